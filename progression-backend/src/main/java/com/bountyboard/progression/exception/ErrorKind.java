package com.bountyboard.progression.exception;

/**
 * 错误分类，决定日志级别与 HTTP 状态码
 */
public enum ErrorKind {
    DUPLICATE_EVENT(409),
    UNKNOWN_ACTION_KIND(400),
    INVALID_EVENT(400),
    DEGRADED_CLASSIFICATION(200),
    CONFIGURATION_ERROR(500),
    PUBLISH_FAILURE(502),
    HUNTER_NOT_FOUND(404);

    private final int httpStatus;

    ErrorKind(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
