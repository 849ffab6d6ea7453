package com.bountyboard.progression.exception;

/**
 * 徽章文档写出失败。会被重试，不影响账本状态
 */
public class PublishFailureException extends ProgressionException {

    public PublishFailureException(String message, Throwable cause) {
        super(ErrorKind.PUBLISH_FAILURE, message, cause);
    }
}
