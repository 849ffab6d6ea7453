package com.bountyboard.progression.exception;

/**
 * 进度账本所有业务异常的基类
 */
public class ProgressionException extends RuntimeException {

    private final ErrorKind kind;

    public ProgressionException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ProgressionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
