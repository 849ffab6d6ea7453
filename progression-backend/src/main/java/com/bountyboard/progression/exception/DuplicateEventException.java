package com.bountyboard.progression.exception;

/**
 * 幂等键已存在：重复投递的事件，不改变任何状态
 */
public class DuplicateEventException extends ProgressionException {

    private final String idempotencyKey;
    private final String sourceRef;

    public DuplicateEventException(String idempotencyKey, String sourceRef) {
        super(ErrorKind.DUPLICATE_EVENT, "Duplicate event for source " + sourceRef + " (key " + idempotencyKey + ")");
        this.idempotencyKey = idempotencyKey;
        this.sourceRef = sourceRef;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }

    public String getSourceRef() {
        return sourceRef;
    }
}
