package com.bountyboard.progression.exception;

public class UnknownActionKindException extends ProgressionException {

    public UnknownActionKindException(String actionKind, String sourceRef) {
        super(ErrorKind.UNKNOWN_ACTION_KIND, "Unknown action kind '" + actionKind + "' for source " + sourceRef);
    }
}
