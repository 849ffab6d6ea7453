package com.bountyboard.progression.exception;

public class InvalidAwardEventException extends ProgressionException {

    public InvalidAwardEventException(String message) {
        super(ErrorKind.INVALID_EVENT, message);
    }
}
