package com.bountyboard.progression.exception;

public class HunterNotFoundException extends ProgressionException {

    public HunterNotFoundException(String hunterId) {
        super(ErrorKind.HUNTER_NOT_FOUND, "Hunter not found: " + hunterId);
    }
}
