package com.adlanda.resumetailor.exception;

public class NoBulletsAvailableException extends ResumeTailorException {

    public NoBulletsAvailableException(String message) {
        super(ErrorCode.NO_BULLETS_AVAILABLE, message);
    }
}
