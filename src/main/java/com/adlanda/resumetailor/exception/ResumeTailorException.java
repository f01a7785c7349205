package com.adlanda.resumetailor.exception;

/**
 * Base type for every domain and pipeline failure.
 */
public abstract class ResumeTailorException extends RuntimeException {

    private final ErrorCode code;

    protected ResumeTailorException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected ResumeTailorException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
