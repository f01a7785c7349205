package com.adlanda.resumetailor.exception;

/**
 * Raised for an illegal resume status change or an unrecognized status value.
 */
public class InvalidStatusTransitionException extends ResumeTailorException {

    public InvalidStatusTransitionException(String from, String to) {
        super(ErrorCode.INVALID_STATUS_TRANSITION, "invalid status transition: " + from + " -> " + to);
    }

    private InvalidStatusTransitionException(ErrorCode code, String message) {
        super(code, message);
    }

    public static InvalidStatusTransitionException unknownStatus(String value) {
        return new InvalidStatusTransitionException(ErrorCode.INVALID_RESUME_STATUS, "invalid resume status: " + value);
    }
}
