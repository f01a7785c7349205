package com.adlanda.resumetailor.exception;

public class TailoringCancelledException extends ResumeTailorException {

    public TailoringCancelledException(String operation, Throwable cause) {
        super(ErrorCode.TAILORING_CANCELLED, operation + " cancelled", cause);
    }
}
