package com.adlanda.resumetailor.exception;

/**
 * The backend answered, but its text could not be coerced into the expected structure.
 *
 * Never retried: asking again does not guarantee a structurally different answer.
 */
public class MalformedAiResponseException extends ResumeTailorException {

    public MalformedAiResponseException(String message) {
        super(ErrorCode.MALFORMED_AI_RESPONSE, message);
    }

    public MalformedAiResponseException(String message, Throwable cause) {
        super(ErrorCode.MALFORMED_AI_RESPONSE, message, cause);
    }
}
