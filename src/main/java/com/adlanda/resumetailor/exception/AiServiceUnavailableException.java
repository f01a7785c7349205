package com.adlanda.resumetailor.exception;

/**
 * The AI backend could not be reached, or kept failing until the retry budget ran out.
 */
public class AiServiceUnavailableException extends ResumeTailorException {

    private final int attempts;

    public AiServiceUnavailableException(String message, int attempts, Throwable cause) {
        super(ErrorCode.AI_SERVICE_UNAVAILABLE, message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
