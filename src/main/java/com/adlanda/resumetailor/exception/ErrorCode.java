package com.adlanda.resumetailor.exception;

/**
 * Stable error codes surfaced to callers and logs.
 *
 * The code tells observability which kind of failure occurred without
 * exposing backend-specific error text.
 */
public enum ErrorCode {
    VALIDATION_ERROR,
    INVALID_DATE_FORMAT,
    INVALID_DATE_RANGE,
    NOT_FOUND,
    INVALID_STATUS_TRANSITION,
    INVALID_RESUME_STATUS,
    NO_BULLETS_AVAILABLE,
    AI_SERVICE_UNAVAILABLE,
    MALFORMED_AI_RESPONSE,
    TAILORING_CANCELLED
}
