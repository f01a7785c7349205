package com.adlanda.resumetailor.exception;

public class ResourceNotFoundException extends ResumeTailorException {

    public ResourceNotFoundException(String resource, String id) {
        super(ErrorCode.NOT_FOUND, resource + " not found: " + id);
    }
}
