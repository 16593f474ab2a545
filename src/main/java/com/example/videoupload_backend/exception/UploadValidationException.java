package com.example.videoupload_backend.exception;

public class UploadValidationException extends UploadException {

    public UploadValidationException(String message) {
        super(ErrorCode.INVALID_UPLOAD_REQUEST, message);
    }

    protected UploadValidationException(ErrorCode code, String message) {
        super(code, message);
    }
}
