package com.example.videoupload_backend.exception;

public class StorageException extends UploadException {

    public StorageException(String message) {
        super(ErrorCode.STORAGE_IO_FAILURE, message);
    }

    public StorageException(String message, Throwable cause) {
        super(ErrorCode.STORAGE_IO_FAILURE, message, cause);
    }
}
