package com.intelmonitor.exception;

public class StorageException extends BaseException {

    public StorageException(String message, Throwable cause) {
        super(ErrorCode.STORAGE_ERROR, message, cause);
    }
}
