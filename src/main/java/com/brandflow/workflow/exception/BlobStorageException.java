package com.brandflow.workflow.exception;

public class BlobStorageException extends BrandFlowException {

    private static final long serialVersionUID = 1L;

    public BlobStorageException(String message) {
        super("BLOB_STORAGE_ERROR", message);
    }

    public BlobStorageException(String message, Throwable cause) {
        super("BLOB_STORAGE_ERROR", message, cause);
    }
}
