package com.invoice.submission.exception;

/**
 * Archive requested without any scanned documents. The spreadsheet can still be built.
 */
public class MissingUploadSetException extends RuntimeException {

    public MissingUploadSetException(String message) {
        super(message);
    }
}
