package com.forensic.anomaly.exception;

/**
 * Exception thrown when an analysis cannot produce or return a result.
 * Row-level parse problems never raise this; they are reported as diagnostics.
 */
public class AnalysisException extends RuntimeException {

    private final String errorCode;

    public AnalysisException(String message) {
        super(message);
        this.errorCode = null;
    }

    public AnalysisException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public AnalysisException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    @Override
    public String toString() {
        return "AnalysisException{" +
               "message='" + getMessage() + '\'' +
               ", errorCode='" + errorCode + '\'' +
               '}';
    }
}
