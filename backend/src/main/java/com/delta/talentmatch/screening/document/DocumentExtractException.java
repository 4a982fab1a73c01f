package com.delta.talentmatch.screening.document;

public class DocumentExtractException extends RuntimeException {
    private final String reasonCode;

    public DocumentExtractException(String reasonCode, String message) {
        super(message);
        this.reasonCode = reasonCode;
    }

    public DocumentExtractException(String reasonCode, String message, Throwable cause) {
        super(message, cause);
        this.reasonCode = reasonCode;
    }

    public String getReasonCode() {
        return reasonCode;
    }
}
