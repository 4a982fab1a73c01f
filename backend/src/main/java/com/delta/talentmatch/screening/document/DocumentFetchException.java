package com.delta.talentmatch.screening.document;

public class DocumentFetchException extends RuntimeException {
    private final String reasonCode;

    public DocumentFetchException(String reasonCode, String message) {
        super(message);
        this.reasonCode = reasonCode;
    }

    public String getReasonCode() {
        return reasonCode;
    }
}
