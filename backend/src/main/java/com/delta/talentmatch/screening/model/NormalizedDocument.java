package com.delta.talentmatch.screening.model;

public record NormalizedDocument(
    String text,
    DocumentFormat format,
    boolean parsingFailed,
    String failureCode
) {
    public static NormalizedDocument success(String text, DocumentFormat format) {
        return new NormalizedDocument(text, format, false, null);
    }

    public static NormalizedDocument failed(DocumentFormat format, String failureCode) {
        return new NormalizedDocument(null, format, true, failureCode);
    }
}
