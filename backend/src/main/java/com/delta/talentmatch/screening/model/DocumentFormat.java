package com.delta.talentmatch.screening.model;

public enum DocumentFormat {
    PDF,
    DOCX,
    HTML,
    PLAIN_TEXT,
    UNKNOWN
}
