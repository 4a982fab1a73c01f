package com.delta.talentmatch.screening.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FieldKind {
    TEXT,
    EMAIL,
    PHONE,
    URL,
    NUMBER,
    FILE,
    PARAGRAPH;

    @JsonCreator
    public static FieldKind fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return TEXT;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return switch (normalized) {
            case "FILE_UPLOAD", "UPLOAD" -> FILE;
            case "PARAGRAPH_TEXT", "LONG_TEXT", "TEXTAREA" -> PARAGRAPH;
            case "TEL", "PHONE_NUMBER" -> PHONE;
            default -> {
                try {
                    yield FieldKind.valueOf(normalized);
                } catch (IllegalArgumentException e) {
                    yield TEXT;
                }
            }
        };
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
