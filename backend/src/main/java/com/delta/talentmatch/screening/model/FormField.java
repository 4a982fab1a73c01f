package com.delta.talentmatch.screening.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.Locale;

public record FormField(
    String label,
    @JsonAlias({"declared_kind", "kind", "type"}) FieldKind declaredKind,
    String value
) {
    public FormField {
        label = label == null ? "" : label.trim();
        declaredKind = declaredKind == null ? FieldKind.TEXT : declaredKind;
    }

    public String normalizedLabel() {
        return label.toLowerCase(Locale.ROOT);
    }

    public boolean hasValue() {
        return value != null && !value.isBlank();
    }
}
