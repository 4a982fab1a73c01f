package com.delta.talentmatch.screening.model;

public enum SemanticRole {
    NAME,
    PHONE,
    RESUME,
    UNASSIGNED
}
