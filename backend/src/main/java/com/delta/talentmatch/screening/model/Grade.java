package com.delta.talentmatch.screening.model;

public enum Grade {
    A,
    B,
    C,
    D;

    public static Grade forScore(int totalScore) {
        if (totalScore >= 80) {
            return A;
        }
        if (totalScore >= 65) {
            return B;
        }
        if (totalScore >= 50) {
            return C;
        }
        return D;
    }
}
