package com.delta.talentmatch.screening.model;

/**
 * The nine scoring axes. Weights are held in basis points so the total is exactly 10 000.
 */
public enum Dimension {
    JOB_RELEVANCE("job_relevance", "job relevance", 2500),
    SKILLS_MATCH("skills_match", "skills match", 2000),
    TECHNICAL_DEPTH("technical_depth", "technical depth", 1500),
    EXPERIENCE("experience", "experience", 1000),
    PROJECT_COMPLEXITY("project_complexity", "project complexity", 1000),
    COMMUNICATION("communication", "communication", 500),
    CULTURE_FIT("culture_fit", "culture fit", 500),
    EDUCATION("education", "education", 500),
    KEYWORDS("keywords", "keyword coverage", 500);

    public static final int TOTAL_BASIS_POINTS = 10_000;

    private final String key;
    private final String label;
    private final int weightBasisPoints;

    Dimension(String key, String label, int weightBasisPoints) {
        this.key = key;
        this.label = label;
        this.weightBasisPoints = weightBasisPoints;
    }

    public String key() {
        return key;
    }

    public String label() {
        return label;
    }

    public int weightBasisPoints() {
        return weightBasisPoints;
    }

    public double weight() {
        return weightBasisPoints / (double) TOTAL_BASIS_POINTS;
    }

    public static int totalWeightBasisPoints() {
        int total = 0;
        for (Dimension dimension : values()) {
            total += dimension.weightBasisPoints;
        }
        return total;
    }
}
