package com.delta.talentmatch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@ConfigurationProperties(prefix = "screening")
public class ScreeningProperties {
    private static final String DEFAULT_USER_AGENT = "talent-match/0.1 (+recruiting)";

    private String userAgent;
    private int scoringConcurrency = 4;
    private Document document = new Document();
    private Ai ai = new Ai();
    private Modifiers modifiers = new Modifiers();
    private Daemon daemon = new Daemon();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getScoringConcurrency() {
        return Math.max(1, scoringConcurrency);
    }

    public void setScoringConcurrency(int scoringConcurrency) {
        this.scoringConcurrency = Math.max(1, scoringConcurrency);
    }

    public Document getDocument() {
        return document;
    }

    public void setDocument(Document document) {
        this.document = document;
    }

    public Ai getAi() {
        return ai;
    }

    public void setAi(Ai ai) {
        this.ai = ai;
    }

    public Modifiers getModifiers() {
        return modifiers;
    }

    public void setModifiers(Modifiers modifiers) {
        this.modifiers = modifiers;
    }

    public Daemon getDaemon() {
        return daemon;
    }

    public void setDaemon(Daemon daemon) {
        this.daemon = daemon;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Document {
        private int fetchTimeoutSeconds = 20;
        private int maxFetchBytes = 10 * 1024 * 1024;
        private int fetchMaxRetries = 2;
        private int retryBaseDelayMs = 500;
        private int retryMaxDelayMs = 4000;
        private int maxTextChars = 20_000;
        private int minTextChars = 50;
        private int maxUnpackedBytes = 8 * 1024 * 1024;

        public int getFetchTimeoutSeconds() {
            return Math.max(1, fetchTimeoutSeconds);
        }

        public void setFetchTimeoutSeconds(int fetchTimeoutSeconds) {
            this.fetchTimeoutSeconds = Math.max(1, fetchTimeoutSeconds);
        }

        public int getMaxFetchBytes() {
            return Math.max(1024, maxFetchBytes);
        }

        public void setMaxFetchBytes(int maxFetchBytes) {
            this.maxFetchBytes = Math.max(1024, maxFetchBytes);
        }

        public int getFetchMaxRetries() {
            return Math.max(0, fetchMaxRetries);
        }

        public void setFetchMaxRetries(int fetchMaxRetries) {
            this.fetchMaxRetries = Math.max(0, fetchMaxRetries);
        }

        public int getRetryBaseDelayMs() {
            return Math.max(0, retryBaseDelayMs);
        }

        public void setRetryBaseDelayMs(int retryBaseDelayMs) {
            this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
        }

        public int getRetryMaxDelayMs() {
            return Math.max(0, retryMaxDelayMs);
        }

        public void setRetryMaxDelayMs(int retryMaxDelayMs) {
            this.retryMaxDelayMs = Math.max(0, retryMaxDelayMs);
        }

        public int getMaxTextChars() {
            return Math.max(500, maxTextChars);
        }

        public void setMaxTextChars(int maxTextChars) {
            this.maxTextChars = Math.max(500, maxTextChars);
        }

        public int getMinTextChars() {
            return Math.max(1, minTextChars);
        }

        public void setMinTextChars(int minTextChars) {
            this.minTextChars = Math.max(1, minTextChars);
        }

        /**
         * Upper bound on bytes inflated from a compressed container such as a DOCX body part.
         */
        public int getMaxUnpackedBytes() {
            return Math.max(1024, maxUnpackedBytes);
        }

        public void setMaxUnpackedBytes(int maxUnpackedBytes) {
            this.maxUnpackedBytes = Math.max(1024, maxUnpackedBytes);
        }
    }

    public static class Ai {
        private boolean enabled = true;
        private String provider = "openai";
        private String baseUrl;
        private String apiKey;
        private String model;
        private int timeoutSeconds = 20;
        private int maxAdjustment = 15;
        private int maxPromptChars = 3000;
        private double temperature = 0.2;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getProvider() {
            return provider == null || provider.isBlank() ? "openai" : provider.trim().toLowerCase(Locale.ROOT);
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getBaseUrl() {
            if (baseUrl != null && !baseUrl.isBlank()) {
                return baseUrl.trim();
            }
            return switch (getProvider()) {
                case "anthropic" -> "https://api.anthropic.com/v1/messages";
                case "perplexity" -> "https://api.perplexity.ai/chat/completions";
                default -> "https://api.openai.com/v1/chat/completions";
            };
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }

        public String getModel() {
            if (model != null && !model.isBlank()) {
                return model.trim();
            }
            return switch (getProvider()) {
                case "anthropic" -> "claude-3-haiku-20240307";
                case "perplexity" -> "sonar";
                default -> "gpt-4o-mini";
            };
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }

        public int getMaxAdjustment() {
            return Math.max(0, maxAdjustment);
        }

        public void setMaxAdjustment(int maxAdjustment) {
            this.maxAdjustment = Math.max(0, maxAdjustment);
        }

        public int getMaxPromptChars() {
            return Math.max(200, maxPromptChars);
        }

        public void setMaxPromptChars(int maxPromptChars) {
            this.maxPromptChars = Math.max(200, maxPromptChars);
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }
    }

    public static class Modifiers {
        private int missingProfileLinkPenalty = 3;
        private int redFlagPenalty = 5;
        private int aiAuthoredPenalty = 10;
        private int unicornBonus = 5;
        private int leadershipBonus = 3;
        private int lowRelevancePenalty = 10;
        private int missingRequiredSkillPenalty = 8;
        private int missingRequiredSkillCap = 30;
        private int unicornSkillsThreshold = 85;
        private int unicornExperienceThreshold = 85;
        private int lowRelevanceThreshold = 20;
        private int aiTemplatePhraseMatches = 2;
        private List<String> profileLinkHosts = new ArrayList<>(List.of(
            "linkedin.com/in/", "github.com/", "gitlab.com/", "behance.net/", "dribbble.com/", "stackoverflow.com/users/"
        ));
        private List<String> redFlagPhrases = new ArrayList<>(List.of(
            "employment gap", "gap in employment", "career break", "unemployed since", "between jobs"
        ));
        private List<String> aiTemplatePhrases = new ArrayList<>(List.of(
            "as an ai language model",
            "i am thrilled to apply",
            "i am excited to apply",
            "in today's fast-paced",
            "in today's rapidly evolving",
            "delve into",
            "rich tapestry",
            "leverage my expertise",
            "i hope this message finds you well",
            "a testament to my",
            "i am confident that my skills",
            "navigate the complexities"
        ));
        private List<String> leadershipTerms = new ArrayList<>(List.of(
            "team lead", "tech lead", "led a team", "led the team", "managed a team", "head of", "director",
            "engineering manager", "mentored", "supervised", "leadership"
        ));

        public int getMissingProfileLinkPenalty() {
            return Math.max(0, missingProfileLinkPenalty);
        }

        public void setMissingProfileLinkPenalty(int missingProfileLinkPenalty) {
            this.missingProfileLinkPenalty = Math.max(0, missingProfileLinkPenalty);
        }

        public int getRedFlagPenalty() {
            return Math.max(0, redFlagPenalty);
        }

        public void setRedFlagPenalty(int redFlagPenalty) {
            this.redFlagPenalty = Math.max(0, redFlagPenalty);
        }

        public int getAiAuthoredPenalty() {
            return Math.max(0, aiAuthoredPenalty);
        }

        public void setAiAuthoredPenalty(int aiAuthoredPenalty) {
            this.aiAuthoredPenalty = Math.max(0, aiAuthoredPenalty);
        }

        public int getUnicornBonus() {
            return Math.max(0, unicornBonus);
        }

        public void setUnicornBonus(int unicornBonus) {
            this.unicornBonus = Math.max(0, unicornBonus);
        }

        public int getLeadershipBonus() {
            return Math.max(0, leadershipBonus);
        }

        public void setLeadershipBonus(int leadershipBonus) {
            this.leadershipBonus = Math.max(0, leadershipBonus);
        }

        public int getLowRelevancePenalty() {
            return Math.max(0, lowRelevancePenalty);
        }

        public void setLowRelevancePenalty(int lowRelevancePenalty) {
            this.lowRelevancePenalty = Math.max(0, lowRelevancePenalty);
        }

        /** Points deducted per must-have skill the résumé does not mention. */
        public int getMissingRequiredSkillPenalty() {
            return Math.max(0, missingRequiredSkillPenalty);
        }

        public void setMissingRequiredSkillPenalty(int missingRequiredSkillPenalty) {
            this.missingRequiredSkillPenalty = Math.max(0, missingRequiredSkillPenalty);
        }

        public int getMissingRequiredSkillCap() {
            return Math.max(0, missingRequiredSkillCap);
        }

        public void setMissingRequiredSkillCap(int missingRequiredSkillCap) {
            this.missingRequiredSkillCap = Math.max(0, missingRequiredSkillCap);
        }

        public int getUnicornSkillsThreshold() {
            return clampScore(unicornSkillsThreshold);
        }

        public void setUnicornSkillsThreshold(int unicornSkillsThreshold) {
            this.unicornSkillsThreshold = clampScore(unicornSkillsThreshold);
        }

        public int getUnicornExperienceThreshold() {
            return clampScore(unicornExperienceThreshold);
        }

        public void setUnicornExperienceThreshold(int unicornExperienceThreshold) {
            this.unicornExperienceThreshold = clampScore(unicornExperienceThreshold);
        }

        public int getLowRelevanceThreshold() {
            return clampScore(lowRelevanceThreshold);
        }

        public void setLowRelevanceThreshold(int lowRelevanceThreshold) {
            this.lowRelevanceThreshold = clampScore(lowRelevanceThreshold);
        }

        public int getAiTemplatePhraseMatches() {
            return Math.max(1, aiTemplatePhraseMatches);
        }

        public void setAiTemplatePhraseMatches(int aiTemplatePhraseMatches) {
            this.aiTemplatePhraseMatches = Math.max(1, aiTemplatePhraseMatches);
        }

        public List<String> getProfileLinkHosts() {
            return profileLinkHosts;
        }

        public void setProfileLinkHosts(List<String> profileLinkHosts) {
            this.profileLinkHosts = profileLinkHosts == null ? new ArrayList<>() : profileLinkHosts;
        }

        public List<String> getRedFlagPhrases() {
            return redFlagPhrases;
        }

        public void setRedFlagPhrases(List<String> redFlagPhrases) {
            this.redFlagPhrases = redFlagPhrases == null ? new ArrayList<>() : redFlagPhrases;
        }

        public List<String> getAiTemplatePhrases() {
            return aiTemplatePhrases;
        }

        public void setAiTemplatePhrases(List<String> aiTemplatePhrases) {
            this.aiTemplatePhrases = aiTemplatePhrases == null ? new ArrayList<>() : aiTemplatePhrases;
        }

        public List<String> getLeadershipTerms() {
            return leadershipTerms;
        }

        public void setLeadershipTerms(List<String> leadershipTerms) {
            this.leadershipTerms = leadershipTerms == null ? new ArrayList<>() : leadershipTerms;
        }

        private static int clampScore(int value) {
            return Math.max(0, Math.min(100, value));
        }
    }

    public static class Daemon {
        private boolean enabled = false;
        private int workerCount = 2;
        private int pollIntervalMs = 2000;
        private int staleClaimMinutes = 10;
        private int maxAttempts = 3;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getWorkerCount() {
            return Math.max(1, workerCount);
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = Math.max(1, workerCount);
        }

        public int getPollIntervalMs() {
            return Math.max(100, pollIntervalMs);
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = Math.max(100, pollIntervalMs);
        }

        public int getStaleClaimMinutes() {
            return Math.max(1, staleClaimMinutes);
        }

        public void setStaleClaimMinutes(int staleClaimMinutes) {
            this.staleClaimMinutes = Math.max(1, staleClaimMinutes);
        }

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }
    }

    public static class Cli {
        private boolean run;
        private String submissionFile = "";
        private String jobTitle = "";
        private String jobDescriptionFile = "";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getSubmissionFile() {
            return submissionFile;
        }

        public void setSubmissionFile(String submissionFile) {
            this.submissionFile = submissionFile;
        }

        public String getJobTitle() {
            return jobTitle;
        }

        public void setJobTitle(String jobTitle) {
            this.jobTitle = jobTitle;
        }

        public String getJobDescriptionFile() {
            return jobDescriptionFile;
        }

        public void setJobDescriptionFile(String jobDescriptionFile) {
            this.jobDescriptionFile = jobDescriptionFile;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
