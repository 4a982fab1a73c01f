package com.delta.talentmatch.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScreeningPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        ScreeningProperties properties = new ScreeningProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("talent-match/0.1"));
    }

    @Test
    void concurrencyAndLimitsAreClamped() {
        ScreeningProperties properties = new ScreeningProperties();
        properties.setScoringConcurrency(0);
        properties.getDocument().setMaxFetchBytes(10);
        properties.getDocument().setFetchMaxRetries(-1);
        properties.getAi().setTimeoutSeconds(0);
        properties.getAi().setMaxAdjustment(-5);
        properties.getDaemon().setWorkerCount(0);
        properties.getDaemon().setMaxAttempts(0);
        assertEquals(1, properties.getScoringConcurrency());
        assertEquals(1024, properties.getDocument().getMaxFetchBytes());
        assertEquals(0, properties.getDocument().getFetchMaxRetries());
        assertEquals(1, properties.getAi().getTimeoutSeconds());
        assertEquals(0, properties.getAi().getMaxAdjustment());
        assertEquals(1, properties.getDaemon().getWorkerCount());
        assertEquals(1, properties.getDaemon().getMaxAttempts());
    }

    @Test
    void modifierThresholdsStayOnTheScoreScale() {
        ScreeningProperties properties = new ScreeningProperties();
        properties.getModifiers().setUnicornSkillsThreshold(140);
        properties.getModifiers().setLowRelevanceThreshold(-3);
        properties.getModifiers().setRedFlagPenalty(-5);
        assertEquals(100, properties.getModifiers().getUnicornSkillsThreshold());
        assertEquals(0, properties.getModifiers().getLowRelevanceThreshold());
        assertEquals(0, properties.getModifiers().getRedFlagPenalty());
    }

    @Test
    void aiEndpointAndModelFollowProvider() {
        ScreeningProperties properties = new ScreeningProperties();
        properties.getAi().setProvider(" Anthropic ");
        assertEquals("anthropic", properties.getAi().getProvider());
        assertEquals("https://api.anthropic.com/v1/messages", properties.getAi().getBaseUrl());
        assertEquals("claude-3-haiku-20240307", properties.getAi().getModel());

        properties.getAi().setProvider("perplexity");
        properties.getAi().setModel("sonar-pro");
        assertEquals("https://api.perplexity.ai/chat/completions", properties.getAi().getBaseUrl());
        assertEquals("sonar-pro", properties.getAi().getModel());

        properties.getAi().setApiKey(" ");
        assertFalse(properties.getAi().hasApiKey());
    }
}
