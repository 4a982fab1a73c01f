package com.delta.talentmatch.screening.ai;

import com.delta.talentmatch.config.ScreeningProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Talks to an OpenAI-compatible chat-completions endpoint (OpenAI, Perplexity) or the Anthropic
 * messages endpoint, depending on {@code screening.ai.provider}.
 */
@Service
public class ChatCompletionCandidateAnalyzer implements CandidateAnalyzer {
    static final String ANTHROPIC_VERSION = "2023-06-01";
    private static final int MAX_OUTPUT_TOKENS = 1000;

    private final ScreeningProperties properties;
    private final ObjectMapper objectMapper;
    private final AiResponseParser responseParser;
    private final HttpClient client;

    public ChatCompletionCandidateAnalyzer(
        ScreeningProperties properties,
        ObjectMapper objectMapper,
        AiResponseParser responseParser,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.responseParser = responseParser;
        this.client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.getAi().getTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    @Override
    public boolean isAvailable() {
        return properties.getAi().isEnabled() && properties.getAi().hasApiKey();
    }

    @Override
    public AiAnalysisResponse analyze(AiAnalysisRequest request) {
        if (!isAvailable()) {
            throw new AiServiceException("AI provider not configured");
        }
        ScreeningProperties.Ai ai = properties.getAi();
        boolean anthropic = "anthropic".equals(ai.getProvider());
        String prompt = buildPrompt(request);
        String body = anthropic ? anthropicBody(prompt) : chatCompletionBody(prompt, "openai".equals(ai.getProvider()));

        URI uri;
        try {
            uri = URI.create(ai.getBaseUrl());
        } catch (IllegalArgumentException e) {
            throw new AiServiceException("Invalid AI endpoint", e);
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(ai.getTimeoutSeconds()))
            .header("User-Agent", properties.getUserAgent())
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        if (anthropic) {
            builder.header("x-api-key", ai.getApiKey()).header("anthropic-version", ANTHROPIC_VERSION);
        } else {
            builder.header("Authorization", "Bearer " + ai.getApiKey());
        }

        HttpResponse<String> response;
        try {
            response = client.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new AiServiceException("AI request timed out", e);
        } catch (IOException e) {
            throw new AiServiceException("AI request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AiServiceException("AI request interrupted", e);
        }
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new AiServiceException("AI provider returned HTTP " + response.statusCode());
        }
        return responseParser.parse(anthropic ? anthropicContent(response.body()) : chatCompletionContent(response.body()));
    }

    String buildPrompt(AiAnalysisRequest request) {
        int limit = properties.getAi().getMaxPromptChars();
        StringBuilder answers = new StringBuilder();
        for (Map.Entry<String, String> entry : request.answers().entrySet()) {
            answers.append("Q: ").append(entry.getKey()).append('\n')
                .append("A: ").append(truncate(entry.getValue(), limit / 4)).append('\n');
        }
        return """
            You are an expert senior recruiter. Evaluate this candidate for the role described below.

            JOB TITLE & DESCRIPTION:
            %s

            CANDIDATE RESUME:
            %s

            CANDIDATE ANSWERS:
            %s

            Respond with a single JSON object with these keys:
            - "summary": two or three sentences on the candidate's fit.
            - "pros": list of 3-5 specific strengths relevant to the job.
            - "cons": list of 3-5 specific gaps or missing skills relative to the job.
            - "score_adjustment": an integer between -%d and %d.

            Return ONLY the JSON.
            """.formatted(
                truncate(request.jobRequirementText(), limit),
                request.resumeText().isBlank() ? "(not available)" : truncate(request.resumeText(), limit),
                answers.length() == 0 ? "(none)" : truncate(answers.toString(), limit),
                properties.getAi().getMaxAdjustment(),
                properties.getAi().getMaxAdjustment()
            );
    }

    private String chatCompletionBody(String prompt, boolean jsonMode) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", properties.getAi().getModel());
        root.put("temperature", properties.getAi().getTemperature());
        ArrayNode messages = root.putArray("messages");
        messages.addObject().put("role", "system").put("content", "You evaluate job candidates and answer in JSON.");
        messages.addObject().put("role", "user").put("content", prompt);
        if (jsonMode) {
            root.putObject("response_format").put("type", "json_object");
        }
        return write(root);
    }

    private String anthropicBody(String prompt) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", properties.getAi().getModel());
        root.put("max_tokens", MAX_OUTPUT_TOKENS);
        root.put("temperature", properties.getAi().getTemperature());
        root.putArray("messages").addObject().put("role", "user").put("content", prompt + "\n\nOutput JSON only.");
        return write(root);
    }

    private String chatCompletionContent(String body) {
        JsonNode content = readTree(body).path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new AiServiceException("Chat completion response has no message content");
        }
        return content.asText();
    }

    private String anthropicContent(String body) {
        for (JsonNode block : readTree(body).path("content")) {
            if ("text".equals(block.path("type").asText()) && block.path("text").isTextual()) {
                return block.path("text").asText();
            }
        }
        throw new AiServiceException("Messages response has no text block");
    }

    private JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new AiServiceException("Unparsable provider envelope", e);
        }
    }

    private String write(ObjectNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new AiServiceException("Could not serialize AI request", e);
        }
    }

    private static String truncate(String value, int limit) {
        if (value == null) {
            return "";
        }
        return value.length() <= limit ? value : value.substring(0, limit);
    }
}
