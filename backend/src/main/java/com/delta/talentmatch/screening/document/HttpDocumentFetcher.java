package com.delta.talentmatch.screening.document;

import com.delta.talentmatch.config.ScreeningProperties;
import com.delta.talentmatch.screening.model.DocumentFetchResult;
import com.delta.talentmatch.screening.util.FailureReasonClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.OptionalLong;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadLocalRandom;

@Service
public class HttpDocumentFetcher implements DocumentFetcher {
    private static final Logger log = LoggerFactory.getLogger(HttpDocumentFetcher.class);
    private static final String ACCEPT =
        "application/pdf,application/vnd.openxmlformats-officedocument.wordprocessingml.document,text/html;q=0.9,text/plain;q=0.9,*/*;q=0.5";

    private final ScreeningProperties properties;
    private final HttpClient client;

    public HttpDocumentFetcher(
        ScreeningProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getDocument().getFetchTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    @Override
    public DocumentFetchResult fetch(String url) {
        int maxAttempts = 1 + properties.getDocument().getFetchMaxRetries();
        DocumentFetchResult lastResult = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            lastResult = executeOnce(url);
            if (!shouldRetry(lastResult) || attempt >= maxAttempts) {
                return lastResult;
            }
            log.debug("Retrying document fetch (attempt {} of {}) after {}", attempt + 1, maxAttempts,
                lastResult.errorCode() != null ? lastResult.errorCode() : "http_" + lastResult.statusCode());
            if (!sleepBackoff(attempt)) {
                return lastResult;
            }
        }
        return lastResult;
    }

    private DocumentFetchResult executeOnce(String url) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_reference", "Reference missing host or malformed");
        }
        int maxBytes = properties.getDocument().getMaxFetchBytes();
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.getDocument().getFetchTimeoutSeconds()))
            .header("User-Agent", properties.getUserAgent())
            .header("Accept", ACCEPT)
            .GET()
            .build();
        try {
            HttpResponse<InputStream> response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
            OptionalLong declaredLength = response.headers().firstValueAsLong("Content-Length");
            if (declaredLength.isPresent() && declaredLength.getAsLong() > maxBytes) {
                response.body().close();
                return errorResult(url, startedAt, "too_large", "Declared length " + declaredLength.getAsLong() + " exceeds " + maxBytes);
            }
            byte[] body;
            try (InputStream in = response.body()) {
                body = readCapped(in, maxBytes);
            }
            if (body == null) {
                return errorResult(url, startedAt, "too_large", "Body exceeds " + maxBytes + " bytes");
            }
            return new DocumentFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                body,
                response.headers().firstValue("Content-Type").orElse(null),
                response.headers().firstValue("Content-Disposition").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, "http_error", e.getMessage());
        }
    }

    private byte[] readCapped(InputStream in, int maxBytes) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[8192];
        int total = 0;
        int read;
        while ((read = in.read(buffer)) != -1) {
            total += read;
            if (total > maxBytes) {
                return null;
            }
            out.write(buffer, 0, read);
        }
        return out.toByteArray();
    }

    private boolean shouldRetry(DocumentFetchResult result) {
        if (result == null) {
            return false;
        }
        String errorCode = result.errorCode();
        if (errorCode != null && !errorCode.isBlank()) {
            if (errorCode.equals("io_error")) {
                return true;
            }
            return FailureReasonClassifier.isRetryable(
                FailureReasonClassifier.fromErrorCode(errorCode, result.errorMessage())
            );
        }
        return FailureReasonClassifier.isRetryable(FailureReasonClassifier.fromHttpStatus(result.statusCode()));
    }

    private boolean sleepBackoff(int attempt) {
        int baseDelayMs = properties.getDocument().getRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return true;
        }
        int maxDelayMs = properties.getDocument().getRetryMaxDelayMs();
        long delay = (long) baseDelayMs * (1L << Math.max(0, attempt - 1));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        if (delay <= 0) {
            return true;
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        try {
            Thread.sleep((delay / 2) + jitter);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private DocumentFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new DocumentFetchResult(
            url,
            null,
            0,
            null,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
