package com.delta.talentmatch.screening.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FailureReasonClassifierTest {

    @Test
    void mapsHttpStatuses() {
        assertThat(FailureReasonClassifier.fromHttpStatus(403)).isEqualTo(FailureReasonClassifier.HTTP_401_403);
        assertThat(FailureReasonClassifier.fromHttpStatus(404)).isEqualTo(FailureReasonClassifier.HTTP_404);
        assertThat(FailureReasonClassifier.fromHttpStatus(408)).isEqualTo(FailureReasonClassifier.TIMEOUT);
        assertThat(FailureReasonClassifier.fromHttpStatus(429)).isEqualTo(FailureReasonClassifier.HTTP_429_RATE_LIMIT);
        assertThat(FailureReasonClassifier.fromHttpStatus(502)).isEqualTo(FailureReasonClassifier.HTTP_5XX);
        assertThat(FailureReasonClassifier.fromHttpStatus(null)).isEqualTo(FailureReasonClassifier.UNKNOWN);
    }

    @Test
    void mapsTransportErrorsByMessage() {
        assertThat(FailureReasonClassifier.fromErrorCode("io_error", "java.net.UnknownHostException: cv.example"))
            .isEqualTo(FailureReasonClassifier.DNS_FAILURE);
        assertThat(FailureReasonClassifier.fromErrorCode("io_error", "javax.net.ssl.SSLHandshakeException"))
            .isEqualTo(FailureReasonClassifier.TLS_FAILURE);
        assertThat(FailureReasonClassifier.fromErrorCode("too_large", null)).isEqualTo(FailureReasonClassifier.TOO_LARGE);
        assertThat(FailureReasonClassifier.fromErrorCode("invalid_reference", null))
            .isEqualTo(FailureReasonClassifier.INVALID_REFERENCE);
        assertThat(FailureReasonClassifier.fromErrorCode("timeout", null)).isEqualTo(FailureReasonClassifier.TIMEOUT);
    }

    @Test
    void onlyTransientReasonsAreRetryable() {
        assertThat(FailureReasonClassifier.isRetryable(FailureReasonClassifier.HTTP_5XX)).isTrue();
        assertThat(FailureReasonClassifier.isRetryable(FailureReasonClassifier.TIMEOUT)).isTrue();
        assertThat(FailureReasonClassifier.isRetryable(FailureReasonClassifier.HTTP_404)).isFalse();
        assertThat(FailureReasonClassifier.isRetryable(FailureReasonClassifier.TOO_LARGE)).isFalse();
        assertThat(FailureReasonClassifier.isRetryable(null)).isFalse();
    }
}
