package com.delta.talentmatch.screening.util;

import java.util.Locale;

/** Maps fetch and extraction failures onto the stable codes stored as {@code parse_error_code}. */
public final class FailureReasonClassifier {
  public static final String TIMEOUT = "TIMEOUT";
  public static final String DNS_FAILURE = "DNS_FAILURE";
  public static final String TLS_FAILURE = "TLS_FAILURE";
  public static final String HTTP_401_403 = "HTTP_401_403";
  public static final String HTTP_404 = "HTTP_404";
  public static final String HTTP_429_RATE_LIMIT = "HTTP_429_RATE_LIMIT";
  public static final String HTTP_5XX = "HTTP_5XX";
  public static final String TOO_LARGE = "TOO_LARGE";
  public static final String INVALID_REFERENCE = "INVALID_REFERENCE";
  public static final String NO_RESUME_FIELD = "NO_RESUME_FIELD";
  public static final String UNSUPPORTED_FORMAT = "UNSUPPORTED_FORMAT";
  public static final String EXTRACTION_FAILED = "EXTRACTION_FAILED";
  public static final String TEXT_TOO_SHORT = "TEXT_TOO_SHORT";
  public static final String UNKNOWN = "UNKNOWN";

  private FailureReasonClassifier() {}

  public static String fromHttpStatus(Integer status) {
    if (status == null || status <= 0) {
      return UNKNOWN;
    }
    if (status == 401 || status == 403) {
      return HTTP_401_403;
    }
    if (status == 404) {
      return HTTP_404;
    }
    if (status == 408) {
      return TIMEOUT;
    }
    if (status == 429) {
      return HTTP_429_RATE_LIMIT;
    }
    if (status >= 500 && status < 600) {
      return HTTP_5XX;
    }
    return UNKNOWN;
  }

  public static String fromErrorCode(String errorCode, String errorMessage) {
    if (errorCode == null || errorCode.isBlank()) {
      return UNKNOWN;
    }
    String code = errorCode.toLowerCase(Locale.ROOT);
    if (code.contains("timeout")) {
      return TIMEOUT;
    }
    if (code.contains("too_large")) {
      return TOO_LARGE;
    }
    if (code.contains("invalid_reference") || code.contains("invalid_url")) {
      return INVALID_REFERENCE;
    }
    if (code.contains("io_error")) {
      String lower = errorMessage == null ? "" : errorMessage.toLowerCase(Locale.ROOT);
      if (lower.contains("unknownhost")
          || lower.contains("unresolved")
          || lower.contains("name or service not known")
          || lower.contains("no such host")) {
        return DNS_FAILURE;
      }
      if (lower.contains("ssl") || lower.contains("handshake")) {
        return TLS_FAILURE;
      }
      if (lower.contains("timed out")) {
        return TIMEOUT;
      }
      return UNKNOWN;
    }
    return UNKNOWN;
  }

  public static boolean isRetryable(String reasonCode) {
    if (reasonCode == null) {
      return false;
    }
    return switch (reasonCode) {
      case TIMEOUT, DNS_FAILURE, TLS_FAILURE, HTTP_429_RATE_LIMIT, HTTP_5XX -> true;
      default -> false;
    };
  }
}
