package com.licensewatch.obits.reconcile.util;

import com.licensewatch.obits.reconcile.model.HttpFetchResult;

import java.util.Locale;

public final class ReasonCodeClassifier {
  public static final String HTTP_403_BLOCKED = "HTTP_403_BLOCKED";
  public static final String CAPTCHA_CHALLENGE = "CAPTCHA_CHALLENGE";
  public static final String HTTP_429_RATE_LIMIT = "HTTP_429_RATE_LIMIT";
  public static final String HTTP_4XX = "HTTP_4XX";
  public static final String HTTP_5XX = "HTTP_5XX";
  public static final String TIMEOUT = "TIMEOUT";
  public static final String DNS_FAILURE = "DNS_FAILURE";
  public static final String TLS_FAILURE = "TLS_FAILURE";
  public static final String IO_ERROR = "IO_ERROR";
  public static final String PARSING_FAILED = "PARSING_FAILED";
  public static final String INTERRUPTED = "INTERRUPTED";
  public static final String UNKNOWN = "UNKNOWN";

  private static final String CAPTCHA_MARKER = "captcha";

  private ReasonCodeClassifier() {}

  public static String fromHttpStatus(Integer status) {
    if (status == null || status <= 0) {
      return UNKNOWN;
    }
    if (status == 403) {
      return HTTP_403_BLOCKED;
    }
    if (status == 408) {
      return TIMEOUT;
    }
    if (status == 429) {
      return HTTP_429_RATE_LIMIT;
    }
    if (status >= 400 && status < 500) {
      return HTTP_4XX;
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
    if (code.contains("interrupted")) {
      return INTERRUPTED;
    }
    if (code.contains("io_error")) {
      String lower = errorMessage == null ? "" : errorMessage.toLowerCase(Locale.ROOT);
      if (lower.contains("unknownhost")
          || lower.contains("name or service not known")
          || lower.contains("no such host")) {
        return DNS_FAILURE;
      }
      if (lower.contains("ssl") || lower.contains("handshake")) {
        return TLS_FAILURE;
      }
      return IO_ERROR;
    }
    return UNKNOWN;
  }

  public static String fromResult(HttpFetchResult result) {
    if (result == null) {
      return UNKNOWN;
    }
    if (result.isTransportError()) {
      return fromErrorCode(result.errorCode(), result.errorMessage());
    }
    return fromHttpStatus(result.statusCode());
  }

  /**
   * True when the body looks like an anti-bot challenge page rather than search data.
   */
  public static boolean isChallenge(String body) {
    return body != null && body.toLowerCase(Locale.ROOT).contains(CAPTCHA_MARKER);
  }
}
