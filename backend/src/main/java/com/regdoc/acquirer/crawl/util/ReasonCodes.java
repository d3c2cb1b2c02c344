package com.regdoc.acquirer.crawl.util;

import com.regdoc.acquirer.crawl.model.HttpFetchResult;

import java.util.Locale;

public final class ReasonCodes {
  public static final String NO_CANDIDATES = "NO_CANDIDATES";
  public static final String NO_MATCH = "NO_MATCH";
  public static final String DETAIL_FAILED = "DETAIL_FAILED";
  public static final String PARSING_FAILED = "PARSING_FAILED";
  public static final String BLOCKED = "BLOCKED";
  public static final String TIMEOUT = "TIMEOUT";
  public static final String DNS_FAILURE = "DNS_FAILURE";
  public static final String TLS_FAILURE = "TLS_FAILURE";
  public static final String HTTP_404 = "HTTP_404";
  public static final String HTTP_5XX = "HTTP_5XX";
  public static final String SESSION_FAILED = "SESSION_FAILED";
  public static final String NOT_CONFIGURED = "NOT_CONFIGURED";
  public static final String STRATEGY_ERROR = "STRATEGY_ERROR";
  public static final String TARGET_TIMEOUT = "target_timeout";
  public static final String EXHAUSTED = "exhausted";
  public static final String UNKNOWN = "UNKNOWN";

  private ReasonCodes() {}

  public static String fromFetch(HttpFetchResult result) {
    if (result == null) {
      return UNKNOWN;
    }
    if (result.errorCode() != null) {
      return fromErrorCode(result.errorCode(), result.errorMessage());
    }
    if (result.verdict() != null && !result.verdict().isNormal()) {
      return BLOCKED;
    }
    return fromHttpStatus(result.statusCode());
  }

  public static String fromHttpStatus(int status) {
    if (status == 404 || status == 410) {
      return HTTP_404;
    }
    if (status == 408) {
      return TIMEOUT;
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
    }
    return UNKNOWN;
  }
}
