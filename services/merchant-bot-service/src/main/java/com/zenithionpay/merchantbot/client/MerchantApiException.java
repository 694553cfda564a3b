package com.zenithionpay.merchantbot.client;

/** Failed call to the merchant payments API. */
public abstract class MerchantApiException extends RuntimeException {

  private final String url;

  protected MerchantApiException(String message, String url, Throwable cause) {
    super(message, cause);
    this.url = url;
  }

  public String getUrl() {
    return url;
  }

  /** True when the operator should only see the generic "service unavailable" text. */
  public abstract boolean isUnavailable();
}
