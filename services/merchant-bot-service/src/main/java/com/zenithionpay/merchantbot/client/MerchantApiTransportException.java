package com.zenithionpay.merchantbot.client;

/** The call never produced an HTTP response (connect failure, timeout, TLS). */
public class MerchantApiTransportException extends MerchantApiException {

  public MerchantApiTransportException(String url, Throwable cause) {
    super("Merchant API unreachable at " + url + ": " + cause.getMessage(), url, cause);
  }

  @Override
  public boolean isUnavailable() {
    return true;
  }
}
