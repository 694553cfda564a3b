package com.zenithionpay.merchantbot.api;

public class InvalidWebhookPayloadException extends RuntimeException {
  public InvalidWebhookPayloadException(String message) {
    super(message);
  }

  public InvalidWebhookPayloadException(String message, Throwable cause) {
    super(message, cause);
  }
}
