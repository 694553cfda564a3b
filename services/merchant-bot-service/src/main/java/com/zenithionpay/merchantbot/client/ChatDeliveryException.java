package com.zenithionpay.merchantbot.client;

public class ChatDeliveryException extends RuntimeException {
  public ChatDeliveryException(String message) {
    super(message);
  }

  public ChatDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
