package com.zenithionpay.merchantbot.api;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Whatever goes wrong while handling a webhook, the caller only sees a 400 with a fixed body. */
@RestControllerAdvice(assignableTypes = PaymentWebhookController.class)
@Slf4j
public class ApiExceptionHandler {

  @ExceptionHandler(InvalidWebhookPayloadException.class)
  public ResponseEntity<String> handleInvalidPayload(InvalidWebhookPayloadException ex) {
    log.warn("Rejected webhook: {}", ex.getMessage());
    return error();
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<String> handleUnexpected(Exception ex) {
    log.error("Webhook error", ex);
    return error();
  }

  private static ResponseEntity<String> error() {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .contentType(MediaType.TEXT_PLAIN)
        .body("Error");
  }
}
