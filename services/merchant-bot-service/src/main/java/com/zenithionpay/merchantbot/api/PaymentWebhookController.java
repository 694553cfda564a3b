package com.zenithionpay.merchantbot.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zenithionpay.merchantbot.domain.DepositNotifier;
import com.zenithionpay.merchantbot.model.DepositNotification;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * Push notifications from the merchant payments API.
 *
 * <p>The body is parsed first (400 when it is not JSON), then the shared secret in {@code
 * X-API-Key} is checked (403). Only {@code new_deposit} events are acted on; other kinds are
 * accepted and ignored.
 */
@RestController
@Slf4j
public class PaymentWebhookController {

  static final String SECRET_HEADER = "X-API-Key";
  static final String NEW_DEPOSIT = "new_deposit";

  private final DepositNotifier notifier;
  private final ObjectMapper mapper;
  private final byte[] secret;

  public PaymentWebhookController(
      DepositNotifier notifier,
      ObjectMapper mapper,
      @Value("${merchant.webhook.secret:}") String secret) {
    this.notifier = notifier;
    this.mapper = mapper;
    String trimmed = secret == null ? "" : secret.trim();
    this.secret = trimmed.getBytes(StandardCharsets.UTF_8);
    if (trimmed.isEmpty()) {
      log.warn("merchant.webhook.secret is not configured; every webhook will be rejected");
    }
  }

  @PostMapping("/webhook")
  public ResponseEntity<String> webhook(
      @RequestBody(required = false) String body,
      @RequestHeader(value = SECRET_HEADER, required = false) String headerSecret) {
    JsonNode event = parse(body);

    if (!secretMatches(headerSecret)) {
      log.warn("Webhook secret mismatch");
      return text(HttpStatus.FORBIDDEN, "Unauthorized");
    }

    String kind = event.path("message").asText("");
    log.info("New webhook: {}", kind);
    if (NEW_DEPOSIT.equals(kind)) {
      notifier.notifyDeposit(
          new DepositNotification(
              required(event, "address"),
              required(event, "amount"),
              required(event, "new_status"),
              required(event, "merchant_api_token")));
    }
    return text(HttpStatus.OK, "Success");
  }

  private static ResponseEntity<String> text(HttpStatus status, String body) {
    return ResponseEntity.status(status).contentType(MediaType.TEXT_PLAIN).body(body);
  }

  private JsonNode parse(String body) {
    if (body == null || body.isBlank()) {
      throw new InvalidWebhookPayloadException("Empty webhook body");
    }
    try {
      JsonNode node = mapper.readTree(body);
      if (node == null || !node.isObject()) {
        throw new InvalidWebhookPayloadException("Webhook body is not a JSON object");
      }
      return node;
    } catch (JsonProcessingException e) {
      throw new InvalidWebhookPayloadException("Webhook body is not valid JSON", e);
    }
  }

  private boolean secretMatches(String headerSecret) {
    if (secret.length == 0 || headerSecret == null) {
      return false;
    }
    return MessageDigest.isEqual(secret, headerSecret.getBytes(StandardCharsets.UTF_8));
  }

  private static String required(JsonNode event, String field) {
    JsonNode value = event.get(field);
    if (value == null || value.isNull()) {
      throw new InvalidWebhookPayloadException("Webhook field '" + field + "' is missing");
    }
    return value.asText();
  }
}
