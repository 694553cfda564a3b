package com.zenithionpay.merchantbot.client;

import com.fasterxml.jackson.databind.JsonNode;

/** The API answered with a non-2xx status. */
public class MerchantApiStatusException extends MerchantApiException {

  private final int status;
  private final JsonNode payload;

  public MerchantApiStatusException(int status, JsonNode payload, String url) {
    super("Merchant API error " + status + " for " + url + ": " + payload, url, null);
    this.status = status;
    this.payload = payload;
  }

  public int getStatus() {
    return status;
  }

  public JsonNode getPayload() {
    return payload;
  }

  /** Payload as it should be shown to the operator: raw text for text bodies, JSON otherwise. */
  public String payloadText() {
    if (payload == null || payload.isMissingNode() || payload.isNull()) {
      return "";
    }
    return payload.isTextual() ? payload.asText() : payload.toString();
  }

  @Override
  public boolean isUnavailable() {
    return status >= 500;
  }
}
