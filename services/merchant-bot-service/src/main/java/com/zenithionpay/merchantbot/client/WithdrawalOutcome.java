package com.zenithionpay.merchantbot.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Decision returned by {@code POST merchant/balance/withdraw}.
 *
 * <p>Only a boolean {@code success: true} counts as success; {@code status} is read only to tell
 * the below-minimum refusal apart from other failures.
 */
public enum WithdrawalOutcome {
  SUCCEEDED,
  BELOW_MINIMUM,
  FAILED;

  static final String UNDER_MINIMUM_STATUS = "under_minimum_withdrawal_amount";

  public static WithdrawalOutcome fromPayload(JsonNode payload) {
    if (payload == null || !payload.isObject()) {
      return FAILED;
    }
    JsonNode success = payload.path("success");
    if (success.isBoolean() && success.booleanValue()) {
      return SUCCEEDED;
    }
    if (UNDER_MINIMUM_STATUS.equals(payload.path("status").asText(null))) {
      return BELOW_MINIMUM;
    }
    return FAILED;
  }
}
