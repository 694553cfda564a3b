package com.zenithionpay.merchantbot.domain;

public enum CallbackAction {
  BALANCE("balance"),
  PAYMENTS_LAST("payments_last"),
  CHECK_PAYMENT("check_payment"),
  WITHDRAW("withdraw"),
  CANCEL("cancel"),
  DELETE_MESSAGE("delete_message"),
  UNKNOWN("");

  private final String code;

  CallbackAction(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public String token(String... args) {
    return CallbackCodec.encode(code, args);
  }

  public static CallbackAction fromToken(String token) {
    if (token == null || token.isBlank()) {
      return UNKNOWN;
    }
    for (CallbackAction action : values()) {
      if (action != UNKNOWN && CallbackCodec.hasActionPrefix(token, action.code)) {
        return action;
      }
    }
    return UNKNOWN;
  }
}
