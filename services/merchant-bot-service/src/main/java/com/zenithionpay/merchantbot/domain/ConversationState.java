package com.zenithionpay.merchantbot.domain;

public enum ConversationState {
  IDLE,
  AWAITING_WITHDRAW_ADDRESS,
  AWAITING_PAYMENT_QUERY
}
