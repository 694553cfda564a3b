package com.zenithionpay.merchantbot.domain;

/**
 * Per-conversation step of a multi-message input flow. Unknown keys read as {@link
 * ConversationState#IDLE}.
 */
public interface ConversationStateStore {

  ConversationState get(String key);

  void set(String key, ConversationState state);

  default void clear(String key) {
    set(key, ConversationState.IDLE);
  }
}
