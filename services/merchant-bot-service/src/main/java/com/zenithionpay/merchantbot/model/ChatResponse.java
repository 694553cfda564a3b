package com.zenithionpay.merchantbot.model;

import java.util.List;

/**
 * What the router wants the chat to show after one event.
 *
 * <p>{@code deleteSource} removes the message the event came from (the menu message for a callback,
 * the user's own message for text input). {@code callbackNotice} is shown as a short toast when the
 * event is a callback.
 */
public record ChatResponse(
    List<OutgoingMessage> messages, boolean deleteSource, String callbackNotice) {

  public ChatResponse {
    messages = messages == null ? List.of() : List.copyOf(messages);
  }

  public static ChatResponse empty() {
    return new ChatResponse(List.of(), false, null);
  }

  public static ChatResponse of(OutgoingMessage message) {
    return new ChatResponse(List.of(message), false, null);
  }

  public static ChatResponse ofText(String text) {
    return of(OutgoingMessage.html(text));
  }

  public ChatResponse deletingSource() {
    return new ChatResponse(messages, true, callbackNotice);
  }

  public ChatResponse withNotice(String notice) {
    return new ChatResponse(messages, deleteSource, notice);
  }

  public boolean isEmpty() {
    return messages.isEmpty() && !deleteSource && callbackNotice == null;
  }
}
