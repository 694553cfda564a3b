package com.zenithionpay.merchantbot.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Transport-neutral inbound chat event.
 *
 * <p>{@code payload} is the normalized command (e.g. {@code /start}) for {@link
 * ChatEventKind#COMMAND}, the callback token for {@link ChatEventKind#CALLBACK} and the raw text
 * for {@link ChatEventKind#TEXT}.
 */
public record ChatEvent(
    @NotNull ChatEventKind kind,
    @NotBlank String chatId,
    @NotBlank String userId,
    String messageId,
    String callbackQueryId,
    String payload) {

  public static ChatEvent command(String chatId, String userId, String messageId, String command) {
    return new ChatEvent(ChatEventKind.COMMAND, chatId, userId, messageId, null, command);
  }

  public static ChatEvent callback(
      String chatId, String userId, String messageId, String callbackQueryId, String data) {
    return new ChatEvent(ChatEventKind.CALLBACK, chatId, userId, messageId, callbackQueryId, data);
  }

  public static ChatEvent text(String chatId, String userId, String messageId, String text) {
    return new ChatEvent(ChatEventKind.TEXT, chatId, userId, messageId, null, text);
  }

  /** Key of the conversation this event belongs to. */
  public String conversationKey() {
    String left = userId == null ? "" : userId.trim();
    String right = chatId == null ? "" : chatId.trim();
    return left + "|" + right;
  }
}
