package com.zenithionpay.merchantbot.client;

import com.zenithionpay.merchantbot.model.InlineKeyboard;

/** Outbound side of the chat platform. Methods throw {@link ChatDeliveryException} on failure. */
public interface ChatTransport {

  void sendMessage(String chatId, String text, String parseMode, InlineKeyboard keyboard);

  void editMessageText(
      String chatId, String messageId, String text, String parseMode, InlineKeyboard keyboard);

  void deleteMessage(String chatId, String messageId);

  /** @param text optional toast text; null just stops the button's loading indicator */
  void answerCallbackQuery(String callbackQueryId, String text);
}
