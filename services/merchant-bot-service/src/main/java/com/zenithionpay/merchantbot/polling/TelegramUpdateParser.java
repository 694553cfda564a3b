package com.zenithionpay.merchantbot.polling;

import com.fasterxml.jackson.databind.JsonNode;
import com.zenithionpay.merchantbot.model.ChatEvent;
import java.util.Locale;
import java.util.Optional;

/** Maps one Bot API {@code Update} object to a {@link ChatEvent}. */
public final class TelegramUpdateParser {

  private TelegramUpdateParser() {}

  public static Optional<ChatEvent> parse(JsonNode update) {
    if (update == null || !update.isObject()) {
      return Optional.empty();
    }

    JsonNode callback = update.path("callback_query");
    if (!callback.isMissingNode() && !callback.isNull()) {
      return parseCallback(callback);
    }

    JsonNode message = update.path("message");
    if (message.isMissingNode() || message.isNull()) {
      return Optional.empty();
    }

    String chatId = message.path("chat").path("id").asText("");
    String fromId = message.path("from").path("id").asText("");
    if (chatId.isBlank() || fromId.isBlank()) {
      return Optional.empty();
    }
    String messageId = message.path("message_id").asText(null);

    // stickers, photos and the like arrive without text
    String text = message.path("text").asText("");
    if (text.startsWith("/")) {
      return Optional.of(ChatEvent.command(chatId, fromId, messageId, normalizeCommand(text)));
    }
    return Optional.of(ChatEvent.text(chatId, fromId, messageId, text));
  }

  private static Optional<ChatEvent> parseCallback(JsonNode callback) {
    JsonNode message = callback.path("message");
    if (message.isMissingNode() || message.isNull()) {
      return Optional.empty();
    }

    String chatId = message.path("chat").path("id").asText("");
    String fromId = callback.path("from").path("id").asText("");
    if (chatId.isBlank() || fromId.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(
        ChatEvent.callback(
            chatId,
            fromId,
            message.path("message_id").asText(null),
            callback.path("id").asText(null),
            callback.path("data").asText("").trim()));
  }

  /** {@code "/Start@MerchantBot arg"} becomes {@code "/start"}. */
  static String normalizeCommand(String text) {
    String command = text.trim().split("\\s+", 2)[0];
    int at = command.indexOf('@');
    if (at > 0) {
      command = command.substring(0, at);
    }
    return command.toLowerCase(Locale.ROOT);
  }
}
