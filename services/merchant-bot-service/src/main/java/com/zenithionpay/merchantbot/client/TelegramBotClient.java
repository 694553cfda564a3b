package com.zenithionpay.merchantbot.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.zenithionpay.merchantbot.model.InlineKeyboard;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Service
@Slf4j
public class TelegramBotClient implements ChatTransport {

  private final RestClient rest;
  private final String botToken;

  public TelegramBotClient(
      RestClient.Builder builder,
      @Value("${telegram.bot-token:}") String botToken,
      @Value("${telegram.api-base-url:https://api.telegram.org}") String apiBaseUrl) {
    this.botToken = botToken == null ? "" : botToken.trim();
    this.rest = builder.clone().baseUrl(apiBaseUrl).build();
  }

  public boolean isConfigured() {
    return !botToken.isBlank();
  }

  public JsonNode getUpdates(long offset, int timeoutSeconds) {
    if (!isConfigured()) {
      log.warn("Telegram bot token is not configured; skip getUpdates");
      return null;
    }
    try {
      return rest.get()
          .uri(
              "/bot" + botToken + "/getUpdates?offset={offset}&timeout={timeout}",
              offset,
              timeoutSeconds)
          .retrieve()
          .body(JsonNode.class);
    } catch (RestClientException e) {
      log.warn("Failed to call getUpdates: {}", e.getMessage());
      return null;
    }
  }

  @Override
  public void sendMessage(String chatId, String text, String parseMode, InlineKeyboard keyboard) {
    Map<String, Object> body = new HashMap<>();
    body.put("chat_id", chatId);
    body.put("text", text);
    putFormatting(body, parseMode, keyboard);
    call("sendMessage", body);
  }

  @Override
  public void editMessageText(
      String chatId, String messageId, String text, String parseMode, InlineKeyboard keyboard) {
    if (messageId == null || messageId.isBlank()) {
      throw new ChatDeliveryException("editMessageText needs a message id");
    }
    Map<String, Object> body = new HashMap<>();
    body.put("chat_id", chatId);
    body.put("message_id", messageId);
    body.put("text", text);
    putFormatting(body, parseMode, keyboard);
    call("editMessageText", body);
  }

  @Override
  public void deleteMessage(String chatId, String messageId) {
    if (messageId == null || messageId.isBlank()) {
      return;
    }
    call("deleteMessage", Map.of("chat_id", chatId, "message_id", messageId));
  }

  @Override
  public void answerCallbackQuery(String callbackQueryId, String text) {
    if (callbackQueryId == null || callbackQueryId.isBlank()) {
      return;
    }
    Map<String, Object> body = new HashMap<>();
    body.put("callback_query_id", callbackQueryId);
    if (text != null && !text.isBlank()) {
      body.put("text", text);
    }
    call("answerCallbackQuery", body);
  }

  private void call(String method, Map<String, Object> body) {
    if (!isConfigured()) {
      throw new ChatDeliveryException("Telegram bot token is not configured; cannot " + method);
    }
    try {
      rest.post().uri("/bot" + botToken + "/" + method).body(body).retrieve().toBodilessEntity();
    } catch (RestClientException e) {
      throw new ChatDeliveryException("Telegram " + method + " failed: " + e.getMessage(), e);
    }
  }

  private static void putFormatting(
      Map<String, Object> body, String parseMode, InlineKeyboard keyboard) {
    if (parseMode != null && !parseMode.isBlank()) {
      body.put("parse_mode", parseMode);
    }
    if (keyboard != null) {
      body.put("reply_markup", toInlineKeyboard(keyboard));
    }
  }

  private static Map<String, Object> toInlineKeyboard(InlineKeyboard keyboard) {
    List<List<Map<String, Object>>> rows = new ArrayList<>();
    for (var row : keyboard.rows()) {
      List<Map<String, Object>> outRow = new ArrayList<>();
      if (row != null) {
        for (var btn : row) {
          if (btn == null) continue;
          Map<String, Object> b = new HashMap<>();
          b.put("text", btn.text());
          b.put("callback_data", btn.callbackData());
          outRow.add(b);
        }
      }
      rows.add(outRow);
    }
    Map<String, Object> out = new HashMap<>();
    out.put("inline_keyboard", rows);
    return out;
  }
}
