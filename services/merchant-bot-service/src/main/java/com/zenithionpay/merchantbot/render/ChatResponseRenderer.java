package com.zenithionpay.merchantbot.render;

import com.zenithionpay.merchantbot.client.ChatTransport;
import com.zenithionpay.merchantbot.model.ChatEvent;
import com.zenithionpay.merchantbot.model.ChatResponse;
import com.zenithionpay.merchantbot.model.OutgoingMessage;
import com.zenithionpay.merchantbot.model.UiHints;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Applies a {@link ChatResponse} to the chat: messages first, then the source deletion, then the
 * callback answer. A failed Bot API call is logged and does not stop the remaining steps.
 */
@Component
@Slf4j
public class ChatResponseRenderer {

  private final ChatTransport chat;

  public ChatResponseRenderer(ChatTransport chat) {
    this.chat = chat;
  }

  public void render(ChatEvent event, ChatResponse response) {
    ChatResponse actual = response == null ? ChatResponse.empty() : response;
    String chatId = event.chatId();
    String sourceMessageId = event.messageId();

    for (OutgoingMessage m : actual.messages()) {
      if (m == null || m.text() == null || m.text().isBlank()) {
        continue;
      }
      UiHints hints = m.uiHints() == null ? UiHints.html() : m.uiHints();
      if (hints.preferEdit() && sourceMessageId != null) {
        try {
          chat.editMessageText(
              chatId, sourceMessageId, m.text(), hints.parseModeHint(), hints.inlineKeyboard());
        } catch (RuntimeException e) {
          // usually "message is not modified" after a repeated refresh
          log.debug("editMessageText in chat {} failed: {}", chatId, e.getMessage());
        }
      } else {
        try {
          chat.sendMessage(chatId, m.text(), hints.parseModeHint(), hints.inlineKeyboard());
        } catch (RuntimeException e) {
          log.warn("sendMessage to chat {} failed: {}", chatId, e.getMessage());
        }
      }
    }

    if (actual.deleteSource() && sourceMessageId != null) {
      try {
        chat.deleteMessage(chatId, sourceMessageId);
      } catch (RuntimeException e) {
        log.warn("deleteMessage {} in chat {} failed: {}", sourceMessageId, chatId, e.getMessage());
      }
    }

    if (event.callbackQueryId() != null) {
      try {
        chat.answerCallbackQuery(event.callbackQueryId(), actual.callbackNotice());
      } catch (RuntimeException e) {
        log.warn("answerCallbackQuery failed: {}", e.getMessage());
      }
    }
  }
}
