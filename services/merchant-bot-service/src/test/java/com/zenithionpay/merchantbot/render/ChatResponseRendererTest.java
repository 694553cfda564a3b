package com.zenithionpay.merchantbot.render;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.zenithionpay.merchantbot.client.ChatDeliveryException;
import com.zenithionpay.merchantbot.client.ChatTransport;
import com.zenithionpay.merchantbot.model.ChatEvent;
import com.zenithionpay.merchantbot.model.ChatResponse;
import com.zenithionpay.merchantbot.model.OutgoingMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class ChatResponseRendererTest {

  private ChatTransport chat;
  private ChatResponseRenderer renderer;

  @BeforeEach
  void setUp() {
    chat = mock(ChatTransport.class);
    renderer = new ChatResponseRenderer(chat);
  }

  @Test
  void callbackResponse_sendsThenDeletesThenAnswers() {
    ChatEvent event = ChatEvent.callback("1", "2", "50", "cb-1", "payments_last");
    ChatResponse response =
        ChatResponse.of(OutgoingMessage.html("list").withKeyboard(Keyboards.cancel()))
            .deletingSource();

    renderer.render(event, response);

    InOrder order = inOrder(chat);
    order.verify(chat).sendMessage("1", "list", "HTML", Keyboards.cancel());
    order.verify(chat).deleteMessage("1", "50");
    order.verify(chat).answerCallbackQuery("cb-1", null);
  }

  @Test
  void preferEdit_editsSourceMessage_andAnswersWithNotice() {
    ChatEvent event = ChatEvent.callback("1", "2", "50", "cb-1", "balance");
    ChatResponse response =
        ChatResponse.of(OutgoingMessage.html("summary").preferEdit()).withNotice("done");

    renderer.render(event, response);

    verify(chat).editMessageText("1", "50", "summary", "HTML", null);
    verify(chat, never()).sendMessage(anyString(), anyString(), any(), any());
    verify(chat).answerCallbackQuery("cb-1", "done");
  }

  @Test
  void failedEdit_stillAnswersCallback() {
    doThrow(new ChatDeliveryException("message is not modified"))
        .when(chat)
        .editMessageText(anyString(), anyString(), anyString(), any(), any());
    ChatEvent event = ChatEvent.callback("1", "2", "50", "cb-1", "balance");

    renderer.render(event, ChatResponse.of(OutgoingMessage.html("same").preferEdit()));

    verify(chat).answerCallbackQuery("cb-1", null);
  }

  @Test
  void failedSend_stillDeletesSource() {
    doThrow(new ChatDeliveryException("chat not found"))
        .when(chat)
        .sendMessage(anyString(), anyString(), any(), any());
    ChatEvent event = ChatEvent.text("1", "2", "60", "p-1");

    renderer.render(event, ChatResponse.ofText("details").deletingSource());

    verify(chat).deleteMessage("1", "60");
    verify(chat, never()).answerCallbackQuery(any(), any());
  }

  @Test
  void emptyResponse_forTextEvent_doesNothing() {
    renderer.render(ChatEvent.text("1", "2", "60", "x"), ChatResponse.empty());
    verifyNoInteractions(chat);
  }
}
