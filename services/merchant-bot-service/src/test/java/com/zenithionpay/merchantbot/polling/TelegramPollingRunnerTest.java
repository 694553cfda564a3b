package com.zenithionpay.merchantbot.polling;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zenithionpay.merchantbot.client.TelegramBotClient;
import com.zenithionpay.merchantbot.model.ChatEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class TelegramPollingRunnerTest {

  private final ObjectMapper mapper = new ObjectMapper();

  private TelegramBotClient bot;
  private ChatEventDispatcher dispatcher;
  private TelegramPollingRunner runner;

  @BeforeEach
  void setUp() {
    bot = mock(TelegramBotClient.class);
    dispatcher = mock(ChatEventDispatcher.class);
    runner = new TelegramPollingRunner(bot, dispatcher, 20);
    when(bot.isConfigured()).thenReturn(true);
  }

  @Test
  void poll_dispatchesEvents_andAdvancesOffset() throws Exception {
    when(bot.getUpdates(0L, 20))
        .thenReturn(
            mapper.readTree(
                "{\"ok\":true,\"result\":["
                    + "{\"update_id\":41,\"message\":{\"message_id\":1,\"chat\":{\"id\":1},"
                    + "\"from\":{\"id\":2},\"text\":\"/start\"}},"
                    + "{\"update_id\":42,\"edited_message\":{\"text\":\"x\"}},"
                    + "{\"update_id\":43,\"message\":{\"message_id\":2,\"chat\":{\"id\":1},"
                    + "\"from\":{\"id\":2},\"text\":\"hi\"}}]}"));

    runner.poll();

    ArgumentCaptor<ChatEvent> events = ArgumentCaptor.forClass(ChatEvent.class);
    verify(dispatcher, times(2)).dispatch(events.capture());
    assertThat(events.getAllValues())
        .extracting(ChatEvent::payload)
        .containsExactly("/start", "hi");
    assertThat(runner.currentOffset()).isEqualTo(44);
  }

  @Test
  void poll_withoutUpdates_keepsOffset() throws Exception {
    when(bot.getUpdates(anyLong(), anyInt()))
        .thenReturn(mapper.readTree("{\"ok\":true,\"result\":[]}"));

    runner.poll();

    verify(dispatcher, never()).dispatch(any());
    assertThat(runner.currentOffset()).isZero();
  }

  @Test
  void poll_unconfigured_skipsCall() {
    when(bot.isConfigured()).thenReturn(false);

    runner.poll();

    verify(bot, never()).getUpdates(anyLong(), anyInt());
  }
}
