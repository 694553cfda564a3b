package com.zenithionpay.merchantbot.polling;

import com.fasterxml.jackson.databind.JsonNode;
import com.zenithionpay.merchantbot.client.TelegramBotClient;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Long polling of the Bot API; each update is handed to the {@link ChatEventDispatcher}. */
@Component
@Slf4j
@ConditionalOnProperty(
    name = "telegram.polling.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class TelegramPollingRunner {

  private final TelegramBotClient bot;
  private final ChatEventDispatcher dispatcher;
  private final int timeoutSeconds;
  private final AtomicLong offset = new AtomicLong(0);

  public TelegramPollingRunner(
      TelegramBotClient bot,
      ChatEventDispatcher dispatcher,
      @Value("${telegram.polling.timeout-seconds:20}") int timeoutSeconds) {
    this.bot = bot;
    this.dispatcher = dispatcher;
    this.timeoutSeconds = timeoutSeconds;
  }

  @Scheduled(fixedDelayString = "${telegram.polling.fixed-delay-ms:500}")
  public void poll() {
    if (!bot.isConfigured()) {
      log.warn("telegram.polling.enabled=true but BOT_TOKEN is empty; polling is skipped");
      return;
    }

    try {
      JsonNode resp = bot.getUpdates(offset.get(), timeoutSeconds);
      if (resp == null) return;

      JsonNode result = resp.path("result");
      if (!result.isArray() || result.isEmpty()) return;

      long maxUpdateId = offset.get() - 1;
      for (JsonNode upd : result) {
        long updateId = upd.path("update_id").asLong(-1);
        if (updateId > maxUpdateId) maxUpdateId = updateId;

        TelegramUpdateParser.parse(upd).ifPresent(dispatcher::dispatch);
      }

      // Telegram expects next offset = last_update_id + 1
      offset.set(maxUpdateId + 1);
    } catch (Exception e) {
      log.warn("Telegram polling failed: {}", e.getMessage());
    }
  }

  long currentOffset() {
    return offset.get();
  }
}
