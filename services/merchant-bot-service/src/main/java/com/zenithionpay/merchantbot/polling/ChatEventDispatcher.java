package com.zenithionpay.merchantbot.polling;

import com.zenithionpay.merchantbot.domain.AccountActionRouter;
import com.zenithionpay.merchantbot.model.ChatEvent;
import com.zenithionpay.merchantbot.model.ChatResponse;
import com.zenithionpay.merchantbot.render.ChatResponseRenderer;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs chat events on the dispatch pool.
 *
 * <p>Events of one conversation are chained behind each other, so they are handled in arrival
 * order; different conversations proceed in parallel.
 */
@Component
@Slf4j
public class ChatEventDispatcher {

  private final AccountActionRouter router;
  private final ChatResponseRenderer renderer;
  private final ExecutorService executor;
  private final ConcurrentMap<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

  public ChatEventDispatcher(
      AccountActionRouter router, ChatResponseRenderer renderer, ExecutorService executor) {
    this.router = router;
    this.renderer = renderer;
    this.executor = executor;
  }

  /** Returns a future that completes once this event has been handled (successfully or not). */
  public CompletableFuture<Void> dispatch(ChatEvent event) {
    String key = event.conversationKey();
    CompletableFuture<Void> next =
        tails.compute(
            key,
            (k, tail) -> {
              Runnable task = () -> process(event);
              return tail == null
                  ? CompletableFuture.runAsync(task, executor)
                  : tail.exceptionally(e -> null).thenRunAsync(task, executor);
            });
    next.whenComplete(
        (ignored, error) -> {
          if (error != null) {
            log.error("Chat event for {} was not processed", key, error);
          }
          tails.remove(key, next);
        });
    return next;
  }

  int pendingConversations() {
    return tails.size();
  }

  private void process(ChatEvent event) {
    try {
      ChatResponse response = router.handle(event);
      renderer.render(event, response);
    } catch (Exception e) {
      log.error(
          "Unhandled error for {} event from user {} in chat {}",
          event.kind(),
          event.userId(),
          event.chatId(),
          e);
    }
  }
}
