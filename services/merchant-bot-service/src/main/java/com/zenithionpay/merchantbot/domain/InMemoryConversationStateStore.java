package com.zenithionpay.merchantbot.domain;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * In-memory conversation state with TTL.
 *
 * <p>Lost on restart; every conversation then starts from {@link ConversationState#IDLE} again.
 */
@Service
public class InMemoryConversationStateStore implements ConversationStateStore {

  private final ConcurrentMap<String, Entry> map = new ConcurrentHashMap<>();
  private final Duration ttl;
  private final Clock clock;

  public InMemoryConversationStateStore(
      @Value("${chat.state.ttl:PT30M}") Duration ttl, Clock clock) {
    this.ttl = ttl;
    this.clock = clock;
  }

  @Override
  public ConversationState get(String key) {
    Entry e = map.get(key);
    if (e == null) {
      return ConversationState.IDLE;
    }
    if (e.expiresAt.isBefore(clock.instant())) {
      map.remove(key, e);
      return ConversationState.IDLE;
    }
    return e.state;
  }

  @Override
  public void set(String key, ConversationState state) {
    if (state == null || state == ConversationState.IDLE) {
      map.remove(key);
      return;
    }
    map.put(key, new Entry(state, clock.instant().plus(ttl)));
  }

  int size() {
    return map.size();
  }

  private record Entry(ConversationState state, Instant expiresAt) {}
}
