package com.zenithionpay.merchantbot.config;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ChatDispatchConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean(destroyMethod = "shutdown")
  public ExecutorService chatDispatchExecutor(@Value("${chat.dispatch.threads:8}") int threads) {
    AtomicInteger seq = new AtomicInteger();
    ThreadFactory factory =
        r -> {
          Thread t = new Thread(r, "chat-dispatch-" + seq.incrementAndGet());
          t.setDaemon(true);
          return t;
        };
    return Executors.newFixedThreadPool(Math.max(1, threads), factory);
  }
}
