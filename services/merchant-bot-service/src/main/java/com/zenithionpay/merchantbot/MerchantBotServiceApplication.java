package com.zenithionpay.merchantbot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MerchantBotServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(MerchantBotServiceApplication.class, args);
  }
}
