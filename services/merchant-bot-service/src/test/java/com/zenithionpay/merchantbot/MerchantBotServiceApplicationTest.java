package com.zenithionpay.merchantbot;

import static org.assertj.core.api.Assertions.assertThat;

import com.zenithionpay.merchantbot.domain.AccountActionRouter;
import com.zenithionpay.merchantbot.domain.CredentialDirectory;
import com.zenithionpay.merchantbot.polling.ChatEventDispatcher;
import com.zenithionpay.merchantbot.polling.TelegramPollingRunner;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

@SpringBootTest
class MerchantBotServiceApplicationTest {

  @Autowired ApplicationContext context;

  @Test
  void contextLoads_withPollingDisabled() {
    assertThat(context.getBean(AccountActionRouter.class)).isNotNull();
    assertThat(context.getBean(ChatEventDispatcher.class)).isNotNull();
    assertThat(context.getBeansOfType(TelegramPollingRunner.class)).isEmpty();
    assertThat(context.getBean(CredentialDirectory.class).credentialCount()).isZero();
  }
}
