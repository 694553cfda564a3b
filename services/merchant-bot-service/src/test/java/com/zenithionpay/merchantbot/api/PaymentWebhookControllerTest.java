package com.zenithionpay.merchantbot.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.zenithionpay.merchantbot.domain.DepositNotifier;
import com.zenithionpay.merchantbot.model.DepositNotification;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(
    controllers = PaymentWebhookController.class,
    properties = "merchant.webhook.secret=test-secret")
class PaymentWebhookControllerTest {

  private static final String DEPOSIT =
      "{\"message\":\"new_deposit\",\"address\":\"TKTgEtjonYPdCWDs7bUb9dUUwYikceDabx\","
          + "\"amount\":\"15.5\",\"new_status\":\"paid\",\"merchant_api_token\":\"tok-a\"}";

  @Autowired MockMvc mvc;

  @MockBean DepositNotifier notifier;

  @Test
  void newDeposit_withSecret_notifies() throws Exception {
    mvc.perform(
            post("/webhook")
                .header("X-API-Key", "test-secret")
                .contentType(MediaType.APPLICATION_JSON)
                .content(DEPOSIT))
        .andExpect(status().isOk())
        .andExpect(content().string("Success"));

    verify(notifier)
        .notifyDeposit(
            new DepositNotification(
                "TKTgEtjonYPdCWDs7bUb9dUUwYikceDabx", "15.5", "paid", "tok-a"));
  }

  @Test
  void wrongSecret_isForbidden_andNothingIsSent() throws Exception {
    mvc.perform(
            post("/webhook")
                .header("X-API-Key", "nope")
                .contentType(MediaType.APPLICATION_JSON)
                .content(DEPOSIT))
        .andExpect(status().isForbidden())
        .andExpect(content().string("Unauthorized"));

    verifyNoInteractions(notifier);
  }

  @Test
  void missingSecret_isForbidden() throws Exception {
    mvc.perform(post("/webhook").contentType(MediaType.APPLICATION_JSON).content(DEPOSIT))
        .andExpect(status().isForbidden());

    verifyNoInteractions(notifier);
  }

  @Test
  void otherKinds_areAcknowledgedAndIgnored() throws Exception {
    mvc.perform(
            post("/webhook")
                .header("X-API-Key", "test-secret")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"message\":\"payment_expired\",\"id\":\"p-1\"}"))
        .andExpect(status().isOk())
        .andExpect(content().string("Success"));

    verifyNoInteractions(notifier);
  }

  @Test
  void jsonAcceptHeader_doesNotChangeStatus() throws Exception {
    mvc.perform(
            post("/webhook")
                .header("X-API-Key", "test-secret")
                .accept(MediaType.APPLICATION_JSON)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"message\":\"other\"}"))
        .andExpect(status().isOk())
        .andExpect(content().string("Success"));

    mvc.perform(
            post("/webhook")
                .header("X-API-Key", "nope")
                .accept(MediaType.APPLICATION_JSON)
                .contentType(MediaType.APPLICATION_JSON)
                .content(DEPOSIT))
        .andExpect(status().isForbidden())
        .andExpect(content().string("Unauthorized"));

    mvc.perform(
            post("/webhook")
                .header("X-API-Key", "test-secret")
                .accept(MediaType.APPLICATION_JSON)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{not json"))
        .andExpect(status().isBadRequest())
        .andExpect(content().string("Error"));

    verifyNoInteractions(notifier);
  }

  @Test
  void malformedBody_isBadRequest() throws Exception {
    mvc.perform(
            post("/webhook")
                .header("X-API-Key", "test-secret")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{not json"))
        .andExpect(status().isBadRequest())
        .andExpect(content().string("Error"));

    mvc.perform(post("/webhook").header("X-API-Key", "test-secret"))
        .andExpect(status().isBadRequest());

    verifyNoInteractions(notifier);
  }

  @Test
  void depositWithoutRequiredField_isBadRequest() throws Exception {
    mvc.perform(
            post("/webhook")
                .header("X-API-Key", "test-secret")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"message\":\"new_deposit\",\"address\":\"Taddr\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(content().string("Error"));

    verifyNoInteractions(notifier);
  }

  @Test
  void notifierFailure_isBadRequest() throws Exception {
    when(notifier.notifyDeposit(any()))
        .thenThrow(new IllegalStateException("boom"));

    mvc.perform(
            post("/webhook")
                .header("X-API-Key", "test-secret")
                .contentType(MediaType.APPLICATION_JSON)
                .content(DEPOSIT))
        .andExpect(status().isBadRequest())
        .andExpect(content().string("Error"));
  }
}
