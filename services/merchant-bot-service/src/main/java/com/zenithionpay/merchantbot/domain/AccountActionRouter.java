package com.zenithionpay.merchantbot.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.zenithionpay.merchantbot.client.MerchantAccountClient;
import com.zenithionpay.merchantbot.client.MerchantApiException;
import com.zenithionpay.merchantbot.client.MerchantApiStatusException;
import com.zenithionpay.merchantbot.client.WithdrawalOutcome;
import com.zenithionpay.merchantbot.model.ChatEvent;
import com.zenithionpay.merchantbot.model.ChatResponse;
import com.zenithionpay.merchantbot.model.OutgoingMessage;
import com.zenithionpay.merchantbot.render.Keyboards;
import com.zenithionpay.merchantbot.render.MessageTemplates;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Per-conversation state machine for the merchant operator chat.
 *
 * <p>Input: one chat event. Output: what to show in the chat. Every privileged action first
 * resolves the operator's API credential; without one the event is answered with a refusal and
 * the conversation state is left as it was. Remote failures are turned into operator messages
 * here and never propagate.
 */
@Service
@Slf4j
public class AccountActionRouter {

  static final int RECENT_PAYMENTS_LIMIT = 10;

  private final CredentialDirectory credentials;
  private final ConversationStateStore stateStore;
  private final MerchantAccountClient accounts;

  public AccountActionRouter(
      CredentialDirectory credentials,
      ConversationStateStore stateStore,
      MerchantAccountClient accounts) {
    this.credentials = credentials;
    this.stateStore = stateStore;
    this.accounts = accounts;
  }

  public ChatResponse handle(ChatEvent event) {
    String key = event.conversationKey();
    return switch (event.kind()) {
      case COMMAND -> handleCommand(event, key);
      case CALLBACK -> handleCallback(event, key);
      case TEXT -> handleText(event, key);
    };
  }

  private ChatResponse handleCommand(ChatEvent event, String key) {
    if ("/start".equals(event.payload())) {
      return withCredential(event, credential -> start(key, credential));
    }
    return ChatResponse.ofText(MessageTemplates.UNKNOWN_INPUT);
  }

  private ChatResponse handleCallback(ChatEvent event, String key) {
    CallbackAction action = CallbackAction.fromToken(event.payload());
    return switch (action) {
      case BALANCE -> withCredential(event, credential -> refreshSummary(key, credential));
      case PAYMENTS_LAST -> withCredential(event, credential -> recentPayments(key, credential));
      case CHECK_PAYMENT ->
          withCredential(
              event,
              credential ->
                  prompt(
                      key,
                      ConversationState.AWAITING_PAYMENT_QUERY,
                      MessageTemplates.PAYMENT_QUERY_PROMPT));
      case WITHDRAW ->
          withCredential(
              event,
              credential ->
                  prompt(
                      key,
                      ConversationState.AWAITING_WITHDRAW_ADDRESS,
                      MessageTemplates.WITHDRAW_PROMPT));
      case CANCEL -> withCredential(event, credential -> cancel(key, credential));
      case DELETE_MESSAGE -> deleteMessage(key);
      case UNKNOWN -> {
        log.debug("Ignoring unknown callback '{}' from user {}", event.payload(), event.userId());
        yield ChatResponse.empty();
      }
    };
  }

  private ChatResponse handleText(ChatEvent event, String key) {
    ConversationState state = stateStore.get(key);
    return switch (state) {
      case AWAITING_PAYMENT_QUERY ->
          withCredential(event, credential -> paymentQuery(key, credential, event.payload()));
      case AWAITING_WITHDRAW_ADDRESS ->
          withCredential(event, credential -> withdrawAddress(key, credential, event.payload()));
      case IDLE -> ChatResponse.ofText(MessageTemplates.UNKNOWN_INPUT);
    };
  }

  /* =========================
  Auth guard
  ========================= */

  private ChatResponse withCredential(ChatEvent event, Function<String, ChatResponse> action) {
    Optional<String> credential = credentials.credentialFor(event.userId());
    if (credential.isEmpty()) {
      log.info("No API credential for user {}; {} rejected", event.userId(), event.kind());
      return ChatResponse.ofText(MessageTemplates.NOT_AUTHORIZED);
    }
    return action.apply(credential.get());
  }

  /* =========================
  Actions
  ========================= */

  private ChatResponse start(String key, String credential) {
    stateStore.clear(key);
    return ChatResponse.of(summaryOrFailure(credential));
  }

  private ChatResponse cancel(String key, String credential) {
    stateStore.clear(key);
    try {
      JsonNode info = accounts.merchantInfo(credential);
      return ChatResponse.of(menuMessage(MessageTemplates.merchantSummary(info))).deletingSource();
    } catch (MerchantApiException e) {
      return ChatResponse.of(menuMessage(summaryFailure(e)));
    }
  }

  private ChatResponse refreshSummary(String key, String credential) {
    stateStore.clear(key);
    try {
      JsonNode info = accounts.merchantInfo(credential);
      return ChatResponse.of(menuMessage(MessageTemplates.merchantSummary(info)).preferEdit())
          .withNotice(MessageTemplates.DATA_REFRESHED);
    } catch (MerchantApiException e) {
      return ChatResponse.empty().withNotice(summaryFailure(e));
    }
  }

  private ChatResponse recentPayments(String key, String credential) {
    stateStore.clear(key);
    JsonNode history;
    try {
      history = accounts.paymentsHistory(credential, RECENT_PAYMENTS_LIMIT, false);
    } catch (MerchantApiException e) {
      return ChatResponse.ofText(describeFailure(e));
    }

    List<JsonNode> payments = new ArrayList<>();
    for (JsonNode item : history.path("payments")) {
      if (item.isObject()) {
        payments.add(item);
      }
    }
    if (payments.isEmpty()) {
      return ChatResponse.ofText(MessageTemplates.NO_PAYMENTS);
    }
    return ChatResponse.of(
            OutgoingMessage.html(MessageTemplates.paymentsList(history, payments))
                .withKeyboard(Keyboards.cancel()))
        .deletingSource();
  }

  private ChatResponse prompt(String key, ConversationState state, String text) {
    stateStore.set(key, state);
    return ChatResponse.of(OutgoingMessage.html(text).withKeyboard(Keyboards.cancel()))
        .deletingSource();
  }

  private ChatResponse deleteMessage(String key) {
    stateStore.clear(key);
    return ChatResponse.empty().deletingSource();
  }

  private ChatResponse paymentQuery(String key, String credential, String input) {
    String query = input == null ? "" : input.trim();
    if (query.isEmpty()) {
      return ChatResponse.of(
              OutgoingMessage.html(MessageTemplates.PAYMENT_QUERY_EMPTY)
                  .withKeyboard(Keyboards.cancel()))
          .deletingSource();
    }

    stateStore.clear(key);
    String text;
    try {
      JsonNode payment = accounts.payment(credential, query);
      text =
          payment.isObject()
              ? MessageTemplates.paymentDetails(payment)
              : MessageTemplates.escape(payment.asText());
    } catch (MerchantApiStatusException e) {
      text =
          e.getStatus() == 404 ? MessageTemplates.paymentNotFound(query) : describeFailure(e);
    } catch (MerchantApiException e) {
      text = describeFailure(e);
    }
    return ChatResponse.of(OutgoingMessage.html(text).withKeyboard(Keyboards.hide()))
        .deletingSource();
  }

  private ChatResponse withdrawAddress(String key, String credential, String input) {
    String toAddress = input == null ? "" : input.trim();
    if (!TronAddress.isValid(toAddress)) {
      return ChatResponse.of(
          OutgoingMessage.html(MessageTemplates.WITHDRAW_INVALID_ADDRESS)
              .withKeyboard(Keyboards.cancel()));
    }

    stateStore.clear(key);
    WithdrawalOutcome outcome;
    try {
      outcome = accounts.withdraw(credential, toAddress);
    } catch (MerchantApiException e) {
      log.warn("Withdrawal to {} failed: {}", toAddress, e.getMessage());
      return ChatResponse.of(
              OutgoingMessage.html(describeFailure(e)).withKeyboard(Keyboards.cancel()))
          .deletingSource();
    }

    log.info(
        "Withdrawal to {} for {}: {}", toAddress, CredentialDirectory.mask(credential), outcome);
    String text =
        switch (outcome) {
          case SUCCEEDED -> MessageTemplates.withdrawalCreated(toAddress);
          case BELOW_MINIMUM -> MessageTemplates.WITHDRAW_BELOW_MINIMUM;
          case FAILED -> MessageTemplates.WITHDRAW_FAILED;
        };
    return ChatResponse.of(OutgoingMessage.html(text).withKeyboard(Keyboards.hide()))
        .deletingSource();
  }

  /* =========================
  Helpers
  ========================= */

  private OutgoingMessage summaryOrFailure(String credential) {
    try {
      return menuMessage(MessageTemplates.merchantSummary(accounts.merchantInfo(credential)));
    } catch (MerchantApiException e) {
      return menuMessage(summaryFailure(e));
    }
  }

  private static OutgoingMessage menuMessage(String text) {
    return OutgoingMessage.html(text).withKeyboard(Keyboards.mainMenu());
  }

  private static String summaryFailure(MerchantApiException e) {
    return e.isUnavailable()
        ? MessageTemplates.SERVICE_UNAVAILABLE
        : MessageTemplates.REQUEST_FAILED;
  }

  /** 5xx and transport failures get the generic text; other statuses echo status and payload. */
  static String describeFailure(MerchantApiException e) {
    if (!e.isUnavailable() && e instanceof MerchantApiStatusException status) {
      return MessageTemplates.requestFailed(status.getStatus(), status.payloadText());
    }
    return MessageTemplates.SERVICE_UNAVAILABLE;
  }
}
