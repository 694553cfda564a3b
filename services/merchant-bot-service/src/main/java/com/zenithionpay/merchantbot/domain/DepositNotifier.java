package com.zenithionpay.merchantbot.domain;

import com.zenithionpay.merchantbot.client.ChatTransport;
import com.zenithionpay.merchantbot.model.DepositNotification;
import com.zenithionpay.merchantbot.model.UiHints;
import com.zenithionpay.merchantbot.render.MessageTemplates;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Delivers a deposit notification to every operator enrolled under the merchant's credential. */
@Service
@Slf4j
public class DepositNotifier {

  private final CredentialDirectory credentials;
  private final ChatTransport chat;

  public DepositNotifier(CredentialDirectory credentials, ChatTransport chat) {
    this.credentials = credentials;
    this.chat = chat;
  }

  /**
   * Sends one message per recipient; a failed send is logged and does not stop the others.
   *
   * @return number of recipients the message was delivered to
   */
  public int notifyDeposit(DepositNotification notification) {
    List<String> recipients = credentials.identitiesFor(notification.merchantCredential());
    if (recipients.isEmpty()) {
      log.warn(
          "Merchant API token not found: {}",
          CredentialDirectory.mask(notification.merchantCredential()));
      return 0;
    }

    String text = MessageTemplates.depositNotification(notification);
    int delivered = 0;
    for (String recipient : recipients) {
      try {
        chat.sendMessage(recipient, text, UiHints.HTML, null);
        delivered++;
      } catch (RuntimeException e) {
        log.warn("Failed to send deposit notification to {}: {}", recipient, e.getMessage());
      }
    }
    log.info(
        "Deposit notification for {} sent to {}/{} recipients",
        notification.address(),
        delivered,
        recipients.size());
    return delivered;
  }
}
