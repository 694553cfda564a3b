package com.zenithionpay.merchantbot.render;

import com.fasterxml.jackson.databind.JsonNode;
import com.zenithionpay.merchantbot.model.DepositNotification;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.web.util.HtmlUtils;

/** Operator-facing texts (Telegram HTML parse mode). */
public final class MessageTemplates {

  public static final String SERVICE_UNAVAILABLE = "Сервис временно недоступен. Попробуйте позже";
  public static final String NOT_AUTHORIZED = "Для вашего аккаунта не найден API токен.";
  public static final String REQUEST_FAILED = "Ошибка запроса";
  public static final String DATA_REFRESHED = "Данные обновлены.";
  public static final String NO_PAYMENTS = "Платежи не найдены.";
  public static final String UNKNOWN_INPUT = "Не понял сообщение. Откройте меню: /start";

  public static final String PAYMENT_QUERY_PROMPT =
      "Отправь <b>ID платежа</b> или <b>TRON-адрес</b>.\n"
          + "Пример: <code>7747b8f0-6970-4f38-bcfd-95e6560e49db</code>";
  public static final String PAYMENT_QUERY_EMPTY = "Пришли ID или адрес одним сообщением.";

  public static final String WITHDRAW_PROMPT =
      "Введите <b>адрес на который совершится вывод</b> USDT TRC-20 (TRON-адрес).";
  public static final String WITHDRAW_INVALID_ADDRESS =
      "Неправильный адрес TRON.\n"
          + "Пример формата: <b>TKTgEtjonYPdCWDs7bUb9dUUwYikceDabx</b>\n"
          + "Отправь адрес ещё раз.";
  public static final String WITHDRAW_BELOW_MINIMUM =
      "❕ Сумма к выводу меньше допустимого минимума. "
          + "Совершайте вывод когда сумма будет превышать порог.";
  public static final String WITHDRAW_FAILED =
      "❌ Не удалось выполнить вывод. Обратитесь в техподдержку.";

  private static final String NOT_YET_AVAILABLE = "Будет доступно позже.";
  private static final String DASH = "—";
  private static final DateTimeFormatter SHORT_DATE_TIME =
      DateTimeFormatter.ofPattern("dd.MM HH:mm", Locale.ROOT);

  private static final Map<String, String> STATUS_RU =
      Map.of(
          "pending", "Ожидает оплаты",
          "paid", "Оплачен",
          "underpaid", "Недооплачен",
          "expired", "Просрочен",
          "closed", "Закрыт",
          "error", "Ошибка");

  private MessageTemplates() {}

  public static String merchantSummary(JsonNode info) {
    return "💵 Баланс: <b>"
        + balance(info.path("balance"))
        + " USDT</b>\n\n"
        + "📅 Оплаченные платежи за сегодня: <b>"
        + textOr(info.path("paid_payments_today"), NOT_YET_AVAILABLE)
        + "</b>\n"
        + "✅ Оплаченные платежи за все время: <b>"
        + textOr(info.path("paid_payments_total"), NOT_YET_AVAILABLE)
        + "</b>";
  }

  public static String paymentsList(JsonNode history, List<JsonNode> payments) {
    List<String> blocks = new ArrayList<>();
    for (JsonNode payment : payments) {
      blocks.add(paymentBlock(payment));
    }
    return "Последние "
        + textOr(history.path("count"), "?")
        + " платежей (Без закрытых):\n\n"
        + String.join("\n\n", blocks);
  }

  static String paymentBlock(JsonNode p) {
    return String.join(
        "\n",
        "<i>ID</i>: <code>" + textOr(p.path("id"), DASH) + "</code>",
        "<i>Статус</i>: <b>" + statusRu(p.path("status").asText(null)) + "</b>",
        "<i>Адрес</i>: <code>" + textOr(p.path("tron_address"), DASH) + "</code>",
        "<i>Создан</i>: <b>"
            + shortDateTime(p.path("created_at"))
            + "</b>  •  До: <b>"
            + shortDateTime(p.path("expires_at"))
            + "</b>",
        "Сумма: <b>"
            + textOr(p.path("amount"), "-")
            + "</b>  •  <i>К оплате</i>: <b>"
            + textOr(p.path("amount_to_pay"), "-")
            + "</b>  •  <i>Оплачено</i>: <b>"
            + textOr(p.path("amount_paid"), "-")
            + "</b>");
  }

  public static String paymentDetails(JsonNode p) {
    if ("closed".equals(p.path("status").asText(null))) {
      return "Платеж <b>закрыт</b>";
    }

    StringBuilder sb = new StringBuilder();
    sb.append("<b>Платёж</b>\n");
    sb.append("<i>ID</i>: <code>").append(textOr(p.path("id"), DASH)).append("</code>\n");
    String status = statusRu(p.path("status").asText(null));
    sb.append("<i>Статус</i>: <b>").append(status).append("</b>\n");
    String address = textOr(p.path("tron_address"), DASH);
    sb.append("<i>Адрес</i>: <code>").append(address).append("</code>\n");
    sb.append("⏱️ <i>Создан</i>: <b>").append(shortDateTime(p.path("created_at"))).append("</b>\n");
    String expires = shortDateTime(p.path("expires_at"));
    sb.append("⌛️ <i>Истекает</i>: <b>").append(expires).append("</b>\n");
    if (present(p.path("amount"))) {
      sb.append("<i>Сумма</i>: <b>").append(escape(p.path("amount").asText())).append("</b>\n");
    }
    List<String> amounts = new ArrayList<>();
    if (present(p.path("amount_to_pay"))) {
      amounts.add("<i>К оплате</i>: <b>" + escape(p.path("amount_to_pay").asText()) + "</b>");
    }
    if (present(p.path("amount_paid"))) {
      amounts.add("<i>Оплачено</i>: <b>" + escape(p.path("amount_paid").asText()) + "</b>");
    }
    sb.append(String.join("  •  ", amounts)).append("\n");
    String meta = metadata(p.path("metadata"));
    sb.append("<i>Метаданные</i>: <code>").append(meta).append("</code>\n\n");

    JsonNode deposits = p.path("deposits");
    List<String> lines = new ArrayList<>();
    if (deposits.isArray()) {
      for (JsonNode d : deposits) {
        if (!d.isObject()) continue;
        lines.add(
            "• <i>ID</i>: <code>"
                + textOr(d.path("id"), DASH)
                + "</code>  •  ⏱️: <b>"
                + shortDateTime(d.path("created_at"))
                + "</b>\n  💵: <b>"
                + textOr(d.path("amount"), DASH)
                + " USDT</b>\n  <i>TXID</i>: <code>"
                + textOr(d.path("txid"), DASH)
                + "</code>");
      }
    }
    sb.append("📥 <b>Депозиты (").append(deposits.isArray() ? deposits.size() : 0).append(")</b>\n");
    sb.append(lines.isEmpty() ? DASH : String.join("\n", lines));
    return sb.toString();
  }

  public static String paymentNotFound(String query) {
    return "Платеж <b>" + escape(query) + "</b> не найден.";
  }

  public static String requestFailed(int status, String payload) {
    return REQUEST_FAILED + ": " + status + "\nОтвет:\n" + escape(payload);
  }

  public static String withdrawalCreated(String toAddress) {
    return "✅ Вывод успешно создан. Ожидайте пополнение на "
        + escape(toAddress)
        + " <b>(не дольше часа)</b>.";
  }

  public static String depositNotification(DepositNotification n) {
    return "💸 Новый депозит.\n\n"
        + "Адрес: <code><b>"
        + escape(n.address())
        + "</b></code>\n"
        + "Сумма: <b><i>"
        + escape(n.amount())
        + "</i></b>\n\n"
        + "Статус платежа: "
        + statusRu(n.newStatus());
  }

  public static String statusRu(String status) {
    if (status == null || status.isBlank()) {
      return "Неизвестно";
    }
    String s = status.toLowerCase(Locale.ROOT);
    return escape(STATUS_RU.getOrDefault(s, s));
  }

  static String shortDateTime(JsonNode value) {
    if (!present(value) || value.asText().isBlank()) {
      return DASH;
    }
    String raw = value.asText();
    try {
      return SHORT_DATE_TIME.format(OffsetDateTime.parse(raw));
    } catch (DateTimeParseException e) {
      try {
        return SHORT_DATE_TIME.format(LocalDateTime.parse(raw));
      } catch (DateTimeParseException ignored) {
        return escape(raw);
      }
    }
  }

  private static String balance(JsonNode value) {
    String raw = present(value) ? value.asText() : "0";
    try {
      return new BigDecimal(raw.trim()).setScale(4, RoundingMode.HALF_UP).toPlainString();
    } catch (NumberFormatException e) {
      return escape(raw);
    }
  }

  private static String metadata(JsonNode metadata) {
    if (!present(metadata)) {
      return DASH;
    }
    if (metadata.isObject()) {
      if (metadata.isEmpty()) {
        return DASH;
      }
      List<String> pairs = new ArrayList<>();
      metadata.fields().forEachRemaining(e -> pairs.add(e.getKey() + "=" + e.getValue().asText()));
      return escape(String.join(", ", pairs));
    }
    return escape(metadata.isTextual() ? metadata.asText() : metadata.toString());
  }

  private static String textOr(JsonNode value, String fallback) {
    return present(value) ? escape(value.asText()) : fallback;
  }

  private static boolean present(JsonNode value) {
    return value != null && !value.isMissingNode() && !value.isNull();
  }

  public static String escape(String value) {
    return value == null ? "" : HtmlUtils.htmlEscape(value, "UTF-8");
  }
}
