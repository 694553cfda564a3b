package com.zenithionpay.merchantbot.render;

import com.zenithionpay.merchantbot.domain.CallbackAction;
import com.zenithionpay.merchantbot.model.InlineKeyboard;
import com.zenithionpay.merchantbot.model.InlineKeyboard.Button;

public final class Keyboards {

  private Keyboards() {}

  public static InlineKeyboard mainMenu() {
    return InlineKeyboard.column(
        new Button("Проверить баланс", CallbackAction.BALANCE.token()),
        new Button("Последние платежи", CallbackAction.PAYMENTS_LAST.token()),
        new Button("Поиск платежа", CallbackAction.CHECK_PAYMENT.token()),
        new Button("Вывести", CallbackAction.WITHDRAW.token()));
  }

  public static InlineKeyboard cancel() {
    return InlineKeyboard.column(new Button("Отмена", CallbackAction.CANCEL.token()));
  }

  public static InlineKeyboard hide() {
    return InlineKeyboard.column(new Button("Скрыть", CallbackAction.DELETE_MESSAGE.token()));
  }
}
