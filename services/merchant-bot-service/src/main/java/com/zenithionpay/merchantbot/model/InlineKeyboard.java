package com.zenithionpay.merchantbot.model;

import java.util.Arrays;
import java.util.List;

public record InlineKeyboard(List<List<Button>> rows) {

  /** One button per row. */
  public static InlineKeyboard column(Button... buttons) {
    return new InlineKeyboard(Arrays.stream(buttons).map(List::of).toList());
  }

  public record Button(String text, String callbackData) {}
}
