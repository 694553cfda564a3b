package com.zenithionpay.merchantbot.model;

public record UiHints(boolean preferEdit, String parseModeHint, InlineKeyboard inlineKeyboard) {

  public static final String HTML = "HTML";

  public static UiHints html() {
    return new UiHints(false, HTML, null);
  }

  public UiHints withPreferEdit(boolean value) {
    return new UiHints(value, parseModeHint, inlineKeyboard);
  }

  public UiHints withInlineKeyboard(InlineKeyboard keyboard) {
    return new UiHints(preferEdit, parseModeHint, keyboard);
  }
}
