package com.zenithionpay.merchantbot.model;

import jakarta.validation.constraints.NotBlank;

public record OutgoingMessage(@NotBlank String text, UiHints uiHints) {

  public static OutgoingMessage html(String text) {
    return new OutgoingMessage(text, UiHints.html());
  }

  public OutgoingMessage preferEdit() {
    UiHints hints = uiHints == null ? UiHints.html() : uiHints;
    return new OutgoingMessage(text, hints.withPreferEdit(true));
  }

  public OutgoingMessage withKeyboard(InlineKeyboard keyboard) {
    UiHints hints = uiHints == null ? UiHints.html() : uiHints;
    return new OutgoingMessage(text, hints.withInlineKeyboard(keyboard));
  }

  public InlineKeyboard keyboard() {
    return uiHints == null ? null : uiHints.inlineKeyboard();
  }
}
