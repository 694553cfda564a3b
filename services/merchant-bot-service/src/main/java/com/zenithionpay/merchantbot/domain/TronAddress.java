package com.zenithionpay.merchantbot.domain;

import java.util.regex.Pattern;

/** Format check for TRON base58 addresses; says nothing about whether the address exists. */
public final class TronAddress {

  private static final Pattern PATTERN = Pattern.compile("^T[1-9A-HJ-NP-Za-km-z]{33}$");

  private TronAddress() {}

  public static boolean isValid(String value) {
    return value != null && PATTERN.matcher(value).matches();
  }
}
