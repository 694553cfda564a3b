package com.zenithionpay.merchantbot.domain;

import java.util.Arrays;
import java.util.List;

/**
 * Compact callback tokens carried on inline buttons: {@code name} or {@code name:arg1:arg2}.
 *
 * <p>Arguments are not escaped, so an argument must not contain {@link #SEPARATOR}.
 */
public final class CallbackCodec {

  public static final String SEPARATOR = ":";

  private CallbackCodec() {}

  public static String encode(String name, String... args) {
    if (args == null || args.length == 0) {
      return name;
    }
    return name + SEPARATOR + String.join(SEPARATOR, args);
  }

  /** Never fails: a null or empty token decodes to an empty name with no arguments. */
  public static DecodedCallback decode(String token) {
    if (token == null || token.isEmpty()) {
      return new DecodedCallback("", List.of());
    }
    String[] parts = token.split(SEPARATOR, -1);
    List<String> args = List.copyOf(Arrays.asList(parts).subList(1, parts.length));
    return new DecodedCallback(parts[0], args);
  }

  public static boolean isAction(String token, String name) {
    return (token == null ? "" : token).equals(name);
  }

  public static boolean hasActionPrefix(String token, String name) {
    String data = token == null ? "" : token;
    return data.equals(name) || data.startsWith(name + SEPARATOR);
  }

  public record DecodedCallback(String name, List<String> args) {}
}
