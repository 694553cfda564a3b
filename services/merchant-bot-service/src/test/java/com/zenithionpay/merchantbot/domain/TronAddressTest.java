package com.zenithionpay.merchantbot.domain;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TronAddressTest {

  @Test
  void acceptsWellFormedAddress() {
    assertThat(TronAddress.isValid("TKTgEtjonYPdCWDs7bUb9dUUwYikceDabx")).isTrue();
  }

  @Test
  void rejectsMalformedInput() {
    // wrong prefix
    assertThat(TronAddress.isValid("AKTgEtjonYPdCWDs7bUb9dUUwYikceDabx")).isFalse();
    // too short / too long
    assertThat(TronAddress.isValid("TKTgEtjonYPdCWDs7bUb9dUUwYikceDab")).isFalse();
    assertThat(TronAddress.isValid("TKTgEtjonYPdCWDs7bUb9dUUwYikceDabxx")).isFalse();
    // 0, O, I and l are not in the base58 alphabet
    assertThat(TronAddress.isValid("TKTgEtjonYPdCWDs7bUb9dUUwYikceDab0")).isFalse();
    assertThat(TronAddress.isValid("TKTgEtjonYPdCWDs7bUb9dUUwYikceDabO")).isFalse();
    assertThat(TronAddress.isValid("TKTgEtjonYPdCWDs7bUb9dUUwYikceDabI")).isFalse();
    assertThat(TronAddress.isValid("TKTgEtjonYPdCWDs7bUb9dUUwYikceDabl")).isFalse();
    assertThat(TronAddress.isValid("")).isFalse();
    assertThat(TronAddress.isValid(null)).isFalse();
  }
}
