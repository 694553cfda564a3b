package com.zenithionpay.merchantbot.model;

public enum ChatEventKind {
  COMMAND,
  CALLBACK,
  TEXT
}
