package com.zenithionpay.merchantbot.model;

public record DepositNotification(
    String address, String amount, String newStatus, String merchantCredential) {}
