package io.github.drompincen.lumenta.runtime.provider;

public record SmsReceipt(
        String messageId,
        String recipient,
        String from,
        String status,
        String remainingBalance
) {}
