package io.github.drompincen.lumenta.runtime.provider;

public record CallReceipt(
        String callId,
        String status
) {}
