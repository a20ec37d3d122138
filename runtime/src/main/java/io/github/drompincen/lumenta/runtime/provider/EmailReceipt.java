package io.github.drompincen.lumenta.runtime.provider;

/**
 * {@code defaultSenderUsed} is set when the requested sender domain was unverified and the
 * provider's shared sender was used instead.
 */
public record EmailReceipt(
        String messageId,
        String from,
        boolean defaultSenderUsed
) {}
