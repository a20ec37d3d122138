package io.github.drompincen.lumenta.runtime.provider;

/**
 * {@code from} may be null, in which case the sender's configured or default address is used.
 */
public record EmailMessage(
        String from,
        String to,
        String subject,
        String html,
        String text
) {}
