package io.github.drompincen.lumenta.runtime.provider;

public interface EmailSender {

    EmailReceipt send(EmailMessage message);
}
