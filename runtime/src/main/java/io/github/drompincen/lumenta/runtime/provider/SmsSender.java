package io.github.drompincen.lumenta.runtime.provider;

public interface SmsSender {

    /**
     * @param to recipient in international format, including the leading {@code +}
     */
    SmsReceipt send(String to, String text);
}
