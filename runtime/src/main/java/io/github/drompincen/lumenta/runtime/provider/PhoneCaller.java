package io.github.drompincen.lumenta.runtime.provider;

public interface PhoneCaller {

    /**
     * Places an outbound assistant call.
     *
     * @param assistantId overrides the configured assistant when non-null
     */
    CallReceipt call(String to, String assistantId);
}
