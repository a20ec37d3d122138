package io.github.drompincen.lumenta.runtime.action;

import java.util.regex.Pattern;

final class PhoneNumbers {

    private static final Pattern LOCAL_FORMAT = Pattern.compile("[\\d\\s\\-()]+");

    private PhoneNumbers() {}

    /**
     * Adds a country code to numbers written without one: ten digits are taken as North American,
     * anything else gets a bare {@code +}. Numbers with a {@code +} or with letters pass through trimmed.
     */
    static String normalize(String raw) {
        String trimmed = raw.trim();
        if (trimmed.startsWith("+") || !LOCAL_FORMAT.matcher(trimmed).matches()) {
            return trimmed;
        }
        String digits = trimmed.replaceAll("\\D", "");
        return digits.length() == 10 ? "+1" + digits : "+" + digits;
    }
}
