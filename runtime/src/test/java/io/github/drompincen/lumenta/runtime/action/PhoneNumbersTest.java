package io.github.drompincen.lumenta.runtime.action;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PhoneNumbersTest {

    @Test
    void tenDigitsGetNorthAmericanPrefix() {
        assertThat(PhoneNumbers.normalize("408-306-6734")).isEqualTo("+14083066734");
        assertThat(PhoneNumbers.normalize("(408) 306 6734")).isEqualTo("+14083066734");
    }

    @Test
    void otherLengthsGetBarePlus() {
        assertThat(PhoneNumbers.normalize("44 20 7946 0958")).isEqualTo("+442079460958");
    }

    @Test
    void numbersWithCountryCodePassThroughTrimmed() {
        assertThat(PhoneNumbers.normalize("  +1-555-123-4567 ")).isEqualTo("+1-555-123-4567");
    }

    @Test
    void textIsLeftAlone() {
        assertThat(PhoneNumbers.normalize("call security")).isEqualTo("call security");
    }
}
