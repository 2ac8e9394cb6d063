package com.phillippitts.feedercontrol.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void truncatesLongInput() {
        assertThat(LogSanitizer.truncate("feeder:start:50,3,5", 6)).isEqualTo("feeder");
        assertThat(LogSanitizer.truncate("ok", 6)).isEqualTo("ok");
    }

    @Test
    void nullAndNonPositiveMaxYieldEmpty() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.truncate("abc", 0)).isEmpty();
    }

    @Test
    void printableReplacesControlCharacters() {
        assertThat(LogSanitizer.printable("temp:25\r\n\u0000", 20)).isEqualTo("temp:25???");
    }
}
