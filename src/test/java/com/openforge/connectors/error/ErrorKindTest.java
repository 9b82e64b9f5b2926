package com.openforge.connectors.error;

import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorKindTest {

    @Test
    void codeIsLowerSnakeCaseRegardlessOfDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertThat(ErrorKind.CREDENTIAL_NOT_FOUND.code()).isEqualTo("credential_not_found");
            assertThat(ErrorKind.TOOL_LOOP_FATAL.code()).isEqualTo("tool_loop_fatal");
        } finally {
            Locale.setDefault(previous);
        }
    }
}
