package com.refgraph.core.document;

import org.junit.jupiter.api.Test;

import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link TextDecoding}.
 */
class TextDecodingTest {

    @Test
    void decode_utf8_isPreferred() throws CharacterCodingException {
        assertThat(TextDecoding.decode("Задвижка".getBytes(StandardCharsets.UTF_8))).isEqualTo("Задвижка");
    }

    @Test
    void decode_windows1251_isFallback() throws CharacterCodingException {
        assertThat(TextDecoding.decode("Задвижка".getBytes(Charset.forName("windows-1251")))).isEqualTo("Задвижка");
    }

    @Test
    void decodeStrict_malformedInput_throws() {
        byte[] invalidUtf8 = {(byte) 0xC3, (byte) 0x28};

        assertThatThrownBy(() -> TextDecoding.decodeStrict(invalidUtf8, StandardCharsets.UTF_8))
            .isInstanceOf(CharacterCodingException.class);
    }
}
