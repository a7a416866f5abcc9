package com.refgraph.core.document;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Decodes document bytes, trying UTF-8 first and then the legacy Cyrillic code page.
 *
 * <p>Both decoders are strict: malformed or unmappable input fails instead of being replaced,
 * so a document is never silently corrupted on rewrite.
 */
public final class TextDecoding {

    /**
     * Charsets tried in order.
     */
    public static final List<Charset> FALLBACK_ORDER = List.of(
        StandardCharsets.UTF_8,
        Charset.forName("windows-1251"));

    private TextDecoding() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Decodes bytes with the first charset that accepts them.
     *
     * @param bytes raw bytes
     * @return decoded text
     * @throws CharacterCodingException if no charset accepts the bytes
     */
    public static String decode(byte[] bytes) throws CharacterCodingException {
        CharacterCodingException last = null;
        for (Charset charset : FALLBACK_ORDER) {
            try {
                return decodeStrict(bytes, charset);
            } catch (CharacterCodingException e) {
                last = e;
            }
        }
        throw last;
    }

    static String decodeStrict(byte[] bytes, Charset charset) throws CharacterCodingException {
        return charset.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT)
            .decode(ByteBuffer.wrap(bytes))
            .toString();
    }
}
