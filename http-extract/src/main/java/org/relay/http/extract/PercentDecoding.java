package org.relay.http.extract;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Percent-decoding of path capture values.
 * <p>
 * Unlike form decoding, {@code +} stays a plus sign. A {@code %} not followed by two hex digits
 * is kept literally. The decoded bytes must form valid UTF-8, and unescaped characters must not
 * contain unpaired surrogates.
 */
final class PercentDecoding {
    private PercentDecoding() {}

    /**
     * Decode value, or return empty if the decoded bytes are not valid UTF-8.
     */
    static Optional<String> decode(String raw) {
        var encoder = StandardCharsets.UTF_8.newEncoder()
                                            .onMalformedInput(CodingErrorAction.REPORT)
                                            .onUnmappableCharacter(CodingErrorAction.REPORT);
        var bytes = new ByteArrayOutputStream(raw.length());
        var i = 0;

        try {
            while (i < raw.length()) {
                var c = raw.charAt(i);

                if (c == '%' && i + 2 < raw.length()) {
                    var high = hexValue(raw.charAt(i + 1));
                    var low = hexValue(raw.charAt(i + 2));

                    if (high >= 0 && low >= 0) {
                        bytes.write((high << 4) | low);
                        i += 3;
                        continue;
                    }
                }

                if (c < 0x80) {
                    bytes.write(c);
                    i++;
                } else {
                    var end = i + 1;
                    while (end < raw.length() && raw.charAt(end) >= 0x80) {
                        end++;
                    }
                    bytes.writeBytes(encode(encoder, raw, i, end));
                    i = end;
                }
            }
        } catch (CharacterCodingException e) {
            return Optional.empty();
        }

        var decoder = StandardCharsets.UTF_8.newDecoder()
                                            .onMalformedInput(CodingErrorAction.REPORT)
                                            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return Optional.of(decoder.decode(ByteBuffer.wrap(bytes.toByteArray())).toString());
        } catch (CharacterCodingException e) {
            return Optional.empty();
        }
    }

    private static byte[] encode(CharsetEncoder encoder, String raw, int start, int end)
            throws CharacterCodingException {
        var buffer = encoder.reset().encode(CharBuffer.wrap(raw, start, end));
        var result = new byte[buffer.remaining()];
        buffer.get(result);
        return result;
    }

    private static int hexValue(char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'a' && c <= 'f') {
            return c - 'a' + 10;
        }
        if (c >= 'A' && c <= 'F') {
            return c - 'A' + 10;
        }
        return -1;
    }
}
