/**
 * Decodes HTML bytes from sites that frequently are not UTF-8
 *
 * @author William Callahan
 *
 * Features:
 * - Tries the charset from the Content-Type header first
 * - Then a charset sniffed from a meta tag in the first 2 KB
 * - Then a fixed list of common encodings, each decoded strictly
 * - Finally UTF-8 with replacement characters
 */
package com.williamcallahan.boxhunt.service.crawler;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
@Slf4j
public class HtmlCharsetDecoder {

    static final int SNIFF_WINDOW_BYTES = 2048;
    static final List<String> FALLBACK_CHARSETS =
        List.of("UTF-8", "GB18030", "Big5", "Shift_JIS", "EUC-KR", "windows-1252");

    private static final Pattern CHARSET_PATTERN =
        Pattern.compile("charset\\s*=\\s*[\"']?([A-Za-z0-9_\\-:.]+)", Pattern.CASE_INSENSITIVE);

    public String decode(byte[] body, String contentType) {
        if (body == null || body.length == 0) {
            return "";
        }

        Optional<String> fromHeader = charsetFromText(contentType);
        if (fromHeader.isPresent()) {
            Optional<String> decoded = decodeStrict(body, fromHeader.get());
            if (decoded.isPresent()) {
                return decoded.get();
            }
            log.debug("Declared charset {} did not decode cleanly", fromHeader.get());
        }

        int window = Math.min(body.length, SNIFF_WINDOW_BYTES);
        Optional<String> sniffed = charsetFromText(new String(body, 0, window, StandardCharsets.ISO_8859_1));
        if (sniffed.isPresent()) {
            Optional<String> decoded = decodeStrict(body, sniffed.get());
            if (decoded.isPresent()) {
                return decoded.get();
            }
            log.debug("Sniffed charset {} did not decode cleanly", sniffed.get());
        }

        for (String charsetName : FALLBACK_CHARSETS) {
            Optional<String> decoded = decodeStrict(body, charsetName);
            if (decoded.isPresent()) {
                return decoded.get();
            }
        }

        log.debug("No charset decoded cleanly; falling back to lossy UTF-8");
        return new String(body, StandardCharsets.UTF_8);
    }

    static Optional<String> charsetFromText(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = CHARSET_PATTERN.matcher(text);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    private static Optional<String> decodeStrict(byte[] body, String charsetName) {
        Charset charset;
        try {
            charset = Charset.forName(charsetName);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            return Optional.empty();
        }
        try {
            return Optional.of(charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(body))
                .toString());
        } catch (CharacterCodingException e) {
            return Optional.empty();
        }
    }
}
