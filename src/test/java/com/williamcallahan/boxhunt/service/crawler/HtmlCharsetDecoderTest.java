package com.williamcallahan.boxhunt.service.crawler;

import org.junit.jupiter.api.Test;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class HtmlCharsetDecoderTest {

    private final HtmlCharsetDecoder decoder = new HtmlCharsetDecoder();

    @Test
    void usesCharsetFromContentTypeHeader() {
        String html = "<html><body><p>纸箱</p></body></html>";
        byte[] body = html.getBytes(Charset.forName("GBK"));

        assertThat(decoder.decode(body, "text/html; charset=GBK")).isEqualTo(html);
    }

    @Test
    void sniffsMetaCharsetWhenHeaderIsSilent() {
        String html = "<html><head><meta charset=\"Big5\"></head><body>紙箱</body></html>";
        byte[] body = html.getBytes(Charset.forName("Big5"));

        assertThat(decoder.decode(body, "text/html")).isEqualTo(html);
    }

    @Test
    void sniffsHttpEquivContentType() {
        String html = "<html><head><meta http-equiv=\"Content-Type\" content=\"text/html; charset=Shift_JIS\"></head>"
            + "<body>段ボール箱</body></html>";
        byte[] body = html.getBytes(Charset.forName("Shift_JIS"));

        assertThat(decoder.decode(body, "")).isEqualTo(html);
    }

    @Test
    void wrongDeclaredCharsetFallsThroughToUtf8() {
        String html = "<html><body>Umzugskarton für Bücher</body></html>";
        byte[] body = html.getBytes(StandardCharsets.UTF_8);

        assertThat(decoder.decode(body, "text/html; charset=us-ascii")).isEqualTo(html);
    }

    @Test
    void unknownCharsetNameIsIgnored() {
        byte[] body = "<p>box</p>".getBytes(StandardCharsets.UTF_8);

        assertThat(decoder.decode(body, "text/html; charset=no-such-charset")).isEqualTo("<p>box</p>");
    }

    @Test
    void legacyBytesDecodeThroughFallbackList() {
        String text = "纸箱和包装盒";
        byte[] body = text.getBytes(Charset.forName("GB18030"));

        assertThat(decoder.decode(body, null)).isEqualTo(text);
    }

    @Test
    void emptyBodyDecodesToEmptyString() {
        assertThat(decoder.decode(new byte[0], "text/html")).isEmpty();
        assertThat(decoder.decode(null, null)).isEmpty();
    }

    @Test
    void extractsCharsetToken() {
        assertThat(HtmlCharsetDecoder.charsetFromText("text/html; Charset='ISO-8859-1'")).contains("ISO-8859-1");
        assertThat(HtmlCharsetDecoder.charsetFromText("text/html")).isEmpty();
    }
}
