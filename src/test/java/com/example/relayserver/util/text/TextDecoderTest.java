package com.example.relayserver.util.text;

import com.example.relayserver.exception.EncodingUnresolvedException;
import com.example.relayserver.model.ReviewReason;
import org.junit.jupiter.api.Test;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextDecoderTest {

    private final TextDecoder decoder = new TextDecoder(null);

    @Test
    void decodesUtf8First() throws Exception {
        byte[] bytes = "0104: Réglage courant: 1,5 A".getBytes(StandardCharsets.UTF_8);

        TextDecoder.DecodedText decoded = decoder.decode(bytes, "p143.txt");

        assertThat(decoded.getEncoding()).isEqualTo("UTF-8");
        assertThat(decoded.getText()).contains("Réglage");
    }

    @Test
    void fallsBackToWindows1252() throws Exception {
        byte[] bytes = "[Protection50]\nlibelle=Réglage €".getBytes(Charset.forName("windows-1252"));

        TextDecoder.DecodedText decoded = decoder.decode(bytes, "relay.S40");

        assertThat(decoded.getEncoding()).isEqualTo("windows-1252");
        assertThat(decoded.getText()).contains("Réglage €");
        assertThat(decoded.getLines()).containsExactly("[Protection50]", "libelle=Réglage €");
    }

    @Test
    void rejectsControlCharactersFromLatin1() {
        // 0x80 在 ISO-8859-1 中是 C1 控制字符
        byte[] bytes = {'A', (byte) 0x80, 'B'};
        TextDecoder strict = new TextDecoder(List.of("UTF-8", "ISO-8859-1"));

        assertThatThrownBy(() -> strict.decode(bytes, "broken.txt"))
                .isInstanceOf(EncodingUnresolvedException.class)
                .satisfies(e -> assertThat(((EncodingUnresolvedException) e).getReason())
                        .isEqualTo(ReviewReason.ENCODING_UNRESOLVED));
    }

    @Test
    void structureCheckMustPass() {
        byte[] bytes = "repere=52-MF-02A".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> decoder.decode(bytes, "relay.S40", KeyedSectionParser::hasSectionHeader))
                .isInstanceOf(EncodingUnresolvedException.class);
    }

    @Test
    void stripsByteOrderMark() throws Exception {
        byte[] body = "[Identification]\r\nrepere=52-MF-02A".getBytes(StandardCharsets.UTF_8);
        byte[] bytes = new byte[body.length + 3];
        bytes[0] = (byte) 0xEF;
        bytes[1] = (byte) 0xBB;
        bytes[2] = (byte) 0xBF;
        System.arraycopy(body, 0, bytes, 3, body.length);

        TextDecoder.DecodedText decoded = decoder.decode(bytes, "relay.S40", KeyedSectionParser::hasSectionHeader);

        assertThat(decoded.getText()).startsWith("[Identification]");
        assertThat(decoded.getLines()).containsExactly("[Identification]", "repere=52-MF-02A");
    }

    @Test
    void skipsUnsupportedCharsetNames() throws Exception {
        TextDecoder custom = new TextDecoder(List.of("x-no-such-charset", "UTF-8"));

        assertThat(custom.decode("ok".getBytes(StandardCharsets.UTF_8), "a.txt").getEncoding()).isEqualTo("UTF-8");
    }

    @Test
    void tabsAndNewlinesAreNotCorruption() {
        assertThat(TextDecoder.looksCorrupted("a\tb\r\nc\f")).isFalse();
        assertThat(TextDecoder.looksCorrupted("a\u0001b")).isTrue();
        assertThat(TextDecoder.looksCorrupted("a\uFFFDb")).isTrue();
    }
}
