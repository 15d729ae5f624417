package com.example.relayserver.util.text;

import com.example.relayserver.exception.EncodingUnresolvedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * 按顺序尝试候选编码解码文本导出文件
 *
 * 解码器遇到非法字节直接报错（不替换）；解码成功后还要通过乱码检查
 * （替换字符 U+FFFD、C0/C1 控制字符）以及调用方给出的结构检查，才算解析成功。
 * 全部失败时抛出 EncodingUnresolvedException，不输出乱码。
 */
public class TextDecoder {

    private static final Logger log = LoggerFactory.getLogger(TextDecoder.class);

    public static final List<String> DEFAULT_ENCODINGS = List.of("UTF-8", "windows-1252", "ISO-8859-1");

    private final List<String> encodings;

    public TextDecoder(List<String> encodings) {
        this.encodings = encodings == null || encodings.isEmpty() ? DEFAULT_ENCODINGS : List.copyOf(encodings);
    }

    public List<String> getEncodings() {
        return encodings;
    }

    public DecodedText decode(byte[] bytes, String fileName) throws EncodingUnresolvedException {
        return decode(bytes, fileName, text -> true);
    }

    /**
     * @param structureCheck 解码结果必须满足的结构条件（如存在 [Section] 头）
     */
    public DecodedText decode(byte[] bytes, String fileName, Predicate<String> structureCheck)
            throws EncodingUnresolvedException {
        List<String> tried = new ArrayList<>();
        for (String name : encodings) {
            tried.add(name);
            Charset charset;
            try {
                charset = Charset.forName(name);
            } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                log.warn("不支持的编码 {}，跳过", name);
                continue;
            }

            String text;
            try {
                text = strictDecode(bytes, charset);
            } catch (CharacterCodingException e) {
                log.debug("{} 以 {} 解码失败: {}", fileName, name, e.getMessage());
                continue;
            }

            if (looksCorrupted(text)) {
                log.debug("{} 以 {} 解码后含乱码字符", fileName, name);
                continue;
            }
            if (!structureCheck.test(text)) {
                log.debug("{} 以 {} 解码后结构不完整", fileName, name);
                continue;
            }

            log.debug("{} 编码确定为 {}", fileName, name);
            return new DecodedText(text, charset.name());
        }
        throw new EncodingUnresolvedException(fileName, tried);
    }

    private static String strictDecode(byte[] bytes, Charset charset) throws CharacterCodingException {
        CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        String text = decoder.decode(ByteBuffer.wrap(bytes)).toString();
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        return text;
    }

    /**
     * 替换字符或非空白控制字符
     */
    static boolean looksCorrupted(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\uFFFD') {
                return true;
            }
            if (c == '\t' || c == '\n' || c == '\r' || c == '\f') {
                continue;
            }
            if (c < 0x20 || (c >= 0x7F && c <= 0x9F)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 解码结果
     */
    public static class DecodedText {

        private final String text;
        private final String encoding;

        public DecodedText(String text, String encoding) {
            this.text = text;
            this.encoding = encoding;
        }

        public String getText() {
            return text;
        }

        public String getEncoding() {
            return encoding;
        }

        public List<String> getLines() {
            return List.of(text.split("\\r?\\n|\\r", -1));
        }
    }
}
