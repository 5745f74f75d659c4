package ai.refgraph.analyzer;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.jetbrains.annotations.Nullable;

/**
 * A file's text with line and offset bookkeeping. Tree-sitter reports UTF-8 byte offsets while edits and columns are
 * expressed in Java chars, so the byte-to-char table is built once per parse instead of re-encoding the source for
 * every node.
 */
public final class SourceText {
    private final String text;
    private final int[] lineStarts;
    private byte @Nullable [] bytes;
    private int @Nullable [] byteToChar;

    public SourceText(String text) {
        this.text = text;
        int count = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n' && i + 1 < text.length()) {
                count++;
            }
        }
        lineStarts = new int[count];
        int line = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n' && i + 1 < text.length()) {
                lineStarts[line++] = i + 1;
            }
        }
    }

    public String text() {
        return text;
    }

    public int lineCount() {
        return text.isEmpty() ? 0 : lineStarts.length;
    }

    /** Char offset of the first character of a 1-based line. */
    public int lineStart(int line) {
        return lineStarts[line - 1];
    }

    /** The 1-based line's text without its terminator. */
    public String line(int line) {
        if (line < 1 || line > lineCount()) {
            return "";
        }
        int start = lineStarts[line - 1];
        int end = line < lineStarts.length ? lineStarts[line] : text.length();
        while (end > start && (text.charAt(end - 1) == '\n' || text.charAt(end - 1) == '\r')) {
            end--;
        }
        return text.substring(start, end);
    }

    /** Lines {@code from..to} inclusive, terminators kept. Out-of-range bounds are clamped. */
    public String lines(int from, int to) {
        int first = Math.max(1, from);
        int last = Math.min(lineCount(), to);
        if (first > last) {
            return "";
        }
        int end = last < lineStarts.length ? lineStarts[last] : text.length();
        return text.substring(lineStarts[first - 1], end);
    }

    /** 1-based line containing the char offset. */
    public int lineOf(int charOffset) {
        int idx = Arrays.binarySearch(lineStarts, charOffset);
        return idx >= 0 ? idx + 1 : -idx - 1;
    }

    public int columnOf(int charOffset) {
        return charOffset - lineStarts[lineOf(charOffset) - 1];
    }

    public int charOffset(int byteOffset) {
        var table = byteTable();
        if (byteOffset <= 0) return 0;
        if (byteOffset >= table.length) return text.length();
        return table[byteOffset];
    }

    /** Text between two UTF-8 byte offsets. */
    public String slice(int startByte, int endByte) {
        if (endByte <= startByte) {
            return "";
        }
        return text.substring(charOffset(startByte), charOffset(endByte));
    }

    public byte[] bytes() {
        if (bytes == null) {
            bytes = text.getBytes(StandardCharsets.UTF_8);
        }
        return bytes;
    }

    private int[] byteTable() {
        if (byteToChar != null) {
            return byteToChar;
        }
        var table = new int[bytes().length + 1];
        int b = 0;
        int c = 0;
        while (c < text.length() && b < table.length - 1) {
            int cp = text.codePointAt(c);
            int width = utf8Width(cp);
            for (int k = 0; k < width && b + k < table.length; k++) {
                table[b + k] = c;
            }
            b += width;
            c += Character.charCount(cp);
        }
        table[table.length - 1] = text.length();
        byteToChar = table;
        return table;
    }

    private static int utf8Width(int cp) {
        if (cp < 0x80 || (cp >= 0xD800 && cp <= 0xDFFF)) return 1; // lone surrogates encode as '?'
        if (cp < 0x800) return 2;
        if (cp < 0x10000) return 3;
        return 4;
    }
}
