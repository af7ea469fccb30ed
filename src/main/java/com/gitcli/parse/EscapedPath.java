package com.gitcli.parse;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Decodes the C-style quoting git applies to unusual path names.
 *
 * <p>Octal escapes ({@code \342\230\240}) each carry one raw byte; consecutive bytes are collected
 * first and decoded as UTF-8 together so multi-byte characters come out whole. Backslashes that do
 * not start a known escape are kept literally.
 */
public final class EscapedPath {

    private EscapedPath() {
    }

    /**
     * Unescapes {@code token} when git wrapped it in double quotes, otherwise returns it unchanged.
     */
    public static String unescapeIfQuoted(String token) {
        if (token != null && token.length() >= 2 && token.startsWith("\"") && token.endsWith("\"")) {
            return unescape(token.substring(1, token.length() - 1));
        }
        return token;
    }

    /**
     * Unescapes the content of a quoted path, without its surrounding quotes.
     */
    public static String unescape(String escaped) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(escaped.length());
        int i = 0;
        while (i < escaped.length()) {
            char c = escaped.charAt(i);
            if (c == '\\' && i + 1 < escaped.length()) {
                char next = escaped.charAt(i + 1);
                if (isOctalDigit(next)) {
                    int end = i + 1;
                    int value = 0;
                    while (end < escaped.length() && end < i + 4 && isOctalDigit(escaped.charAt(end))) {
                        value = value * 8 + (escaped.charAt(end) - '0');
                        end++;
                    }
                    bytes.write(value & 0xFF);
                    i = end;
                    continue;
                }
                int unescaped = unescapeChar(next);
                if (unescaped >= 0) {
                    bytes.write(unescaped);
                    i += 2;
                    continue;
                }
            }
            int codePoint = escaped.codePointAt(i);
            bytes.writeBytes(new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8));
            i += Character.charCount(codePoint);
        }
        return bytes.toString(StandardCharsets.UTF_8);
    }

    private static boolean isOctalDigit(char c) {
        return c >= '0' && c <= '7';
    }

    private static int unescapeChar(char c) {
        return switch (c) {
            case 'a' -> 0x07;
            case 'b' -> 0x08;
            case 't' -> 0x09;
            case 'n' -> 0x0a;
            case 'v' -> 0x0b;
            case 'f' -> 0x0c;
            case 'r' -> 0x0d;
            case 'e' -> 0x1b;
            case '\\' -> 0x5c;
            case '"' -> 0x22;
            case '\'' -> 0x27;
            default -> -1;
        };
    }
}
