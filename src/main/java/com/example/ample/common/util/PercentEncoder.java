package com.example.ample.common.util;

import java.nio.charset.StandardCharsets;

/**
 * RFC 3986 percent-encoding as LastFM expects it for query-string and form values.
 * <p>
 * {@code [A-Za-z0-9]} and {@code - _ ~ .} pass through; every other character is written as one
 * lowercase {@code %xx} pair per UTF-8 byte.
 */
public final class PercentEncoder {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private PercentEncoder() {
    }

    public static String encode(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length() + 16);
        int i = 0;
        while (i < value.length()) {
            int codePoint = value.codePointAt(i);
            int charCount = Character.charCount(codePoint);
            if (isUnreserved(codePoint)) {
                sb.append((char) codePoint);
            } else {
                byte[] bytes = value.substring(i, i + charCount).getBytes(StandardCharsets.UTF_8);
                for (byte b : bytes) {
                    sb.append('%');
                    sb.append(HEX[(b >> 4) & 0x0f]);
                    sb.append(HEX[b & 0x0f]);
                }
            }
            i += charCount;
        }
        return sb.toString();
    }

    static boolean isUnreserved(int codePoint) {
        return (codePoint >= 'a' && codePoint <= 'z')
                || (codePoint >= 'A' && codePoint <= 'Z')
                || (codePoint >= '0' && codePoint <= '9')
                || codePoint == '-'
                || codePoint == '_'
                || codePoint == '~'
                || codePoint == '.';
    }
}
