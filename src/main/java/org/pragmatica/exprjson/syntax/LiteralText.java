package org.pragmatica.exprjson.syntax;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/**
 * Decoding of literal source text. Every method takes the literal body (source form without suffix)
 * and throws {@link IllegalArgumentException} with a readable reason when the body is malformed.
 */
public final class LiteralText {
    private static final int MAX_ASCII = 0x7F;
    private static final int MAX_BYTE = 0xFF;
    private static final int MAX_UNICODE_DIGITS = 6;

    private LiteralText() {}

    /**
     * {@code "text"} or {@code r#"text"#}.
     */
    public static String decodeString(String body) {
        if (body.startsWith("r")) {
            return rawContent(body, 1);
        }
        return unescapeText(quotedContent(body, 0, '"'), false);
    }

    /**
     * {@code 'c'}.
     */
    public static String decodeChar(String body) {
        var decoded = unescapeText(quotedContent(body, 0, '\''), true);
        if (decoded.codePointCount(0, decoded.length()) != 1) {
            throw new IllegalArgumentException("character literal must contain exactly one character");
        }
        return decoded;
    }

    /**
     * {@code b"bytes"} or {@code br#"bytes"#}.
     */
    public static byte[] decodeByteString(String body) {
        if (body.startsWith("br")) {
            var content = rawContent(body, 2);
            requireAscii(content, "raw byte string");
            return content.getBytes(StandardCharsets.ISO_8859_1);
        }
        return unescapeBytes(quotedContent(body, 1, '"'), false);
    }

    /**
     * {@code b'c'}.
     */
    public static int decodeByte(String body) {
        var bytes = unescapeBytes(quotedContent(body, 1, '\''), false);
        if (bytes.length != 1) {
            throw new IllegalArgumentException("byte literal must contain exactly one byte");
        }
        return bytes[0] & MAX_BYTE;
    }

    /**
     * {@code c"text"} or {@code cr#"text"#}, without the implicit terminating nul.
     */
    public static byte[] decodeCString(String body) {
        byte[] bytes;
        if (body.startsWith("cr")) {
            bytes = rawContent(body, 2).getBytes(StandardCharsets.UTF_8);
        } else {
            bytes = unescapeBytes(quotedContent(body, 1, '"'), true);
        }
        for (var b : bytes) {
            if (b == 0) {
                throw new IllegalArgumentException("C string literal cannot contain a nul byte");
            }
        }
        return bytes;
    }

    /**
     * Base-10 digits of an integer literal. Underscores are dropped and other radixes are rewritten
     * with exact arithmetic, so arbitrarily long literals keep every digit.
     */
    public static String integerDigits(String body) {
        var clean = body.replace("_", "");
        var radix = radixOf(clean);
        var digits = radix == 10
                     ? clean
                     : clean.substring(2);
        if (digits.isEmpty()) {
            throw new IllegalArgumentException("integer literal has no digits");
        }
        try {
            return new BigInteger(digits, radix).toString();
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid digit for a base " + radix + " literal", e);
        }
    }

    /**
     * Digits of a float literal as written, minus underscores.
     */
    public static String floatDigits(String body) {
        return body.replace("_", "");
    }

    public static int radixOf(String body) {
        if (body.length() > 1 && body.charAt(0) == '0') {
            switch (body.charAt(1)) {
                case 'x':
                    return 16;
                case 'o':
                    return 8;
                case 'b':
                    return 2;
                default:
                    break;
            }
        }
        return 10;
    }

    private static String quotedContent(String body, int prefixLength, char quote) {
        if (body.length() < prefixLength + 2
            || body.charAt(prefixLength) != quote
            || body.charAt(body.length() - 1) != quote) {
            throw new IllegalArgumentException("malformed literal " + body);
        }
        return body.substring(prefixLength + 1, body.length() - 1);
    }

    private static String rawContent(String body, int prefixLength) {
        int hashes = 0;
        while (prefixLength + hashes < body.length() && body.charAt(prefixLength + hashes) == '#') {
            hashes++;
        }
        int start = prefixLength + hashes + 1;
        int end = body.length() - hashes - 1;
        if (end < start) {
            throw new IllegalArgumentException("malformed raw literal " + body);
        }
        return body.substring(start, end);
    }

    private static void requireAscii(String content, String what) {
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) > MAX_ASCII) {
                throw new IllegalArgumentException("non-ASCII character in " + what);
            }
        }
    }

    private static String unescapeText(String content, boolean singleChar) {
        var sb = new StringBuilder(content.length());
        int i = 0;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (c != '\\') {
                sb.append(c);
                i++;
                continue;
            }
            if (i + 1 >= content.length()) {
                throw new IllegalArgumentException("unterminated escape sequence");
            }
            char e = content.charAt(i + 1);
            i += 2;
            switch (e) {
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case '\\' -> sb.append('\\');
                case '0' -> sb.append('\0');
                case '\'' -> sb.append('\'');
                case '"' -> sb.append('"');
                case 'x' -> {
                    int value = hexValue(content, i, 2);
                    if (value > MAX_ASCII) {
                        throw new IllegalArgumentException("\\x escape must be at most \\x7F");
                    }
                    sb.append((char) value);
                    i += 2;
                }
                case 'u' -> {
                    int close = content.indexOf('}', i);
                    sb.appendCodePoint(unicodeEscape(content, i, close));
                    i = close + 1;
                }
                case '\n' -> {
                    if (singleChar) {
                        throw new IllegalArgumentException("line continuation in character literal");
                    }
                    i = skipWhitespace(content, i);
                }
                default -> throw new IllegalArgumentException("unknown character escape: \\" + e);
            }
        }
        return sb.toString();
    }

    private static byte[] unescapeBytes(String content, boolean allowUnicode) {
        var out = new ByteArrayOutputStream(content.length());
        int i = 0;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (c != '\\') {
                if (allowUnicode) {
                    int cp = content.codePointAt(i);
                    writeUtf8(out, cp);
                    i += Character.charCount(cp);
                } else {
                    if (c > MAX_ASCII) {
                        throw new IllegalArgumentException("non-ASCII character in byte literal");
                    }
                    out.write(c);
                    i++;
                }
                continue;
            }
            if (i + 1 >= content.length()) {
                throw new IllegalArgumentException("unterminated escape sequence");
            }
            char e = content.charAt(i + 1);
            i += 2;
            switch (e) {
                case 'n' -> out.write('\n');
                case 'r' -> out.write('\r');
                case 't' -> out.write('\t');
                case '\\' -> out.write('\\');
                case '0' -> out.write(0);
                case '\'' -> out.write('\'');
                case '"' -> out.write('"');
                case 'x' -> {
                    out.write(hexValue(content, i, 2));
                    i += 2;
                }
                case 'u' -> {
                    if (!allowUnicode) {
                        throw new IllegalArgumentException("unicode escape in byte literal");
                    }
                    int close = content.indexOf('}', i);
                    writeUtf8(out, unicodeEscape(content, i, close));
                    i = close + 1;
                }
                case '\n' -> i = skipWhitespace(content, i);
                default -> throw new IllegalArgumentException("unknown byte escape: \\" + e);
            }
        }
        return out.toByteArray();
    }

    private static int hexValue(String content, int from, int digits) {
        if (from + digits > content.length()) {
            throw new IllegalArgumentException("numeric character escape is too short");
        }
        try {
            return Integer.parseInt(content.substring(from, from + digits), 16);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid character in numeric character escape", e);
        }
    }

    private static int unicodeEscape(String content, int from, int close) {
        if (from >= content.length() || content.charAt(from) != '{' || close < 0) {
            throw new IllegalArgumentException("incorrect unicode escape sequence");
        }
        var digits = content.substring(from + 1, close).replace("_", "");
        if (digits.isEmpty() || digits.length() > MAX_UNICODE_DIGITS) {
            throw new IllegalArgumentException("unicode escape must have between 1 and 6 hex digits");
        }
        int cp;
        try {
            cp = Integer.parseInt(digits, 16);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid character in unicode escape", e);
        }
        if (cp > Character.MAX_CODE_POINT || (cp >= Character.MIN_SURROGATE && cp <= Character.MAX_SURROGATE)) {
            throw new IllegalArgumentException("invalid unicode character escape");
        }
        return cp;
    }

    private static int skipWhitespace(String content, int from) {
        int i = from;
        while (i < content.length() && Character.isWhitespace(content.charAt(i))) {
            i++;
        }
        return i;
    }

    private static void writeUtf8(ByteArrayOutputStream out, int codePoint) {
        var bytes = new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8);
        out.write(bytes, 0, bytes.length);
    }
}
