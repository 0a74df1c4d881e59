package net.wsrooms.util;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;
import net.wsrooms.api.DecodeException;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

public final class Util {

    private static final Logger LOGGER = Logger.getLogger("Util");

    private Util() {}

    /**
     * Parse exactly one JSON value from input.
     * JSONTokener on its own is lenient: it takes bare words for strings
     * and accepts unquoted keys, single quotes and trailing commas. Input
     * is therefore checked against the strict JSON grammar first, and
     * trailing garbage after the value is rejected as well.
     */
    public static Object parseOneJSONValue(String input)
            throws JSONException {
        new StrictSyntax(input).check();
        JSONTokener tok = new JSONTokener(input);
        Object ret = tok.nextValue();
        if (tok.nextClean() != 0)
            throw tok.syntaxError("Unexpected garbage after JSON value");
        return ret;
    }

    /* Recognizes RFC 8259 JSON text without building any values. */
    private static class StrictSyntax {

        private final String input;
        private int pos;

        StrictSyntax(String input) {
            this.input = input;
        }

        void check() throws JSONException {
            skipSpace();
            value();
            skipSpace();
            if (pos != input.length())
                throw error("Unexpected garbage after JSON value");
        }

        private void value() throws JSONException {
            if (pos == input.length())
                throw error("Unexpected end of input");
            char c = input.charAt(pos);
            switch (c) {
                case '{': object(); break;
                case '[': array(); break;
                case '"': string(); break;
                case 't': literal("true"); break;
                case 'f': literal("false"); break;
                case 'n': literal("null"); break;
                default:
                    if (c == '-' || isDigit(c)) {
                        number();
                    } else {
                        throw error("Unexpected character '" + c + "'");
                    }
            }
        }

        private void object() throws JSONException {
            pos++;
            skipSpace();
            if (peek() == '}') {
                pos++;
                return;
            }
            for (;;) {
                skipSpace();
                if (peek() != '"') throw error("Expected a quoted key");
                string();
                skipSpace();
                expect(':');
                skipSpace();
                value();
                skipSpace();
                if (peek() == ',') {
                    pos++;
                    continue;
                }
                expect('}');
                return;
            }
        }

        private void array() throws JSONException {
            pos++;
            skipSpace();
            if (peek() == ']') {
                pos++;
                return;
            }
            for (;;) {
                skipSpace();
                value();
                skipSpace();
                if (peek() == ',') {
                    pos++;
                    continue;
                }
                expect(']');
                return;
            }
        }

        private void string() throws JSONException {
            pos++;
            for (;;) {
                if (pos == input.length())
                    throw error("Unterminated string");
                char c = input.charAt(pos++);
                if (c == '"') return;
                if (c < 0x20) throw error("Control character in string");
                if (c != '\\') continue;
                if (pos == input.length())
                    throw error("Unterminated escape");
                char e = input.charAt(pos++);
                if (e == 'u') {
                    for (int i = 0; i < 4; i++) {
                        if (pos == input.length() ||
                                Character.digit(input.charAt(pos), 16) == -1)
                            throw error("Invalid \\u escape");
                        pos++;
                    }
                } else if ("\"\\/bfnrt".indexOf(e) == -1) {
                    throw error("Invalid escape \\" + e);
                }
            }
        }

        private void number() throws JSONException {
            if (peek() == '-') pos++;
            if (peek() == '0') {
                pos++;
            } else if (isDigit(peek())) {
                digits();
            } else {
                throw error("Invalid number");
            }
            if (peek() == '.') {
                pos++;
                if (! isDigit(peek())) throw error("Invalid fraction");
                digits();
            }
            if (peek() == 'e' || peek() == 'E') {
                pos++;
                if (peek() == '+' || peek() == '-') pos++;
                if (! isDigit(peek())) throw error("Invalid exponent");
                digits();
            }
        }

        private void digits() {
            while (isDigit(peek())) pos++;
        }

        private void literal(String word) throws JSONException {
            if (! input.startsWith(word, pos))
                throw error("Unexpected token");
            pos += word.length();
        }

        private void expect(char c) throws JSONException {
            if (peek() != c) throw error("Expected '" + c + "'");
            pos++;
        }

        private char peek() {
            return (pos < input.length()) ? input.charAt(pos) : 0;
        }

        private void skipSpace() {
            while (pos < input.length()) {
                char c = input.charAt(pos);
                if (c != ' ' && c != '\t' && c != '\n' && c != '\r') break;
                pos++;
            }
        }

        private static boolean isDigit(char c) {
            return (c >= '0' && c <= '9');
        }

        private JSONException error(String message) {
            return new JSONException(message + " at character " + pos);
        }

    }

    public static Object decodeJSON(String input) throws DecodeException {
        try {
            return parseOneJSONValue(input);
        } catch (JSONException exc) {
            throw new DecodeException("Invalid JSON: " + exc.getMessage(),
                                      exc);
        }
    }

    // Strict: malformed input is an error rather than U+FFFD.
    public static String decodeUTF8(byte[] data) throws DecodeException {
        CharsetDecoder dec = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return dec.decode(ByteBuffer.wrap(data)).toString();
        } catch (CharacterCodingException exc) {
            throw new DecodeException("Invalid UTF-8", exc);
        }
    }

    public static String encodeJSON(Object value) throws JSONException {
        return JSONObject.valueToString(value);
    }

    public static JSONObject createJSONObject(Object... params) {
        if (params.length % 2 != 0)
            throw new IllegalArgumentException("Invalid argument count " +
                params.length);
        JSONObject ret = new JSONObject();
        for (int i = 0; i < params.length; i += 2) {
            ret.put((String) params[i], params[i + 1]);
        }
        return ret;
    }

    // Use ByteBuffer.wrap() to reverse.
    public static byte[] extractBytes(ByteBuffer buf) {
        byte[] ret = new byte[buf.remaining()];
        buf.get(ret);
        return ret;
    }

    public static boolean nonempty(String s) {
        return (s != null && ! s.isEmpty());
    }

    public static long parseLong(String key, String value, long dflt) {
        if (! nonempty(value)) return dflt;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException exc) {
            LOGGER.warning("Invalid value " + value + " for " + key +
                           "; using " + dflt);
            return dflt;
        }
    }

}
