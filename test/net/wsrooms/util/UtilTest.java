package net.wsrooms.util;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Set;
import net.wsrooms.api.DecodeException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class UtilTest {

    @Test
    public void jsonParsingRejectsTrailingGarbage() throws Exception {
        JSONObject obj = assertInstanceOf(JSONObject.class,
            Util.parseOneJSONValue("  {\"a\": [1, 2]}  "));
        assertTrue(new JSONArray("[1, 2]").similar(obj.getJSONArray("a")));

        assertThrows(JSONException.class,
                     () -> Util.parseOneJSONValue("{} {}"));
        assertThrows(DecodeException.class,
                     () -> Util.decodeJSON("[1, 2"));
    }

    @Test
    public void scalarsAreValidJson() throws Exception {
        assertEquals("abc", Util.decodeJSON("\"abc\""));
        assertEquals(Boolean.TRUE, Util.decodeJSON("true"));
        assertEquals(JSONObject.NULL, Util.decodeJSON("null"));
    }

    @Test
    public void onlyStrictJsonIsAccepted() throws Exception {
        String[] bad = {
            "hi!", "abcd", "True", "nul", "{a:1}", "{'a': 1}", "['x',]",
            "[1,]", "{\"a\": 1,}", "01", "1.", ".5", "+1", "-", "\"\\x\"",
            "\"\\u12\"", "\"tab\there\"", "[1 2]", "{\"a\" 1}", ""
        };
        for (final String input : bad) {
            assertThrows(DecodeException.class, () -> Util.decodeJSON(input),
                         input);
        }

        assertEquals(-500, ((Number) Util.decodeJSON("-0.5e+3"))
                     .intValue());
        assertEquals("\u00e9\n", Util.decodeJSON("\"\\u00e9\\n\""));
        assertEquals(0, ((JSONArray) Util.decodeJSON(" [ ] ")).length());
        assertEquals(0, ((JSONObject) Util.decodeJSON("{}")).length());
    }

    @Test
    public void utf8DecodingIsStrict() throws Exception {
        assertEquals("grüße", Util.decodeUTF8(
            "grüße".getBytes(StandardCharsets.UTF_8)));
        assertThrows(DecodeException.class, () -> Util.decodeUTF8(
            new byte[] {'o', 'k', (byte) 0xFF}));
    }

    @Test
    public void encodingProducesParseableText() throws Exception {
        JSONObject value = Util.createJSONObject("name", "x\"y",
                                                 "n", 3);
        String text = Util.encodeJSON(value);

        assertTrue(value.similar(Util.decodeJSON(text)));
        assertEquals("\"plain\"", Util.encodeJSON("plain"));
        assertThrows(IllegalArgumentException.class,
                     () -> Util.createJSONObject("lonely"));
    }

    @Test
    public void parseLongFallsBackOnGarbage() {
        assertEquals(7, Util.parseLong("k", " 7 ", 1));
        assertEquals(1, Util.parseLong("k", "seven", 1));
        assertEquals(1, Util.parseLong("k", null, 1));
        assertEquals(1, Util.parseLong("k", "", 1));
    }

    @Test
    public void uniqueCounterNeverRepeats() {
        Set<Long> seen = new HashSet<Long>();
        long prev = -1;
        for (int i = 0; i < 5000; i++) {
            long v = UniqueCounter.INSTANCE.get();
            assertTrue(v > prev);
            assertTrue(seen.add(v));
            prev = v;
        }
        assertEquals(16, UniqueCounter.INSTANCE.getString().length());
    }

}
