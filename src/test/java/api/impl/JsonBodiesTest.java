package api.impl;

import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class JsonBodiesTest {

    private static byte[] utf8(String s) { return s.getBytes(StandardCharsets.UTF_8); }

    @Test
    void emptyBodyReadsAsNull() {
        assertTrue(JsonBodies.read(new byte[0]).isJsonNull());
        assertTrue(JsonBodies.read(null).isJsonNull());
    }

    @Test
    void plainObjectAndTopLevelValues() {
        JsonElement obj = JsonBodies.read(utf8("{\"id\":\"dev1\",\"modified_at\":0}"));
        assertTrue(obj.isJsonObject());
        assertEquals("dev1", obj.getAsJsonObject().get("id").getAsString());

        assertTrue(JsonBodies.read(utf8("null")).isJsonNull());
        assertTrue(JsonBodies.read(utf8("[1,2]")).isJsonArray());
        assertTrue(JsonBodies.read(utf8(" 7 ")).isJsonPrimitive());
    }

    @Test
    void quotedStringBodyIsDecodedTwice() {
        // not valid JSON as-is, but a single-quoted string literal holding an object
        JsonElement el = JsonBodies.read(utf8("'{\"id\":\"dev1\",\"modified_at\":5}'"));
        assertTrue(el.isJsonObject());
        assertEquals(5, el.getAsJsonObject().get("modified_at").getAsInt());
    }

    @Test
    void properlyEncodedStringStaysAString() {
        JsonElement el = JsonBodies.read(utf8("\"{\\\"id\\\":\\\"dev1\\\"}\""));
        assertTrue(el.isJsonPrimitive());
        assertTrue(el.getAsJsonPrimitive().isString());
    }

    @Test
    void garbageIsRejected() {
        assertThrows(JsonParseException.class, () -> JsonBodies.read(utf8("{not json")));
        assertThrows(JsonParseException.class, () -> JsonBodies.read(utf8("hello")));
        assertThrows(JsonParseException.class, () -> JsonBodies.read(utf8("{\"a\":1} trailing")));
        assertThrows(JsonParseException.class, () -> JsonBodies.read(utf8("'not json inside'")));
        assertThrows(JsonParseException.class, () -> JsonBodies.read(utf8("   ")));
    }

    @Test
    void stringOrEmptyTreatsFalsyAsEmpty() {
        assertEquals("", JsonBodies.stringOrEmpty(null));
        assertEquals("", JsonBodies.stringOrEmpty(JsonParser.parseString("null")));
        assertEquals("", JsonBodies.stringOrEmpty(new JsonPrimitive("")));
        assertEquals("", JsonBodies.stringOrEmpty(new JsonPrimitive(false)));
        assertEquals("", JsonBodies.stringOrEmpty(JsonParser.parseString("0")));
        assertEquals("", JsonBodies.stringOrEmpty(JsonParser.parseString("[]")));
        assertEquals("", JsonBodies.stringOrEmpty(JsonParser.parseString("{}")));

        assertEquals("dev1", JsonBodies.stringOrEmpty(new JsonPrimitive("dev1")));
        assertEquals("123", JsonBodies.stringOrEmpty(JsonParser.parseString("123")));
    }

    @Test
    void longOrZeroCoercions() {
        assertEquals(0L, JsonBodies.longOrZero(null));
        assertEquals(0L, JsonBodies.longOrZero(JsonParser.parseString("null")));
        assertEquals(0L, JsonBodies.longOrZero(JsonParser.parseString("[1]")));
        assertEquals(0L, JsonBodies.longOrZero(new JsonPrimitive("abc")));
        assertEquals(0L, JsonBodies.longOrZero(new JsonPrimitive("1.5")));
        assertEquals(0L, JsonBodies.longOrZero(JsonParser.parseString("1e30")));

        assertEquals(1_700_000_000_123L, JsonBodies.longOrZero(JsonParser.parseString("1700000000123")));
        assertEquals(12L, JsonBodies.longOrZero(JsonParser.parseString("12.9")));
        assertEquals(-3L, JsonBodies.longOrZero(JsonParser.parseString("-3.7")));
        assertEquals(42L, JsonBodies.longOrZero(new JsonPrimitive(" 42 ")));
        assertEquals(1L, JsonBodies.longOrZero(new JsonPrimitive(true)));
        assertEquals(0L, JsonBodies.longOrZero(new JsonPrimitive(false)));
    }
}
