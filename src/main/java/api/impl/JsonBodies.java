package api.impl;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSyntaxException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;

/**
 * Request body decoding and the loose field coercions heartbeat clients rely on.
 */
public final class JsonBodies {

    private static final TypeAdapter<JsonElement> ELEMENT = Responses.gson().getAdapter(JsonElement.class);

    private JsonBodies() {}

    /**
     * Parses a request body. An empty body reads as JSON {@code null}.
     * <p>
     * Some clients post the payload already encoded as a JSON string. When the body is
     * not valid JSON on its own, it is read once more as a (leniently quoted) string
     * literal whose content is then parsed; if that fails too the first error is thrown.
     *
     * @throws JsonParseException when neither reading yields a JSON value
     */
    public static JsonElement read(byte[] body) {
        String raw = body == null ? "" : new String(body, StandardCharsets.UTF_8);
        if (raw.isEmpty()) {
            return JsonNull.INSTANCE;
        }
        try {
            return parseStrict(raw);
        } catch (JsonParseException first) {
            try {
                JsonElement literal = JsonParser.parseString(raw.trim());
                if (literal.isJsonPrimitive() && literal.getAsJsonPrimitive().isString()) {
                    return parseStrict(literal.getAsString());
                }
            } catch (JsonParseException second) {
                first.addSuppressed(second);
            }
            throw first;
        }
    }

    static JsonElement parseStrict(String text) {
        JsonReader reader = new JsonReader(new StringReader(text));
        reader.setLenient(false);
        try {
            JsonElement element = ELEMENT.read(reader);
            if (reader.peek() != JsonToken.END_DOCUMENT) {
                throw new JsonSyntaxException("trailing data after JSON value");
            }
            return element;
        } catch (IOException | IllegalStateException | NumberFormatException e) {
            throw new JsonSyntaxException(e);
        }
    }

    /** String form of a field, or "" when it is missing or falsy (null, false, 0, "", [] or {}). */
    public static String stringOrEmpty(JsonElement value) {
        if (value == null || value.isJsonNull()) return "";
        if (value.isJsonObject()) {
            return value.getAsJsonObject().size() == 0 ? "" : value.toString();
        }
        if (value.isJsonArray()) {
            return value.getAsJsonArray().size() == 0 ? "" : value.toString();
        }
        JsonPrimitive p = value.getAsJsonPrimitive();
        if (p.isBoolean()) return p.getAsBoolean() ? "true" : "";
        if (p.isNumber()) {
            try {
                if (p.getAsBigDecimal().signum() == 0) return "";
            } catch (NumberFormatException e) {
                return p.getAsString();
            }
        }
        return p.getAsString();
    }

    /**
     * Integer value of a field: numbers truncate toward zero, booleans count as 1/0,
     * numeric strings are parsed after trimming. Anything else, or an out-of-range
     * value, gives 0.
     */
    public static long longOrZero(JsonElement value) {
        if (value == null || !value.isJsonPrimitive()) return 0L;
        JsonPrimitive p = value.getAsJsonPrimitive();
        try {
            if (p.isBoolean()) return p.getAsBoolean() ? 1L : 0L;
            if (p.isNumber()) {
                return new BigDecimal(p.getAsString()).toBigInteger().longValueExact();
            }
            return Long.parseLong(p.getAsString().trim());
        } catch (NumberFormatException | ArithmeticException e) {
            return 0L;
        }
    }
}
