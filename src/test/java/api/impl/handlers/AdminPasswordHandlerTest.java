package api.impl.handlers;

import api.impl.HttpResponseImpl;
import com.google.gson.JsonObject;
import domain.model.DeviceStrategy;
import infrastructure.impl.InMemoryStrategyStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static api.impl.handlers.HandlerTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

class AdminPasswordHandlerTest {

    private static final String PATH = "/api/admin/devices/dev1/permanent-password";

    private InMemoryStrategyStore store;
    private AdminPasswordHandler handler;

    @BeforeEach
    void setUp() {
        store = new InMemoryStrategyStore(() -> 77L);
        handler = new AdminPasswordHandler(store, "devtoken", "dev1");
    }

    private HttpResponseImpl post(Map<String, String> headers, String body) throws Exception {
        return run(handler, request("POST", PATH, headers, body));
    }

    private static void assertFailure(HttpResponseImpl res, int code, String error) {
        assertEquals(code, res.status());
        JsonObject body = json(res);
        assertFalse(body.get("ok").getAsBoolean());
        assertEquals(error, body.get("error").getAsString());
    }

    @Test
    @DisplayName("Valid token and password → 200 with device id and version")
    void setsPassword() throws Exception {
        HttpResponseImpl res = post(Map.of("X-Admin-Token", "devtoken"), "{\"new_password\":\"secret123\"}");
        assertEquals(200, res.status());
        assertEquals("{\"ok\":true,\"device_id\":\"dev1\",\"modified_at\":77}", res.bodyText());
        assertEquals("secret123", store.getStrategyIfModified("dev1", 0L).orElseThrow()
                .configOptions().get(DeviceStrategy.PERMANENT_PASSWORD));
    }

    @Test
    @DisplayName("Header name is matched case-insensitively")
    void headerCaseInsensitive() throws Exception {
        assertEquals(200, post(Map.of("x-admin-token", "devtoken"), "{\"new_password\":\"p\"}").status());
    }

    @Test
    @DisplayName("Missing, empty or wrong token → 401, checked before the body")
    void unauthorized() throws Exception {
        assertFailure(post(Map.of(), "{\"new_password\":\"p\"}"), 401, "unauthorized");
        assertFailure(post(Map.of("X-Admin-Token", ""), "{\"new_password\":\"p\"}"), 401, "unauthorized");
        assertFailure(post(Map.of("X-Admin-Token", "DEVTOKEN"), "{\"new_password\":\"p\"}"), 401, "unauthorized");
        assertFailure(post(Map.of("X-Admin-Token", "nope"), "{broken"), 401, "unauthorized");
        assertEquals(0, store.size());
    }

    @Test
    @DisplayName("Body validation → 400 with the matching reason")
    void badBodies() throws Exception {
        Map<String, String> auth = Map.of("X-Admin-Token", "devtoken");
        assertFailure(post(auth, "{broken"), 400, "invalid json");
        assertFailure(post(auth, "[\"x\"]"), 400, "json object required");
        assertFailure(post(auth, ""), 400, "json object required");
        assertFailure(post(auth, "{}"), 400, "new_password required");
        assertFailure(post(auth, "{\"new_password\":\"\"}"), 400, "new_password required");
        assertFailure(post(auth, "{\"new_password\":123}"), 400, "new_password required");
        assertFailure(post(auth, "{\"new_password\":null}"), 400, "new_password required");
        assertEquals(0, store.size());
    }

    @Test
    @DisplayName("Empty configured token rejects every request")
    void emptyConfiguredToken() throws Exception {
        AdminPasswordHandler open = new AdminPasswordHandler(store, "", "dev1");
        HttpResponseImpl res = run(open, request("POST", PATH, Map.of("X-Admin-Token", ""), "{\"new_password\":\"p\"}"));
        assertFailure(res, 401, "unauthorized");
    }
}
