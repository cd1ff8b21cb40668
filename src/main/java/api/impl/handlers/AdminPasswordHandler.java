package api.impl.handlers;

import api.impl.JsonBodies;
import api.impl.Responses;
import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import domain.interfaces.IStrategyStore;

/**
 * POST /api/admin/devices/{id}/permanent-password
 * <p>
 * Requires {@code X-Admin-Token} to match the configured token exactly, then expects
 * {@code {"new_password": "..."}}. Any malformed request is rejected with 400.
 */
public class AdminPasswordHandler implements IHttpHandler {
    public static final String TOKEN_HEADER = "X-Admin-Token";

    private final IStrategyStore store;
    private final String adminToken;
    private final String deviceId;

    public AdminPasswordHandler(IStrategyStore store, String adminToken, String deviceId) {
        this.store = store;
        this.adminToken = adminToken;
        this.deviceId = deviceId;
    }

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        // checked before the body is even looked at
        String token = req.header(TOKEN_HEADER);
        if (token == null || token.isEmpty() || !token.equals(adminToken)) {
            fail(res, Responses.UNAUTHORIZED, "unauthorized");
            return;
        }

        JsonElement body;
        try {
            body = JsonBodies.read(req.body());
        } catch (JsonParseException e) {
            fail(res, Responses.BAD_REQUEST, "invalid json");
            return;
        }
        if (!body.isJsonObject()) {
            fail(res, Responses.BAD_REQUEST, "json object required");
            return;
        }

        JsonElement pw = body.getAsJsonObject().get("new_password");
        if (pw == null || !pw.isJsonPrimitive() || !pw.getAsJsonPrimitive().isString()
                || pw.getAsString().isEmpty()) {
            fail(res, Responses.BAD_REQUEST, "new_password required");
            return;
        }

        long modifiedAt = store.setPassword(deviceId, pw.getAsString());
        System.out.println("[Store] permanent-password set for device=" + deviceId
                + " modified_at=" + modifiedAt + " devices=" + store.size());

        JsonObject ok = new JsonObject();
        ok.addProperty("ok", true);
        ok.addProperty("device_id", deviceId);
        ok.addProperty("modified_at", modifiedAt);
        Responses.json(res, Responses.OK, ok);
    }

    private static void fail(HttpResponse res, int code, String error) {
        JsonObject body = new JsonObject();
        body.addProperty("ok", false);
        body.addProperty("error", error);
        Responses.json(res, code, body);
    }
}
