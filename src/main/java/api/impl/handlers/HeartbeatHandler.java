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
import domain.model.StrategySnapshot;

import java.util.Optional;

/**
 * POST /api/heartbeat
 * <p>
 * Devices send {@code {"id": "...", "modified_at": <last seen version>, ...}} and get back
 * either {@code {}} (nothing new) or the full current strategy. Anything that parses but
 * is not a usable heartbeat also gets {@code {}} so a polling client never sees an error
 * for it; only unparseable bodies are rejected.
 */
public class HeartbeatHandler implements IHttpHandler {
    private final IStrategyStore store;

    public HeartbeatHandler(IStrategyStore store) { this.store = store; }

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        JsonElement body;
        try {
            body = JsonBodies.read(req.body());
        } catch (JsonParseException e) {
            JsonObject err = new JsonObject();
            err.addProperty("error", "invalid json");
            Responses.json(res, Responses.BAD_REQUEST, err);
            return;
        }

        if (!body.isJsonObject()) {
            Responses.json(res, Responses.OK, new JsonObject());
            return;
        }
        JsonObject hb = body.getAsJsonObject();

        String deviceId = JsonBodies.stringOrEmpty(hb.get("id"));
        long clientModifiedAt = JsonBodies.longOrZero(hb.get("modified_at"));
        if (deviceId.isEmpty()) {
            Responses.json(res, Responses.OK, new JsonObject());
            return;
        }

        Optional<StrategySnapshot> snapshot = store.getStrategyIfModified(deviceId, clientModifiedAt);
        if (snapshot.isPresent()) {
            Responses.json(res, Responses.OK, snapshot.get());
        } else {
            Responses.json(res, Responses.OK, new JsonObject());
        }
    }
}
