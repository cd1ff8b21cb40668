package api.impl.handlers;

import api.impl.Responses;
import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;

/** Liveness probe; answers {@code ok} whatever the store holds. */
public class HealthHandler implements IHttpHandler {

    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        Responses.text(res, Responses.OK, "ok");
    }
}
