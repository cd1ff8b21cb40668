package api.impl.handlers;

import api.impl.Responses;
import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;

public class NotFoundHandler implements IHttpHandler {
    @Override
    public void handle(HttpRequest req, HttpResponse res) {
        Responses.text(res, Responses.NOT_FOUND, "not found");
    }
}
