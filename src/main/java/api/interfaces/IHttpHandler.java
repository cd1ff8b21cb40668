package api.interfaces;

import api.interfaces.http.HttpRequest;
import api.interfaces.http.HttpResponse;

/** Handles one routed request. Anything thrown here is answered with a 500 by the server. */
public interface IHttpHandler {
    void handle(HttpRequest req, HttpResponse res) throws Exception;
}
