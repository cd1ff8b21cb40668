package api.interfaces;

import api.interfaces.http.HttpRequest;

/** Picks the handler for a request by method and path; never returns null. */
public interface IHandlerFactory {
    IHttpHandler create(HttpRequest req);
}
