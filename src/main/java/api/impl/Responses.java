package api.impl;

import api.interfaces.http.HttpResponse;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Status codes, reason phrases and body helpers shared by the handlers.
 */
public final class Responses {

    public static final int OK = 200;
    public static final int BAD_REQUEST = 400;
    public static final int UNAUTHORIZED = 401;
    public static final int NOT_FOUND = 404;
    public static final int INTERNAL_SERVER_ERROR = 500;

    public static final String JSON_UTF8 = "application/json; charset=utf-8";
    public static final String TEXT_UTF8 = "text/plain; charset=utf-8";

    private static final Gson gson = new GsonBuilder()
            .serializeNulls()
            .disableHtmlEscaping()
            .create();

    private Responses() {}

    public static Gson gson() { return gson; }

    public static void json(HttpResponse res, int code, Object body) {
        res.status(code, reason(code));
        res.header("Content-Type", JSON_UTF8);
        res.body(gson.toJson(body));
    }

    public static void text(HttpResponse res, int code, String body) {
        res.status(code, reason(code));
        res.header("Content-Type", TEXT_UTF8);
        res.body(body);
    }

    public static String reason(int code) {
        switch (code) {
            case OK: return "OK";
            case BAD_REQUEST: return "Bad Request";
            case UNAUTHORIZED: return "Unauthorized";
            case NOT_FOUND: return "Not Found";
            case INTERNAL_SERVER_ERROR: return "Internal Server Error";
            default: return "Unknown";
        }
    }
}
