package api.interfaces.http;

/** Minimal response contract; the body is sent as UTF-8 */
public interface HttpResponse {
    void status(int code, String reason);
    void header(String name, String value);
    void body(String text);
}
