package api.impl;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;

public final class HttpResponseWriter {

    private HttpResponseWriter() {}

    public static void write(OutputStream out, HttpResponseImpl res) throws IOException {
        if (!res.headers().containsKey("Content-Length")) {
            res.header("Content-Length", String.valueOf(res.body().length));
        }
        // one request per connection
        if (!res.headers().containsKey("Connection")) {
            res.header("Connection", "close");
        }

        OutputStreamWriter w = new OutputStreamWriter(out, StandardCharsets.US_ASCII);
        w.write("HTTP/1.1 " + res.status() + " " + res.reason() + "\r\n");
        for (Map.Entry<String, String> e : res.headers().entrySet()) {
            w.write(e.getKey() + ": " + e.getValue() + "\r\n");
        }
        w.write("\r\n");
        w.flush();

        out.write(res.body());
        out.flush();
    }

    /** Interim reply for clients that sent {@code Expect: 100-continue}. */
    public static void writeContinue(OutputStream out) throws IOException {
        out.write("HTTP/1.1 100 Continue\r\n\r\n".getBytes(StandardCharsets.US_ASCII));
        out.flush();
    }
}
