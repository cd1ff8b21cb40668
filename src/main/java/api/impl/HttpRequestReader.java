package api.impl;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reads one HTTP/1.1 request (request line, headers, Content-Length body) off a socket stream.
 */
public final class HttpRequestReader {

    private HttpRequestReader() {}

    /**
     * @return the parsed request, or {@code null} when the request line is missing or empty
     */
    public static MinimalHttpRequest read(InputStream in, OutputStream out, String remoteAddress) throws IOException {
        String start = readLineAscii(in); // e.g. "POST /api/heartbeat HTTP/1.1"
        if (start == null || start.isEmpty()) {
            return null;
        }
        String[] p = start.split(" ", 3);
        String method = p.length > 0 ? p[0] : "";
        String path   = p.length > 1 ? p[1] : "/";
        String ver    = p.length > 2 ? p[2] : "HTTP/1.1";

        Map<String,String> headers = new LinkedHashMap<>();
        String line;
        while ((line = readLineAscii(in)) != null && !line.isEmpty()) {
            int idx = line.indexOf(':');
            if (idx > 0) {
                headers.put(line.substring(0, idx).trim().toLowerCase(Locale.ROOT), line.substring(idx + 1).trim());
            }
        }

        String expect = headers.get("expect");
        if (expect != null && expect.equalsIgnoreCase("100-continue")) {
            HttpResponseWriter.writeContinue(out);
        }

        byte[] body = in.readNBytes(contentLength(headers));
        return new MinimalHttpRequest(method, path, ver, headers, body, remoteAddress);
    }

    /** Content-Length header, 0 when absent, malformed or negative. */
    static int contentLength(Map<String,String> headers) {
        try {
            return Math.max(0, Integer.parseInt(headers.getOrDefault("content-length", "0").trim()));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    static String readLineAscii(InputStream in) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(128);
        int prev = -1, b;
        while ((b = in.read()) != -1) {
            if (prev == '\r' && b == '\n') {
                byte[] bytes = buf.toByteArray();
                int len = Math.max(0, bytes.length - 1);
                return new String(bytes, 0, len, StandardCharsets.US_ASCII);
            }
            buf.write(b);
            prev = b;
        }
        return (buf.size() == 0) ? null : buf.toString(StandardCharsets.US_ASCII);
    }
}
