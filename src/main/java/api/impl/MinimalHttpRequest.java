package api.impl;

import api.interfaces.http.HttpRequest;

import java.util.Locale;
import java.util.Map;

public class MinimalHttpRequest implements HttpRequest {
    private final String method;
    private final String path;
    private final String version;
    private final Map<String,String> headers; // keys lower-cased by the reader
    private final byte[] body;
    private final String remoteAddress;

    public MinimalHttpRequest(String method, String path, String version,
                              Map<String,String> headers, byte[] body, String remoteAddress){
        this.method = method;
        this.path = path;
        this.version = version;
        this.headers = headers;
        this.body = body == null ? new byte[0] : body;
        this.remoteAddress = remoteAddress;
    }

    @Override public String method(){ return method; }
    @Override public String path(){ return path; }
    @Override public String version(){ return version; }

    @Override
    public String header(String name){
        if (name == null) return null;
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    @Override public byte[] body() { return body; }
    @Override public String remoteAddress() { return remoteAddress; }
}
