package api.impl;

import api.interfaces.IHandlerFactory;
import api.interfaces.IHttpHandler;
import api.interfaces.IHttpServer;
import com.google.gson.JsonObject;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;

/**
 * Blocking HTTP/1.1 server: one accept thread, and one new thread per connection with no
 * upper bound. Each connection carries exactly one request and is closed after the reply.
 */
public class SocketHttpServer implements IHttpServer {

    private final IHandlerFactory factory;
    private volatile ServerSocket server;
    private Thread acceptor;

    public SocketHttpServer(IHandlerFactory factory) {
        this.factory = factory;
    }

    @Override
    public void start(String host, int port) throws IOException {
        if (server != null) throw new IllegalStateException("server already started");
        ServerSocket ss = new ServerSocket();
        ss.setReuseAddress(true);
        ss.bind(new InetSocketAddress(InetAddress.getByName(host), port));
        server = ss;

        acceptor = new Thread(this::acceptLoop, "http-acceptor");
        acceptor.start();
        System.out.println("[Server] listening on http://" + host + ":" + ss.getLocalPort());
    }

    @Override
    public int port() {
        ServerSocket ss = server;
        return ss == null ? -1 : ss.getLocalPort();
    }

    @Override
    public void close() throws IOException {
        ServerSocket ss = server;
        if (ss != null && !ss.isClosed()) {
            ss.close();
            System.out.println("[Server] stopped");
        }
    }

    private void acceptLoop() {
        ServerSocket ss = server;
        while (!ss.isClosed()) {
            try {
                Socket client = ss.accept();
                new Thread(() -> handle(client), "http-conn-" + client.getPort()).start();
            } catch (IOException e) {
                if (!ss.isClosed()) {
                    System.err.println("[Server] accept failed: " + e.getMessage());
                }
            }
        }
    }

    void handle(Socket client) {
        String remote = client.getInetAddress() == null ? "?" : client.getInetAddress().getHostAddress();
        try (client;
             InputStream in = new BufferedInputStream(client.getInputStream());
             OutputStream out = client.getOutputStream()) {

            MinimalHttpRequest req = HttpRequestReader.read(in, out, remote);
            HttpResponseImpl res = new HttpResponseImpl();
            if (req == null) {
                Responses.text(res, Responses.BAD_REQUEST, "empty request line");
                HttpResponseWriter.write(out, res);
                System.out.println("[" + remote + "] - - " + res.status());
                return;
            }

            dispatch(req, res);
            HttpResponseWriter.write(out, res);
            System.out.println("[" + remote + "] " + req.method() + " " + req.path() + " " + res.status());

        } catch (SocketException se) {
            String msg = String.valueOf(se.getMessage()).toLowerCase();
            if (!(msg.contains("connection reset") || msg.contains("broken pipe"))) {
                System.err.println("[Server] socket error from " + remote + ": " + se.getMessage());
            }
        } catch (IOException e) {
            System.err.println("[Server] error from " + remote + ": " + e.getMessage());
        }
    }

    /** Runs the routed handler; a handler failure becomes a 500 instead of killing the connection. */
    void dispatch(MinimalHttpRequest req, HttpResponseImpl res) {
        IHttpHandler handler = factory.create(req);
        try {
            handler.handle(req, res);
        } catch (Exception e) {
            System.err.println("[Server] handler failed for " + req.method() + " " + req.path() + ": " + e);
            JsonObject err = new JsonObject();
            err.addProperty("error", "internal error");
            res.headers().clear();
            Responses.json(res, Responses.INTERNAL_SERVER_ERROR, err);
        }
    }
}
