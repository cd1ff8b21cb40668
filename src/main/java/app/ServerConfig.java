package app;

/** Bootstrap settings, fixed for the lifetime of the process. */
public final class ServerConfig {
    public static final String DEFAULT_HOST = "0.0.0.0";
    public static final int DEFAULT_PORT = 21115;
    public static final String DEFAULT_ADMIN_TOKEN = "devtoken";

    private final String host;
    private final int port;
    private final String adminToken;

    public ServerConfig(String host, int port, String adminToken) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        this.host = host == null || host.isBlank() ? DEFAULT_HOST : host.trim();
        this.port = port;
        this.adminToken = adminToken == null ? "" : adminToken;
    }

    public String host() { return host; }
    public int port() { return port; }
    public String adminToken() { return adminToken; }
}
