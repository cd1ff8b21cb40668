package app;

import api.impl.SocketHttpServer;
import api.impl.handlers.HandlerFactory;
import api.interfaces.IHttpServer;
import domain.impl.SystemClock;
import domain.interfaces.IStrategyStore;
import infrastructure.impl.InMemoryStrategyStore;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(
        name = "heartbeat-mock-server",
        mixinStandardHelpOptions = true,
        version = "heartbeat-mock-server 1.0.0",
        description = "In-memory mock of the device heartbeat and admin permanent-password API"
)
public final class HeartbeatMockServer implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Option(names = {"--host"}, defaultValue = ServerConfig.DEFAULT_HOST, description = "Bind address")
    String host;

    @Option(names = {"--port"}, defaultValue = "21115", description = "Bind port (0 picks a free one)")
    int port;

    @Option(names = {"--admin-token"}, defaultValue = "${env:MOCK_ADMIN_TOKEN:-devtoken}",
            description = "Shared secret expected in X-Admin-Token (env MOCK_ADMIN_TOKEN)")
    String adminToken;

    IHttpServer server;

    public static void main(String[] args) {
        int code = new CommandLine(new HeartbeatMockServer()).execute(args);
        if (code != 0) {
            System.exit(code);
        }
        // otherwise the non-daemon acceptor thread keeps the JVM alive
    }

    @Override
    public Integer call() throws Exception {
        server = start(config());
        IHttpServer running = server;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                running.close();
            } catch (Exception e) {
                System.err.println("[Server] shutdown failed: " + e.getMessage());
            }
        }, "shutdown"));

        System.out.println("Health: GET /health");
        System.out.println("Heartbeat: POST /api/heartbeat");
        System.out.println("Admin set password: POST /api/admin/devices/{id}/permanent-password (header X-Admin-Token)");
        return 0;
    }

    ServerConfig config() {
        try {
            return new ServerConfig(host, port, adminToken);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage(), e);
        }
    }

    /** Builds the store, wires it into the router and starts listening. */
    public static IHttpServer start(ServerConfig config) throws Exception {
        IStrategyStore store = new InMemoryStrategyStore(new SystemClock());
        IHttpServer http = new SocketHttpServer(new HandlerFactory(store, config.adminToken()));
        http.start(config.host(), config.port());
        return http;
    }
}
