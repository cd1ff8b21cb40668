package api.impl.handlers;

import api.interfaces.IHandlerFactory;
import api.interfaces.IHttpHandler;
import api.interfaces.http.HttpRequest;
import domain.interfaces.IStrategyStore;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class HandlerFactory implements IHandlerFactory {

    private static final Pattern ADMIN_PASSWORD =
            Pattern.compile("/api/admin/devices/([^/]+)/permanent-password");

    private final IStrategyStore store;
    private final String adminToken;

    public HandlerFactory(IStrategyStore store, String adminToken) {
        this.store = store;
        this.adminToken = adminToken;
    }

    @Override
    public IHttpHandler create(HttpRequest req) {
        String m = req.method() == null ? "" : req.method().toUpperCase(Locale.ROOT);
        String p = req.path() == null ? "" : req.path();

        if ("GET".equals(m) && "/health".equals(p)) return new HealthHandler();

        if ("POST".equals(m)) {
            if ("/api/heartbeat".equals(p)) return new HeartbeatHandler(store);

            // matched on the raw target; a query string makes it miss
            Matcher admin = ADMIN_PASSWORD.matcher(p);
            if (admin.matches()) return new AdminPasswordHandler(store, adminToken, admin.group(1));
        }

        return new NotFoundHandler();
    }
}
