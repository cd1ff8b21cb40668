package domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** One stored device strategy plus the version stamp clients poll against. */
public final class DeviceStrategy {
    public static final String PERMANENT_PASSWORD = "permanent-password";

    public final long modifiedAt;                    // ms since epoch of the last write
    public final Map<String, String> configOptions;  // pushed to the device as-is
    public final Map<String, String> extra;          // reserved, currently always empty

    public DeviceStrategy(long modifiedAt, Map<String, String> configOptions, Map<String, String> extra) {
        this.modifiedAt = modifiedAt;
        this.configOptions = Collections.unmodifiableMap(new LinkedHashMap<>(configOptions));
        this.extra = Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }

    public static DeviceStrategy withPassword(long modifiedAt, String password) {
        Map<String, String> options = new LinkedHashMap<>();
        options.put(PERMANENT_PASSWORD, password);
        return new DeviceStrategy(modifiedAt, options, Collections.emptyMap());
    }
}
