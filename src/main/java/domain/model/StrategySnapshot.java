package domain.model;

import com.google.gson.annotations.SerializedName;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Heartbeat reply body for a device whose cached strategy is stale.
 * Field names follow the wire format, e.g.
 * {@code {"modified_at":1700000000000,"strategy":{"config_options":{...},"extra":{}}}}.
 */
public final class StrategySnapshot {

    @SerializedName("modified_at")
    private final long modifiedAt;

    @SerializedName("strategy")
    private final Strategy strategy;

    public StrategySnapshot(long modifiedAt, Map<String, String> configOptions, Map<String, String> extra) {
        this.modifiedAt = modifiedAt;
        this.strategy = new Strategy(configOptions, extra);
    }

    public static StrategySnapshot of(DeviceStrategy stored) {
        return new StrategySnapshot(stored.modifiedAt, stored.configOptions, stored.extra);
    }

    public long modifiedAt() { return modifiedAt; }
    public Map<String, String> configOptions() { return strategy.configOptions; }
    public Map<String, String> extra() { return strategy.extra; }

    static final class Strategy {
        @SerializedName("config_options")
        private final Map<String, String> configOptions;

        @SerializedName("extra")
        private final Map<String, String> extra;

        Strategy(Map<String, String> configOptions, Map<String, String> extra) {
            // copies, so a snapshot never aliases store state
            this.configOptions = new LinkedHashMap<>(configOptions);
            this.extra = new LinkedHashMap<>(extra);
        }
    }
}
