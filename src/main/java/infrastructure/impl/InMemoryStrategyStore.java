package infrastructure.impl;

import common.interfaces.IClock;
import domain.interfaces.IStrategyStore;
import domain.model.DeviceStrategy;
import domain.model.StrategySnapshot;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Device strategies kept in memory only; everything is lost when the process exits.
 * <p>
 * A single lock guards the map for the whole of each operation, so readers see either
 * the previous entry or the new one, never a half-built strategy.
 */
public class InMemoryStrategyStore implements IStrategyStore {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, DeviceStrategy> map = new HashMap<>();
    private final IClock clock;

    public InMemoryStrategyStore(IClock clock) {
        this.clock = clock;
    }

    @Override
    public long setPassword(String deviceId, String newPassword) {
        lock.lock();
        try {
            long ts = clock.nowMillis();
            map.put(deviceId, DeviceStrategy.withPassword(ts, newPassword));
            return ts;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<StrategySnapshot> getStrategyIfModified(String deviceId, long clientModifiedAt) {
        lock.lock();
        try {
            DeviceStrategy stored = map.get(deviceId);
            if (stored == null || stored.modifiedAt == clientModifiedAt) {
                return Optional.empty();
            }
            return Optional.of(StrategySnapshot.of(stored));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return map.size();
        } finally {
            lock.unlock();
        }
    }
}
