package domain.interfaces;

import domain.model.StrategySnapshot;

import java.util.Optional;

public interface IStrategyStore {

    /** Stores {@code newPassword} as the device's permanent password; returns the new version. */
    long setPassword(String deviceId, String newPassword);

    /**
     * Returns the current strategy unless the device is unknown or the stored version
     * equals {@code clientModifiedAt} exactly.
     */
    Optional<StrategySnapshot> getStrategyIfModified(String deviceId, long clientModifiedAt);

    int size();
}
