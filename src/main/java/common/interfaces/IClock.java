package common.interfaces;

/** Wall-clock source used to stamp strategy versions. */
public interface IClock {
    long nowMillis();
}
