package domain.impl;

import common.interfaces.IClock;

public class SystemClock implements IClock {

    @Override
    public long nowMillis() {
        return System.currentTimeMillis();
    }
}
