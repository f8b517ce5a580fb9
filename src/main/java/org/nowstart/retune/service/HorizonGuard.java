package org.nowstart.retune.service;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class HorizonGuard {

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public boolean tryAcquire(String horizon) {
        return inFlight.add(horizon);
    }

    public void release(String horizon) {
        inFlight.remove(horizon);
    }

    public boolean isHeld(String horizon) {
        return inFlight.contains(horizon);
    }
}
