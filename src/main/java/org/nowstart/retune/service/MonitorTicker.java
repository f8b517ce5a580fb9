package org.nowstart.retune.service;

import java.time.Duration;

@FunctionalInterface
public interface MonitorTicker {

    void await(Duration interval) throws InterruptedException;
}
