package org.nowstart.retune.service;

import java.time.Duration;
import org.springframework.stereotype.Component;

@Component
public class SleepingMonitorTicker implements MonitorTicker {

    @Override
    public void await(Duration interval) throws InterruptedException {
        Thread.sleep(interval.toMillis());
    }
}
