package org.nowstart.retune.service.signal;

import org.nowstart.retune.data.dto.PerformanceSnapshot;

public interface PerformanceMonitor {

    PerformanceSnapshot fetch(String horizon);
}
