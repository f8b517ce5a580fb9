package org.nowstart.retune.service.signal;

import org.nowstart.retune.data.dto.HealthStatus;

public interface HealthProbe {

    HealthStatus check(String horizon);
}
