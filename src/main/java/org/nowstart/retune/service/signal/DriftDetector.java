package org.nowstart.retune.service.signal;

import org.nowstart.retune.data.dto.DriftSignal;

public interface DriftDetector {

    DriftSignal detect(String horizon);
}
