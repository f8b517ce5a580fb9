package org.nowstart.retune.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.retune.data.dto.DeploymentRecord;
import org.nowstart.retune.data.dto.HealthStatus;
import org.nowstart.retune.data.dto.MonitorResult;
import org.nowstart.retune.data.property.MonitorProperties;
import org.nowstart.retune.data.type.MonitorState;
import org.nowstart.retune.service.signal.HealthProbe;
import org.springframework.stereotype.Service;

/**
 * Watches a freshly deployed horizon for a fixed window and rolls it back automatically once the
 * health probe fails a configured number of times in a row. A healthy probe resets the count.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PostDeploymentMonitorService {

    private final HealthProbe healthProbe;
    private final ConfigDeploymentService configDeploymentService;
    private final MonitorProperties monitorProperties;
    private final MonitorTicker monitorTicker;
    private final Clock clock;

    public MonitorResult observe(String horizon, Duration window) {
        Duration interval = monitorProperties.probeInterval();
        int threshold = monitorProperties.failureThreshold();
        long maxProbes = Math.max(1L, window.toMillis() / Math.max(1L, interval.toMillis()));
        Instant startedAt = clock.instant();

        MonitorState state = MonitorState.OBSERVING;
        int probes = 0;
        int failures = 0;
        int consecutive = 0;
        int maxConsecutive = 0;
        DeploymentRecord rollback = null;

        log.info("event=monitor_started horizon={} window={} probe_interval={} failure_threshold={}",
                horizon, window, interval, threshold);

        while (probes < maxProbes) {
            try {
                monitorTicker.await(interval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("event=monitor_interrupted horizon={} probes={}", horizon, probes, e);
                state = MonitorState.INTERRUPTED;
                break;
            }

            probes++;
            if (probe(horizon, probes)) {
                consecutive = 0;
                state = MonitorState.OBSERVING;
                continue;
            }

            failures++;
            consecutive++;
            maxConsecutive = Math.max(maxConsecutive, consecutive);
            state = MonitorState.DEGRADED;
            log.warn("event=monitor_probe_failed horizon={} probe={} consecutive_failures={} threshold={}",
                    horizon, probes, consecutive, threshold);

            if (consecutive >= threshold) {
                String reason = "health probe failed " + consecutive + " consecutive times";
                try {
                    rollback = configDeploymentService.rollback(horizon, reason);
                    state = MonitorState.ROLLED_BACK;
                    log.error("event=post_deployment_rollback horizon={} probe={} restored_config_id={} reason={}",
                            horizon, probes, rollback.deployedConfigId(), reason);
                } catch (RuntimeException e) {
                    state = MonitorState.ROLLBACK_FAILED;
                    log.error("event=post_deployment_rollback_failed horizon={} probe={}", horizon, probes, e);
                }
                break;
            }
        }

        if (state == MonitorState.OBSERVING || state == MonitorState.DEGRADED) {
            state = MonitorState.PASSED;
        }
        Instant finishedAt = clock.instant();
        MonitorResult result = new MonitorResult(
                horizon,
                state,
                probes,
                failures,
                maxConsecutive,
                startedAt,
                finishedAt,
                Duration.between(startedAt, finishedAt),
                rollback
        );
        log.info("event=monitor_finished horizon={} state={} probes={} failures={} elapsed={}",
                horizon, state, probes, failures, result.elapsed());
        return result;
    }

    private boolean probe(String horizon, int probeNumber) {
        try {
            HealthStatus status = healthProbe.check(horizon);
            if (status != null && status.healthy()) {
                return true;
            }
            log.warn("event=health_unhealthy horizon={} probe={} detail={}",
                    horizon, probeNumber, status == null ? null : status.detail());
            return false;
        } catch (RuntimeException e) {
            log.warn("event=health_probe_error horizon={} probe={}", horizon, probeNumber, e);
            return false;
        }
    }
}
