package org.nowstart.retune.service;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.retune.data.dto.OptimizerNotification;
import org.nowstart.retune.data.entity.AuditEvent;
import org.nowstart.retune.data.type.NotificationType;
import org.nowstart.retune.repository.AuditEventRepository;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class OptimizerNotificationService {

    private final AuditEventRepository auditEventRepository;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    public void publish(NotificationType type, String horizon, String message) {
        Instant now = clock.instant();
        if (type == NotificationType.DEPLOYMENT_ROLLED_BACK || type == NotificationType.VALIDATION_FAILED) {
            log.warn("event=notification type={} horizon={} message={}", type, horizon, message);
        } else {
            log.info("event=notification type={} horizon={} message={}", type, horizon, message);
        }

        try {
            auditEventRepository.save(AuditEvent.builder()
                    .eventId(UUID.randomUUID())
                    .type(type)
                    .horizon(horizon)
                    .payload(truncate(message))
                    .emittedAt(now)
                    .build());
            applicationEventPublisher.publishEvent(new OptimizerNotification(type, horizon, message, now));
        } catch (RuntimeException e) {
            log.warn("event=notification_failed type={} horizon={}", type, horizon, e);
        }
    }

    private String truncate(String message) {
        if (message == null || message.length() <= 2000) {
            return message;
        }
        return message.substring(0, 2000);
    }
}
