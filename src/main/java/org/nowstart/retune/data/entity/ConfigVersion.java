package org.nowstart.retune.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.nowstart.retune.data.type.ConfigStatus;

/**
 * Archive row for every configuration that was ever activated. Rows are never deleted; only the status
 * moves as newer configurations supersede or roll back older ones.
 */
@Entity
@Table(name = "config_versions")
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ConfigVersion extends AuditableEntity {

    @Id
    private String configId;

    @Column(nullable = false, updatable = false)
    private String horizon;

    @Column(length = 4000, updatable = false)
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ConfigStatus status;

    private String activatedBy;

    private Instant activatedAt;
}
