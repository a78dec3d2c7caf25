package com.medidesk.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * Append-only record of a privileged mutation. Rows are never updated.
 */
@Entity
@Immutable
@Table(name = "audit_logs", indexes = {
    @Index(name = "idx_audit_user", columnList = "user_id"),
    @Index(name = "idx_audit_record", columnList = "table_name, record_id"),
    @Index(name = "idx_audit_timestamp", columnList = "timestamp")
})
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuditLog {

    @Id
    @Column(name = "log_id", length = 30, nullable = false, updatable = false)
    private String id;

    @Column(name = "user_id", nullable = false, length = 50, updatable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action_type", nullable = false, length = 20, updatable = false)
    private AuditAction action;

    @Column(name = "table_name", nullable = false, length = 50, updatable = false)
    private String tableName;

    @Column(name = "record_id", nullable = false, length = 30, updatable = false)
    private String recordId;

    @Column(name = "old_value", columnDefinition = "TEXT", updatable = false)
    private String oldValue;

    @Column(name = "new_value", columnDefinition = "TEXT", updatable = false)
    private String newValue;

    @Column(nullable = false, updatable = false)
    private Instant timestamp;

    public enum AuditAction {
        MANUAL_CHARGE_ADD("manual charge add"),
        MANUAL_CHARGE_EDIT("manual charge edit"),
        RATE_CHANGE("rate change");

        private final String description;

        AuditAction(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }
}
