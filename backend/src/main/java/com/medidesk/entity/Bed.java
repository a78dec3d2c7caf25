package com.medidesk.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Entity
@Table(name = "beds", uniqueConstraints = {
    @UniqueConstraint(name = "uk_bed_number", columnNames = "bed_number")
}, indexes = {
    @Index(name = "idx_bed_status", columnList = "status"),
    @Index(name = "idx_bed_ward", columnList = "ward_type")
})
@Getter
@Setter(AccessLevel.PACKAGE)
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Bed extends BaseEntity {

    @Column(name = "bed_number", nullable = false, length = 10)
    private String bedNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "ward_type", nullable = false, length = 15)
    private WardType wardType;

    @Setter
    @Column(name = "per_day_charge", nullable = false, precision = 10, scale = 2)
    private BigDecimal perDayCharge;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 15)
    @Builder.Default
    private BedStatus status = BedStatus.AVAILABLE;

    /**
     * Moves the bed to {@code target}, enforcing the bed transition table.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public void transitionTo(BedStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                "Bed " + bedNumber + " cannot move from " + status + " to " + target);
        }
        this.status = target;
    }

    public boolean isAvailable() {
        return status == BedStatus.AVAILABLE;
    }

    public enum WardType {
        GENERAL,
        SEMI_PRIVATE,
        PRIVATE
    }

    public enum BedStatus {
        AVAILABLE,
        OCCUPIED,
        MAINTENANCE;

        public boolean canTransitionTo(BedStatus target) {
            return switch (this) {
                case AVAILABLE -> target == OCCUPIED || target == MAINTENANCE;
                case OCCUPIED -> target == AVAILABLE;
                case MAINTENANCE -> target == AVAILABLE;
            };
        }
    }
}
