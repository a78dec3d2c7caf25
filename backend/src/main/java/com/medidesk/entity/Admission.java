package com.medidesk.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * An inpatient stay. While {@link AdmissionStatus#ADMITTED} the referenced bed
 * is {@link Bed.BedStatus#OCCUPIED}; both end states are terminal.
 */
@Entity
@Table(name = "admissions", indexes = {
    @Index(name = "idx_admission_patient", columnList = "patient_id"),
    @Index(name = "idx_admission_status", columnList = "status"),
    @Index(name = "idx_admission_bed", columnList = "bed_id")
})
@Getter
@Setter(AccessLevel.PACKAGE)
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Admission extends BaseEntity {

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "patient_id", nullable = false, updatable = false)
    private Patient patient;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "visit_id", updatable = false)
    private Visit visit;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "bed_id", nullable = false)
    private Bed bed;

    @Column(name = "admission_date", nullable = false, updatable = false)
    private LocalDateTime admissionDate;

    @Column(name = "discharge_date")
    private LocalDateTime dischargeDate;

    @Column(name = "file_charge", nullable = false, precision = 10, scale = 2, updatable = false)
    private BigDecimal fileCharge;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 15)
    @Builder.Default
    private AdmissionStatus status = AdmissionStatus.ADMITTED;

    public boolean isActive() {
        return status == AdmissionStatus.ADMITTED;
    }

    /**
     * Points the admission at a new bed. Bed statuses are the caller's concern.
     */
    public void moveTo(Bed newBed) {
        requireActive();
        this.bed = newBed;
    }

    /**
     * Closes the stay with the given terminal status.
     */
    public void close(AdmissionStatus target, LocalDateTime closedAt) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                "Admission " + getId() + " cannot move from " + status + " to " + target);
        }
        this.status = target;
        this.dischargeDate = closedAt;
    }

    private void requireActive() {
        if (!isActive()) {
            throw new IllegalStateException("Admission " + getId() + " is " + status);
        }
    }

    public enum AdmissionStatus {
        ADMITTED,
        DISCHARGED,
        TRANSFERRED;

        public boolean canTransitionTo(AdmissionStatus target) {
            return switch (this) {
                case ADMITTED -> target == DISCHARGED || target == TRANSFERRED;
                case DISCHARGED, TRANSFERRED -> false;
            };
        }
    }
}
