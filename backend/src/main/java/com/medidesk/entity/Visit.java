package com.medidesk.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;

@Entity
@Table(name = "visits", uniqueConstraints = {
    @UniqueConstraint(name = "uk_visit_doctor_day_serial",
        columnNames = {"doctor_id", "visit_date", "serial_number"})
}, indexes = {
    @Index(name = "idx_visit_patient", columnList = "patient_id"),
    @Index(name = "idx_visit_date", columnList = "visit_date")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Visit extends BaseEntity {

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "patient_id", nullable = false, updatable = false)
    private Patient patient;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "doctor_id", nullable = false, updatable = false)
    private Doctor doctor;

    @Column(nullable = false, length = 50)
    private String department;

    @Enumerated(EnumType.STRING)
    @Column(name = "visit_type", nullable = false, length = 15)
    private VisitType visitType;

    @Column(name = "serial_number", nullable = false, updatable = false)
    private int serialNumber;

    @Column(name = "visit_date", nullable = false)
    private LocalDate visitDate;

    @Column(name = "visit_time", nullable = false)
    private LocalTime visitTime;

    @Column(name = "opd_fee", nullable = false, precision = 10, scale = 2)
    private BigDecimal opdFee;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_mode", nullable = false, length = 10)
    private PaymentMode paymentMode;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    @Builder.Default
    private VisitStatus status = VisitStatus.ACTIVE;

    public enum VisitType {
        OPD_NEW,
        OPD_FOLLOWUP
    }

    public enum VisitStatus {
        ACTIVE,
        COMPLETED,
        CANCELLED
    }
}
