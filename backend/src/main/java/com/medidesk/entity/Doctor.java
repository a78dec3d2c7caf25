package com.medidesk.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Entity
@Table(name = "doctors", indexes = {
    @Index(name = "idx_doctor_department", columnList = "department")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Doctor extends BaseEntity {

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, length = 50)
    private String department;

    @Column(name = "new_patient_fee", nullable = false, precision = 10, scale = 2)
    private BigDecimal newPatientFee;

    @Column(name = "followup_fee", nullable = false, precision = 10, scale = 2)
    private BigDecimal followupFee;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    @Builder.Default
    private DoctorStatus status = DoctorStatus.ACTIVE;

    /**
     * Consultation fee charged for the given visit type.
     */
    public BigDecimal feeFor(Visit.VisitType visitType) {
        return switch (visitType) {
            case OPD_NEW -> newPatientFee;
            case OPD_FOLLOWUP -> followupFee;
        };
    }

    public enum DoctorStatus {
        ACTIVE,
        INACTIVE
    }
}
