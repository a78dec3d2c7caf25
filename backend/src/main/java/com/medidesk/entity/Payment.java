package com.medidesk.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "payments", indexes = {
    @Index(name = "idx_payment_patient", columnList = "patient_id"),
    @Index(name = "idx_payment_target", columnList = "target_type, target_id"),
    @Index(name = "idx_payment_date", columnList = "payment_date")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Payment extends BaseEntity {

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "patient_id", nullable = false, updatable = false)
    private Patient patient;

    // null when the payment is not tied to a visit or admission
    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "kind", column = @Column(name = "target_type", length = 10, updatable = false)),
        @AttributeOverride(name = "targetId", column = @Column(name = "target_id", length = 30, updatable = false))
    })
    private BillingTarget target;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_type", nullable = false, length = 15)
    private PaymentType paymentType;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_mode", nullable = false, length = 10)
    private PaymentMode paymentMode;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 10)
    @Builder.Default
    private PaymentStatus paymentStatus = PaymentStatus.COMPLETED;

    @Column(name = "transaction_reference", length = 100)
    private String transactionReference;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "payment_date", nullable = false)
    private LocalDateTime paymentDate;

    @Column(name = "created_by", nullable = false, length = 50)
    private String createdBy;

    public boolean isAdvance() {
        return paymentType == PaymentType.IPD_ADVANCE;
    }

    public enum PaymentType {
        OPD_FEE,
        IPD_ADVANCE,
        INVESTIGATION,
        PROCEDURE,
        SERVICE,
        OT,
        DISCHARGE,
        MANUAL
    }

    public enum PaymentStatus {
        COMPLETED,
        PENDING,
        FAILED,
        REFUNDED
    }
}
