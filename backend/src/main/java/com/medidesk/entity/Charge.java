package com.medidesk.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "billing_charges", indexes = {
    @Index(name = "idx_charge_target", columnList = "target_type, target_id"),
    @Index(name = "idx_charge_type", columnList = "charge_type")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Charge extends BaseEntity {

    public static final String TABLE = "billing_charges";

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "kind", column = @Column(name = "target_type", nullable = false, length = 10, updatable = false)),
        @AttributeOverride(name = "targetId", column = @Column(name = "target_id", nullable = false, length = 30, updatable = false))
    })
    private BillingTarget target;

    @Enumerated(EnumType.STRING)
    @Column(name = "charge_type", nullable = false, length = 15, updatable = false)
    private ChargeType chargeType;

    @Column(name = "charge_name", nullable = false, length = 100)
    private String chargeName;

    @Column(nullable = false)
    private int quantity;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal rate;

    @Column(name = "total_amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "charge_date", nullable = false)
    private LocalDateTime chargeDate;

    @Column(name = "created_by", nullable = false, length = 50)
    private String createdBy;

    public enum ChargeType {
        INVESTIGATION,
        PROCEDURE,
        SERVICE,
        OT,
        MANUAL,
        BED
    }
}
