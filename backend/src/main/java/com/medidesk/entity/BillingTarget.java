package com.medidesk.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * What a charge or payment is billed against: exactly one visit or one admission.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BillingTarget {

    @Enumerated(EnumType.STRING)
    @Column(name = "target_type", length = 10)
    private Kind kind;

    @Column(name = "target_id", length = 30)
    private String targetId;

    private BillingTarget(Kind kind, String targetId) {
        if (targetId == null || targetId.isBlank()) {
            throw new IllegalArgumentException(kind.label + " id is required");
        }
        this.kind = kind;
        this.targetId = targetId.trim();
    }

    public static BillingTarget visit(String visitId) {
        return new BillingTarget(Kind.VISIT, visitId);
    }

    public static BillingTarget admission(String admissionId) {
        return new BillingTarget(Kind.ADMISSION, admissionId);
    }

    /**
     * Builds a target from a pair of optional references, as they arrive from callers.
     *
     * @throws IllegalArgumentException unless exactly one reference is present
     */
    public static BillingTarget of(String visitId, String admissionId) {
        boolean hasVisit = visitId != null && !visitId.isBlank();
        boolean hasAdmission = admissionId != null && !admissionId.isBlank();
        if (hasVisit == hasAdmission) {
            throw new IllegalArgumentException("Exactly one of visit_id or ipd_id must be provided");
        }
        return hasVisit ? visit(visitId) : admission(admissionId);
    }

    public boolean isVisit() {
        return kind == Kind.VISIT;
    }

    public boolean isAdmission() {
        return kind == Kind.ADMISSION;
    }

    public String visitId() {
        return isVisit() ? targetId : null;
    }

    public String admissionId() {
        return isAdmission() ? targetId : null;
    }

    @Override
    public String toString() {
        return kind.label + " " + targetId;
    }

    public enum Kind {
        VISIT("Visit"),
        ADMISSION("IPD");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }
}
