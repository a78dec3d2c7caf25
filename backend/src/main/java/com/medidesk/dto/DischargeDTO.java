package com.medidesk.dto;

import com.medidesk.entity.Bed;
import com.medidesk.entity.Patient;
import com.medidesk.entity.Payment;
import com.medidesk.entity.PaymentMode;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Discharge bill and its blocks, shaped for the printed bill.
 */
public class DischargeDTO {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DischargeBill {
        private String hospitalName;
        private String ipdId;
        private PatientInfo patient;
        private AdmissionInfo admission;
        // insertion order is print order
        private Map<String, List<BillLine>> chargesByType;
        private List<PaymentLine> payments;
        private Summary summary;
        private LocalDateTime generatedDate;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PatientInfo {
        private String patientId;
        private String name;
        private int age;
        private Patient.Gender gender;
        private String mobileNumber;
        private String address;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AdmissionInfo {
        private String ipdId;
        private LocalDateTime admissionDate;
        private LocalDateTime dischargeDate;
        private long stayDays;
        private String bedNumber;
        private Bed.WardType wardType;
        private BigDecimal perDayCharge;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BillLine {
        private String chargeName;
        private int quantity;
        private BigDecimal rate;
        private BigDecimal totalAmount;
        private LocalDateTime chargeDate;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PaymentLine {
        private String paymentId;
        private Payment.PaymentType paymentType;
        private BigDecimal amount;
        private PaymentMode paymentMode;
        private String transactionReference;
        private LocalDateTime paymentDate;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Summary {
        private BigDecimal totalCharges;
        private BigDecimal totalPaid;
        private BigDecimal advancePaid;
        private BigDecimal balanceDue;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PendingAmount {
        private String ipdId;
        private BigDecimal pendingAmount;
    }
}
