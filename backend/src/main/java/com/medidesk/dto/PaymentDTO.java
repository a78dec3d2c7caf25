package com.medidesk.dto;

import com.medidesk.entity.Payment;
import com.medidesk.entity.PaymentMode;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

public class PaymentDTO {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CreateRequest {
        @NotBlank(message = "Patient id is required")
        private String patientId;
        @NotNull(message = "Amount is required")
        @DecimalMin(value = "0.01", message = "Payment amount must be positive")
        private BigDecimal amount;
        @NotBlank(message = "Payment mode is required")
        private String paymentMode;
        @NotNull(message = "Payment type is required")
        private Payment.PaymentType paymentType;
        private String visitId;
        private String ipdId;
        private String transactionReference;
        private String notes;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AdvanceRequest {
        @NotBlank(message = "IPD id is required")
        private String ipdId;
        @NotNull(message = "Amount is required")
        @DecimalMin(value = "0.01", message = "Payment amount must be positive")
        private BigDecimal amount;
        @NotBlank(message = "Payment mode is required")
        private String paymentMode;
        private String transactionReference;
        private String notes;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Response {
        private String id;
        private String patientId;
        private String visitId;
        private String ipdId;
        private Payment.PaymentType paymentType;
        private BigDecimal amount;
        private PaymentMode paymentMode;
        private Payment.PaymentStatus paymentStatus;
        private String transactionReference;
        private String notes;
        private LocalDateTime paymentDate;
        private String createdBy;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BalanceSummary {
        private String patientId;
        private BigDecimal totalCharges;
        private BigDecimal totalPaid;
        private BigDecimal balanceDue;
        private BigDecimal advanceBalance;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DailyCollection {
        private LocalDate date;
        private BigDecimal totalCollected;
    }
}
