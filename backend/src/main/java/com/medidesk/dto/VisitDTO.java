package com.medidesk.dto;

import com.medidesk.entity.PaymentMode;
import com.medidesk.entity.Visit;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;

public class VisitDTO {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Response {
        private String id;
        private String patientId;
        private String patientName;
        private String doctorId;
        private String doctorName;
        private String department;
        private Visit.VisitType visitType;
        private int serialNumber;
        private LocalDate visitDate;
        private LocalTime visitTime;
        private BigDecimal opdFee;
        private PaymentMode paymentMode;
        private Visit.VisitStatus status;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CreateRequest {
        @NotBlank(message = "Patient id is required")
        private String patientId;
        @NotBlank(message = "Doctor id is required")
        private String doctorId;
        @NotNull(message = "Visit type is required")
        private Visit.VisitType visitType;
        @NotBlank(message = "Payment mode is required")
        private String paymentMode;
        private LocalDate visitDate;
        private LocalTime visitTime;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StatusUpdateRequest {
        @NotNull(message = "Status is required")
        private Visit.VisitStatus status;
    }
}
