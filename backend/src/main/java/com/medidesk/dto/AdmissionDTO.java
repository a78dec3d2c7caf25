package com.medidesk.dto;

import com.medidesk.entity.Admission;
import com.medidesk.entity.Bed;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public class AdmissionDTO {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AdmitRequest {
        @NotBlank(message = "Patient id is required")
        private String patientId;
        @NotBlank(message = "Bed id is required")
        private String bedId;
        @NotNull(message = "File charge is required")
        @DecimalMin(value = "0.00", message = "File charge cannot be negative")
        private BigDecimal fileCharge;
        private String visitId;
        private LocalDateTime admissionDate;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ChangeBedRequest {
        @NotBlank(message = "New bed id is required")
        private String newBedId;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CloseRequest {
        private LocalDateTime date;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Response {
        private String id;
        private String patientId;
        private String patientName;
        private String visitId;
        private String bedId;
        private String bedNumber;
        private Bed.WardType wardType;
        private LocalDateTime admissionDate;
        private LocalDateTime dischargeDate;
        private BigDecimal fileCharge;
        private Admission.AdmissionStatus status;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BedCharges {
        private String admissionId;
        private String bedId;
        private String bedNumber;
        private Bed.WardType wardType;
        private long days;
        private BigDecimal perDayCharge;
        private BigDecimal totalBedCharges;
    }
}
