package com.medidesk.dto;

import com.medidesk.entity.Doctor;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.math.BigDecimal;

public class DoctorDTO {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Response {
        private String id;
        private String name;
        private String department;
        private BigDecimal newPatientFee;
        private BigDecimal followupFee;
        private Doctor.DoctorStatus status;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CreateRequest {
        @NotBlank(message = "Doctor name is required")
        private String name;
        @NotBlank(message = "Department is required")
        private String department;
        @NotNull
        @DecimalMin(value = "0.00", message = "Fee cannot be negative")
        private BigDecimal newPatientFee;
        @NotNull
        @DecimalMin(value = "0.00", message = "Fee cannot be negative")
        private BigDecimal followupFee;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FeeUpdateRequest {
        @DecimalMin(value = "0.00", message = "Fee cannot be negative")
        private BigDecimal newPatientFee;
        @DecimalMin(value = "0.00", message = "Fee cannot be negative")
        private BigDecimal followupFee;
    }
}
