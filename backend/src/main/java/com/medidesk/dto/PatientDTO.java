package com.medidesk.dto;

import com.medidesk.entity.Patient;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.*;

import java.time.Instant;

public class PatientDTO {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Response {
        private String id;
        private String name;
        private int age;
        private Patient.Gender gender;
        private String address;
        private String mobileNumber;
        private Instant createdAt;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RegisterRequest {
        @NotBlank(message = "Patient name is required")
        private String name;
        @NotNull(message = "Age is required")
        @Min(value = 0, message = "Age must be between 0 and 150")
        @Max(value = 150, message = "Age must be between 0 and 150")
        private Integer age;
        @NotNull(message = "Gender is required")
        private Patient.Gender gender;
        @NotBlank(message = "Address is required")
        private String address;
        @NotBlank(message = "Mobile number is required")
        @Pattern(regexp = "^[6-9]\\d{9}$", message = "Invalid mobile number")
        private String mobileNumber;
    }

    /**
     * Partial update; null fields are left unchanged.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UpdateRequest {
        private String name;
        private Integer age;
        private Patient.Gender gender;
        private String address;
        private String mobileNumber;
    }
}
