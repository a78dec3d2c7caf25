package com.medidesk.dto;

import com.medidesk.entity.BillingTarget;
import com.medidesk.entity.Charge;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public class BillingDTO {

    /**
     * One line of a bulk charge request. Service lines may carry a start and end
     * time instead of a quantity; the quantity is then the elapsed hours, rounded up.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ChargeItem {
        @NotBlank(message = "Charge name is required")
        private String name;
        @NotNull(message = "Rate is required")
        @DecimalMin(value = "0.00", message = "Rate cannot be negative")
        private BigDecimal rate;
        @Builder.Default
        private int quantity = 1;
        private LocalDateTime startTime;
        private LocalDateTime endTime;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BulkChargeRequest {
        private String visitId;
        private String ipdId;
        @NotEmpty(message = "At least one charge is required")
        @Valid
        private List<ChargeItem> items;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CreateRequest {
        private String visitId;
        private String ipdId;
        @NotNull(message = "Charge type is required")
        private Charge.ChargeType chargeType;
        @NotBlank(message = "Charge name is required")
        private String chargeName;
        @NotNull(message = "Rate is required")
        @DecimalMin(value = "0.00", message = "Rate cannot be negative")
        private BigDecimal rate;
        @Min(value = 1, message = "Quantity must be positive")
        @Builder.Default
        private int quantity = 1;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UpdateRequest {
        private String chargeName;
        @DecimalMin(value = "0.00", message = "Rate cannot be negative")
        private BigDecimal rate;
        private Integer quantity;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Response {
        private String id;
        private String visitId;
        private String ipdId;
        private Charge.ChargeType chargeType;
        private String chargeName;
        private int quantity;
        private BigDecimal rate;
        private BigDecimal totalAmount;
        private LocalDateTime chargeDate;
        private String createdBy;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TotalResponse {
        private BillingTarget.Kind targetType;
        private String targetId;
        private BigDecimal totalCharges;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OtProcedureRequest {
        @NotBlank(message = "IPD id is required")
        private String ipdId;
        @NotBlank(message = "Operation name is required")
        private String operationName;
        @NotNull(message = "Operation date is required")
        private LocalDateTime operationDate;
        @Min(value = 1, message = "Duration must be positive")
        private int durationMinutes;
        @NotBlank(message = "Surgeon name is required")
        private String surgeonName;
        private String anesthesiaType;
        private String notes;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OtProcedureResponse {
        private String id;
        private String ipdId;
        private String operationName;
        private LocalDateTime operationDate;
        private int durationMinutes;
        private String surgeonName;
        private String anesthesiaType;
        private String notes;
        private String createdBy;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OtChargesRequest {
        @NotNull
        @DecimalMin(value = "0.00", message = "Surgeon charge cannot be negative")
        private BigDecimal surgeonCharge;
        @NotNull
        @DecimalMin(value = "0.00", message = "Anesthesia charge cannot be negative")
        private BigDecimal anesthesiaCharge;
        @NotNull
        @DecimalMin(value = "0.00", message = "Facility charge cannot be negative")
        private BigDecimal facilityCharge;
        @DecimalMin(value = "0.00", message = "Assistant charge cannot be negative")
        private BigDecimal assistantCharge;
    }
}
