package com.medidesk.dto;

import com.medidesk.entity.Bed;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.math.BigDecimal;
import java.util.Map;

public class BedDTO {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CreateRequest {
        @NotBlank(message = "Bed number is required")
        @Size(max = 10)
        private String bedNumber;
        @NotNull(message = "Ward type is required")
        private Bed.WardType wardType;
        @NotNull
        @DecimalMin(value = "0.00", message = "Per day charge cannot be negative")
        private BigDecimal perDayCharge;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RateUpdateRequest {
        @NotNull
        @DecimalMin(value = "0.00", message = "Per day charge cannot be negative")
        private BigDecimal perDayCharge;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Response {
        private String id;
        private String bedNumber;
        private Bed.WardType wardType;
        private BigDecimal perDayCharge;
        private Bed.BedStatus status;
    }

    /**
     * Per-status bed counts; also used as the accumulator while counting.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class WardOccupancy {
        private int total;
        private int occupied;
        private int available;
        private int maintenance;

        public void count(Bed.BedStatus status) {
            total++;
            switch (status) {
                case OCCUPIED -> occupied++;
                case AVAILABLE -> available++;
                case MAINTENANCE -> maintenance++;
            }
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OccupancyStats {
        private int totalBeds;
        private int occupied;
        private int available;
        private int maintenance;
        private BigDecimal occupancyRate;
        private Map<Bed.WardType, WardOccupancy> byWardType;
    }
}
