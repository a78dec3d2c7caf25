package com.medidesk.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "ot_procedures", indexes = {
    @Index(name = "idx_ot_admission", columnList = "admission_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OtProcedure extends BaseEntity {

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "admission_id", nullable = false, updatable = false)
    private Admission admission;

    @Column(name = "operation_name", nullable = false, length = 200)
    private String operationName;

    @Column(name = "operation_date", nullable = false)
    private LocalDateTime operationDate;

    @Column(name = "duration_minutes", nullable = false)
    private int durationMinutes;

    @Column(name = "surgeon_name", nullable = false, length = 100)
    private String surgeonName;

    @Column(name = "anesthesia_type", length = 100)
    private String anesthesiaType;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "created_by", nullable = false, length = 50)
    private String createdBy;
}
