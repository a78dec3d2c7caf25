package com.medidesk.controller;

import com.medidesk.dto.PaymentDTO;
import com.medidesk.dto.VisitDTO;
import com.medidesk.entity.Visit;
import com.medidesk.service.PaymentService;
import com.medidesk.service.VisitService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1/visits")
@RequiredArgsConstructor
@Tag(name = "Visits", description = "OPD visits and serial numbers")
public class VisitController {

    private final VisitService visitService;
    private final PaymentService paymentService;

    @PostMapping
    @Operation(summary = "Create an OPD visit")
    public ResponseEntity<VisitDTO.Response> createVisit(@Valid @RequestBody VisitDTO.CreateRequest request) {
        Visit visit = visitService.createVisit(request.getPatientId(), request.getDoctorId(),
            request.getVisitType(), request.getPaymentMode(), request.getVisitDate(), request.getVisitTime());
        return ResponseEntity.ok(mapToResponse(visit));
    }

    @GetMapping("/{visitId}")
    @Operation(summary = "Get visit by ID")
    public ResponseEntity<VisitDTO.Response> getVisit(@PathVariable String visitId) {
        return ResponseEntity.ok(mapToResponse(visitService.findById(visitId)));
    }

    @PutMapping("/{visitId}/status")
    @Operation(summary = "Complete or cancel an active visit")
    public ResponseEntity<VisitDTO.Response> updateStatus(
            @PathVariable String visitId,
            @Valid @RequestBody VisitDTO.StatusUpdateRequest request) {
        return ResponseEntity.ok(mapToResponse(visitService.updateStatus(visitId, request.getStatus())));
    }

    @GetMapping("/daily")
    @Operation(summary = "Visits of a day in serial order")
    public ResponseEntity<List<VisitDTO.Response>> dailyVisits(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) String doctorId) {
        return ResponseEntity.ok(visitService.dailyVisits(date, doctorId).stream().map(this::mapToResponse).toList());
    }

    @GetMapping("/patient/{patientId}")
    @Operation(summary = "Visit history of a patient, newest first")
    public ResponseEntity<List<VisitDTO.Response>> patientVisits(
            @PathVariable String patientId,
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(visitService.patientVisits(patientId, limit).stream()
            .map(this::mapToResponse)
            .toList());
    }

    @GetMapping("/doctor/{doctorId}/count")
    @Operation(summary = "Number of visits for a doctor on a day")
    public ResponseEntity<Map<String, Object>> doctorDailyCount(
            @PathVariable String doctorId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(Map.of("doctorId", doctorId, "count", visitService.doctorDailyCount(doctorId, date)));
    }

    @GetMapping("/{visitId}/balance")
    @Operation(summary = "Balance for a visit including its OPD fee")
    public ResponseEntity<PaymentDTO.BalanceSummary> getBalance(@PathVariable String visitId) {
        Visit visit = visitService.findById(visitId);
        return ResponseEntity.ok(paymentService.calculateBalance(visit.getPatient().getId(), visitId, null));
    }

    private VisitDTO.Response mapToResponse(Visit visit) {
        return VisitDTO.Response.builder()
            .id(visit.getId())
            .patientId(visit.getPatient().getId())
            .patientName(visit.getPatient().getName())
            .doctorId(visit.getDoctor().getId())
            .doctorName(visit.getDoctor().getName())
            .department(visit.getDepartment())
            .visitType(visit.getVisitType())
            .serialNumber(visit.getSerialNumber())
            .visitDate(visit.getVisitDate())
            .visitTime(visit.getVisitTime())
            .opdFee(visit.getOpdFee())
            .paymentMode(visit.getPaymentMode())
            .status(visit.getStatus())
            .build();
    }
}
