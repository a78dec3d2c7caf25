package com.medidesk.controller;

import com.medidesk.dto.AdmissionDTO;
import com.medidesk.dto.PaymentDTO;
import com.medidesk.entity.Admission;
import com.medidesk.service.AdmissionService;
import com.medidesk.service.PaymentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/v1/admissions")
@RequiredArgsConstructor
@Tag(name = "Admissions", description = "IPD admission, bed changes, discharge and transfer")
public class AdmissionController {

    private final AdmissionService admissionService;
    private final PaymentService paymentService;

    @PostMapping
    @Operation(summary = "Admit a patient into an available bed")
    public ResponseEntity<AdmissionDTO.Response> admit(@Valid @RequestBody AdmissionDTO.AdmitRequest request) {
        Admission admission = admissionService.admit(request.getPatientId(), request.getBedId(),
            request.getFileCharge(), request.getVisitId(), request.getAdmissionDate());
        return ResponseEntity.ok(mapToResponse(admission));
    }

    @GetMapping("/{admissionId}")
    @Operation(summary = "Get admission by ID")
    public ResponseEntity<AdmissionDTO.Response> getAdmission(@PathVariable String admissionId) {
        return ResponseEntity.ok(mapToResponse(admissionService.getAdmission(admissionId)));
    }

    @GetMapping("/active")
    @Operation(summary = "Currently admitted patients")
    public ResponseEntity<List<AdmissionDTO.Response>> activeAdmissions() {
        return ResponseEntity.ok(admissionService.findActiveAdmissions().stream().map(this::mapToResponse).toList());
    }

    @GetMapping("/patient/{patientId}")
    @Operation(summary = "Admissions of a patient, optionally by status")
    public ResponseEntity<List<AdmissionDTO.Response>> patientAdmissions(
            @PathVariable String patientId,
            @RequestParam(required = false) Admission.AdmissionStatus status) {
        return ResponseEntity.ok(admissionService.findPatientAdmissions(patientId, status).stream()
            .map(this::mapToResponse)
            .toList());
    }

    @PostMapping("/{admissionId}/change-bed")
    @Operation(summary = "Move an admitted patient to another bed")
    public ResponseEntity<AdmissionDTO.Response> changeBed(
            @PathVariable String admissionId,
            @Valid @RequestBody AdmissionDTO.ChangeBedRequest request) {
        return ResponseEntity.ok(mapToResponse(admissionService.changeBed(admissionId, request.getNewBedId())));
    }

    @PostMapping("/{admissionId}/discharge")
    @Operation(summary = "Discharge and release the bed")
    public ResponseEntity<AdmissionDTO.Response> discharge(
            @PathVariable String admissionId,
            @RequestBody(required = false) AdmissionDTO.CloseRequest request) {
        return ResponseEntity.ok(mapToResponse(
            admissionService.discharge(admissionId, request != null ? request.getDate() : null)));
    }

    @PostMapping("/{admissionId}/transfer")
    @Operation(summary = "Transfer out to another facility and release the bed")
    public ResponseEntity<AdmissionDTO.Response> transferOut(
            @PathVariable String admissionId,
            @RequestBody(required = false) AdmissionDTO.CloseRequest request) {
        return ResponseEntity.ok(mapToResponse(
            admissionService.transferOut(admissionId, request != null ? request.getDate() : null)));
    }

    @GetMapping("/{admissionId}/bed-charges")
    @Operation(summary = "Bed charges accrued so far")
    public ResponseEntity<AdmissionDTO.BedCharges> bedCharges(@PathVariable String admissionId) {
        return ResponseEntity.ok(admissionService.computeBedCharges(admissionId));
    }

    @GetMapping("/{admissionId}/balance")
    @Operation(summary = "Balance for an admission including its file charge")
    public ResponseEntity<PaymentDTO.BalanceSummary> getBalance(@PathVariable String admissionId) {
        Admission admission = admissionService.getAdmission(admissionId);
        return ResponseEntity.ok(paymentService.calculateBalance(admission.getPatient().getId(), null, admissionId));
    }

    private AdmissionDTO.Response mapToResponse(Admission admission) {
        return AdmissionDTO.Response.builder()
            .id(admission.getId())
            .patientId(admission.getPatient().getId())
            .patientName(admission.getPatient().getName())
            .visitId(admission.getVisit() != null ? admission.getVisit().getId() : null)
            .bedId(admission.getBed().getId())
            .bedNumber(admission.getBed().getBedNumber())
            .wardType(admission.getBed().getWardType())
            .admissionDate(admission.getAdmissionDate())
            .dischargeDate(admission.getDischargeDate())
            .fileCharge(admission.getFileCharge())
            .status(admission.getStatus())
            .build();
    }
}
