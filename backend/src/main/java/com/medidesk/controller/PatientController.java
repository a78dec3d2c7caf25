package com.medidesk.controller;

import com.medidesk.dto.PatientDTO;
import com.medidesk.dto.PaymentDTO;
import com.medidesk.entity.Patient;
import com.medidesk.service.PatientService;
import com.medidesk.service.PaymentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/v1/patients")
@RequiredArgsConstructor
@Tag(name = "Patients", description = "Patient registration and lookup")
public class PatientController {

    private final PatientService patientService;
    private final PaymentService paymentService;

    @PostMapping
    @Operation(summary = "Register a patient")
    public ResponseEntity<PatientDTO.Response> register(@Valid @RequestBody PatientDTO.RegisterRequest request) {
        Patient patient = patientService.register(request.getName(), request.getAge(), request.getGender(),
            request.getAddress(), request.getMobileNumber());
        return ResponseEntity.ok(mapToResponse(patient));
    }

    @GetMapping
    @Operation(summary = "Search patients by id, name or mobile number")
    public ResponseEntity<List<PatientDTO.Response>> searchPatients(
            @RequestParam String search,
            @RequestParam(defaultValue = "20") int limit) {

        List<PatientDTO.Response> patients = patientService.search(search, limit).stream()
            .map(this::mapToResponse)
            .toList();
        return ResponseEntity.ok(patients);
    }

    @GetMapping("/{patientId}")
    @Operation(summary = "Get patient by ID")
    public ResponseEntity<PatientDTO.Response> getPatient(@PathVariable String patientId) {
        return ResponseEntity.ok(mapToResponse(patientService.findById(patientId)));
    }

    @GetMapping("/mobile/{mobileNumber}")
    @Operation(summary = "Get patient by mobile number")
    public ResponseEntity<PatientDTO.Response> getPatientByMobile(@PathVariable String mobileNumber) {
        return ResponseEntity.ok(mapToResponse(patientService.findByMobile(mobileNumber)));
    }

    @PatchMapping("/{patientId}")
    @Operation(summary = "Update patient details")
    public ResponseEntity<PatientDTO.Response> updatePatient(
            @PathVariable String patientId,
            @RequestBody PatientDTO.UpdateRequest request) {

        Patient patient = patientService.update(patientId, request.getName(), request.getAge(),
            request.getGender(), request.getAddress(), request.getMobileNumber());
        return ResponseEntity.ok(mapToResponse(patient));
    }

    @GetMapping("/{patientId}/balance")
    @Operation(summary = "Outstanding balance across all visits and admissions")
    public ResponseEntity<PaymentDTO.BalanceSummary> getBalance(@PathVariable String patientId) {
        return ResponseEntity.ok(paymentService.calculateBalance(patientId, null, null));
    }

    private PatientDTO.Response mapToResponse(Patient patient) {
        return PatientDTO.Response.builder()
            .id(patient.getId())
            .name(patient.getName())
            .age(patient.getAge())
            .gender(patient.getGender())
            .address(patient.getAddress())
            .mobileNumber(patient.getMobileNumber())
            .createdAt(patient.getCreatedAt())
            .build();
    }
}
