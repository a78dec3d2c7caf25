package com.medidesk.controller;

import com.medidesk.dto.DoctorDTO;
import com.medidesk.entity.Doctor;
import com.medidesk.service.DoctorService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/v1/doctors")
@RequiredArgsConstructor
@Tag(name = "Doctors", description = "Doctors, departments and consultation fees")
public class DoctorController {

    private final DoctorService doctorService;

    @PostMapping
    @Operation(summary = "Add a doctor")
    public ResponseEntity<DoctorDTO.Response> createDoctor(@Valid @RequestBody DoctorDTO.CreateRequest request) {
        Doctor doctor = doctorService.create(request.getName(), request.getDepartment(),
            request.getNewPatientFee(), request.getFollowupFee());
        return ResponseEntity.ok(mapToResponse(doctor));
    }

    @GetMapping
    @Operation(summary = "List active doctors, optionally by department")
    public ResponseEntity<List<DoctorDTO.Response>> listDoctors(@RequestParam(required = false) String department) {
        List<Doctor> doctors = department == null || department.isBlank()
            ? doctorService.findActive()
            : doctorService.findByDepartment(department);
        return ResponseEntity.ok(doctors.stream().map(this::mapToResponse).toList());
    }

    @GetMapping("/departments")
    @Operation(summary = "Departments with active doctors")
    public ResponseEntity<List<String>> departments() {
        return ResponseEntity.ok(doctorService.departments());
    }

    @GetMapping("/{doctorId}")
    @Operation(summary = "Get doctor by ID")
    public ResponseEntity<DoctorDTO.Response> getDoctor(@PathVariable String doctorId) {
        return ResponseEntity.ok(mapToResponse(doctorService.findById(doctorId)));
    }

    @PutMapping("/{doctorId}/fees")
    @Operation(summary = "Change consultation fees (audited)")
    public ResponseEntity<DoctorDTO.Response> updateFees(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable String doctorId,
            @Valid @RequestBody DoctorDTO.FeeUpdateRequest request) {

        Doctor doctor = doctorService.updateFees(doctorId, request.getNewPatientFee(), request.getFollowupFee(),
            Actors.of(jwt));
        return ResponseEntity.ok(mapToResponse(doctor));
    }

    @PutMapping("/{doctorId}/status")
    @Operation(summary = "Activate or deactivate a doctor")
    public ResponseEntity<DoctorDTO.Response> setStatus(
            @PathVariable String doctorId,
            @RequestParam Doctor.DoctorStatus status) {
        return ResponseEntity.ok(mapToResponse(doctorService.setStatus(doctorId, status)));
    }

    private DoctorDTO.Response mapToResponse(Doctor doctor) {
        return DoctorDTO.Response.builder()
            .id(doctor.getId())
            .name(doctor.getName())
            .department(doctor.getDepartment())
            .newPatientFee(doctor.getNewPatientFee())
            .followupFee(doctor.getFollowupFee())
            .status(doctor.getStatus())
            .build();
    }
}
