package com.medidesk.controller;

import com.medidesk.dto.AdmissionDTO;
import com.medidesk.dto.DischargeDTO;
import com.medidesk.service.DischargeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/v1/discharge")
@RequiredArgsConstructor
@Tag(name = "Discharge", description = "Discharge bills and processing")
public class DischargeController {

    private final DischargeService dischargeService;

    @GetMapping("/{admissionId}/bill")
    @Operation(summary = "Generate the discharge bill")
    public ResponseEntity<DischargeDTO.DischargeBill> getBill(@PathVariable String admissionId) {
        return ResponseEntity.ok(dischargeService.generateDischargeBill(admissionId));
    }

    @PostMapping("/{admissionId}")
    @Operation(summary = "Discharge the patient and return the final bill")
    public ResponseEntity<DischargeDTO.DischargeBill> processDischarge(
            @PathVariable String admissionId,
            @RequestBody(required = false) AdmissionDTO.CloseRequest request) {

        dischargeService.processDischarge(admissionId, request != null ? request.getDate() : null);
        return ResponseEntity.ok(dischargeService.generateDischargeBill(admissionId));
    }

    @GetMapping("/{admissionId}/pending")
    @Operation(summary = "Amount still due for an admission")
    public ResponseEntity<DischargeDTO.PendingAmount> pending(@PathVariable String admissionId) {
        return ResponseEntity.ok(DischargeDTO.PendingAmount.builder()
            .ipdId(admissionId)
            .pendingAmount(dischargeService.calculatePendingAmount(admissionId))
            .build());
    }
}
