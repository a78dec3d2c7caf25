package com.medidesk.controller;

import com.medidesk.dto.BillingDTO;
import com.medidesk.entity.BillingTarget;
import com.medidesk.entity.Charge;
import com.medidesk.entity.OtProcedure;
import com.medidesk.service.BillingService;
import com.medidesk.service.OtService;
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
@RequestMapping("/v1/billing")
@RequiredArgsConstructor
@Tag(name = "Billing", description = "Charges against visits and admissions, including OT")
public class BillingController {

    private final BillingService billingService;
    private final OtService otService;

    @PostMapping("/charges")
    @Operation(summary = "Add a single charge")
    public ResponseEntity<BillingDTO.Response> createCharge(
            @AuthenticationPrincipal Jwt jwt,
            @Valid @RequestBody BillingDTO.CreateRequest request) {

        BillingTarget target = BillingService.targetOf(request.getVisitId(), request.getIpdId());
        Charge charge = billingService.createCharge(request.getChargeType(), request.getChargeName(),
            request.getRate(), request.getQuantity(), target, Actors.of(jwt));
        return ResponseEntity.ok(mapToResponse(charge));
    }

    @PostMapping("/charges/investigations")
    @Operation(summary = "Add investigation charges")
    public ResponseEntity<List<BillingDTO.Response>> addInvestigations(
            @AuthenticationPrincipal Jwt jwt,
            @Valid @RequestBody BillingDTO.BulkChargeRequest request) {
        return ok(billingService.addInvestigationCharges(target(request), request.getItems(), Actors.of(jwt)));
    }

    @PostMapping("/charges/procedures")
    @Operation(summary = "Add procedure charges")
    public ResponseEntity<List<BillingDTO.Response>> addProcedures(
            @AuthenticationPrincipal Jwt jwt,
            @Valid @RequestBody BillingDTO.BulkChargeRequest request) {
        return ok(billingService.addProcedureCharges(target(request), request.getItems(), Actors.of(jwt)));
    }

    @PostMapping("/charges/services")
    @Operation(summary = "Add service charges, billed per started hour when times are given")
    public ResponseEntity<List<BillingDTO.Response>> addServices(
            @AuthenticationPrincipal Jwt jwt,
            @Valid @RequestBody BillingDTO.BulkChargeRequest request) {
        return ok(billingService.addServiceCharges(target(request), request.getItems(), Actors.of(jwt)));
    }

    @PostMapping("/charges/manual")
    @Operation(summary = "Add manual charges (audited)")
    public ResponseEntity<List<BillingDTO.Response>> addManual(
            @AuthenticationPrincipal Jwt jwt,
            @Valid @RequestBody BillingDTO.BulkChargeRequest request) {
        return ok(billingService.addManualCharges(target(request), request.getItems(), Actors.of(jwt)));
    }

    @PostMapping("/admissions/{admissionId}/bed-charges")
    @Operation(summary = "Post accrued bed charges for an admission")
    public ResponseEntity<BillingDTO.Response> postBedCharges(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable String admissionId) {
        return ResponseEntity.ok(mapToResponse(billingService.postBedCharges(admissionId, Actors.of(jwt))));
    }

    @GetMapping("/charges/{chargeId}")
    @Operation(summary = "Get charge by ID")
    public ResponseEntity<BillingDTO.Response> getCharge(@PathVariable String chargeId) {
        return ResponseEntity.ok(mapToResponse(billingService.getCharge(chargeId)));
    }

    @PatchMapping("/charges/{chargeId}")
    @Operation(summary = "Edit a charge; manual charge edits are audited")
    public ResponseEntity<BillingDTO.Response> updateCharge(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable String chargeId,
            @Valid @RequestBody BillingDTO.UpdateRequest request) {

        Charge charge = billingService.updateCharge(chargeId, request.getChargeName(), request.getRate(),
            request.getQuantity(), Actors.of(jwt));
        return ResponseEntity.ok(mapToResponse(charge));
    }

    @GetMapping("/charges")
    @Operation(summary = "Charges of a visit or admission, optionally by type")
    public ResponseEntity<List<BillingDTO.Response>> getCharges(
            @RequestParam(required = false) String visitId,
            @RequestParam(required = false) String ipdId,
            @RequestParam(required = false) Charge.ChargeType chargeType) {

        BillingTarget target = BillingService.targetOf(visitId, ipdId);
        List<Charge> charges = chargeType == null
            ? billingService.getCharges(target)
            : billingService.getChargesByType(target, chargeType);
        return ok(charges);
    }

    @GetMapping("/total")
    @Operation(summary = "Total of all charges of a visit or admission")
    public ResponseEntity<BillingDTO.TotalResponse> getTotal(
            @RequestParam(required = false) String visitId,
            @RequestParam(required = false) String ipdId) {

        BillingTarget target = BillingService.targetOf(visitId, ipdId);
        return ResponseEntity.ok(BillingDTO.TotalResponse.builder()
            .targetType(target.getKind())
            .targetId(target.getTargetId())
            .totalCharges(billingService.calculateTotalCharges(target))
            .build());
    }

    @PostMapping("/ot")
    @Operation(summary = "Record an OT procedure")
    public ResponseEntity<BillingDTO.OtProcedureResponse> createOtProcedure(
            @AuthenticationPrincipal Jwt jwt,
            @Valid @RequestBody BillingDTO.OtProcedureRequest request) {

        OtProcedure procedure = otService.createProcedure(request.getIpdId(), request.getOperationName(),
            request.getOperationDate(), request.getDurationMinutes(), request.getSurgeonName(),
            request.getAnesthesiaType(), request.getNotes(), Actors.of(jwt));
        return ResponseEntity.ok(mapOtToResponse(procedure));
    }

    @GetMapping("/ot/admission/{admissionId}")
    @Operation(summary = "OT procedures of an admission")
    public ResponseEntity<List<BillingDTO.OtProcedureResponse>> otProcedures(@PathVariable String admissionId) {
        return ResponseEntity.ok(otService.findByAdmission(admissionId).stream().map(this::mapOtToResponse).toList());
    }

    @PostMapping("/ot/{otId}/charges")
    @Operation(summary = "Bill the surgeon, anesthesia, facility and assistant charges of an operation")
    public ResponseEntity<List<BillingDTO.Response>> addOtCharges(
            @AuthenticationPrincipal Jwt jwt,
            @PathVariable String otId,
            @Valid @RequestBody BillingDTO.OtChargesRequest request) {

        OtProcedure procedure = otService.getProcedure(otId);
        return ok(otService.addOtCharges(procedure.getAdmission().getId(), otId, request.getSurgeonCharge(),
            request.getAnesthesiaCharge(), request.getFacilityCharge(), request.getAssistantCharge(),
            Actors.of(jwt)));
    }

    private static BillingTarget target(BillingDTO.BulkChargeRequest request) {
        return BillingService.targetOf(request.getVisitId(), request.getIpdId());
    }

    private ResponseEntity<List<BillingDTO.Response>> ok(List<Charge> charges) {
        return ResponseEntity.ok(charges.stream().map(this::mapToResponse).toList());
    }

    private BillingDTO.Response mapToResponse(Charge charge) {
        return BillingDTO.Response.builder()
            .id(charge.getId())
            .visitId(charge.getTarget().visitId())
            .ipdId(charge.getTarget().admissionId())
            .chargeType(charge.getChargeType())
            .chargeName(charge.getChargeName())
            .quantity(charge.getQuantity())
            .rate(charge.getRate())
            .totalAmount(charge.getTotalAmount())
            .chargeDate(charge.getChargeDate())
            .createdBy(charge.getCreatedBy())
            .build();
    }

    private BillingDTO.OtProcedureResponse mapOtToResponse(OtProcedure procedure) {
        return BillingDTO.OtProcedureResponse.builder()
            .id(procedure.getId())
            .ipdId(procedure.getAdmission().getId())
            .operationName(procedure.getOperationName())
            .operationDate(procedure.getOperationDate())
            .durationMinutes(procedure.getDurationMinutes())
            .surgeonName(procedure.getSurgeonName())
            .anesthesiaType(procedure.getAnesthesiaType())
            .notes(procedure.getNotes())
            .createdBy(procedure.getCreatedBy())
            .build();
    }
}
