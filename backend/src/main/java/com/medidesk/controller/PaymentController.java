package com.medidesk.controller;

import com.medidesk.dto.PaymentDTO;
import com.medidesk.entity.BillingTarget;
import com.medidesk.entity.Payment;
import com.medidesk.service.BillingService;
import com.medidesk.service.PaymentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/v1/payments")
@RequiredArgsConstructor
@Tag(name = "Payments", description = "Payments, IPD advances, balances and collections")
public class PaymentController {

    private final PaymentService paymentService;

    @PostMapping
    @Operation(summary = "Record a payment")
    public ResponseEntity<PaymentDTO.Response> recordPayment(
            @AuthenticationPrincipal Jwt jwt,
            @Valid @RequestBody PaymentDTO.CreateRequest request) {

        BillingTarget target = hasText(request.getVisitId()) || hasText(request.getIpdId())
            ? BillingService.targetOf(request.getVisitId(), request.getIpdId())
            : null;
        Payment payment = paymentService.recordPayment(request.getPatientId(), request.getAmount(),
            request.getPaymentMode(), request.getPaymentType(), target, Actors.of(jwt),
            request.getTransactionReference(), request.getNotes());
        return ResponseEntity.ok(mapToResponse(payment));
    }

    @PostMapping("/advance")
    @Operation(summary = "Record an IPD advance")
    public ResponseEntity<PaymentDTO.Response> recordAdvance(
            @AuthenticationPrincipal Jwt jwt,
            @Valid @RequestBody PaymentDTO.AdvanceRequest request) {

        Payment payment = paymentService.recordAdvance(request.getIpdId(), request.getAmount(),
            request.getPaymentMode(), Actors.of(jwt), request.getTransactionReference(), request.getNotes());
        return ResponseEntity.ok(mapToResponse(payment));
    }

    @GetMapping("/{paymentId}")
    @Operation(summary = "Get payment by ID")
    public ResponseEntity<PaymentDTO.Response> getPayment(@PathVariable String paymentId) {
        return ResponseEntity.ok(mapToResponse(paymentService.getPayment(paymentId)));
    }

    @GetMapping("/patient/{patientId}")
    @Operation(summary = "Payments of a patient, newest first")
    public ResponseEntity<List<PaymentDTO.Response>> byPatient(@PathVariable String patientId) {
        return ResponseEntity.ok(paymentService.findByPatient(patientId).stream().map(this::mapToResponse).toList());
    }

    @GetMapping("/visit/{visitId}")
    @Operation(summary = "Payments against a visit")
    public ResponseEntity<List<PaymentDTO.Response>> byVisit(@PathVariable String visitId) {
        return ResponseEntity.ok(paymentService.findByTarget(BillingTarget.visit(visitId)).stream()
            .map(this::mapToResponse)
            .toList());
    }

    @GetMapping("/admission/{admissionId}")
    @Operation(summary = "Payments against an admission")
    public ResponseEntity<List<PaymentDTO.Response>> byAdmission(@PathVariable String admissionId) {
        return ResponseEntity.ok(paymentService.findByTarget(BillingTarget.admission(admissionId)).stream()
            .map(this::mapToResponse)
            .toList());
    }

    @GetMapping("/admission/{admissionId}/advances")
    @Operation(summary = "IPD advances of an admission")
    public ResponseEntity<List<PaymentDTO.Response>> advances(@PathVariable String admissionId) {
        return ResponseEntity.ok(paymentService.findAdvances(admissionId).stream().map(this::mapToResponse).toList());
    }

    @GetMapping("/balance")
    @Operation(summary = "Balance for a patient, visit or admission")
    public ResponseEntity<PaymentDTO.BalanceSummary> balance(
            @RequestParam String patientId,
            @RequestParam(required = false) String visitId,
            @RequestParam(required = false) String ipdId) {
        return ResponseEntity.ok(paymentService.calculateBalance(patientId, visitId, ipdId));
    }

    @GetMapping("/daily-collection")
    @Operation(summary = "Completed payments taken on a day")
    public ResponseEntity<PaymentDTO.DailyCollection> dailyCollection(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(PaymentDTO.DailyCollection.builder()
            .date(date)
            .totalCollected(paymentService.dailyCollection(date))
            .build());
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private PaymentDTO.Response mapToResponse(Payment payment) {
        BillingTarget target = payment.getTarget();
        return PaymentDTO.Response.builder()
            .id(payment.getId())
            .patientId(payment.getPatient().getId())
            .visitId(target != null ? target.visitId() : null)
            .ipdId(target != null ? target.admissionId() : null)
            .paymentType(payment.getPaymentType())
            .amount(payment.getAmount())
            .paymentMode(payment.getPaymentMode())
            .paymentStatus(payment.getPaymentStatus())
            .transactionReference(payment.getTransactionReference())
            .notes(payment.getNotes())
            .paymentDate(payment.getPaymentDate())
            .createdBy(payment.getCreatedBy())
            .build();
    }
}
