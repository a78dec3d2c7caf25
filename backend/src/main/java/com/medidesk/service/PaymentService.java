package com.medidesk.service;

import com.medidesk.dto.PaymentDTO;
import com.medidesk.entity.Admission;
import com.medidesk.entity.BillingTarget;
import com.medidesk.entity.Patient;
import com.medidesk.entity.Payment;
import com.medidesk.entity.PaymentMode;
import com.medidesk.entity.Visit;
import com.medidesk.exception.InvalidRequestException;
import com.medidesk.exception.ResourceNotFoundException;
import com.medidesk.repository.AdmissionRepository;
import com.medidesk.repository.ChargeRepository;
import com.medidesk.repository.PatientRepository;
import com.medidesk.repository.PaymentRepository;
import com.medidesk.repository.VisitRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Payment ledger and balance computation. Balances are always computed from the
 * store; nothing is cached.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentService {

    private final PaymentRepository paymentRepository;
    private final PatientRepository patientRepository;
    private final VisitRepository visitRepository;
    private final AdmissionRepository admissionRepository;
    private final ChargeRepository chargeRepository;
    private final IdGenerator idGenerator;
    private final Clock clock;

    /**
     * Records a completed payment. The target is optional; when present it must
     * belong to the paying patient.
     */
    @Transactional(timeoutString = "${medidesk.tx.timeout-seconds:10}")
    public Payment recordPayment(String patientId, BigDecimal amount, String paymentMode,
                                 Payment.PaymentType paymentType, BillingTarget target, String actor,
                                 String transactionReference, String notes) {
        if (amount == null || !Money.isPositive(Money.of(amount))) {
            throw new InvalidRequestException("Amount must be positive");
        }
        PaymentMode mode = PaymentMode.parse(paymentMode)
            .orElseThrow(() -> new InvalidRequestException("Payment mode must be one of: CASH, UPI, CARD"));
        if (paymentType == null) {
            throw new InvalidRequestException("Payment type is required");
        }

        Patient patient = patientRepository.findById(patientId)
            .orElseThrow(() -> ResourceNotFoundException.of("Patient", patientId));
        if (target != null) {
            requireTargetOwnedBy(target, patientId);
        }

        Payment payment = Payment.builder()
            .patient(patient)
            .target(target)
            .paymentType(paymentType)
            .amount(Money.of(amount))
            .paymentMode(mode)
            .paymentStatus(Payment.PaymentStatus.COMPLETED)
            .transactionReference(transactionReference)
            .notes(notes)
            .paymentDate(LocalDateTime.now(clock))
            .createdBy(actor != null && !actor.isBlank() ? actor : BillingService.SYSTEM_ACTOR)
            .build();
        payment.setId(idGenerator.next(IdGenerator.IdKind.PAYMENT));

        payment = paymentRepository.save(payment);
        log.info("Payment {} of {} ({}, {}) recorded for patient {}{}", payment.getId(), payment.getAmount(),
            paymentType, mode, patientId, target != null ? " against " + target : "");
        return payment;
    }

    @Transactional(timeoutString = "${medidesk.tx.timeout-seconds:10}")
    public Payment recordAdvance(String admissionId, BigDecimal amount, String paymentMode, String actor,
                                 String transactionReference, String notes) {
        Admission admission = admissionRepository.findById(admissionId)
            .orElseThrow(() -> ResourceNotFoundException.of("IPD admission", admissionId));
        return recordPayment(admission.getPatient().getId(), amount, paymentMode, Payment.PaymentType.IPD_ADVANCE,
            BillingTarget.admission(admissionId), actor, transactionReference,
            notes != null ? notes : "IPD Advance Payment");
    }

    @Transactional(readOnly = true)
    public Payment getPayment(String paymentId) {
        return paymentRepository.findById(paymentId)
            .orElseThrow(() -> ResourceNotFoundException.of("Payment", paymentId));
    }

    @Transactional(readOnly = true)
    public List<Payment> findByPatient(String patientId) {
        return paymentRepository.findByPatientId(patientId);
    }

    @Transactional(readOnly = true)
    public List<Payment> findByTarget(BillingTarget target) {
        return paymentRepository.findByTarget(target.getKind(), target.getTargetId());
    }

    @Transactional(readOnly = true)
    public List<Payment> findAdvances(String admissionId) {
        return paymentRepository.findByTargetAndType(BillingTarget.Kind.ADMISSION, admissionId,
            Payment.PaymentType.IPD_ADVANCE);
    }

    @Transactional(readOnly = true)
    public BigDecimal calculateTotalPaid(BillingTarget target) {
        return Money.of(paymentRepository.sumByTarget(target.getKind(), target.getTargetId()));
    }

    /**
     * Sum of completed payments taken on the given day.
     */
    @Transactional(readOnly = true)
    public BigDecimal dailyCollection(LocalDate date) {
        LocalDate day = date != null ? date : LocalDate.now(clock);
        return Money.of(paymentRepository.sumByStatusBetween(Payment.PaymentStatus.COMPLETED,
            day.atStartOfDay(), day.plusDays(1).atStartOfDay()));
    }

    /**
     * Balance for one visit, one admission, or (with neither) everything the patient owes.
     * Visit scope adds the OPD fee; admission scope adds the file charge. Patient scope
     * folds in every visit and admission of the patient and all of their payments.
     */
    @Transactional(readOnly = true)
    public PaymentDTO.BalanceSummary calculateBalance(String patientId, String visitId, String admissionId) {
        if (!patientRepository.existsById(patientId)) {
            throw ResourceNotFoundException.of("Patient", patientId);
        }
        boolean hasVisit = visitId != null && !visitId.isBlank();
        boolean hasAdmission = admissionId != null && !admissionId.isBlank();
        if (hasVisit && hasAdmission) {
            throw new InvalidRequestException("Provide at most one of visit_id or ipd_id");
        }

        BigDecimal totalCharges;
        BigDecimal totalPaid;
        BigDecimal advanceBalance = Money.ZERO;

        if (hasVisit) {
            Visit visit = visitRepository.findById(visitId)
                .orElseThrow(() -> ResourceNotFoundException.of("Visit", visitId));
            requireOwner(visit.getPatient().getId(), patientId, "Visit " + visitId);
            totalCharges = Money.sum(sumCharges(BillingTarget.Kind.VISIT, List.of(visitId)), visit.getOpdFee());
            totalPaid = Money.of(paymentRepository.sumByTarget(BillingTarget.Kind.VISIT, visitId));
        } else if (hasAdmission) {
            Admission admission = admissionRepository.findById(admissionId)
                .orElseThrow(() -> ResourceNotFoundException.of("IPD admission", admissionId));
            requireOwner(admission.getPatient().getId(), patientId, "IPD admission " + admissionId);
            totalCharges = Money.sum(sumCharges(BillingTarget.Kind.ADMISSION, List.of(admissionId)),
                admission.getFileCharge());
            totalPaid = Money.of(paymentRepository.sumByTarget(BillingTarget.Kind.ADMISSION, admissionId));
            advanceBalance = findAdvances(admissionId).stream()
                .map(Payment::getAmount)
                .reduce(Money.ZERO, Money::sum);
        } else {
            BigDecimal visitCharges = sumCharges(BillingTarget.Kind.VISIT, visitRepository.findIdsByPatientId(patientId));
            BigDecimal admissionCharges = sumCharges(BillingTarget.Kind.ADMISSION,
                admissionRepository.findIdsByPatientId(patientId));
            totalCharges = Money.sum(Money.sum(visitCharges, admissionCharges),
                Money.sum(visitRepository.sumOpdFeesByPatientId(patientId),
                    admissionRepository.sumFileChargesByPatientId(patientId)));
            totalPaid = Money.of(paymentRepository.sumByPatientId(patientId));
        }

        return PaymentDTO.BalanceSummary.builder()
            .patientId(patientId)
            .totalCharges(totalCharges)
            .totalPaid(totalPaid)
            .balanceDue(Money.of(totalCharges.subtract(totalPaid)))
            .advanceBalance(advanceBalance)
            .build();
    }

    private BigDecimal sumCharges(BillingTarget.Kind kind, List<String> targetIds) {
        if (targetIds.isEmpty()) {
            return Money.ZERO;
        }
        return Money.of(chargeRepository.sumTotalsByTargets(kind, targetIds));
    }

    private void requireTargetOwnedBy(BillingTarget target, String patientId) {
        if (target.isVisit()) {
            Visit visit = visitRepository.findById(target.getTargetId())
                .orElseThrow(() -> ResourceNotFoundException.of("Visit", target.getTargetId()));
            requireOwner(visit.getPatient().getId(), patientId, "Visit " + target.getTargetId());
        } else {
            Admission admission = admissionRepository.findById(target.getTargetId())
                .orElseThrow(() -> ResourceNotFoundException.of("IPD admission", target.getTargetId()));
            requireOwner(admission.getPatient().getId(), patientId, "IPD admission " + target.getTargetId());
        }
    }

    private static void requireOwner(String ownerId, String patientId, String what) {
        if (!ownerId.equals(patientId)) {
            throw new InvalidRequestException(what + " does not belong to patient " + patientId);
        }
    }
}
