package com.medidesk.service;

import com.medidesk.dto.DischargeDTO;
import com.medidesk.entity.Admission;
import com.medidesk.entity.Bed;
import com.medidesk.entity.BillingTarget;
import com.medidesk.entity.Charge;
import com.medidesk.entity.Patient;
import com.medidesk.entity.Payment;
import com.medidesk.entity.Visit;
import com.medidesk.repository.ChargeRepository;
import com.medidesk.repository.PaymentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Composes discharge bills from the admission, its charges and its payments.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DischargeService {

    static final String FILE_CHARGE = "FILE_CHARGE";
    static final String OPD_FEE = "OPD_FEE";

    private final AdmissionService admissionService;
    private final ChargeRepository chargeRepository;
    private final PaymentRepository paymentRepository;
    private final Clock clock;

    @Value("${medidesk.hospital-name:MediDesk Hospital}")
    private String hospitalName;

    @Transactional(readOnly = true)
    public DischargeDTO.DischargeBill generateDischargeBill(String admissionId) {
        Admission admission = admissionService.getAdmission(admissionId);
        Patient patient = admission.getPatient();
        Visit visit = admission.getVisit();
        Bed bed = admission.getBed();
        LocalDateTime now = LocalDateTime.now(clock);

        Map<String, List<DischargeDTO.BillLine>> chargesByType = new LinkedHashMap<>();
        BigDecimal totalCharges = Money.of(admission.getFileCharge());
        chargesByType.put(FILE_CHARGE, List.of(singleLine("IPD File Charge", admission.getFileCharge(),
            admission.getAdmissionDate())));

        if (visit != null) {
            chargesByType.put(OPD_FEE, List.of(singleLine("OPD Consultation Fee", visit.getOpdFee(),
                visit.getVisitDate().atTime(visit.getVisitTime()))));
            totalCharges = Money.sum(totalCharges, visit.getOpdFee());
        }

        for (Charge charge : chargeRepository.findByTarget(BillingTarget.Kind.ADMISSION, admissionId)) {
            chargesByType.computeIfAbsent(charge.getChargeType().name(), type -> new ArrayList<>())
                .add(DischargeDTO.BillLine.builder()
                    .chargeName(charge.getChargeName())
                    .quantity(charge.getQuantity())
                    .rate(charge.getRate())
                    .totalAmount(charge.getTotalAmount())
                    .chargeDate(charge.getChargeDate())
                    .build());
            totalCharges = Money.sum(totalCharges, charge.getTotalAmount());
        }

        BigDecimal totalPaid = Money.ZERO;
        BigDecimal advancePaid = Money.ZERO;
        List<DischargeDTO.PaymentLine> paymentLines = new ArrayList<>();
        for (Payment payment : paymentRepository.findByTarget(BillingTarget.Kind.ADMISSION, admissionId)) {
            totalPaid = Money.sum(totalPaid, payment.getAmount());
            if (payment.isAdvance()) {
                advancePaid = Money.sum(advancePaid, payment.getAmount());
            }
            paymentLines.add(DischargeDTO.PaymentLine.builder()
                .paymentId(payment.getId())
                .paymentType(payment.getPaymentType())
                .amount(payment.getAmount())
                .paymentMode(payment.getPaymentMode())
                .transactionReference(payment.getTransactionReference())
                .paymentDate(payment.getPaymentDate())
                .build());
        }

        LocalDateTime end = admission.getDischargeDate() != null ? admission.getDischargeDate() : now;
        return DischargeDTO.DischargeBill.builder()
            .hospitalName(hospitalName)
            .ipdId(admissionId)
            .patient(DischargeDTO.PatientInfo.builder()
                .patientId(patient.getId())
                .name(patient.getName())
                .age(patient.getAge())
                .gender(patient.getGender())
                .mobileNumber(patient.getMobileNumber())
                .address(patient.getAddress())
                .build())
            .admission(DischargeDTO.AdmissionInfo.builder()
                .ipdId(admissionId)
                .admissionDate(admission.getAdmissionDate())
                .dischargeDate(admission.getDischargeDate())
                .stayDays(stayDays(admission.getAdmissionDate(), end))
                .bedNumber(bed.getBedNumber())
                .wardType(bed.getWardType())
                .perDayCharge(bed.getPerDayCharge())
                .build())
            .chargesByType(chargesByType)
            .payments(paymentLines)
            .summary(DischargeDTO.Summary.builder()
                .totalCharges(totalCharges)
                .totalPaid(totalPaid)
                .advancePaid(advancePaid)
                .balanceDue(Money.of(totalCharges.subtract(totalPaid)))
                .build())
            .generatedDate(now)
            .build();
    }

    /**
     * Discharges the patient and releases the bed. Fails if the admission is already closed.
     */
    @Transactional(timeoutString = "${medidesk.tx.timeout-seconds:10}")
    public Admission processDischarge(String admissionId, LocalDateTime dischargeDate) {
        Admission admission = admissionService.discharge(admissionId, dischargeDate);
        log.info("Discharge processed for admission {}", admissionId);
        return admission;
    }

    @Transactional(readOnly = true)
    public BigDecimal calculatePendingAmount(String admissionId) {
        return generateDischargeBill(admissionId).getSummary().getBalanceDue();
    }

    /**
     * Days shown on the printed bill: started days, counting the admission day.
     */
    static long stayDays(LocalDateTime admissionDate, LocalDateTime end) {
        return Math.max(1, Duration.between(admissionDate, end).toDays() + 1);
    }

    private static DischargeDTO.BillLine singleLine(String name, BigDecimal amount, LocalDateTime date) {
        BigDecimal value = Money.of(amount);
        return DischargeDTO.BillLine.builder()
            .chargeName(name)
            .quantity(1)
            .rate(value)
            .totalAmount(value)
            .chargeDate(date)
            .build();
    }
}
