package com.medidesk.service;

import com.medidesk.entity.Admission;
import com.medidesk.entity.BillingTarget;
import com.medidesk.entity.Charge;
import com.medidesk.entity.OtProcedure;
import com.medidesk.exception.InvalidRequestException;
import com.medidesk.exception.ResourceNotFoundException;
import com.medidesk.repository.AdmissionRepository;
import com.medidesk.repository.OtProcedureRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operating-theater procedures for admitted patients and the OT charges billed for them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OtService {

    private final OtProcedureRepository otProcedureRepository;
    private final AdmissionRepository admissionRepository;
    private final BillingService billingService;
    private final IdGenerator idGenerator;
    private final Clock clock;

    @Transactional
    public OtProcedure createProcedure(String admissionId, String operationName, LocalDateTime operationDate,
                                      int durationMinutes, String surgeonName, String anesthesiaType,
                                      String notes, String actor) {
        if (operationName == null || operationName.isBlank()) {
            throw new InvalidRequestException("Operation name is required");
        }
        if (surgeonName == null || surgeonName.isBlank()) {
            throw new InvalidRequestException("Surgeon name is required");
        }
        if (durationMinutes <= 0) {
            throw new InvalidRequestException("Duration must be positive");
        }
        Admission admission = admissionRepository.findById(admissionId)
            .orElseThrow(() -> ResourceNotFoundException.of("IPD admission", admissionId));

        OtProcedure procedure = OtProcedure.builder()
            .admission(admission)
            .operationName(operationName.trim())
            .operationDate(operationDate != null ? operationDate : LocalDateTime.now(clock))
            .durationMinutes(durationMinutes)
            .surgeonName(surgeonName.trim())
            .anesthesiaType(trimToNull(anesthesiaType))
            .notes(trimToNull(notes))
            .createdBy(actor != null && !actor.isBlank() ? actor : BillingService.SYSTEM_ACTOR)
            .build();
        procedure.setId(idGenerator.next(IdGenerator.IdKind.OT_PROCEDURE));

        procedure = otProcedureRepository.save(procedure);
        log.info("OT procedure {} recorded for admission {}: {}", procedure.getId(), admissionId, operationName);
        return procedure;
    }

    /**
     * Bills the components of an operation against its admission. Zero components
     * are skipped; the assistant component is optional.
     */
    @Transactional(timeoutString = "${medidesk.tx.timeout-seconds:10}")
    public List<Charge> addOtCharges(String admissionId, String otId, BigDecimal surgeonCharge,
                                     BigDecimal anesthesiaCharge, BigDecimal facilityCharge,
                                     BigDecimal assistantCharge, String actor) {
        Map<String, BigDecimal> components = new LinkedHashMap<>();
        components.put("Surgeon", surgeonCharge);
        components.put("Anesthesia", anesthesiaCharge);
        components.put("Facility", facilityCharge);
        components.put("Assistant", assistantCharge);
        components.forEach((component, amount) -> {
            if (Money.isNegative(amount)) {
                throw new InvalidRequestException(component + " charge cannot be negative");
            }
        });

        OtProcedure procedure = getProcedure(otId);
        if (!procedure.getAdmission().getId().equals(admissionId)) {
            throw new InvalidRequestException("OT procedure " + otId + " does not belong to admission " + admissionId);
        }

        BillingTarget target = BillingTarget.admission(admissionId);
        List<Charge> charges = new ArrayList<>();
        for (Map.Entry<String, BigDecimal> component : components.entrySet()) {
            if (Money.isPositive(component.getValue())) {
                String name = "OT " + component.getKey() + " Charge - " + procedure.getOperationName();
                charges.add(billingService.createCharge(Charge.ChargeType.OT, name, component.getValue(), 1,
                    target, actor));
            }
        }
        log.info("Added {} OT charges for procedure {} on admission {}", charges.size(), otId, admissionId);
        return charges;
    }

    @Transactional(readOnly = true)
    public OtProcedure getProcedure(String otId) {
        return otProcedureRepository.findById(otId)
            .orElseThrow(() -> ResourceNotFoundException.of("OT procedure", otId));
    }

    @Transactional(readOnly = true)
    public List<OtProcedure> findByAdmission(String admissionId) {
        return otProcedureRepository.findByAdmissionId(admissionId);
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
