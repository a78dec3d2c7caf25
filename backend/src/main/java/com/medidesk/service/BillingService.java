package com.medidesk.service;

import com.medidesk.dto.AdmissionDTO;
import com.medidesk.dto.BillingDTO;
import com.medidesk.entity.AuditLog;
import com.medidesk.entity.BillingTarget;
import com.medidesk.entity.Charge;
import com.medidesk.event.ChargeAuditEvent;
import com.medidesk.exception.InvalidRequestException;
import com.medidesk.exception.ResourceNotFoundException;
import com.medidesk.exception.StateConflictException;
import com.medidesk.repository.AdmissionRepository;
import com.medidesk.repository.ChargeRepository;
import com.medidesk.repository.VisitRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
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
 * Charge ledger for visits and admissions. Every stored total equals
 * rate times quantity rounded to two places. Manual charge creation and edits
 * are audited through {@link ChargeAuditEvent}s recorded before commit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BillingService {

    static final String SYSTEM_ACTOR = "SYSTEM";
    private static final long SECONDS_PER_HOUR = 3600;

    private final ChargeRepository chargeRepository;
    private final VisitRepository visitRepository;
    private final AdmissionRepository admissionRepository;
    private final AdmissionService admissionService;
    private final IdGenerator idGenerator;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Resolves a visit or admission reference pair into a billing target.
     *
     * @throws InvalidRequestException unless exactly one reference is given
     */
    public static BillingTarget targetOf(String visitId, String admissionId) {
        try {
            return BillingTarget.of(visitId, admissionId);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(e.getMessage(), e);
        }
    }

    @Transactional(timeoutString = "${medidesk.tx.timeout-seconds:10}")
    public Charge createCharge(Charge.ChargeType chargeType, String chargeName, BigDecimal rate, int quantity,
                               BillingTarget target, String actor) {
        if (chargeType == Charge.ChargeType.MANUAL) {
            requireActor(actor);
        }
        Charge charge = insertCharge(chargeType, chargeName, rate, quantity, target, actor);
        if (chargeType == Charge.ChargeType.MANUAL) {
            publishAudit(actor, AuditLog.AuditAction.MANUAL_CHARGE_ADD, charge.getId(), null, snapshot(charge));
        }
        return charge;
    }

    @Transactional(timeoutString = "${medidesk.tx.timeout-seconds:10}")
    public List<Charge> addInvestigationCharges(BillingTarget target, List<BillingDTO.ChargeItem> items, String actor) {
        return addCharges(Charge.ChargeType.INVESTIGATION, target, items, actor);
    }

    @Transactional(timeoutString = "${medidesk.tx.timeout-seconds:10}")
    public List<Charge> addProcedureCharges(BillingTarget target, List<BillingDTO.ChargeItem> items, String actor) {
        return addCharges(Charge.ChargeType.PROCEDURE, target, items, actor);
    }

    /**
     * Adds service charges. An item with start and end times is billed per started hour,
     * at least one.
     */
    @Transactional(timeoutString = "${medidesk.tx.timeout-seconds:10}")
    public List<Charge> addServiceCharges(BillingTarget target, List<BillingDTO.ChargeItem> items, String actor) {
        requireItems(items);
        List<Charge> charges = new ArrayList<>(items.size());
        for (BillingDTO.ChargeItem item : items) {
            int quantity = item.getQuantity();
            if (item.getStartTime() != null || item.getEndTime() != null) {
                quantity = billableHours(item.getStartTime(), item.getEndTime());
            }
            charges.add(insertCharge(Charge.ChargeType.SERVICE, item.getName(), item.getRate(), quantity,
                target, actor));
        }
        log.info("Added {} service charges to {}", charges.size(), target);
        return charges;
    }

    /**
     * Adds manual charges; each one gets its own audit entry in the same transaction.
     */
    @Transactional(timeoutString = "${medidesk.tx.timeout-seconds:10}")
    public List<Charge> addManualCharges(BillingTarget target, List<BillingDTO.ChargeItem> items, String actor) {
        requireActor(actor);
        requireItems(items);
        List<Charge> charges = new ArrayList<>(items.size());
        for (BillingDTO.ChargeItem item : items) {
            charges.add(createCharge(Charge.ChargeType.MANUAL, item.getName(), item.getRate(), item.getQuantity(),
                target, actor));
        }
        log.info("Added {} manual charges to {} by {}", charges.size(), target, actor);
        return charges;
    }

    /**
     * Posts the bed days accrued since the last posting as one BED charge. Days already
     * covered by earlier BED charges on the admission are not billed again.
     */
    @Transactional(timeoutString = "${medidesk.tx.timeout-seconds:10}")
    public Charge postBedCharges(String admissionId, String actor) {
        admissionRepository.findByIdForUpdate(admissionId)
            .orElseThrow(() -> ResourceNotFoundException.of("IPD admission", admissionId));
        AdmissionDTO.BedCharges bedCharges = admissionService.computeBedCharges(admissionId);

        long billedDays = chargeRepository.findByTargetAndType(BillingTarget.Kind.ADMISSION, admissionId,
                Charge.ChargeType.BED).stream()
            .mapToLong(Charge::getQuantity)
            .sum();
        long unbilledDays = bedCharges.getDays() - billedDays;
        if (unbilledDays <= 0) {
            throw new StateConflictException("Bed charges already posted for " + billedDays
                + " day(s) of admission " + admissionId);
        }

        String name = "Bed Charges - " + bedCharges.getWardType() + " " + bedCharges.getBedNumber();
        log.debug("Posting {} of {} bed day(s) for {}", unbilledDays, bedCharges.getDays(), admissionId);
        return insertCharge(Charge.ChargeType.BED, name, bedCharges.getPerDayCharge(),
            Math.toIntExact(unbilledDays), BillingTarget.admission(admissionId), actor);
    }

    /**
     * Partial update of a charge; the total is recomputed. Edits to manual charges
     * made by a named user are audited with before and after snapshots.
     */
    @Transactional(timeoutString = "${medidesk.tx.timeout-seconds:10}")
    public Charge updateCharge(String chargeId, String chargeName, BigDecimal rate, Integer quantity, String actor) {
        if (rate != null && Money.isNegative(rate)) {
            throw new InvalidRequestException("Rate cannot be negative");
        }
        if (quantity != null && quantity <= 0) {
            throw new InvalidRequestException("Quantity must be positive");
        }
        if (chargeName != null && chargeName.isBlank()) {
            throw new InvalidRequestException("Charge name cannot be empty");
        }

        Charge charge = getCharge(chargeId);
        boolean audited = charge.getChargeType() == Charge.ChargeType.MANUAL && actor != null && !actor.isBlank();
        Map<String, Object> before = audited ? snapshot(charge) : null;

        if (chargeName != null) {
            charge.setChargeName(chargeName.trim());
        }
        if (rate != null) {
            charge.setRate(Money.of(rate));
        }
        if (quantity != null) {
            charge.setQuantity(quantity);
        }
        charge.setTotalAmount(Money.times(charge.getRate(), charge.getQuantity()));

        if (audited) {
            publishAudit(actor, AuditLog.AuditAction.MANUAL_CHARGE_EDIT, chargeId, before, snapshot(charge));
        }
        log.info("Charge {} updated: {} x {} = {}", chargeId, charge.getRate(), charge.getQuantity(),
            charge.getTotalAmount());
        return charge;
    }

    @Transactional(readOnly = true)
    public Charge getCharge(String chargeId) {
        return chargeRepository.findById(chargeId)
            .orElseThrow(() -> ResourceNotFoundException.of("Charge", chargeId));
    }

    @Transactional(readOnly = true)
    public List<Charge> getCharges(BillingTarget target) {
        return chargeRepository.findByTarget(target.getKind(), target.getTargetId());
    }

    @Transactional(readOnly = true)
    public List<Charge> getChargesByType(BillingTarget target, Charge.ChargeType chargeType) {
        return chargeRepository.findByTargetAndType(target.getKind(), target.getTargetId(), chargeType);
    }

    @Transactional(readOnly = true)
    public BigDecimal calculateTotalCharges(BillingTarget target) {
        return Money.of(chargeRepository.sumTotalsByTargets(target.getKind(), List.of(target.getTargetId())));
    }

    static int billableHours(LocalDateTime start, LocalDateTime end) {
        if (start == null || end == null) {
            throw new InvalidRequestException("Service charges need both a start and an end time");
        }
        if (end.isBefore(start)) {
            throw new InvalidRequestException("Service end time cannot be before start time");
        }
        long seconds = Duration.between(start, end).getSeconds();
        long hours = (seconds + SECONDS_PER_HOUR - 1) / SECONDS_PER_HOUR;
        return Math.toIntExact(Math.max(1, hours));
    }

    private List<Charge> addCharges(Charge.ChargeType chargeType, BillingTarget target,
                                    List<BillingDTO.ChargeItem> items, String actor) {
        requireItems(items);
        List<Charge> charges = new ArrayList<>(items.size());
        for (BillingDTO.ChargeItem item : items) {
            charges.add(insertCharge(chargeType, item.getName(), item.getRate(), item.getQuantity(), target, actor));
        }
        log.info("Added {} {} charges to {}", charges.size(), chargeType, target);
        return charges;
    }

    private Charge insertCharge(Charge.ChargeType chargeType, String chargeName, BigDecimal rate, int quantity,
                                BillingTarget target, String actor) {
        if (chargeType == null) {
            throw new InvalidRequestException("Charge type is required");
        }
        if (target == null) {
            throw new InvalidRequestException("Exactly one of visit_id or ipd_id must be provided");
        }
        if (chargeName == null || chargeName.isBlank()) {
            throw new InvalidRequestException("Charge name is required");
        }
        if (quantity <= 0) {
            throw new InvalidRequestException("Quantity must be positive");
        }
        if (rate == null || Money.isNegative(rate)) {
            throw new InvalidRequestException("Rate cannot be negative");
        }
        requireTargetExists(target);

        BigDecimal storedRate = Money.of(rate);
        Charge charge = Charge.builder()
            .target(target)
            .chargeType(chargeType)
            .chargeName(chargeName.trim())
            .quantity(quantity)
            .rate(storedRate)
            .totalAmount(Money.times(storedRate, quantity))
            .chargeDate(LocalDateTime.now(clock))
            .createdBy(actor != null && !actor.isBlank() ? actor : SYSTEM_ACTOR)
            .build();
        charge.setId(idGenerator.next(IdGenerator.IdKind.CHARGE));

        charge = chargeRepository.save(charge);
        log.debug("Charge {} ({}) on {}: {} x {} = {}", charge.getId(), chargeType, target,
            storedRate, quantity, charge.getTotalAmount());
        return charge;
    }

    private void requireTargetExists(BillingTarget target) {
        if (target.isVisit()) {
            if (!visitRepository.existsById(target.getTargetId())) {
                throw ResourceNotFoundException.of("Visit", target.getTargetId());
            }
        } else if (!admissionRepository.existsById(target.getTargetId())) {
            throw ResourceNotFoundException.of("IPD admission", target.getTargetId());
        }
    }

    private void publishAudit(String actor, AuditLog.AuditAction action, String chargeId,
                              Map<String, Object> before, Map<String, Object> after) {
        eventPublisher.publishEvent(ChargeAuditEvent.builder()
            .actor(actor)
            .action(action)
            .chargeId(chargeId)
            .oldSnapshot(before)
            .newSnapshot(after)
            .build());
    }

    static Map<String, Object> snapshot(Charge charge) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("charge_name", charge.getChargeName());
        data.put("rate", charge.getRate());
        data.put("quantity", charge.getQuantity());
        data.put("total_amount", charge.getTotalAmount());
        data.put("visit_id", charge.getTarget().visitId());
        data.put("ipd_id", charge.getTarget().admissionId());
        return data;
    }

    private static void requireActor(String actor) {
        if (actor == null || actor.isBlank()) {
            throw new InvalidRequestException("Manual charges require an acting user");
        }
    }

    private static void requireItems(List<BillingDTO.ChargeItem> items) {
        if (items == null || items.isEmpty()) {
            throw new InvalidRequestException("At least one charge is required");
        }
    }
}
