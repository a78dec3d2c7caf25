package com.medidesk.service;

import com.medidesk.dto.BedDTO;
import com.medidesk.entity.Bed;
import com.medidesk.event.BedStatusChangedEvent;
import com.medidesk.exception.InvalidRequestException;
import com.medidesk.exception.ResourceNotFoundException;
import com.medidesk.exception.StateConflictException;
import com.medidesk.repository.BedRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Bed inventory: creation, maintenance toggles, rate changes and occupancy.
 * Occupancy itself only changes through {@link AdmissionService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BedService {

    static final String TABLE = "beds";

    private final BedRepository bedRepository;
    private final IdGenerator idGenerator;
    private final AuditService auditService;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional
    public Bed createBed(String bedNumber, Bed.WardType wardType, BigDecimal perDayCharge) {
        if (bedNumber == null || bedNumber.isBlank()) {
            throw new InvalidRequestException("Bed number is required");
        }
        if (wardType == null) {
            throw new InvalidRequestException("Ward type is required");
        }
        if (perDayCharge == null || Money.isNegative(perDayCharge)) {
            throw new InvalidRequestException("Per day charge cannot be negative");
        }
        String number = bedNumber.trim();
        if (bedRepository.existsByBedNumber(number)) {
            throw new InvalidRequestException("Bed number " + number + " already exists");
        }

        Bed bed = Bed.builder()
            .bedNumber(number)
            .wardType(wardType)
            .perDayCharge(Money.of(perDayCharge))
            .status(Bed.BedStatus.AVAILABLE)
            .build();
        bed.setId(idGenerator.next(IdGenerator.IdKind.BED));

        try {
            bed = bedRepository.saveAndFlush(bed);
        } catch (DataIntegrityViolationException e) {
            throw new InvalidRequestException("Bed number " + number + " already exists", e);
        }
        log.info("Bed created: {} ({}, {} per day)", bed.getBedNumber(), wardType, bed.getPerDayCharge());
        return bed;
    }

    @Transactional(readOnly = true)
    public Bed getBed(String bedId) {
        return bedRepository.findById(bedId)
            .orElseThrow(() -> ResourceNotFoundException.of("Bed", bedId));
    }

    @Transactional(readOnly = true)
    public Bed getBedByNumber(String bedNumber) {
        return bedRepository.findByBedNumber(bedNumber)
            .orElseThrow(() -> ResourceNotFoundException.of("Bed number", bedNumber));
    }

    @Transactional(readOnly = true)
    public List<Bed> findAvailableBeds(Bed.WardType wardType) {
        if (wardType == null) {
            return bedRepository.findByStatusOrderByWardTypeAscBedNumberAsc(Bed.BedStatus.AVAILABLE);
        }
        return bedRepository.findByStatusAndWardTypeOrderByBedNumber(Bed.BedStatus.AVAILABLE, wardType);
    }

    @Transactional(readOnly = true)
    public List<Bed> findBedsByWard(Bed.WardType wardType) {
        return bedRepository.findByWardTypeOrderByBedNumber(wardType);
    }

    @Transactional
    public Bed markUnderMaintenance(String bedId) {
        return toggleMaintenance(bedId, Bed.BedStatus.MAINTENANCE);
    }

    @Transactional
    public Bed releaseFromMaintenance(String bedId) {
        return toggleMaintenance(bedId, Bed.BedStatus.AVAILABLE);
    }

    private Bed toggleMaintenance(String bedId, Bed.BedStatus target) {
        Bed bed = bedRepository.findByIdForUpdate(bedId)
            .orElseThrow(() -> ResourceNotFoundException.of("Bed", bedId));

        boolean leavingMaintenance = target == Bed.BedStatus.AVAILABLE;
        if (leavingMaintenance && bed.getStatus() != Bed.BedStatus.MAINTENANCE) {
            throw new StateConflictException("Bed " + bed.getBedNumber() + " is " + bed.getStatus()
                + ", not under maintenance");
        }
        if (!bed.getStatus().canTransitionTo(target)) {
            throw new StateConflictException("Bed " + bed.getBedNumber() + " is " + bed.getStatus()
                + " and cannot be moved to " + target);
        }

        bed.transitionTo(target);
        eventPublisher.publishEvent(BedStatusChangedEvent.of(bed, null));
        log.info("Bed {} is now {}", bed.getBedNumber(), target);
        return bed;
    }

    /**
     * Changes the per-day charge. Future bed-charge computations use the new rate;
     * the change is written to the audit trail.
     */
    @Transactional
    public Bed updatePerDayCharge(String bedId, BigDecimal newRate, String actor) {
        if (newRate == null || Money.isNegative(newRate)) {
            throw new InvalidRequestException("Per day charge cannot be negative");
        }
        if (actor == null || actor.isBlank()) {
            throw new InvalidRequestException("Rate changes require an acting user");
        }
        Bed bed = bedRepository.findByIdForUpdate(bedId)
            .orElseThrow(() -> ResourceNotFoundException.of("Bed", bedId));

        BigDecimal oldRate = bed.getPerDayCharge();
        BigDecimal rate = Money.of(newRate);
        if (oldRate.compareTo(rate) == 0) {
            return bed;
        }
        bed.setPerDayCharge(rate);
        auditService.logRateChange(actor, TABLE, bed.getId(), "per_day_charge", oldRate, rate);
        log.info("Bed {} rate changed from {} to {} by {}", bed.getBedNumber(), oldRate, rate, actor);
        return bed;
    }

    @Transactional(readOnly = true)
    public BedDTO.OccupancyStats getOccupancyStats() {
        List<Bed> beds = bedRepository.findAll();

        Map<Bed.WardType, BedDTO.WardOccupancy> byWard = new EnumMap<>(Bed.WardType.class);
        for (Bed.WardType wardType : Bed.WardType.values()) {
            byWard.put(wardType, new BedDTO.WardOccupancy());
        }
        BedDTO.WardOccupancy overall = new BedDTO.WardOccupancy();
        for (Bed bed : beds) {
            overall.count(bed.getStatus());
            byWard.get(bed.getWardType()).count(bed.getStatus());
        }

        BigDecimal occupancyRate = overall.getTotal() == 0
            ? Money.ZERO
            : BigDecimal.valueOf(overall.getOccupied() * 100L)
                .divide(BigDecimal.valueOf(overall.getTotal()), Money.SCALE, RoundingMode.HALF_UP);

        return BedDTO.OccupancyStats.builder()
            .totalBeds(overall.getTotal())
            .occupied(overall.getOccupied())
            .available(overall.getAvailable())
            .maintenance(overall.getMaintenance())
            .occupancyRate(occupancyRate)
            .byWardType(byWard)
            .build();
    }
}
