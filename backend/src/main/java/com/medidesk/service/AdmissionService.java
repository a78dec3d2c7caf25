package com.medidesk.service;

import com.medidesk.dto.AdmissionDTO;
import com.medidesk.entity.Admission;
import com.medidesk.entity.Bed;
import com.medidesk.entity.Patient;
import com.medidesk.entity.Visit;
import com.medidesk.event.BedStatusChangedEvent;
import com.medidesk.exception.InvalidRequestException;
import com.medidesk.exception.ResourceNotFoundException;
import com.medidesk.exception.StateConflictException;
import com.medidesk.repository.AdmissionRepository;
import com.medidesk.repository.BedRepository;
import com.medidesk.repository.PatientRepository;
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
import java.util.List;

/**
 * Inpatient admission lifecycle. This is the only place where bed occupancy and
 * admission status change; each operation is one transaction, and bed rows are
 * read under a write lock so the store serializes competing requests for a bed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdmissionService {

    private final AdmissionRepository admissionRepository;
    private final BedRepository bedRepository;
    private final PatientRepository patientRepository;
    private final VisitRepository visitRepository;
    private final IdGenerator idGenerator;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional(timeoutString = "${medidesk.tx.timeout-seconds:10}")
    public Admission admit(String patientId, String bedId, BigDecimal fileCharge,
                           String visitId, LocalDateTime admissionDate) {
        if (fileCharge == null) {
            throw new InvalidRequestException("File charge is required");
        }
        if (Money.isNegative(fileCharge)) {
            throw new InvalidRequestException("File charge cannot be negative");
        }

        Patient patient = patientRepository.findById(patientId)
            .orElseThrow(() -> ResourceNotFoundException.of("Patient", patientId));

        Visit visit = null;
        if (visitId != null && !visitId.isBlank()) {
            visit = visitRepository.findById(visitId)
                .orElseThrow(() -> ResourceNotFoundException.of("Visit", visitId));
            if (!visit.getPatient().getId().equals(patientId)) {
                throw new InvalidRequestException("Visit " + visitId + " does not belong to patient " + patientId);
            }
        }

        Bed bed = bedRepository.findByIdForUpdate(bedId)
            .orElseThrow(() -> ResourceNotFoundException.of("Bed", bedId));
        requireAvailable(bed);

        Admission admission = Admission.builder()
            .patient(patient)
            .visit(visit)
            .bed(bed)
            .admissionDate(admissionDate != null ? admissionDate : LocalDateTime.now(clock))
            .fileCharge(Money.of(fileCharge))
            .status(Admission.AdmissionStatus.ADMITTED)
            .build();
        admission.setId(idGenerator.next(IdGenerator.IdKind.ADMISSION));

        bed.transitionTo(Bed.BedStatus.OCCUPIED);
        admission = admissionRepository.save(admission);

        eventPublisher.publishEvent(BedStatusChangedEvent.of(bed, admission.getId()));
        log.info("Patient {} admitted as {} into bed {}", patientId, admission.getId(), bed.getBedNumber());
        return admission;
    }

    @Transactional(timeoutString = "${medidesk.tx.timeout-seconds:10}")
    public Admission changeBed(String admissionId, String newBedId) {
        if (newBedId == null || newBedId.isBlank()) {
            throw new InvalidRequestException("New bed id is required");
        }
        Admission admission = lockAdmission(admissionId);
        if (!admission.isActive()) {
            throw new StateConflictException("Can only change bed for admitted patients; admission "
                + admissionId + " is " + admission.getStatus());
        }

        String currentBedId = admission.getBed().getId();
        if (currentBedId.equals(newBedId)) {
            throw new StateConflictException("Admission " + admissionId + " already occupies bed " + newBedId);
        }

        // Lock in id order so two opposite moves cannot deadlock.
        Bed currentBed;
        Bed newBed;
        if (currentBedId.compareTo(newBedId) < 0) {
            currentBed = lockBed(currentBedId);
            newBed = lockBed(newBedId);
        } else {
            newBed = lockBed(newBedId);
            currentBed = lockBed(currentBedId);
        }
        requireAvailable(newBed);

        currentBed.transitionTo(Bed.BedStatus.AVAILABLE);
        newBed.transitionTo(Bed.BedStatus.OCCUPIED);
        admission.moveTo(newBed);

        eventPublisher.publishEvent(BedStatusChangedEvent.of(currentBed, admissionId));
        eventPublisher.publishEvent(BedStatusChangedEvent.of(newBed, admissionId));
        log.info("Admission {} moved from bed {} to bed {}", admissionId,
            currentBed.getBedNumber(), newBed.getBedNumber());
        return admission;
    }

    @Transactional(timeoutString = "${medidesk.tx.timeout-seconds:10}")
    public Admission discharge(String admissionId, LocalDateTime dischargeDate) {
        return close(admissionId, Admission.AdmissionStatus.DISCHARGED, dischargeDate);
    }

    /**
     * Ends the stay because the patient moved to another facility; the bed is released.
     */
    @Transactional(timeoutString = "${medidesk.tx.timeout-seconds:10}")
    public Admission transferOut(String admissionId, LocalDateTime transferDate) {
        return close(admissionId, Admission.AdmissionStatus.TRANSFERRED, transferDate);
    }

    private Admission close(String admissionId, Admission.AdmissionStatus target, LocalDateTime closedAt) {
        Admission admission = lockAdmission(admissionId);
        if (!admission.isActive()) {
            throw new StateConflictException("Patient is not currently admitted; admission "
                + admissionId + " is " + admission.getStatus());
        }
        LocalDateTime effective = closedAt != null ? closedAt : LocalDateTime.now(clock);
        if (effective.isBefore(admission.getAdmissionDate())) {
            throw new InvalidRequestException("Discharge date cannot be before admission date "
                + admission.getAdmissionDate());
        }

        Bed bed = lockBed(admission.getBed().getId());
        admission.close(target, effective);
        bed.transitionTo(Bed.BedStatus.AVAILABLE);

        eventPublisher.publishEvent(BedStatusChangedEvent.of(bed, admissionId));
        log.info("Admission {} {} at {}; bed {} released", admissionId, target, effective, bed.getBedNumber());
        return admission;
    }

    /**
     * Bed charges so far: whole days between admission and discharge (or now),
     * never less than one, at the current bed's per-day rate.
     */
    @Transactional(readOnly = true)
    public AdmissionDTO.BedCharges computeBedCharges(String admissionId) {
        Admission admission = getAdmission(admissionId);
        Bed bed = admission.getBed();

        long days = chargeableDays(admission);
        BigDecimal total = Money.times(bed.getPerDayCharge(), days);

        return AdmissionDTO.BedCharges.builder()
            .admissionId(admissionId)
            .bedId(bed.getId())
            .bedNumber(bed.getBedNumber())
            .wardType(bed.getWardType())
            .days(days)
            .perDayCharge(bed.getPerDayCharge())
            .totalBedCharges(total)
            .build();
    }

    long chargeableDays(Admission admission) {
        LocalDateTime end = admission.getDischargeDate() != null
            ? admission.getDischargeDate()
            : LocalDateTime.now(clock);
        long days = Duration.between(admission.getAdmissionDate(), end).toDays();
        return Math.max(1, days);
    }

    @Transactional(readOnly = true)
    public Admission getAdmission(String admissionId) {
        return admissionRepository.findById(admissionId)
            .orElseThrow(() -> ResourceNotFoundException.of("IPD admission", admissionId));
    }

    @Transactional(readOnly = true)
    public List<Admission> findPatientAdmissions(String patientId, Admission.AdmissionStatus status) {
        if (status == null) {
            return admissionRepository.findByPatientId(patientId);
        }
        return admissionRepository.findByPatientIdAndStatus(patientId, status);
    }

    @Transactional(readOnly = true)
    public List<Admission> findActiveAdmissions() {
        return admissionRepository.findByStatusWithPatientAndBed(Admission.AdmissionStatus.ADMITTED);
    }

    private Admission lockAdmission(String admissionId) {
        return admissionRepository.findByIdForUpdate(admissionId)
            .orElseThrow(() -> ResourceNotFoundException.of("IPD admission", admissionId));
    }

    private Bed lockBed(String bedId) {
        return bedRepository.findByIdForUpdate(bedId)
            .orElseThrow(() -> ResourceNotFoundException.of("Bed", bedId));
    }

    private static void requireAvailable(Bed bed) {
        if (!bed.isAvailable()) {
            log.warn("Rejected allocation of bed {}: status {}", bed.getBedNumber(), bed.getStatus());
            throw new StateConflictException("Bed " + bed.getBedNumber() + " is not available (status "
                + bed.getStatus() + ")");
        }
    }
}
