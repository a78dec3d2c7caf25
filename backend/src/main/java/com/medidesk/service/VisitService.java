package com.medidesk.service;

import com.medidesk.entity.Doctor;
import com.medidesk.entity.Patient;
import com.medidesk.entity.PaymentMode;
import com.medidesk.entity.Visit;
import com.medidesk.exception.InvalidRequestException;
import com.medidesk.exception.ResourceNotFoundException;
import com.medidesk.exception.StateConflictException;
import com.medidesk.repository.DoctorRepository;
import com.medidesk.repository.PatientRepository;
import com.medidesk.repository.VisitRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * OPD visits. Serial numbers run from 1 per doctor per calendar day and are drawn
 * from the same serialized counters that issue identifiers.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VisitService {

    private final VisitRepository visitRepository;
    private final PatientRepository patientRepository;
    private final DoctorRepository doctorRepository;
    private final IdGenerator idGenerator;
    private final Clock clock;

    @Transactional
    public Visit createVisit(String patientId, String doctorId, Visit.VisitType visitType, String paymentMode,
                             LocalDate visitDate, LocalTime visitTime) {
        if (visitType == null) {
            throw new InvalidRequestException("Visit type is required");
        }
        PaymentMode mode = PaymentMode.parse(paymentMode)
            .orElseThrow(() -> new InvalidRequestException("Invalid payment mode: " + paymentMode));

        Patient patient = patientRepository.findById(patientId)
            .orElseThrow(() -> ResourceNotFoundException.of("Patient", patientId));
        Doctor doctor = doctorRepository.findById(doctorId)
            .orElseThrow(() -> ResourceNotFoundException.of("Doctor", doctorId));
        if (doctor.getStatus() != Doctor.DoctorStatus.ACTIVE) {
            throw new StateConflictException("Doctor " + doctorId + " is " + doctor.getStatus());
        }

        LocalDate date = visitDate != null ? visitDate : LocalDate.now(clock);
        LocalTime time = visitTime != null ? visitTime : LocalTime.now(clock).truncatedTo(ChronoUnit.SECONDS);

        Visit visit = Visit.builder()
            .patient(patient)
            .doctor(doctor)
            .department(doctor.getDepartment())
            .visitType(visitType)
            .serialNumber(nextSerialNumber(doctorId, date))
            .visitDate(date)
            .visitTime(time)
            .opdFee(Money.of(doctor.feeFor(visitType)))
            .paymentMode(mode)
            .status(Visit.VisitStatus.ACTIVE)
            .build();
        visit.setId(idGenerator.next(IdGenerator.IdKind.VISIT));

        try {
            visit = visitRepository.saveAndFlush(visit);
        } catch (DataIntegrityViolationException e) {
            throw new StateConflictException("Serial number " + visit.getSerialNumber()
                + " is already taken for doctor " + doctorId + " on " + date, e);
        }
        log.info("Visit {} created for patient {} with doctor {} (serial {})",
            visit.getId(), patientId, doctorId, visit.getSerialNumber());
        return visit;
    }

    private int nextSerialNumber(String doctorId, LocalDate date) {
        long serial = idGenerator.nextSequence("SERIAL:" + doctorId + ":" + date, () -> {
            Integer max = visitRepository.findMaxSerialNumber(doctorId, date);
            return max != null ? max : 0;
        });
        return Math.toIntExact(serial);
    }

    /**
     * Only ACTIVE visits can be completed or cancelled.
     */
    @Transactional
    public Visit updateStatus(String visitId, Visit.VisitStatus status) {
        if (status == null) {
            throw new InvalidRequestException("Visit status is required");
        }
        Visit visit = findById(visitId);
        if (visit.getStatus() != Visit.VisitStatus.ACTIVE) {
            throw new StateConflictException("Visit " + visitId + " is " + visit.getStatus()
                + " and can no longer change status");
        }
        visit.setStatus(status);
        log.info("Visit {} is now {}", visitId, status);
        return visit;
    }

    @Transactional(readOnly = true)
    public Visit findById(String visitId) {
        return visitRepository.findById(visitId)
            .orElseThrow(() -> ResourceNotFoundException.of("Visit", visitId));
    }

    @Transactional(readOnly = true)
    public List<Visit> dailyVisits(LocalDate date, String doctorId) {
        LocalDate day = date != null ? date : LocalDate.now(clock);
        if (doctorId == null || doctorId.isBlank()) {
            return visitRepository.findByVisitDateOrderBySerialNumber(day);
        }
        return visitRepository.findDailyVisitsForDoctor(day, doctorId);
    }

    @Transactional(readOnly = true)
    public List<Visit> patientVisits(String patientId, int limit) {
        return visitRepository.findByPatientId(patientId, PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public long doctorDailyCount(String doctorId, LocalDate date) {
        return visitRepository.countByDoctorAndDate(doctorId, date != null ? date : LocalDate.now(clock));
    }
}
