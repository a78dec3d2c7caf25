package com.medidesk.service;

import com.medidesk.entity.Doctor;
import com.medidesk.exception.InvalidRequestException;
import com.medidesk.exception.ResourceNotFoundException;
import com.medidesk.repository.DoctorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class DoctorService {

    static final String TABLE = "doctors";

    private final DoctorRepository doctorRepository;
    private final IdGenerator idGenerator;
    private final AuditService auditService;

    @Transactional
    public Doctor create(String name, String department, BigDecimal newPatientFee, BigDecimal followupFee) {
        if (name == null || name.isBlank()) {
            throw new InvalidRequestException("Doctor name is required");
        }
        if (department == null || department.isBlank()) {
            throw new InvalidRequestException("Department is required");
        }
        requireFee(newPatientFee, "New patient fee");
        requireFee(followupFee, "Follow-up fee");

        Doctor doctor = Doctor.builder()
            .name(name.trim())
            .department(Names.titleCase(department))
            .newPatientFee(Money.of(newPatientFee))
            .followupFee(Money.of(followupFee))
            .build();
        doctor.setId(idGenerator.next(IdGenerator.IdKind.DOCTOR));

        doctor = doctorRepository.save(doctor);
        log.info("Doctor created: {} ({})", doctor.getId(), doctor.getDepartment());
        return doctor;
    }

    /**
     * Changes consultation fees; each fee that actually changes gets its own rate-change entry.
     * Existing visits keep the fee captured when they were created.
     */
    @Transactional
    public Doctor updateFees(String doctorId, BigDecimal newPatientFee, BigDecimal followupFee, String actor) {
        if (actor == null || actor.isBlank()) {
            throw new InvalidRequestException("Rate changes require an acting user");
        }
        Doctor doctor = findById(doctorId);

        if (newPatientFee != null) {
            requireFee(newPatientFee, "New patient fee");
            BigDecimal oldFee = doctor.getNewPatientFee();
            BigDecimal fee = Money.of(newPatientFee);
            if (oldFee.compareTo(fee) != 0) {
                doctor.setNewPatientFee(fee);
                auditService.logRateChange(actor, TABLE, doctorId, "new_patient_fee", oldFee, fee);
            }
        }
        if (followupFee != null) {
            requireFee(followupFee, "Follow-up fee");
            BigDecimal oldFee = doctor.getFollowupFee();
            BigDecimal fee = Money.of(followupFee);
            if (oldFee.compareTo(fee) != 0) {
                doctor.setFollowupFee(fee);
                auditService.logRateChange(actor, TABLE, doctorId, "followup_fee", oldFee, fee);
            }
        }

        log.info("Doctor {} fees now {} / {}", doctorId, doctor.getNewPatientFee(), doctor.getFollowupFee());
        return doctor;
    }

    @Transactional
    public Doctor setStatus(String doctorId, Doctor.DoctorStatus status) {
        if (status == null) {
            throw new InvalidRequestException("Doctor status is required");
        }
        Doctor doctor = findById(doctorId);
        doctor.setStatus(status);
        log.info("Doctor {} is now {}", doctorId, status);
        return doctor;
    }

    @Transactional(readOnly = true)
    public Doctor findById(String doctorId) {
        return doctorRepository.findById(doctorId)
            .orElseThrow(() -> ResourceNotFoundException.of("Doctor", doctorId));
    }

    @Transactional(readOnly = true)
    public List<Doctor> findActive() {
        return doctorRepository.findByStatusOrderByName(Doctor.DoctorStatus.ACTIVE);
    }

    @Transactional(readOnly = true)
    public List<Doctor> findByDepartment(String department) {
        return doctorRepository.findByDepartmentAndStatusOrderByName(
            Names.titleCase(department), Doctor.DoctorStatus.ACTIVE);
    }

    @Transactional(readOnly = true)
    public List<String> departments() {
        return doctorRepository.findDepartmentsByStatus(Doctor.DoctorStatus.ACTIVE);
    }

    private static void requireFee(BigDecimal fee, String field) {
        if (fee == null) {
            throw new InvalidRequestException(field + " is required");
        }
        if (Money.isNegative(fee)) {
            throw new InvalidRequestException(field + " cannot be negative");
        }
    }
}
