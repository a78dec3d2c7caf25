package com.medidesk.service;

import com.medidesk.entity.Patient;
import com.medidesk.exception.InvalidRequestException;
import com.medidesk.exception.ResourceNotFoundException;
import com.medidesk.repository.PatientRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.regex.Pattern;

@Service
@RequiredArgsConstructor
@Slf4j
public class PatientService {

    private static final Pattern MOBILE = Pattern.compile("^[6-9]\\d{9}$");
    private static final int MAX_AGE = 150;

    private final PatientRepository patientRepository;
    private final IdGenerator idGenerator;

    @Transactional
    public Patient register(String name, int age, Patient.Gender gender, String address, String mobileNumber) {
        requireMobile(mobileNumber);
        requireAge(age);
        if (name == null || name.isBlank()) {
            throw new InvalidRequestException("Patient name is required");
        }
        if (address == null || address.isBlank()) {
            throw new InvalidRequestException("Patient address is required");
        }
        if (gender == null) {
            throw new InvalidRequestException("Gender is required");
        }
        if (patientRepository.existsByMobileNumber(mobileNumber)) {
            throw new InvalidRequestException("Mobile number already exists");
        }

        Patient patient = Patient.builder()
            .name(Names.titleCase(name))
            .age(age)
            .gender(gender)
            .address(address.trim())
            .mobileNumber(mobileNumber)
            .build();
        patient.setId(idGenerator.next(IdGenerator.IdKind.PATIENT));

        patient = saveAndFlush(patient);
        log.info("Patient registered: {}", patient.getId());
        return patient;
    }

    /**
     * Partial update; null arguments leave the field unchanged.
     */
    @Transactional
    public Patient update(String patientId, String name, Integer age, Patient.Gender gender,
                          String address, String mobileNumber) {
        Patient patient = findById(patientId);

        if (mobileNumber != null && !mobileNumber.equals(patient.getMobileNumber())) {
            requireMobile(mobileNumber);
            if (patientRepository.existsByMobileNumber(mobileNumber)) {
                throw new InvalidRequestException("Mobile number already exists");
            }
            patient.setMobileNumber(mobileNumber);
        }
        if (age != null) {
            requireAge(age);
            patient.setAge(age);
        }
        if (name != null) {
            if (name.isBlank()) {
                throw new InvalidRequestException("Patient name cannot be empty");
            }
            patient.setName(Names.titleCase(name));
        }
        if (address != null) {
            if (address.isBlank()) {
                throw new InvalidRequestException("Patient address cannot be empty");
            }
            patient.setAddress(address.trim());
        }
        if (gender != null) {
            patient.setGender(gender);
        }

        patient = saveAndFlush(patient);
        log.info("Patient updated: {}", patientId);
        return patient;
    }

    @Transactional(readOnly = true)
    public Patient findById(String patientId) {
        return patientRepository.findById(patientId)
            .orElseThrow(() -> ResourceNotFoundException.of("Patient", patientId));
    }

    @Transactional(readOnly = true)
    public Patient findByMobile(String mobileNumber) {
        return patientRepository.findByMobileNumber(mobileNumber)
            .orElseThrow(() -> ResourceNotFoundException.of("Patient with mobile", mobileNumber));
    }

    @Transactional(readOnly = true)
    public List<Patient> search(String term, int limit) {
        if (term == null || term.isBlank()) {
            return List.of();
        }
        return patientRepository.searchPatients(term.trim(), PageRequest.of(0, limit));
    }

    private Patient saveAndFlush(Patient patient) {
        try {
            return patientRepository.saveAndFlush(patient);
        } catch (DataIntegrityViolationException e) {
            throw new InvalidRequestException("Mobile number already exists", e);
        }
    }

    private static void requireMobile(String mobileNumber) {
        if (mobileNumber == null || !MOBILE.matcher(mobileNumber).matches()) {
            throw new InvalidRequestException("Invalid mobile number format");
        }
    }

    private static void requireAge(int age) {
        if (age < 0 || age > MAX_AGE) {
            throw new InvalidRequestException("Age must be between 0 and 150");
        }
    }
}
