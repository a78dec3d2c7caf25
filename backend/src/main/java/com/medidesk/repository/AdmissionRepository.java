package com.medidesk.repository;

import com.medidesk.entity.Admission;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

@Repository
public interface AdmissionRepository extends JpaRepository<Admission, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Admission a WHERE a.id = :admissionId")
    Optional<Admission> findByIdForUpdate(@Param("admissionId") String admissionId);

    @Query("SELECT a FROM Admission a WHERE a.patient.id = :patientId ORDER BY a.admissionDate DESC")
    List<Admission> findByPatientId(@Param("patientId") String patientId);

    @Query("SELECT a FROM Admission a WHERE a.patient.id = :patientId AND a.status = :status ORDER BY a.admissionDate DESC")
    List<Admission> findByPatientIdAndStatus(@Param("patientId") String patientId,
                                             @Param("status") Admission.AdmissionStatus status);

    @Query("SELECT a FROM Admission a JOIN FETCH a.patient JOIN FETCH a.bed " +
           "WHERE a.status = :status ORDER BY a.admissionDate DESC")
    List<Admission> findByStatusWithPatientAndBed(@Param("status") Admission.AdmissionStatus status);

    @Query("SELECT a.id FROM Admission a WHERE a.patient.id = :patientId")
    List<String> findIdsByPatientId(@Param("patientId") String patientId);

    @Query("SELECT SUM(a.fileCharge) FROM Admission a WHERE a.patient.id = :patientId")
    BigDecimal sumFileChargesByPatientId(@Param("patientId") String patientId);
}
