package com.medidesk.repository;

import com.medidesk.entity.Visit;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Repository
public interface VisitRepository extends JpaRepository<Visit, String> {

    @Query("SELECT MAX(v.serialNumber) FROM Visit v " +
           "WHERE v.doctor.id = :doctorId AND v.visitDate = :visitDate")
    Integer findMaxSerialNumber(@Param("doctorId") String doctorId, @Param("visitDate") LocalDate visitDate);

    @Query("SELECT COUNT(v) FROM Visit v WHERE v.doctor.id = :doctorId AND v.visitDate = :visitDate")
    long countByDoctorAndDate(@Param("doctorId") String doctorId, @Param("visitDate") LocalDate visitDate);

    List<Visit> findByVisitDateOrderBySerialNumber(LocalDate visitDate);

    @Query("SELECT v FROM Visit v WHERE v.visitDate = :visitDate AND v.doctor.id = :doctorId ORDER BY v.serialNumber")
    List<Visit> findDailyVisitsForDoctor(@Param("visitDate") LocalDate visitDate, @Param("doctorId") String doctorId);

    @Query("SELECT v FROM Visit v WHERE v.patient.id = :patientId ORDER BY v.visitDate DESC, v.visitTime DESC")
    List<Visit> findByPatientId(@Param("patientId") String patientId, Pageable pageable);

    @Query("SELECT v.id FROM Visit v WHERE v.patient.id = :patientId")
    List<String> findIdsByPatientId(@Param("patientId") String patientId);

    @Query("SELECT SUM(v.opdFee) FROM Visit v WHERE v.patient.id = :patientId")
    BigDecimal sumOpdFeesByPatientId(@Param("patientId") String patientId);
}
