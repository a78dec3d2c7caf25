package com.medidesk.repository;

import com.medidesk.entity.Patient;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PatientRepository extends JpaRepository<Patient, String> {
    Optional<Patient> findByMobileNumber(String mobileNumber);

    boolean existsByMobileNumber(String mobileNumber);

    @Query("SELECT p FROM Patient p WHERE " +
           "LOWER(p.name) LIKE LOWER(CONCAT('%', :search, '%')) OR " +
           "p.mobileNumber LIKE CONCAT('%', :search, '%') OR " +
           "p.id LIKE CONCAT('%', :search, '%') " +
           "ORDER BY p.createdAt DESC")
    List<Patient> searchPatients(@Param("search") String search, Pageable pageable);
}
