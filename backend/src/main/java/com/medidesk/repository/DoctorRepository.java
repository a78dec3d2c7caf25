package com.medidesk.repository;

import com.medidesk.entity.Doctor;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DoctorRepository extends JpaRepository<Doctor, String> {
    List<Doctor> findByStatusOrderByName(Doctor.DoctorStatus status);

    List<Doctor> findByDepartmentAndStatusOrderByName(String department, Doctor.DoctorStatus status);

    @Query("SELECT DISTINCT d.department FROM Doctor d WHERE d.status = :status ORDER BY d.department")
    List<String> findDepartmentsByStatus(@Param("status") Doctor.DoctorStatus status);
}
