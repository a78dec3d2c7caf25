package com.medidesk.repository;

import com.medidesk.entity.OtProcedure;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface OtProcedureRepository extends JpaRepository<OtProcedure, String> {

    @Query("SELECT o FROM OtProcedure o WHERE o.admission.id = :admissionId ORDER BY o.operationDate DESC")
    List<OtProcedure> findByAdmissionId(@Param("admissionId") String admissionId);
}
