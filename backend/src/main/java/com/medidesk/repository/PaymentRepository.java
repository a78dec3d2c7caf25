package com.medidesk.repository;

import com.medidesk.entity.BillingTarget;
import com.medidesk.entity.Payment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface PaymentRepository extends JpaRepository<Payment, String> {

    @Query("SELECT p FROM Payment p WHERE p.patient.id = :patientId ORDER BY p.paymentDate DESC, p.id DESC")
    List<Payment> findByPatientId(@Param("patientId") String patientId);

    @Query("SELECT p FROM Payment p WHERE p.target.kind = :kind AND p.target.targetId = :targetId " +
           "ORDER BY p.paymentDate DESC, p.id DESC")
    List<Payment> findByTarget(@Param("kind") BillingTarget.Kind kind, @Param("targetId") String targetId);

    @Query("SELECT p FROM Payment p WHERE p.target.kind = :kind AND p.target.targetId = :targetId " +
           "AND p.paymentType = :paymentType ORDER BY p.paymentDate DESC, p.id DESC")
    List<Payment> findByTargetAndType(@Param("kind") BillingTarget.Kind kind,
                                      @Param("targetId") String targetId,
                                      @Param("paymentType") Payment.PaymentType paymentType);

    @Query("SELECT SUM(p.amount) FROM Payment p WHERE p.patient.id = :patientId")
    BigDecimal sumByPatientId(@Param("patientId") String patientId);

    @Query("SELECT SUM(p.amount) FROM Payment p " +
           "WHERE p.target.kind = :kind AND p.target.targetId = :targetId")
    BigDecimal sumByTarget(@Param("kind") BillingTarget.Kind kind, @Param("targetId") String targetId);

    @Query("SELECT SUM(p.amount) FROM Payment p WHERE p.paymentDate >= :from " +
           "AND p.paymentDate < :to AND p.paymentStatus = :status")
    BigDecimal sumByStatusBetween(@Param("status") Payment.PaymentStatus status,
                                  @Param("from") LocalDateTime from,
                                  @Param("to") LocalDateTime to);
}
