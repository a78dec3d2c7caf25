package com.medidesk.repository;

import com.medidesk.entity.BillingTarget;
import com.medidesk.entity.Charge;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;

@Repository
public interface ChargeRepository extends JpaRepository<Charge, String> {

    @Query("SELECT c FROM Charge c WHERE c.target.kind = :kind AND c.target.targetId = :targetId " +
           "ORDER BY c.chargeDate, c.id")
    List<Charge> findByTarget(@Param("kind") BillingTarget.Kind kind, @Param("targetId") String targetId);

    @Query("SELECT c FROM Charge c WHERE c.target.kind = :kind AND c.target.targetId = :targetId " +
           "AND c.chargeType = :chargeType ORDER BY c.chargeDate, c.id")
    List<Charge> findByTargetAndType(@Param("kind") BillingTarget.Kind kind,
                                     @Param("targetId") String targetId,
                                     @Param("chargeType") Charge.ChargeType chargeType);

    @Query("SELECT SUM(c.totalAmount) FROM Charge c " +
           "WHERE c.target.kind = :kind AND c.target.targetId IN :targetIds")
    BigDecimal sumTotalsByTargets(@Param("kind") BillingTarget.Kind kind,
                                  @Param("targetIds") Collection<String> targetIds);
}
