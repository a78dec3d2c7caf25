package com.medidesk.repository;

import com.medidesk.entity.Bed;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface BedRepository extends JpaRepository<Bed, String> {
    Optional<Bed> findByBedNumber(String bedNumber);

    boolean existsByBedNumber(String bedNumber);

    /**
     * Reads the bed row under a write lock held until the surrounding transaction ends,
     * so concurrent admissions into the same bed are serialized by the store.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM Bed b WHERE b.id = :bedId")
    Optional<Bed> findByIdForUpdate(@Param("bedId") String bedId);

    List<Bed> findByStatusOrderByWardTypeAscBedNumberAsc(Bed.BedStatus status);

    List<Bed> findByStatusAndWardTypeOrderByBedNumber(Bed.BedStatus status, Bed.WardType wardType);

    List<Bed> findByWardTypeOrderByBedNumber(Bed.WardType wardType);
}
