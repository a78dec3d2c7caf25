package com.medidesk.service;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Reads the highest stored identifier for a bucket from the table that owns the prefix.
 */
@Component
@Slf4j
public class JpaIdSequenceSeed implements IdSequenceSeed {

    private static final Map<String, String> ENTITY_BY_PREFIX = Map.of(
        IdGenerator.IdKind.PATIENT.prefix(), "Patient",
        IdGenerator.IdKind.VISIT.prefix(), "Visit",
        IdGenerator.IdKind.ADMISSION.prefix(), "Admission",
        IdGenerator.IdKind.CHARGE.prefix(), "Charge",
        IdGenerator.IdKind.PAYMENT.prefix(), "Payment",
        IdGenerator.IdKind.AUDIT_LOG.prefix(), "AuditLog",
        IdGenerator.IdKind.OT_PROCEDURE.prefix(), "OtProcedure",
        IdGenerator.IdKind.BED.prefix(), "Bed",
        IdGenerator.IdKind.DOCTOR.prefix(), "Doctor"
    );

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public long highestIssued(String prefix, String stamp) {
        String entity = ENTITY_BY_PREFIX.get(prefix);
        if (entity == null) {
            return 0L;
        }
        String bucket = prefix + stamp;
        String highest = entityManager
            .createQuery("SELECT MAX(e.id) FROM " + entity + " e WHERE e.id LIKE :pattern", String.class)
            .setParameter("pattern", bucket + "%")
            .getSingleResult();
        if (highest == null) {
            return 0L;
        }
        String sequence = highest.substring(bucket.length());
        try {
            return Long.parseLong(sequence);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Stored id " + highest + " does not end in a sequence number", e);
        }
    }
}
