package com.medidesk.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.medidesk.entity.AuditLog;
import com.medidesk.entity.Charge;
import com.medidesk.event.ChargeAuditEvent;
import com.medidesk.exception.InvalidRequestException;
import com.medidesk.repository.AuditLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only audit trail for privileged mutations: manual charge creation and
 * edits, and rate changes on beds and doctor fees.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditService {

    private final AuditLogRepository auditLogRepository;
    private final IdGenerator idGenerator;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional
    public AuditLog append(String actor, AuditLog.AuditAction action, String tableName, String recordId,
                           Map<String, Object> oldSnapshot, Map<String, Object> newSnapshot) {
        requirePresent(actor, "Audit actor");
        requirePresent(tableName, "Audit table name");
        requirePresent(recordId, "Audit record id");
        if (action == null) {
            throw new InvalidRequestException("Audit action is required");
        }

        AuditLog entry = AuditLog.builder()
            .id(idGenerator.next(IdGenerator.IdKind.AUDIT_LOG))
            .userId(actor)
            .action(action)
            .tableName(tableName)
            .recordId(recordId)
            .oldValue(toJson(oldSnapshot))
            .newValue(toJson(newSnapshot))
            .timestamp(Instant.now(clock))
            .build();

        AuditLog saved = auditLogRepository.save(entry);
        log.info("Audit {} by {} on {}/{}", action, actor, tableName, recordId);
        return saved;
    }

    /**
     * Records a charge audit inside the publishing transaction, just before it commits,
     * so a charge mutation and its audit entry become visible together or not at all.
     */
    @TransactionalEventListener(phase = TransactionPhase.BEFORE_COMMIT, fallbackExecution = true)
    public void onChargeAudit(ChargeAuditEvent event) {
        append(event.getActor(), event.getAction(), Charge.TABLE, event.getChargeId(),
            event.getOldSnapshot(), event.getNewSnapshot());
    }

    public AuditLog logManualChargeAdd(String actor, String chargeId, Map<String, Object> chargeData) {
        return append(actor, AuditLog.AuditAction.MANUAL_CHARGE_ADD, Charge.TABLE, chargeId, null, chargeData);
    }

    public AuditLog logManualChargeEdit(String actor, String chargeId,
                                        Map<String, Object> oldData, Map<String, Object> newData) {
        return append(actor, AuditLog.AuditAction.MANUAL_CHARGE_EDIT, Charge.TABLE, chargeId, oldData, newData);
    }

    public AuditLog logRateChange(String actor, String tableName, String recordId,
                                  String field, BigDecimal oldRate, BigDecimal newRate) {
        Map<String, Object> oldValue = new LinkedHashMap<>();
        oldValue.put(field, oldRate);
        Map<String, Object> newValue = new LinkedHashMap<>();
        newValue.put(field, newRate);
        return append(actor, AuditLog.AuditAction.RATE_CHANGE, tableName, recordId, oldValue, newValue);
    }

    @Transactional(readOnly = true)
    public List<AuditLog> findByRecord(String tableName, String recordId) {
        return auditLogRepository.findByTableNameAndRecordIdOrderByTimestampDescIdDesc(tableName, recordId);
    }

    @Transactional(readOnly = true)
    public List<AuditLog> findByActor(String actor, int limit) {
        return auditLogRepository.findByUserIdOrderByTimestampDescIdDesc(actor, PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public List<AuditLog> findByAction(AuditLog.AuditAction action, int limit) {
        return auditLogRepository.findByActionOrderByTimestampDescIdDesc(action, PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public List<AuditLog> findRecent(int limit) {
        return auditLogRepository.findAllByOrderByTimestampDescIdDesc(PageRequest.of(0, limit));
    }

    private String toJson(Map<String, Object> snapshot) {
        if (snapshot == null || snapshot.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Audit snapshot could not be serialized", e);
        }
    }

    private static void requirePresent(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidRequestException(field + " is required");
        }
    }
}
