package com.medidesk.event;

import com.medidesk.entity.AuditLog;
import lombok.Builder;
import lombok.Getter;

import java.util.Map;

/**
 * Published by the billing ledger when a privileged charge mutation needs an audit entry.
 * Snapshots are captured at publish time, so later changes to the charge do not leak in.
 */
@Getter
@Builder
public class ChargeAuditEvent {

    private final String actor;
    private final AuditLog.AuditAction action;
    private final String chargeId;
    private final Map<String, Object> oldSnapshot;
    private final Map<String, Object> newSnapshot;
}
