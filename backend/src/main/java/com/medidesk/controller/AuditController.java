package com.medidesk.controller;

import com.medidesk.dto.AuditDTO;
import com.medidesk.entity.AuditLog;
import com.medidesk.service.AuditService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/v1/audit")
@RequiredArgsConstructor
@Tag(name = "Audit", description = "Audit trail of privileged changes")
public class AuditController {

    private final AuditService auditService;

    @GetMapping("/record/{tableName}/{recordId}")
    @Operation(summary = "Audit history of one record, newest first")
    public ResponseEntity<List<AuditDTO.Response>> byRecord(
            @PathVariable String tableName,
            @PathVariable String recordId) {
        return ok(auditService.findByRecord(tableName, recordId));
    }

    @GetMapping("/user/{userId}")
    @Operation(summary = "Recent audit entries of a user")
    public ResponseEntity<List<AuditDTO.Response>> byUser(
            @PathVariable String userId,
            @RequestParam(defaultValue = "100") int limit) {
        return ok(auditService.findByActor(userId, limit));
    }

    @GetMapping("/action/{action}")
    @Operation(summary = "Recent audit entries of one action type")
    public ResponseEntity<List<AuditDTO.Response>> byAction(
            @PathVariable AuditLog.AuditAction action,
            @RequestParam(defaultValue = "100") int limit) {
        return ok(auditService.findByAction(action, limit));
    }

    @GetMapping("/recent")
    @Operation(summary = "Most recent audit entries")
    public ResponseEntity<List<AuditDTO.Response>> recent(@RequestParam(defaultValue = "100") int limit) {
        return ok(auditService.findRecent(limit));
    }

    private ResponseEntity<List<AuditDTO.Response>> ok(List<AuditLog> entries) {
        return ResponseEntity.ok(entries.stream().map(this::mapToResponse).toList());
    }

    private AuditDTO.Response mapToResponse(AuditLog entry) {
        return AuditDTO.Response.builder()
            .logId(entry.getId())
            .userId(entry.getUserId())
            .action(entry.getAction())
            .actionDescription(entry.getAction().getDescription())
            .tableName(entry.getTableName())
            .recordId(entry.getRecordId())
            .oldValue(entry.getOldValue())
            .newValue(entry.getNewValue())
            .timestamp(entry.getTimestamp())
            .build();
    }
}
