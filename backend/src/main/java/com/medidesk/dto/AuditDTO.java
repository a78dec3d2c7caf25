package com.medidesk.dto;

import com.medidesk.entity.AuditLog;
import lombok.*;

import java.time.Instant;

public class AuditDTO {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Response {
        private String logId;
        private String userId;
        private AuditLog.AuditAction action;
        private String actionDescription;
        private String tableName;
        private String recordId;
        private String oldValue;
        private String newValue;
        private Instant timestamp;
    }
}
