package com.medidesk.repository;

import com.medidesk.entity.AuditLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AuditLogRepository extends JpaRepository<AuditLog, String> {
    List<AuditLog> findByTableNameAndRecordIdOrderByTimestampDescIdDesc(String tableName, String recordId);

    List<AuditLog> findByUserIdOrderByTimestampDescIdDesc(String userId, Pageable pageable);

    List<AuditLog> findByActionOrderByTimestampDescIdDesc(AuditLog.AuditAction action, Pageable pageable);

    List<AuditLog> findAllByOrderByTimestampDescIdDesc(Pageable pageable);
}
