package com.graphivault.infrastructure.audit;

import com.graphivault.domain.repository.AuditLog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@lombok.RequiredArgsConstructor
public class DefaultAuditService implements AuditService {
    private final AuditLog auditLog;

    @Override
    public boolean record(String eventType, String status, String details) {
        log.info("AUDIT event={} status={} details={}", eventType, status, details);
        try {
            auditLog.append(eventType, status, details);
            return true;
        } catch (RuntimeException e) {
            // audit persistence is best-effort; never fail the main flow
            log.warn("Audit write failed for event={} status={}: {}", eventType, status, e.getMessage());
            return false;
        }
    }
}
