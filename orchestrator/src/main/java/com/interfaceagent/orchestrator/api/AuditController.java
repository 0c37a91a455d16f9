package com.interfaceagent.orchestrator.api;

import com.interfaceagent.orchestrator.api.dto.AuditRecordResponse;
import com.interfaceagent.orchestrator.audit.AuditLogger;
import com.interfaceagent.orchestrator.model.AuditRecord;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only access to the audit trail. Exactly one filter is required:
 *
 * GET /audit-records?resourceType=pipeline&resourceId={id}
 * GET /audit-records?action=pipeline.execute
 * GET /audit-records?actor=alice
 */
@RestController
@RequestMapping("/audit-records")
public class AuditController {

    private final AuditLogger auditLogger;

    public AuditController(AuditLogger auditLogger) {
        this.auditLogger = auditLogger;
    }

    @GetMapping
    public List<AuditRecordResponse> find(@RequestParam(required = false) String resourceType,
                                          @RequestParam(required = false) String resourceId,
                                          @RequestParam(required = false) String action,
                                          @RequestParam(required = false) String actor) {
        List<AuditRecord> records;
        if (resourceType != null && resourceId != null) {
            records = auditLogger.forResource(resourceType, resourceId);
        } else if (action != null) {
            records = auditLogger.byAction(action);
        } else if (actor != null) {
            records = auditLogger.byActor(actor);
        } else {
            throw new IllegalArgumentException("Specify resourceType and resourceId, action, or actor");
        }
        return records.stream().map(AuditRecordResponse::from).toList();
    }
}
