package com.interfaceagent.orchestrator.api;

import com.interfaceagent.orchestrator.api.dto.EventRecordResponse;
import com.interfaceagent.orchestrator.event.JpaEventLedger;
import com.interfaceagent.orchestrator.model.EventRecord;
import com.interfaceagent.orchestrator.model.EventStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Read-only access to the event log. Exactly one filter is required:
 *
 * GET /events?status=failed
 * GET /events?executionId={id}
 */
@RestController
@RequestMapping("/events")
public class EventController {

    private final JpaEventLedger ledger;

    public EventController(JpaEventLedger ledger) {
        this.ledger = ledger;
    }

    @GetMapping
    public List<EventRecordResponse> find(@RequestParam(required = false) String status,
                                          @RequestParam(required = false) UUID executionId) {
        List<EventRecord> records;
        if (executionId != null) {
            records = ledger.forExecution(executionId);
        } else if (status != null) {
            records = ledger.byStatus(parseStatus(status));
        } else {
            throw new IllegalArgumentException("Specify status or executionId");
        }
        return records.stream().map(EventRecordResponse::from).toList();
    }

    private static EventStatus parseStatus(String raw) {
        try {
            return EventStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown event status '" + raw + "'");
        }
    }
}
