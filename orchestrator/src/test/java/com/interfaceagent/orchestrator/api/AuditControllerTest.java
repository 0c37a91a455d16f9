package com.interfaceagent.orchestrator.api;

import com.interfaceagent.orchestrator.audit.AuditLogger;
import com.interfaceagent.orchestrator.model.AuditRecord;
import com.interfaceagent.orchestrator.model.AuditStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AuditController.class)
class AuditControllerTest {

    @Autowired MockMvc       mockMvc;
    @MockitoBean AuditLogger auditLogger;

    @Test
    void find_byResource_returnsRecords() throws Exception {
        AuditRecord record = new AuditRecord("alice", "pipeline.create", "pipeline", "p-1",
                AuditStatus.SUCCESS, Map.of("name", "orders"), "10.0.0.1");
        when(auditLogger.forResource("pipeline", "p-1")).thenReturn(List.of(record));

        mockMvc.perform(get("/audit-records").param("resourceType", "pipeline").param("resourceId", "p-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].actor").value("alice"))
                .andExpect(jsonPath("$[0].status").value("SUCCESS"))
                .andExpect(jsonPath("$[0].details.name").value("orders"));
    }

    @Test
    void find_byActor_delegates() throws Exception {
        when(auditLogger.byActor("bob")).thenReturn(List.of());

        mockMvc.perform(get("/audit-records").param("actor", "bob"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
    }

    @Test
    void find_withoutFilter_returns400() throws Exception {
        mockMvc.perform(get("/audit-records"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("INVALID_REQUEST"));
        verifyNoInteractions(auditLogger);
    }
}
