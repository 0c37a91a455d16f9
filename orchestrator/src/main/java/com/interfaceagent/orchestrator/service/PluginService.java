package com.interfaceagent.orchestrator.service;

import com.interfaceagent.orchestrator.agent.AgentRegistration;
import com.interfaceagent.orchestrator.audit.AuditLogger;
import com.interfaceagent.orchestrator.audit.Caller;
import com.interfaceagent.orchestrator.model.AuditStatus;
import com.interfaceagent.orchestrator.plugin.PluginLoader;
import com.interfaceagent.orchestrator.plugin.PluginLoader.PluginInfo;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator-facing plugin operations: load, reload, unload, list. Wraps {@link PluginLoader} with the audit trail.
 */
@Service
public class PluginService {

    private static final String RESOURCE = "plugin";

    private final PluginLoader loader;
    private final AuditLogger  auditLogger;

    public PluginService(PluginLoader loader, AuditLogger auditLogger) {
        this.loader      = loader;
        this.auditLogger = auditLogger;
    }

    public AgentRegistration load(String moduleRef, String symbol, String typeName,
                                  Map<String, Object> config, Caller caller) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("moduleRef", String.valueOf(moduleRef));
        details.put("typeName", String.valueOf(typeName));
        try {
            AgentRegistration registration = loader.load(moduleRef, symbol, typeName,
                    config == null ? Map.of() : config);
            auditLogger.record(caller.actor(), "plugin.load", RESOURCE, symbol, AuditStatus.SUCCESS,
                    details, caller.origin());
            return registration;
        } catch (RuntimeException e) {
            details.put("error", String.valueOf(e.getMessage()));
            auditLogger.record(caller.actor(), "plugin.load", RESOURCE, symbol, AuditStatus.FAILURE,
                    details, caller.origin());
            throw e;
        }
    }

    /** @return the type names rebound to the fresh implementation */
    public List<String> reload(String moduleRef, String symbol, Caller caller) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("moduleRef", String.valueOf(moduleRef));
        try {
            List<String> types = loader.reload(moduleRef, symbol);
            details.put("types", types);
            auditLogger.record(caller.actor(), "plugin.reload", RESOURCE, symbol, AuditStatus.SUCCESS,
                    details, caller.origin());
            return types;
        } catch (RuntimeException e) {
            details.put("error", String.valueOf(e.getMessage()));
            auditLogger.record(caller.actor(), "plugin.reload", RESOURCE, symbol, AuditStatus.FAILURE,
                    details, caller.origin());
            throw e;
        }
    }

    /** @return the type names removed from the registry */
    public List<String> unload(String moduleRef, String symbol, Caller caller) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("moduleRef", String.valueOf(moduleRef));
        try {
            List<String> types = loader.unload(moduleRef, symbol);
            details.put("types", types);
            auditLogger.record(caller.actor(), "plugin.unload", RESOURCE, symbol, AuditStatus.SUCCESS,
                    details, caller.origin());
            return types;
        } catch (RuntimeException e) {
            details.put("error", String.valueOf(e.getMessage()));
            auditLogger.record(caller.actor(), "plugin.unload", RESOURCE, symbol, AuditStatus.FAILURE,
                    details, caller.origin());
            throw e;
        }
    }

    public List<PluginInfo> listLoaded() {
        return loader.listLoaded();
    }
}
