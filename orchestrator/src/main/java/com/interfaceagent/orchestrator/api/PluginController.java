package com.interfaceagent.orchestrator.api;

import com.interfaceagent.orchestrator.agent.AgentRegistration;
import com.interfaceagent.orchestrator.api.dto.AgentTypeResponse;
import com.interfaceagent.orchestrator.api.dto.PluginLoadRequest;
import com.interfaceagent.orchestrator.api.dto.PluginReloadRequest;
import com.interfaceagent.orchestrator.plugin.PluginLoader.PluginInfo;
import com.interfaceagent.orchestrator.service.PluginService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * POST /plugins          load a plugin and bind it to a type name
 * POST /plugins/reload   re-read a loaded plugin; bound types switch to the new code
 * POST /plugins/unload   forget a loaded plugin; its types leave the registry
 * GET  /plugins          loaded plugins
 */
@RestController
@RequestMapping("/plugins")
public class PluginController {

    private final PluginService pluginService;

    public PluginController(PluginService pluginService) {
        this.pluginService = pluginService;
    }

    @PostMapping
    public ResponseEntity<AgentTypeResponse> load(@RequestBody PluginLoadRequest req, HttpServletRequest http) {
        AgentRegistration registration = pluginService.load(req.moduleRef(), req.symbol(), req.typeName(),
                req.config(), Callers.from(http));
        return ResponseEntity.status(HttpStatus.CREATED).body(AgentTypeResponse.from(registration));
    }

    @PostMapping("/reload")
    public Map<String, Object> reload(@RequestBody PluginReloadRequest req, HttpServletRequest http) {
        List<String> types = pluginService.reload(req.moduleRef(), req.symbol(), Callers.from(http));
        return Map.of("symbol", req.symbol(), "types", types);
    }

    @PostMapping("/unload")
    public Map<String, Object> unload(@RequestBody PluginReloadRequest req, HttpServletRequest http) {
        List<String> types = pluginService.unload(req.moduleRef(), req.symbol(), Callers.from(http));
        return Map.of("symbol", req.symbol(), "types", types);
    }

    @GetMapping
    public List<PluginInfo> list() {
        return pluginService.listLoaded();
    }
}
