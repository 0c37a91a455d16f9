package com.interfaceagent.orchestrator.api;

import com.interfaceagent.orchestrator.agent.AgentRegistryException;
import com.interfaceagent.orchestrator.orchestration.OrchestrationException;
import com.interfaceagent.orchestrator.plugin.PluginException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps the service's exception kinds to HTTP problem responses (RFC 7807).
 * The {@code kind} property carries the enum constant so clients can branch on it.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(OrchestrationException.class)
    public ProblemDetail onOrchestration(OrchestrationException e) {
        HttpStatus status = switch (e.getKind()) {
            case PIPELINE_NOT_FOUND, STEP_NOT_FOUND, AGENT_NOT_FOUND, EXECUTION_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case DUPLICATE_NAME, STEP_ORDER_CONFLICT, AGENT_IN_USE, PIPELINE_NOT_ACTIVE -> HttpStatus.CONFLICT;
            case UNKNOWN_AGENT_TYPE -> HttpStatus.BAD_REQUEST;
            case AGENT_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
        return problem(status, e.getKind().name(), e.getMessage());
    }

    @ExceptionHandler(AgentRegistryException.class)
    public ProblemDetail onRegistry(AgentRegistryException e) {
        HttpStatus status = switch (e.getKind()) {
            case DUPLICATE_TYPE -> HttpStatus.CONFLICT;
            case UNKNOWN_TYPE -> HttpStatus.NOT_FOUND;
            case INSTANTIATION_FAILED -> HttpStatus.BAD_REQUEST;
        };
        return problem(status, e.getKind().name(), e.getMessage());
    }

    @ExceptionHandler(PluginException.class)
    public ProblemDetail onPlugin(PluginException e) {
        HttpStatus status = e.getKind() == PluginException.Kind.PLUGIN_NOT_FOUND
                ? HttpStatus.NOT_FOUND
                : HttpStatus.BAD_REQUEST;
        log.info("Plugin request failed: {}", e.getMessage());
        return problem(status, e.getKind().name(), e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail onBadRequest(IllegalArgumentException e) {
        return problem(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", e.getMessage());
    }

    private static ProblemDetail problem(HttpStatus status, String kind, String detail) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(status, detail);
        pd.setTitle(status.getReasonPhrase());
        pd.setProperty("kind", kind);
        return pd;
    }
}
