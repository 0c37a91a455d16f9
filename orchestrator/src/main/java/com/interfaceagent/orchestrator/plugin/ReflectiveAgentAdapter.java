package com.interfaceagent.orchestrator.plugin;

import com.interfaceagent.orchestrator.agent.Agent;
import com.interfaceagent.orchestrator.agent.AgentException;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Map;

/**
 * Presents a plugin object that does not implement {@link Agent} through the
 * agent contract. Only {@code execute(Map)} is mandatory; {@code validateInput(Map)}
 * and {@code onError(<exception>, Map)} are used when the class declares them.
 */
final class ReflectiveAgentAdapter implements Agent {

    private final Object target;
    private final Method execute;
    private final Method validateInput;   // nullable
    private final Method onError;         // nullable

    ReflectiveAgentAdapter(Object target, Method execute, Method validateInput, Method onError) {
        this.target        = target;
        this.execute       = execute;
        this.validateInput = validateInput;
        this.onError       = onError;
    }

    @Override
    public boolean validateInput(Map<String, Object> data) {
        if (validateInput == null) return true;
        return Boolean.TRUE.equals(invoke(validateInput, data));
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> execute(Map<String, Object> data) {
        return (Map<String, Object>) invoke(execute, data);
    }

    @Override
    public void onError(AgentException error, Map<String, Object> data) {
        if (onError != null) {
            invoke(onError, error, data);
        }
    }

    private Object invoke(Method method, Object... args) {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err)           throw err;
            throw new AgentException(AgentException.Kind.PROCESSING_FAILED,
                    target.getClass().getName() + "." + method.getName() + " failed: " + cause, cause);
        } catch (IllegalAccessException e) {
            throw new AgentException(AgentException.Kind.PROCESSING_FAILED,
                    "Cannot invoke " + method + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "ReflectiveAgentAdapter[" + target.getClass().getName() + "]";
    }
}
