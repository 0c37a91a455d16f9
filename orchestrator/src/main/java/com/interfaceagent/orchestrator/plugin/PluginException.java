package com.interfaceagent.orchestrator.plugin;

/**
 * A plugin load failed. The registry is left exactly as it was before the call.
 */
public class PluginException extends RuntimeException {

    public enum Kind {
        PLUGIN_NOT_FOUND,     // module or symbol could not be resolved
        CONTRACT_VIOLATION,   // resolved class does not expose the agent operations
        LOAD_ERROR            // malformed module, static initialiser failure, ...
    }

    private final Kind   kind;
    private final String moduleRef;
    private final String symbol;

    public PluginException(Kind kind, String moduleRef, String symbol, String message) {
        this(kind, moduleRef, symbol, message, null);
    }

    public PluginException(Kind kind, String moduleRef, String symbol, String message, Throwable cause) {
        super("[" + kind + "] " + message + " (module=" + moduleRef + ", symbol=" + symbol + ")", cause);
        this.kind      = kind;
        this.moduleRef = moduleRef;
        this.symbol    = symbol;
    }

    public Kind   getKind()      { return kind; }
    public String getModuleRef() { return moduleRef; }
    public String getSymbol()    { return symbol; }
}
