package com.interfaceagent.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A configured, named agent that pipeline steps can bind to.
 *
 * {@code agentType} is the registry key used to construct instances; several
 * definitions may share one type with different configurations. Plugin-backed
 * definitions also carry the module reference and symbol the Plugin Loader
 * resolves the first time the type is needed.
 *
 * DB table: agents  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "agents")
public class AgentDefinition {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    // Display name; unique but mutable.
    @Column(nullable = false, unique = true)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "agent_type", nullable = false)
    private String agentType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AgentCategory category = AgentCategory.CUSTOM;

    @Column(nullable = false)
    private String version = "1.0.0";

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AgentStatus status = AgentStatus.INACTIVE;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> config = new LinkedHashMap<>();

    @Column(nullable = false)
    private boolean plugin = false;

    @Column(name = "plugin_module")
    private String pluginModule;

    @Column(name = "plugin_symbol")
    private String pluginSymbol;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected AgentDefinition() {}   // required by JPA

    public AgentDefinition(String name, String agentType, AgentCategory category) {
        this.name      = name;
        this.agentType = agentType;
        this.category  = category;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID          getId()           { return id; }
    public String        getName()         { return name; }
    public String        getDescription()  { return description; }
    public String        getAgentType()    { return agentType; }
    public AgentCategory getCategory()     { return category; }
    public String        getVersion()      { return version; }
    public AgentStatus   getStatus()       { return status; }
    public boolean       isPlugin()        { return plugin; }
    public String        getPluginModule() { return pluginModule; }
    public String        getPluginSymbol() { return pluginSymbol; }
    public Instant       getCreatedAt()    { return createdAt; }
    public Instant       getUpdatedAt()    { return updatedAt; }

    public Map<String, Object> getConfig() {
        return config == null ? Map.of() : config;
    }

    public boolean isActive() { return status == AgentStatus.ACTIVE; }

    public void setName(String name)                   { this.name = name; }
    public void setDescription(String description)     { this.description = description; }
    public void setVersion(String version)             { this.version = version; }
    public void setStatus(AgentStatus status)          { this.status = status; }
    public void setConfig(Map<String, Object> config)  { this.config = new LinkedHashMap<>(config); }

    /** Marks this definition as plugin-backed; the loader resolves {@code symbol} from {@code module}. */
    public void bindPlugin(String module, String symbol) {
        this.plugin       = true;
        this.pluginModule = module;
        this.pluginSymbol = symbol;
    }
}
