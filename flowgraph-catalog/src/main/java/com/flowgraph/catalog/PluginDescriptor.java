package com.flowgraph.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flowgraph.document.model.Role;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Catalog description of an installable plugin: display name, implementation name
 * ({@code pluginName}, written to an entry's {@code type}), role, config schema and the parameters
 * its constructor takes.
 * <p>
 * JSON shape:
 * <pre>
 * { "name": "RSS Feed", "pluginName": "RSSSource", "type": "source", "description": "...",
 *   "configSchema": { "url": { "type": "string", "required": true } },
 *   "constructorInterface": { "parameters": [ { "name": "provider", "type": "AIProvider" } ] } }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PluginDescriptor {

    private final String name;
    private final String pluginName;
    private final Role role;
    private final String description;
    private final boolean hidden;
    private final List<ParameterDef> configParameters;
    private final List<ParameterDef> constructorParameters;

    @JsonCreator
    public PluginDescriptor(
            @JsonProperty("name") String name,
            @JsonProperty("pluginName") String pluginName,
            @JsonProperty("type") Role role,
            @JsonProperty("description") String description,
            @JsonProperty("hidden") Boolean hidden,
            @JsonProperty("configSchema") Map<String, ParameterDef> configSchema,
            @JsonProperty("constructorInterface") ConstructorInterface constructorInterface) {
        this.name = name;
        this.pluginName = pluginName != null ? pluginName : name;
        this.role = role;
        this.description = description;
        this.hidden = Boolean.TRUE.equals(hidden);
        List<ParameterDef> schema = new ArrayList<>();
        if (configSchema != null) {
            configSchema.forEach((key, def) -> {
                if (key != null && def != null) schema.add(def.withName(key));
            });
        }
        this.configParameters = List.copyOf(schema);
        this.constructorParameters = constructorInterface != null
                ? constructorInterface.getParameters() : List.of();
    }

    public static PluginDescriptor of(String pluginName, Role role, List<ParameterDef> config,
                                      List<ParameterDef> constructorParameters) {
        Map<String, ParameterDef> schema = new LinkedHashMap<>();
        for (ParameterDef def : config) {
            schema.put(def.getName(), def);
        }
        return new PluginDescriptor(pluginName, pluginName, role, null, false, schema,
                new ConstructorInterface(constructorParameters));
    }

    public String getName() {
        return name;
    }

    public String getPluginName() {
        return pluginName;
    }

    @JsonProperty("type")
    public Role getRole() {
        return role;
    }

    public String getDescription() {
        return description;
    }

    public boolean isHidden() {
        return hidden;
    }

    /** Config schema parameters in declaration order. */
    @JsonIgnore
    public List<ParameterDef> getConfigParameters() {
        return configParameters;
    }

    @JsonIgnore
    public List<ParameterDef> getConstructorParameters() {
        return constructorParameters;
    }

    @JsonProperty("configSchema")
    Map<String, ParameterDef> configSchemaJson() {
        Map<String, ParameterDef> schema = new LinkedHashMap<>();
        for (ParameterDef def : configParameters) {
            schema.put(def.getName(), def);
        }
        return Collections.unmodifiableMap(schema);
    }

    @JsonProperty("constructorInterface")
    ConstructorInterface constructorInterfaceJson() {
        return new ConstructorInterface(constructorParameters);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PluginDescriptor that = (PluginDescriptor) o;
        return hidden == that.hidden
                && Objects.equals(name, that.name)
                && Objects.equals(pluginName, that.pluginName)
                && role == that.role
                && Objects.equals(description, that.description)
                && Objects.equals(configParameters, that.configParameters)
                && Objects.equals(constructorParameters, that.constructorParameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, pluginName, role, description, hidden, configParameters, constructorParameters);
    }

    @Override
    public String toString() {
        return "PluginDescriptor{" + pluginName + ", role=" + role + "}";
    }

    /** {@code constructorInterface} object: the constructor's parameter list. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ConstructorInterface {
        private final List<ParameterDef> parameters;

        @JsonCreator
        public ConstructorInterface(@JsonProperty("parameters") List<ParameterDef> parameters) {
            this.parameters = parameters != null ? List.copyOf(parameters) : List.of();
        }

        public List<ParameterDef> getParameters() {
            return parameters;
        }
    }
}
