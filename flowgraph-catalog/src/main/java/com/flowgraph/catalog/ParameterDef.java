package com.flowgraph.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Definition of a single plugin parameter: name, declared type ({@code string}, {@code number},
 * {@code boolean}, {@code string[]} or a plugin interface such as {@code AIProvider}), required flag,
 * description and whether the value is secret.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ParameterDef {

    private final String name;
    private final String type;
    private final boolean required;
    private final String description;
    private final boolean secret;

    @JsonCreator
    public ParameterDef(
            @JsonProperty("name") String name,
            @JsonProperty("type") String type,
            @JsonProperty("required") Boolean required,
            @JsonProperty("description") String description,
            @JsonProperty("secret") Boolean secret) {
        this.name = name;
        this.type = type;
        this.required = Boolean.TRUE.equals(required);
        this.description = description;
        this.secret = Boolean.TRUE.equals(secret);
    }

    public static ParameterDef of(String name, String type, boolean required) {
        return new ParameterDef(name, type, required, null, false);
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public boolean isRequired() {
        return required;
    }

    public String getDescription() {
        return description;
    }

    public boolean isSecret() {
        return secret;
    }

    /** Copy with the given name; config schemas key parameters by name instead of carrying it. */
    public ParameterDef withName(String name) {
        return new ParameterDef(name, type, required, description, secret);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ParameterDef that = (ParameterDef) o;
        return required == that.required && secret == that.secret
                && Objects.equals(name, that.name) && Objects.equals(type, that.type)
                && Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, required, description, secret);
    }

    @Override
    public String toString() {
        return name + ":" + type + (required ? " (required)" : "");
    }
}
