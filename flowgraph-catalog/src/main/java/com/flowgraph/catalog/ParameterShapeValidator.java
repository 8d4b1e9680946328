package com.flowgraph.catalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Structural checks of an entry's params against a descriptor's config schema: required parameters
 * are present and values of the scalar types {@code string}, {@code number}, {@code boolean} and
 * {@code string[]} have that JSON shape. Other declared types are not checked.
 */
public final class ParameterShapeValidator {

    private ParameterShapeValidator() {
    }

    public static List<ShapeWarning> validate(PluginDescriptor descriptor, Map<String, ?> params) {
        if (descriptor == null) return List.of();
        Map<String, ?> values = params != null ? params : Map.of();
        List<ShapeWarning> warnings = new ArrayList<>();
        for (ParameterDef def : descriptor.getConfigParameters()) {
            Object value = values.get(def.getName());
            if (value == null) {
                if (def.isRequired()) {
                    warnings.add(new ShapeWarning(def.getName(), ShapeWarning.Kind.MISSING_REQUIRED,
                            descriptor.getPluginName() + ": required parameter '" + def.getName() + "' is missing"));
                }
                continue;
            }
            if (!matches(def.getType(), value)) {
                warnings.add(new ShapeWarning(def.getName(), ShapeWarning.Kind.TYPE_MISMATCH,
                        descriptor.getPluginName() + ": parameter '" + def.getName() + "' should be "
                                + def.getType() + " but is " + describe(value)));
            }
        }
        return warnings;
    }

    static boolean matches(String declaredType, Object value) {
        if (declaredType == null) return true;
        switch (declaredType.trim().toLowerCase(Locale.ROOT)) {
            case "string":
                return value instanceof String;
            case "number":
                return value instanceof Number;
            case "boolean":
                return value instanceof Boolean;
            case "string[]":
                return value instanceof List && ((List<?>) value).stream().allMatch(v -> v instanceof String);
            default:
                return true;
        }
    }

    private static String describe(Object value) {
        if (value instanceof String) return "string";
        if (value instanceof Number) return "number";
        if (value instanceof Boolean) return "boolean";
        if (value instanceof List) return "list";
        if (value instanceof Map) return "object";
        return value.getClass().getSimpleName();
    }
}
