package de.mirkosertic.mcp.toolsearch.mcp;

import io.modelcontextprotocol.spec.McpSchema;
import org.jspecify.annotations.Nullable;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives MCP tool input schemas from request records.
 * <p>
 * Every record component becomes a property. Components annotated with {@link Nullable}
 * are optional, all others are listed as required.
 */
public final class SchemaGenerator {

    private SchemaGenerator() {
    }

    /**
     * Generate an object schema for a request record.
     */
    public static McpSchema.JsonSchema generateSchema(final Class<? extends Record> recordClass) {
        final Map<String, Object> properties = new LinkedHashMap<>();
        final List<String> required = new ArrayList<>();

        for (final RecordComponent component : recordClass.getRecordComponents()) {
            properties.put(component.getName(), propertySchema(component));
            if (!isNullable(component)) {
                required.add(component.getName());
            }
        }

        return new McpSchema.JsonSchema("object", properties, required, null, null, null);
    }

    /**
     * Schema for tools without parameters.
     */
    public static McpSchema.JsonSchema emptySchema() {
        return new McpSchema.JsonSchema("object", Map.of(), List.of(), null, null, null);
    }

    private static boolean isNullable(final RecordComponent component) {
        // jspecify's @Nullable is a type annotation
        return component.getAnnotatedType().isAnnotationPresent(Nullable.class)
                || component.isAnnotationPresent(Nullable.class);
    }

    private static Map<String, Object> propertySchema(final RecordComponent component) {
        final Map<String, Object> schema = new LinkedHashMap<>();
        final Description description = component.getAnnotation(Description.class);
        if (description != null) {
            schema.put("description", description.value());
        }
        addType(schema, component.getGenericType());
        return schema;
    }

    private static void addType(final Map<String, Object> schema, final Type type) {
        if (type instanceof ParameterizedType parameterized
                && parameterized.getRawType() instanceof Class<?> raw
                && (List.class.isAssignableFrom(raw) || Set.class.isAssignableFrom(raw))) {
            schema.put("type", "array");
            final Map<String, Object> items = new LinkedHashMap<>();
            addType(items, parameterized.getActualTypeArguments()[0]);
            schema.put("items", items);
            return;
        }
        schema.put("type", jsonType(type));
    }

    private static String jsonType(final Type type) {
        if (type == String.class) {
            return "string";
        }
        if (type == Integer.class || type == int.class || type == Long.class || type == long.class) {
            return "integer";
        }
        if (type == Double.class || type == double.class || type == Float.class || type == float.class) {
            return "number";
        }
        if (type == Boolean.class || type == boolean.class) {
            return "boolean";
        }
        return "object";
    }
}
