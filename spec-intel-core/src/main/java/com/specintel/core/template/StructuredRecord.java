package com.specintel.core.template;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed read/write access to one record in structured form.
 *
 * <p>Readers assume the record already passed the field checks of {@link TemplateEngine};
 * absent optional values come back as null, empty lists or the supplied default.
 */
public final class StructuredRecord {

    private final JsonNode node;

    public StructuredRecord(JsonNode node) {
        this.node = node;
    }

    public JsonNode node() {
        return node;
    }

    /**
     * @param field field name
     * @return text value, or null if absent or null
     */
    public String text(String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }

    /**
     * @param field field name
     * @param defaultValue value used when the field is absent
     * @return boolean value
     */
    public boolean flag(String field, boolean defaultValue) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        return value.asBoolean(defaultValue);
    }

    /**
     * @param field field name
     * @return list of text values, empty if absent
     */
    public List<String> list(String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>(value.size());
        value.forEach(element -> values.add(element.asText()));
        return values;
    }

    /**
     * Writes a text field, omitting it when the value is null.
     */
    public static void putText(ObjectNode target, String field, String value) {
        if (value != null) {
            target.put(field, value);
        }
    }

    /**
     * Writes a list field; an empty list is written as an empty array.
     */
    public static void putList(ObjectNode target, String field, List<String> values) {
        ArrayNode array = target.putArray(field);
        values.forEach(array::add);
    }
}
