package com.specintel.core.template;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.specintel.core.config.ConfigException;
import com.specintel.core.config.MalformedConfigException;
import com.specintel.core.config.StructuredDocuments;
import com.specintel.core.model.ValidationIssue;
import com.specintel.core.model.ValidationIssue.IssueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Loads, validates, filters, groups and serializes one kind of configuration record.
 *
 * <p>One implementation serves every record kind. A {@link RecordKind} supplies the
 * field declarations and conversions; this class interprets them, so questions,
 * export formats, conflict rules and quality analyzers all share identical
 * validation and filtering semantics.
 *
 * <p><b>Contract:</b>
 * <ul>
 *   <li>{@link #load(JsonNode)} is fail-fast: the first record with a missing required
 *       field or an illegal value fails the whole set, then cross-record problems
 *       (duplicate IDs) fail it as well.</li>
 *   <li>{@link #validate(List)} never throws; it reports every problem it finds.</li>
 *   <li>Filtering and grouping return new collections and never fail for lack of matches.</li>
 *   <li>{@code load(toStructured(records))} equals {@code records} for any valid list.</li>
 * </ul>
 *
 * <p>Instances hold no mutable state and are safe to share between threads.
 *
 * @param <T> record type
 */
public class TemplateEngine<T> {

    private static final Logger log = LoggerFactory.getLogger(TemplateEngine.class);

    protected final RecordKind<T> kind;
    private final Map<String, FieldSpec> fieldsByName;

    public TemplateEngine(RecordKind<T> kind) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.fieldsByName = kind.fields().stream()
            .collect(Collectors.toMap(FieldSpec::name, Function.identity(), (a, b) -> a, LinkedHashMap::new));
    }

    /**
     * @return the record kind this engine interprets
     */
    public RecordKind<T> kind() {
        return kind;
    }

    // ==================== Loading ====================

    /**
     * Loads records from structured data.
     *
     * @param data array of record objects
     * @return loaded records in source order
     * @throws ConfigException naming the offending record and field if any record is invalid
     */
    public List<T> load(JsonNode data) {
        if (data == null || !data.isArray()) {
            throw new ConfigException("Invalid " + kind.name() + " set",
                List.of(notAList(data)));
        }

        List<T> records = new ArrayList<>(data.size());
        for (int i = 0; i < data.size(); i++) {
            JsonNode element = data.get(i);
            List<ValidationIssue> issues = checkNode(element, i);
            if (!issues.isEmpty()) {
                throw new ConfigException("Invalid " + kind.name() + " " + issues.get(0).recordId(), issues);
            }
            T record = kind.bind(new StructuredRecord(element));
            log.debug("Loaded {}: {}", kind.name(), element.path(kind.idField()).asText());
            records.add(record);
        }

        List<ValidationIssue> issues = validate(records);
        if (!issues.isEmpty()) {
            throw new ConfigException("Invalid " + kind.name() + " set", issues);
        }
        return List.copyOf(records);
    }

    /**
     * Loads records from plain Java collections, e.g. maps produced by another parser.
     *
     * @param data list of field maps
     * @return loaded records in source order
     * @throws ConfigException if any record is invalid
     */
    public List<T> load(List<? extends Map<String, ?>> data) {
        return load(StructuredDocuments.json().<JsonNode>valueToTree(data));
    }

    /**
     * Reads a document whose root is a list of records and loads it.
     *
     * @param path YAML or JSON document
     * @return loaded records in source order
     * @throws MalformedConfigException if the document cannot be read or its root is not a list
     * @throws ConfigException if any record is invalid
     */
    public List<T> loadDocument(Path path) {
        JsonNode root = StructuredDocuments.read(path);
        if (!root.isArray()) {
            throw new MalformedConfigException(
                capitalize(kind.name()) + " document must contain a list at its root", path);
        }
        try {
            List<T> records = load(root);
            log.info("Loaded {} {} record(s) from {}", records.size(), kind.name(), path);
            return records;
        } catch (MalformedConfigException e) {
            throw e;
        } catch (ConfigException e) {
            throw new ConfigException("Invalid " + kind.name() + " document", e.issues(), path);
        }
    }

    // ==================== Validation ====================

    /**
     * Validates a record set without throwing.
     *
     * <p>Reports missing required fields, illegal values, duplicate unique keys (one
     * issue per duplicate, naming both records) and kind-specific problems. A null element
     * is reported as an invalid record.
     *
     * @param records records to check
     * @return every issue found, empty if the set is valid
     */
    public List<ValidationIssue> validate(List<T> records) {
        List<JsonNode> nodes = new ArrayList<>(records.size());
        for (T record : records) {
            nodes.add(record == null ? null : toNode(record));
        }

        List<ValidationIssue> issues = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            issues.addAll(checkNode(nodes.get(i), i));
        }
        issues.addAll(checkUniqueness(nodes));
        issues.addAll(kind.checkSet(records.stream().filter(Objects::nonNull).toList()));
        return issues;
    }

    /**
     * Validates raw structured data without throwing. Pre-flight variant of {@link #validate(List)}
     * that also reports type errors and illegal enum values before anything is bound.
     *
     * @param data array of record objects
     * @return every issue found, empty if the data would load
     */
    public List<ValidationIssue> validateStructured(JsonNode data) {
        if (data == null || !data.isArray()) {
            return List.of(notAList(data));
        }

        List<ValidationIssue> issues = new ArrayList<>();
        List<JsonNode> nodes = new ArrayList<>(data.size());
        data.forEach(nodes::add);
        for (int i = 0; i < nodes.size(); i++) {
            issues.addAll(checkNode(nodes.get(i), i));
        }
        issues.addAll(checkUniqueness(nodes));

        if (issues.isEmpty()) {
            List<T> records = nodes.stream()
                .map(node -> kind.bind(new StructuredRecord(node)))
                .toList();
            issues.addAll(kind.checkSet(records));
        }
        return issues;
    }

    // ==================== Filtering & Grouping ====================

    /**
     * Keeps records whose field equals {@code value} exactly (case-sensitive).
     *
     * <p>For list fields such as {@code tags}, a record matches if any element equals the value.
     * Booleans compare by their text form ({@code "true"}/{@code "false"}).
     *
     * @param records records to filter
     * @param field indexed field name
     * @param value value to match
     * @return matching records in source order, possibly empty
     * @throws IllegalArgumentException if the field is not indexed for this kind
     */
    public List<T> filterBy(List<T> records, String field, String value) {
        requireIndexed(field);
        return records.stream()
            .filter(record -> valuesOf(toNode(record), field).contains(value))
            .toList();
    }

    /**
     * Partitions records by a field.
     *
     * <p>A record whose field is a list appears under every element. Records without a
     * value for the field are left out. Groups are ordered by first appearance.
     *
     * @param records records to group
     * @param field indexed field name
     * @return groups keyed by field value
     * @throws IllegalArgumentException if the field is not indexed for this kind
     */
    public Map<String, List<T>> groupBy(List<T> records, String field) {
        requireIndexed(field);
        Map<String, List<T>> groups = new LinkedHashMap<>();
        for (T record : records) {
            for (String value : valuesOf(toNode(record), field)) {
                groups.computeIfAbsent(value, k -> new ArrayList<>()).add(record);
            }
        }
        return groups;
    }

    /**
     * @param records records to search
     * @param id value of the ID field
     * @return first record with that ID, or null
     */
    public T findById(List<T> records, String id) {
        return records.stream()
            .filter(record -> id.equals(toNode(record).path(kind.idField()).asText(null)))
            .findFirst()
            .orElse(null);
    }

    // ==================== Serialization ====================

    /**
     * Converts records to structured data; exact inverse of {@link #load(JsonNode)}.
     *
     * @param records records to convert
     * @return array of record objects
     */
    public ArrayNode toStructured(List<T> records) {
        ArrayNode array = StructuredDocuments.json().createArrayNode();
        records.forEach(record -> array.add(toNode(record)));
        return array;
    }

    /**
     * Writes records to a YAML or JSON document, chosen by file extension.
     *
     * @param records records to write
     * @param path target document
     */
    public void toDocument(List<T> records, Path path) {
        StructuredDocuments.write(toStructured(records), path);
        log.info("Saved {} {} record(s) to {}", records.size(), kind.name(), path);
    }

    // ==================== Internals ====================

    protected ObjectNode toNode(T record) {
        ObjectNode node = StructuredDocuments.json().createObjectNode();
        kind.unbind(record, node);
        return node;
    }

    private List<ValidationIssue> checkNode(JsonNode node, int index) {
        if (node == null || !node.isObject()) {
            return List.of(new ValidationIssue(kind.name(), "#" + index, null, IssueType.INVALID_FORMAT,
                "record must be a mapping of field names to values"));
        }

        String recordId = recordId(node, index);
        List<ValidationIssue> issues = new ArrayList<>();
        for (FieldSpec field : fieldsByName.values()) {
            JsonNode value = node.get(field.name());
            if (isAbsent(value, field)) {
                if (field.required()) {
                    issues.add(issue(recordId, field.name(), IssueType.MISSING_FIELD,
                        "required field '" + field.name() + "' is missing or blank"));
                }
                continue;
            }
            switch (field.type()) {
                case STRING -> {
                    if (!value.isValueNode() || value.isBoolean()) {
                        issues.add(issue(recordId, field.name(), IssueType.INVALID_FORMAT,
                            "field '" + field.name() + "' must be text"));
                    } else if (!field.legalValues().isEmpty() && !field.legalValues().contains(value.asText())) {
                        issues.add(issue(recordId, field.name(), IssueType.ILLEGAL_VALUE,
                            "field '" + field.name() + "' has illegal value '" + value.asText()
                                + "', expected one of " + field.legalValues()));
                    }
                }
                case BOOLEAN -> {
                    if (!value.isBoolean()) {
                        issues.add(issue(recordId, field.name(), IssueType.INVALID_FORMAT,
                            "field '" + field.name() + "' must be true or false"));
                    }
                }
                case STRING_LIST -> {
                    boolean valid = value.isArray();
                    if (valid) {
                        for (JsonNode element : value) {
                            valid &= element.isTextual() || element.isNumber();
                        }
                    }
                    if (!valid) {
                        issues.add(issue(recordId, field.name(), IssueType.INVALID_FORMAT,
                            "field '" + field.name() + "' must be a list of strings"));
                    }
                }
            }
        }
        if (issues.isEmpty()) {
            issues.addAll(kind.checkRecord(node, recordId));
        }
        return issues;
    }

    private List<ValidationIssue> checkUniqueness(List<JsonNode> nodes) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (String field : kind.uniqueFields()) {
            Map<String, Integer> firstSeen = new HashMap<>();
            for (int i = 0; i < nodes.size(); i++) {
                JsonNode node = nodes.get(i);
                JsonNode value = node == null ? null : node.get(field);
                if (value == null || !value.isValueNode() || value.asText().isBlank()) {
                    continue;
                }
                Integer first = firstSeen.putIfAbsent(value.asText(), i);
                if (first != null) {
                    issues.add(issue(value.asText(), field, IssueType.DUPLICATE_ID,
                        String.format("duplicate %s '%s' in records #%d and #%d",
                            field, value.asText(), first, i)));
                }
            }
        }
        return issues;
    }

    private List<String> valuesOf(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (value.isArray()) {
            List<String> values = new ArrayList<>(value.size());
            value.forEach(element -> values.add(element.asText()));
            return values;
        }
        return List.of(value.asText());
    }

    private void requireIndexed(String field) {
        FieldSpec spec = fieldsByName.get(field);
        if (spec == null || !spec.indexed()) {
            throw new IllegalArgumentException(String.format(
                "Field '%s' is not indexed for %s records. Indexed fields: %s",
                field, kind.name(), indexedFields()));
        }
    }

    /**
     * @return names of the fields {@link #filterBy} and {@link #groupBy} accept
     */
    public List<String> indexedFields() {
        return fieldsByName.values().stream()
            .filter(FieldSpec::indexed)
            .map(FieldSpec::name)
            .toList();
    }

    private String recordId(JsonNode node, int index) {
        JsonNode id = node.get(kind.idField());
        if (id != null && id.isValueNode() && !id.asText().isBlank()) {
            return id.asText();
        }
        return "#" + index;
    }

    private static boolean isAbsent(JsonNode value, FieldSpec field) {
        if (value == null || value.isNull()) {
            return true;
        }
        return field.type() == FieldSpec.FieldType.STRING && value.isTextual() && value.asText().isBlank();
    }

    private ValidationIssue issue(String recordId, String field, IssueType type, String message) {
        return new ValidationIssue(kind.name(), recordId, field, type, message);
    }

    private ValidationIssue notAList(JsonNode data) {
        String found = data == null ? "nothing" : data.getNodeType().name().toLowerCase(Locale.ROOT);
        return new ValidationIssue(kind.name(), "-", null, IssueType.INVALID_FORMAT,
            kind.name() + " data must be a list of records, found " + found);
    }

    private static String capitalize(String text) {
        return text.isEmpty() ? text : Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }

    /**
     * Collects the distinct values of a field across records, in first-seen order.
     *
     * @param records records to scan
     * @param field indexed field name
     * @return distinct values
     */
    public Collection<String> distinctValues(List<T> records, String field) {
        return groupBy(records, field).keySet();
    }
}
