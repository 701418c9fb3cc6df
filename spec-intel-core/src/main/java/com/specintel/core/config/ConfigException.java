package com.specintel.core.config;

import com.specintel.core.SpecIntelException;
import com.specintel.core.model.ValidationIssue;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Raised when configuration records fail validation during loading.
 *
 * <p>Carries every {@link ValidationIssue} found. A document that cannot be read or
 * parsed at all raises the {@link MalformedConfigException} subclass instead.
 */
public class ConfigException extends SpecIntelException {

    private final transient List<ValidationIssue> issues;
    private final transient Path source;

    public ConfigException(String message, List<ValidationIssue> issues) {
        this(message, issues, null);
    }

    public ConfigException(String message, List<ValidationIssue> issues, Path source) {
        super(format(message, issues, source));
        this.issues = issues == null ? List.of() : List.copyOf(issues);
        this.source = source;
    }

    protected ConfigException(String message, Path source, Throwable cause) {
        super(format(message, List.of(), source), cause);
        this.issues = List.of();
        this.source = source;
    }

    /**
     * @return every issue that caused the failure, possibly empty for malformed documents
     */
    public List<ValidationIssue> issues() {
        return issues;
    }

    /**
     * @return document the configuration came from, if it came from a file
     */
    public Optional<Path> source() {
        return Optional.ofNullable(source);
    }

    private static String format(String message, List<ValidationIssue> issues, Path source) {
        StringBuilder sb = new StringBuilder(message);
        if (source != null) {
            sb.append(" [").append(source).append(']');
        }
        if (issues != null && !issues.isEmpty()) {
            sb.append(": ").append(issues.stream()
                .map(ValidationIssue::toString)
                .collect(Collectors.joining("; ")));
        }
        return sb.toString();
    }
}
