package com.specintel.core.template;

import com.specintel.core.model.ExportFormat;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Template engine for export formats.
 */
public class ExportEngine extends TemplateEngine<ExportFormat> {

    // Language families by format ID, used by filterByCategory.
    private static final Map<String, Set<String>> LANGUAGE_CATEGORIES = Map.of(
        "compiled", Set.of("java", "go", "rust", "csharp", "kotlin"),
        "scripted", Set.of("python", "javascript"),
        "typed", Set.of("typescript", "csharp", "kotlin", "java", "rust", "go"),
        "dynamic", Set.of("python", "javascript"),
        "static", Set.of("java", "go", "rust", "csharp", "kotlin", "typescript"),
        "web", Set.of("javascript", "typescript"),
        "systems", Set.of("rust", "go", "csharp"),
        "jvm", Set.of("java", "kotlin"));

    public ExportEngine() {
        super(new ExportFormatKind());
    }

    /**
     * @param formats formats to search
     * @param formatId format ID
     * @return the format with that ID, if any
     */
    public Optional<ExportFormat> find(List<ExportFormat> formats, String formatId) {
        return Optional.ofNullable(findById(formats, formatId));
    }

    /**
     * Filters by file extension; a missing leading dot is added before matching.
     */
    public List<ExportFormat> filterByExtension(List<ExportFormat> formats, String extension) {
        String normalized = extension.startsWith(".") ? extension : "." + extension;
        return filterBy(formats, ExportFormatKind.FILE_EXTENSION, normalized);
    }

    public List<ExportFormat> filterByMimeType(List<ExportFormat> formats, String mimeType) {
        return filterBy(formats, ExportFormatKind.MIME_TYPE, mimeType);
    }

    /**
     * Filters by language name, ignoring case ("Python" matches "python").
     */
    public List<ExportFormat> filterByLanguage(List<ExportFormat> formats, String language) {
        String wanted = language.toLowerCase(Locale.ROOT);
        return formats.stream()
            .filter(format -> format.name() != null && format.name().toLowerCase(Locale.ROOT).equals(wanted))
            .toList();
    }

    /**
     * Keeps language formats belonging to a language category: {@code compiled},
     * {@code scripted}, {@code typed}, {@code dynamic}, {@code static}, {@code web},
     * {@code systems} or {@code jvm}. Formats match by {@code format_id}.
     *
     * @param formats formats to filter
     * @param category category name, exact match
     * @return matching formats in source order, empty for an unknown category
     */
    public List<ExportFormat> filterByCategory(List<ExportFormat> formats, String category) {
        Set<String> formatIds = LANGUAGE_CATEGORIES.get(category);
        if (formatIds == null) {
            return List.of();
        }
        return formats.stream()
            .filter(format -> formatIds.contains(format.formatId()))
            .toList();
    }

    /**
     * Groups formats by family: the part of {@code format_id} before the first underscore,
     * or the whole ID when it has none.
     *
     * @param formats formats to group
     * @return formats per family, in order of first appearance
     */
    public Map<String, List<ExportFormat>> groupByFamily(List<ExportFormat> formats) {
        Map<String, List<ExportFormat>> families = new LinkedHashMap<>();
        for (ExportFormat format : formats) {
            families.computeIfAbsent(prefix(format.formatId()), k -> new ArrayList<>()).add(format);
        }
        return families;
    }

    static String prefix(String id) {
        int underscore = id.indexOf('_');
        return underscore > 0 ? id.substring(0, underscore) : id;
    }
}
