package com.specintel.core.model;

/**
 * An output format a domain can export specifications to.
 *
 * <p>{@code templateId} is opaque here; an external renderer resolves it.
 *
 * @param formatId stable, unique format ID
 * @param name display name
 * @param description optional description
 * @param fileExtension file extension including the leading dot
 * @param mimeType MIME type in {@code type/subtype} form
 * @param templateId renderer template reference, unique within an exporter set
 */
public record ExportFormat(
    String formatId,
    String name,
    String description,
    String fileExtension,
    String mimeType,
    String templateId
) {
}
