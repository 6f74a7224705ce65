package org.stencil.cache;

/**
 * The text of one template as loaded by a {@link TemplateLoader}.
 *
 * @param sourceId The identity of the template, e.g. its path relative to the template root.
 * @param application The application the template belongs to; empty if it belongs to none.
 * @param text The template source.
 */
public record TemplateSource(String sourceId, String application, String text) {
}
