package org.stencil.compiler.api;

/**
 * Maps a region of the compiled output, bracketed by {@code <!--dbg:id-->} markers, back to the
 * source region it was generated from.
 *
 * @param id The marker identifier.
 * @param outputStart The output offset right after the opening marker.
 * @param outputEnd The output offset of the closing marker.
 * @param source The originating source region.
 */
public record DebugMapEntry(int id, int outputStart, int outputEnd, SourceSpan source) {
}
