package org.stencil.compiler.backend.optimize.features;

import org.stencil.compiler.api.CompilerErrorCode;
import org.stencil.compiler.api.OptionFlag;
import org.stencil.compiler.backend.optimize.AssetKind;
import org.stencil.compiler.backend.optimize.AssetPublisher;
import org.stencil.compiler.backend.optimize.IOptimizationPass;
import org.stencil.compiler.backend.optimize.NodeLists;
import org.stencil.compiler.backend.optimize.PassContext;
import org.stencil.compiler.backend.optimize.script.CssCompressor;
import org.stencil.compiler.backend.optimize.script.JsMinifier;
import org.stencil.compiler.backend.optimize.script.JsSyntaxException;
import org.stencil.compiler.diagnostics.CompilerLogger;
import org.stencil.compiler.frontend.parser.ast.AttributeNode;
import org.stencil.compiler.frontend.parser.ast.DirectiveNode;
import org.stencil.compiler.frontend.parser.ast.DocumentNode;
import org.stencil.compiler.frontend.parser.ast.ElementNode;
import org.stencil.compiler.frontend.parser.ast.HtmlElements;
import org.stencil.compiler.frontend.parser.ast.Node;
import org.stencil.compiler.frontend.parser.ast.TextNode;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Merges, minifies and bundles scripts and stylesheets.
 * <p>
 * Inline scripts and styles that render unconditionally, i.e. outside every directive branch,
 * and carry no attributes beyond a default {@code type} are merged in document order. The
 * merged script takes the place of the last one, the merged style the place of the first one.
 * An element opts out with {@code data-no-merge}.
 */
public final class ScriptStyleMergePass implements IOptimizationPass {

    private static final Set<String> SCRIPT_TYPES = Set.of(
            "text/javascript", "application/javascript", "application/x-javascript", "text/ecmascript");
    private static final Set<String> MERGEABLE_SCRIPT_ATTRIBUTES = Set.of("type", "language");
    private static final Pattern WHITESPACE = Pattern.compile("[ \\t\\n\\r\\f]+");

    private static final Set<OptionFlag> FLAGS = Set.of(
            OptionFlag.MERGE_INTERNAL_JAVASCRIPT, OptionFlag.MERGE_INTERNAL_CSS,
            OptionFlag.COMPILE_JAVASCRIPT, OptionFlag.COMPILE_CSS,
            OptionFlag.PACK_EXTERNAL_JAVASCRIPT, OptionFlag.PACK_EXTERNAL_CSS);

    @Override
    public DocumentNode apply(DocumentNode document, PassContext context) {
        if (FLAGS.stream().noneMatch(context::enabledAnywhere)) {
            return document;
        }
        Run run = new Run(context);
        run.collect(document.children(), true);
        run.seal();
        return document.withChildren(run.rewrite(document.children()));
    }

    private static final class Run {

        private final PassContext context;
        private final List<ElementNode> scripts = new ArrayList<>();
        private final List<ElementNode> styles = new ArrayList<>();
        private final Set<ElementNode> merged = Collections.newSetFromMap(new IdentityHashMap<>());
        private boolean publisherWarned;

        Run(PassContext context) {
            this.context = context;
        }

        // region Collection

        void collect(List<Node> nodes, boolean unconditional) {
            for (Node node : nodes) {
                if (node instanceof ElementNode element) {
                    if (unconditional && mergeableScript(element)) {
                        scripts.add(element);
                    } else if (unconditional && mergeableStyle(element)) {
                        styles.add(element);
                    } else if (!HtmlElements.isRawText(element.name())) {
                        collect(element.children(), unconditional);
                    }
                } else if (node instanceof DirectiveNode directive && directive.block()) {
                    directive.branches().forEach(b -> collect(b.children(), false));
                }
            }
        }

        void seal() {
            merged.addAll(scripts);
            merged.addAll(styles);
        }

        private boolean mergeableScript(ElementNode element) {
            if (!inlineScript(element) || !context.enabled(OptionFlag.MERGE_INTERNAL_JAVASCRIPT, element)) {
                return false;
            }
            return MERGEABLE_SCRIPT_ATTRIBUTES.containsAll(literalAttributes(element.attributes()).keySet());
        }

        private boolean mergeableStyle(ElementNode element) {
            if (!inlineStyle(element) || !context.enabled(OptionFlag.MERGE_INTERNAL_CSS, element)) {
                return false;
            }
            return Set.of("type").containsAll(literalAttributes(element.attributes()).keySet());
        }

        // endregion

        // region Rewriting

        List<Node> rewrite(List<Node> nodes) {
            List<Node> out = new ArrayList<>();
            boolean removed = false;
            for (Node node : nodes) {
                Node result = node;
                if (node instanceof ElementNode element) {
                    result = element(element);
                } else if (node instanceof DirectiveNode directive && directive.block()) {
                    result = directive.mapBranches(this::rewrite);
                }
                if (result == null) {
                    removed = true;
                    continue;
                }
                if (removed && result instanceof TextNode text && !out.isEmpty()
                        && out.get(out.size() - 1) instanceof TextNode) {
                    NodeLists.append(out, text);
                    compressJoined(out);
                } else {
                    NodeLists.append(out, result);
                }
                removed = false;
            }
            return pack(out);
        }

        private Node element(ElementNode element) {
            if (merged.contains(element)) {
                if (!scripts.isEmpty() && element == scripts.get(scripts.size() - 1)) {
                    return mergedScript(element);
                }
                if (!styles.isEmpty() && element == styles.get(0)) {
                    return element.withChildren(compress(joinStyles()));
                }
                return null;
            }
            if (inlineScript(element) && context.enabled(OptionFlag.COMPILE_JAVASCRIPT, element)) {
                return element.withChildren(minify(element.children(), true, element));
            }
            if (inlineStyle(element) && context.enabled(OptionFlag.COMPILE_CSS, element)) {
                return element.withChildren(compress(element.children()));
            }
            if (HtmlElements.isRawText(element.name())) {
                return element;
            }
            return element.withChildren(rewrite(element.children()));
        }

        private ElementNode mergedScript(ElementNode last) {
            List<Node> parts = new ArrayList<>();
            for (ElementNode script : scripts) {
                if (!parts.isEmpty()) {
                    String end = trailingText(parts).strip();
                    String separator = end.endsWith(";") || end.endsWith("}") ? "\n" : ";\n";
                    NodeLists.append(parts, new TextNode(separator, script.span()));
                }
                script.children().forEach(child -> NodeLists.append(parts, child));
            }
            CompilerLogger.debug("ScriptStyleMerge: merged " + scripts.size() + " scripts into " + last.span());
            return last.withChildren(minify(parts, context.enabled(OptionFlag.COMPILE_JAVASCRIPT, last), last));
        }

        private List<Node> joinStyles() {
            List<Node> parts = new ArrayList<>();
            for (ElementNode style : styles) {
                if (!parts.isEmpty()) {
                    NodeLists.append(parts, new TextNode("\n", style.span()));
                }
                style.children().forEach(child -> NodeLists.append(parts, child));
            }
            return parts;
        }

        private List<Node> minify(List<Node> content, boolean compile, ElementNode script) {
            try {
                return JsMinifier.minify(content, compile);
            } catch (JsSyntaxException e) {
                context.diagnostics().reportError(CompilerErrorCode.INVALID_SCRIPT,
                        "Invalid <script> content: " + e.getMessage(), script.span());
                return content;
            }
        }

        private static List<Node> compress(List<Node> content) {
            return CssCompressor.compress(content);
        }

        private void compressJoined(List<Node> out) {
            TextNode joined = (TextNode) out.get(out.size() - 1);
            if (context.enabled(OptionFlag.WHITESPACE_COMPRESSION, joined)) {
                out.set(out.size() - 1, new TextNode(WHITESPACE.matcher(joined.text()).replaceAll(" "), joined.span()));
            }
        }

        // endregion

        // region Packing

        /**
         * Replaces each run of two or more local external scripts, or local stylesheets,
         * separated by whitespace only, with one element referencing a published bundle.
         */
        private List<Node> pack(List<Node> nodes) {
            List<Node> out = new ArrayList<>();
            int i = 0;
            while (i < nodes.size()) {
                AssetKind kind = packable(nodes.get(i));
                if (kind == null) {
                    out.add(nodes.get(i++));
                    continue;
                }
                List<ElementNode> run = new ArrayList<>();
                run.add((ElementNode) nodes.get(i));
                int end = i + 1;
                int j = i + 1;
                while (j < nodes.size()) {
                    if (nodes.get(j) instanceof TextNode t && t.isBlank()) {
                        j++;
                    } else if (packable(nodes.get(j)) == kind) {
                        run.add((ElementNode) nodes.get(j));
                        end = ++j;
                    } else {
                        break;
                    }
                }
                if (run.size() < 2 || context.publisher().isEmpty()) {
                    if (run.size() >= 2) warnNoPublisher();
                    out.add(nodes.get(i++));
                    continue;
                }
                ElementNode bundled = bundle(run, kind, context.publisher().get());
                if (bundled == null) {
                    out.addAll(nodes.subList(i, end));
                } else {
                    out.add(bundled);
                }
                i = end;
            }
            return out;
        }

        private ElementNode bundle(List<ElementNode> run, AssetKind kind, AssetPublisher publisher) {
            String urlAttribute = kind == AssetKind.JAVASCRIPT ? "src" : "href";
            List<String> urls = run.stream().map(e -> literalAttributes(e.attributes()).get(urlAttribute)).toList();
            String bundleUrl;
            try {
                bundleUrl = publisher.publish(urls, kind);
            } catch (UncheckedIOException e) {
                CompilerLogger.warn("Cannot publish bundle of " + urls + " for " + context.fileName() + ": "
                        + e.getCause().getMessage());
                return null;
            }
            CompilerLogger.info("Packed " + urls.size() + " " + kind + " files of " + context.fileName() + " into " + bundleUrl);
            ElementNode first = run.get(0);
            List<Node> attributes = new ArrayList<>();
            for (Node item : first.attributes()) {
                if (item instanceof AttributeNode a && a.name().equalsIgnoreCase(urlAttribute)) {
                    attributes.add(a.withValue(List.of(new TextNode(bundleUrl, a.span()))));
                } else {
                    attributes.add(item);
                }
            }
            return first.withAttributes(attributes);
        }

        private AssetKind packable(Node node) {
            if (!(node instanceof ElementNode element)) {
                return null;
            }
            Map<String, String> attributes = literalAttributes(element.attributes());
            if (attributes == null) {
                return null;
            }
            if (element.name().equals("script") && context.enabled(OptionFlag.PACK_EXTERNAL_JAVASCRIPT, element)
                    && element.children().stream().allMatch(c -> c instanceof TextNode t && t.isBlank())
                    && isLocal(attributes.get("src"))
                    && Set.of("src", "type").containsAll(attributes.keySet())
                    && scriptType(attributes)) {
                return AssetKind.JAVASCRIPT;
            }
            if (element.name().equals("link") && context.enabled(OptionFlag.PACK_EXTERNAL_CSS, element)
                    && "stylesheet".equalsIgnoreCase(attributes.get("rel"))
                    && isLocal(attributes.get("href"))
                    && Set.of("rel", "href", "type").containsAll(attributes.keySet())
                    && (!attributes.containsKey("type") || "text/css".equalsIgnoreCase(attributes.get("type")))) {
                return AssetKind.CSS;
            }
            return null;
        }

        private void warnNoPublisher() {
            if (!publisherWarned) {
                CompilerLogger.warn("Packing external assets of " + context.fileName()
                        + " is enabled but no asset publisher is configured; files are left as they are.");
                publisherWarned = true;
            }
        }

        // endregion
    }

    // region Element classification

    private static boolean inlineScript(ElementNode element) {
        if (!element.name().equals("script") || !element.hasEndTag()) return false;
        Map<String, String> attributes = literalAttributes(element.attributes());
        return attributes != null && !attributes.containsKey("src") && !attributes.containsKey("data-no-merge")
                && scriptType(attributes);
    }

    private static boolean inlineStyle(ElementNode element) {
        if (!element.name().equals("style") || !element.hasEndTag()) return false;
        Map<String, String> attributes = literalAttributes(element.attributes());
        return attributes != null && !attributes.containsKey("data-no-merge")
                && (!attributes.containsKey("type") || "text/css".equalsIgnoreCase(attributes.get("type")));
    }

    private static boolean scriptType(Map<String, String> attributes) {
        String type = attributes.get("type");
        return type == null || SCRIPT_TYPES.contains(type.toLowerCase(Locale.ROOT));
    }

    private static boolean isLocal(String url) {
        if (url == null || url.isBlank()) return false;
        String lower = url.toLowerCase(Locale.ROOT);
        return !lower.startsWith("http:") && !lower.startsWith("https:") && !lower.startsWith("//")
                && !lower.startsWith("data:");
    }

    /**
     * @return Lower-case attribute names mapped to their values, or {@code null} if any item
     *         depends on the render context. Boolean attributes map to the empty string.
     */
    private static Map<String, String> literalAttributes(List<Node> items) {
        Map<String, String> attributes = new LinkedHashMap<>();
        for (Node item : items) {
            if (item instanceof TextNode t && t.isBlank()) {
                continue;
            }
            if (!(item instanceof AttributeNode a)) {
                return null;
            }
            String value = a.hasValue() ? a.literalValue() : "";
            if (value == null) {
                return null;
            }
            attributes.put(a.name().toLowerCase(Locale.ROOT), value);
        }
        return attributes;
    }

    private static String trailingText(List<Node> parts) {
        return parts.get(parts.size() - 1) instanceof TextNode t ? t.text() : "";
    }

    // endregion
}
