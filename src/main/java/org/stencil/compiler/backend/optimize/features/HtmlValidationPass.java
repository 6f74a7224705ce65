package org.stencil.compiler.backend.optimize.features;

import org.stencil.compiler.api.CompilerErrorCode;
import org.stencil.compiler.api.OptionFlag;
import org.stencil.compiler.api.SourceSpan;
import org.stencil.compiler.backend.optimize.IOptimizationPass;
import org.stencil.compiler.backend.optimize.PassContext;
import org.stencil.compiler.diagnostics.CompilerLogger;
import org.stencil.compiler.frontend.parser.ast.AttributeNode;
import org.stencil.compiler.frontend.parser.ast.Branch;
import org.stencil.compiler.frontend.parser.ast.DirectiveNode;
import org.stencil.compiler.frontend.parser.ast.DocumentNode;
import org.stencil.compiler.frontend.parser.ast.ElementNode;
import org.stencil.compiler.frontend.parser.ast.Node;
import org.stencil.compiler.frontend.parser.ast.StartTagNode;
import org.stencil.compiler.frontend.parser.ast.TextNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks the attributes of every start tag and optionally drops empty {@code class} attributes.
 * <p>
 * Attributes inside the branches of a directive are checked per render path: a name may occur
 * in several branches, but not twice in one branch or in a branch and outside the directive.
 */
public final class HtmlValidationPass implements IOptimizationPass {

    private static final Pattern ATTRIBUTE_NAME = Pattern.compile("[^\\s\"'<>/=\\p{Cntrl}]+");
    private static final String UNQUOTED_FORBIDDEN = "\"'=<>`";

    @Override
    public DocumentNode apply(DocumentNode document, PassContext context) {
        if (!context.enabledAnywhere(OptionFlag.VALIDATE_HTML)
                && !context.enabledAnywhere(OptionFlag.HTML_REMOVE_EMPTY_CLASS_ATTRIBUTES)) {
            return document;
        }
        return document.withChildren(new Run(context).walk(document.children()));
    }

    private static final class Run {

        private final PassContext context;

        Run(PassContext context) {
            this.context = context;
        }

        List<Node> walk(List<Node> nodes) {
            List<Node> out = new ArrayList<>(nodes.size());
            for (Node node : nodes) {
                if (node instanceof ElementNode element) {
                    out.add(element.withAttributes(tag(element.name(), element.attributes(), element))
                            .withChildren(walk(element.children())));
                } else if (node instanceof StartTagNode start) {
                    out.add(start.withAttributes(tag(start.name(), start.attributes(), start)));
                } else if (node instanceof DirectiveNode directive && directive.block()) {
                    out.add(directive.mapBranches(this::walk));
                } else {
                    out.add(node);
                }
            }
            return out;
        }

        private List<Node> tag(String name, List<Node> items, Node tag) {
            List<Node> result = context.enabled(OptionFlag.HTML_REMOVE_EMPTY_CLASS_ATTRIBUTES, tag)
                    ? withoutEmptyClass(items) : items;
            if (context.enabled(OptionFlag.VALIDATE_HTML, tag)) {
                validate(name, result, tag);
            }
            return result;
        }

        private void validate(String name, List<Node> items, Node tag) {
            Set<String> topLevel = new HashSet<>();
            Set<String> anywhere = new HashSet<>();
            for (Node item : items) {
                if (item instanceof AttributeNode attribute) {
                    attribute(attribute);
                    String key = attribute.name().toLowerCase(Locale.ROOT);
                    if (!topLevel.add(key)) {
                        violation(CompilerErrorCode.DUPLICATE_ATTRIBUTE,
                                "Duplicate attribute '" + attribute.name() + "' on <" + name + ">.", attribute.span());
                    }
                }
            }
            anywhere.addAll(topLevel);
            for (Node item : items) {
                if (item instanceof DirectiveNode directive && directive.block()) {
                    for (Branch branch : directive.branches()) {
                        branch(name, branch.children(), new HashSet<>(topLevel), anywhere);
                    }
                }
            }
            if (context.enabled(OptionFlag.HTML_CHECK_ALT_AND_TITLE_ATTRIBUTES, tag)) {
                required(name, items, anywhere, tag.span());
            }
        }

        private void branch(String name, List<Node> items, Set<String> seen, Set<String> anywhere) {
            for (Node item : items) {
                if (item instanceof AttributeNode attribute) {
                    attribute(attribute);
                    String key = attribute.name().toLowerCase(Locale.ROOT);
                    anywhere.add(key);
                    if (!seen.add(key)) {
                        violation(CompilerErrorCode.DUPLICATE_ATTRIBUTE,
                                "Duplicate attribute '" + attribute.name() + "' on <" + name + "> in one render path.",
                                attribute.span());
                    }
                } else if (item instanceof DirectiveNode directive && directive.block()) {
                    for (Branch nested : directive.branches()) {
                        branch(name, nested.children(), new HashSet<>(seen), anywhere);
                    }
                }
            }
        }

        private void attribute(AttributeNode attribute) {
            if (!ATTRIBUTE_NAME.matcher(attribute.name()).matches()) {
                violation(CompilerErrorCode.INVALID_ATTRIBUTE,
                        "Invalid attribute name '" + attribute.name() + "'.", attribute.span());
            }
            if (attribute.hasValue() && attribute.quote().isEmpty()) {
                for (Node part : attribute.value()) {
                    if (part instanceof TextNode text && containsAny(text.text(), UNQUOTED_FORBIDDEN)) {
                        violation(CompilerErrorCode.INVALID_ATTRIBUTE,
                                "Unquoted value of '" + attribute.name() + "' contains one of " + UNQUOTED_FORBIDDEN
                                        + "; quote the value.", attribute.span());
                        break;
                    }
                }
            }
            if (attribute.name().equalsIgnoreCase("id")) {
                String value = attribute.literalValue();
                if (value != null && value.chars().anyMatch(Character::isWhitespace)) {
                    violation(CompilerErrorCode.INVALID_ATTRIBUTE,
                            "Attribute id=\"" + value + "\" must not contain whitespace.", attribute.span());
                }
            }
        }

        private void required(String name, List<Node> items, Set<String> present, SourceSpan span) {
            boolean imageInput = name.equals("input") && items.stream()
                    .anyMatch(i -> i instanceof AttributeNode a && a.name().equalsIgnoreCase("type")
                            && "image".equalsIgnoreCase(a.literalValue()));
            if ((name.equals("img") || name.equals("area") || imageInput) && !present.contains("alt")) {
                violation(CompilerErrorCode.MISSING_REQUIRED_ATTRIBUTE, "<" + name + "> needs an alt attribute.", span);
            }
            if ((name.equals("abbr") || name.equals("acronym")) && !present.contains("title")) {
                violation(CompilerErrorCode.MISSING_REQUIRED_ATTRIBUTE, "<" + name + "> needs a title attribute.", span);
            }
        }

        private void violation(CompilerErrorCode code, String message, SourceSpan span) {
            if (context.timeline().at(span.start()).has(OptionFlag.HTML_VALIDATION_WARNINGS)) {
                CompilerLogger.warn(span + ": " + message);
                context.diagnostics().reportWarning(code, message, span);
            } else {
                context.diagnostics().reportError(code, message, span);
            }
        }

        private static List<Node> withoutEmptyClass(List<Node> items) {
            List<Node> out = new ArrayList<>(items.size());
            for (Node item : items) {
                if (item instanceof AttributeNode a && a.name().equalsIgnoreCase("class")
                        && (!a.hasValue() || (a.literalValue() != null && a.literalValue().isBlank()))) {
                    if (!out.isEmpty() && out.get(out.size() - 1) instanceof TextNode t && t.isBlank()) {
                        out.remove(out.size() - 1);
                    }
                    continue;
                }
                out.add(item);
            }
            return out;
        }

        private static boolean containsAny(String text, String characters) {
            for (char c : characters.toCharArray()) {
                if (text.indexOf(c) >= 0) return true;
            }
            return false;
        }
    }
}
