package org.stencil.compiler.frontend.structure;

import org.stencil.compiler.api.CompilerErrorCode;
import org.stencil.compiler.api.SourceSpan;
import org.stencil.compiler.frontend.directive.BlockKind;
import org.stencil.compiler.frontend.directive.BranchKeyword;
import org.stencil.compiler.frontend.directive.DirectiveEntry;
import org.stencil.compiler.frontend.parser.ast.AttributeNode;
import org.stencil.compiler.frontend.parser.ast.Branch;
import org.stencil.compiler.frontend.parser.ast.CommentNode;
import org.stencil.compiler.frontend.parser.ast.DirectiveNode;
import org.stencil.compiler.frontend.parser.ast.ElementNode;
import org.stencil.compiler.frontend.parser.ast.EndTagNode;
import org.stencil.compiler.frontend.parser.ast.ExpressionNode;
import org.stencil.compiler.frontend.parser.ast.HtmlElements;
import org.stencil.compiler.frontend.parser.ast.Node;
import org.stencil.compiler.frontend.parser.ast.TagPair;
import org.stencil.compiler.frontend.parser.ast.TextNode;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the normalized form of one node sequence: the document, a directive branch, or the
 * attribute list inside a directive branch of a start tag.
 * <p>
 * Text is fed through an HTML state machine that continues across the template nodes of the
 * sequence. The tag stack starts with the frames that were open when the sequence was entered;
 * those frames are shared with the enclosing builder and can only be closed here, which emits
 * an {@link EndTagNode}.
 */
final class SequenceBuilder {

    private enum State {
        CONTENT, ATTRIBUTES, ATTRIBUTE_NAME, AFTER_ATTRIBUTE_NAME, BEFORE_VALUE,
        QUOTED_VALUE, UNQUOTED_VALUE, HTML_COMMENT, DECLARATION, RAW_TEXT
    }

    private static final String UNQUOTED_FORBIDDEN = " \t\n\r\f>\"'";

    private final NormalizerContext context;
    private final boolean attributeMode;
    private final List<Node> rootOutput = new ArrayList<>();
    private final List<Frame> stack;
    private int baseDepth;
    private State state;

    // Text node being scanned.
    private String text;
    private SourceSpan textSpan;
    private int mark;

    // Start tag being built.
    private String tagName;
    private SourceSpan tagSpan;
    private List<Node> attributes;

    // Attribute being built.
    private StringBuilder attributeName;
    private SourceSpan attributeSpan;
    private StringBuilder separator;
    private SourceSpan separatorSpan;
    private String quote;
    private List<Node> value;

    // HTML comment being built.
    private List<Node> commentParts;
    private SourceSpan commentSpan;

    private String rawTextTag;

    private SequenceBuilder(NormalizerContext context, List<Frame> inherited, boolean attributeMode) {
        this.context = context;
        this.attributeMode = attributeMode;
        this.stack = new ArrayList<>(inherited);
        this.baseDepth = inherited.size();
        if (attributeMode) {
            this.state = State.ATTRIBUTES;
            this.attributes = rootOutput;
        } else {
            this.state = State.CONTENT;
        }
    }

    static SequenceBuilder content(NormalizerContext context, List<Frame> inherited) {
        return new SequenceBuilder(context, inherited, false);
    }

    static SequenceBuilder attributes(NormalizerContext context) {
        return new SequenceBuilder(context, List.of(), true);
    }

    void process(List<Node> nodes) {
        for (int k = 0; k < nodes.size(); k++) {
            Node node = nodes.get(k);
            Node next = k + 1 < nodes.size() ? nodes.get(k + 1) : null;
            if (node instanceof TextNode t) {
                text(t, next);
            } else {
                templateNode(node);
            }
        }
    }

    // region Finishing

    /**
     * Finishes the document: closes optional end tags and rejects everything else left open.
     */
    List<Node> finishDocument(SourceSpan documentSpan) {
        requireContent("the end of the template", documentSpan);
        while (!stack.isEmpty()) {
            Frame top = stack.get(stack.size() - 1);
            if (context.parseAllTags(top.span.start()) || !HtmlElements.hasOptionalEndTag(top.name)) {
                throw context.abort(CompilerErrorCode.UNCLOSED_ELEMENT,
                        "Element <" + top.name + "> opened at " + top.span + " is never closed.", top.span);
            }
            popTop(null, top.span);
        }
        return rootOutput;
    }

    /**
     * Closes frames opened in this branch whose end tag is optional.
     */
    void closeLeakedOptional() {
        while (stack.size() > baseDepth) {
            Frame top = stack.get(stack.size() - 1);
            if (context.parseAllTags(top.span.start()) || !HtmlElements.hasOptionalEndTag(top.name)) {
                return;
            }
            popTop(null, top.span);
        }
    }

    /**
     * Flattens the frames this branch leaves open and returns the branch content.
     */
    List<Node> finishBranch() {
        for (int j = stack.size() - 1; j >= baseDepth; j--) {
            stack.get(j).flatten();
        }
        return rootOutput;
    }

    List<Frame> stack() {
        return List.copyOf(stack);
    }

    private List<Node> finishAttributeBranch(Branch branch) {
        switch (state) {
            case ATTRIBUTE_NAME -> finishAttribute(branch.span().start());
            case AFTER_ATTRIBUTE_NAME -> finishBooleanAttributeBeforeWhitespace(branch.span().start());
            case UNQUOTED_VALUE -> finishAttribute(branch.span().start());
            case ATTRIBUTES -> { }
            default -> throw context.abort(CompilerErrorCode.MALFORMED_TAG,
                    "An attribute value is cut by the end of branch {% " + branch.keyword() + " %}.", branch.span());
        }
        return rootOutput;
    }

    private void requireContent(String where, SourceSpan span) {
        switch (state) {
            case CONTENT -> { }
            case HTML_COMMENT -> throw context.abort(CompilerErrorCode.MALFORMED_TAG,
                    "HTML comment opened at " + commentSpan + " is not closed before " + where + ".", commentSpan);
            case DECLARATION -> throw context.abort(CompilerErrorCode.MALFORMED_TAG,
                    "Markup declaration is not closed before " + where + ".", span);
            case RAW_TEXT -> throw context.abort(CompilerErrorCode.MALFORMED_TAG,
                    "<" + rawTextTag + "> content is not closed before " + where + ".", span);
            default -> throw context.abort(CompilerErrorCode.MALFORMED_TAG,
                    "Start tag <" + tagName + "> opened at " + tagSpan + " is not finished before " + where + ".",
                    tagSpan);
        }
    }

    // endregion

    // region Text scanning

    private void text(TextNode node, Node next) {
        if (state == State.CONTENT && !attributeMode && !context.htmlEnabled(node.span().start())) {
            addText(currentOutput(), node.text(), node.span());
            return;
        }
        text = node.text();
        textSpan = node.span();
        mark = 0;
        int i = 0;
        while (i < text.length()) {
            i = step(i, next);
        }
        flush(text.length());
        text = null;
    }

    private int step(int i, Node next) {
        return switch (state) {
            case CONTENT -> content(i, next);
            case DECLARATION -> declaration(i);
            case HTML_COMMENT -> comment(i);
            case RAW_TEXT -> rawText(i);
            case ATTRIBUTES -> attributeList(i);
            case ATTRIBUTE_NAME -> attributeName(i);
            case AFTER_ATTRIBUTE_NAME -> afterAttributeName(i);
            case BEFORE_VALUE -> beforeValue(i);
            case QUOTED_VALUE -> quotedValue(i);
            case UNQUOTED_VALUE -> unquotedValue(i);
        };
    }

    private int content(int i, Node next) {
        if (text.charAt(i) != '<' || i + 1 >= text.length()) {
            return i + 1;
        }
        char n = text.charAt(i + 1);
        if (text.startsWith("<!--", i)) {
            flush(i);
            commentParts = new ArrayList<>();
            commentSpan = spanOf(i, i + 4);
            state = State.HTML_COMMENT;
            mark = i + 4;
            return i + 4;
        }
        if (n == '!' || n == '?') {
            state = State.DECLARATION;
            return i + 2;
        }
        if (n == '/') {
            int end = endTagEnd(i);
            if (end < 0) {
                return i + 1;
            }
            flush(i);
            endTag(i, end);
            mark = end;
            return end;
        }
        if (isNameStart(n)) {
            int nameEnd = scanName(i + 1);
            if (nameEnd == text.length() && next instanceof ExpressionNode) {
                // Dynamic tag name like <h{{ level }}>; passed through as text.
                return i + 1;
            }
            flush(i);
            tagName = text.substring(i + 1, nameEnd);
            tagSpan = spanOf(i, nameEnd);
            attributes = new ArrayList<>();
            state = State.ATTRIBUTES;
            mark = nameEnd;
            return nameEnd;
        }
        return i + 1;
    }

    private int declaration(int i) {
        int k = text.indexOf('>', i);
        if (k < 0) {
            return text.length();
        }
        state = State.CONTENT;
        return k + 1;
    }

    private int comment(int i) {
        int k = text.indexOf("-->", i);
        if (k < 0) {
            return text.length();
        }
        flush(k);
        SourceSpan span = commentSpan.union(spanOf(k, k + 3));
        state = State.CONTENT;
        currentOutput().add(new CommentNode(CommentNode.Kind.HTML, commentParts, span));
        commentParts = null;
        mark = k + 3;
        return k + 3;
    }

    private int rawText(int i) {
        for (int k = text.indexOf("</", i); k >= 0; k = text.indexOf("</", k + 1)) {
            int after = k + 2 + rawTextTag.length();
            if (!text.regionMatches(true, k + 2, rawTextTag, 0, rawTextTag.length())) continue;
            if (after < text.length() && !Character.isWhitespace(text.charAt(after))
                    && text.charAt(after) != '>' && text.charAt(after) != '/') continue;
            int end = endTagEnd(k);
            if (end < 0) continue;
            flush(k);
            state = State.CONTENT;
            endTag(k, end);
            mark = end;
            return end;
        }
        return text.length();
    }

    private int attributeList(int i) {
        char c = text.charAt(i);
        if (Character.isWhitespace(c)) {
            return i + 1;
        }
        flush(i);
        if (c == '>') {
            finishStartTag(false, i + 1);
            mark = i + 1;
            return i + 1;
        }
        if (c == '/' && i + 1 < text.length() && text.charAt(i + 1) == '>') {
            finishStartTag(true, i + 2);
            mark = i + 2;
            return i + 2;
        }
        state = State.ATTRIBUTE_NAME;
        attributeName = new StringBuilder();
        attributeSpan = spanOf(i, i + 1);
        separator = new StringBuilder();
        separatorSpan = null;
        quote = "";
        value = null;
        return i + 1;
    }

    private int attributeName(int i) {
        char c = text.charAt(i);
        if (Character.isWhitespace(c)) {
            flush(i);
            state = State.AFTER_ATTRIBUTE_NAME;
            return i;
        }
        if (c == '=') {
            flush(i);
            appendSeparator("=", spanOf(i, i + 1));
            state = State.BEFORE_VALUE;
            mark = i + 1;
            return i + 1;
        }
        if (c == '>' || (c == '/' && i + 1 < text.length() && text.charAt(i + 1) == '>')) {
            flush(i);
            finishAttribute(absolute(i));
            state = State.ATTRIBUTES;
            return i;
        }
        return i + 1;
    }

    private int afterAttributeName(int i) {
        char c = text.charAt(i);
        if (Character.isWhitespace(c)) {
            return i + 1;
        }
        if (c == '=') {
            flush(i);
            appendSeparator("=", spanOf(i, i + 1));
            state = State.BEFORE_VALUE;
            mark = i + 1;
            return i + 1;
        }
        // A boolean attribute; the whitespace since mark becomes an attribute item.
        finishBooleanAttributeBeforeWhitespace(absolute(mark));
        return i;
    }

    private int beforeValue(int i) {
        char c = text.charAt(i);
        if (Character.isWhitespace(c)) {
            return i + 1;
        }
        flush(i);
        value = new ArrayList<>();
        if (c == '"' || c == '\'') {
            quote = String.valueOf(c);
            state = State.QUOTED_VALUE;
            mark = i + 1;
            return i + 1;
        }
        if (c == '>') {
            finishAttribute(absolute(i));
            state = State.ATTRIBUTES;
            return i;
        }
        state = State.UNQUOTED_VALUE;
        return i;
    }

    private int quotedValue(int i) {
        int k = text.indexOf(quote.charAt(0), i);
        if (k < 0) {
            return text.length();
        }
        flush(k);
        finishAttribute(absolute(k + 1));
        state = State.ATTRIBUTES;
        mark = k + 1;
        return k + 1;
    }

    private int unquotedValue(int i) {
        char c = text.charAt(i);
        if (Character.isWhitespace(c) || c == '>') {
            flush(i);
            finishAttribute(absolute(i));
            state = State.ATTRIBUTES;
            return i;
        }
        return i + 1;
    }

    /**
     * Routes the text between {@code mark} and {@code to} to the sink of the current state.
     */
    private void flush(int to) {
        if (to <= mark) {
            return;
        }
        String slice = text.substring(mark, to);
        SourceSpan span = spanOf(mark, to);
        switch (state) {
            case CONTENT, DECLARATION, RAW_TEXT -> addText(currentOutput(), slice, span);
            case ATTRIBUTES -> addText(attributes, slice, span);
            case ATTRIBUTE_NAME -> {
                attributeName.append(slice);
                attributeSpan = attributeSpan.union(span);
            }
            case AFTER_ATTRIBUTE_NAME, BEFORE_VALUE -> appendSeparator(slice, span);
            case QUOTED_VALUE, UNQUOTED_VALUE -> addText(value, slice, span);
            case HTML_COMMENT -> addText(commentParts, slice, span);
        }
        mark = to;
    }

    // endregion

    // region Template nodes

    private void templateNode(Node node) {
        boolean block = node instanceof DirectiveNode d && d.block();
        switch (state) {
            case CONTENT -> {
                if (block && !attributeMode) {
                    directive((DirectiveNode) node);
                } else {
                    currentOutput().add(node);
                }
            }
            case RAW_TEXT, DECLARATION -> currentOutput().add(node);
            case HTML_COMMENT -> commentParts.add(node);
            case ATTRIBUTES -> attributes.add(block ? attributeDirective((DirectiveNode) node) : node);
            case ATTRIBUTE_NAME -> {
                finishAttribute(node.span().start());
                state = State.ATTRIBUTES;
                templateNode(node);
            }
            case AFTER_ATTRIBUTE_NAME -> {
                finishBooleanAttributeBeforeWhitespace(node.span().start());
                templateNode(node);
            }
            case BEFORE_VALUE -> {
                value = new ArrayList<>();
                state = State.UNQUOTED_VALUE;
                templateNode(node);
            }
            case QUOTED_VALUE -> value.add(block ? valueDirective((DirectiveNode) node, quote) : node);
            case UNQUOTED_VALUE -> value.add(block ? valueDirective((DirectiveNode) node, UNQUOTED_FORBIDDEN) : node);
        }
    }

    /**
     * Normalizes each branch of a block directive in content context and reconciles the tag
     * stacks the branches leave behind.
     */
    private void directive(DirectiveNode directive) {
        DirectiveEntry entry = context.registry().lookup(directive.name()).orElseThrow(
                () -> new IllegalStateException("Unregistered block directive " + directive.name()));
        List<Frame> entryStack = List.copyOf(stack);

        List<SequenceBuilder> builders = new ArrayList<>();
        for (Branch branch : directive.branches()) {
            SequenceBuilder builder = content(context, entryStack);
            builder.process(branch.children());
            builder.requireContent("the end of branch {% " + branch.keyword() + " %}", branch.span());
            builders.add(builder);
        }

        boolean mustBalance = entry.blockKind() == BlockKind.LOOP || entry.blockKind() == BlockKind.BLOCK;
        boolean emptyPath = entry.blockKind() == BlockKind.CONDITIONAL && !hasTerminalBranch(directive, entry);
        List<List<Frame>> paths = paths(builders, entryStack, emptyPath);
        if (mustBalance || !sameNames(paths)) {
            builders.forEach(SequenceBuilder::closeLeakedOptional);
            paths = paths(builders, entryStack, emptyPath);
        }

        if (mustBalance) {
            for (int i = 0; i < builders.size(); i++) {
                if (!identical(paths.get(i), entryStack)) {
                    Branch branch = directive.branches().get(i);
                    throw context.abort(CompilerErrorCode.UNBALANCED_BODY,
                            "Branch {% " + branch.keyword() + " %} of {% " + directive.name() + " %} must leave "
                                    + names(entryStack) + " open but leaves " + names(paths.get(i)) + ".",
                            branch.span());
                }
            }
        } else {
            for (int i = 1; i < paths.size(); i++) {
                if (!names(paths.get(i)).equals(names(paths.get(0)))) {
                    boolean implicit = i == builders.size();
                    SourceSpan span = implicit ? directive.span() : directive.branches().get(i).span();
                    String label = implicit ? "the path that renders no branch"
                            : "branch {% " + directive.branches().get(i).keyword() + " %}";
                    throw context.abort(CompilerErrorCode.DIVERGENT_BRANCHES,
                            "In {% " + directive.name() + " %} at " + directive.span() + ", " + label + " leaves "
                                    + names(paths.get(i)) + " open but branch {% " + directive.name() + " %} leaves "
                                    + names(paths.get(0)) + " open.", span);
                }
            }
        }

        int common = entryStack.size();
        for (List<Frame> path : paths) {
            common = Math.min(common, identicalPrefix(path, entryStack));
        }

        List<Branch> branches = new ArrayList<>();
        for (int i = 0; i < builders.size(); i++) {
            branches.add(directive.branches().get(i).withChildren(builders.get(i).finishBranch()));
        }

        for (int j = stack.size() - 1; j >= common; j--) {
            Frame frame = stack.remove(j);
            if (j >= baseDepth) {
                frame.flatten();
            } else {
                baseDepth = j;
            }
        }
        currentOutput().add(directive.withBranches(branches));

        List<Frame> first = paths.get(0);
        for (int j = common; j < first.size(); j++) {
            TagPair pair = first.get(j).pair();
            for (List<Frame> path : paths) {
                pair.union(path.get(j).pair());
            }
            stack.add(Frame.foreign(context, first.get(j), pair, currentOutput()));
        }
    }

    private DirectiveNode attributeDirective(DirectiveNode directive) {
        List<Branch> branches = new ArrayList<>();
        for (Branch branch : directive.branches()) {
            SequenceBuilder builder = attributes(context);
            builder.process(branch.children());
            branches.add(branch.withChildren(builder.finishAttributeBranch(branch)));
        }
        return directive.withBranches(branches);
    }

    private DirectiveNode valueDirective(DirectiveNode directive, String forbidden) {
        return directive.mapBranches(children -> valueParts(directive, children, forbidden));
    }

    private List<Node> valueParts(DirectiveNode directive, List<Node> children, String forbidden) {
        List<Node> parts = new ArrayList<>();
        for (Node child : children) {
            if (child instanceof TextNode t) {
                for (char c : forbidden.toCharArray()) {
                    if (t.text().indexOf(c) >= 0) {
                        throw context.abort(CompilerErrorCode.MALFORMED_TAG,
                                "Text in {% " + directive.name() + " %} inside an attribute value must not contain '"
                                        + c + "'.", t.span());
                    }
                }
                parts.add(t);
            } else if (child instanceof DirectiveNode d && d.block()) {
                parts.add(valueDirective(d, forbidden));
            } else {
                parts.add(child);
            }
        }
        return parts;
    }

    // endregion

    // region Tags

    private void finishStartTag(boolean selfClosing, int end) {
        SourceSpan span = new SourceSpan(tagSpan.fileName(), tagSpan.start(), absolute(end),
                tagSpan.line(), tagSpan.column());
        if (attributeMode) {
            throw context.abort(CompilerErrorCode.MALFORMED_TAG,
                    "Directive branches inside a start tag may contain attributes only.", span);
        }
        String name = HtmlElements.normalize(tagName);
        if (!context.parseAllTags(span.start())) {
            while (!stack.isEmpty() && HtmlElements.impliesEndOf(stack.get(stack.size() - 1).name, name)) {
                Frame top = stack.get(stack.size() - 1);
                popTop(null, top.span);
            }
        }
        boolean isVoid = HtmlElements.isVoid(name);
        if (isVoid || selfClosing) {
            currentOutput().add(new ElementNode(tagName, attributes, selfClosing, isVoid, List.of(), null, span));
            state = State.CONTENT;
        } else {
            stack.add(Frame.local(context, tagName, name, attributes, span, currentOutput()));
            if (HtmlElements.isRawText(name)) {
                rawTextTag = name;
                state = State.RAW_TEXT;
            } else {
                state = State.CONTENT;
            }
        }
        tagName = null;
        attributes = null;
    }

    private void finishAttribute(int end) {
        SourceSpan span = new SourceSpan(attributeSpan.fileName(), attributeSpan.start(), end,
                attributeSpan.line(), attributeSpan.column());
        String sep = value == null ? "" : separator.toString();
        attributes.add(new AttributeNode(attributeName.toString(), sep, value == null ? "" : quote, value, span));
        attributeName = null;
        value = null;
    }

    private void finishBooleanAttributeBeforeWhitespace(int end) {
        String whitespace = separator.toString();
        SourceSpan whitespaceSpan = separatorSpan;
        value = null;
        finishAttribute(end);
        state = State.ATTRIBUTES;
        if (!whitespace.isEmpty()) {
            addText(attributes, whitespace, whitespaceSpan);
        }
    }

    private void appendSeparator(String slice, SourceSpan span) {
        separator.append(slice);
        separatorSpan = separatorSpan == null ? span : separatorSpan.union(span);
    }

    private void endTag(int start, int end) {
        String name = HtmlElements.normalize(text.substring(start + 2, scanName(start + 2)));
        SourceSpan span = spanOf(start, end);
        String endText = text.substring(start, end);
        if (HtmlElements.isVoid(name)) {
            throw context.abort(CompilerErrorCode.UNMATCHED_END_TAG,
                    "End tag " + endText + " for void element <" + name + ">.", span);
        }
        int index = stack.size() - 1;
        while (index >= 0 && !stack.get(index).name.equals(name)) {
            index--;
        }
        if (index < 0) {
            throw context.abort(CompilerErrorCode.UNMATCHED_END_TAG,
                    "End tag " + endText + " has no matching start tag.", span);
        }
        boolean parseAll = context.parseAllTags(span.start());
        for (int j = stack.size() - 1; j > index; j--) {
            Frame open = stack.get(j);
            if (parseAll || !HtmlElements.hasOptionalEndTag(open.name)) {
                throw context.abort(CompilerErrorCode.UNCLOSED_ELEMENT,
                        "Element <" + open.name + "> opened at " + open.span + " is not closed before "
                                + endText + ".", open.span);
            }
            popTop(null, open.span);
        }
        popTop(endText, span);
    }

    /**
     * Pops the innermost open frame. Local elements become {@link ElementNode}s, frames opened
     * elsewhere emit an {@link EndTagNode} into the current output.
     */
    private void popTop(String endText, SourceSpan span) {
        int index = stack.size() - 1;
        Frame frame = stack.get(index);
        if (index >= baseDepth && frame.kind == Frame.Kind.LOCAL) {
            stack.remove(index);
            frame.parentOutput.add(frame.toElement(endText));
            return;
        }
        currentOutput().add(new EndTagNode(frame.tagName, endText, frame.pair(), span));
        stack.remove(index);
        if (index < baseDepth) {
            baseDepth = index;
        }
    }

    private int endTagEnd(int start) {
        int nameStart = start + 2;
        if (nameStart >= text.length() || !isNameStart(text.charAt(nameStart))) {
            return -1;
        }
        int k = text.indexOf('>', scanName(nameStart));
        return k < 0 ? -1 : k + 1;
    }

    // endregion

    // region Helpers

    private List<Node> currentOutput() {
        return stack.size() > baseDepth ? stack.get(stack.size() - 1).content : rootOutput;
    }

    private SourceSpan spanOf(int from, int to) {
        return textSpan.slice(text, from, to);
    }

    private int absolute(int index) {
        return textSpan.start() + index;
    }

    private int scanName(int from) {
        int i = from;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (!(Character.isLetterOrDigit(c) || c == '-' || c == ':' || c == '_' || c == '.')) break;
            i++;
        }
        return i;
    }

    private static boolean isNameStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    static void addText(List<Node> out, String text, SourceSpan span) {
        if (text.isEmpty()) {
            return;
        }
        if (!out.isEmpty() && out.get(out.size() - 1) instanceof TextNode last && last.span().end() == span.start()) {
            out.set(out.size() - 1, new TextNode(last.text() + text, last.span().union(span)));
        } else {
            out.add(new TextNode(text, span));
        }
    }

    private static boolean hasTerminalBranch(DirectiveNode directive, DirectiveEntry entry) {
        return directive.branches().stream().skip(1)
                .anyMatch(b -> entry.branch(b.keyword()).map(BranchKeyword::terminal).orElse(false));
    }

    private static List<List<Frame>> paths(List<SequenceBuilder> builders, List<Frame> entryStack, boolean emptyPath) {
        List<List<Frame>> paths = new ArrayList<>();
        builders.forEach(b -> paths.add(b.stack()));
        if (emptyPath) {
            paths.add(entryStack);
        }
        return paths;
    }

    private static boolean sameNames(List<List<Frame>> paths) {
        return paths.stream().map(SequenceBuilder::names).distinct().count() <= 1;
    }

    private static String names(List<Frame> frames) {
        return frames.isEmpty() ? "nothing" : frames.stream().map(Frame::toString).collect(Collectors.joining());
    }

    private static boolean identical(List<Frame> a, List<Frame> b) {
        return a.size() == b.size() && identicalPrefix(a, b) == a.size();
    }

    private static int identicalPrefix(List<Frame> a, List<Frame> b) {
        int i = 0;
        while (i < a.size() && i < b.size() && a.get(i) == b.get(i)) {
            i++;
        }
        return i;
    }

    // endregion
}
