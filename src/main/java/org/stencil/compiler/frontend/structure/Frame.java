package org.stencil.compiler.frontend.structure;

import org.stencil.compiler.api.SourceSpan;
import org.stencil.compiler.frontend.parser.ast.ElementNode;
import org.stencil.compiler.frontend.parser.ast.Node;
import org.stencil.compiler.frontend.parser.ast.StartTagNode;
import org.stencil.compiler.frontend.parser.ast.TagPair;

import java.util.ArrayList;
import java.util.List;

/**
 * An open element on the tag stack. Frames are compared by identity: two frames with the same
 * tag name opened in different branches are different elements.
 */
final class Frame {

    enum Kind {
        /** Opened in the sequence that owns the frame; becomes an element or a start tag leaf. */
        LOCAL,
        /** Opened inside the branches of a preceding directive; only its end tag is emitted here. */
        FOREIGN
    }

    private final NormalizerContext context;
    final Kind kind;
    final String tagName;
    final String name;
    final List<Node> attributes;
    final SourceSpan span;
    final List<Node> content;
    final List<Node> parentOutput;
    private TagPair pair;

    private Frame(NormalizerContext context, Kind kind, String tagName, String name, List<Node> attributes,
                  SourceSpan span, List<Node> content, List<Node> parentOutput, TagPair pair) {
        this.context = context;
        this.kind = kind;
        this.tagName = tagName;
        this.name = name;
        this.attributes = attributes;
        this.span = span;
        this.content = content;
        this.parentOutput = parentOutput;
        this.pair = pair;
    }

    static Frame local(NormalizerContext context, String tagName, String name, List<Node> attributes,
                       SourceSpan span, List<Node> parentOutput) {
        return new Frame(context, Kind.LOCAL, tagName, name, attributes, span, new ArrayList<>(), parentOutput, null);
    }

    static Frame foreign(NormalizerContext context, Frame template, TagPair pair, List<Node> output) {
        return new Frame(context, Kind.FOREIGN, template.tagName, template.name, List.of(), template.span,
                output, output, pair);
    }

    TagPair pair() {
        if (pair == null) {
            pair = context.newPair();
        }
        return pair;
    }

    ElementNode toElement(String endTag) {
        return new ElementNode(tagName, attributes, false, false, content, endTag, span);
    }

    /**
     * Turns a local frame that stays open at the end of its sequence into a start tag leaf
     * followed by its content.
     */
    void flatten() {
        if (kind == Kind.LOCAL) {
            parentOutput.add(new StartTagNode(tagName, attributes, pair(), span));
            parentOutput.addAll(content);
        }
    }

    @Override
    public String toString() {
        return "<" + name + ">";
    }
}
