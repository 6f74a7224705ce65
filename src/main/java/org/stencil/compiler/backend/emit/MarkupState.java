package org.stencil.compiler.backend.emit;

import org.stencil.compiler.frontend.parser.ast.HtmlElements;

/**
 * Tracks the HTML tokenizer state of generated text, so that debug markers are only written
 * where a comment is allowed. Scanning is incremental: {@link #advance} continues where the
 * previous call stopped.
 */
final class MarkupState {

    private enum State { CONTENT, TAG, DOUBLE_QUOTED, SINGLE_QUOTED, COMMENT, RAW_TEXT }

    private State state = State.CONTENT;
    private int position;
    private int tagStart;
    private String rawTextElement;

    /**
     * Scans {@code text} from the last scanned position to its end. A trailing {@code <} whose
     * meaning depends on the next character stays unscanned until more text arrives.
     *
     * @param text The text, which only ever grows between calls.
     */
    void advance(CharSequence text) {
        int length = text.length();
        while (position < length) {
            char c = text.charAt(position);
            switch (state) {
                case CONTENT:
                    if (c == '<') {
                        if (position + 1 >= length) {
                            return;
                        }
                        if (startsWith(text, position, "<!--")) {
                            state = State.COMMENT;
                            position += 4;
                            continue;
                        }
                        if (isCommentPrefix(text, position)) {
                            return;
                        }
                        char next = text.charAt(position + 1);
                        if (Character.isLetter(next) || next == '/' || next == '!' || next == '?') {
                            state = State.TAG;
                            tagStart = position;
                        }
                    }
                    break;
                case TAG:
                    if (c == '"') {
                        state = State.DOUBLE_QUOTED;
                    } else if (c == '\'') {
                        state = State.SINGLE_QUOTED;
                    } else if (c == '>') {
                        String name = tagName(text, tagStart + 1, position);
                        if (HtmlElements.isRawText(name)) {
                            state = State.RAW_TEXT;
                            rawTextElement = name;
                        } else {
                            state = State.CONTENT;
                        }
                    }
                    break;
                case DOUBLE_QUOTED:
                    if (c == '"') {
                        state = State.TAG;
                    }
                    break;
                case SINGLE_QUOTED:
                    if (c == '\'') {
                        state = State.TAG;
                    }
                    break;
                case COMMENT:
                    if (startsWith(text, position, "-->")) {
                        state = State.CONTENT;
                        position += 3;
                        continue;
                    }
                    break;
                case RAW_TEXT:
                    if (c == '<') {
                        String closing = "</" + rawTextElement;
                        if (position + closing.length() > length) {
                            return;
                        }
                        if (text.subSequence(position, position + closing.length()).toString().equalsIgnoreCase(closing)) {
                            state = State.TAG;
                            tagStart = position;
                        }
                    }
                    break;
                default:
                    throw new IllegalStateException("Unknown markup state " + state);
            }
            position++;
        }
    }

    /**
     * @return {@code true} if everything scanned so far ends between tags and comments.
     */
    boolean inContent(CharSequence text) {
        advance(text);
        return state == State.CONTENT && position == text.length();
    }

    /**
     * @param fragment Generated text.
     * @return {@code true} if the fragment, starting between tags, also ends between tags.
     */
    static boolean balanced(String fragment) {
        return new MarkupState().inContent(fragment);
    }

    private static boolean startsWith(CharSequence text, int at, String prefix) {
        if (at + prefix.length() > text.length()) {
            return false;
        }
        for (int i = 0; i < prefix.length(); i++) {
            if (text.charAt(at + i) != prefix.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    private static String tagName(CharSequence text, int from, int to) {
        int end = from;
        while (end < to && (Character.isLetterOrDigit(text.charAt(end)) || text.charAt(end) == '-')) {
            end++;
        }
        return HtmlElements.normalize(text.subSequence(from, end).toString());
    }

    // "<", "<!" or "<!-" at the very end may still become a comment opener.
    private static boolean isCommentPrefix(CharSequence text, int at) {
        int available = text.length() - at;
        return available < 4 && "<!--".startsWith(text.subSequence(at, text.length()).toString());
    }
}
