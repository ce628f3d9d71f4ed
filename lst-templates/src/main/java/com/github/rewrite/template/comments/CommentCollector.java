package com.github.rewrite.template.comments;

import com.github.rewrite.template.config.TemplateConfiguration;
import org.openrewrite.PrintOutputCapture;
import org.openrewrite.java.JavaPrinter;
import org.openrewrite.java.tree.Comment;
import org.openrewrite.java.tree.J;
import org.openrewrite.java.tree.Space;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Collects comments matching a regular expression together with the line they apply to.
 * <p>
 * Useful for special-purpose comments such as {@code // NOSONAR} or {@code // lint:ignore}
 * suppressions. The expression is matched against the printed comment, delimiters included,
 * and must match at its start.
 * <p>
 * A standalone comment (only whitespace before it on its line) applies to the line following
 * it; an inline comment applies to its own line:
 * <pre>
 * // TAG: a          line 4, recorded for line 5
 * foo();             line 5
 * bar(); // TAG: b   line 6, recorded for line 6
 * </pre>
 * When several matching comments apply to the same line, the {@link DuplicateCommentPolicy}
 * decides which one is kept.
 */
public class CommentCollector {

    private final Pattern pattern;
    private final DuplicateCommentPolicy duplicatePolicy;

    public CommentCollector(String regex) {
        this(Pattern.compile(regex), DuplicateCommentPolicy.LAST_WINS);
    }

    /**
     * Uses the duplicate policy configured in lst-templates.yaml.
     */
    public CommentCollector(Pattern pattern, TemplateConfiguration configuration) {
        this(pattern, configuration.getDuplicateCommentPolicy());
    }

    public CommentCollector(Pattern pattern, DuplicateCommentPolicy duplicatePolicy) {
        this.pattern = pattern;
        this.duplicatePolicy = duplicatePolicy;
    }

    public static Map<Integer, Comment> scan(J tree, String regex) {
        return new CommentCollector(regex).collect(tree);
    }

    /**
     * @param tree usually a compilation unit; for any other tree, line 1 is the line its prefix
     *             starts on
     * @return matching comments keyed by the 1-based line they apply to, in line order
     */
    public Map<Integer, Comment> collect(J tree) {
        Map<Integer, Comment> comments = new TreeMap<>();
        LineTrackingOutput output = new LineTrackingOutput();
        new LineTrackingPrinter(output, (comment, text, line, standalone) -> {
            if (!pattern.matcher(text).lookingAt()) {
                return;
            }
            int effectiveLine = standalone ? line + 1 : line;
            if (duplicatePolicy == DuplicateCommentPolicy.FIRST_WINS) {
                comments.putIfAbsent(effectiveLine, comment);
            } else {
                comments.put(effectiveLine, comment);
            }
        }).visit(tree, output);
        return Collections.unmodifiableMap(comments);
    }

    interface CommentPositionListener {
        void onComment(Comment comment, String text, int line, boolean standalone);
    }

    /**
     * Print output that keeps the current line number and whether the current line holds
     * anything but whitespace, updated as text is appended.
     */
    static class LineTrackingOutput extends PrintOutputCapture<Integer> {

        private int line = 1;
        private boolean blankLine = true;

        LineTrackingOutput() {
            super(0);
        }

        @Override
        public PrintOutputCapture<Integer> append(String text) {
            if (text != null) {
                for (int i = 0; i < text.length(); i++) {
                    track(text.charAt(i));
                }
            }
            return super.append(text);
        }

        @Override
        public PrintOutputCapture<Integer> append(char c) {
            track(c);
            return super.append(c);
        }

        private void track(char c) {
            if (c == '\n') {
                line++;
                blankLine = true;
            } else if (!Character.isWhitespace(c)) {
                blankLine = false;
            }
        }

        int getLine() {
            return line;
        }

        boolean isBlankLine() {
            return blankLine;
        }
    }

    /**
     * Prints the tree and reports the source line of every comment as it is printed.
     */
    static class LineTrackingPrinter extends JavaPrinter<Integer> {

        private final LineTrackingOutput output;
        private final CommentPositionListener listener;

        LineTrackingPrinter(LineTrackingOutput output, CommentPositionListener listener) {
            this.output = output;
            this.listener = listener;
        }

        @Override
        public Space visitSpace(Space space, Space.Location loc, PrintOutputCapture<Integer> p) {
            p.append(space.getWhitespace());
            for (Comment comment : space.getComments()) {
                visitMarkers(comment.getMarkers(), p);

                PrintOutputCapture<Integer> text = new PrintOutputCapture<>(p.getContext());
                comment.printComment(getCursor(), text);
                listener.onComment(comment, text.getOut(), output.getLine(), output.isBlankLine());

                p.append(text.getOut());
                p.append(comment.getSuffix());
            }
            return space;
        }
    }
}
