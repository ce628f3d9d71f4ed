package com.github.rewrite.template.comments;

import com.github.rewrite.template.config.TemplateConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.openrewrite.java.JavaParser;
import org.openrewrite.java.tree.Comment;
import org.openrewrite.java.tree.J;
import org.openrewrite.java.tree.TextComment;

import java.util.Map;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

class CommentCollectorTest {

    private static J.CompilationUnit parse(String source) {
        return (J.CompilationUnit) JavaParser.fromJavaVersion().build().parse(source).toList().get(0);
    }

    private static String text(Comment comment) {
        return ((TextComment) comment).getText().trim();
    }

    @Nested
    @DisplayName("Line attribution")
    class LineAttribution {

        @Test
        void inlineCommentAppliesToItsOwnLine() {
            J.CompilationUnit cu = parse("""
                    class A {
                        void m() {
                            run(); // TAG: inline
                        }
                        void run() {}
                    }
                    """);

            Map<Integer, Comment> comments = CommentCollector.scan(cu, "// TAG");

            assertThat(comments).containsOnlyKeys(3);
            assertThat(text(comments.get(3))).isEqualTo("TAG: inline");
        }

        @Test
        void standaloneCommentAppliesToNextLine() {
            J.CompilationUnit cu = parse("""
                    class A {
                        void m() {
                            run();
                            // TAG: standalone
                            run();
                        }
                        void run() {}
                    }
                    """);

            Map<Integer, Comment> comments = CommentCollector.scan(cu, "// TAG");

            assertThat(comments).containsOnlyKeys(5);
            assertThat(text(comments.get(5))).isEqualTo("TAG: standalone");
        }

        @Test
        void commentAtStartOfFileAppliesToLineTwo() {
            J.CompilationUnit cu = parse("""
                    // TAG: header
                    class A {
                    }
                    """);

            assertThat(CommentCollector.scan(cu, "// TAG")).containsOnlyKeys(2);
        }

        @Test
        void linesStayAccurateAfterMultiLineCommentsAndStrings() {
            J.CompilationUnit cu = parse("""
                    class A {
                        /*
                         * not tagged
                         */
                        String s = \"""
                            one
                            two
                            \""";
                        int a; // TAG: nine
                        /** docs
                         */
                        // TAG: thirteen
                        int b;
                    }
                    """);

            assertThat(CommentCollector.scan(cu, "// TAG").keySet()).containsExactly(9, 13);
        }

        @Test
        void blockCommentsAreAttributedByTheirStartLine() {
            J.CompilationUnit cu = parse("""
                    class A {
                        /* TAG: block
                           spans lines */
                        int a;
                        int b; /* TAG: tail */
                    }
                    """);

            Map<Integer, Comment> comments = CommentCollector.scan(cu, "/\\* TAG");

            assertThat(comments).containsOnlyKeys(3, 5);
        }
    }

    @Nested
    @DisplayName("Matching")
    class Matching {

        @Test
        void nonMatchingCommentsAreIgnored() {
            J.CompilationUnit cu = parse("""
                    class A {
                        int a; // unrelated
                        int b; // TAG: kept
                        // prefix TAG: not at start
                        int c;
                    }
                    """);

            Map<Integer, Comment> comments = CommentCollector.scan(cu, "// TAG");

            assertThat(comments).containsOnlyKeys(3);
        }

        @Test
        void treeWithoutCommentsYieldsEmptyMap() {
            assertThat(CommentCollector.scan(parse("class A { int a; }"), "//")).isEmpty();
        }

        @Test
        void resultIsOrderedByLine() {
            J.CompilationUnit cu = parse("""
                    class A {
                        int a; // TAG: 2
                        int b;
                        int c; // TAG: 4
                        // TAG: 6
                        int d;
                    }
                    """);

            assertThat(CommentCollector.scan(cu, "// TAG").keySet()).containsExactly(2, 4, 6);
        }
    }

    @Nested
    @DisplayName("Duplicate policy")
    class DuplicatePolicy {

        private final String source = """
                class A {
                    // TAG: first
                    int a; // TAG: second
                }
                """;

        @Test
        void lastCommentWinsByDefault() {
            Map<Integer, Comment> comments = CommentCollector.scan(parse(source), "// TAG");

            assertThat(comments).containsOnlyKeys(3);
            assertThat(text(comments.get(3))).isEqualTo("TAG: second");
        }

        @Test
        void firstCommentWinsWhenConfigured() {
            Map<Integer, Comment> comments = new CommentCollector(Pattern.compile("// TAG"),
                    DuplicateCommentPolicy.FIRST_WINS).collect(parse(source));

            assertThat(comments).containsOnlyKeys(3);
            assertThat(text(comments.get(3))).isEqualTo("TAG: first");
        }

        @Test
        void policyComesFromConfiguration() {
            TemplateConfiguration configuration = TemplateConfiguration.defaults()
                    .withDuplicateCommentPolicy(DuplicateCommentPolicy.FIRST_WINS);

            Map<Integer, Comment> comments = new CommentCollector(Pattern.compile("// TAG"), configuration)
                    .collect(parse(source));

            assertThat(text(comments.get(3))).isEqualTo("TAG: first");
            assertThat(text(new CommentCollector(Pattern.compile("// TAG"), TemplateConfiguration.defaults())
                    .collect(parse(source)).get(3))).isEqualTo("TAG: second");
        }

        @Test
        void policyNamesParseFromConfigurationValues() {
            assertThat(DuplicateCommentPolicy.fromString("first-wins")).isEqualTo(DuplicateCommentPolicy.FIRST_WINS);
            assertThat(DuplicateCommentPolicy.fromString(" LAST_WINS ")).isEqualTo(DuplicateCommentPolicy.LAST_WINS);
            assertThat(DuplicateCommentPolicy.fromString("newest")).isNull();
            assertThat(DuplicateCommentPolicy.fromString(null)).isNull();
        }
    }
}
