package com.github.rewrite.template;

import com.github.rewrite.template.config.TemplateParserConfig;
import org.openrewrite.ExecutionContext;
import org.openrewrite.InMemoryExecutionContext;
import org.openrewrite.ParseExceptionResult;
import org.openrewrite.SourceFile;
import org.openrewrite.java.JavaVisitor;
import org.openrewrite.java.tree.Expression;
import org.openrewrite.java.tree.J;
import org.openrewrite.java.tree.Space;
import org.openrewrite.java.tree.Statement;
import org.openrewrite.tree.ParseError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Builds LST fragments from Java source templates whose placeholders are bound to existing trees.
 * <p>
 * A placeholder is written {@code {name}} and is bound through the replacement map to an
 * {@link Expression}. The bound node is inserted into the parsed template as if the parser had
 * produced it in place, so structured values never have to be printed back to source text and
 * re-parsed with the right escaping and precedence:
 * <pre>
 * Expression call = LstTemplates.expression("{target}.close()", Map.of("target", field)).orElseThrow();
 * Statement check = LstTemplates.statement("Objects.requireNonNull({arg}, {message});",
 *         Map.of("arg", param, "message", literal)).orElseThrow();
 * </pre>
 * Every render call mangles the placeholders, parses the result with a parser of its own,
 * substitutes the bound nodes and finally proves that no placeholder is left. A failure at any
 * stage aborts the call with a {@link TemplateError}; there is no partial result.
 * <p>
 * Calls share no mutable state and may run concurrently.
 */
public final class LstTemplates {

    private static final Logger log = LoggerFactory.getLogger(LstTemplates.class);

    private static final String WRAPPER_CLASS = "__LstTemplate__";
    private static final String WRAPPER_METHOD = "__template__";
    private static final String WRAPPER_FIELD = "__value__";

    private LstTemplates() {
    }

    /**
     * Renders a complete compilation unit. Leading and trailing whitespace of the template is
     * kept in the resulting tree.
     */
    public static TemplateResult<J.CompilationUnit> compilationUnit(String template,
                                                                    Map<String, ? extends J> replacements) {
        return compilationUnit(template, TemplateParserConfig.defaults(), replacements);
    }

    public static TemplateResult<J.CompilationUnit> compilationUnit(String template,
                                                                    TemplateParserConfig config,
                                                                    Map<String, ? extends J> replacements) {
        return render("compilation unit", template, config, replacements, J.CompilationUnit.class,
                source -> source,
                cu -> cu);
    }

    /**
     * Renders a single statement, e.g. {@code "assert {x} > 0 : {message};"}. A trailing line
     * terminator is added when the template has none, so a trailing line comment cannot swallow
     * the rest of the parsed source.
     */
    public static TemplateResult<Statement> statement(String template,
                                                      Map<String, ? extends J> replacements) {
        return statement(template, TemplateParserConfig.defaults(), replacements);
    }

    public static TemplateResult<Statement> statement(String template,
                                                      TemplateParserConfig config,
                                                      Map<String, ? extends J> replacements) {
        String terminated = template.endsWith("\n") ? template : template + "\n";
        return render("statement", terminated, config, replacements, Statement.class,
                source -> "class " + WRAPPER_CLASS + " {\n" +
                          "    void " + WRAPPER_METHOD + "() {" + source +
                          "    }\n" +
                          "}\n",
                LstTemplates::extractStatement);
    }

    /**
     * Renders a single expression, e.g. {@code "x + {y}"}. The template must be one line without
     * leading or trailing whitespace because an expression has nowhere to keep it.
     */
    public static TemplateResult<Expression> expression(String template,
                                                        Map<String, ? extends J> replacements) {
        return expression(template, TemplateParserConfig.defaults(), replacements);
    }

    public static TemplateResult<Expression> expression(String template,
                                                        TemplateParserConfig config,
                                                        Map<String, ? extends J> replacements) {
        return render("expression", template, config, replacements, Expression.class,
                source -> {
                    if (source.isEmpty() || source.contains("\n") || source.contains("\r") ||
                        !source.equals(source.strip())) {
                        throw parseFailure("Expression templates must be a single line without leading " +
                                           "or trailing whitespace");
                    }
                    return "class " + WRAPPER_CLASS + " {\n" +
                           "    Object " + WRAPPER_FIELD + " = " + source + "\n" +
                           "    ;\n" +
                           "}\n";
                },
                LstTemplates::extractExpression);
    }

    private static <T> TemplateResult<T> render(String description,
                                                String template,
                                                TemplateParserConfig config,
                                                Map<String, ? extends J> replacements,
                                                Class<T> resultType,
                                                Function<String, String> wrap,
                                                Function<J.CompilationUnit, J> unwrap) {
        Set<String> variables = replacements.keySet();
        log.debug("Rendering {} template with variables {}", description, variables);
        try {
            String mangled = TemplateSentinels.mangle(template, variables);
            PlaceholderSubstitution substitution = new PlaceholderSubstitution(replacements);

            ExecutionContext ctx = new InMemoryExecutionContext(
                    t -> log.debug("Parser reported an error while parsing a {} template", description, t));
            J parsed = unwrap.apply(parse(wrap.apply(mangled), config, ctx));

            J substituted = substitution.visitNonNull(parsed, ctx);
            T result = requireResultType(substituted, resultType, description);
            new TemplateCompletenessChecker(variables).check(substituted, ctx);
            return TemplateResult.success(result);
        } catch (TemplateException e) {
            log.debug("Rendering {} template failed: {}", description, e.getError());
            return TemplateResult.failure(e.getError());
        }
    }

    /**
     * Guards the promise of each entry point. The wrappers only ever hand over a compilation unit,
     * a method body statement or a field initializer, and substitution only puts expressions into
     * expression slots, so a mismatch means the extraction itself is broken.
     */
    static <T> T requireResultType(J tree, Class<T> resultType, String description) {
        if (!resultType.isInstance(tree)) {
            throw new TemplateException(TemplateError.of(TemplateError.Kind.RESULT_TYPE_MISMATCH,
                    "Expected a " + description + " but got a " + NodeKind.describe(tree) + "!"));
        }
        return resultType.cast(tree);
    }

    private static J.CompilationUnit parse(String source, TemplateParserConfig config, ExecutionContext ctx) {
        List<SourceFile> parsed = config.newParser().parse(ctx, source).toList();
        if (parsed.size() != 1) {
            throw parseFailure("Expected one source file but the parser produced " + parsed.size());
        }
        SourceFile sourceFile = parsed.get(0);
        if (sourceFile instanceof ParseError) {
            String message = sourceFile.getMarkers().findFirst(ParseExceptionResult.class)
                    .map(ParseExceptionResult::getMessage)
                    .orElse("unknown parse error");
            throw parseFailure("Template does not parse: " + message);
        }
        if (!(sourceFile instanceof J.CompilationUnit)) {
            throw parseFailure("Expected a Java compilation unit but the parser produced a " +
                               sourceFile.getClass().getSimpleName());
        }
        J.CompilationUnit cu = (J.CompilationUnit) sourceFile;

        List<J.Erroneous> erroneous = new ArrayList<>();
        new JavaVisitor<List<J.Erroneous>>() {
            @Override
            public J visitErroneous(J.Erroneous e, List<J.Erroneous> found) {
                found.add(e);
                return e;
            }
        }.visit(cu, erroneous);
        if (!erroneous.isEmpty()) {
            throw parseFailure("Template does not parse: the parser recovered from " + erroneous.size() +
                               " syntax error(s)");
        }
        return cu;
    }

    private static J extractStatement(J.CompilationUnit cu) {
        J.MethodDeclaration method = singleMember(cu, J.MethodDeclaration.class);
        if (method.getBody() == null || method.getBody().getStatements().size() != 1) {
            throw parseFailure("Expected exactly one statement but found " +
                               (method.getBody() == null ? 0 : method.getBody().getStatements().size()));
        }
        return method.getBody().getStatements().get(0);
    }

    private static J extractExpression(J.CompilationUnit cu) {
        J.VariableDeclarations field = singleMember(cu, J.VariableDeclarations.class);
        if (field.getVariables().size() != 1 || field.getVariables().get(0).getInitializer() == null) {
            throw parseFailure("Expected exactly one expression");
        }
        //noinspection DataFlowIssue
        return field.getVariables().get(0).getInitializer().withPrefix(Space.EMPTY);
    }

    private static <T extends Statement> T singleMember(J.CompilationUnit cu, Class<T> memberType) {
        if (cu.getClasses().size() != 1) {
            throw parseFailure("Expected exactly one " + memberType.getSimpleName() + " but the template " +
                               "declares additional types");
        }
        List<Statement> members = cu.getClasses().get(0).getBody().getStatements();
        if (members.size() != 1 || !memberType.isInstance(members.get(0))) {
            throw parseFailure("Template does not parse as a single " + memberType.getSimpleName());
        }
        return memberType.cast(members.get(0));
    }

    private static TemplateException parseFailure(String message) {
        return new TemplateException(TemplateError.of(TemplateError.Kind.PARSE_FAILURE, message));
    }
}
