package org.pragmatica.callalign.lint.rules;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.nodeTypes.NodeWithArguments;
import org.pragmatica.callalign.alignment.AlignmentChecker;
import org.pragmatica.callalign.alignment.CallSite;
import org.pragmatica.callalign.lint.Diagnostic;
import org.pragmatica.callalign.lint.LintContext;
import org.pragmatica.callalign.position.LineMap;
import org.pragmatica.callalign.position.SourcePosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Stream;

/**
 * ALIGN-CALL-01: Arguments of a multi-line call are aligned vertically.
 *
 * Every argument that starts a new line must start at the column of the first argument. After a
 * lambda whose block body spans several lines, the next argument starting a line sets the column
 * for the rest of the call.
 *
 * Opt-in rule.
 */
public class VerticalParameterAlignmentOnCallRule implements LintRule {
    private static final Logger log = LoggerFactory.getLogger(VerticalParameterAlignmentOnCallRule.class);

    private static final String RULE_ID = "ALIGN-CALL-01";

    private static final RuleDescription DESCRIPTION = new RuleDescription(
            RULE_ID,
            "Vertical Parameter Alignment On Call",
            "Method arguments should be aligned vertically if they're in multiple lines in a call",
            List.of(
                    "foo(param1, param2,\n" +
                    "    param3, param4);",
                    "foo(param1, param2);",
                    "foo(param1, param2,\n" +
                    "    param3,\n" +
                    "    param4);",
                    "executor.submit(() -> {\n" +
                    "    work();\n" +
                    "}, timeout);",
                    "animate(duration, () -> {\n" +
                    "    fade();\n" +
                    "}, completion -> {\n" +
                    "    hide();\n" +
                    "});",
                    "animate(duration, () -> {\n" +
                    "    fade();\n" +
                    "},\n" +
                    "completion -> {\n" +
                    "    hide();\n" +
                    "});",
                    "foo(param1, () -> { },\n" +
                    "    param3, param4);",
                    "foo(() -> {\n" +
                    "       bar();\n" +
                    "   },\n" +
                    "   completion -> {\n" +
                    "       baz();\n" +
                    "   }\n" +
                    ");",
                    "foo(bar(first,\n" +
                    "        second),\n" +
                    "    third);",
                    "new Point(x,\n" +
                    "          y);"
            ),
            List.of(
                    "foo(param1, param2,\n" +
                    "                ↓param3, param4);",
                    "foo(param1, param2,\n" +
                    " ↓param3, param4);",
                    "foo(param1, param2,\n" +
                    "       ↓param3,\n" +
                    "       ↓param4);",
                    "foo(param1,\n" +
                    "       ↓() -> { });",
                    "foo(param1,\n" +
                    "    () -> {\n" +
                    "}, param3,\n" +
                    " ↓param4);",
                    "foo(param1, () -> { },\n" +
                    "       ↓param3, param4);",
                    "new Point(x,\n" +
                    "    ↓y);"
            )
    );

    @Override
    public RuleDescription describe() {
        return DESCRIPTION;
    }

    @Override
    public boolean optIn() {
        return true;
    }

    @Override
    public Stream<Diagnostic> analyze(CompilationUnit cu, String source, LintContext ctx) {
        var packageName = cu.getPackageDeclaration()
                .map(pd -> pd.getNameAsString())
                .orElse("");

        if (!ctx.shouldLint(packageName)) {
            return Stream.empty();
        }

        var lineMap = LineMap.lineMap(source);
        var extractor = CallSiteExtractor.callSiteExtractor(lineMap);
        var checker = AlignmentChecker.alignmentChecker(source, lineMap);

        return cu.findAll(Node.class, node -> node instanceof NodeWithArguments)
                .stream()
                .flatMap(node -> extractor.extract(node).stream())
                .flatMap(call -> misalignedArguments(call, checker, lineMap))
                .map(position -> createDiagnostic(position, ctx));
    }

    private Stream<SourcePosition> misalignedArguments(CallSite call, AlignmentChecker checker, LineMap lineMap) {
        var flagged = checker.check(call);

        if (!flagged.isEmpty()) {
            log.debug("Call at offset {} has {} misaligned argument(s)", call.span().offset(), flagged.size());
        }

        return flagged.stream()
                .flatMap(offset -> lineMap.resolve(offset).stream());
    }

    private Diagnostic createDiagnostic(SourcePosition position, LintContext ctx) {
        return Diagnostic.diagnostic(
                RULE_ID,
                ctx.severityFor(RULE_ID),
                ctx.fileName(),
                position.line(),
                position.column(),
                "Argument is not vertically aligned with the first argument of the call",
                "Arguments of a call that spans several lines should start at the column of the first " +
                        "argument, unless they follow a multi-line lambda."
        ).withExample("""
                // Before
                return Result.all(Email.email(raw.email()),
                    Password.password(raw.password()));

                // After
                return Result.all(Email.email(raw.email()),
                                  Password.password(raw.password()));
                """);
    }
}
