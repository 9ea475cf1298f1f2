package org.pragmatica.callalign.lint.rules;

import com.github.javaparser.JavaToken;
import com.github.javaparser.Position;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.nodeTypes.NodeWithArguments;
import org.pragmatica.callalign.alignment.Argument;
import org.pragmatica.callalign.alignment.CallSite;
import org.pragmatica.callalign.alignment.Span;
import org.pragmatica.callalign.position.LineMap;
import org.pragmatica.callalign.position.SourcePosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Optional;

/**
 * Builds {@link CallSite} descriptors from JavaParser nodes.
 *
 * A lambda argument with a block body is treated as a closure literal; its body span covers the
 * block from the opening to the closing brace. The call span runs from the start of the call
 * expression to its closing parenthesis.
 */
public final class CallSiteExtractor {
    private static final Logger log = LoggerFactory.getLogger(CallSiteExtractor.class);

    private final LineMap lineMap;

    private CallSiteExtractor(LineMap lineMap) {
        this.lineMap = lineMap;
    }

    public static CallSiteExtractor callSiteExtractor(LineMap lineMap) {
        return new CallSiteExtractor(lineMap);
    }

    /**
     * Describe the call represented by the node.
     *
     * @return empty if the node takes no argument list or lacks source positions
     */
    public Optional<CallSite> extract(Node node) {
        if (!(node instanceof NodeWithArguments<?> call)) {
            return Optional.empty();
        }

        var expressions = call.getArguments();
        var arguments = new ArrayList<Argument>(expressions.size());

        for (var expression : expressions) {
            var argument = argument(expression);

            if (argument.isEmpty()) {
                log.debug("Argument without source position in {}, call skipped", node.getClass().getSimpleName());
                return Optional.empty();
            }
            arguments.add(argument.get());
        }

        return callSpan(node, expressions).map(span -> CallSite.callSite(span, arguments));
    }

    private Optional<Argument> argument(Expression expression) {
        return expression.getBegin()
                         .flatMap(this::offsetOf)
                         .map(offset -> closureBody(expression).map(body -> Argument.closureArgument(offset, body))
                                                               .orElseGet(() -> Argument.argument(offset)));
    }

    private Optional<Span> closureBody(Expression expression) {
        if (!expression.isLambdaExpr()) {
            return Optional.empty();
        }

        var body = expression.asLambdaExpr()
                             .getBody();

        return body.isBlockStmt()
               ? spanOf(body)
               : Optional.empty();
    }

    private Optional<Span> callSpan(Node node, NodeList<Expression> arguments) {
        var start = node.getBegin()
                        .flatMap(this::offsetOf);
        var end = closingParenthesis(arguments).or(() -> endOf(node));

        return start.flatMap(from -> end.filter(to -> to >= from)
                                        .map(to -> Span.span(from, to - from)));
    }

    private Optional<Integer> closingParenthesis(NodeList<Expression> arguments) {
        if (arguments.isEmpty()) {
            return Optional.empty();
        }

        return arguments.get(arguments.size() - 1)
                        .getTokenRange()
                        .map(TokenRange::getEnd)
                        .flatMap(CallSiteExtractor::nextSignificantToken)
                        .filter(token -> token.getText().equals(")"))
                        .flatMap(JavaToken::getRange)
                        .flatMap(range -> offsetOf(range.end))
                        .map(offset -> offset + 1);
    }

    private static Optional<JavaToken> nextSignificantToken(JavaToken token) {
        var next = token.getNextToken();

        while (next.isPresent() && next.get()
                                       .getCategory()
                                       .isWhitespaceOrComment()) {
            next = next.get()
                       .getNextToken();
        }
        return next;
    }

    private Optional<Span> spanOf(Node node) {
        return node.getBegin()
                   .flatMap(this::offsetOf)
                   .flatMap(from -> endOf(node).map(to -> Span.span(from, to - from)));
    }

    private Optional<Integer> endOf(Node node) {
        return node.getEnd()
                   .flatMap(this::offsetOf)
                   .map(offset -> offset + 1);
    }

    private Optional<Integer> offsetOf(Position position) {
        if (position.line < 1 || position.column < 1) {
            return Optional.empty();
        }
        return lineMap.offsetOf(SourcePosition.sourcePosition(position.line, position.column));
    }
}
