package com.vidnyan.eqlint.adapter.out.rule.unicorn;

import com.vidnyan.eqlint.domain.ast.*;
import com.vidnyan.eqlint.domain.rule.Diagnostic;
import com.vidnyan.eqlint.domain.rule.RuleDefinition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class NegationInEqualityDetectorTest {

    private final NegationInEqualityDetector detector = new NegationInEqualityDetector();

    private static AstNode identifier(String name, int start) {
        return OtherNode.leaf("NAME", new Span(start, start + name.length()));
    }

    private static UnaryExpression not(AstNode argument) {
        return new UnaryExpression(UnaryOperator.LOGICAL_NOT, argument,
                new Span(argument.span().start() - 1, argument.span().end()));
    }

    /**
     * Builds {@code <left> <op> bar} with the operator one space after the left operand.
     */
    private static BinaryExpression compare(AstNode left, BinaryOperator operator) {
        int rightStart = left.span().end() + operator.symbol().length() + 2;
        AstNode right = identifier("bar", rightStart);
        return new BinaryExpression(operator, left, right, new Span(left.span().start(), right.span().end()));
    }

    @Test
    void negatedStrictEquality_SuggestsStrictInequality() {
        BinaryExpression node = compare(not(identifier("foo", 1)), BinaryOperator.STRICT_EQUALITY);

        Optional<Diagnostic> result = detector.check(node);

        assertTrue(result.isPresent());
        assertEquals("!==", result.get().getContext(NegationInEqualityDetector.SUGGESTED_OPERATOR, String.class));
        assertEquals("Remove the negation operator and use '!==' instead.", result.get().help());
    }

    @Test
    void negatedStrictInequality_SuggestsStrictEquality() {
        BinaryExpression node = compare(not(identifier("foo", 1)), BinaryOperator.STRICT_INEQUALITY);

        assertEquals("===", detector.check(node).orElseThrow()
                .getContext(NegationInEqualityDetector.SUGGESTED_OPERATOR, String.class));
    }

    @Test
    void negatedLooseEquality_SuggestsLooseInequality() {
        BinaryExpression node = compare(not(identifier("foo", 1)), BinaryOperator.EQUALITY);

        assertEquals("!=", detector.check(node).orElseThrow()
                .getContext(NegationInEqualityDetector.SUGGESTED_OPERATOR, String.class));
    }

    @Test
    void negatedLooseInequality_SuggestsLooseEquality() {
        BinaryExpression node = compare(not(identifier("foo", 1)), BinaryOperator.INEQUALITY);

        assertEquals("==", detector.check(node).orElseThrow()
                .getContext(NegationInEqualityDetector.SUGGESTED_OPERATOR, String.class));
    }

    @Test
    void diagnostic_CoversWholeComparisonAsWarning() {
        BinaryExpression node = compare(not(identifier("foo", 1)), BinaryOperator.STRICT_EQUALITY);

        Diagnostic diagnostic = detector.check(node).orElseThrow();

        assertEquals(node.span(), diagnostic.span());
        assertEquals(new Span(0, 12), diagnostic.span());
        assertEquals(RuleDefinition.Severity.WARN, diagnostic.severity());
        assertEquals(NegationInEqualityDetector.MESSAGE, diagnostic.message());
    }

    @Test
    void doubleNegation_IsNotReported() {
        BinaryExpression node = compare(not(not(identifier("foo", 2))), BinaryOperator.STRICT_EQUALITY);

        assertTrue(detector.check(node).isEmpty());
    }

    @Test
    void tripleNegation_IsNotReported() {
        BinaryExpression node = compare(not(not(not(identifier("foo", 3)))), BinaryOperator.STRICT_EQUALITY);

        assertTrue(detector.check(node).isEmpty());
    }

    @Test
    void unaryPlus_IsNotReported() {
        AstNode plus = new UnaryExpression(UnaryOperator.UNARY_PLUS, identifier("foo", 1), new Span(0, 4));

        assertTrue(detector.check(compare(plus, BinaryOperator.STRICT_EQUALITY)).isEmpty());
    }

    @Test
    void negationOfNonNotUnary_IsReported() {
        // !-foo === bar: only one logical negation
        AstNode minus = new UnaryExpression(UnaryOperator.UNARY_NEGATION, identifier("foo", 2), new Span(1, 5));

        assertTrue(detector.check(compare(not(minus), BinaryOperator.STRICT_EQUALITY)).isPresent());
    }

    @Test
    void plainLeftOperand_IsNotReported() {
        assertTrue(detector.check(compare(identifier("foo", 0), BinaryOperator.STRICT_EQUALITY)).isEmpty());
    }

    @Test
    void negationOnRight_IsNotReported() {
        // foo === !bar
        AstNode left = identifier("foo", 0);
        AstNode right = not(identifier("bar", 9));
        BinaryExpression node = new BinaryExpression(BinaryOperator.STRICT_EQUALITY, left, right, new Span(0, 12));

        assertTrue(detector.check(node).isEmpty());
    }

    @ParameterizedTest
    @EnumSource(value = BinaryOperator.class, mode = EnumSource.Mode.EXCLUDE,
            names = {"EQUALITY", "INEQUALITY", "STRICT_EQUALITY", "STRICT_INEQUALITY"})
    void nonEqualityOperators_AreNotReported(BinaryOperator operator) {
        BinaryExpression node = compare(not(identifier("foo", 1)), operator);

        assertTrue(detector.check(node).isEmpty(), "operator " + operator);
    }

    @Test
    void repeatedChecks_GiveIdenticalResults() {
        BinaryExpression node = compare(not(identifier("foo", 1)), BinaryOperator.STRICT_EQUALITY);

        assertEquals(detector.check(node), detector.check(node));
    }

    @Test
    void concurrentChecks_GiveIdenticalResults() throws Exception {
        BinaryExpression node = compare(not(identifier("foo", 1)), BinaryOperator.EQUALITY);
        Optional<Diagnostic> expected = detector.check(node);

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Callable<Optional<Diagnostic>>> tasks = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                tasks.add(() -> detector.check(node));
            }
            for (Future<Optional<Diagnostic>> future : executor.invokeAll(tasks)) {
                assertEquals(expected, future.get());
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
