package com.vidnyan.eqlint.domain.ast;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BinaryOperatorTest {

    @Test
    void equalityInverse_MapsWithinSameStrictness() {
        assertEquals(Optional.of(BinaryOperator.STRICT_INEQUALITY), BinaryOperator.STRICT_EQUALITY.equalityInverse());
        assertEquals(Optional.of(BinaryOperator.STRICT_EQUALITY), BinaryOperator.STRICT_INEQUALITY.equalityInverse());
        assertEquals(Optional.of(BinaryOperator.INEQUALITY), BinaryOperator.EQUALITY.equalityInverse());
        assertEquals(Optional.of(BinaryOperator.EQUALITY), BinaryOperator.INEQUALITY.equalityInverse());
    }

    @ParameterizedTest
    @EnumSource(BinaryOperator.class)
    void equalityInverse_PresentExactlyForEqualityFamily(BinaryOperator operator) {
        assertEquals(operator.isEquality(), operator.equalityInverse().isPresent());
        operator.equalityInverse().ifPresent(inverse ->
                assertEquals(Optional.of(operator), inverse.equalityInverse()));
    }
}
