package org.wittpoly.symbolic;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.wittpoly.core.CoefficientSequence;
import org.wittpoly.core.rings.RationalField;
import org.wittpoly.expressions.Polynomial;
import org.wittpoly.expressions.Variable;
import org.wittpoly.utils.Rational;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BasisChangeTest {

    @Nested
    @DisplayName("基变换公式 (Basis Change Formulas)")
    class FormulaTests {

        @Test
        @DisplayName("p = 2: X0 = W0, X1 = W1/2 - W0^2/2")
        void testXInTermsOfW_P2() {
            BasisChange basisChange = GhostOracle.forPrime(2).getBasisChange();
            Polynomial w0 = Polynomial.of(Variable.ghost(0));
            Polynomial w1 = Polynomial.of(Variable.ghost(1));
            Rational half = Rational.valueOf(1, 2);

            assertAll("p = 2",
                    () -> assertEquals(w0, basisChange.xInTermsOfW(0)),
                    () -> assertEquals(w1.scale(half).subtract(w0.pow(2).scale(half)), basisChange.xInTermsOfW(1)),
                    () -> assertFalse(basisChange.xInTermsOfW(1).isIntegral())
            );
        }

        @Test
        @DisplayName("负下标应被拒绝")
        void testNegativeIndex_ShouldThrow() {
            BasisChange basisChange = GhostOracle.forPrime(2).getBasisChange();
            assertThrows(IllegalArgumentException.class, () -> basisChange.xInTermsOfW(-1));
        }
    }

    @ParameterizedTest(name = "p = {0}, n = {1}")
    @DisplayName("基变换恒等式在两个方向上都成立")
    @CsvSource({"2, 0", "2, 1", "2, 2", "2, 3", "3, 0", "3, 1", "3, 2", "5, 1"})
    void testVerifyInversion(int prime, int n) {
        assertTrue(GhostOracle.forPrime(prime).getBasisChange().verifyInversion(n));
    }

    @Test
    @DisplayName("在 ℚ 中由 ghost 分量 (3, 5, 17, 257) 反解出 (3, -2, -18, -954)")
    void testGhostInverse_OverRationals() {
        BasisChange basisChange = GhostOracle.forPrime(2).getBasisChange();
        CoefficientSequence<Rational> ghosts = CoefficientSequence.ofPrefix(RationalField.INSTANCE,
                Rational.valueOf(3), Rational.valueOf(5), Rational.valueOf(17), Rational.valueOf(257));

        List<Rational> coordinates = basisChange.ghostInverse(RationalField.INSTANCE, ghosts).prefix(4);

        assertEquals(List.of(Rational.valueOf(3), Rational.valueOf(-2), Rational.valueOf(-18), Rational.valueOf(-954)), coordinates);
    }

    @Test
    @DisplayName("不是 ghost 向量的序列反解出非整数坐标")
    void testGhostInverse_NonGhostSequence() {
        BasisChange basisChange = GhostOracle.forPrime(2).getBasisChange();
        // W0 = 0, W1 = 1 => X1 = 1/2
        CoefficientSequence<Rational> ghosts = CoefficientSequence.ofPrefix(RationalField.INSTANCE, Rational.ZERO, Rational.ONE);

        assertEquals(Rational.valueOf(1, 2), basisChange.ghostInverse(RationalField.INSTANCE, ghosts).get(1));
    }
}
