package org.wittpoly.symbolic;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.wittpoly.core.CoefficientSequence;
import org.wittpoly.core.rings.IntegerRing;
import org.wittpoly.core.rings.ZModRing;
import org.wittpoly.expressions.Polynomial;
import org.wittpoly.expressions.Variable;
import org.wittpoly.utils.Rational;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GhostMapTest {

    private static Polynomial x(int i) {
        return Polynomial.of(Variable.x(i));
    }

    private static BigInteger big(long v) {
        return BigInteger.valueOf(v);
    }

    @Nested
    @DisplayName("ghost 多项式 (Ghost Polynomials)")
    class GhostPolynomialTests {

        @Test
        @DisplayName("p = 2: Ψ_0 = X0, Ψ_1 = X0^2 + 2*X1")
        void testGhostPolynomials_P2() {
            GhostMap ghostMap = GhostOracle.forPrime(2).getGhostMap();

            assertAll("p = 2",
                    () -> assertEquals(x(0), ghostMap.ghostPolynomial(0)),
                    () -> assertEquals(x(0).pow(2).add(x(1).scale(Rational.valueOf(2))), ghostMap.ghostPolynomial(1)),
                    () -> assertEquals(8, ghostMap.ghostPolynomial(3).totalDegree())
            );
        }

        @Test
        @DisplayName("p = 3: Ψ_2 = X0^9 + 3*X1^3 + 9*X2")
        void testGhostPolynomials_P3() {
            GhostMap ghostMap = GhostOracle.forPrime(3).getGhostMap();
            Polynomial expected = x(0).pow(9)
                    .add(x(1).pow(3).scale(Rational.valueOf(3)))
                    .add(x(2).scale(Rational.valueOf(9)));

            assertEquals(expected, ghostMap.ghostPolynomial(2));
        }

        @Test
        @DisplayName("指定槽的 Ψ_n 只含该槽的变量")
        void testGhostPolynomial_InSlot() {
            GhostMap ghostMap = GhostOracle.forPrime(2).getGhostMap();
            Polynomial psi = ghostMap.ghostPolynomial(2, Variable.SECOND_SLOT);

            assertTrue(psi.variables().stream().allMatch(v -> v.getSlot() == Variable.SECOND_SLOT));
        }

        @Test
        @DisplayName("非素数应被拒绝")
        void testNonPrime_ShouldThrow() {
            assertAll("Non-prime",
                    () -> assertThrows(IllegalArgumentException.class, () -> new GhostMap(6)),
                    () -> assertThrows(IllegalArgumentException.class, () -> GhostOracle.forPrime(1))
            );
        }
    }

    @Nested
    @DisplayName("ghost 分量 (Ghost Components)")
    class GhostComponentTests {

        @Test
        @DisplayName("p = 2: (2, 0, 0, ...) 的 ghost 分量为 2, 4, 16, 256")
        void testGhostSequence_InIntegers() {
            GhostMap ghostMap = GhostOracle.forPrime(2).getGhostMap();
            CoefficientSequence<BigInteger> y = CoefficientSequence.ofPrefix(IntegerRing.INSTANCE, big(2));

            assertEquals(List.of(big(2), big(4), big(16), big(256)), ghostMap.ghostSequence(IntegerRing.INSTANCE, y).prefix(4));
        }

        @Test
        @DisplayName("ghost 分量在 p 不可逆的环中也有定义 (ℤ/4)")
        void testGhostComponent_InZModPower() {
            GhostMap ghostMap = GhostOracle.forPrime(2).getGhostMap();
            ZModRing z4 = ZModRing.of(4);
            CoefficientSequence<BigInteger> x = CoefficientSequence.ofPrefix(z4, big(1), big(1));

            // Ψ_1 = 1 + 2 = 3, Ψ_2 = 1 + 2 + 0 = 3
            assertAll("Ghost components mod 4",
                    () -> assertEquals(big(3), ghostMap.ghostComponent(z4, 1, x)),
                    () -> assertEquals(big(3), ghostMap.ghostComponent(z4, 2, x))
            );
        }

        @Test
        @DisplayName("bindGhost 把公式族代入 Ψ_n")
        void testBindGhost() {
            GhostMap ghostMap = GhostOracle.forPrime(2).getGhostMap();
            // φ(k) = 0 对所有 k：ghost 公式也是 0
            assertTrue(ghostMap.bindGhost(k -> Polynomial.ZERO, 3).isZero());
            // φ = 恒等：ghost 公式就是 Ψ_n 本身
            assertEquals(ghostMap.ghostPolynomial(2), ghostMap.bindGhost(GhostMapTest::x, 2));
        }
    }

    @Test
    @DisplayName("同一个素数共享同一个 GhostOracle")
    void testOracleIsSharedPerPrime() {
        assertSame(GhostOracle.forPrime(5), GhostOracle.forPrime(5));
        assertNotSame(GhostOracle.forPrime(5), GhostOracle.forPrime(7));
    }
}
