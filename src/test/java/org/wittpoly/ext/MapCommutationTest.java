package org.wittpoly.ext;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.wittpoly.core.CoefficientSequence;
import org.wittpoly.core.CommRing;
import org.wittpoly.core.RingHom;
import org.wittpoly.core.rings.IntegerRing;
import org.wittpoly.core.rings.PolynomialRing;
import org.wittpoly.core.rings.RationalField;
import org.wittpoly.core.rings.ZModRing;
import org.wittpoly.expressions.Polynomial;
import org.wittpoly.expressions.Variable;
import org.wittpoly.utils.Rational;
import org.wittpoly.witness.PrimitiveWitnesses;
import org.wittpoly.witness.Representable;
import org.wittpoly.witness.SequenceTransform;
import org.wittpoly.witness.UnaryWitness;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class MapCommutationTest {

    private static PrimitiveWitnesses p2;

    @BeforeAll
    static void setUp() {
        p2 = new PrimitiveWitnesses(2);
    }

    private static CoefficientSequence<BigInteger> seq(long... prefix) {
        BigInteger[] values = new BigInteger[prefix.length];
        for (int i = 0; i < prefix.length; i++) {
            values[i] = BigInteger.valueOf(prefix[i]);
        }
        return CoefficientSequence.ofPrefix(IntegerRing.INSTANCE, values);
    }

    @Test
    @DisplayName("加法与约化 ℤ → ℤ/8 可交换")
    void testAddition_WithReduction() {
        RingHom<BigInteger, BigInteger> reduction = ZModRing.of(8).reduction();
        assertTrue(MapCommutation.holds2(p2.addition(), reduction, seq(1, 3), seq(2, -5), 3));
    }

    @Test
    @DisplayName("Frobenius 与 Verschiebung 与约化 ℤ → ℤ/4 可交换")
    void testFrobeniusAndVerschiebung_WithReduction() {
        RingHom<BigInteger, BigInteger> reduction = ZModRing.of(4).reduction();
        CoefficientSequence<BigInteger> x = seq(3, -1, 2, 5);

        assertAll("F and V mod 4",
                () -> assertTrue(MapCommutation.holds(p2.frobenius(), reduction, x, 2)),
                () -> assertTrue(MapCommutation.holds(p2.verschiebung(), reduction, x, 3))
        );
    }

    @Test
    @DisplayName("乘法与求值同态 ℚ[X] → ℚ 可交换")
    void testMultiplication_WithEvaluation() {
        RingHom<Polynomial, Rational> evaluation = PolynomialRing.INSTANCE.evaluationAt(RationalField.INSTANCE,
                v -> Rational.valueOf(v.getIndex() + 1, v.getSlot() + 2));
        CoefficientSequence<Polynomial> x = CoefficientSequence.variables(Variable.FIRST_SLOT);
        CoefficientSequence<Polynomial> y = CoefficientSequence.variables(Variable.SECOND_SLOT);

        assertTrue(MapCommutation.holds2(p2.multiplication(), evaluation, x, y, 2));
    }

    @Test
    @DisplayName("依赖具体环的变换不与同态交换")
    void testNonNaturalTransform_ShouldFail() {
        Representable ringDependent = Representable.of("ringDependent", new SequenceTransform() {
            @Override
            public <R> CoefficientSequence<R> apply(CommRing<R> ring, CoefficientSequence<R> x) {
                if (ring instanceof IntegerRing) {
                    return CoefficientSequence.of(n -> ring.negate(x.get(n)));
                }
                return x;
            }
        }, UnaryWitness.identity());

        assertFalse(MapCommutation.holds(ringDependent, ZModRing.of(8).reduction(), seq(1), 1));
    }
}
