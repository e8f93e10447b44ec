package org.wittpoly.ext;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.wittpoly.core.CommRing;
import org.wittpoly.expressions.Polynomial;
import org.wittpoly.expressions.Variable;
import org.wittpoly.witness.PrimitiveWitnesses;
import org.wittpoly.witness.Representable;
import org.wittpoly.witness.Representable2;
import org.wittpoly.witness.WitnessAlgebra;

import java.util.function.IntFunction;

import static org.junit.jupiter.api.Assertions.*;

class ExtensionalityEngineTest {

    private static PrimitiveWitnesses p2, p3;
    private static ExtensionalityEngine engine2, engine3;

    @BeforeAll
    static void setUp() {
        p2 = new PrimitiveWitnesses(2);
        p3 = new PrimitiveWitnesses(3);
        engine2 = new ExtensionalityEngine(2);
        engine3 = new ExtensionalityEngine(ExtensionalityOptions.defaults(3).withBound(2));
    }

    /**
     * W_n(x) + W_n(x)
     */
    private static final GhostExpression DOUBLE_GHOST = new GhostExpression() {
        @Override
        public <R> R evaluate(CommRing<R> ring, IntFunction<R> ghost, int n) {
            return ring.add(ghost.apply(n), ghost.apply(n));
        }
    };

    /**
     * 2 * W_n(x)
     */
    private static final GhostExpression TWICE_GHOST = new GhostExpression() {
        @Override
        public <R> R evaluate(CommRing<R> ring, IntFunction<R> ghost, int n) {
            return ring.multiply(ring.fromInteger(2), ghost.apply(n));
        }
    };

    @Nested
    @DisplayName("只用 ghost 证据的等式 (Ghost-only Equalities)")
    class GhostOnlyTests {

        @Test
        @DisplayName("x + x = 2 • x：ghost 层 W_n + W_n = 2 W_n 推出下标 0..3 的公式相等")
        void testDoubleEqualsNsmulTwo() {
            Representable doubled = WitnessAlgebra.diagonal(p2.addition());
            Representable twice = p2.nsmul(2);

            WitnessEquality result = engine2.ext(doubled, twice,
                    GhostHypothesis.byGhostExpressions(doubled, DOUBLE_GHOST, twice, TWICE_GHOST));

            assertAll("x + x = 2 • x",
                    () -> assertTrue(result.isProved(), result::toString),
                    () -> assertEquals(4, result.getCertificates().size()),
                    () -> assertTrue(result.failures().isEmpty()),
                    () -> assertEquals(doubled.getWitness().formula(3), result.certificate(3).reconstructed().orElseThrow().getLeft()),
                    () -> assertEquals(twice.getWitness().formula(3), result.certificate(3).reconstructed().orElseThrow().getRight())
            );
        }

        @Test
        @DisplayName("neg ∘ neg = id (p = 2 与 p = 3)")
        void testDoubleNegation() {
            Representable negNeg2 = WitnessAlgebra.compose(p2.negation(), p2.negation());
            Representable negNeg3 = WitnessAlgebra.compose(p3.negation(), p3.negation());

            assertAll("neg ∘ neg = id",
                    () -> assertTrue(engine2.ext(negNeg2, p2.identity(), GhostHypothesis.byEvaluation(negNeg2, p2.identity())).isProved()),
                    () -> assertTrue(engine3.ext(negNeg3, p3.identity(), GhostHypothesis.byEvaluation(negNeg3, p3.identity())).isProved())
            );
        }

        @Test
        @DisplayName("x + (-x) = 0")
        void testAdditiveInverse() {
            Representable sum = WitnessAlgebra.compose2(p2.addition(), p2.identity(), p2.negation());

            WitnessEquality result = engine2.ext(sum, p2.zero(), GhostHypothesis.byEvaluation(sum, p2.zero()));

            assertAll("x + (-x) = 0",
                    () -> assertTrue(result.isProved(), result::toString),
                    () -> assertTrue(result.certificate(2).reconstructed().orElseThrow().getLeft().isZero())
            );
        }

        @Test
        @DisplayName("手写的 Verschiebung 与由 ghost 定义生成的版本相等")
        void testVerschiebung_HandWrittenMatchesStructure() {
            Polynomial prime = Polynomial.constant(2);
            Representable generated = p2.unaryStructure("V'",
                    k -> k == 0 ? Polynomial.ZERO : prime.multiply(Polynomial.of(Variable.x(k - 1))));

            WitnessEquality result = engine2.ext(p2.verschiebung(), generated,
                    GhostHypothesis.byEvaluation(p2.verschiebung(), generated));

            assertAll("V = V'",
                    () -> assertTrue(result.isProved(), result::toString),
                    () -> assertEquals(Polynomial.of(Variable.x(2)), result.certificate(3).reconstructed().orElseThrow().getRight())
            );
        }

        @Test
        @DisplayName("F ∘ V = p • id (p = 2)")
        void testFrobeniusAfterVerschiebung() {
            Representable fv = WitnessAlgebra.compose(p2.frobenius(), p2.verschiebung());
            Representable twice = p2.nsmul(2);
            ExtensionalityEngine engine = new ExtensionalityEngine(ExtensionalityOptions.defaults(2).withBound(2));

            assertTrue(engine.ext(fv, twice, GhostHypothesis.byEvaluation(fv, twice)).isProved());
        }
    }

    @Nested
    @DisplayName("二元外延性 (Binary Extensionality)")
    class BinaryTests {

        @Test
        @DisplayName("加法交换律 add(x, y) = add(y, x)")
        void testAdditionCommutes() {
            Representable2 add = p2.addition();
            Representable2 swapped = WitnessAlgebra.swap(add);

            WitnessEquality result = engine2.ext2(add, swapped, GhostHypothesis2.byEvaluation(add, swapped));

            assertAll("Commutativity",
                    () -> assertTrue(result.isProved(), result::toString),
                    () -> assertTrue(result.certificate(1).reconstructed().orElseThrow().getLeft().variables().stream()
                            .allMatch(v -> v.getSlot() == Variable.FIRST_SLOT || v.getSlot() == Variable.SECOND_SLOT))
            );
        }

        @Test
        @DisplayName("sub(x, y) = add(x, neg y) (p = 3)")
        void testSubtractionIsAdditionOfNegation() {
            Representable2 sub = p3.subtraction();
            Representable2 viaAdd = WitnessAlgebra.precompose2(p3.addition(), p3.identity(), p3.negation());

            assertTrue(engine3.ext2(sub, viaAdd, GhostHypothesis2.byEvaluation(sub, viaAdd)).isProved());
        }

        @Test
        @DisplayName("乘法交换律，只检查到下标 2")
        void testMultiplicationCommutes() {
            Representable2 mul = p2.multiplication();
            Representable2 swapped = WitnessAlgebra.swap(mul);
            ExtensionalityEngine engine = new ExtensionalityEngine(ExtensionalityOptions.defaults(2).withBound(2));

            assertTrue(engine.ext2(mul, swapped, GhostHypothesis2.byEvaluation(mul, swapped)).isProved());
        }
    }

    @Nested
    @DisplayName("失败情形 (Failures)")
    class FailureTests {

        @Test
        @DisplayName("证据在探针上不成立时不得给出证明")
        void testRefutedHypothesis() {
            WitnessEquality result = engine3.ext(p3.identity(), p3.negation(),
                    GhostHypothesis.byEvaluation(p3.identity(), p3.negation()));

            assertAll("Refuted",
                    () -> assertFalse(result.isProved()),
                    () -> assertEquals(IndexCertificate.Outcome.HYPOTHESIS_REFUTED, result.certificate(0).getOutcome()),
                    () -> assertTrue(result.certificate(0).ghosts().isEmpty()),
                    () -> assertEquals(3, result.failures().size())
            );
        }

        @Test
        @DisplayName("变换与见证不一致时报告 WITNESS_MISMATCH")
        void testWitnessMismatch() {
            Representable lying = Representable.of("lying", p2.identity().getTransform(), p2.negation().getWitness());

            WitnessEquality result = engine2.ext(lying, p2.identity(), GhostHypothesis.byEvaluation(lying, p2.identity()));

            assertAll("Mismatch",
                    () -> assertFalse(result.isProved()),
                    () -> assertEquals(IndexCertificate.Outcome.WITNESS_MISMATCH, result.certificate(0).getOutcome()),
                    () -> assertTrue(result.certificate(0).reconstructed().isEmpty())
            );
        }

        @Test
        @DisplayName("certificate 的下标越界应抛出 IllegalArgumentException")
        void testCertificateOutOfRange() {
            WitnessEquality result = engine2.ext(p2.identity(), p2.identity(),
                    GhostHypothesis.byEvaluation(p2.identity(), p2.identity()));

            assertThrows(IllegalArgumentException.class, () -> result.certificate(4));
        }
    }

    @Test
    @DisplayName("串行与并行的结论一致")
    void testSequentialMatchesParallel() {
        Representable sum = WitnessAlgebra.compose2(p2.addition(), p2.identity(), p2.negation());
        ExtensionalityEngine sequential = new ExtensionalityEngine(ExtensionalityOptions.defaults(2).withParallel(false));

        WitnessEquality parallelResult = engine2.ext(sum, p2.zero(), GhostHypothesis.byEvaluation(sum, p2.zero()));
        WitnessEquality sequentialResult = sequential.ext(sum, p2.zero(), GhostHypothesis.byEvaluation(sum, p2.zero()));

        assertAll("Sequential vs parallel",
                () -> assertEquals(parallelResult.isProved(), sequentialResult.isProved()),
                () -> assertEquals(parallelResult.certificate(3).reconstructed(), sequentialResult.certificate(3).reconstructed())
        );
    }

    @Test
    @DisplayName("配置：非法的 bound 与素数应被拒绝")
    void testOptionsValidation() {
        assertAll("Options",
                () -> assertThrows(IllegalArgumentException.class, () -> ExtensionalityOptions.defaults(2).withBound(-1)),
                () -> assertThrows(IllegalArgumentException.class, () -> ExtensionalityOptions.defaults(10)),
                () -> assertEquals(ExtensionalityOptions.DEFAULT_BOUND, ExtensionalityOptions.defaults(2).getBound()),
                () -> assertFalse(ExtensionalityOptions.defaults(2).withVerifyBasisChange(false).isVerifyBasisChange())
        );
    }
}
