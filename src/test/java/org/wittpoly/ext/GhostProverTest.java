package org.wittpoly.ext;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.wittpoly.core.CoefficientSequence;
import org.wittpoly.core.CommRing;
import org.wittpoly.core.rings.IntegerRing;
import org.wittpoly.core.rings.ZModRing;
import org.wittpoly.ext.exceptions.ExtensionalityException;
import org.wittpoly.ext.exceptions.MissingWitnessException;
import org.wittpoly.ext.exceptions.RepresentabilityViolationException;
import org.wittpoly.witness.PrimitiveWitnesses;
import org.wittpoly.witness.Representable;
import org.wittpoly.witness.Representable2;
import org.wittpoly.witness.SequenceTransform;
import org.wittpoly.witness.SequenceTransform2;
import org.wittpoly.witness.WitnessAlgebra;
import org.wittpoly.witness.WitnessRegistry;

import java.math.BigInteger;
import java.util.function.IntFunction;

import static org.junit.jupiter.api.Assertions.*;

class GhostProverTest {

    private static PrimitiveWitnesses primitives;
    private static GhostProver prover;

    @BeforeAll
    static void setUp() {
        primitives = new PrimitiveWitnesses(2);
        WitnessRegistry registry = WitnessRegistry.withPrimitives(primitives)
                .register(WitnessAlgebra.compose(primitives.negation(), primitives.negation()))
                .register(WitnessAlgebra.swap(primitives.addition()));
        prover = new GhostProver(registry, ExtensionalityOptions.defaults(2));
    }

    @Nested
    @DisplayName("按名字证明 (Proving by Name)")
    class ProveEqualTests {

        @Test
        @DisplayName("查找、探针代入、化简：(neg ∘ neg) = id")
        void testProveEqual_ByName() {
            WitnessEquality result = prover.proveEqual("(neg ∘ neg)", "id");

            assertAll("(neg ∘ neg) = id",
                    () -> assertTrue(result.isProved()),
                    () -> assertEquals("(neg ∘ neg)", result.getLeft()),
                    () -> assertEquals(2, result.getPrime())
            );
        }

        @Test
        @DisplayName("二元：add(y, x) = add(x, y)")
        void testProveEqual2_ByName() {
            assertTrue(prover.proveEqual2("add(y, x)", "add").isProved());
        }

        @Test
        @DisplayName("给定 ghost 证据：neg 的 ghost 分量为 -W_n")
        void testProveEqual_WithHypothesis() {
            Representable neg = prover.witnessFor("neg");
            GhostHypothesis hypothesis = GhostHypothesis.byGhostExpressions(
                    neg, new GhostExpression() {
                        @Override
                        public <R> R evaluate(CommRing<R> ring, IntFunction<R> ghost, int n) {
                            return ring.negate(ghost.apply(n));
                        }
                    },
                    neg, new GhostExpression() {
                        @Override
                        public <R> R evaluate(CommRing<R> ring, IntFunction<R> ghost, int n) {
                            return ring.multiply(ring.fromInteger(-1), ghost.apply(n));
                        }
                    });

            assertTrue(prover.proveEqual("neg", "neg", hypothesis).isProved());
        }
    }

    @Nested
    @DisplayName("异常 (Exceptions)")
    class ExceptionTests {

        @Test
        @DisplayName("未登记的名字应抛出 MissingWitnessException")
        void testMissingWitness() {
            assertAll("Missing witnesses",
                    () -> assertThrows(MissingWitnessException.class, () -> prover.witnessFor("teichmuller")),
                    () -> assertThrows(MissingWitnessException.class, () -> prover.witnessFor2("neg")),
                    () -> assertThrows(MissingWitnessException.class, () -> prover.proveEqual("id", "nope"))
            );
        }

        @Test
        @DisplayName("证据不成立时应抛出 ExtensionalityException")
        void testUnprovable() {
            ExtensionalityException e = assertThrows(ExtensionalityException.class, () -> prover.proveEqual("id", "neg"));
            assertTrue(e.getMessage().contains("HYPOTHESIS_REFUTED"));
        }

        @Test
        @DisplayName("变换与见证不一致时应抛出 RepresentabilityViolationException")
        void testRepresentabilityViolation() {
            Representable lying = Representable.of("lying", primitives.identity().getTransform(), primitives.negation().getWitness());

            assertThrows(RepresentabilityViolationException.class,
                    () -> prover.ext(lying, primitives.identity(), GhostHypothesis.byEvaluation(lying, primitives.identity())));
        }
    }

    @Nested
    @DisplayName("与环同态交换 (Map Commutation)")
    class MapCommuteTests {

        @Test
        @DisplayName("基本见证与 ℤ → ℤ/8 交换")
        void testMapCommute_Primitives() {
            CoefficientSequence<BigInteger> x = CoefficientSequence.ofPrefix(IntegerRing.INSTANCE, BigInteger.valueOf(5), BigInteger.valueOf(-3));
            CoefficientSequence<BigInteger> y = CoefficientSequence.ofPrefix(IntegerRing.INSTANCE, BigInteger.valueOf(2));

            assertDoesNotThrow(() -> {
                prover.mapCommute(prover.witnessFor("neg"), ZModRing.of(8).reduction(), x);
                prover.mapCommute(prover.witnessFor("V"), ZModRing.of(8).reduction(), x);
                prover.mapCommute2(prover.witnessFor2("mul"), ZModRing.of(8).reduction(), x, y);
            });
        }

        @Test
        @DisplayName("依赖具体环的变换应抛出 RepresentabilityViolationException")
        void testMapCommute_Violation() {
            Representable ringDependent = Representable.of("ringDependent", new SequenceTransform() {
                @Override
                public <R> CoefficientSequence<R> apply(CommRing<R> ring, CoefficientSequence<R> x) {
                    return ring instanceof ZModRing ? CoefficientSequence.constant(ring.zero()) : x;
                }
            }, primitives.identity().getWitness());
            CoefficientSequence<BigInteger> x = CoefficientSequence.ofPrefix(IntegerRing.INSTANCE, BigInteger.ONE);

            assertThrows(RepresentabilityViolationException.class,
                    () -> prover.mapCommute(ringDependent, ZModRing.of(8).reduction(), x));
        }

        @Test
        @DisplayName("二元：在 ℤ/m 上改取第二个参数的变换应抛出 RepresentabilityViolationException")
        void testMapCommute2_Violation() {
            Representable2 ringDependent = Representable2.of("ringDependent2", new SequenceTransform2() {
                @Override
                public <R> CoefficientSequence<R> apply(CommRing<R> ring, CoefficientSequence<R> x, CoefficientSequence<R> y) {
                    return ring instanceof ZModRing ? y : x;
                }
            }, primitives.addition().getWitness());
            CoefficientSequence<BigInteger> x = CoefficientSequence.ofPrefix(IntegerRing.INSTANCE, BigInteger.ONE);
            CoefficientSequence<BigInteger> y = CoefficientSequence.ofPrefix(IntegerRing.INSTANCE, BigInteger.TWO);

            RepresentabilityViolationException e = assertThrows(RepresentabilityViolationException.class,
                    () -> prover.mapCommute2(ringDependent, ZModRing.of(8).reduction(), x, y));
            assertTrue(e.getMessage().contains("ringDependent2"));
        }
    }

    @Test
    @DisplayName("forPrime 登记全部基本见证")
    void testForPrime() {
        GhostProver defaultProver = GhostProver.forPrime(3);

        assertAll("forPrime",
                () -> assertEquals(3, defaultProver.getEngine().getOptions().getPrime()),
                () -> assertTrue(defaultProver.getRegistry().names().contains("mul")),
                () -> assertTrue(defaultProver.proveEqual2("sub", "sub").isProved())
        );
    }
}
