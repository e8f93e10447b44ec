package org.wittpoly.witness;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wittpoly.core.CommRing;
import org.wittpoly.core.CoefficientSequence;
import org.wittpoly.expressions.Polynomial;
import org.wittpoly.expressions.Variable;
import org.wittpoly.symbolic.GhostOracle;
import org.wittpoly.symbolic.WittStructure;

import java.math.BigInteger;
import java.util.function.IntFunction;

/**
 * 素数 p 下的基本见证目录。
 * 算术运算的见证由它们的 ghost 层定义经 {@link WittStructure} 生成；
 * 恒等、零、一与 Verschiebung 另有直接实现，见证是手写的。
 * 组合代数只消费这些见证，不重新推导它们的正确性。
 */
public final class PrimitiveWitnesses {

    private static final Logger logger = LoggerFactory.getLogger(PrimitiveWitnesses.class);

    @Getter
    private final GhostOracle oracle;

    private final Representable identity;
    private final Representable zero;
    private final Representable one;
    private final Representable negation;
    private final Representable2 addition;
    private final Representable2 subtraction;
    private final Representable2 multiplication;
    private final Representable frobenius;
    private final Representable verschiebung;

    /**
     * @throws IllegalArgumentException 如果 prime 不是素数
     */
    public PrimitiveWitnesses(int prime) {
        this.oracle = GhostOracle.forPrime(prime);

        this.identity = Representable.of("id", new SequenceTransform() {
            @Override
            public <R> CoefficientSequence<R> apply(CommRing<R> ring, CoefficientSequence<R> x) {
                return x;
            }
        }, UnaryWitness.identity());

        this.zero = Representable.of("0", new SequenceTransform() {
            @Override
            public <R> CoefficientSequence<R> apply(CommRing<R> ring, CoefficientSequence<R> x) {
                return CoefficientSequence.constant(ring.zero());
            }
        }, UnaryWitness.of(n -> Polynomial.ZERO));

        // 1 = (1, 0, 0, ...)
        this.one = Representable.of("1", new SequenceTransform() {
            @Override
            public <R> CoefficientSequence<R> apply(CommRing<R> ring, CoefficientSequence<R> x) {
                return CoefficientSequence.ofPrefix(ring, ring.one());
            }
        }, UnaryWitness.of(n -> n == 0 ? Polynomial.ONE : Polynomial.ZERO));

        // V(x) = (0, x_0, x_1, ...)
        this.verschiebung = Representable.of("V", new SequenceTransform() {
            @Override
            public <R> CoefficientSequence<R> apply(CommRing<R> ring, CoefficientSequence<R> x) {
                R zeroElement = ring.zero();
                return CoefficientSequence.of(n -> n == 0 ? zeroElement : x.get(n - 1));
            }
        }, UnaryWitness.of(n -> n == 0 ? Polynomial.ZERO : Polynomial.of(Variable.x(n - 1))));

        this.negation = unaryStructure("neg", k -> ghostX(k).negate());
        this.addition = binaryStructure("add", k -> ghostX(k).add(ghostY(k)));
        this.subtraction = binaryStructure("sub", k -> ghostX(k).subtract(ghostY(k)));
        this.multiplication = binaryStructure("mul", k -> ghostX(k).multiply(ghostY(k)));
        this.frobenius = unaryStructure("F", k -> ghostX(k + 1));
        logger.info("基本见证目录就绪, p = {}", prime);
    }

    public int getPrime() {
        return oracle.getPrime();
    }

    public Representable identity() {
        return identity;
    }

    public Representable zero() {
        return zero;
    }

    public Representable one() {
        return one;
    }

    public Representable negation() {
        return negation;
    }

    public Representable2 addition() {
        return addition;
    }

    public Representable2 subtraction() {
        return subtraction;
    }

    public Representable2 multiplication() {
        return multiplication;
    }

    /**
     * Frobenius：ghost 层为 W_k(F x) = W_{k+1}(x)。
     */
    public Representable frobenius() {
        return frobenius;
    }

    /**
     * Verschiebung：坐标右移一位并补零。
     */
    public Representable verschiebung() {
        return verschiebung;
    }

    /**
     * 整数常数 m 的 Witt 向量，ghost 分量恒为 m。与输入无关。
     */
    public Representable intCast(long m) {
        Polynomial constant = Polynomial.constant(m);
        return unaryStructure("const(" + m + ")", k -> constant);
    }

    /**
     * k • x，k 为自然数。
     * @throws IllegalArgumentException 如果 k 为负
     */
    public Representable nsmul(long k) {
        if (k < 0) {
            throw new IllegalArgumentException("PrimitiveWitnesses-nsmul: k 不能为负: " + k);
        }
        return smul("nsmul(" + k + ")", k);
    }

    /**
     * k • x，k 为任意整数。
     */
    public Representable zsmul(long k) {
        return smul("zsmul(" + k + ")", k);
    }

    private Representable smul(String name, long k) {
        Polynomial factor = Polynomial.constant(BigInteger.valueOf(k));
        return unaryStructure(name, j -> factor.multiply(ghostX(j)));
    }

    /**
     * x^e。
     * @throws IllegalArgumentException 如果 e 为负
     */
    public Representable power(int e) {
        if (e < 0) {
            throw new IllegalArgumentException("PrimitiveWitnesses-power: 指数不能为负: " + e);
        }
        return unaryStructure("pow(" + e + ")", k -> ghostX(k).pow(e));
    }

    /**
     * 由 ghost 层定义生成一元见证；变换就是见证求值。
     */
    public Representable unaryStructure(String name, IntFunction<Polynomial> ghostDefinition) {
        WittStructure structure = WittStructure.of(name, oracle, ghostDefinition);
        return Representable.ofWitness(name, UnaryWitness.of(structure));
    }

    /**
     * 由 ghost 层定义生成二元见证；变换就是见证求值。
     */
    public Representable2 binaryStructure(String name, IntFunction<Polynomial> ghostDefinition) {
        WittStructure structure = WittStructure.of(name, oracle, ghostDefinition);
        return Representable2.ofWitness(name, BinaryWitness.of(structure));
    }

    private static Polynomial ghostX(int k) {
        return Polynomial.of(Variable.x(k));
    }

    private static Polynomial ghostY(int k) {
        return Polynomial.of(Variable.y(k));
    }

    @Override
    public String toString() {
        return "PrimitiveWitnesses(p=" + oracle.getPrime() + ")";
    }
}
