package org.wittpoly.witness;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wittpoly.core.CommRing;
import org.wittpoly.core.CoefficientSequence;
import org.wittpoly.expressions.Polynomial;
import org.wittpoly.expressions.Variable;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.IntFunction;

/**
 * 二元见证：全函数 n ↦ φ(n)，φ(n) 是只含 X_i（第一个参数）与 Y_i（第二个参数）的整系数多项式。
 * 此类是不可变的。
 */
public final class BinaryWitness {

    private static final Logger logger = LoggerFactory.getLogger(BinaryWitness.class);

    private final IntFunction<Polynomial> family;
    private final ConcurrentHashMap<Integer, Polynomial> formulas = new ConcurrentHashMap<>();

    private BinaryWitness(IntFunction<Polynomial> family) {
        this.family = Objects.requireNonNull(family, "BinaryWitness-构造函数: family 不能为 null");
    }

    public static BinaryWitness of(IntFunction<Polynomial> family) {
        return new BinaryWitness(family);
    }

    /**
     * @throws IllegalStateException 如果生成的公式不是整系数，或含有 X / Y 以外的变量
     */
    public Polynomial formula(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("BinaryWitness-formula: 下标不能为负: " + n);
        }
        return formulas.computeIfAbsent(n, this::build);
    }

    private Polynomial build(int n) {
        Polynomial phi = Objects.requireNonNull(family.apply(n), "BinaryWitness: φ(" + n + ") 为 null");
        if (!phi.isIntegral()) {
            logger.error("BinaryWitness: φ({}) = {} 不是整系数", n, phi);
            throw new IllegalStateException("见证公式必须是整系数: φ(" + n + ") = " + phi);
        }
        for (Variable v : phi.variables()) {
            if (v.getSlot() != Variable.FIRST_SLOT && v.getSlot() != Variable.SECOND_SLOT) {
                logger.error("BinaryWitness: φ({}) 含有非法变量 {}", n, v);
                throw new IllegalStateException("二元见证公式只能含 X / Y 变量: φ(" + n + ") = " + phi);
            }
        }
        return phi;
    }

    public IntFunction<Polynomial> asFamily() {
        return this::formula;
    }

    public <R> R evaluate(CommRing<R> ring, int n, CoefficientSequence<R> x, CoefficientSequence<R> y) {
        Objects.requireNonNull(x, "BinaryWitness-evaluate: x 不能为 null");
        Objects.requireNonNull(y, "BinaryWitness-evaluate: y 不能为 null");
        return formula(n).evaluate(ring, v -> v.getSlot() == Variable.FIRST_SLOT ? x.get(v.getIndex()) : y.get(v.getIndex()));
    }

    public <R> CoefficientSequence<R> apply(CommRing<R> ring, CoefficientSequence<R> x, CoefficientSequence<R> y) {
        Objects.requireNonNull(ring, "BinaryWitness-apply: ring 不能为 null");
        return CoefficientSequence.of(n -> evaluate(ring, n, x, y));
    }

    public boolean agreesUpTo(BinaryWitness other, int upTo) {
        for (int n = 0; n <= upTo; n++) {
            if (!formula(n).equals(other.formula(n))) {
                logger.debug("BinaryWitness 在 n = {} 处不同: {} vs {}", n, formula(n), other.formula(n));
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "BinaryWitness[φ(0) = " + formula(0) + ", ...]";
    }
}
