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
 * 一元见证：全函数 n ↦ φ(n)，φ(n) 是只含 X_i 的整系数多项式。
 * 被见证的变换 f 满足：对任意环与任意输入 x，f(x)_n = φ(n)(x)。
 * 公式按需生成并缓存；生成时检查整系数与变量槽。
 * 此类是不可变的。
 */
public final class UnaryWitness {

    private static final Logger logger = LoggerFactory.getLogger(UnaryWitness.class);

    private static final UnaryWitness IDENTITY = new UnaryWitness(n -> Polynomial.of(Variable.x(n)));

    private final IntFunction<Polynomial> family;
    private final ConcurrentHashMap<Integer, Polynomial> formulas = new ConcurrentHashMap<>();

    private UnaryWitness(IntFunction<Polynomial> family) {
        this.family = Objects.requireNonNull(family, "UnaryWitness-构造函数: family 不能为 null");
    }

    public static UnaryWitness of(IntFunction<Polynomial> family) {
        return new UnaryWitness(family);
    }

    /**
     * 规范的恒等见证：φ(n) = X_n。
     */
    public static UnaryWitness identity() {
        return IDENTITY;
    }

    /**
     * 第 n 个输出坐标的公式。
     * @throws IllegalStateException 如果生成的公式不是整系数，或含有 X 以外的变量
     */
    public Polynomial formula(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("UnaryWitness-formula: 下标不能为负: " + n);
        }
        return formulas.computeIfAbsent(n, this::build);
    }

    private Polynomial build(int n) {
        Polynomial phi = Objects.requireNonNull(family.apply(n), "UnaryWitness: φ(" + n + ") 为 null");
        if (!phi.isIntegral()) {
            logger.error("UnaryWitness: φ({}) = {} 不是整系数", n, phi);
            throw new IllegalStateException("见证公式必须是整系数: φ(" + n + ") = " + phi);
        }
        for (Variable v : phi.variables()) {
            if (v.getSlot() != Variable.FIRST_SLOT) {
                logger.error("UnaryWitness: φ({}) 含有非法变量 {}", n, v);
                throw new IllegalStateException("一元见证公式只能含 X 变量: φ(" + n + ") = " + phi);
            }
        }
        return phi;
    }

    /**
     * 以方法引用形式暴露公式族，供 bind 使用。
     */
    public IntFunction<Polynomial> asFamily() {
        return this::formula;
    }

    /**
     * evaluate(φ(n), x)：在环 ring 中对输入 x 求第 n 个输出坐标。
     */
    public <R> R evaluate(CommRing<R> ring, int n, CoefficientSequence<R> x) {
        Objects.requireNonNull(x, "UnaryWitness-evaluate: x 不能为 null");
        return formula(n).evaluate(ring, v -> x.get(v.getIndex()));
    }

    /**
     * 见证诱导的变换本身。
     */
    public <R> CoefficientSequence<R> apply(CommRing<R> ring, CoefficientSequence<R> x) {
        Objects.requireNonNull(ring, "UnaryWitness-apply: ring 不能为 null");
        return CoefficientSequence.of(n -> evaluate(ring, n, x));
    }

    /**
     * 公式在下标 0..upTo 上逐个字面相等。
     */
    public boolean agreesUpTo(UnaryWitness other, int upTo) {
        for (int n = 0; n <= upTo; n++) {
            if (!formula(n).equals(other.formula(n))) {
                logger.debug("UnaryWitness 在 n = {} 处不同: {} vs {}", n, formula(n), other.formula(n));
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "UnaryWitness[φ(0) = " + formula(0) + ", ...]";
    }
}
