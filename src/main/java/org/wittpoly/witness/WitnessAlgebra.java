package org.wittpoly.witness;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wittpoly.core.CommRing;
import org.wittpoly.core.CoefficientSequence;
import org.wittpoly.expressions.Variable;

import java.util.Objects;

/**
 * 见证的组合代数。所有组合子都是公式层面的纯代换，全函数，不调用 ghost 预言机：
 * 代换与求值可交换，所以结果自动满足可表示性。
 * 每个组合子同时提供见证层与 {@link Representable} 层两个版本，后者把变换一并组合。
 */
public final class WitnessAlgebra {

    private static final Logger logger = LoggerFactory.getLogger(WitnessAlgebra.class);

    private WitnessAlgebra() {
    }

    // ========== 见证层 ==========

    /**
     * compose(g, f)：n ↦ g(n)[X_i := f(i)]。
     */
    public static UnaryWitness compose(UnaryWitness g, UnaryWitness f) {
        Objects.requireNonNull(g, "WitnessAlgebra-compose: g 不能为 null");
        Objects.requireNonNull(f, "WitnessAlgebra-compose: f 不能为 null");
        return UnaryWitness.of(n -> g.formula(n).bind(v -> f.formula(v.getIndex())));
    }

    /**
     * postcompose₂(g, h)：(x, y) ↦ g(h(x, y))。
     */
    public static BinaryWitness postcompose2(UnaryWitness g, BinaryWitness h) {
        Objects.requireNonNull(g, "WitnessAlgebra-postcompose2: g 不能为 null");
        Objects.requireNonNull(h, "WitnessAlgebra-postcompose2: h 不能为 null");
        return BinaryWitness.of(n -> g.formula(n).bind(v -> h.formula(v.getIndex())));
    }

    /**
     * precompose₂(h, f, g)：(x, y) ↦ h(f x, g y)。
     * f 的公式留在 X 槽，g 的公式先改名到 Y 槽，二者不相交后再代入 h。
     */
    public static BinaryWitness precompose2(BinaryWitness h, UnaryWitness f, UnaryWitness g) {
        Objects.requireNonNull(h, "WitnessAlgebra-precompose2: h 不能为 null");
        Objects.requireNonNull(f, "WitnessAlgebra-precompose2: f 不能为 null");
        Objects.requireNonNull(g, "WitnessAlgebra-precompose2: g 不能为 null");
        return BinaryWitness.of(n -> h.formula(n).bind(v -> v.getSlot() == Variable.FIRST_SLOT
                ? f.formula(v.getIndex())
                : g.formula(v.getIndex()).moveToSlot(Variable.SECOND_SLOT)));
    }

    /**
     * diagonal(h)：x ↦ h(x, x)，Y 变量换成同下标的 X 变量。
     */
    public static UnaryWitness diagonal(BinaryWitness h) {
        Objects.requireNonNull(h, "WitnessAlgebra-diagonal: h 不能为 null");
        return UnaryWitness.of(n -> h.formula(n).moveToSlot(Variable.FIRST_SLOT));
    }

    /**
     * x ↦ h(f x, g x)。
     */
    public static UnaryWitness compose2(BinaryWitness h, UnaryWitness f, UnaryWitness g) {
        return diagonal(precompose2(h, f, g));
    }

    /**
     * (x, y) ↦ h(y, x)。
     */
    public static BinaryWitness swap(BinaryWitness h) {
        Objects.requireNonNull(h, "WitnessAlgebra-swap: h 不能为 null");
        return BinaryWitness.of(n -> h.formula(n).rename(v -> v.withSlot(
                v.getSlot() == Variable.FIRST_SLOT ? Variable.SECOND_SLOT : Variable.FIRST_SLOT)));
    }

    // ========== Representable 层 ==========

    public static Representable compose(Representable g, Representable f) {
        Objects.requireNonNull(g, "WitnessAlgebra-compose: g 不能为 null");
        Objects.requireNonNull(f, "WitnessAlgebra-compose: f 不能为 null");
        String name = "(" + g.getName() + " ∘ " + f.getName() + ")";
        logger.debug("组合 {}", name);
        return Representable.of(name, new SequenceTransform() {
            @Override
            public <R> CoefficientSequence<R> apply(CommRing<R> ring, CoefficientSequence<R> x) {
                return g.apply(ring, f.apply(ring, x));
            }
        }, compose(g.getWitness(), f.getWitness()));
    }

    public static Representable2 postcompose2(Representable g, Representable2 h) {
        Objects.requireNonNull(g, "WitnessAlgebra-postcompose2: g 不能为 null");
        Objects.requireNonNull(h, "WitnessAlgebra-postcompose2: h 不能为 null");
        String name = "(" + g.getName() + " ∘ " + h.getName() + ")";
        logger.debug("组合 {}", name);
        return Representable2.of(name, new SequenceTransform2() {
            @Override
            public <R> CoefficientSequence<R> apply(CommRing<R> ring, CoefficientSequence<R> x, CoefficientSequence<R> y) {
                return g.apply(ring, h.apply(ring, x, y));
            }
        }, postcompose2(g.getWitness(), h.getWitness()));
    }

    public static Representable2 precompose2(Representable2 h, Representable f, Representable g) {
        Objects.requireNonNull(h, "WitnessAlgebra-precompose2: h 不能为 null");
        Objects.requireNonNull(f, "WitnessAlgebra-precompose2: f 不能为 null");
        Objects.requireNonNull(g, "WitnessAlgebra-precompose2: g 不能为 null");
        String name = h.getName() + "(" + f.getName() + " x, " + g.getName() + " y)";
        logger.debug("组合 {}", name);
        return Representable2.of(name, new SequenceTransform2() {
            @Override
            public <R> CoefficientSequence<R> apply(CommRing<R> ring, CoefficientSequence<R> x, CoefficientSequence<R> y) {
                return h.apply(ring, f.apply(ring, x), g.apply(ring, y));
            }
        }, precompose2(h.getWitness(), f.getWitness(), g.getWitness()));
    }

    public static Representable diagonal(Representable2 h) {
        Objects.requireNonNull(h, "WitnessAlgebra-diagonal: h 不能为 null");
        String name = h.getName() + "(x, x)";
        logger.debug("对角化 {}", name);
        return Representable.of(name, new SequenceTransform() {
            @Override
            public <R> CoefficientSequence<R> apply(CommRing<R> ring, CoefficientSequence<R> x) {
                return h.apply(ring, x, x);
            }
        }, diagonal(h.getWitness()));
    }

    public static Representable compose2(Representable2 h, Representable f, Representable g) {
        Objects.requireNonNull(h, "WitnessAlgebra-compose2: h 不能为 null");
        Objects.requireNonNull(f, "WitnessAlgebra-compose2: f 不能为 null");
        Objects.requireNonNull(g, "WitnessAlgebra-compose2: g 不能为 null");
        String name = h.getName() + "(" + f.getName() + " x, " + g.getName() + " x)";
        logger.debug("组合 {}", name);
        return Representable.of(name, new SequenceTransform() {
            @Override
            public <R> CoefficientSequence<R> apply(CommRing<R> ring, CoefficientSequence<R> x) {
                return h.apply(ring, f.apply(ring, x), g.apply(ring, x));
            }
        }, compose2(h.getWitness(), f.getWitness(), g.getWitness()));
    }

    public static Representable2 swap(Representable2 h) {
        Objects.requireNonNull(h, "WitnessAlgebra-swap: h 不能为 null");
        String name = h.getName() + "(y, x)";
        return Representable2.of(name, new SequenceTransform2() {
            @Override
            public <R> CoefficientSequence<R> apply(CommRing<R> ring, CoefficientSequence<R> x, CoefficientSequence<R> y) {
                return h.apply(ring, y, x);
            }
        }, swap(h.getWitness()));
    }
}
