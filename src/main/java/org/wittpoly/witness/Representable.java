package org.wittpoly.witness;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wittpoly.core.CommRing;
import org.wittpoly.core.CoefficientSequence;

import java.util.Objects;

/**
 * 可表示性：把一个一元变换与它的见证显式地打包在一起。
 * 创建者负责证明 "对任意环与任意输入，变换的输出坐标等于见证求值"；
 * 这里只保存与组合，不重新推导该证明。{@link #audit} 可以在有限前缀上抽查。
 * 此类是不可变的。
 */
@Getter
public final class Representable {

    private static final Logger logger = LoggerFactory.getLogger(Representable.class);

    private final String name;
    private final SequenceTransform transform;
    private final UnaryWitness witness;

    private Representable(String name, SequenceTransform transform, UnaryWitness witness) {
        this.name = Objects.requireNonNull(name, "Representable-构造函数: name 不能为 null");
        this.transform = Objects.requireNonNull(transform, "Representable-构造函数: transform 不能为 null");
        this.witness = Objects.requireNonNull(witness, "Representable-构造函数: witness 不能为 null");
        logger.debug("创建了 Representable: {}", name);
    }

    /**
     * 变换与见证分别给出，调用方保证二者一致。
     */
    public static Representable of(String name, SequenceTransform transform, UnaryWitness witness) {
        return new Representable(name, transform, witness);
    }

    /**
     * 变换就定义为见证求值，契约平凡成立。
     */
    public static Representable ofWitness(String name, UnaryWitness witness) {
        Objects.requireNonNull(witness, "Representable-ofWitness: witness 不能为 null");
        return new Representable(name, new SequenceTransform() {
            @Override
            public <R> CoefficientSequence<R> apply(CommRing<R> ring, CoefficientSequence<R> x) {
                return witness.apply(ring, x);
            }
        }, witness);
    }

    public <R> CoefficientSequence<R> apply(CommRing<R> ring, CoefficientSequence<R> x) {
        return transform.apply(ring, x);
    }

    /**
     * 在 0..upTo 上比较变换输出与见证求值。
     */
    public <R> boolean audit(CommRing<R> ring, CoefficientSequence<R> x, int upTo) {
        CoefficientSequence<R> actual = transform.apply(ring, x);
        for (int n = 0; n <= upTo; n++) {
            R expected = witness.evaluate(ring, n, x);
            if (!ring.areEqual(actual.get(n), expected)) {
                logger.warn("{} 在环 {} 上 n = {} 处与见证不一致: {} vs {}", name, ring.name(), n, actual.get(n), expected);
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return name;
    }
}
