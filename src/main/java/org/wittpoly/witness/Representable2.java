package org.wittpoly.witness;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wittpoly.core.CommRing;
import org.wittpoly.core.CoefficientSequence;

import java.util.Objects;

/**
 * 二元变换的可表示性，见 {@link Representable}。
 * 此类是不可变的。
 */
@Getter
public final class Representable2 {

    private static final Logger logger = LoggerFactory.getLogger(Representable2.class);

    private final String name;
    private final SequenceTransform2 transform;
    private final BinaryWitness witness;

    private Representable2(String name, SequenceTransform2 transform, BinaryWitness witness) {
        this.name = Objects.requireNonNull(name, "Representable2-构造函数: name 不能为 null");
        this.transform = Objects.requireNonNull(transform, "Representable2-构造函数: transform 不能为 null");
        this.witness = Objects.requireNonNull(witness, "Representable2-构造函数: witness 不能为 null");
        logger.debug("创建了 Representable2: {}", name);
    }

    public static Representable2 of(String name, SequenceTransform2 transform, BinaryWitness witness) {
        return new Representable2(name, transform, witness);
    }

    public static Representable2 ofWitness(String name, BinaryWitness witness) {
        Objects.requireNonNull(witness, "Representable2-ofWitness: witness 不能为 null");
        return new Representable2(name, new SequenceTransform2() {
            @Override
            public <R> CoefficientSequence<R> apply(CommRing<R> ring, CoefficientSequence<R> x, CoefficientSequence<R> y) {
                return witness.apply(ring, x, y);
            }
        }, witness);
    }

    public <R> CoefficientSequence<R> apply(CommRing<R> ring, CoefficientSequence<R> x, CoefficientSequence<R> y) {
        return transform.apply(ring, x, y);
    }

    public <R> boolean audit(CommRing<R> ring, CoefficientSequence<R> x, CoefficientSequence<R> y, int upTo) {
        CoefficientSequence<R> actual = transform.apply(ring, x, y);
        for (int n = 0; n <= upTo; n++) {
            R expected = witness.evaluate(ring, n, x, y);
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
