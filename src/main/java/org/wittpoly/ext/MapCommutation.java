package org.wittpoly.ext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wittpoly.core.CoefficientSequence;
import org.wittpoly.core.RingHom;
import org.wittpoly.witness.Representable;
import org.wittpoly.witness.Representable2;

import java.util.Objects;

/**
 * 与环同态的交换性：coeff_map(g, f(x)) = f(coeff_map(g, x))。
 * 对由见证给出的变换这是自动成立的（同态与多项式求值可交换）；
 * 对另有直接实现的变换，这里在有限前缀上检查。
 */
public final class MapCommutation {

    private static final Logger logger = LoggerFactory.getLogger(MapCommutation.class);

    private MapCommutation() {
    }

    public static <R, S> boolean holds(Representable f, RingHom<R, S> hom, CoefficientSequence<R> x, int upTo) {
        Objects.requireNonNull(f, "MapCommutation-holds: f 不能为 null");
        Objects.requireNonNull(hom, "MapCommutation-holds: hom 不能为 null");
        Objects.requireNonNull(x, "MapCommutation-holds: x 不能为 null");
        CoefficientSequence<S> mappedOutput = f.apply(hom.domain(), x).map(hom);
        CoefficientSequence<S> outputOfMapped = f.apply(hom.codomain(), x.map(hom));
        return compare(f.getName(), hom, mappedOutput, outputOfMapped, upTo);
    }

    public static <R, S> boolean holds2(Representable2 f, RingHom<R, S> hom,
                                        CoefficientSequence<R> x, CoefficientSequence<R> y, int upTo) {
        Objects.requireNonNull(f, "MapCommutation-holds2: f 不能为 null");
        Objects.requireNonNull(hom, "MapCommutation-holds2: hom 不能为 null");
        Objects.requireNonNull(x, "MapCommutation-holds2: x 不能为 null");
        Objects.requireNonNull(y, "MapCommutation-holds2: y 不能为 null");
        CoefficientSequence<S> mappedOutput = f.apply(hom.domain(), x, y).map(hom);
        CoefficientSequence<S> outputOfMapped = f.apply(hom.codomain(), x.map(hom), y.map(hom));
        return compare(f.getName(), hom, mappedOutput, outputOfMapped, upTo);
    }

    private static <S> boolean compare(String name, RingHom<?, S> hom,
                                       CoefficientSequence<S> mappedOutput,
                                       CoefficientSequence<S> outputOfMapped, int upTo) {
        for (int n = 0; n <= upTo; n++) {
            if (!hom.codomain().areEqual(mappedOutput.get(n), outputOfMapped.get(n))) {
                logger.warn("{} 与同态 {} 在 n = {} 处不交换: {} vs {}",
                        name, hom, n, mappedOutput.get(n), outputOfMapped.get(n));
                return false;
            }
        }
        return true;
    }
}
