package org.wittpoly.core;

import java.math.BigInteger;
import java.util.Objects;

/**
 * 环同态 R → S。实现者负责保持加法、乘法与单位元。
 *
 * @param <R> 定义域元素类型
 * @param <S> 值域元素类型
 */
public interface RingHom<R, S> {

    CommRing<R> domain();

    CommRing<S> codomain();

    S apply(R element);

    default <T> RingHom<R, T> andThen(RingHom<S, T> next) {
        return compose(next, this);
    }

    /**
     * 复合 g ∘ f。
     */
    static <R, S, T> RingHom<R, T> compose(RingHom<S, T> g, RingHom<R, S> f) {
        Objects.requireNonNull(g, "RingHom-compose: g 不能为 null");
        Objects.requireNonNull(f, "RingHom-compose: f 不能为 null");
        return new RingHom<>() {
            @Override
            public CommRing<R> domain() {
                return f.domain();
            }

            @Override
            public CommRing<T> codomain() {
                return g.codomain();
            }

            @Override
            public T apply(R element) {
                return g.apply(f.apply(element));
            }

            @Override
            public String toString() {
                return g + " ∘ " + f;
            }
        };
    }

    /**
     * 唯一的环同态 ℤ → S。
     */
    static <S> RingHom<BigInteger, S> integerCast(CommRing<BigInteger> integers, CommRing<S> target) {
        Objects.requireNonNull(integers, "RingHom-integerCast: integers 不能为 null");
        Objects.requireNonNull(target, "RingHom-integerCast: target 不能为 null");
        return new RingHom<>() {
            @Override
            public CommRing<BigInteger> domain() {
                return integers;
            }

            @Override
            public CommRing<S> codomain() {
                return target;
            }

            @Override
            public S apply(BigInteger element) {
                return target.fromInteger(element);
            }

            @Override
            public String toString() {
                return "ℤ → " + target.name();
            }
        };
    }
}
