package org.wittpoly.core;

import org.wittpoly.expressions.Polynomial;
import org.wittpoly.expressions.Variable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.IntFunction;

/**
 * 以自然数为下标的无限系数序列 (x_0, x_1, x_2, ...)。
 * 按需计算并缓存每个坐标；生成函数必须是纯函数，因此缓存不会改变语义。
 * 此类是不可变的。
 *
 * @param <R> 坐标所在环的元素类型
 */
public final class CoefficientSequence<R> {

    private static final int DISPLAY_PREFIX = 4;

    private final IntFunction<? extends R> generator;
    private final ConcurrentHashMap<Integer, R> cache = new ConcurrentHashMap<>();

    private CoefficientSequence(IntFunction<? extends R> generator) {
        this.generator = Objects.requireNonNull(generator, "CoefficientSequence: generator 不能为 null");
    }

    public static <R> CoefficientSequence<R> of(IntFunction<? extends R> generator) {
        return new CoefficientSequence<>(generator);
    }

    /**
     * 给定有限前缀，其余坐标补零。
     */
    public static <R> CoefficientSequence<R> ofPrefix(CommRing<R> ring, List<R> prefix) {
        Objects.requireNonNull(ring, "CoefficientSequence-ofPrefix: ring 不能为 null");
        List<R> copy = List.copyOf(prefix);
        R zero = ring.zero();
        return new CoefficientSequence<>(n -> n < copy.size() ? copy.get(n) : zero);
    }

    @SafeVarargs
    public static <R> CoefficientSequence<R> ofPrefix(CommRing<R> ring, R... prefix) {
        return ofPrefix(ring, List.of(prefix));
    }

    public static <R> CoefficientSequence<R> constant(R value) {
        Objects.requireNonNull(value, "CoefficientSequence-constant: value 不能为 null");
        return new CoefficientSequence<>(n -> value);
    }

    /**
     * 由形式变量组成的序列，第 k 个坐标是 slot 中的第 k 个变量。
     */
    public static CoefficientSequence<Polynomial> variables(int slot) {
        return new CoefficientSequence<>(k -> Polynomial.of(Variable.of(slot, k)));
    }

    /**
     * 第 n 个坐标。
     * @throws IllegalArgumentException 如果 n 为负
     */
    public R get(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("CoefficientSequence-get: 下标不能为负: " + n);
        }
        R cached = cache.get(n);
        if (cached != null) {
            return cached;
        }
        // 不用 computeIfAbsent：生成函数可能读取其它序列，避免在同一个 map 上递归更新
        R value = Objects.requireNonNull(generator.apply(n), "CoefficientSequence: 生成的坐标为 null, n = " + n);
        R previous = cache.putIfAbsent(n, value);
        return previous != null ? previous : value;
    }

    /**
     * 前 length 个坐标。
     */
    public List<R> prefix(int length) {
        List<R> result = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            result.add(get(i));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * 逐坐标应用函数。
     */
    public <S> CoefficientSequence<S> map(Function<? super R, ? extends S> mapper) {
        Objects.requireNonNull(mapper, "CoefficientSequence-map: mapper 不能为 null");
        return new CoefficientSequence<>(n -> mapper.apply(get(n)));
    }

    /**
     * coeff_map：逐坐标应用环同态。
     */
    public <S> CoefficientSequence<S> map(RingHom<R, S> hom) {
        Objects.requireNonNull(hom, "CoefficientSequence-map: hom 不能为 null");
        return new CoefficientSequence<>(n -> hom.apply(get(n)));
    }

    /**
     * 在下标 0..upTo 上逐个比较。
     */
    public boolean agreesUpTo(CoefficientSequence<R> other, CommRing<R> ring, int upTo) {
        for (int n = 0; n <= upTo; n++) {
            if (!ring.areEqual(this.get(n), other.get(n))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < DISPLAY_PREFIX; i++) {
            sb.append(get(i)).append(", ");
        }
        return sb.append("...)").toString();
    }
}
