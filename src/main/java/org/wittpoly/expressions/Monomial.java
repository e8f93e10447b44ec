package org.wittpoly.expressions;

import lombok.Getter;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 单项式，形式为 v1^e1 * v2^e2 * ...，所有指数为正。
 * 空单项式表示常数 1。
 * 此类是不可变的。
 */
@Getter
public final class Monomial implements Comparable<Monomial> {

    public static final Monomial ONE = new Monomial(Collections.emptySortedMap());

    private final SortedMap<Variable, Integer> exponents;

    private final int hashCode;

    private Monomial(SortedMap<Variable, Integer> exponents) {
        this.exponents = Collections.unmodifiableSortedMap(exponents);
        this.hashCode = this.exponents.hashCode();
    }

    /**
     * 工厂方法：过滤掉零指数，拒绝负指数。
     */
    public static Monomial of(Map<Variable, Integer> exponents) {
        SortedMap<Variable, Integer> cleaned = new TreeMap<>();
        for (Map.Entry<Variable, Integer> entry : Objects.requireNonNull(exponents, "Monomial-of: exponents 不能为 null").entrySet()) {
            int e = Objects.requireNonNull(entry.getValue(), "Monomial-of: 指数不能为 null");
            if (e < 0) {
                throw new IllegalArgumentException("Monomial-of: 指数不能为负: " + entry.getKey() + "^" + e);
            }
            if (e > 0) {
                cleaned.put(Objects.requireNonNull(entry.getKey(), "Monomial-of: 变量不能为 null"), e);
            }
        }
        return cleaned.isEmpty() ? ONE : new Monomial(cleaned);
    }

    public static Monomial of(Variable variable) {
        return of(variable, 1);
    }

    public static Monomial of(Variable variable, int exponent) {
        return of(Map.of(variable, exponent));
    }

    public boolean isOne() {
        return exponents.isEmpty();
    }

    public int degree() {
        return exponents.values().stream().mapToInt(Integer::intValue).sum();
    }

    public Set<Variable> variables() {
        return exponents.keySet();
    }

    public Monomial multiply(Monomial other) {
        if (this.isOne()) {
            return other;
        }
        if (other.isOne()) {
            return this;
        }
        SortedMap<Variable, Integer> product = new TreeMap<>(this.exponents);
        other.exponents.forEach((v, e) -> product.merge(v, e, Integer::sum));
        return new Monomial(product);
    }

    public Monomial pow(int exponent) {
        if (exponent < 0) {
            throw new IllegalArgumentException("Monomial-pow: 指数不能为负: " + exponent);
        }
        if (exponent == 0) {
            return ONE;
        }
        SortedMap<Variable, Integer> powered = new TreeMap<>();
        exponents.forEach((v, e) -> powered.put(v, Math.multiplyExact(e, exponent)));
        return new Monomial(powered);
    }

    /**
     * 变量改名；改名后重合的变量指数相加。
     */
    public Monomial rename(Function<Variable, Variable> renaming) {
        SortedMap<Variable, Integer> renamed = new TreeMap<>();
        exponents.forEach((v, e) -> renamed.merge(renaming.apply(v), e, Integer::sum));
        return renamed.isEmpty() ? ONE : new Monomial(renamed);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return exponents.equals(((Monomial) o).exponents);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    /**
     * 分级字典序：先比总次数，再按变量顺序逐个比较指数。
     */
    @Override
    public int compareTo(Monomial other) {
        int cmp = Integer.compare(this.degree(), other.degree());
        if (cmp != 0) {
            return cmp;
        }
        Iterator<Map.Entry<Variable, Integer>> thisIt = this.exponents.entrySet().iterator();
        Iterator<Map.Entry<Variable, Integer>> otherIt = other.exponents.entrySet().iterator();
        while (thisIt.hasNext() && otherIt.hasNext()) {
            Map.Entry<Variable, Integer> a = thisIt.next();
            Map.Entry<Variable, Integer> b = otherIt.next();
            cmp = a.getKey().compareTo(b.getKey());
            if (cmp != 0) {
                // 变量较小的一方在该位置有更高的指数
                return -cmp;
            }
            cmp = Integer.compare(a.getValue(), b.getValue());
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(this.exponents.size(), other.exponents.size());
    }

    @Override
    public String toString() {
        if (isOne()) {
            return "1";
        }
        return exponents.entrySet().stream()
                .map(entry -> entry.getValue() == 1
                        ? entry.getKey().getName()
                        : entry.getKey().getName() + "^" + entry.getValue())
                .collect(Collectors.joining("*"));
    }
}
