package org.wittpoly.expressions;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wittpoly.core.CommRing;
import org.wittpoly.core.ScalarInvertibleRing;
import org.wittpoly.utils.Rational;

import java.math.BigInteger;
import java.util.*;
import java.util.function.Function;

/**
 * 多元多项式，形式为 c1*m1 + c2*m2 + ...，系数为 Rational，m_i 为互不相同的单项式。
 * 内部始终是规范形（无零系数、单项式有序），因此结构相等即公式相等。
 * 见证公式要求整系数，基变换公式允许 p 的幂作分母。
 * 此类是不可变的。
 */
@Getter
public final class Polynomial {

    private static final Logger logger = LoggerFactory.getLogger(Polynomial.class);

    public static final Polynomial ZERO = new Polynomial(Collections.emptySortedMap());
    public static final Polynomial ONE = new Polynomial(new TreeMap<>(Map.of(Monomial.ONE, Rational.ONE)));

    private final SortedMap<Monomial, Rational> terms;

    private final int hashCode;

    private Polynomial(SortedMap<Monomial, Rational> terms) {
        this.terms = Collections.unmodifiableSortedMap(terms);
        this.hashCode = this.terms.hashCode();
    }

    /**
     * 工厂方法：过滤掉零系数。
     * @param terms 单项式到系数的映射。
     */
    public static Polynomial of(Map<Monomial, Rational> terms) {
        SortedMap<Monomial, Rational> cleaned = new TreeMap<>();
        for (Map.Entry<Monomial, Rational> entry : Objects.requireNonNull(terms, "Polynomial-of: terms 不能为 null").entrySet()) {
            Rational c = Objects.requireNonNull(entry.getValue(), "Polynomial-of: 系数不能为 null");
            if (!c.isZero()) {
                cleaned.put(Objects.requireNonNull(entry.getKey(), "Polynomial-of: 单项式不能为 null"), c);
            }
        }
        return cleaned.isEmpty() ? ZERO : new Polynomial(cleaned);
    }

    public static Polynomial of(Variable variable) {
        return term(Rational.ONE, Monomial.of(variable));
    }

    public static Polynomial term(Rational coefficient, Monomial monomial) {
        return of(Map.of(monomial, coefficient));
    }

    public static Polynomial constant(Rational value) {
        return term(value, Monomial.ONE);
    }

    public static Polynomial constant(long value) {
        return constant(Rational.valueOf(value));
    }

    public static Polynomial constant(BigInteger value) {
        return constant(Rational.valueOf(value));
    }

    // ========== 查询 ==========

    public boolean isZero() {
        return terms.isEmpty();
    }

    public boolean isConstant() {
        return terms.isEmpty() || (terms.size() == 1 && terms.firstKey().isOne());
    }

    public Rational coefficient(Monomial monomial) {
        return terms.getOrDefault(monomial, Rational.ZERO);
    }

    /**
     * 所有系数都是整数时才能作为见证公式。
     */
    public boolean isIntegral() {
        return terms.values().stream().allMatch(Rational::isInteger);
    }

    public SortedSet<Variable> variables() {
        SortedSet<Variable> vars = new TreeSet<>();
        terms.keySet().forEach(m -> vars.addAll(m.variables()));
        return Collections.unmodifiableSortedSet(vars);
    }

    public int totalDegree() {
        return terms.keySet().stream().mapToInt(Monomial::degree).max().orElse(0);
    }

    // ========== 环运算 ==========

    public Polynomial add(Polynomial other) {
        if (this.isZero()) {
            return other;
        }
        if (other.isZero()) {
            return this;
        }
        Map<Monomial, Rational> sum = new HashMap<>(this.terms);
        other.terms.forEach((m, c) -> sum.merge(m, c, Rational::add));
        return of(sum);
    }

    public Polynomial subtract(Polynomial other) {
        return this.add(other.negate());
    }

    public Polynomial negate() {
        return scale(Rational.MINUS_ONE);
    }

    public Polynomial scale(Rational factor) {
        if (factor.isZero() || this.isZero()) {
            return ZERO;
        }
        if (factor.isOne()) {
            return this;
        }
        SortedMap<Monomial, Rational> scaled = new TreeMap<>();
        terms.forEach((m, c) -> scaled.put(m, c.multiply(factor)));
        return new Polynomial(scaled);
    }

    public Polynomial multiply(Polynomial other) {
        if (this.isZero() || other.isZero()) {
            return ZERO;
        }
        if (this.equals(ONE)) {
            return other;
        }
        if (other.equals(ONE)) {
            return this;
        }
        Map<Monomial, Rational> product = new HashMap<>();
        for (Map.Entry<Monomial, Rational> a : this.terms.entrySet()) {
            for (Map.Entry<Monomial, Rational> b : other.terms.entrySet()) {
                product.merge(a.getKey().multiply(b.getKey()), a.getValue().multiply(b.getValue()), Rational::add);
            }
        }
        return of(product);
    }

    /**
     * 非负整数次幂，平方乘算法。
     */
    public Polynomial pow(int exponent) {
        if (exponent < 0) {
            throw new IllegalArgumentException("Polynomial-pow: 指数不能为负: " + exponent);
        }
        if (exponent == 0) {
            return ONE;
        }
        if (terms.size() == 1) {
            Map.Entry<Monomial, Rational> only = terms.entrySet().iterator().next();
            return term(only.getValue().pow(exponent), only.getKey().pow(exponent));
        }
        Polynomial result = ONE;
        Polynomial base = this;
        int e = exponent;
        while (e > 0) {
            if ((e & 1) == 1) {
                result = result.multiply(base);
            }
            e >>= 1;
            if (e > 0) {
                base = base.multiply(base);
            }
        }
        return result;
    }

    // ========== 代换 ==========

    /**
     * bind：把每个变量 v 替换为多项式 substitution(v)，展开并规范化。
     * 代换与求值可交换，这是组合代数正确性的全部依据。
     */
    public Polynomial bind(Function<Variable, Polynomial> substitution) {
        Objects.requireNonNull(substitution, "Polynomial-bind: substitution 不能为 null");
        if (isConstant()) {
            return this;
        }
        Map<Variable, Polynomial> images = new HashMap<>();
        Map<Variable, Map<Integer, Polynomial>> powers = new HashMap<>();
        Map<Monomial, Rational> accumulated = new HashMap<>();
        for (Map.Entry<Monomial, Rational> entry : terms.entrySet()) {
            Polynomial product = constant(entry.getValue());
            for (Map.Entry<Variable, Integer> factor : entry.getKey().getExponents().entrySet()) {
                Variable v = factor.getKey();
                Polynomial image = images.computeIfAbsent(v, key ->
                        Objects.requireNonNull(substitution.apply(key), "Polynomial-bind: 变量 " + key + " 的代换结果为 null"));
                Polynomial power = powers.computeIfAbsent(v, key -> new HashMap<>())
                        .computeIfAbsent(factor.getValue(), image::pow);
                product = product.multiply(power);
                if (product.isZero()) {
                    break;
                }
            }
            product.terms.forEach((m, c) -> accumulated.merge(m, c, Rational::add));
        }
        Polynomial result = of(accumulated);
        logger.debug("bind 完成: {} 项 -> {} 项", terms.size(), result.terms.size());
        return result;
    }

    /**
     * 变量改名，是 bind 的特例。
     */
    public Polynomial rename(Function<Variable, Variable> renaming) {
        Objects.requireNonNull(renaming, "Polynomial-rename: renaming 不能为 null");
        Map<Monomial, Rational> renamed = new HashMap<>();
        terms.forEach((m, c) -> renamed.merge(m.rename(renaming), c, Rational::add));
        return of(renamed);
    }

    /**
     * 把所有变量移到同一个槽，下标不变。
     */
    public Polynomial moveToSlot(int slot) {
        return rename(v -> v.withSlot(slot));
    }

    // ========== 求值 ==========

    /**
     * 在环 ring 中求值，变量取 assignment 给出的值。
     * 整系数多项式可在任意环中求值；含分母的系数要求 ring 是 {@link ScalarInvertibleRing}。
     *
     * @throws IllegalStateException 如果含非整系数而 ring 不能对标量求逆
     */
    public <R> R evaluate(CommRing<R> ring, Function<Variable, R> assignment) {
        Objects.requireNonNull(ring, "Polynomial-evaluate: ring 不能为 null");
        Objects.requireNonNull(assignment, "Polynomial-evaluate: assignment 不能为 null");
        Map<Variable, R> values = new HashMap<>();
        R result = ring.zero();
        for (Map.Entry<Monomial, Rational> entry : terms.entrySet()) {
            R term = embedCoefficient(ring, entry.getValue());
            for (Map.Entry<Variable, Integer> factor : entry.getKey().getExponents().entrySet()) {
                R value = values.computeIfAbsent(factor.getKey(), key ->
                        Objects.requireNonNull(assignment.apply(key), "Polynomial-evaluate: 变量 " + key + " 没有赋值"));
                term = ring.multiply(term, ring.pow(value, factor.getValue()));
            }
            result = ring.add(result, term);
        }
        return result;
    }

    private static <R> R embedCoefficient(CommRing<R> ring, Rational c) {
        if (c.isInteger()) {
            return ring.fromInteger(c.getNumerator());
        }
        if (ring instanceof ScalarInvertibleRing<R> invertible) {
            return invertible.fromRational(c);
        }
        logger.error("Polynomial-evaluate: 系数 {} 不是整数，环 {} 不能对标量求逆", c, ring.name());
        throw new IllegalStateException("非整系数 " + c + " 无法在环 " + ring.name() + " 中求值");
    }

    // ========== Object 方法 ==========

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Polynomial that = (Polynomial) o;
        return hashCode == that.hashCode && terms.equals(that.terms);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        if (isZero()) {
            return "0";
        }
        StringBuilder sb = new StringBuilder();
        boolean firstTerm = true;
        // 从高次到低次输出
        for (Map.Entry<Monomial, Rational> entry : new TreeMap<>(terms).descendingMap().entrySet()) {
            Monomial m = entry.getKey();
            Rational c = entry.getValue();
            if (firstTerm) {
                if (c.signum() < 0) {
                    sb.append("-");
                }
            } else {
                sb.append(c.signum() < 0 ? " - " : " + ");
            }
            Rational abs = c.abs();
            if (m.isOne()) {
                sb.append(abs);
            } else if (abs.isOne()) {
                sb.append(m);
            } else {
                sb.append(abs).append("*").append(m);
            }
            firstTerm = false;
        }
        return sb.toString();
    }
}
