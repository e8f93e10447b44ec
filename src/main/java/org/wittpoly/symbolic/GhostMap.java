package org.wittpoly.symbolic;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wittpoly.core.CommRing;
import org.wittpoly.core.CoefficientSequence;
import org.wittpoly.expressions.Monomial;
import org.wittpoly.expressions.Polynomial;
import org.wittpoly.expressions.Variable;
import org.wittpoly.utils.Primes;
import org.wittpoly.utils.Rational;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.IntFunction;

/**
 * ghost 映射：固定的、与环无关的多项式族
 * Ψ_n = Σ_{i=0..n} p^i X_i^{p^(n-i)}。
 * 只用作验证工具，从不用来实现变换本身。
 * 此类是不可变的（内部缓存不影响语义）。
 */
public final class GhostMap {

    private static final Logger logger = LoggerFactory.getLogger(GhostMap.class);

    @Getter
    private final int prime;

    private final ConcurrentHashMap<Integer, Polynomial> ghostPolynomials = new ConcurrentHashMap<>();

    /**
     * @param prime 素数 p
     * @throws IllegalArgumentException 如果 prime 不是素数
     */
    public GhostMap(int prime) {
        this.prime = Primes.requirePrime(prime);
        logger.debug("创建 GhostMap, p = {}", prime);
    }

    /**
     * 第 n 个 ghost 多项式 Ψ_n，变量在第一个参数槽。
     */
    public Polynomial ghostPolynomial(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("GhostMap-ghostPolynomial: 下标不能为负: " + n);
        }
        return ghostPolynomials.computeIfAbsent(n, this::buildGhostPolynomial);
    }

    /**
     * Ψ_n，变量换到 slot 槽。
     */
    public Polynomial ghostPolynomial(int n, int slot) {
        Polynomial psi = ghostPolynomial(n);
        return slot == Variable.FIRST_SLOT ? psi : psi.moveToSlot(slot);
    }

    private Polynomial buildGhostPolynomial(int n) {
        Map<Monomial, Rational> terms = new HashMap<>();
        BigInteger p = BigInteger.valueOf(prime);
        for (int i = 0; i <= n; i++) {
            terms.put(Monomial.of(Variable.x(i), Primes.exactPower(prime, n - i)), Rational.valueOf(p.pow(i)));
        }
        Polynomial psi = Polynomial.of(terms);
        logger.debug("Ψ_{} = {}", n, psi);
        return psi;
    }

    /**
     * ghostComponent(n, x)：在任意环中对序列 x 求 Ψ_n 的值，无条件有定义。
     */
    public <R> R ghostComponent(CommRing<R> ring, int n, CoefficientSequence<R> x) {
        Objects.requireNonNull(ring, "GhostMap-ghostComponent: ring 不能为 null");
        Objects.requireNonNull(x, "GhostMap-ghostComponent: x 不能为 null");
        return ghostPolynomial(n).evaluate(ring, v -> x.get(v.getIndex()));
    }

    /**
     * 整个 ghost 序列 (Ψ_0(x), Ψ_1(x), ...)。
     */
    public <R> CoefficientSequence<R> ghostSequence(CommRing<R> ring, CoefficientSequence<R> x) {
        return CoefficientSequence.of(n -> ghostComponent(ring, n, x));
    }

    /**
     * bind(φ, Ψ_n)：把公式族 φ 代入 Ψ_n，得到 f 的第 n 个 ghost 分量的公式。
     */
    public Polynomial bindGhost(IntFunction<Polynomial> family, int n) {
        Objects.requireNonNull(family, "GhostMap-bindGhost: family 不能为 null");
        return ghostPolynomial(n).bind(v -> family.apply(v.getIndex()));
    }

    @Override
    public String toString() {
        return "GhostMap(p=" + prime + ")";
    }
}
