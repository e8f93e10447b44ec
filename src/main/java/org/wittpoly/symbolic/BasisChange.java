package org.wittpoly.symbolic;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wittpoly.core.CoefficientSequence;
import org.wittpoly.core.ScalarInvertibleRing;
import org.wittpoly.expressions.Polynomial;
import org.wittpoly.expressions.Variable;
import org.wittpoly.utils.Primes;
import org.wittpoly.utils.Rational;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.IntFunction;

/**
 * 基变换公式：用 ghost 分量 W_0..W_n 表示原始坐标 X_n，
 * X_n = (W_n - Σ_{i<n} p^i X_i^{p^(n-i)}) / p^n。
 * 系数的分母是 p 的幂，所以只有在 p 可逆的环中才有意义。
 */
public final class BasisChange {

    private static final Logger logger = LoggerFactory.getLogger(BasisChange.class);

    @Getter
    private final GhostMap ghostMap;

    // 只追加，按下标升序填充，访问时加锁
    private final List<Polynomial> xInTermsOfW = new ArrayList<>();

    public BasisChange(GhostMap ghostMap) {
        this.ghostMap = Objects.requireNonNull(ghostMap, "BasisChange-构造函数: ghostMap 不能为 null");
    }

    public int getPrime() {
        return ghostMap.getPrime();
    }

    /**
     * X_n 关于 ghost 变量 W_k 的表达式。
     */
    public synchronized Polynomial xInTermsOfW(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("BasisChange-xInTermsOfW: 下标不能为负: " + n);
        }
        BigInteger p = BigInteger.valueOf(ghostMap.getPrime());
        // 递推式只依赖更小的下标，按顺序补齐
        while (xInTermsOfW.size() <= n) {
            int m = xInTermsOfW.size();
            Polynomial numerator = Polynomial.of(Variable.ghost(m));
            for (int i = 0; i < m; i++) {
                Polynomial lower = xInTermsOfW.get(i).pow(Primes.exactPower(ghostMap.getPrime(), m - i));
                numerator = numerator.subtract(lower.scale(Rational.valueOf(p.pow(i))));
            }
            Polynomial xm = numerator.scale(Rational.valueOf(BigInteger.ONE, p.pow(m)));
            logger.debug("xInTermsOfW({}) 共 {} 项", m, xm.getTerms().size());
            xInTermsOfW.add(xm);
        }
        return xInTermsOfW.get(n);
    }

    /**
     * 用给定的 ghost 公式族替换 W_k，得到第 n 个坐标的公式。
     * 当 ghostFamily(k) = bind(φ, Ψ_k) 时，结果恰好是 φ(n)。
     */
    public Polynomial reconstruct(IntFunction<Polynomial> ghostFamily, int n) {
        Objects.requireNonNull(ghostFamily, "BasisChange-reconstruct: ghostFamily 不能为 null");
        return xInTermsOfW(n).bind(w -> ghostFamily.apply(w.getIndex()));
    }

    /**
     * 重新计算被当作公理使用的恒等式：
     * bind(xInTermsOfW(n), W_k ↦ Ψ_k) = X_n 且 bind(Ψ_n, X_i ↦ xInTermsOfW(i)) = W_n。
     */
    public boolean verifyInversion(int n) {
        boolean forward = reconstruct(ghostMap::ghostPolynomial, n).equals(Polynomial.of(Variable.x(n)));
        boolean backward = ghostMap.bindGhost(this::xInTermsOfW, n).equals(Polynomial.of(Variable.ghost(n)));
        if (!forward || !backward) {
            logger.warn("基变换恒等式在 n = {} 处不成立 (forward = {}, backward = {})", n, forward, backward);
        }
        return forward && backward;
    }

    /**
     * 由 ghost 分量反解坐标。只在 p 可逆的环中可用。
     */
    public <R> CoefficientSequence<R> ghostInverse(ScalarInvertibleRing<R> ring, CoefficientSequence<R> ghosts) {
        Objects.requireNonNull(ring, "BasisChange-ghostInverse: ring 不能为 null");
        Objects.requireNonNull(ghosts, "BasisChange-ghostInverse: ghosts 不能为 null");
        return CoefficientSequence.of(n -> xInTermsOfW(n).evaluate(ring, w -> ghosts.get(w.getIndex())));
    }

    @Override
    public String toString() {
        return "BasisChange(p=" + ghostMap.getPrime() + ")";
    }
}
