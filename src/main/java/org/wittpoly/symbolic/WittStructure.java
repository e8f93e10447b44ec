package org.wittpoly.symbolic;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wittpoly.expressions.Polynomial;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.IntFunction;

/**
 * Witt 结构多项式：由 ghost 层的定义 Φ_k 生成整系数公式族。
 * Φ_k 中的变量 (slot, j) 表示"第 slot 个参数的第 j 个 ghost 分量"，
 * 例如加法的 Φ_k = W_k(X) + W_k(Y) 写作 X_k + Y_k。
 * S_n = bind(xInTermsOfW(n), W_k ↦ bind(Φ_k, (s, j) ↦ Ψ_j 在槽 s 中))。
 * 对素数 p 与整系数 Φ，结果必为整系数；否则说明 Φ 不是 Witt 结构。
 */
public final class WittStructure implements IntFunction<Polynomial> {

    private static final Logger logger = LoggerFactory.getLogger(WittStructure.class);

    @Getter
    private final String name;
    private final GhostOracle oracle;
    private final IntFunction<Polynomial> ghostDefinition;
    private final ConcurrentHashMap<Integer, Polynomial> structurePolynomials = new ConcurrentHashMap<>();

    private WittStructure(String name, GhostOracle oracle, IntFunction<Polynomial> ghostDefinition) {
        this.name = Objects.requireNonNull(name, "WittStructure-构造函数: name 不能为 null");
        this.oracle = Objects.requireNonNull(oracle, "WittStructure-构造函数: oracle 不能为 null");
        this.ghostDefinition = Objects.requireNonNull(ghostDefinition, "WittStructure-构造函数: ghostDefinition 不能为 null");
    }

    /**
     * @param name 用于日志与显示的名字
     * @param oracle 提供 ghost 映射与基变换
     * @param ghostDefinition k ↦ Φ_k
     */
    public static WittStructure of(String name, GhostOracle oracle, IntFunction<Polynomial> ghostDefinition) {
        return new WittStructure(name, oracle, ghostDefinition);
    }

    /**
     * 第 n 个结构多项式 S_n。
     * @throws IllegalStateException 如果 S_n 不是整系数
     */
    @Override
    public Polynomial apply(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("WittStructure-apply: 下标不能为负: " + n);
        }
        return structurePolynomials.computeIfAbsent(n, this::build);
    }

    private Polynomial build(int n) {
        GhostMap ghostMap = oracle.getGhostMap();
        Polynomial s = oracle.getBasisChange().reconstruct(
                k -> Objects.requireNonNull(ghostDefinition.apply(k), "WittStructure: Φ_" + k + " 为 null")
                        .bind(v -> ghostMap.ghostPolynomial(v.getIndex(), v.getSlot())),
                n);
        if (!s.isIntegral()) {
            logger.error("{} 的第 {} 个结构多项式不是整系数: {}", name, n, s);
            throw new IllegalStateException(name + " 的第 " + n + " 个结构多项式不是整系数");
        }
        logger.debug("{} 的结构多项式 S_{} 共 {} 项", name, n, s.getTerms().size());
        return s;
    }

    @Override
    public String toString() {
        return "WittStructure(" + name + ", p=" + oracle.getPrime() + ")";
    }
}
