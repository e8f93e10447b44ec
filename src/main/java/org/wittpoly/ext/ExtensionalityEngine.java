package org.wittpoly.ext;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wittpoly.core.CoefficientSequence;
import org.wittpoly.core.rings.PolynomialRing;
import org.wittpoly.expressions.Polynomial;
import org.wittpoly.expressions.Variable;
import org.wittpoly.expressions.VariableSupply;
import org.wittpoly.symbolic.BasisChange;
import org.wittpoly.symbolic.GhostMap;
import org.wittpoly.symbolic.GhostOracle;
import org.wittpoly.witness.Representable;
import org.wittpoly.witness.Representable2;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Function;
import java.util.function.IntFunction;
import java.util.function.IntPredicate;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * 外延性判定：把 "对任意环、任意输入，两个变换的 ghost 分量相等" 归约为有限个公式的字面相等。
 * <ol>
 *     <li>输入取通用探针：ℚ[T] 中互不相同的新变量 T_0, T_1, ...（特征 0，代数无关）；</li>
 *     <li>在探针上检查调用方的 ghost 证据，并计算 bind(φ, Ψ_n) 与 bind(ψ, Ψ_n)；</li>
 *     <li>用基变换公式消去 Ψ，从两边的 ghost 公式反解出 φ(n) 与 ψ(n)；</li>
 *     <li>逐下标比较。</li>
 * </ol>
 * 各下标之间互不依赖，可以并行计算。
 */
public final class ExtensionalityEngine {

    private static final Logger logger = LoggerFactory.getLogger(ExtensionalityEngine.class);
    private static final ForkJoinPool PARALLEL_POOL = new ForkJoinPool();

    @Getter
    private final ExtensionalityOptions options;
    private final GhostOracle oracle;

    public ExtensionalityEngine(ExtensionalityOptions options) {
        this.options = Objects.requireNonNull(options, "ExtensionalityEngine-构造函数: options 不能为 null");
        this.oracle = GhostOracle.forPrime(options.getPrime());
    }

    public ExtensionalityEngine(int prime) {
        this(ExtensionalityOptions.defaults(prime));
    }

    /**
     * ext：一元见证的外延性。
     * @param f 左边的可表示变换（携带见证 φ）
     * @param g 右边的可表示变换（携带见证 ψ）
     * @param hypothesis ghost 层证据
     */
    public WitnessEquality ext(Representable f, Representable g, GhostHypothesis hypothesis) {
        Objects.requireNonNull(f, "ExtensionalityEngine-ext: f 不能为 null");
        Objects.requireNonNull(g, "ExtensionalityEngine-ext: g 不能为 null");
        Objects.requireNonNull(hypothesis, "ExtensionalityEngine-ext: hypothesis 不能为 null");
        logger.info("ext 开始: {} = {}, {}", f.getName(), g.getName(), options);

        PolynomialRing ring = PolynomialRing.INSTANCE;
        GhostMap ghostMap = oracle.getGhostMap();
        int probeSlot = VariableSupply.freshSlot();
        CoefficientSequence<Polynomial> probe = CoefficientSequence.variables(probeSlot);

        ProbeRun run = new ProbeRun(
                n -> hypothesis.holds(ring, ghostMap, probe, n),
                ghostMap.ghostSequence(ring, f.getWitness().apply(ring, probe)),
                ghostMap.ghostSequence(ring, g.getWitness().apply(ring, probe)),
                n -> f.getWitness().formula(n).moveToSlot(probeSlot),
                formula -> formula.moveToSlot(Variable.FIRST_SLOT));
        return finish(f.getName(), g.getName(), run);
    }

    /**
     * ext₂：二元见证的外延性，使用两条互不相交的探针。
     */
    public WitnessEquality ext2(Representable2 f, Representable2 g, GhostHypothesis2 hypothesis) {
        Objects.requireNonNull(f, "ExtensionalityEngine-ext2: f 不能为 null");
        Objects.requireNonNull(g, "ExtensionalityEngine-ext2: g 不能为 null");
        Objects.requireNonNull(hypothesis, "ExtensionalityEngine-ext2: hypothesis 不能为 null");
        logger.info("ext2 开始: {} = {}, {}", f.getName(), g.getName(), options);

        PolynomialRing ring = PolynomialRing.INSTANCE;
        GhostMap ghostMap = oracle.getGhostMap();
        int slotX = VariableSupply.freshSlot();
        int slotY = VariableSupply.freshSlot();
        CoefficientSequence<Polynomial> probeX = CoefficientSequence.variables(slotX);
        CoefficientSequence<Polynomial> probeY = CoefficientSequence.variables(slotY);
        Function<Variable, Variable> toProbe = v -> v.withSlot(v.getSlot() == Variable.FIRST_SLOT ? slotX : slotY);
        Function<Variable, Variable> fromProbe = v -> v.withSlot(v.getSlot() == slotX ? Variable.FIRST_SLOT : Variable.SECOND_SLOT);

        ProbeRun run = new ProbeRun(
                n -> hypothesis.holds(ring, ghostMap, probeX, probeY, n),
                ghostMap.ghostSequence(ring, f.getWitness().apply(ring, probeX, probeY)),
                ghostMap.ghostSequence(ring, g.getWitness().apply(ring, probeX, probeY)),
                n -> f.getWitness().formula(n).rename(toProbe),
                formula -> formula.rename(fromProbe));
        return finish(f.getName(), g.getName(), run);
    }

    private WitnessEquality finish(String left, String right, ProbeRun run) {
        List<IndexCertificate> certificates;
        if (options.isParallel()) {
            certificates = PARALLEL_POOL.submit(() ->
                    IntStream.rangeClosed(0, options.getBound())
                            .parallel()
                            .mapToObj(run::check)
                            .collect(Collectors.toList())
            ).join();
        } else {
            certificates = IntStream.rangeClosed(0, options.getBound())
                    .mapToObj(run::check)
                    .collect(Collectors.toList());
        }
        WitnessEquality result = new WitnessEquality(left, right, options.getPrime(), options.getBound(), certificates);
        if (result.isProved()) {
            logger.info("ext 完成: {}", result);
        } else {
            logger.warn("ext 未能证明: {}", result);
        }
        return result;
    }

    /**
     * 一次探针计算的全部材料；ghost 序列带缓存，各下标可以安全地并发读取。
     */
    private final class ProbeRun {
        private final IntPredicate hypothesisAt;
        private final CoefficientSequence<Polynomial> ghostLeft;
        private final CoefficientSequence<Polynomial> ghostRight;
        private final IntFunction<Polynomial> leftFormulaOnProbe;
        private final Function<Polynomial, Polynomial> backFromProbe;

        private ProbeRun(IntPredicate hypothesisAt,
                         CoefficientSequence<Polynomial> ghostLeft,
                         CoefficientSequence<Polynomial> ghostRight,
                         IntFunction<Polynomial> leftFormulaOnProbe,
                         Function<Polynomial, Polynomial> backFromProbe) {
            this.hypothesisAt = hypothesisAt;
            this.ghostLeft = ghostLeft;
            this.ghostRight = ghostRight;
            this.leftFormulaOnProbe = leftFormulaOnProbe;
            this.backFromProbe = backFromProbe;
        }

        private IndexCertificate check(int n) {
            if (!hypothesisAt.test(n)) {
                logger.warn("ghost 证据在探针上的下标 {} 处不成立", n);
                return IndexCertificate.refuted(n);
            }

            Pair<Polynomial, Polynomial> ghosts = Pair.of(
                    backFromProbe.apply(ghostLeft.get(n)),
                    backFromProbe.apply(ghostRight.get(n)));
            if (!ghostLeft.get(n).equals(ghostRight.get(n))) {
                logger.warn("证据成立但见证的 ghost 公式在下标 {} 处不同", n);
                return new IndexCertificate(n, IndexCertificate.Outcome.WITNESS_MISMATCH, ghosts, null);
            }

            BasisChange basisChange = oracle.getBasisChange();
            Polynomial phi = basisChange.reconstruct(ghostLeft::get, n);
            Polynomial psi = basisChange.reconstruct(ghostRight::get, n);
            Pair<Polynomial, Polynomial> formulas = Pair.of(backFromProbe.apply(phi), backFromProbe.apply(psi));
            if (!phi.equals(psi)) {
                return new IndexCertificate(n, IndexCertificate.Outcome.FORMULA_MISMATCH, ghosts, formulas);
            }
            if (options.isVerifyBasisChange() && !phi.equals(leftFormulaOnProbe.apply(n))) {
                logger.error("基变换反解的公式与见证不符, n = {}: {} vs {}", n, phi, leftFormulaOnProbe.apply(n));
                return new IndexCertificate(n, IndexCertificate.Outcome.BASIS_CHANGE_FAILED, ghosts, formulas);
            }
            logger.debug("下标 {} 已证明: φ({}) = ψ({}) = {}", n, n, n, formulas.getLeft());
            return new IndexCertificate(n, IndexCertificate.Outcome.PROVED, ghosts, formulas);
        }
    }
}
