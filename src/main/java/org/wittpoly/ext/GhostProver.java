package org.wittpoly.ext;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wittpoly.core.CoefficientSequence;
import org.wittpoly.core.RingHom;
import org.wittpoly.ext.exceptions.ExtensionalityException;
import org.wittpoly.ext.exceptions.MissingWitnessException;
import org.wittpoly.ext.exceptions.RepresentabilityViolationException;
import org.wittpoly.witness.PrimitiveWitnesses;
import org.wittpoly.witness.Representable;
import org.wittpoly.witness.Representable2;
import org.wittpoly.witness.WitnessRegistry;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 证明入口：查找见证、探针代入、化简比较。
 * 与 {@link ExtensionalityEngine} 不同，失败时抛出异常而不是返回结果对象。
 */
@Getter
public final class GhostProver {

    private static final Logger logger = LoggerFactory.getLogger(GhostProver.class);

    private final WitnessRegistry registry;
    private final ExtensionalityEngine engine;

    public GhostProver(WitnessRegistry registry, ExtensionalityOptions options) {
        this.registry = Objects.requireNonNull(registry, "GhostProver-构造函数: registry 不能为 null");
        this.engine = new ExtensionalityEngine(options);
    }

    /**
     * 登记了全部基本见证、使用默认配置的证明器。
     */
    public static GhostProver forPrime(int prime) {
        return new GhostProver(WitnessRegistry.withPrimitives(new PrimitiveWitnesses(prime)),
                ExtensionalityOptions.defaults(prime));
    }

    /**
     * @throws MissingWitnessException 如果没有登记名为 name 的一元见证
     */
    public Representable witnessFor(String name) {
        return registry.witnessFor(name).orElseThrow(() -> {
            logger.error("找不到一元见证: {}", name);
            return new MissingWitnessException(name);
        });
    }

    /**
     * @throws MissingWitnessException 如果没有登记名为 name 的二元见证
     */
    public Representable2 witnessFor2(String name) {
        return registry.witnessFor2(name).orElseThrow(() -> {
            logger.error("找不到二元见证: {}", name);
            return new MissingWitnessException(name);
        });
    }

    /**
     * @throws RepresentabilityViolationException 如果证据成立但某个变换与它的见证不一致
     * @throws ExtensionalityException 其它未能证明的情形
     */
    public WitnessEquality ext(Representable f, Representable g, GhostHypothesis hypothesis) {
        return requireProved(engine.ext(f, g, hypothesis));
    }

    public WitnessEquality ext2(Representable2 f, Representable2 g, GhostHypothesis2 hypothesis) {
        return requireProved(engine.ext2(f, g, hypothesis));
    }

    /**
     * 按名字查找两个见证，再用给定证据做外延性判定。
     */
    public WitnessEquality proveEqual(String nameF, String nameG, GhostHypothesis hypothesis) {
        return ext(witnessFor(nameF), witnessFor(nameG), hypothesis);
    }

    /**
     * 证据直接取两边输出的 ghost 分量比较。
     */
    public WitnessEquality proveEqual(String nameF, String nameG) {
        Representable f = witnessFor(nameF);
        Representable g = witnessFor(nameG);
        return ext(f, g, GhostHypothesis.byEvaluation(f, g));
    }

    public WitnessEquality proveEqual2(String nameF, String nameG, GhostHypothesis2 hypothesis) {
        return ext2(witnessFor2(nameF), witnessFor2(nameG), hypothesis);
    }

    public WitnessEquality proveEqual2(String nameF, String nameG) {
        Representable2 f = witnessFor2(nameF);
        Representable2 g = witnessFor2(nameG);
        return ext2(f, g, GhostHypothesis2.byEvaluation(f, g));
    }

    /**
     * 在下标 0..bound 上检查 coeff_map(hom, f(x)) = f(coeff_map(hom, x))。
     * @throws RepresentabilityViolationException 如果不交换
     */
    public <R, S> void mapCommute(Representable f, RingHom<R, S> hom, CoefficientSequence<R> x) {
        if (!MapCommutation.holds(f, hom, x, engine.getOptions().getBound())) {
            logger.error("GhostProver-mapCommute: {} 与环同态 {} 不交换", f.getName(), hom);
            throw new RepresentabilityViolationException(f.getName(), "与环同态 " + hom + " 不交换");
        }
    }

    public <R, S> void mapCommute2(Representable2 f, RingHom<R, S> hom, CoefficientSequence<R> x, CoefficientSequence<R> y) {
        if (!MapCommutation.holds2(f, hom, x, y, engine.getOptions().getBound())) {
            logger.error("GhostProver-mapCommute2: {} 与环同态 {} 不交换", f.getName(), hom);
            throw new RepresentabilityViolationException(f.getName(), "与环同态 " + hom + " 不交换");
        }
    }

    private WitnessEquality requireProved(WitnessEquality result) {
        if (result.isProved()) {
            return result;
        }
        boolean violated = result.failures().stream()
                .anyMatch(c -> c.getOutcome() == IndexCertificate.Outcome.WITNESS_MISMATCH);
        if (violated) {
            String indices = result.failures().stream()
                    .filter(c -> c.getOutcome() == IndexCertificate.Outcome.WITNESS_MISMATCH)
                    .map(c -> String.valueOf(c.getIndex()))
                    .collect(Collectors.joining(", "));
            logger.error("GhostProver-ext: {} 与 {} 的见证在下标 {} 处与变换不一致", result.getLeft(), result.getRight(), indices);
            throw new RepresentabilityViolationException(result.getLeft() + " / " + result.getRight(),
                    "ghost 公式在下标 " + indices + " 处不同");
        }
        logger.error("GhostProver-ext: 未能证明 {}", result);
        throw new ExtensionalityException("未能证明 " + result);
    }

    @Override
    public String toString() {
        return "GhostProver(" + engine.getOptions() + ")";
    }
}
