package org.wittpoly.witness;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 显式的见证注册表：按名字查找 "某个变换的见证"。
 * 不做全局隐式查找；找不到时返回空，由调用方决定如何处理。
 */
public final class WitnessRegistry {

    private static final Logger logger = LoggerFactory.getLogger(WitnessRegistry.class);

    private final ConcurrentHashMap<String, Representable> unary = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Representable2> binary = new ConcurrentHashMap<>();

    /**
     * 预先登记了全部基本见证的注册表。
     */
    public static WitnessRegistry withPrimitives(PrimitiveWitnesses primitives) {
        Objects.requireNonNull(primitives, "WitnessRegistry-withPrimitives: primitives 不能为 null");
        WitnessRegistry registry = new WitnessRegistry();
        registry.register(primitives.identity());
        registry.register(primitives.zero());
        registry.register(primitives.one());
        registry.register(primitives.negation());
        registry.register(primitives.frobenius());
        registry.register(primitives.verschiebung());
        registry.register(primitives.addition());
        registry.register(primitives.subtraction());
        registry.register(primitives.multiplication());
        return registry;
    }

    /**
     * 登记一元见证。同名覆盖并给出警告。
     */
    public WitnessRegistry register(Representable representable) {
        Objects.requireNonNull(representable, "WitnessRegistry-register: representable 不能为 null");
        Representable previous = unary.put(representable.getName(), representable);
        if (previous != null && previous != representable) {
            logger.warn("一元见证 {} 被覆盖", representable.getName());
        }
        logger.info("登记一元见证: {}", representable.getName());
        return this;
    }

    public WitnessRegistry register(Representable2 representable) {
        Objects.requireNonNull(representable, "WitnessRegistry-register: representable 不能为 null");
        Representable2 previous = binary.put(representable.getName(), representable);
        if (previous != null && previous != representable) {
            logger.warn("二元见证 {} 被覆盖", representable.getName());
        }
        logger.info("登记二元见证: {}", representable.getName());
        return this;
    }

    public Optional<Representable> witnessFor(String name) {
        return Optional.ofNullable(unary.get(name));
    }

    public Optional<Representable2> witnessFor2(String name) {
        return Optional.ofNullable(binary.get(name));
    }

    public Set<String> names() {
        Set<String> all = new TreeSet<>(unary.keySet());
        all.addAll(binary.keySet());
        return Collections.unmodifiableSet(all);
    }
}
