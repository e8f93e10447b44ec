package org.wittpoly.symbolic;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wittpoly.utils.Primes;

import java.util.concurrent.ConcurrentHashMap;

/**
 * 某个素数 p 下的验证工具集合：ghost 映射与它的基变换逆。
 * 每个 p 只有一个实例，公式缓存因而在整个进程内共享。
 */
@Getter
public final class GhostOracle {

    private static final Logger logger = LoggerFactory.getLogger(GhostOracle.class);

    private static final ConcurrentHashMap<Integer, GhostOracle> INSTANCES = new ConcurrentHashMap<>();

    private final int prime;
    private final GhostMap ghostMap;
    private final BasisChange basisChange;

    private GhostOracle(int prime) {
        this.prime = prime;
        this.ghostMap = new GhostMap(prime);
        this.basisChange = new BasisChange(ghostMap);
        logger.info("初始化 GhostOracle, p = {}", prime);
    }

    /**
     * @throws IllegalArgumentException 如果 prime 不是素数
     */
    public static GhostOracle forPrime(int prime) {
        Primes.requirePrime(prime);
        return INSTANCES.computeIfAbsent(prime, GhostOracle::new);
    }

    @Override
    public String toString() {
        return "GhostOracle(p=" + prime + ")";
    }
}
