package org.wittpoly.ext;

import lombok.Getter;
import org.wittpoly.utils.Primes;

/**
 * 外延性引擎的配置。
 * 此类是不可变的，with 方法返回新实例。
 */
@Getter
public final class ExtensionalityOptions {

    public static final int DEFAULT_BOUND = 3;

    private final int prime;
    // 检查下标 0..bound
    private final int bound;
    private final boolean parallel;
    private final boolean verifyBasisChange;

    private ExtensionalityOptions(int prime, int bound, boolean parallel, boolean verifyBasisChange) {
        this.prime = Primes.requirePrime(prime);
        if (bound < 0) {
            throw new IllegalArgumentException("ExtensionalityOptions: bound 不能为负: " + bound);
        }
        this.bound = bound;
        this.parallel = parallel;
        this.verifyBasisChange = verifyBasisChange;
    }

    /**
     * 默认：检查下标 0..3，并行，重新验证基变换恒等式。
     */
    public static ExtensionalityOptions defaults(int prime) {
        return new ExtensionalityOptions(prime, DEFAULT_BOUND, true, true);
    }

    public ExtensionalityOptions withBound(int newBound) {
        return new ExtensionalityOptions(prime, newBound, parallel, verifyBasisChange);
    }

    public ExtensionalityOptions withParallel(boolean newParallel) {
        return new ExtensionalityOptions(prime, bound, newParallel, verifyBasisChange);
    }

    public ExtensionalityOptions withVerifyBasisChange(boolean newVerify) {
        return new ExtensionalityOptions(prime, bound, parallel, newVerify);
    }

    @Override
    public String toString() {
        return "ExtensionalityOptions{p=" + prime + ", bound=" + bound + ", parallel=" + parallel
                + ", verifyBasisChange=" + verifyBasisChange + "}";
    }
}
