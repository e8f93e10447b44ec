package org.wittpoly.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

/**
 * 素数参数的校验与 p 的幂运算。
 */
public final class Primes {

    private static final Logger logger = LoggerFactory.getLogger(Primes.class);

    private Primes() {
    }

    /**
     * @throws IllegalArgumentException 如果 p 不是素数
     */
    public static int requirePrime(int p) {
        if (p < 2 || !BigInteger.valueOf(p).isProbablePrime(64)) {
            logger.error("Primes-requirePrime: {} 不是素数", p);
            throw new IllegalArgumentException("参数必须是素数: " + p);
        }
        return p;
    }

    /**
     * p^k，溢出 int 时抛出 ArithmeticException。ghost 多项式的指数用这个计算。
     */
    public static int exactPower(int p, int k) {
        if (k < 0) {
            throw new IllegalArgumentException("Primes-exactPower: 指数不能为负: " + k);
        }
        int result = 1;
        for (int i = 0; i < k; i++) {
            result = Math.multiplyExact(result, p);
        }
        return result;
    }
}
