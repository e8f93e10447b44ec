package org.wittpoly.core;

import java.math.BigInteger;
import java.util.Objects;

/**
 * 交换环的能力对象。系数序列上的变换对任意环都泛型，通过该接口获得环运算。
 * 实现类必须满足交换环公理，本库不做运行时检查。
 *
 * @param <R> 环元素的类型
 */
public interface CommRing<R> {

    R zero();

    R one();

    R add(R a, R b);

    R negate(R a);

    R multiply(R a, R b);

    default R subtract(R a, R b) {
        return add(a, negate(b));
    }

    /**
     * 整数 n 在环中的像，即 n 个 1 之和。默认用倍加法实现。
     */
    default R fromInteger(BigInteger n) {
        Objects.requireNonNull(n, "CommRing-fromInteger: n 不能为 null");
        R result = zero();
        R base = one();
        BigInteger k = n.abs();
        while (k.signum() > 0) {
            if (k.testBit(0)) {
                result = add(result, base);
            }
            base = add(base, base);
            k = k.shiftRight(1);
        }
        return n.signum() < 0 ? negate(result) : result;
    }

    default R fromInteger(long n) {
        return fromInteger(BigInteger.valueOf(n));
    }

    /**
     * 非负整数次幂，平方乘算法。
     */
    default R pow(R base, int exponent) {
        if (exponent < 0) {
            throw new IllegalArgumentException("CommRing-pow: 指数不能为负: " + exponent);
        }
        R result = one();
        R b = base;
        int e = exponent;
        while (e > 0) {
            if ((e & 1) == 1) {
                result = multiply(result, b);
            }
            e >>= 1;
            if (e > 0) {
                b = multiply(b, b);
            }
        }
        return result;
    }

    default boolean areEqual(R a, R b) {
        return Objects.equals(a, b);
    }

    String name();
}
