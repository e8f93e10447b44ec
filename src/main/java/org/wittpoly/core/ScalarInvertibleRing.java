package org.wittpoly.core;

import org.wittpoly.utils.Rational;

import java.math.BigInteger;

/**
 * 可以对整数标量求逆的环，因而可以嵌入有理常数。
 * 基变换公式的系数含有 p 的负幂，只能在这类环中求值：这是类型层面的前提，不是运行时检查。
 *
 * @param <R> 环元素的类型
 */
public interface ScalarInvertibleRing<R> extends CommRing<R> {

    /**
     * 整数 scalar 在环中的逆。
     * @throws ArithmeticException 如果 scalar 在该环中不可逆
     */
    R invert(BigInteger scalar);

    default R fromRational(Rational q) {
        R numerator = fromInteger(q.getNumerator());
        if (q.isInteger()) {
            return numerator;
        }
        return multiply(numerator, invert(q.getDenominator()));
    }
}
