package org.wittpoly.ext;

import org.wittpoly.core.CommRing;

import java.util.function.IntFunction;

/**
 * 只用输入的 ghost 分量写出的 ghost 层表达式，例如 "W_n(x) + W_n(x)"。
 */
public interface GhostExpression {

    /**
     * @param ring 求值所在的环
     * @param ghost 输入的 ghost 分量 k ↦ W_k(x)
     * @param n 要计算的 ghost 下标
     */
    <R> R evaluate(CommRing<R> ring, IntFunction<R> ghost, int n);
}
