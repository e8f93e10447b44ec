package org.wittpoly.ext;

import org.wittpoly.core.CommRing;

import java.util.function.IntFunction;

/**
 * 两个输入的 ghost 层表达式，例如 "W_n(x) * W_n(y)"。
 */
public interface GhostExpression2 {

    <R> R evaluate(CommRing<R> ring, IntFunction<R> ghostX, IntFunction<R> ghostY, int n);
}
