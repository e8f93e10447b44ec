package org.wittpoly.witness;

import org.wittpoly.core.CommRing;
import org.wittpoly.core.CoefficientSequence;

/**
 * 系数序列上的一元变换，对任意交换环一致地定义。
 */
public interface SequenceTransform {

    <R> CoefficientSequence<R> apply(CommRing<R> ring, CoefficientSequence<R> x);
}
