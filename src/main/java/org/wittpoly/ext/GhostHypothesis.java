package org.wittpoly.ext;

import org.wittpoly.core.CommRing;
import org.wittpoly.core.CoefficientSequence;
import org.wittpoly.symbolic.GhostMap;
import org.wittpoly.witness.Representable;

import java.util.Objects;

/**
 * 调用方提供的 ghost 层证据：对任意环 R 与任意 x，
 * ghostComponent(n, f(x)) = ghostComponent(n, g(x))。
 * 外延性引擎只在通用探针上调用它，因此实现必须对环泛型，不能依赖具体的环。
 */
public interface GhostHypothesis {

    <R> boolean holds(CommRing<R> ring, GhostMap ghostMap, CoefficientSequence<R> x, int n);

    /**
     * 直接比较两个变换输出的 ghost 分量。
     */
    static GhostHypothesis byEvaluation(Representable f, Representable g) {
        Objects.requireNonNull(f, "GhostHypothesis-byEvaluation: f 不能为 null");
        Objects.requireNonNull(g, "GhostHypothesis-byEvaluation: g 不能为 null");
        return new GhostHypothesis() {
            @Override
            public <R> boolean holds(CommRing<R> ring, GhostMap ghostMap, CoefficientSequence<R> x, int n) {
                return ring.areEqual(
                        ghostMap.ghostComponent(ring, n, f.apply(ring, x)),
                        ghostMap.ghostComponent(ring, n, g.apply(ring, x)));
            }
        };
    }

    /**
     * ghost 层的计算：W_n(f x) = lhs(W(x))_n，W_n(g x) = rhs(W(x))_n，且 lhs 与 rhs 相等。
     * 这是手工证明时的典型写法：先把两边都推到只含输入 ghost 分量的式子，再比较。
     */
    static GhostHypothesis byGhostExpressions(Representable f, GhostExpression lhs, Representable g, GhostExpression rhs) {
        Objects.requireNonNull(f, "GhostHypothesis-byGhostExpressions: f 不能为 null");
        Objects.requireNonNull(lhs, "GhostHypothesis-byGhostExpressions: lhs 不能为 null");
        Objects.requireNonNull(g, "GhostHypothesis-byGhostExpressions: g 不能为 null");
        Objects.requireNonNull(rhs, "GhostHypothesis-byGhostExpressions: rhs 不能为 null");
        return new GhostHypothesis() {
            @Override
            public <R> boolean holds(CommRing<R> ring, GhostMap ghostMap, CoefficientSequence<R> x, int n) {
                CoefficientSequence<R> ghostX = ghostMap.ghostSequence(ring, x);
                R left = lhs.evaluate(ring, ghostX::get, n);
                R right = rhs.evaluate(ring, ghostX::get, n);
                return ring.areEqual(left, right)
                        && ring.areEqual(ghostMap.ghostComponent(ring, n, f.apply(ring, x)), left)
                        && ring.areEqual(ghostMap.ghostComponent(ring, n, g.apply(ring, x)), right);
            }
        };
    }
}
