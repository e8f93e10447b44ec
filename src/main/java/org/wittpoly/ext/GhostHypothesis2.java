package org.wittpoly.ext;

import org.wittpoly.core.CommRing;
import org.wittpoly.core.CoefficientSequence;
import org.wittpoly.symbolic.GhostMap;
import org.wittpoly.witness.Representable2;

import java.util.Objects;

/**
 * 二元版本的 ghost 层证据，见 {@link GhostHypothesis}。
 */
public interface GhostHypothesis2 {

    <R> boolean holds(CommRing<R> ring, GhostMap ghostMap, CoefficientSequence<R> x, CoefficientSequence<R> y, int n);

    static GhostHypothesis2 byEvaluation(Representable2 f, Representable2 g) {
        Objects.requireNonNull(f, "GhostHypothesis2-byEvaluation: f 不能为 null");
        Objects.requireNonNull(g, "GhostHypothesis2-byEvaluation: g 不能为 null");
        return new GhostHypothesis2() {
            @Override
            public <R> boolean holds(CommRing<R> ring, GhostMap ghostMap, CoefficientSequence<R> x, CoefficientSequence<R> y, int n) {
                return ring.areEqual(
                        ghostMap.ghostComponent(ring, n, f.apply(ring, x, y)),
                        ghostMap.ghostComponent(ring, n, g.apply(ring, x, y)));
            }
        };
    }

    static GhostHypothesis2 byGhostExpressions(Representable2 f, GhostExpression2 lhs, Representable2 g, GhostExpression2 rhs) {
        Objects.requireNonNull(f, "GhostHypothesis2-byGhostExpressions: f 不能为 null");
        Objects.requireNonNull(lhs, "GhostHypothesis2-byGhostExpressions: lhs 不能为 null");
        Objects.requireNonNull(g, "GhostHypothesis2-byGhostExpressions: g 不能为 null");
        Objects.requireNonNull(rhs, "GhostHypothesis2-byGhostExpressions: rhs 不能为 null");
        return new GhostHypothesis2() {
            @Override
            public <R> boolean holds(CommRing<R> ring, GhostMap ghostMap, CoefficientSequence<R> x, CoefficientSequence<R> y, int n) {
                CoefficientSequence<R> ghostX = ghostMap.ghostSequence(ring, x);
                CoefficientSequence<R> ghostY = ghostMap.ghostSequence(ring, y);
                R left = lhs.evaluate(ring, ghostX::get, ghostY::get, n);
                R right = rhs.evaluate(ring, ghostX::get, ghostY::get, n);
                return ring.areEqual(left, right)
                        && ring.areEqual(ghostMap.ghostComponent(ring, n, f.apply(ring, x, y)), left)
                        && ring.areEqual(ghostMap.ghostComponent(ring, n, g.apply(ring, x, y)), right);
            }
        };
    }
}
