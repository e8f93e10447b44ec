package org.wittpoly.ext;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.wittpoly.expressions.Polynomial;

import java.util.Objects;
import java.util.Optional;

/**
 * 外延性引擎在单个下标 n 上的结论。
 * 此类是不可变的。
 */
@Getter
public final class IndexCertificate {

    public enum Outcome {
        /** φ(n) = ψ(n) 已由 ghost 证据推出 */
        PROVED,
        /** 调用方的 ghost 证据在探针上不成立 */
        HYPOTHESIS_REFUTED,
        /** 证据成立，但两个见证的 ghost 公式不同：某个变换与它的见证不一致 */
        WITNESS_MISMATCH,
        /** ghost 公式相同而反解出的公式不同 */
        FORMULA_MISMATCH,
        /** 反解结果与见证公式本身不符，基变换恒等式失效 */
        BASIS_CHANGE_FAILED
    }

    private final int index;
    private final Outcome outcome;
    // (bind(φ, Ψ_n), bind(ψ, Ψ_n))，证据被否定时为 null
    private final Pair<Polynomial, Polynomial> ghostFormulas;
    // 经基变换反解出的 (φ(n), ψ(n))
    private final Pair<Polynomial, Polynomial> formulas;

    IndexCertificate(int index, Outcome outcome, Pair<Polynomial, Polynomial> ghostFormulas, Pair<Polynomial, Polynomial> formulas) {
        this.index = index;
        this.outcome = Objects.requireNonNull(outcome, "IndexCertificate: outcome 不能为 null");
        this.ghostFormulas = ghostFormulas;
        this.formulas = formulas;
    }

    static IndexCertificate refuted(int index) {
        return new IndexCertificate(index, Outcome.HYPOTHESIS_REFUTED, null, null);
    }

    public boolean isProved() {
        return outcome == Outcome.PROVED;
    }

    public Optional<Pair<Polynomial, Polynomial>> ghosts() {
        return Optional.ofNullable(ghostFormulas);
    }

    public Optional<Pair<Polynomial, Polynomial>> reconstructed() {
        return Optional.ofNullable(formulas);
    }

    @Override
    public String toString() {
        return "n=" + index + ": " + outcome;
    }
}
