package org.wittpoly.ext;

import lombok.Getter;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 一次 ext 调用的结果：两个见证在下标 0..bound 上是否被证明相等，以及逐下标的证书。
 * 此类是不可变的。
 */
@Getter
public final class WitnessEquality {

    private final String left;
    private final String right;
    private final int prime;
    private final int bound;
    private final List<IndexCertificate> certificates;

    WitnessEquality(String left, String right, int prime, int bound, List<IndexCertificate> certificates) {
        this.left = left;
        this.right = right;
        this.prime = prime;
        this.bound = bound;
        this.certificates = certificates.stream()
                .sorted(Comparator.comparingInt(IndexCertificate::getIndex))
                .collect(Collectors.collectingAndThen(Collectors.toList(), Collections::unmodifiableList));
    }

    public boolean isProved() {
        return certificates.stream().allMatch(IndexCertificate::isProved);
    }

    public List<IndexCertificate> failures() {
        return certificates.stream().filter(c -> !c.isProved()).collect(Collectors.toList());
    }

    public IndexCertificate certificate(int n) {
        if (n < 0 || n > bound) {
            throw new IllegalArgumentException("WitnessEquality-certificate: 下标超出范围 0.." + bound + ": " + n);
        }
        return certificates.get(n);
    }

    @Override
    public String toString() {
        return left + " = " + right + " (p=" + prime + ", n ≤ " + bound + "): "
                + (isProved() ? "PROVED" : "FAILED " + failures());
    }
}
