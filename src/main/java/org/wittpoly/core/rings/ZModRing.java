package org.wittpoly.core.rings;

import lombok.Getter;
import org.wittpoly.core.CommRing;
import org.wittpoly.core.RingHom;

import java.math.BigInteger;
import java.util.Objects;

/**
 * 剩余类环 ℤ/mℤ，元素用 [0, m) 中的代表元表示。
 * 当 m 是 p 的幂时 p 不可逆，这正是基变换不能直接使用的情形。
 */
@Getter
public final class ZModRing implements CommRing<BigInteger> {

    private final BigInteger modulus;

    private ZModRing(BigInteger modulus) {
        this.modulus = modulus;
    }

    /**
     * @throws IllegalArgumentException 如果 modulus < 2
     */
    public static ZModRing of(long modulus) {
        return of(BigInteger.valueOf(modulus));
    }

    public static ZModRing of(BigInteger modulus) {
        Objects.requireNonNull(modulus, "ZModRing-of: modulus 不能为 null");
        if (modulus.compareTo(BigInteger.TWO) < 0) {
            throw new IllegalArgumentException("ZModRing-of: 模数必须至少为 2: " + modulus);
        }
        return new ZModRing(modulus);
    }

    @Override
    public BigInteger zero() {
        return BigInteger.ZERO;
    }

    @Override
    public BigInteger one() {
        return BigInteger.ONE;
    }

    @Override
    public BigInteger add(BigInteger a, BigInteger b) {
        return a.add(b).mod(modulus);
    }

    @Override
    public BigInteger negate(BigInteger a) {
        return a.negate().mod(modulus);
    }

    @Override
    public BigInteger multiply(BigInteger a, BigInteger b) {
        return a.multiply(b).mod(modulus);
    }

    @Override
    public BigInteger fromInteger(BigInteger n) {
        return n.mod(modulus);
    }

    @Override
    public BigInteger pow(BigInteger base, int exponent) {
        if (exponent < 0) {
            throw new IllegalArgumentException("ZModRing-pow: 指数不能为负: " + exponent);
        }
        return base.modPow(BigInteger.valueOf(exponent), modulus);
    }

    /**
     * 约化同态 ℤ → ℤ/mℤ。
     */
    public RingHom<BigInteger, BigInteger> reduction() {
        ZModRing self = this;
        return new RingHom<>() {
            @Override
            public CommRing<BigInteger> domain() {
                return IntegerRing.INSTANCE;
            }

            @Override
            public CommRing<BigInteger> codomain() {
                return self;
            }

            @Override
            public BigInteger apply(BigInteger element) {
                return element.mod(modulus);
            }

            @Override
            public String toString() {
                return "ℤ → " + self.name();
            }
        };
    }

    @Override
    public String name() {
        return "ℤ/" + modulus + "ℤ";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return modulus.equals(((ZModRing) o).modulus);
    }

    @Override
    public int hashCode() {
        return modulus.hashCode();
    }

    @Override
    public String toString() {
        return name();
    }
}
