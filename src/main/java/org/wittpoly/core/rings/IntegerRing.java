package org.wittpoly.core.rings;

import org.wittpoly.core.CommRing;

import java.math.BigInteger;

/**
 * 整数环 ℤ。
 */
public final class IntegerRing implements CommRing<BigInteger> {

    public static final IntegerRing INSTANCE = new IntegerRing();

    private IntegerRing() {
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
        return a.add(b);
    }

    @Override
    public BigInteger negate(BigInteger a) {
        return a.negate();
    }

    @Override
    public BigInteger multiply(BigInteger a, BigInteger b) {
        return a.multiply(b);
    }

    @Override
    public BigInteger fromInteger(BigInteger n) {
        return n;
    }

    @Override
    public BigInteger pow(BigInteger base, int exponent) {
        return base.pow(exponent);
    }

    @Override
    public String name() {
        return "ℤ";
    }

    @Override
    public String toString() {
        return name();
    }
}
