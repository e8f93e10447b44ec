package org.wittpoly.core.rings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wittpoly.core.ScalarInvertibleRing;
import org.wittpoly.utils.Rational;

import java.math.BigInteger;

/**
 * 有理数域 ℚ。每个素数都可逆，ghost 映射在这里是双射。
 */
public final class RationalField implements ScalarInvertibleRing<Rational> {

    private static final Logger logger = LoggerFactory.getLogger(RationalField.class);

    public static final RationalField INSTANCE = new RationalField();

    private RationalField() {
    }

    @Override
    public Rational zero() {
        return Rational.ZERO;
    }

    @Override
    public Rational one() {
        return Rational.ONE;
    }

    @Override
    public Rational add(Rational a, Rational b) {
        return a.add(b);
    }

    @Override
    public Rational negate(Rational a) {
        return a.negate();
    }

    @Override
    public Rational multiply(Rational a, Rational b) {
        return a.multiply(b);
    }

    @Override
    public Rational fromInteger(BigInteger n) {
        return Rational.valueOf(n);
    }

    @Override
    public Rational pow(Rational base, int exponent) {
        return base.pow(exponent);
    }

    @Override
    public Rational invert(BigInteger scalar) {
        if (scalar.signum() == 0) {
            logger.error("RationalField-invert: 0 不可逆");
            throw new ArithmeticException("ℚ 中 0 不可逆");
        }
        return Rational.valueOf(BigInteger.ONE, scalar);
    }

    @Override
    public Rational fromRational(Rational q) {
        return q;
    }

    @Override
    public String name() {
        return "ℚ";
    }

    @Override
    public String toString() {
        return name();
    }
}
