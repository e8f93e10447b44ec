package org.wittpoly.core.rings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wittpoly.core.CommRing;
import org.wittpoly.core.RingHom;
import org.wittpoly.core.ScalarInvertibleRing;
import org.wittpoly.expressions.Polynomial;
import org.wittpoly.expressions.Variable;
import org.wittpoly.utils.Rational;

import java.math.BigInteger;
import java.util.Objects;
import java.util.function.Function;

/**
 * 有理系数多项式环 ℚ[变量]。特征为 0，不同变量代数无关，
 * 是外延性引擎使用的通用探针环；非零整数在其中可逆，因此基变换公式可以直接求值。
 */
public final class PolynomialRing implements ScalarInvertibleRing<Polynomial> {

    private static final Logger logger = LoggerFactory.getLogger(PolynomialRing.class);

    public static final PolynomialRing INSTANCE = new PolynomialRing();

    private PolynomialRing() {
    }

    @Override
    public Polynomial zero() {
        return Polynomial.ZERO;
    }

    @Override
    public Polynomial one() {
        return Polynomial.ONE;
    }

    @Override
    public Polynomial add(Polynomial a, Polynomial b) {
        return a.add(b);
    }

    @Override
    public Polynomial negate(Polynomial a) {
        return a.negate();
    }

    @Override
    public Polynomial multiply(Polynomial a, Polynomial b) {
        return a.multiply(b);
    }

    @Override
    public Polynomial subtract(Polynomial a, Polynomial b) {
        return a.subtract(b);
    }

    @Override
    public Polynomial fromInteger(BigInteger n) {
        return Polynomial.constant(n);
    }

    @Override
    public Polynomial pow(Polynomial base, int exponent) {
        return base.pow(exponent);
    }

    @Override
    public Polynomial invert(BigInteger scalar) {
        if (scalar.signum() == 0) {
            logger.error("PolynomialRing-invert: 0 不可逆");
            throw new ArithmeticException("ℚ[X] 中 0 不可逆");
        }
        return Polynomial.constant(Rational.valueOf(BigInteger.ONE, scalar));
    }

    @Override
    public Polynomial fromRational(Rational q) {
        return Polynomial.constant(q);
    }

    /**
     * 求值同态 ℚ[X] → S，把变量 v 送到 assignment(v)。
     */
    public <S> RingHom<Polynomial, S> evaluationAt(ScalarInvertibleRing<S> target, Function<Variable, S> assignment) {
        Objects.requireNonNull(target, "PolynomialRing-evaluationAt: target 不能为 null");
        Objects.requireNonNull(assignment, "PolynomialRing-evaluationAt: assignment 不能为 null");
        PolynomialRing self = this;
        return new RingHom<>() {
            @Override
            public CommRing<Polynomial> domain() {
                return self;
            }

            @Override
            public CommRing<S> codomain() {
                return target;
            }

            @Override
            public S apply(Polynomial element) {
                return element.evaluate(target, assignment);
            }

            @Override
            public String toString() {
                return "eval: ℚ[X] → " + target.name();
            }
        };
    }

    /**
     * 变量改名诱导的同态 ℚ[X] → ℚ[X]。
     */
    public RingHom<Polynomial, Polynomial> renaming(Function<Variable, Variable> renaming) {
        Objects.requireNonNull(renaming, "PolynomialRing-renaming: renaming 不能为 null");
        PolynomialRing self = this;
        return new RingHom<>() {
            @Override
            public CommRing<Polynomial> domain() {
                return self;
            }

            @Override
            public CommRing<Polynomial> codomain() {
                return self;
            }

            @Override
            public Polynomial apply(Polynomial element) {
                return element.rename(renaming);
            }

            @Override
            public String toString() {
                return "rename: ℚ[X] → ℚ[X]";
            }
        };
    }

    @Override
    public String name() {
        return "ℚ[X]";
    }

    @Override
    public String toString() {
        return name();
    }
}
