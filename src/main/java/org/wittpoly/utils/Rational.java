package org.wittpoly.utils;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 精确有理数，分子分母均为 BigInteger，始终保持约分且分母为正。
 * 作为多项式系数使用：公式族本身只含整数系数，基变换公式含 p 的幂作为分母。
 * 此类是不可变的。
 */
public final class Rational {
    private static final Logger logger = LoggerFactory.getLogger(Rational.class);
    private static final ConcurrentHashMap<List<BigInteger>, Rational> CACHE = new ConcurrentHashMap<>(256);

    @Getter
    private final BigInteger numerator;
    @Getter
    private final BigInteger denominator;

    private volatile int hash;

    // 常用常量
    public static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE); // 0/1
    public static final Rational ONE = new Rational(BigInteger.ONE, BigInteger.ONE);   // 1/1
    public static final Rational MINUS_ONE = new Rational(BigInteger.ONE.negate(), BigInteger.ONE);

    static {
        CACHE.put(ZERO.getCacheKey(), ZERO);
        CACHE.put(ONE.getCacheKey(), ONE);
        CACHE.put(MINUS_ONE.getCacheKey(), MINUS_ONE);
        for (int i = -16; i <= 16; i++) {
            if (i < -1 || i > 1) {
                Rational r = new Rational(BigInteger.valueOf(i), BigInteger.ONE);
                CACHE.put(r.getCacheKey(), r);
            }
        }
    }

    /**
     * 私有构造函数，调用方保证已经约分且分母为正。
     */
    private Rational(BigInteger numerator, BigInteger denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }


    // ========== 工厂方法 ==========

    public static Rational valueOf(BigInteger numerator) {
        return valueOf(numerator, BigInteger.ONE);
    }

    public static Rational valueOf(long numerator) {
        if (numerator == 0L) {
            return ZERO;
        }
        if (numerator == 1L) {
            return ONE;
        }
        return valueOf(BigInteger.valueOf(numerator), BigInteger.ONE);
    }

    public static Rational valueOf(long numerator, long denominator) {
        return valueOf(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    /**
     * 规范化并（在数值较小时）缓存。
     * @throws ArithmeticException 如果分母为 0
     */
    public static Rational valueOf(BigInteger numerator, BigInteger denominator) {
        Objects.requireNonNull(numerator, "Rational-valueOf: numerator 不能为 null");
        Objects.requireNonNull(denominator, "Rational-valueOf: denominator 不能为 null");

        // 1. 分母为0直接拒绝，多项式系数不允许无穷
        if (denominator.signum() == 0) {
            logger.error("Rational-valueOf: 分母为 0 ({} / {})", numerator, denominator);
            throw new ArithmeticException("Rational-valueOf: 分母为 0: " + numerator + "/0");
        }

        // 2. 分子为0的情况
        if (numerator.signum() == 0) {
            return ZERO;
        }

        // 3. 分母总是正数
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }

        // 4. 约分
        BigInteger commonDivisor = numerator.gcd(denominator);
        if (!commonDivisor.equals(BigInteger.ONE)) {
            numerator = numerator.divide(commonDivisor);
            denominator = denominator.divide(commonDivisor);
        }

        // 5. 统一处理缓存
        List<BigInteger> key = List.of(numerator, denominator);
        Rational cached = CACHE.get(key);
        if (cached != null) {
            return cached;
        }

        Rational result = new Rational(numerator, denominator);
        if (shouldCache(result)) {
            CACHE.putIfAbsent(key, result);
        }
        return result;
    }

    // ========== 基础运算 ==========
    public Rational add(Rational other) {
        if (this.isZero()) {
            return other;
        }
        if (other.isZero()) {
            return this;
        }
        if (this.isInteger() && other.isInteger()) {
            return valueOf(this.numerator.add(other.numerator));
        }
        BigInteger newNum = this.numerator.multiply(other.denominator).add(other.numerator.multiply(this.denominator));
        BigInteger newDen = this.denominator.multiply(other.denominator);
        return valueOf(newNum, newDen);
    }

    public Rational subtract(Rational other) {
        return this.add(other.negate());
    }

    public Rational multiply(Rational other) {
        if (this.isZero() || other.isZero()) {
            return ZERO;
        }
        if (this == ONE) {
            return other;
        }
        if (other == ONE) {
            return this;
        }
        return valueOf(this.numerator.multiply(other.numerator), this.denominator.multiply(other.denominator));
    }

    public Rational negate() {
        if (this.isZero()) {
            return ZERO;
        }
        return valueOf(this.numerator.negate(), this.denominator);
    }

    /**
     * 非负整数次幂。
     */
    public Rational pow(int exponent) {
        if (exponent < 0) {
            throw new IllegalArgumentException("Rational-pow: 指数不能为负: " + exponent);
        }
        if (exponent == 0) {
            return ONE;
        }
        return valueOf(this.numerator.pow(exponent), this.denominator.pow(exponent));
    }

    public Rational abs() {
        return this.numerator.signum() >= 0 ? this : this.negate();
    }

    // ========== 工具方法 ==========

    public boolean isZero() {
        return this.numerator.signum() == 0;
    }

    public boolean isOne() {
        return this == ONE || (this.numerator.equals(BigInteger.ONE) && this.denominator.equals(BigInteger.ONE));
    }

    public int signum() {
        return this.numerator.signum();
    }

    /**
     *  判断该rational是否是整数
     */
    public boolean isInteger() {
        return this.denominator.equals(BigInteger.ONE);
    }

    // ========== 对象基础方法 ==========

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Rational that)) {
            return false;
        }
        return this.numerator.equals(that.numerator) && this.denominator.equals(that.denominator);
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0) {
            h = Objects.hash(numerator, denominator);
            if (h == 0) {
                h = 1;
            }
            hash = h;
        }
        return h;
    }

    private List<BigInteger> getCacheKey() {
        return List.of(this.numerator, this.denominator);
    }

    /**
     * 只缓存位长较小的值，展开高次幂时产生的大系数不进缓存。
     */
    private static boolean shouldCache(Rational r) {
        return (r.numerator.abs().bitLength() + r.denominator.bitLength()) < 32;
    }

    @Override
    public String toString() {
        if (this.denominator.equals(BigInteger.ONE)) {
            return this.numerator.toString();
        }
        // 分数
        return this.numerator + "/" + this.denominator;
    }
}
