/*
MIT License

Copyright (c) 2024 Philipp Grasboeck

Permission is hereby granted, free of charge, to any person obtaining a copy
of this software and associated documentation files (the "Software"), to deal
in the Software without restriction, including without limitation the rights
to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
copies of the Software, and to permit persons to whom the Software is
furnished to do so, subject to the following conditions:

The above copyright notice and this permission notice shall be included in all
copies or substantial portions of the Software.

THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
SOFTWARE.
*/

package philippag.lib.common.math.cnf;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Unbounded natural numbers backed by {@link BigInteger}.
 *
 * Exponents are values of the same domain, but {@link #pow(BigInteger, BigInteger)}
 * only accepts exponents that fit an int, which is no practical restriction:
 * the result would not fit into memory otherwise.
 */
public final class NaturalArithmetic implements ValueArithmetic<BigInteger> {

    private static final NaturalArithmetic INSTANCE = new NaturalArithmetic();

    private static final double LN2 = Math.log(2);
    private static final int DOUBLE_PRECISION = 53;

    private NaturalArithmetic() {
    }

    public static NaturalArithmetic instance() {
        return INSTANCE;
    }

    @Override
    public int compare(BigInteger lhs, BigInteger rhs) {
        return lhs.compareTo(rhs);
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
    public BigInteger add(BigInteger lhs, BigInteger rhs) {
        return lhs.add(rhs);
    }

    @Override
    public BigInteger multiply(BigInteger lhs, BigInteger rhs) {
        return lhs.multiply(rhs);
    }

    @Override
    public BigInteger pow(BigInteger base, BigInteger exponent) {
        return base.pow(exponent.intValueExact());
    }

    @Override
    public BigInteger divide(BigInteger dividend, BigInteger divisor) {
        if (divisor.signum() == 0) {
            throw new ArithmeticException("Division by zero");
        }
        return dividend.divide(divisor);
    }

    @Override
    public BigInteger modulo(BigInteger dividend, BigInteger divisor) {
        if (divisor.signum() == 0) {
            throw new ArithmeticException("Division by zero");
        }
        return dividend.mod(divisor);
    }

    @Override
    public BigInteger log(BigInteger base, BigInteger value) {
        if (value.signum() == 0 || base.compareTo(BigInteger.ONE) <= 0) {
            return BigInteger.ZERO;
        }
        if (value.compareTo(base) < 0) {
            return BigInteger.ZERO;
        }
        if (base.bitCount() == 1) { // power of two: exact from the bit length
            return BigInteger.valueOf((value.bitLength() - 1) / (base.bitLength() - 1));
        }

        int e = Math.max(0, (int) Math.floor(log2(value) / log2(base)));
        var power = base.pow(e);

        // the estimate is off by at most one or two
        while (power.compareTo(value) > 0) {
            power = power.divide(base);
            e--;
        }
        for (var next = power.multiply(base); next.compareTo(value) <= 0; next = next.multiply(base)) {
            power = next;
            e++;
        }

        assert e >= 0;
        return BigInteger.valueOf(e);
    }

    private static double log2(BigInteger value) {
        assert value.signum() > 0;
        int shift = Math.max(0, value.bitLength() - DOUBLE_PRECISION);
        return shift + Math.log(value.shiftRight(shift).doubleValue()) / LN2;
    }

    @Override
    public BigInteger check(BigInteger value) {
        Objects.requireNonNull(value, "value");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Negative value: " + value);
        }
        return value;
    }

    @Override
    public BigInteger fromLong(long value) {
        return check(BigInteger.valueOf(value));
    }

    @Override
    public BigInteger parse(CharSequence str) {
        var value = new BigInteger(str.toString().trim());
        if (value.signum() < 0) {
            throw new NumberFormatException("Negative value: " + str);
        }
        return value;
    }
}
