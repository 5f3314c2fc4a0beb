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

import java.util.Objects;

/**
 * Natural numbers in the range of a non-negative long.
 * All operations are exact and throw {@link ArithmeticException} on overflow.
 */
public final class LongArithmetic implements ValueArithmetic<Long> {

    private static final LongArithmetic INSTANCE = new LongArithmetic();

    private static final Long ZERO = 0L;
    private static final Long ONE  = 1L;

    private LongArithmetic() {
    }

    public static LongArithmetic instance() {
        return INSTANCE;
    }

    @Override
    public int compare(Long lhs, Long rhs) {
        return Long.compare(lhs, rhs);
    }

    @Override
    public Long zero() {
        return ZERO;
    }

    @Override
    public Long one() {
        return ONE;
    }

    @Override
    public Long add(Long lhs, Long rhs) {
        return Math.addExact(lhs, rhs);
    }

    @Override
    public Long multiply(Long lhs, Long rhs) {
        return Math.multiplyExact(lhs, rhs);
    }

    @Override
    public Long pow(Long base, Long exponent) {
        return powExact(base, exponent);
    }

    static long powExact(long base, long exponent) {
        assert base >= 0 && exponent >= 0;
        if (exponent == 0 || base == 1) {
            return 1;
        }
        if (base == 0) {
            return 0;
        }

        long result = 1;
        while (true) {
            if ((exponent & 1) != 0) {
                result = Math.multiplyExact(result, base);
            }
            exponent >>= 1;
            if (exponent == 0) {
                return result;
            }
            base = Math.multiplyExact(base, base); // square, only when still needed
        }
    }

    @Override
    public Long divide(Long dividend, Long divisor) {
        if (divisor == 0) {
            throw new ArithmeticException("Division by zero");
        }
        return dividend / divisor;
    }

    @Override
    public Long modulo(Long dividend, Long divisor) {
        if (divisor == 0) {
            throw new ArithmeticException("Division by zero");
        }
        return dividend % divisor;
    }

    @Override
    public Long log(Long base, Long value) {
        return floorLog(base, value);
    }

    static long floorLog(long base, long value) {
        if (value == 0 || base <= 1) {
            return 0;
        }
        long e = 0;
        // power * base <= value, without overflow
        for (long power = 1, limit = value / base; power <= limit; power *= base) {
            e++;
        }
        return e;
    }

    @Override
    public Long check(Long value) {
        Objects.requireNonNull(value, "value");
        if (value < 0) {
            throw new IllegalArgumentException("Negative value: " + value);
        }
        return value;
    }

    @Override
    public Long fromLong(long value) {
        return check(value);
    }

    @Override
    public Long parse(CharSequence str) {
        long value = Long.parseLong(str.toString().trim());
        if (value < 0) {
            throw new NumberFormatException("Negative value: " + str);
        }
        return value;
    }
}
