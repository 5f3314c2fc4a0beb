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

import java.util.Comparator;

/**
 * The value domain a Cantor normal form is computed over.
 *
 * Values must be totally ordered and well-founded (no infinite strictly
 * decreasing chains), which for the supplied implementations means natural
 * numbers. Implementations are stateless and values are never mutated.
 *
 * The contract the encoder relies on: for {@code o != 0},
 * {@code modulo(o, pow(b, log(b, o)))} is strictly smaller than {@code o}.
 */
public interface ValueArithmetic<V> extends Comparator<V> {

    V zero();

    V one();

    V add(V lhs, V rhs);

    V multiply(V lhs, V rhs);

    /**
     * {@code base^exponent}, with {@code x^0 == 1} for every x, including 0.
     */
    V pow(V base, V exponent);

    /**
     * Euclidean quotient.
     * @throws ArithmeticException if divisor is zero
     */
    V divide(V dividend, V divisor);

    /**
     * Euclidean remainder.
     * @throws ArithmeticException if divisor is zero
     */
    V modulo(V dividend, V divisor);

    /**
     * The greatest {@code e} with {@code base^e <= value}.
     * Defined as zero when value is zero or base is at most one.
     */
    V log(V base, V value);

    /**
     * Returns the value if it belongs to this domain.
     * @throws IllegalArgumentException otherwise
     */
    V check(V value);

    V fromLong(long value);

    /**
     * @throws NumberFormatException on malformed input
     */
    V parse(CharSequence str);

    default String format(V value) {
        return String.valueOf(value);
    }

    default boolean isZero(V value) {
        return compare(value, zero()) == 0;
    }

    // bases 0 and 1 can't carry a positional expansion
    default boolean isDegenerateBase(V base) {
        return compare(base, one()) <= 0;
    }
}
