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
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Computes Cantor normal forms over a given value domain.
 *
 * For a base {@code b > 1} and value {@code o != 0}, the leading term is
 * {@code (e, o / b^e)} with {@code e = log(b, o)}, followed by the normal form
 * of {@code o mod b^e}. Bases 0 and 1 can't support a positional expansion,
 * so there the whole value is a single "digit" {@code (0, o)}.
 *
 * Evaluating a normal form gives back the encoded value:
 * {@code evaluate(b, encode(b, o).entries()) == o}.
 */
public final class CnfEncoder<V> {

    public static final int DEFAULT_MAX_TERMS = Integer.MAX_VALUE;

    private final ValueArithmetic<V> arithmetic;
    private final int maxTerms;

    private CnfEncoder(ValueArithmetic<V> arithmetic, int maxTerms) {
        this.arithmetic = Objects.requireNonNull(arithmetic, "arithmetic");
        if (maxTerms < 0) {
            throw new IllegalArgumentException("negative maxTerms: " + maxTerms);
        }
        this.maxTerms = maxTerms;
    }

    /* ===============
     * factory methods
     * ===============
     */

    public static <V> CnfEncoder<V> of(ValueArithmetic<V> arithmetic) {
        return of(arithmetic, DEFAULT_MAX_TERMS);
    }

    /**
     * @param maxTerms upper bound on the number of terms, exceeding it means
     *        the arithmetic is broken and raises {@link IllegalStateException}
     */
    public static <V> CnfEncoder<V> of(ValueArithmetic<V> arithmetic, int maxTerms) {
        return new CnfEncoder<>(arithmetic, maxTerms);
    }

    public static CnfEncoder<BigInteger> natural() {
        return of(NaturalArithmetic.instance());
    }

    public static CnfEncoder<Long> ofLong() {
        return of(LongArithmetic.instance());
    }

    public ValueArithmetic<V> arithmetic() {
        return arithmetic;
    }

    public int maxTerms() {
        return maxTerms;
    }

    /* ========
     * encoding
     * ========
     */

    public Cnf<V> encode(V base, V value) {
        arithmetic.check(base);
        arithmetic.check(value);

        var entries = new ArrayList<CnfEntry<V>>();
        if (arithmetic.isZero(value)) {
            return new Cnf<>(arithmetic, base, value, entries);
        }
        if (arithmetic.isDegenerateBase(base)) {
            entries.add(CnfEntry.of(arithmetic.zero(), value));
        } else {
            CnfRecursion.unfold(arithmetic, base, value, maxTerms, (o, exponent, power) -> {
                var coefficient = arithmetic.divide(o, power);
                assert arithmetic.compare(coefficient, arithmetic.zero()) > 0;
                assert arithmetic.compare(coefficient, base) < 0;
                entries.add(CnfEntry.of(exponent, coefficient));
            });
        }
        return new Cnf<>(arithmetic, base, value, entries);
    }

    public CnfAssoc<V> assoc(V base, V value) {
        return encode(base, value).assoc();
    }

    public CnfCoeffMap<V> coefficients(V base, V value) {
        return encode(base, value).coefficients();
    }

    /**
     * Right fold of {@code (e, c), acc -> b^e * c + acc}, seeded at zero.
     * Accepts any list of terms, normal or not.
     */
    public V evaluate(V base, List<CnfEntry<V>> entries) {
        arithmetic.check(base);
        return evaluate(arithmetic, base, entries);
    }

    static <V> V evaluate(ValueArithmetic<V> arithmetic, V base, List<CnfEntry<V>> entries) {
        var result = arithmetic.zero();
        for (int i = entries.size() - 1; i >= 0; --i) {
            var entry = entries.get(i);
            var term = arithmetic.multiply(arithmetic.pow(base, entry.exponent()), entry.coefficient());
            result = arithmetic.add(term, result);
        }
        return result;
    }

    /* ==========
     * validation
     * ==========
     */

    public boolean isNormalForm(V base, List<CnfEntry<V>> entries) {
        arithmetic.check(base);
        return isNormalForm(arithmetic, base, entries);
    }

    static <V> boolean isNormalForm(ValueArithmetic<V> arithmetic, V base, List<CnfEntry<V>> entries) {
        var zero = arithmetic.zero();
        boolean degenerate = arithmetic.isDegenerateBase(base);
        if (degenerate && (entries.size() > 1
                || entries.size() == 1 && !arithmetic.isZero(entries.get(0).exponent()))) {
            return false;
        }

        CnfEntry<V> previous = null;
        for (var entry : entries) {
            if (arithmetic.compare(entry.coefficient(), zero) <= 0) {
                return false;
            }
            if (!degenerate && arithmetic.compare(entry.coefficient(), base) >= 0) {
                return false;
            }
            if (arithmetic.compare(entry.exponent(), zero) < 0) {
                return false;
            }
            if (previous != null && arithmetic.compare(previous.exponent(), entry.exponent()) <= 0) {
                return false;
            }
            previous = entry;
        }
        return true;
    }

    /**
     * Wraps an already normal list of terms.
     *
     * @throws IllegalArgumentException if the terms are not a normal form in this base
     */
    public Cnf<V> fromEntries(V base, List<CnfEntry<V>> entries) {
        arithmetic.check(base);
        var copy = List.copyOf(entries);
        for (var entry : copy) {
            arithmetic.check(entry.exponent());
            arithmetic.check(entry.coefficient());
        }
        if (!isNormalForm(arithmetic, base, copy)) {
            throw new IllegalArgumentException("Not a normal form in base " + arithmetic.format(base) + ": " + copy);
        }
        return new Cnf<>(arithmetic, base, evaluate(arithmetic, base, copy), copy);
    }
}
