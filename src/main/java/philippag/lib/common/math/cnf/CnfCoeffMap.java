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

import java.util.ArrayList;
import java.util.Collections;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * The coefficients of a normal form as a total function on exponents.
 *
 * Exponents not present in the normal form map to zero, so the function is
 * finitely supported: its support is exactly the exponent set of the normal form.
 */
public final class CnfCoeffMap<V> implements Function<V, V> {

    private final ValueArithmetic<V> arithmetic;
    private final V base;
    private final NavigableMap<V, V> coefficients;

    CnfCoeffMap(Cnf<V> cnf) {
        this.arithmetic = cnf.arithmetic();
        this.base = cnf.base();
        var map = new TreeMap<V, V>(arithmetic.reversed());
        for (var entry : cnf.entries()) {
            var previous = map.put(entry.exponent(), entry.coefficient());
            assert previous == null : "duplicate exponent " + entry.exponent();
        }
        this.coefficients = Collections.unmodifiableNavigableMap(map);
    }

    public V base() {
        return base;
    }

    public V get(V exponent) {
        var coefficient = coefficients.get(exponent);
        return coefficient == null ? arithmetic.zero() : coefficient;
    }

    @Override
    public V apply(V exponent) {
        return get(exponent);
    }

    /**
     * The exponents with non-zero coefficient, in decreasing order.
     */
    public NavigableSet<V> support() {
        return coefficients.navigableKeySet();
    }

    public boolean isZero() {
        return coefficients.isEmpty();
    }

    /**
     * Sum of {@code b^e * get(e)} over the support.
     */
    public V evaluate() {
        var result = arithmetic.zero();
        for (var entry : coefficients.entrySet()) {
            result = arithmetic.add(result, arithmetic.multiply(arithmetic.pow(base, entry.getKey()), entry.getValue()));
        }
        return result;
    }

    public Cnf<V> toCnf() {
        var entries = new ArrayList<CnfEntry<V>>(coefficients.size());
        coefficients.forEach((exponent, coefficient) -> entries.add(CnfEntry.of(exponent, coefficient)));
        return new Cnf<>(arithmetic, base, evaluate(), entries);
    }

    @Override
    public String toString() {
        var sb = new StringBuilder();
        sb.append("{");
        String sep = "";
        for (var entry : coefficients.entrySet()) {
            sb.append(sep).append(arithmetic.format(entry.getKey())).append('=').append(arithmetic.format(entry.getValue()));
            sep = ", ";
        }
        sb.append("}");
        return sb.toString();
    }
}
