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
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * A normal form viewed as an association list {@code exponent -> coefficient}.
 *
 * Keys are unique without any deduplication: the exponents of a normal form
 * are strictly decreasing. Lookups binary search the exponents.
 */
public final class CnfAssoc<V> {

    private final Cnf<V> cnf;
    private final List<V> exponents;
    private final List<V> coefficients;
    private final Comparator<V> descending;

    CnfAssoc(Cnf<V> cnf) {
        this.cnf = cnf;
        int size = cnf.size();
        var exponents = new ArrayList<V>(size);
        var coefficients = new ArrayList<V>(size);
        for (var entry : cnf.entries()) {
            exponents.add(entry.exponent());
            coefficients.add(entry.coefficient());
        }
        this.exponents = Collections.unmodifiableList(exponents);
        this.coefficients = coefficients;
        this.descending = cnf.arithmetic().reversed();
        assert strictlyDecreasing();
    }

    private boolean strictlyDecreasing() {
        for (int i = 1; i < exponents.size(); i++) {
            if (descending.compare(exponents.get(i - 1), exponents.get(i)) >= 0) {
                return false;
            }
        }
        return true;
    }

    public V base() {
        return cnf.base();
    }

    public V value() {
        return cnf.value();
    }

    // true iff the value is zero
    public boolean isEmpty() {
        return exponents.isEmpty();
    }

    public int size() {
        return exponents.size();
    }

    public boolean containsExponent(V exponent) {
        return indexOf(exponent) >= 0;
    }

    public Optional<V> lookup(V exponent) {
        int index = indexOf(exponent);
        return index >= 0 ? Optional.of(coefficients.get(index)) : Optional.empty();
    }

    private int indexOf(V exponent) {
        return Collections.binarySearch(exponents, exponent, descending);
    }

    /**
     * Exponents in decreasing order.
     */
    public List<V> exponents() {
        return exponents;
    }

    public List<CnfEntry<V>> entries() {
        return cnf.entries();
    }

    @Override
    public String toString() {
        return cnf.entries().toString();
    }
}
