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

import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * The Cantor normal form of a value {@code o} in base {@code b}:
 * the sequence of terms {@code (e, c)} with
 * {@code o = b^e1 * c1 + b^e2 * c2 + ...}.
 *
 * Invariants:
 * - exponents are strictly decreasing
 * - every coefficient is greater than zero
 * - if b > 1, every coefficient is less than b
 * - the sequence is empty iff o == 0
 *
 * Instances are immutable and obtained from a {@link CnfEncoder}.
 */
public final class Cnf<V> {

    private final ValueArithmetic<V> arithmetic;
    private final V base;
    private final V value;
    private final List<CnfEntry<V>> entries;

    Cnf(ValueArithmetic<V> arithmetic, V base, V value, List<CnfEntry<V>> entries) {
        this.arithmetic = Objects.requireNonNull(arithmetic, "arithmetic");
        this.base = Objects.requireNonNull(base, "base");
        this.value = Objects.requireNonNull(value, "value");
        this.entries = Collections.unmodifiableList(entries);
        assert CnfEncoder.isNormalForm(arithmetic, base, entries);
        assert entries.isEmpty() == arithmetic.isZero(value);
    }

    ValueArithmetic<V> arithmetic() {
        return arithmetic;
    }

    public V base() {
        return base;
    }

    public V value() {
        return value;
    }

    public List<CnfEntry<V>> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public CnfEntry<V> get(int index) {
        return entries.get(index);
    }

    /**
     * For base > 1 this is {@code log(b, o)}.
     */
    public V leadingExponent() {
        return leadingEntry().exponent();
    }

    public V leadingCoefficient() {
        return leadingEntry().coefficient();
    }

    private CnfEntry<V> leadingEntry() {
        if (entries.isEmpty()) {
            throw new NoSuchElementException("Normal form of zero has no terms");
        }
        return entries.get(0);
    }

    public V evaluate() {
        return CnfEncoder.evaluate(arithmetic, base, entries);
    }

    public CnfAssoc<V> assoc() {
        return new CnfAssoc<>(this);
    }

    public CnfCoeffMap<V> coefficients() {
        return new CnfCoeffMap<>(this);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Cnf<?> o
                && base.equals(o.base)
                && entries.equals(o.entries);
    }

    @Override
    public int hashCode() {
        return 31 * base.hashCode() + entries.hashCode();
    }

    @Override
    public String toString() {
        return CnfFormat.format(this);
    }
}
