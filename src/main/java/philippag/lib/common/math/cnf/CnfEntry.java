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
 * One term {@code b^exponent * coefficient} of a Cantor normal form.
 */
public final class CnfEntry<V> {

    private final V exponent;
    private final V coefficient;

    public CnfEntry(V exponent, V coefficient) {
        this.exponent = Objects.requireNonNull(exponent, "exponent");
        this.coefficient = Objects.requireNonNull(coefficient, "coefficient");
    }

    public static <V> CnfEntry<V> of(V exponent, V coefficient) {
        return new CnfEntry<>(exponent, coefficient);
    }

    public V exponent() {
        return exponent;
    }

    public V coefficient() {
        return coefficient;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof CnfEntry<?> o
                && exponent.equals(o.exponent)
                && coefficient.equals(o.coefficient);
    }

    @Override
    public int hashCode() {
        return 31 * exponent.hashCode() + coefficient.hashCode();
    }

    @Override
    public String toString() {
        return "(" + exponent + ", " + coefficient + ")";
    }
}
