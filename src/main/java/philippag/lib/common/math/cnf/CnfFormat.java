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
import java.util.Objects;

/**
 * Text form of normal forms: terms {@code b^e*c} joined by {@code " + "},
 * e.g. {@code "2^2*1 + 2^0*1"} for 5 in base 2. Zero is {@code "0"}.
 */
public class CnfFormat {

    private static final String ZERO = "0";
    private static final String SEPARATOR = " + ";

    public static <V> String format(Cnf<V> cnf) {
        var sb = new StringBuilder();
        format(sb, cnf);
        return sb.toString();
    }

    public static <V> void format(StringBuilder sb, Cnf<V> cnf) {
        if (cnf.isEmpty()) {
            sb.append(ZERO);
            return;
        }
        var arithmetic = cnf.arithmetic();
        var base = arithmetic.format(cnf.base());
        String sep = "";
        for (var entry : cnf.entries()) {
            sb.append(sep)
                .append(base)
                .append('^').append(arithmetic.format(entry.exponent()))
                .append('*').append(arithmetic.format(entry.coefficient()));
            sep = SEPARATOR;
        }
    }

    /**
     * Inverse of {@link #format(Cnf)}. Whitespace around terms and operators is ignored.
     *
     * @throws NumberFormatException if the text is malformed
     * @throws IllegalArgumentException if a term has another base, or the terms are not a normal form
     */
    public static <V> Cnf<V> parse(ValueArithmetic<V> arithmetic, V base, CharSequence str) {
        Objects.requireNonNull(str, "str");
        var encoder = CnfEncoder.of(arithmetic);
        var text = str.toString().trim();
        if (text.isEmpty()) {
            throw new NumberFormatException("No terms in input string");
        }

        var entries = new ArrayList<CnfEntry<V>>();
        if (!ZERO.equals(text)) {
            for (String term : text.split("\\+", -1)) {
                entries.add(parseTerm(arithmetic, base, term.trim()));
            }
        }
        return encoder.fromEntries(base, entries);
    }

    private static <V> CnfEntry<V> parseTerm(ValueArithmetic<V> arithmetic, V base, String term) {
        int caret = term.indexOf('^');
        int star = term.indexOf('*', caret + 1);
        if (caret <= 0 || star < 0) {
            throw new NumberFormatException("Malformed term: \"" + term + "\"");
        }
        var termBase = arithmetic.parse(term.substring(0, caret));
        if (arithmetic.compare(termBase, base) != 0) {
            throw new IllegalArgumentException("Term \"" + term + "\" is not in base " + arithmetic.format(base));
        }
        var exponent = arithmetic.parse(term.substring(caret + 1, star));
        var coefficient = arithmetic.parse(term.substring(star + 1));
        return CnfEntry.of(exponent, coefficient);
    }
}
