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
 * Recursion over a value by splitting off its leading base-b term.
 *
 * A non-zero value {@code o} is decomposed into its leading power
 * {@code p = b^log(b, o)} and the remainder {@code o mod p}, which is strictly
 * smaller than {@code o}. As the value domain is well-founded, repeating this
 * reaches zero after finitely many steps.
 *
 * The recursion runs as a loop, so the stack depth doesn't grow with the
 * number of terms. Each step verifies that the remainder decreased: an
 * arithmetic implementation violating this would loop forever otherwise.
 */
public final class CnfRecursion {

    private CnfRecursion() {
    }

    /**
     * Receives each non-zero value of the chain {@code o, o mod b^log(b, o), ...}
     * together with its leading exponent and leading power.
     */
    public interface TermVisitor<V> {

        void visit(V value, V exponent, V power);
    }

    /**
     * Computes the result for {@code value} from the result for its remainder.
     */
    public interface Step<V, C> {

        C apply(V value, C remainderResult);
    }

    /**
     * Visits the chain of remainders of {@code value}, largest first,
     * stopping at zero (which is not visited).
     *
     * @return the number of visited terms
     * @throws IllegalStateException if a remainder is not smaller than its value,
     *         or more than {@code maxTerms} terms are produced
     */
    public static <V> int unfold(ValueArithmetic<V> arithmetic, V base, V value, int maxTerms, TermVisitor<V> visitor) {
        Objects.requireNonNull(arithmetic, "arithmetic");
        Objects.requireNonNull(visitor, "visitor");
        if (maxTerms < 0) {
            throw new IllegalArgumentException("negative maxTerms: " + maxTerms);
        }

        int terms = 0;
        var o = value;
        while (!arithmetic.isZero(o)) {
            if (terms == maxTerms) {
                throw new IllegalStateException("Term limit exceeded: " + maxTerms + " terms for base " + base);
            }
            var exponent = arithmetic.log(base, o);
            var power = arithmetic.pow(base, exponent);
            visitor.visit(o, exponent, power);
            terms++;

            var remainder = arithmetic.modulo(o, power);
            if (arithmetic.compare(remainder, o) >= 0) {
                throw new IllegalStateException("Remainder did not decrease: " + o + " mod " + power + " = " + remainder);
            }
            o = remainder;
        }
        return terms;
    }

    /**
     * The recursion principle: {@code C(0) = zeroResult} and
     * {@code C(o) = step(o, C(o mod b^log(b, o)))} for non-zero {@code o}.
     */
    public static <V, C> C recurse(ValueArithmetic<V> arithmetic, V base, V value, C zeroResult, Step<V, C> step) {
        return recurse(arithmetic, base, value, Integer.MAX_VALUE, zeroResult, step);
    }

    public static <V, C> C recurse(ValueArithmetic<V> arithmetic, V base, V value, int maxTerms, C zeroResult, Step<V, C> step) {
        Objects.requireNonNull(step, "step");
        var chain = new ArrayList<V>();
        unfold(arithmetic, base, value, maxTerms, (o, exponent, power) -> chain.add(o));

        var result = zeroResult;
        for (int i = chain.size() - 1; i >= 0; --i) {
            result = step.apply(chain.get(i), result);
        }
        return result;
    }
}
