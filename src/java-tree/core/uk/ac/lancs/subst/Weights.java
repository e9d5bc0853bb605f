/*
 * Copyright 2017, Regents of the University of Lancaster
 * All rights reserved.
 * 
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are
 * met:
 * 
 *  * Redistributions of source code must retain the above copyright
 *    notice, this list of conditions and the following disclaimer.
 * 
 *  * Redistributions in binary form must reproduce the above copyright
 *    notice, this list of conditions and the following disclaimer in the
 *    documentation and/or other materials provided with the
 *    distribution.
 * 
 *  * Neither the name of the University of Lancaster nor the names of
 *    its contributors may be used to endorse or promote products derived
 *    from this software without specific prior written permission.
 * 
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS
 * "AS IS" AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT
 * LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR
 * A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT
 * OWNER OR CONTRIBUTORS BE LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL,
 * SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT
 * LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE,
 * DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY
 * THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
 * OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 *
 *
 * Author: Steven Simpson <s.simpson@lancaster.ac.uk>
 */
package uk.ac.lancs.subst;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Comparator;

/**
 * Compares edge weights exactly, whatever their numeric type. Weights
 * are not narrowed to {@code double}, so large integral weights that
 * differ are never taken as equal.
 *
 * @author simpsons
 */
public final class Weights {
    private Weights() {}

    /**
     * Orders weights by numeric value, so that {@code 1}, {@code 1L}
     * and {@code 1.0} compare equal.
     */
    public static final Comparator<Number> ORDER = Weights::compare;

    /**
     * Compare two weights by numeric value.
     *
     * @param a one weight
     *
     * @param b another weight
     *
     * @return negative if the first is lighter, positive if heavier, or
     * zero if they are equal
     *
     * @throws IllegalArgumentException if either weight is NaN
     */
    public static int compare(Number a, Number b) {
        if (isIntegral(a) && isIntegral(b))
            return Long.compare(a.longValue(), b.longValue());
        if (isFloating(a) && isFloating(b)) {
            final double x = a.doubleValue(), y = b.doubleValue();
            if (Double.isNaN(x) || Double.isNaN(y))
                throw new IllegalArgumentException("NaN weight");
            return x == y ? 0 : Double.compare(x, y);
        }
        final boolean ainf = isInfinite(a), binf = isInfinite(b);
        if (ainf || binf) {
            if (ainf && binf)
                return Double.compare(a.doubleValue(), b.doubleValue());
            if (ainf) return a.doubleValue() > 0.0 ? +1 : -1;
            return b.doubleValue() > 0.0 ? -1 : +1;
        }
        return exact(a).compareTo(exact(b));
    }

    /**
     * Determine whether two weights have the same numeric value.
     *
     * @param a one weight
     *
     * @param b another weight
     *
     * @return {@code true} if the weights are equal
     */
    public static boolean equal(Number a, Number b) {
        return compare(a, b) == 0;
    }

    /**
     * Compute a hash code consistent with {@link #equal(Number, Number)}.
     *
     * @param w the weight
     *
     * @return the hash code
     */
    public static int hash(Number w) {
        if (isInfinite(w)) return Double.hashCode(w.doubleValue());
        return exact(w).stripTrailingZeros().hashCode();
    }

    /**
     * Determine whether a value can serve as a weight.
     *
     * @param w the candidate weight, possibly {@code null}
     *
     * @return {@code false} if the value is {@code null} or NaN
     */
    public static boolean isWeight(Number w) {
        if (w == null) return false;
        if (isFloating(w))
            return !Double.isNaN(w.doubleValue());
        return true;
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Long || n instanceof Integer
            || n instanceof Short || n instanceof Byte;
    }

    private static boolean isFloating(Number n) {
        return n instanceof Double || n instanceof Float;
    }

    private static boolean isInfinite(Number n) {
        return isFloating(n) && Double.isInfinite(n.doubleValue());
    }

    private static BigDecimal exact(Number n) {
        if (n instanceof BigDecimal) return (BigDecimal) n;
        if (n instanceof BigInteger) return new BigDecimal((BigInteger) n);
        if (isIntegral(n)) return BigDecimal.valueOf(n.longValue());
        if (isFloating(n)) {
            double d = n.doubleValue();
            if (Double.isNaN(d))
                throw new IllegalArgumentException("NaN weight");
            return new BigDecimal(d);
        }
        /* Other types, such as AtomicLong, print their exact value. */
        return new BigDecimal(n.toString());
    }
}
