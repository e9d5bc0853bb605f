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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.Test;

class WeightsTest {
    private static final long BIG = 1L << 53;

    @Test
    void adjacentLargeLongsDiffer() {
        assertEquals((double) BIG, (double) (BIG + 1));
        assertFalse(Weights.equal(BIG, BIG + 1));
        assertTrue(Weights.compare(BIG, BIG + 1) < 0);
        assertFalse(Weights.equal(BigInteger.valueOf(BIG + 1), (double) BIG));
        assertTrue(Weights.compare(BigInteger.valueOf(BIG + 1),
                                   (double) BIG) > 0);
    }

    @Test
    void equalValuesOfMixedTypes() {
        assertTrue(Weights.equal(3, 3L));
        assertTrue(Weights.equal(3L, 3.0));
        assertTrue(Weights.equal(new BigDecimal("3.000"), 3));
        assertTrue(Weights.equal(BigInteger.TEN, 10.0f));
        assertTrue(Weights.equal(new AtomicLong(7), 7));
        assertTrue(Weights.equal(0.0, -0.0));
        assertEquals(Weights.hash(new BigDecimal("3.000")), Weights.hash(3L));
        assertEquals(Weights.hash(3.0), Weights.hash(3));
    }

    @Test
    void decimalsAreNotRounded() {
        assertFalse(Weights.equal(0.1, new BigDecimal("0.1")));
        assertTrue(Weights.compare(new BigDecimal("0.3"),
                                   new BigDecimal("0.30000000000000001")) < 0);
    }

    @Test
    void infinitiesBoundEverything() {
        BigInteger huge = BigInteger.TEN.pow(400);
        assertTrue(Weights.compare(Double.POSITIVE_INFINITY, huge) > 0);
        assertTrue(Weights.compare(huge, Double.POSITIVE_INFINITY) < 0);
        assertTrue(Weights.compare(Double.NEGATIVE_INFINITY, Long.MIN_VALUE) < 0);
        assertTrue(Weights.equal(Double.POSITIVE_INFINITY,
                                 Float.POSITIVE_INFINITY));
    }

    @Test
    void orderSortsByValue() {
        List<Number> weights =
            new ArrayList<>(Arrays.asList(BIG + 1, 2.5, BIG, 1, BigInteger.ONE
                .shiftLeft(70)));
        weights.sort(Weights.ORDER);
        assertEquals(Arrays.asList(1, 2.5, BIG, BIG + 1,
                                   BigInteger.ONE.shiftLeft(70)),
                     weights);
    }

    @Test
    void nanIsNotAWeight() {
        assertFalse(Weights.isWeight(Double.NaN));
        assertFalse(Weights.isWeight(null));
        assertTrue(Weights.isWeight(Double.POSITIVE_INFINITY));
        assertThrows(IllegalArgumentException.class,
                     () -> Weights.compare(Double.NaN, 1));
        assertThrows(IllegalArgumentException.class,
                     () -> Weights.compare(Double.NaN, 1.0));
    }
}
