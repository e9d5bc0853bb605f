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
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.NoSuchElementException;
import java.util.Set;

import org.junit.jupiter.api.Test;

class EdgeTest {

    @Test
    void orientationDoesNotMatter() {
        Edge<String> ab = Edge.of("A", "B");
        Edge<String> ba = Edge.of("B", "A");
        assertEquals(ab, ba);
        assertEquals(ab.hashCode(), ba.hashCode());
        assertEquals(ab.first(), ba.first());

        Set<Edge<String>> set = new HashSet<>();
        set.add(ab);
        assertTrue(set.contains(ba));
    }

    @Test
    void collidingHashCodesStillCompareEqual() {
        /* "Aa" and "BB" share a hash code. */
        assertEquals("Aa".hashCode(), "BB".hashCode());
        Edge<String> one = Edge.of("Aa", "BB");
        Edge<String> two = Edge.of("BB", "Aa");
        assertEquals(one, two);
        assertEquals(one.hashCode(), two.hashCode());
        assertNotEquals(one, Edge.of("Aa", "Aa"));
    }

    @Test
    void otherEndAndLoops() {
        Edge<Integer> edge = Edge.of(3, 7);
        assertEquals(7, edge.other(3));
        assertEquals(3, edge.other(7));
        assertThrows(IllegalArgumentException.class, () -> edge.other(5));
        assertFalse(edge.isLoop());
        assertTrue(Edge.of(4, 4).isLoop());
    }

    @Test
    void listView() {
        Edge<Integer> edge = Edge.of(9, 2);
        assertEquals(2, edge.size());
        assertEquals(2, edge.get(0));
        assertEquals(9, edge.get(1));
        assertThrows(NoSuchElementException.class, () -> edge.get(2));
        assertEquals("<2,9>", edge.toString());
    }

    @Test
    void nullVerticesRejected() {
        assertThrows(NullPointerException.class, () -> Edge.of(null, "A"));
        assertThrows(NullPointerException.class, () -> Edge.of("A", null));
    }
}
