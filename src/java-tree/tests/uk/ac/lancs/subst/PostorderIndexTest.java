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
import static uk.ac.lancs.subst.Fixtures.e;

import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PostorderIndexTest {
    private PostorderIndex<Integer> index;

    @BeforeEach
    void rankExampleTree() {
        index = PostorderIndex.traverse(Fixtures.exampleTree(), 1);
    }

    @Test
    void ranksFollowPostorder() {
        assertEquals(Arrays.asList(5, 6, 4, 2, 3, 1), index.order());
        assertEquals(1, index.rank(5));
        assertEquals(3, index.rank(4));
        assertEquals(6, index.rank(1));
        assertEquals(4, index.vertexAt(3));
        assertEquals(1, index.root());
        assertThrows(NoSuchElementException.class, () -> index.rank(9));
    }

    @Test
    void descendantsAreContiguousRanks() {
        BitSet expected = new BitSet();
        expected.set(1, 4);
        assertEquals(expected, index.descendants(4));
        assertEquals(1, index.lowest(4));
        assertEquals(3, index.highest(4));
        assertEquals(1, index.lowest(2));
        assertEquals(4, index.highest(2));
        assertEquals(5, index.lowest(3));
        assertEquals(5, index.highest(3));
        assertEquals(6, index.descendants(1).cardinality());

        assertTrue(index.isDescendant(4, index.rank(6)));
        assertTrue(index.isDescendant(4, index.rank(4)));
        assertFalse(index.isDescendant(4, index.rank(2)));
        assertFalse(index.isDescendant(4, 0));
    }

    @Test
    void descendantsAreCopied() {
        index.descendants(4).clear();
        assertEquals(3, index.descendants(4).cardinality());
    }

    @Test
    void childrenAndParents() {
        assertEquals(Arrays.asList(5, 6), index.children(4));
        assertEquals(Collections.emptyList(), index.children(5));
        assertEquals(Arrays.asList(4), index.parents(5));
        assertEquals(Arrays.asList(1), index.parents(3));
        assertTrue(index.parents(1).isEmpty());
    }

    @Test
    void linksOrderedByChildRank() {
        List<String> links = index.links().stream()
            .map(l -> l.child + "->" + l.parent).collect(Collectors.toList());
        assertEquals(Arrays.asList("5->4", "6->4", "4->2", "2->1", "3->1"),
                     links);

        PostorderIndex.Link<Integer> first = index.links().get(0);
        assertEquals(1L, first.weight);
        assertEquals(e(4, 5), first.edge());
        assertEquals(3L, index.links().get(1).weight);
    }

    @Test
    void trustedOrderIsTakenAsGiven() {
        Map<Edge<Integer>, Number> links = new LinkedHashMap<>();
        links.put(e(1, 2), 1.0);
        links.put(e(2, 3), 1.0);
        links.put(e(3, 4), 1.0);
        PostorderIndex<Integer> trusted =
            PostorderIndex.trust(MapGraph.of(Arrays.asList(4, 3, 2, 1), links));
        assertEquals(Arrays.asList(4, 3, 2, 1), trusted.order());
        assertEquals(1, trusted.root());
        assertEquals(Arrays.asList(3), trusted.children(2));
        assertEquals(3, trusted.links().size());
        assertEquals(4, trusted.links().get(0).child);
    }
}
