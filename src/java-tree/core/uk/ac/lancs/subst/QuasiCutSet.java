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

import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Holds candidate substitute edges ordered by weight, then source, then
 * target. Ascending order ensures that the lightest admissible
 * candidate is encountered first.
 *
 * @param <V> the vertex type
 *
 * @author simpsons
 */
public final class QuasiCutSet<V> implements Iterable<QuasiCutEntry<V>> {
    private final NavigableSet<QuasiCutEntry<V>> entries;

    /**
     * Create an empty set.
     *
     * @param vertexOrder the order of vertices, used to break ties
     * between candidates of equal weight
     */
    public QuasiCutSet(Comparator<? super V> vertexOrder) {
        Objects.requireNonNull(vertexOrder, "vertexOrder");
        /* Null vertices only appear in probes, and sort before all
         * real ones. */
        Comparator<V> vo = Comparator.nullsFirst(vertexOrder);
        Comparator<QuasiCutEntry<V>> order =
            Comparator.<QuasiCutEntry<V>, Number> comparing(e -> e.weight,
                                                            Weights.ORDER)
                .thenComparing(e -> e.source, vo)
                .thenComparing(e -> e.target, vo);
        this.entries = new TreeSet<>(order);
    }

    /**
     * Add an entry if not already present.
     *
     * @param entry the entry to add
     *
     * @return {@code true} if the entry was added
     */
    public boolean add(QuasiCutEntry<V> entry) {
        return entries.add(entry);
    }

    /**
     * Remove an entry if present.
     *
     * @param entry the entry to remove
     *
     * @return {@code true} if the entry was removed
     */
    public boolean remove(QuasiCutEntry<V> entry) {
        return entries.remove(entry);
    }

    /**
     * Determine whether an entry is present.
     *
     * @param entry the entry to test
     *
     * @return {@code true} if the entry is present
     */
    public boolean contains(QuasiCutEntry<V> entry) {
        return entries.contains(entry);
    }

    /**
     * Get the number of entries.
     *
     * @return the number of entries
     */
    public int size() {
        return entries.size();
    }

    /**
     * Determine whether the set is empty.
     *
     * @return {@code true} if there are no entries
     */
    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Find the first entry of a given weight whose source is a
     * descendant of a given vertex. Entries of other weights are
     * skipped without being examined.
     *
     * @param weight the required weight
     *
     * @param index the ranks and descendant sets of the tree
     *
     * @param vertex the vertex whose subtree must contain the source
     *
     * @return the first matching entry, or {@code null} if there is
     * none
     */
    public QuasiCutEntry<V> findFirstMatching(Number weight,
                                              PostorderIndex<V> index,
                                              V vertex) {
        QuasiCutEntry<V> probe = new QuasiCutEntry<>(weight, null, null);
        for (QuasiCutEntry<V> cand : entries.tailSet(probe, true)) {
            if (!Weights.equal(cand.weight, weight)) break;
            if (index.isDescendant(vertex, index.rank(cand.source)))
                return cand;
        }
        return null;
    }

    /**
     * Iterate over the entries in ascending order.
     *
     * @return a read-only iterator over the entries
     */
    @Override
    public Iterator<QuasiCutEntry<V>> iterator() {
        return Collections.unmodifiableSet(entries).iterator();
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
