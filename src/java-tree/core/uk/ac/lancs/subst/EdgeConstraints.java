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

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Objects;

/**
 * Records which edges must stay in a spanning tree (fixed) and which
 * must never enter it (restricted). A spanning tree is
 * <dfn>FR-admissible</dfn> if it contains every fixed edge and no
 * restricted edge.
 *
 * @param <V> the vertex type
 *
 * @author simpsons
 */
public final class EdgeConstraints<V> {
    private final Collection<Edge<V>> fixed;
    private final Collection<Edge<V>> restricted;

    private EdgeConstraints(Collection<? extends Edge<V>> fixed,
                            Collection<? extends Edge<V>> restricted) {
        this.fixed = Collections
            .unmodifiableSet(new LinkedHashSet<>(Objects
                .requireNonNull(fixed, "fixed")));
        this.restricted = Collections
            .unmodifiableSet(new LinkedHashSet<>(Objects
                .requireNonNull(restricted, "restricted")));
    }

    /**
     * Create a set of constraints.
     *
     * @param fixed the edges that must remain in the tree
     *
     * @param restricted the edges that must not appear in the tree
     *
     * @param <V> the vertex type
     *
     * @return the constraints
     */
    public static <V> EdgeConstraints<V>
        of(Collection<? extends Edge<V>> fixed,
           Collection<? extends Edge<V>> restricted) {
        return new EdgeConstraints<>(fixed, restricted);
    }

    /**
     * Create an empty set of constraints.
     *
     * @param <V> the vertex type
     *
     * @return constraints fixing and restricting nothing
     */
    public static <V> EdgeConstraints<V> none() {
        return new EdgeConstraints<>(Collections.emptySet(),
                                     Collections.emptySet());
    }

    /**
     * Get the fixed edges.
     *
     * @return an unmodifiable set of the fixed edges
     */
    public Collection<Edge<V>> fixed() {
        return fixed;
    }

    /**
     * Get the restricted edges.
     *
     * @return an unmodifiable set of the restricted edges
     */
    public Collection<Edge<V>> restricted() {
        return restricted;
    }

    /**
     * Determine whether an edge is fixed.
     *
     * @param edge the edge to test
     *
     * @return {@code true} if the edge must remain in the tree
     */
    public boolean isFixed(Edge<V> edge) {
        return fixed.contains(edge);
    }

    /**
     * Determine whether an edge is restricted.
     *
     * @param edge the edge to test
     *
     * @return {@code true} if the edge must not enter the tree
     */
    public boolean isRestricted(Edge<V> edge) {
        return restricted.contains(edge);
    }

    /**
     * Determine whether a tree is admissible under these constraints.
     *
     * @param tree the tree to test
     *
     * @return {@code true} if the tree contains all fixed edges and no
     * restricted edges
     */
    public boolean isAdmissible(WeightedGraph<V> tree) {
        for (Edge<V> edge : fixed)
            if (!tree.contains(edge)) return false;
        for (Edge<V> edge : restricted)
            if (tree.contains(edge)) return false;
        return true;
    }

    /**
     * Determine whether a tree is FR-admissible.
     *
     * @param tree the tree to test
     *
     * @param fixed the edges that must be in the tree
     *
     * @param restricted the edges that must not be in the tree
     *
     * @param <V> the vertex type
     *
     * @return {@code true} if all fixed edges are in the tree, and no
     * restricted edges are
     */
    public static <V> boolean
        isAdmissible(WeightedGraph<V> tree,
                     Collection<? extends Edge<V>> fixed,
                     Collection<? extends Edge<V>> restricted) {
        return of(fixed, restricted).isAdmissible(tree);
    }

    /**
     * Determine whether a set of tree edges is FR-admissible.
     *
     * @param treeEdges the edges of the tree
     *
     * @param fixed the edges that must be in the tree
     *
     * @param restricted the edges that must not be in the tree
     *
     * @param <V> the vertex type
     *
     * @return {@code true} if all fixed edges are in the tree, and no
     * restricted edges are
     */
    public static <V> boolean
        isAdmissible(Collection<? extends Edge<V>> treeEdges,
                     Collection<? extends Edge<V>> fixed,
                     Collection<? extends Edge<V>> restricted) {
        Collection<Edge<V>> tree = new HashSet<>(treeEdges);
        if (!tree.containsAll(fixed)) return false;
        for (Edge<V> edge : restricted)
            if (tree.contains(edge)) return false;
        return true;
    }

    @Override
    public String toString() {
        return "fixed=" + fixed + "; restricted=" + restricted;
    }
}
