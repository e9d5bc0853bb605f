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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Maps each tree edge to at most one substitute edge. Tree edges are
 * held in the order they were processed, each with its orientation from
 * child to parent.
 *
 * @param <V> the vertex type
 *
 * @author simpsons
 */
public final class SubstituteMapping<V> {
    private final Map<Edge<V>, PostorderIndex.Link<V>> links =
        new LinkedHashMap<>();
    private final Map<Edge<V>, Edge<V>> substitutes = new LinkedHashMap<>();

    SubstituteMapping(List<PostorderIndex.Link<V>> links) {
        for (PostorderIndex.Link<V> link : links) {
            Edge<V> edge = link.edge();
            this.links.put(edge, link);
            this.substitutes.put(edge, null);
        }
    }

    void record(Edge<V> treeEdge, Edge<V> substitute) {
        assert substitutes.containsKey(treeEdge);
        substitutes.put(treeEdge, substitute);
    }

    /**
     * Get the tree edges, in processing order.
     *
     * @return an unmodifiable view of the tree edges
     */
    public Collection<Edge<V>> treeEdges() {
        return Collections.unmodifiableSet(substitutes.keySet());
    }

    /**
     * Get the orientation of a tree edge, as traversed.
     *
     * @param treeEdge the tree edge
     *
     * @return the edge oriented from child to parent
     *
     * @throws NoSuchElementException if the edge is not a tree edge
     */
    public PostorderIndex.Link<V> link(Edge<V> treeEdge) {
        PostorderIndex.Link<V> result = links.get(treeEdge);
        if (result == null)
            throw new NoSuchElementException("not a tree edge: " + treeEdge);
        return result;
    }

    /**
     * Get the substitute for a tree edge.
     *
     * @param treeEdge the tree edge
     *
     * @return the substitute edge, or {@code null} if there is none
     *
     * @throws NoSuchElementException if the edge is not a tree edge
     */
    public Edge<V> substitute(Edge<V> treeEdge) {
        if (!substitutes.containsKey(treeEdge))
            throw new NoSuchElementException("not a tree edge: " + treeEdge);
        return substitutes.get(treeEdge);
    }

    /**
     * Determine whether a tree edge has a substitute.
     *
     * @param treeEdge the tree edge
     *
     * @return {@code true} if the edge has a substitute
     */
    public boolean hasSubstitute(Edge<V> treeEdge) {
        return substitutes.get(treeEdge) != null;
    }

    /**
     * Get the tree edges that have substitutes, with those substitutes.
     *
     * @return a fresh map from tree edge to substitute, in processing
     * order
     */
    public Map<Edge<V>, Edge<V>> pairs() {
        return substitutes.entrySet().stream()
            .filter(e -> e.getValue() != null)
            .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue,
                                      (a, b) -> a, LinkedHashMap::new));
    }

    /**
     * Get the number of tree edges.
     *
     * @return the number of tree edges
     */
    public int size() {
        return substitutes.size();
    }

    @Override
    public int hashCode() {
        return substitutes.hashCode();
    }

    /**
     * Determine whether this mapping equals another object. Processing
     * order and orientation are not compared.
     *
     * @param obj the other object
     *
     * @return {@code true} iff the other object is a mapping with the
     * same tree edges and substitutes
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SubstituteMapping)) return false;
        SubstituteMapping<?> other = (SubstituteMapping<?>) obj;
        return Objects.equals(substitutes, other.substitutes);
    }

    @Override
    public String toString() {
        return substitutes.toString();
    }
}
