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

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Interprets an undirected tree as rooted, by ranking its vertices in
 * depth-first postorder. Ranks run from 1 to the number of vertices,
 * and a vertex's rank follows those of all its descendants.
 *
 * <p>
 * Ranks are assigned in order. As each vertex is ranked, edges to
 * vertices not yet ranked are pruned, so the retained edges run from
 * parent (higher rank) to child (lower rank). The descendant set of a
 * vertex is the set of ranks reachable from it in this pruned forest,
 * including its own. For a genuine postorder, it is the contiguous
 * range ending at the vertex's rank.
 *
 * @param <V> the vertex type
 *
 * @author simpsons
 */
public final class PostorderIndex<V> {
    /**
     * A tree edge oriented from child to parent
     *
     * @param <V> the vertex type
     */
    public static final class Link<V> {
        /**
         * The vertex with the lower rank
         */
        public final V child;

        /**
         * The vertex with the higher rank
         */
        public final V parent;

        /**
         * The weight of the edge
         */
        public final Number weight;

        Link(V child, V parent, Number weight) {
            this.child = child;
            this.parent = parent;
            this.weight = weight;
        }

        /**
         * Get the undirected edge.
         *
         * @return the edge joining child and parent
         */
        public Edge<V> edge() {
            return Edge.of(child, parent);
        }

        @Override
        public String toString() {
            return child + "->" + parent + "(" + weight + ")";
        }
    }

    private final List<V> order;
    private final Map<V, Integer> ranks;
    private final Map<V, BitSet> descendants;
    private final Map<V, List<V>> children;
    private final Map<V, List<V>> parents;
    private final List<Link<V>> links;

    private PostorderIndex(WeightedGraph<V> tree,
                           Collection<? extends V> postorder) {
        final int size = postorder.size();
        List<V> order = new ArrayList<>(size);
        Map<V, Integer> ranks = new HashMap<>();
        Map<V, BitSet> descendants = new HashMap<>();
        Map<V, List<V>> children = new HashMap<>();
        Map<V, List<V>> parents = new HashMap<>();
        List<Link<V>> links = new ArrayList<>(size);

        for (V vertex : postorder) {
            final int rank = order.size() + 1;
            order.add(vertex);
            ranks.put(vertex, rank);
            BitSet desc = new BitSet(rank + 1);
            desc.set(rank);

            /* Only neighbours already ranked remain attached to this
             * vertex, as its children. Their descendant sets are
             * complete. */
            List<V> kids = new ArrayList<>();
            for (V neigh : tree.neighbours(vertex)) {
                if (neigh.equals(vertex) || !ranks.containsKey(neigh))
                    continue;
                kids.add(neigh);
                desc.or(descendants.get(neigh));
                parents.computeIfAbsent(neigh, k -> new ArrayList<>(1))
                    .add(vertex);
                links.add(new Link<>(neigh, vertex,
                                     tree.weight(neigh, vertex)));
            }
            children.put(vertex, Collections.unmodifiableList(kids));
            descendants.put(vertex, desc);
        }

        links.sort((a, b) -> {
            int c = Integer.compare(ranks.get(a.child), ranks.get(b.child));
            if (c != 0) return c;
            return Integer.compare(ranks.get(a.parent), ranks.get(b.parent));
        });

        this.order = Collections.unmodifiableList(order);
        this.ranks = ranks;
        this.descendants = descendants;
        this.children = children;
        this.parents = parents;
        this.links = Collections.unmodifiableList(links);
    }

    /**
     * Index a tree by traversing it from a root.
     *
     * @param tree the tree to index
     *
     * @param root the root vertex
     *
     * @param <V> the vertex type
     *
     * @return the postorder index of the tree
     */
    public static <V> PostorderIndex<V> traverse(WeightedGraph<V> tree,
                                                 V root) {
        return new PostorderIndex<>(tree, Graphs.postorder(tree, root));
    }

    /**
     * Index a tree whose vertices are already listed in postorder. The
     * order is not verified.
     *
     * @param tree the tree to index, whose vertex iteration order is
     * taken as the postorder
     *
     * @param <V> the vertex type
     *
     * @return the postorder index of the tree
     */
    public static <V> PostorderIndex<V> trust(WeightedGraph<V> tree) {
        return new PostorderIndex<>(tree, tree.vertices());
    }

    /**
     * Get the vertices in rank order.
     *
     * @return the vertices, the first having rank 1
     */
    public List<V> order() {
        return order;
    }

    /**
     * Get the root of the traversal.
     *
     * @return the vertex with the highest rank
     */
    public V root() {
        return order.get(order.size() - 1);
    }

    /**
     * Get the rank of a vertex.
     *
     * @param vertex the vertex
     *
     * @return the vertex's rank
     *
     * @throws NoSuchElementException if the vertex was not ranked
     */
    public int rank(V vertex) {
        Integer r = ranks.get(vertex);
        if (r == null) throw new NoSuchElementException("unranked: " + vertex);
        return r;
    }

    /**
     * Get the vertex with a given rank.
     *
     * @param rank the rank, from 1
     *
     * @return the vertex with that rank
     *
     * @throws IndexOutOfBoundsException if no vertex has that rank
     */
    public V vertexAt(int rank) {
        return order.get(rank - 1);
    }

    private BitSet descendantBits(V vertex) {
        BitSet result = descendants.get(vertex);
        if (result == null)
            throw new NoSuchElementException("unranked: " + vertex);
        return result;
    }

    /**
     * Get the ranks of a vertex and its descendants.
     *
     * @param vertex the vertex
     *
     * @return a fresh copy of the descendant ranks
     */
    public BitSet descendants(V vertex) {
        return (BitSet) descendantBits(vertex).clone();
    }

    /**
     * Determine whether a rank belongs to a vertex or one of its
     * descendants.
     *
     * @param vertex the possible ancestor
     *
     * @param rank the rank to test
     *
     * @return {@code true} if the rank is in the vertex's descendant
     * set
     */
    public boolean isDescendant(V vertex, int rank) {
        return rank > 0 && descendantBits(vertex).get(rank);
    }

    /**
     * Get the lowest rank among a vertex and its descendants.
     *
     * @param vertex the vertex
     *
     * @return the lowest descendant rank
     */
    public int lowest(V vertex) {
        return descendantBits(vertex).nextSetBit(0);
    }

    /**
     * Get the highest rank among a vertex and its descendants.
     *
     * @param vertex the vertex
     *
     * @return the highest descendant rank
     */
    public int highest(V vertex) {
        return descendantBits(vertex).length() - 1;
    }

    /**
     * Get the children of a vertex in the pruned forest.
     *
     * @param vertex the vertex
     *
     * @return the neighbours of the vertex with lower ranks
     */
    public List<V> children(V vertex) {
        return children.getOrDefault(vertex, Collections.emptyList());
    }

    /**
     * Get the parents of a vertex in the pruned forest. In a genuine
     * postorder, every vertex but the root has exactly one.
     *
     * @param vertex the vertex
     *
     * @return the neighbours of the vertex with higher ranks
     */
    public List<V> parents(V vertex) {
        return Collections.unmodifiableList(parents
            .getOrDefault(vertex, Collections.emptyList()));
    }

    /**
     * Get the tree edges oriented from child to parent. They are
     * ordered by the rank of the child, then by the rank of the
     * parent.
     *
     * @return the oriented tree edges
     */
    public List<Link<V>> links() {
        return links;
    }
}
