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
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

import uk.ac.lancs.subst.config.Configuration;

/**
 * Finds substitute edges for a spanning tree, after Yamada et al.
 * (2010). For each tree edge that is not fixed, a substitute is a
 * non-tree, non-restricted edge of the same weight that reconnects the
 * two parts of the tree left when the tree edge is removed.
 *
 * <p>
 * Tree edges are processed bottom-up, in postorder of their child
 * vertices. A set of quasi-cut candidates is maintained from the
 * non-tree edges incident to each processed vertex, and searched in
 * ascending order for one that crosses the cut below the vertex.
 *
 * <pre>
 * SubstituteComputer&lt;String&gt; computer =
 *     SubstituteComputer.start(String.class).withGraph(graph)
 *         .withTree(tree).fixing(fixed).restricting(restricted)
 *         .create();
 * SubstituteMapping&lt;String&gt; subs = computer.substitute();
 * </pre>
 *
 * <p>
 * A candidate chosen as a substitute remains a candidate, so an edge
 * further up the tree may receive the same substitute.
 *
 * @param <V> the vertex type
 *
 * @author simpsons
 */
public final class SubstituteComputer<V> {
    /**
     * The configuration key enabling the postorder fast path, namely
     * {@value}
     */
    public static final String POSTORDERED_KEY = "postordered";

    /**
     * Collects parameters for computing substitutes.
     *
     * @param <V> the vertex type
     *
     * @author simpsons
     */
    public static final class Builder<V> {
        WeightedGraph<V> graph;
        WeightedGraph<V> tree;
        Collection<? extends Edge<V>> fixed = Collections.emptySet();
        Collection<? extends Edge<V>> restricted = Collections.emptySet();
        RootSelector<V> rootSelector = RootSelectors.first();
        Comparator<? super V> vertexOrder = naturalOrder();
        boolean postordered;

        private Builder() {}

        /**
         * Specify the graph.
         *
         * @param graph the connected, weighted graph
         *
         * @return this object
         */
        public Builder<V> withGraph(WeightedGraph<V> graph) {
            this.graph = Objects.requireNonNull(graph, "graph");
            return this;
        }

        /**
         * Specify the spanning tree.
         *
         * @param tree a spanning tree of the graph
         *
         * @return this object
         */
        public Builder<V> withTree(WeightedGraph<V> tree) {
            this.tree = Objects.requireNonNull(tree, "tree");
            return this;
        }

        /**
         * Specify the edges that must remain in the tree. These are
         * never given substitutes.
         *
         * @param fixed the fixed edges
         *
         * @return this object
         */
        public Builder<V> fixing(Collection<? extends Edge<V>> fixed) {
            this.fixed = Objects.requireNonNull(fixed, "fixed");
            return this;
        }

        /**
         * Specify the edges that must not enter the tree. These are
         * never offered as substitutes.
         *
         * @param restricted the restricted edges
         *
         * @return this object
         */
        public Builder<V>
            restricting(Collection<? extends Edge<V>> restricted) {
            this.restricted = Objects.requireNonNull(restricted, "restricted");
            return this;
        }

        /**
         * Specify fixed and restricted edges together.
         *
         * @param constraints the constraints
         *
         * @return this object
         */
        public Builder<V> constrainedBy(EdgeConstraints<V> constraints) {
            return fixing(constraints.fixed())
                .restricting(constraints.restricted());
        }

        /**
         * Specify how to choose the root of the tree.
         *
         * @param selector the root selector
         *
         * @return this object
         */
        public Builder<V> rootedBy(RootSelector<V> selector) {
            this.rootSelector = Objects.requireNonNull(selector, "selector");
            return this;
        }

        /**
         * Specify the order of vertices, used to break ties between
         * candidates of equal weight. Without this, vertices must be
         * {@link Comparable}.
         *
         * @param order the vertex order
         *
         * @return this object
         */
        public Builder<V> orderingVertices(Comparator<? super V> order) {
            this.vertexOrder = Objects.requireNonNull(order, "order");
            return this;
        }

        /**
         * Specify whether the tree's vertices are already in postorder.
         * If so, no root is chosen, and no traversal is performed. The
         * order is trusted, not verified.
         *
         * @param status {@code true} if the tree's vertex order is a
         * postorder
         *
         * @return this object
         */
        public Builder<V> alreadyPostordered(boolean status) {
            this.postordered = status;
            return this;
        }

        /**
         * Apply settings from configuration. <samp>root.selection</samp>
         * and <samp>root.seed</samp> choose the root selector, as
         * described by
         * {@link RootSelectors#fromConfiguration(Configuration)}.
         * <samp>postordered</samp> enables the fast path.
         *
         * @param conf the configuration
         *
         * @return this object
         *
         * @throws IllegalArgumentException if a setting is malformed
         */
        public Builder<V> configuredBy(Configuration conf) {
            rootedBy(RootSelectors.fromConfiguration(conf));
            String ordered = conf.get(POSTORDERED_KEY);
            if (ordered != null) {
                switch (ordered.trim()) {
                case "true":
                    return alreadyPostordered(true);
                case "false":
                    return alreadyPostordered(false);
                default:
                    throw new IllegalArgumentException(POSTORDERED_KEY
                        + ": " + ordered);
                }
            }
            return this;
        }

        /**
         * Validate the parameters and create the computer.
         *
         * @return the new computer
         *
         * @throws InvalidGraphException if the graph is disconnected,
         * has a loop, or has an unweighted edge
         *
         * @throws InvalidTreeException if the tree is not a spanning
         * tree of the graph
         *
         * @throws IllegalStateException if the graph or tree has not
         * been specified
         */
        public SubstituteComputer<V> create() throws InvalidGraphException {
            if (graph == null) throw new IllegalStateException("no graph");
            if (tree == null) throw new IllegalStateException("no tree");
            GraphValidator.check(graph, tree);
            return new SubstituteComputer<>(this);
        }
    }

    /**
     * Start collecting parameters for computing substitutes.
     *
     * @param type the vertex type
     *
     * @param <V> the vertex type
     *
     * @return a fresh parameter collector
     */
    public static <V> Builder<V> start(Class<V> type) {
        return new Builder<>();
    }

    @SuppressWarnings("unchecked")
    private static <V> Comparator<V> naturalOrder() {
        return (a, b) -> ((Comparable<Object>) a).compareTo(b);
    }

    private final WeightedGraph<V> graph;
    private final WeightedGraph<V> tree;
    private final EdgeConstraints<V> constraints;
    private final RootSelector<V> rootSelector;
    private final Comparator<? super V> vertexOrder;
    private final boolean postordered;

    private SubstituteComputer(Builder<V> builder) {
        this.graph = builder.graph;
        this.tree = builder.tree;
        this.constraints =
            EdgeConstraints.of(builder.fixed, builder.restricted);
        this.rootSelector = builder.rootSelector;
        this.vertexOrder = builder.vertexOrder;
        this.postordered = builder.postordered;
    }

    /**
     * Get the constraints in force.
     *
     * @return the fixed and restricted edges
     */
    public EdgeConstraints<V> constraints() {
        return constraints;
    }

    /**
     * Rank the tree's vertices in postorder, choosing a root unless the
     * tree is already postordered.
     *
     * @return a fresh postorder index of the tree
     */
    public PostorderIndex<V> index() {
        if (postordered) return PostorderIndex.trust(tree);
        List<V> candidates = new ArrayList<>(tree.vertices());
        V root = rootSelector.selectRoot(candidates);
        return PostorderIndex.traverse(tree, root);
    }

    /**
     * Find substitutes for all tree edges. Fresh internal state is
     * created for each call.
     *
     * @return a mapping from each tree edge to its substitute, if any
     */
    public SubstituteMapping<V> substitute() {
        PostorderIndex<V> index = index();
        QuasiCutSet<V> quasiCuts = new QuasiCutSet<>(vertexOrder);
        SubstituteMapping<V> result = new SubstituteMapping<>(index.links());
        logger.fine(() -> String
            .format("rooted at %s; %d vertices; %d tree edges%s",
                    index.root(), index.order().size(),
                    index.links().size(),
                    postordered ? " (trusted order)" : ""));

        int found = 0;
        for (PostorderIndex.Link<V> link : index.links()) {
            final V vertex = link.child;
            updateCandidates(vertex, index, quasiCuts);

            /* Fixed edges keep no substitute. */
            Edge<V> treeEdge = link.edge();
            if (constraints.isFixed(treeEdge)) continue;

            QuasiCutEntry<V> cand =
                quasiCuts.findFirstMatching(link.weight, index, vertex);
            while (cand != null
                && index.isDescendant(vertex, index.rank(cand.target))) {
                /* Both ends are below the cut, so this edge can never
                 * bridge it or any cut further up. */
                final QuasiCutEntry<V> discarded = cand;
                logger.finest(() -> String.format("discarding %s at %s",
                                                  discarded, vertex));
                quasiCuts.remove(cand);
                cand = quasiCuts.findFirstMatching(link.weight, index, vertex);
            }
            if (cand == null) continue;

            Edge<V> substitute = cand.edge();
            result.record(treeEdge, substitute);
            found++;
            logger.finer(() -> String.format("%s substitutes for %s",
                                             substitute, treeEdge));
        }

        final int total = found;
        logger.fine(() -> String.format("%d of %d tree edges substitutable",
                                        total, index.links().size()));
        return result;
    }

    /**
     * Add and remove candidates according to the non-tree edges
     * incident to a vertex and the position of their other ends
     * relative to the vertex's subtree.
     *
     * @param vertex the vertex being processed
     *
     * @param index the ranks and descendant sets of the tree
     *
     * @param quasiCuts the candidates to update
     */
    private void updateCandidates(V vertex, PostorderIndex<V> index,
                                  QuasiCutSet<V> quasiCuts) {
        final int lowest = index.lowest(vertex);
        final int highest = index.highest(vertex);
        for (V neigh : graph.neighbours(vertex)) {
            Edge<V> edge = Edge.of(vertex, neigh);
            if (constraints.isRestricted(edge) || tree.contains(edge))
                continue;
            QuasiCutEntry<V> entry =
                new QuasiCutEntry<>(graph.weight(vertex, neigh), vertex,
                                    neigh);
            final int rank = index.rank(neigh);
            if (rank < lowest) {
                /* The other end was processed earlier, outside this
                 * subtree. */
                quasiCuts.remove(entry.reverse());
                quasiCuts.add(entry);
            } else if (index.isDescendant(vertex, rank)) {
                quasiCuts.remove(entry.reverse());
            } else if (rank > highest) {
                quasiCuts.add(entry);
            }
        }
    }

    private static final Logger logger =
        Logger.getLogger(SubstituteComputer.class.getName());
}
