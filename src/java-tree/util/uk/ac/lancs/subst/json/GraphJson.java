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
package uk.ac.lancs.subst.json;

import java.io.Reader;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.function.Function;

import javax.json.Json;
import javax.json.JsonArray;
import javax.json.JsonArrayBuilder;
import javax.json.JsonException;
import javax.json.JsonNumber;
import javax.json.JsonObject;
import javax.json.JsonReader;
import javax.json.JsonReaderFactory;
import javax.json.JsonStructure;
import javax.json.JsonValue;

import uk.ac.lancs.subst.Edge;
import uk.ac.lancs.subst.MapGraph;
import uk.ac.lancs.subst.SubstituteMapping;
import uk.ac.lancs.subst.Weights;

/**
 * Converts weighted graphs and substitute mappings to and from JSON.
 *
 * <p>
 * Two forms of graph are read. The adjacency form maps each vertex to
 * its neighbours, and each neighbour to an attribute object:
 *
 * <pre>
 * { "1": { "2": { "weight": 2 }, "3": { "weight": 1 } },
 *   "2": { "1": { "weight": 2 } },
 *   "3": { "1": { "weight": 1 } } }
 * </pre>
 *
 * <p>
 * The edge-list form is an array of edges:
 *
 * <pre>
 * [ { "from": "1", "to": "2", "weight": 2 },
 *   { "from": "1", "to": "3", "weight": 1 } ]
 * </pre>
 *
 * <p>
 * An edge without a <samp>weight</samp> is read as unweighted, and
 * will be rejected when the graph is validated. Weights are read
 * without rounding: integers as {@link Long} (or {@link BigInteger}
 * when too large), and others as {@link java.math.BigDecimal}.
 *
 * @author simpsons
 */
public final class GraphJson {
    private GraphJson() {}

    private static final String WEIGHT = "weight";

    /**
     * Read a graph in either form.
     *
     * @param in the source of JSON text
     *
     * @param vertexParser a conversion from JSON keys to vertices
     *
     * @param <V> the vertex type
     *
     * @return the graph
     *
     * @throws JsonException if the text is not a graph in either form
     */
    public static <V> MapGraph<V> read(Reader in,
                                       Function<? super String, ? extends V> vertexParser) {
        final JsonReaderFactory factory =
            Json.createReaderFactory(Collections.emptyMap());
        final JsonStructure struct;
        try (JsonReader jr = factory.createReader(in)) {
            struct = jr.read();
        }
        switch (struct.getValueType()) {
        case OBJECT:
            return readAdjacency((JsonObject) struct, vertexParser);
        case ARRAY:
            return readEdgeList((JsonArray) struct, vertexParser);
        default:
            throw new JsonException("not a graph: " + struct.getValueType());
        }
    }

    /**
     * Read a graph in adjacency form. Edges described in both
     * directions must agree on their weights.
     *
     * @param adjacency the JSON object mapping each vertex to its
     * neighbours
     *
     * @param vertexParser a conversion from JSON keys to vertices
     *
     * @param <V> the vertex type
     *
     * @return the graph
     *
     * @throws JsonException if an attribute is not an object, a weight
     * is not a number, or the two directions of an edge disagree
     */
    public static <V> MapGraph<V>
        readAdjacency(JsonObject adjacency,
                      Function<? super String, ? extends V> vertexParser) {
        Map<String, V> vertices = new LinkedHashMap<>();
        Map<Edge<V>, Number> links = new LinkedHashMap<>();
        for (Map.Entry<String, JsonValue> entry : adjacency.entrySet()) {
            V from = vertices.computeIfAbsent(entry.getKey(), vertexParser);
            JsonObject neighbours = asObject(entry.getValue(), entry.getKey());
            for (Map.Entry<String, JsonValue> nent : neighbours.entrySet()) {
                V to = vertices.computeIfAbsent(nent.getKey(), vertexParser);
                JsonObject attrs = asObject(nent.getValue(), nent.getKey());
                Edge<V> edge = Edge.of(from, to);
                Number weight = weightOf(attrs, edge);
                if (links.containsKey(edge)) {
                    Number prior = links.get(edge);
                    if (!sameWeight(prior, weight))
                        throw new JsonException("edge " + edge + " weighs "
                            + prior + " and " + weight);
                    continue;
                }
                links.put(edge, weight);
            }
        }
        return MapGraph.of(new LinkedHashSet<>(vertices.values()), links);
    }

    /**
     * Read a graph in edge-list form.
     *
     * @param edges the JSON array of edges
     *
     * @param vertexParser a conversion from JSON strings to vertices
     *
     * @param <V> the vertex type
     *
     * @return the graph
     *
     * @throws JsonException if an element is not an edge, or an edge
     * appears twice
     */
    public static <V> MapGraph<V>
        readEdgeList(JsonArray edges,
                     Function<? super String, ? extends V> vertexParser) {
        Map<String, V> vertices = new LinkedHashMap<>();
        Map<Edge<V>, Number> links = new LinkedHashMap<>();
        for (JsonValue value : edges) {
            JsonObject attrs = asObject(value, "edge");
            if (!attrs.containsKey("from") || !attrs.containsKey("to"))
                throw new JsonException("edge lacks from/to: " + attrs);
            V from =
                vertices.computeIfAbsent(attrs.getString("from"), vertexParser);
            V to = vertices.computeIfAbsent(attrs.getString("to"), vertexParser);
            Edge<V> edge = Edge.of(from, to);
            if (links.containsKey(edge))
                throw new JsonException("duplicate edge " + edge);
            links.put(edge, weightOf(attrs, edge));
        }
        return MapGraph.of(new LinkedHashSet<>(vertices.values()), links);
    }

    /**
     * Describe a substitute mapping in JSON. Tree edges appear in
     * processing order, each with its substitute, or {@code null} if it
     * has none.
     *
     * @param mapping the mapping to describe
     *
     * @param <V> the vertex type
     *
     * @return a JSON object with a single <samp>substitutes</samp>
     * array
     */
    public static <V> JsonObject toJson(SubstituteMapping<V> mapping) {
        JsonArrayBuilder arr = Json.createArrayBuilder();
        for (Edge<V> treeEdge : mapping.treeEdges()) {
            Edge<V> sub = mapping.substitute(treeEdge);
            if (sub == null) {
                arr.add(Json.createObjectBuilder()
                    .add("edge", toJson(treeEdge))
                    .addNull("substitute"));
            } else {
                arr.add(Json.createObjectBuilder()
                    .add("edge", toJson(treeEdge))
                    .add("substitute", toJson(sub)));
            }
        }
        return Json.createObjectBuilder().add("substitutes", arr).build();
    }

    private static JsonArray toJson(Edge<?> edge) {
        return Json.createArrayBuilder().add(edge.first().toString())
            .add(edge.second().toString()).build();
    }

    private static JsonObject asObject(JsonValue value, String context) {
        if (value.getValueType() != JsonValue.ValueType.OBJECT)
            throw new JsonException("not an object at " + context + ": "
                + value);
        return (JsonObject) value;
    }

    private static Number weightOf(JsonObject attrs, Edge<?> edge) {
        if (!attrs.containsKey(WEIGHT)) return null;
        JsonValue value = attrs.get(WEIGHT);
        switch (value.getValueType()) {
        case NULL:
            return null;
        case NUMBER:
            return exactNumber((JsonNumber) value);
        default:
            throw new JsonException("edge " + edge + " has non-numeric weight "
                + value);
        }
    }

    /* Integral weights become Long where they fit, and BigInteger
     * otherwise. Others keep their decimal digits as BigDecimal. */
    private static Number exactNumber(JsonNumber num) {
        if (!num.isIntegral()) return num.bigDecimalValue();
        BigInteger big = num.bigIntegerValue();
        if (big.bitLength() < Long.SIZE) return big.longValue();
        return big;
    }

    private static boolean sameWeight(Number a, Number b) {
        if (a == null || b == null) return a == b;
        return Weights.equal(a, b);
    }
}
