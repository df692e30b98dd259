package com.github.fsmdsl.graph;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.fsmdsl.FsmException;
import com.github.fsmdsl.FsmException.Code;

/**
 * JSON wire format shared with the layout collaborator.
 *
 * <pre>
 * graph:  {"name": "...", "nodes": [{"id", "label"}...], "edges": [{"source", "target", "label"}...]}
 * layout: {"positions": {"id": {"x", "y"}...}, "edges": [[{"x", "y"}...]...]}
 * </pre>
 */
public final class GraphCodec {
  private static final ObjectMapper mapper = new ObjectMapper();

  public String write(final GraphDescription graph) throws FsmException {
    final ObjectNode root = mapper.createObjectNode();
    root.put("name", graph.getName());
    final ArrayNode nodes = root.putArray("nodes");
    for (final NodeRecord node : graph.getNodes()) {
      nodes.addObject().put("id", node.getId()).put("label", node.getLabel());
    }
    final ArrayNode edges = root.putArray("edges");
    for (final EdgeRecord edge : graph.getEdges()) {
      edges.addObject().put("source", edge.getSource()).put("target", edge.getTarget())
          .put("label", edge.getLabel());
    }
    try {
      return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
    } catch (JsonProcessingException problem) {
      throw new FsmException(Code.IO_FAILURE, problem);
    }
  }

  public GraphDescription readGraph(final String json) throws FsmException {
    final JsonNode root = parse(json);
    final List<NodeRecord> nodes = new ArrayList<>();
    for (final JsonNode node : root.path("nodes")) {
      nodes.add(new NodeRecord(required(node, "id"), node.path("label").asText("")));
    }
    final List<EdgeRecord> edges = new ArrayList<>();
    for (final JsonNode edge : root.path("edges")) {
      edges.add(new EdgeRecord(required(edge, "source"), required(edge, "target"),
          edge.path("label").asText("")));
    }
    return new GraphDescription(required(root, "name"), nodes, edges);
  }

  /**
   * Parses a layout answer. Missing sections are read as empty.
   */
  public LayoutResult readLayout(final String json) throws FsmException {
    final JsonNode root = parse(json);
    final Map<String, Point> positions = new LinkedHashMap<>();
    final Iterator<Map.Entry<String, JsonNode>> fields = root.path("positions").fields();
    while (fields.hasNext()) {
      final Map.Entry<String, JsonNode> field = fields.next();
      positions.put(field.getKey(), point(field.getValue()));
    }
    final List<List<Point>> routes = new ArrayList<>();
    for (final JsonNode route : root.path("edges")) {
      final List<Point> points = new ArrayList<>();
      for (final JsonNode point : route) {
        points.add(point(point));
      }
      routes.add(points);
    }
    return new LayoutResult(positions, routes);
  }

  private static JsonNode parse(final String json) throws FsmException {
    try {
      final JsonNode root = mapper.readTree(json);
      if (root == null || !root.isObject()) {
        throw new FsmException(Code.IO_FAILURE, "Expected a JSON object");
      }
      return root;
    } catch (JsonProcessingException problem) {
      throw new FsmException(Code.IO_FAILURE, problem);
    }
  }

  private static Point point(final JsonNode node) throws FsmException {
    if (!node.path("x").isNumber() || !node.path("y").isNumber()) {
      throw new FsmException(Code.IO_FAILURE, "Point needs numeric x and y, got " + node);
    }
    return new Point(node.get("x").asDouble(), node.get("y").asDouble());
  }

  private static String required(final JsonNode node, final String field) throws FsmException {
    final JsonNode value = node.get(field);
    if (value == null || !value.isTextual()) {
      throw new FsmException(Code.IO_FAILURE, "Missing text field '" + field + "' in " + node);
    }
    return value.asText();
  }
}
