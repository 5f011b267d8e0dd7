package com.relayflow.relayflow_engine.engine;

import com.relayflow.relayflow_engine.exception.CycleException;
import com.relayflow.relayflow_engine.exception.ValidationException;
import com.relayflow.relayflow_engine.model.domain.EdgeDefinition;
import com.relayflow.relayflow_engine.model.domain.NodeDefinition;
import com.relayflow.relayflow_engine.model.domain.WorkflowDefinition;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Index based view of a definition. Nodes are addressed by declaration position; edges are
 * int adjacency lists. Immutable once built.
 */
public final class WorkflowGraph {

    private final WorkflowDefinition definition;
    private final List<NodeDefinition> nodes;
    private final Map<String, Integer> indexById;
    private final int[][] children;
    private final int[][] parents;
    // source * size + target -> handle, only for branch edges
    private final Map<Long, String> handles;

    private WorkflowGraph(WorkflowDefinition definition, Map<String, Integer> indexById,
                          int[][] children, int[][] parents, Map<Long, String> handles) {
        this.definition = definition;
        this.nodes = definition.getNodes();
        this.indexById = indexById;
        this.children = children;
        this.parents = parents;
        this.handles = handles;
    }

    /**
     * Builds the arena. Rejects duplicate node ids, edges whose endpoints are undeclared and
     * two edges between the same pair of nodes with different handles; does not check for
     * cycles.
     */
    public static WorkflowGraph of(WorkflowDefinition definition) {
        List<NodeDefinition> nodes = definition.getNodes();
        Map<String, Integer> indexById = new HashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            String id = nodes.get(i).getId();
            if (indexById.putIfAbsent(id, i) != null) {
                throw new ValidationException("Duplicate node id '" + id + "'");
            }
        }

        List<List<Integer>> out = new ArrayList<>();
        List<List<Integer>> in = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            out.add(new ArrayList<>());
            in.add(new ArrayList<>());
        }
        Map<Long, String> handles = new HashMap<>();
        Map<Long, String> seen = new HashMap<>();
        for (EdgeDefinition edge : definition.getEdges()) {
            Integer source = indexById.get(edge.getSource());
            Integer target = indexById.get(edge.getTarget());
            if (source == null || target == null) {
                throw new ValidationException("Edge " + edge.getSource() + " -> " + edge.getTarget()
                        + " refers to an undeclared node");
            }
            long key = edgeKey(source, target, nodes.size());
            String handle = edge.getSourceHandle();
            if (seen.containsKey(key)) {
                if (!Objects.equals(seen.get(key), handle)) {
                    throw new ValidationException("Edges " + edge.getSource() + " -> " + edge.getTarget()
                            + " disagree on their source handle");
                }
                continue;
            }
            seen.put(key, handle);
            if (handle != null) {
                handles.put(key, handle);
            }
            out.get(source).add(target);
            in.get(target).add(source);
        }
        return new WorkflowGraph(definition, Map.copyOf(indexById), toArrays(out), toArrays(in), Map.copyOf(handles));
    }

    private static long edgeKey(int source, int target, int size) {
        return (long) source * size + target;
    }

    private static int[][] toArrays(List<List<Integer>> lists) {
        int[][] result = new int[lists.size()][];
        for (int i = 0; i < lists.size(); i++) {
            result[i] = lists.get(i).stream().mapToInt(Integer::intValue).sorted().toArray();
        }
        return result;
    }

    public WorkflowDefinition definition() {
        return definition;
    }

    public int size() {
        return nodes.size();
    }

    public NodeDefinition node(int index) {
        return nodes.get(index);
    }

    public int indexOf(String nodeId) {
        Integer index = indexById.get(nodeId);
        return index == null ? -1 : index;
    }

    public int[] children(int index) {
        return children[index];
    }

    public int[] parents(int index) {
        return parents[index];
    }

    /** Handle of the edge {@code source -> target}, or null for an unconditional edge. */
    public String handle(int source, int target) {
        return handles.get(edgeKey(source, target, size()));
    }

    /**
     * Depth-first search with white/grey/black colouring. Returns the node ids of the
     * first cycle found, closed (first id repeated at the end), or an empty list.
     */
    public List<String> findCycle() {
        int n = size();
        int[] colour = new int[n];
        int[] via = new int[n];
        for (int start = 0; start < n; start++) {
            if (colour[start] != 0) continue;
            // iterative DFS; frame = {node, next child position}
            List<int[]> stack = new ArrayList<>();
            stack.add(new int[]{start, 0});
            colour[start] = 1;
            via[start] = -1;
            while (!stack.isEmpty()) {
                int[] frame = stack.get(stack.size() - 1);
                int node = frame[0];
                if (frame[1] < children[node].length) {
                    int child = children[node][frame[1]++];
                    if (colour[child] == 1) {
                        return closeCycle(node, child, via);
                    }
                    if (colour[child] == 0) {
                        colour[child] = 1;
                        via[child] = node;
                        stack.add(new int[]{child, 0});
                    }
                } else {
                    colour[node] = 2;
                    stack.remove(stack.size() - 1);
                }
            }
        }
        return List.of();
    }

    private List<String> closeCycle(int from, int backTo, int[] via) {
        List<String> cycle = new ArrayList<>();
        for (int cur = from; cur != backTo; cur = via[cur]) {
            cycle.add(node(cur).getId());
        }
        cycle.add(node(backTo).getId());
        Collections.reverse(cycle);
        cycle.add(node(backTo).getId());
        return cycle;
    }

    public void requireAcyclic() {
        List<String> cycle = findCycle();
        if (!cycle.isEmpty()) {
            throw new CycleException(cycle);
        }
    }

    /** Strict ancestors of {@code index}. Only meaningful on an acyclic graph. */
    public BitSet ancestors(int index) {
        return reach(index, parents);
    }

    /** Strict descendants of {@code index}. */
    public BitSet descendants(int index) {
        return reach(index, children);
    }

    private BitSet reach(int index, int[][] adjacency) {
        BitSet seen = new BitSet(size());
        List<Integer> frontier = new ArrayList<>();
        frontier.add(index);
        while (!frontier.isEmpty()) {
            int current = frontier.remove(frontier.size() - 1);
            for (int next : adjacency[current]) {
                if (!seen.get(next)) {
                    seen.set(next);
                    frontier.add(next);
                }
            }
        }
        seen.clear(index);
        return seen;
    }
}
