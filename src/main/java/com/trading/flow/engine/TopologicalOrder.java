package com.trading.flow.engine;

import com.trading.flow.api.Node;
import com.trading.flow.error.CycleException;
import com.trading.flow.error.DuplicateNodeException;
import com.trading.flow.error.UnknownNodeException;

import java.util.*;

/**
 * Topology -- CSR-encoded static DAG of a workflow.
 *
 * This is the compiled, immutable form of a {@link WorkflowGraph} that the
 * executor works from. Node indices are topological: iterating 0..N visits
 * every dependency before its dependents.
 *
 * Data layout:
 * - topoOrder: nodes sorted topologically.
 * - childrenList: one flattened int array with the topological indices of
 * all children of all nodes.
 * - childrenOffset: children of node i are childrenList[childrenOffset[i]]
 * inclusive to childrenList[childrenOffset[i+1]] exclusive.
 * - parentCount: the in-degree of each node, the starting value of the
 * executor's per-run countdown.
 * - ancestors: the transitive dependencies of each node, by name. The
 * executor uses them to scope a node's launch snapshot.
 *
 * The terminal marker is not part of the topology.
 */
public final class TopologicalOrder {
    // The nodes in topological execution order.
    private final Node[] topoOrder;

    // CSR Index: childrenOffset[i] points to the start of node i's children in
    // childrenList. childrenOffset[i+1] points to the end.
    private final int[] childrenOffset;

    // CSR Data: Flattened list of child indices.
    private final int[] childrenList;

    private final int[] parentCount;

    private final List<Set<String>> ancestors;

    private final Map<String, Integer> nameToIndex;

    private TopologicalOrder(Node[] topoOrder, int[] childrenOffset, int[] childrenList,
            int[] parentCount, List<Set<String>> ancestors, Map<String, Integer> nameToIndex) {
        this.topoOrder = topoOrder;
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.parentCount = parentCount;
        this.ancestors = ancestors;
        this.nameToIndex = nameToIndex;
    }

    public int nodeCount() {
        return topoOrder.length;
    }

    /** Returns the node object at the given topological index. */
    public Node node(int ti) {
        return topoOrder[ti];
    }

    /** Resolves a node name to its topological index. O(1) hash lookup. */
    public int topoIndex(String name) {
        Integer idx = nameToIndex.get(name);
        if (idx == null)
            throw new UnknownNodeException(name);
        return idx;
    }

    public int childCount(int ti) {
        return childrenOffset[ti + 1] - childrenOffset[ti];
    }

    public int child(int ti, int i) {
        return childrenList[childrenOffset[ti] + i];
    }

    public int childrenStart(int ti) {
        return childrenOffset[ti];
    }

    public int childrenEnd(int ti) {
        return childrenOffset[ti + 1];
    }

    public int childAt(int flatIndex) {
        return childrenList[flatIndex];
    }

    public int parentCount(int ti) {
        return parentCount[ti];
    }

    /** Names of every node that {@code ti} transitively depends on. */
    public Set<String> ancestors(int ti) {
        return ancestors.get(ti);
    }

    /** Node names in topological order. */
    public List<String> names() {
        List<String> names = new ArrayList<>(topoOrder.length);
        for (Node n : topoOrder)
            names.add(n.name());
        return names;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for constructing the TopologicalOrder.
     * Handles cycle detection and topological sorting.
     */
    public static final class Builder {
        private final List<Node> nodes = new ArrayList<>();
        private final Map<String, Integer> nameToIdx = new HashMap<>();
        private final Map<Integer, Set<Integer>> forwardEdges = new HashMap<>();

        public Builder addNode(Node node) {
            if (nameToIdx.containsKey(node.name()))
                throw new DuplicateNodeException(node.name());
            int idx = nodes.size();
            nodes.add(node);
            nameToIdx.put(node.name(), idx);
            forwardEdges.put(idx, new LinkedHashSet<>());
            return this;
        }

        /** Self-edges are accepted here and reported as a cycle by {@link #build()}. */
        public Builder addEdge(String from, String to) {
            forwardEdges.get(requireIndex(from)).add(requireIndex(to));
            return this;
        }

        private int requireIndex(String name) {
            Integer idx = nameToIdx.get(name);
            if (idx == null)
                throw new UnknownNodeException(name);
            return idx;
        }

        /**
         * Compiles the graph.
         * <p>
         * Performs Kahn's algorithm for topological sorting and cycle detection.
         *
         * @throws CycleException if no total order exists.
         */
        public TopologicalOrder build() {
            int n = nodes.size();
            int[] inDegree = new int[n];

            // 1. Calculate in-degrees
            for (var entry : forwardEdges.entrySet())
                for (int child : entry.getValue())
                    inDegree[child]++;

            // 2. Initialize queue with nodes having in-degree 0
            int[] queue = new int[n];
            int head = 0, tail = 0;
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    queue[tail++] = i;

            // 3. Process queue (Kahn's algorithm)
            int[] topoMap = new int[n], reverseMap = new int[n];
            int topoIdx = 0;
            while (head < tail) {
                int curr = queue[head++];
                topoMap[curr] = topoIdx;
                reverseMap[topoIdx] = curr;
                topoIdx++;
                for (int child : forwardEdges.get(curr))
                    if (--inDegree[child] == 0)
                        queue[tail++] = child;
            }
            if (topoIdx != n)
                throw new CycleException(cycleMembers(inDegree));

            // 4. Construct compact arrays
            Node[] orderedNodes = new Node[n];
            Map<String, Integer> newNameToIndex = new HashMap<>(n * 2);
            for (int ti = 0; ti < n; ti++) {
                orderedNodes[ti] = nodes.get(reverseMap[ti]);
                newNameToIndex.put(orderedNodes[ti].name(), ti);
            }

            // 5. Build CSR structure
            int[] offsets = new int[n + 1];
            for (int ti = 0; ti < n; ti++)
                offsets[ti + 1] = offsets[ti] + forwardEdges.get(reverseMap[ti]).size();

            int[] flatChildren = new int[offsets[n]];
            int[] parentCounts = new int[n];
            for (int ti = 0; ti < n; ti++) {
                int j = offsets[ti];
                for (int child : forwardEdges.get(reverseMap[ti])) {
                    int childTi = topoMap[child];
                    flatChildren[j++] = childTi;
                    parentCounts[childTi]++;
                }
            }

            // 6. Ancestor sets, accumulated parents-first in topological order
            List<Set<String>> ancestorSets = new ArrayList<>(n);
            List<Set<String>> building = new ArrayList<>(n);
            for (int ti = 0; ti < n; ti++)
                building.add(new HashSet<>());
            for (int ti = 0; ti < n; ti++) {
                Set<String> mine = building.get(ti);
                for (int ci = offsets[ti]; ci < offsets[ti + 1]; ci++) {
                    Set<String> childSet = building.get(flatChildren[ci]);
                    childSet.addAll(mine);
                    childSet.add(orderedNodes[ti].name());
                }
                ancestorSets.add(Set.copyOf(mine));
            }
            return new TopologicalOrder(orderedNodes, offsets, flatChildren, parentCounts,
                    List.copyOf(ancestorSets), newNameToIndex);
        }

        /*
         * Nodes left with a positive in-degree after Kahn's pass are on a cycle or
         * downstream of one. Peel off the ones with no edge back into the
         * remainder; what is left sits on, or between, cycles.
         */
        private List<String> cycleMembers(int[] inDegree) {
            Set<Integer> remaining = new LinkedHashSet<>();
            for (int i = 0; i < inDegree.length; i++)
                if (inDegree[i] > 0)
                    remaining.add(i);
            boolean pruned = true;
            while (pruned) {
                pruned = false;
                for (Iterator<Integer> it = remaining.iterator(); it.hasNext();) {
                    int idx = it.next();
                    boolean feedsRemainder = false;
                    for (int child : forwardEdges.get(idx)) {
                        if (remaining.contains(child)) {
                            feedsRemainder = true;
                            break;
                        }
                    }
                    if (!feedsRemainder) {
                        it.remove();
                        pruned = true;
                    }
                }
            }
            List<String> names = new ArrayList<>(remaining.size());
            for (int idx : remaining)
                names.add(nodes.get(idx).name());
            return names;
        }
    }
}
