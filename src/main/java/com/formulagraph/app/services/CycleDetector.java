package com.formulagraph.app.services;

import com.formulagraph.app.models.Cycle;
import com.formulagraph.app.models.DependencyGraph;
import com.formulagraph.app.models.QualifiedAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Finds circular reference chains with an explicit-stack depth-first traversal.
 *
 * <p>Each root gets a fresh traversal carrying a path vector and an index map
 * (node -> position on the current path). An edge into a node that is on the path closes
 * a cycle; the sub-path from that node to the current one is reported and the traversal
 * backtracks instead of stopping.
 *
 * <p>The root stays on the path for its whole traversal and every node reachable from it
 * is expanded, so any cycle through the root is reported. Roots already covered by a
 * reported cycle are skipped. Worst case is O(V * (V + E)).
 */
@Service
public class CycleDetector {

    private static final Logger logger = LoggerFactory.getLogger(CycleDetector.class);

    public List<Cycle> detect(DependencyGraph graph) {
        Set<Cycle> cycles = new LinkedHashSet<>();
        Set<QualifiedAddress> covered = new HashSet<>();

        for (QualifiedAddress root : graph.getNodes()) {
            // Only formula nodes have outgoing edges
            if (!graph.isFormulaNode(root) || covered.contains(root)) {
                continue;
            }
            traverse(graph, root, cycles, covered);
        }

        if (!cycles.isEmpty()) {
            logger.info("Detected {} circular reference chain(s) over {} cell(s)", cycles.size(), covered.size());
        }
        return new ArrayList<>(cycles);
    }

    /**
     * All nodes that take part in at least one of the given cycles.
     */
    public static Set<QualifiedAddress> members(Collection<Cycle> cycles) {
        Set<QualifiedAddress> members = new LinkedHashSet<>();
        for (Cycle cycle : cycles) {
            members.addAll(cycle.getMembers());
        }
        return members;
    }

    private void traverse(DependencyGraph graph, QualifiedAddress root,
                          Set<Cycle> cycles, Set<QualifiedAddress> covered) {
        Set<QualifiedAddress> visited = new HashSet<>();
        List<QualifiedAddress> path = new ArrayList<>();
        Map<QualifiedAddress, Integer> onPath = new HashMap<>();
        Deque<Frame> stack = new ArrayDeque<>();

        enter(graph, root, visited, path, onPath, stack);
        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.pending.hasNext()) {
                QualifiedAddress next = frame.pending.next();
                Integer position = onPath.get(next);
                if (position != null) {
                    Cycle cycle = new Cycle(path.subList(position, path.size()));
                    if (cycles.add(cycle)) {
                        logger.debug(cycle.getDescription());
                    }
                    covered.addAll(cycle.getMembers());
                } else if (!visited.contains(next)) {
                    enter(graph, next, visited, path, onPath, stack);
                }
            } else {
                stack.pop();
                onPath.remove(path.remove(path.size() - 1));
            }
        }
    }

    private void enter(DependencyGraph graph, QualifiedAddress node, Set<QualifiedAddress> visited,
                       List<QualifiedAddress> path, Map<QualifiedAddress, Integer> onPath, Deque<Frame> stack) {
        visited.add(node);
        onPath.put(node, path.size());
        path.add(node);
        stack.push(new Frame(graph.getDependencies(node).iterator()));
    }

    private static final class Frame {
        private final Iterator<QualifiedAddress> pending;

        private Frame(Iterator<QualifiedAddress> pending) {
            this.pending = pending;
        }
    }
}
