package com.tencent.funcmodel.domain.model;

import com.tencent.funcmodel.domain.shared.Result;
import com.tencent.funcmodel.domain.valueobject.NodeId;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * 容器依赖图的循环检测与拓扑排序。
 * <p>
 * 输入统一为 "节点 -> 其上游依赖" 的映射，只考虑映射中出现的节点之间的依赖。
 * </p>
 */
@Slf4j
public final class DependencyGraph {

    private DependencyGraph() {
    }

    /**
     * 使用 DFS 检测是否存在循环依赖
     */
    public static boolean hasCycle(Map<NodeId, ? extends Collection<NodeId>> dependencies) {
        Set<NodeId> visited = new HashSet<>();
        Set<NodeId> visiting = new HashSet<>();
        for (NodeId nodeId : dependencies.keySet()) {
            if (!visited.contains(nodeId) && hasCycleDfs(nodeId, dependencies, visited, visiting)) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasCycleDfs(NodeId nodeId, Map<NodeId, ? extends Collection<NodeId>> dependencies,
                                       Set<NodeId> visited, Set<NodeId> visiting) {
        visited.add(nodeId);
        visiting.add(nodeId);
        for (NodeId upstream : upstreamOf(nodeId, dependencies)) {
            if (!dependencies.containsKey(upstream)) {
                continue;
            }
            if (visiting.contains(upstream)) {
                log.debug("Cycle detected through edge {} -> {}", upstream, nodeId);
                return true;
            }
            if (!visited.contains(upstream) && hasCycleDfs(upstream, dependencies, visited, visiting)) {
                return true;
            }
        }
        visiting.remove(nodeId);
        return false;
    }

    /**
     * Kahn 算法拓扑排序，入度相同的节点按 registrationOrder 中的先后次序输出。
     *
     * @param registrationOrder 所有节点，按注册顺序排列
     * @param dependencies      节点 -> 上游依赖
     * @return 拓扑序；存在循环时返回失败
     */
    public static Result<List<NodeId>> topologicalSort(List<NodeId> registrationOrder,
                                                       Map<NodeId, ? extends Collection<NodeId>> dependencies) {
        Map<NodeId, Integer> rank = new HashMap<>();
        for (int i = 0; i < registrationOrder.size(); i++) {
            rank.put(registrationOrder.get(i), i);
        }
        Map<NodeId, Integer> inDegree = new HashMap<>();
        Map<NodeId, List<NodeId>> downstream = new HashMap<>();
        for (NodeId nodeId : registrationOrder) {
            int degree = 0;
            for (NodeId upstream : upstreamOf(nodeId, dependencies)) {
                if (rank.containsKey(upstream)) {
                    degree++;
                    downstream.computeIfAbsent(upstream, k -> new ArrayList<>()).add(nodeId);
                }
            }
            inDegree.put(nodeId, degree);
        }

        PriorityQueue<NodeId> ready = new PriorityQueue<>((a, b) -> Integer.compare(rank.get(a), rank.get(b)));
        for (NodeId nodeId : registrationOrder) {
            if (inDegree.get(nodeId) == 0) {
                ready.add(nodeId);
            }
        }

        List<NodeId> sorted = new ArrayList<>(registrationOrder.size());
        while (!ready.isEmpty()) {
            NodeId current = ready.poll();
            sorted.add(current);
            for (NodeId next : downstream.getOrDefault(current, Collections.emptyList())) {
                int remaining = inDegree.merge(next, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(next);
                }
            }
        }

        if (sorted.size() != registrationOrder.size()) {
            return Result.fail("Cycle detected among container dependencies");
        }
        return Result.ok(sorted);
    }

    /**
     * 最长依赖链的深度（无依赖的节点深度为 0）
     */
    public static int maxDepth(Map<NodeId, ? extends Collection<NodeId>> dependencies) {
        Map<NodeId, Integer> memo = new HashMap<>();
        int max = 0;
        for (NodeId nodeId : dependencies.keySet()) {
            max = Math.max(max, depth(nodeId, dependencies, memo, new HashSet<>()));
        }
        return max;
    }

    private static int depth(NodeId nodeId, Map<NodeId, ? extends Collection<NodeId>> dependencies,
                             Map<NodeId, Integer> memo, Set<NodeId> path) {
        Integer cached = memo.get(nodeId);
        if (cached != null) {
            return cached;
        }
        if (!path.add(nodeId)) {
            return 0;
        }
        int result = 0;
        for (NodeId upstream : upstreamOf(nodeId, dependencies)) {
            if (dependencies.containsKey(upstream)) {
                result = Math.max(result, depth(upstream, dependencies, memo, path) + 1);
            }
        }
        path.remove(nodeId);
        memo.put(nodeId, result);
        return result;
    }

    private static Collection<NodeId> upstreamOf(NodeId nodeId, Map<NodeId, ? extends Collection<NodeId>> dependencies) {
        Collection<NodeId> upstream = dependencies.get(nodeId);
        return upstream == null ? Collections.<NodeId>emptyList() : upstream;
    }
}
