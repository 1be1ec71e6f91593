package com.pocket.graph;

import com.pocket.exception.PocketException;
import com.pocket.obj.Shove;
import com.pocket.obj.ShoveId;
import com.pocket.remote.Remote;
import com.pocket.repo.Refs;
import com.pocket.repo.Repository;
import com.pocket.repo.Timeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 全部 shove 与 timeline 的内存 DAG 视图。
 * 磁盘数据不可信：所有向上遍历都带 visited 集合，缺失的父 shove 只记录警告。
 */
public final class ShoveGraph {

    private static final Logger log = LoggerFactory.getLogger(ShoveGraph.class);

    /** 新的在前；时间相同时按 id 排序，保证输出稳定。 */
    private static final Comparator<GraphNode> NEWEST_FIRST = Comparator
            .comparing(GraphNode::getTimestamp, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(GraphNode::getId);

    private final Map<ShoveId, GraphNode> nodes;

    private ShoveGraph(Map<ShoveId, GraphNode> nodes) {
        this.nodes = nodes;
    }

    /**
     * 读取全部持久化的 shove、本地 timeline 与远端跟踪 timeline（名称为 remote/name）。
     */
    public static ShoveGraph load(Repository repo) throws PocketException, IOException {
        Refs refs = repo.getRefs();
        List<Shove> shoves = new ArrayList<>();
        for (ShoveId id : refs.listShoveIds()) {
            shoves.add(refs.loadShove(id));
        }
        Map<String, ShoveId> heads = new LinkedHashMap<>();
        for (Timeline timeline : refs.listTimelines()) {
            if (timeline.hasHead()) {
                heads.put(timeline.getName(), timeline.getHead());
            }
        }
        for (Remote remote : repo.getConfig().getRemote().getRemotes()) {
            for (Timeline timeline : refs.listRemoteTimelines(remote.getName())) {
                if (timeline.hasHead()) {
                    heads.put(Refs.remoteTimelineName(remote.getName(), timeline.getName()), timeline.getHead());
                }
            }
        }
        return build(shoves, heads);
    }

    /** 由 shove 列表与 timeline head 构建图。 */
    public static ShoveGraph build(Collection<Shove> shoves, Map<String, ShoveId> heads) {
        Map<ShoveId, GraphNode> nodes = new HashMap<>();
        for (Shove shove : shoves) {
            nodes.put(shove.getId(), new GraphNode(shove.getId(), shove.getMessage(), shove.getTimestamp(),
                    shove.getParentIds()));
        }
        for (GraphNode node : nodes.values()) {
            for (ShoveId parent : node.getParents()) {
                GraphNode p = nodes.get(parent);
                if (p == null) {
                    log.warn("shove {} references missing parent {}", node.getId().shortId(), parent.shortId());
                    continue;
                }
                p.addChild(node.getId());
            }
        }
        ShoveGraph graph = new ShoveGraph(nodes);
        for (Map.Entry<String, ShoveId> head : heads.entrySet()) {
            GraphNode node = nodes.get(head.getValue());
            if (node == null) {
                log.warn("timeline {} points at missing shove {}", head.getKey(), head.getValue().shortId());
                continue;
            }
            node.addHead(head.getKey());
            for (ShoveId id : graph.ancestors(head.getValue())) {
                nodes.get(id).addTimeline(head.getKey());
            }
        }
        log.debug("built graph with {} shoves and {} timelines", nodes.size(), heads.size());
        return graph;
    }

    public Optional<GraphNode> getNode(ShoveId id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public int size() {
        return nodes.size();
    }

    /** 没有父 shove 的节点，新的在前。 */
    public List<GraphNode> roots() {
        return nodes.values().stream().filter(GraphNode::isRoot).sorted(NEWEST_FIRST).collect(Collectors.toList());
    }

    /** 没有子 shove 的节点，新的在前。 */
    public List<GraphNode> leaves() {
        return nodes.values().stream().filter(GraphNode::isLeaf).sorted(NEWEST_FIRST).collect(Collectors.toList());
    }

    /** id 自身及其全部祖先（图中存在的部分）。 */
    public Set<ShoveId> ancestors(ShoveId id) {
        Set<ShoveId> seen = new HashSet<>();
        Deque<ShoveId> queue = new ArrayDeque<>();
        queue.add(id);
        while (!queue.isEmpty()) {
            ShoveId current = queue.poll();
            GraphNode node = nodes.get(current);
            if (node == null || !seen.add(current)) {
                continue;
            }
            queue.addAll(node.getParents());
        }
        return seen;
    }

    /** ancestor 是否为 descendant 本身或其祖先。 */
    public boolean isAncestor(ShoveId ancestor, ShoveId descendant) {
        return nodes.containsKey(ancestor) && ancestors(descendant).contains(ancestor);
    }

    /**
     * 拓扑序：子在父之前，同一层新的在前。有环的残余节点按时间追加在末尾。
     */
    public List<GraphNode> topologicalOrder() {
        Map<ShoveId, Integer> pendingChildren = new HashMap<>();
        PriorityQueue<GraphNode> ready = new PriorityQueue<>(NEWEST_FIRST);
        for (GraphNode node : nodes.values()) {
            pendingChildren.put(node.getId(), node.getChildren().size());
            if (node.isLeaf()) {
                ready.add(node);
            }
        }
        List<GraphNode> order = new ArrayList<>();
        Set<ShoveId> emitted = new HashSet<>();
        while (!ready.isEmpty()) {
            GraphNode node = ready.poll();
            if (!emitted.add(node.getId())) {
                continue;
            }
            order.add(node);
            for (ShoveId parent : new HashSet<>(node.getParents())) {
                GraphNode p = nodes.get(parent);
                if (p == null) {
                    continue;
                }
                int left = pendingChildren.merge(parent, -1, Integer::sum);
                if (left == 0) {
                    ready.add(p);
                }
            }
        }
        if (order.size() < nodes.size()) {
            List<GraphNode> rest = nodes.values().stream()
                    .filter(n -> !emitted.contains(n.getId()))
                    .sorted(NEWEST_FIRST)
                    .collect(Collectors.toList());
            log.warn("graph contains a cycle through {} shove(s)", rest.size());
            order.addAll(rest);
        }
        return order;
    }

    /**
     * 文本形式的图：每行一个 shove，按列画出并行的历史线。
     * <pre>
     * * 1a2b3c4d (main) Merge timeline 'feature' into main
     * | * 5e6f7a8b (feature) add feature
     * * | 9c0d1e2f fix typo
     * </pre>
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        List<ShoveId> lanes = new ArrayList<>();
        for (GraphNode node : topologicalOrder()) {
            int col = lanes.indexOf(node.getId());
            if (col < 0) {
                lanes.add(node.getId());
                col = lanes.size() - 1;
            }
            StringBuilder row = new StringBuilder();
            for (int i = 0; i < lanes.size(); i++) {
                if (i > 0) {
                    row.append(' ');
                }
                row.append(i == col ? '*' : '|');
            }
            sb.append(row).append(' ').append(node.getId().shortId());
            if (!node.getHeads().isEmpty()) {
                sb.append(" (").append(String.join(", ", node.getHeads())).append(')');
            }
            sb.append(' ').append(node.getSummary()).append('\n');

            // 当前列由第一个父接替，其余父占新列；同一 shove 只保留一列
            for (int i = lanes.size() - 1; i > col; i--) {
                if (lanes.get(i).equals(node.getId())) {
                    lanes.remove(i);
                }
            }
            List<ShoveId> parents = node.getParents().stream()
                    .filter(nodes::containsKey)
                    .collect(Collectors.toList());
            if (parents.isEmpty() || lanes.contains(parents.get(0))) {
                lanes.remove(col);
            } else {
                lanes.set(col, parents.get(0));
            }
            for (ShoveId parent : parents.subList(Math.min(1, parents.size()), parents.size())) {
                if (!lanes.contains(parent)) {
                    lanes.add(parent);
                }
            }
        }
        return sb.toString();
    }

    /** 所有节点，新的在前。 */
    public List<GraphNode> nodes() {
        List<GraphNode> all = new ArrayList<>(nodes.values());
        all.sort(NEWEST_FIRST);
        return Collections.unmodifiableList(all);
    }
}
