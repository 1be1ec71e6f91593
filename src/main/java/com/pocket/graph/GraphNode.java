package com.pocket.graph;

import com.pocket.obj.ShoveId;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * 图中的一个 shove：父、子以及能到达它的 timeline。
 */
@Getter
@ToString
public final class GraphNode {

    private final ShoveId id;
    private final String message;
    private final Instant timestamp;
    private final List<ShoveId> parents;
    private final Set<ShoveId> children = new TreeSet<>();
    /** head 能到达该 shove 的 timeline。 */
    private final Set<String> timelines = new TreeSet<>();
    /** head 正好是该 shove 的 timeline。 */
    private final Set<String> heads = new TreeSet<>();

    GraphNode(ShoveId id, String message, Instant timestamp, List<ShoveId> parents) {
        this.id = id;
        this.message = message;
        this.timestamp = timestamp;
        this.parents = List.copyOf(parents);
    }

    public Set<ShoveId> getChildren() {
        return Collections.unmodifiableSet(children);
    }

    public Set<String> getTimelines() {
        return Collections.unmodifiableSet(timelines);
    }

    public Set<String> getHeads() {
        return Collections.unmodifiableSet(heads);
    }

    public boolean isRoot() {
        return parents.isEmpty();
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /** 提交信息首行。 */
    public String getSummary() {
        if (message == null) {
            return "";
        }
        int nl = message.indexOf('\n');
        return nl >= 0 ? message.substring(0, nl) : message;
    }

    void addChild(ShoveId child) {
        children.add(child);
    }

    void addTimeline(String name) {
        timelines.add(name);
    }

    void addHead(String name) {
        heads.add(name);
    }
}
