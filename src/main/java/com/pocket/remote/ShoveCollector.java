package com.pocket.remote;

import com.pocket.exception.PocketException;
import com.pocket.obj.ObjectId;
import com.pocket.obj.Shove;
import com.pocket.obj.ShoveId;
import com.pocket.obj.Tree;
import com.pocket.obj.TreeEntry;
import lombok.Value;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 从某个 head 出发收集对方缺少的 shove 及其引用的全部对象。
 * 遇到对方已有的 shove 即停止向上遍历。
 */
final class ShoveCollector {

    /** 读取 shove 与 tree 的来源（本地仓库或远端）。 */
    interface Source {
        Shove shove(ShoveId id) throws PocketException, IOException;

        Tree tree(ObjectId id) throws PocketException, IOException;
    }

    @FunctionalInterface
    interface Known {
        boolean has(ShoveId id) throws PocketException;
    }

    /** 收集结果：shove 按父先子后排列。 */
    @Value
    static class Collected {
        List<Shove> shoves;
        Set<ObjectId> objects;
    }

    private final Source source;

    ShoveCollector(Source source) {
        this.source = source;
    }

    Collected collect(ShoveId head, Known known) throws PocketException, IOException {
        List<Shove> ordered = new ArrayList<>();
        Set<ObjectId> objects = new LinkedHashSet<>();
        Map<ShoveId, Shove> loaded = new HashMap<>();
        Set<ShoveId> visited = new HashSet<>();
        Set<ShoveId> done = new HashSet<>();
        Deque<ShoveId> stack = new ArrayDeque<>();
        stack.push(head);
        while (!stack.isEmpty()) {
            ShoveId id = stack.peek();
            if (done.contains(id)) {
                stack.pop();
                continue;
            }
            if (visited.add(id)) {
                if (known.has(id)) {
                    done.add(id);
                    stack.pop();
                    continue;
                }
                Shove shove = source.shove(id);
                loaded.put(id, shove);
                for (ShoveId parent : shove.getParentIds()) {
                    if (!visited.contains(parent)) {
                        stack.push(parent);
                    }
                }
                continue;
            }
            // 所有父 shove 已处理
            stack.pop();
            done.add(id);
            Shove shove = loaded.get(id);
            ordered.add(shove);
            collectTree(shove.getRootTreeId(), objects);
        }
        return new Collected(ordered, objects);
    }

    private void collectTree(ObjectId treeId, Set<ObjectId> objects) throws PocketException, IOException {
        if (!objects.add(treeId)) {
            return;
        }
        Tree tree = source.tree(treeId);
        for (TreeEntry entry : tree.getEntries()) {
            if (entry.isTree()) {
                collectTree(entry.getId(), objects);
            } else {
                objects.add(entry.getId());
            }
        }
    }
}
