package com.pocket.graph;

import com.pocket.obj.Author;
import com.pocket.obj.ObjectId;
import com.pocket.obj.Shove;
import com.pocket.obj.ShoveId;
import com.pocket.repo.Repository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.pocket.PocketTestUtil.shoveAll;
import static com.pocket.PocketTestUtil.write;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ShoveGraph 测试")
class ShoveGraphTest {

    private static final ObjectId TREE = ObjectId.of("b".repeat(64));

    private Shove root;
    private Shove left;
    private Shove right;
    private Shove merge;
    private ShoveGraph graph;

    private static Shove shove(String message, long second, Shove... parents) {
        Instant time = Instant.ofEpochSecond(1_700_000_000L + second);
        Author author = Author.builder().name("Tester").email("t@example.com").timestamp(time).build();
        List<ShoveId> parentIds = new ArrayList<>();
        for (Shove p : parents) {
            parentIds.add(p.getId());
        }
        return Shove.create(parentIds, author, time, message, TREE);
    }

    /**
     * root ← left ← merge
     *      ← right ↙
     */
    @BeforeEach
    void setUp() {
        root = shove("root", 1);
        left = shove("left", 2, root);
        right = shove("right", 3, root);
        merge = shove("merge\n\ndetails", 4, left, right);
        Map<String, ShoveId> heads = new LinkedHashMap<>();
        heads.put("main", merge.getId());
        heads.put("feature", right.getId());
        graph = ShoveGraph.build(List.of(root, left, right, merge), heads);
    }

    @Test
    @DisplayName("父子关系、根与叶")
    void structure() {
        assertThat(graph.size()).isEqualTo(4);
        assertThat(graph.roots()).extracting(GraphNode::getId).containsExactly(root.getId());
        assertThat(graph.leaves()).extracting(GraphNode::getId).containsExactly(merge.getId());
        assertThat(graph.getNode(root.getId()).orElseThrow().getChildren())
                .containsExactlyInAnyOrder(left.getId(), right.getId());
        assertThat(graph.getNode(merge.getId()).orElseThrow().getSummary()).isEqualTo("merge");
        assertThat(graph.nodes()).extracting(GraphNode::getId)
                .containsExactly(merge.getId(), right.getId(), left.getId(), root.getId());
    }

    @Test
    @DisplayName("每个 shove 记录所属的 timeline 与指向它的 head")
    void timelines() {
        GraphNode rootNode = graph.getNode(root.getId()).orElseThrow();
        assertThat(rootNode.getTimelines()).containsExactly("feature", "main");
        assertThat(rootNode.getHeads()).isEmpty();
        assertThat(graph.getNode(left.getId()).orElseThrow().getTimelines()).containsExactly("main");
        assertThat(graph.getNode(right.getId()).orElseThrow().getHeads()).containsExactly("feature");
    }

    @Test
    @DisplayName("祖先查询包含自身")
    void ancestors() {
        assertThat(graph.ancestors(merge.getId()))
                .containsExactlyInAnyOrder(merge.getId(), left.getId(), right.getId(), root.getId());
        assertThat(graph.ancestors(left.getId())).containsExactlyInAnyOrder(left.getId(), root.getId());
        assertThat(graph.isAncestor(root.getId(), right.getId())).isTrue();
        assertThat(graph.isAncestor(left.getId(), right.getId())).isFalse();
    }

    @Test
    @DisplayName("拓扑序中子在父之前，同层新的在前")
    void topologicalOrder() {
        assertThat(graph.topologicalOrder()).extracting(GraphNode::getId)
                .containsExactly(merge.getId(), right.getId(), left.getId(), root.getId());
    }

    @Test
    @DisplayName("渲染并行历史线")
    void render() {
        String expected = "* " + merge.getId().shortId() + " (main) merge\n"
                + "| * " + right.getId().shortId() + " (feature) right\n"
                + "* | " + left.getId().shortId() + " left\n"
                + "* " + root.getId().shortId() + " root\n";
        assertThat(graph.render()).isEqualTo(expected);
    }

    @Test
    @DisplayName("缺失的父 shove 与环不会导致死循环")
    void toleratesBrokenHistory() {
        Instant time = Instant.ofEpochSecond(1_700_000_000L);
        Shove x = Shove.builder().id(ShoveId.of("x")).parentIds(List.of(ShoveId.of("y"))).timestamp(time).message("x").build();
        Shove y = Shove.builder().id(ShoveId.of("y")).parentIds(List.of(ShoveId.of("x"))).timestamp(time).message("y").build();
        Shove orphan = Shove.builder().id(ShoveId.of("orphan")).parentIds(List.of(ShoveId.of("ghost")))
                .timestamp(time).message("orphan").build();

        ShoveGraph broken = ShoveGraph.build(List.of(x, y, orphan), Map.of("main", ShoveId.of("x")));

        assertThat(broken.topologicalOrder()).hasSize(3);
        assertThat(broken.ancestors(ShoveId.of("x"))).containsExactlyInAnyOrder(ShoveId.of("x"), ShoveId.of("y"));
        assertThat(broken.ancestors(ShoveId.of("orphan"))).containsExactly(ShoveId.of("orphan"));
    }

    @Test
    @DisplayName("从仓库加载全部 shove 与 timeline")
    void loadFromRepository(@TempDir Path dir) throws Exception {
        Repository repo = Repository.create(dir);
        write(dir, "a.txt", "1");
        Shove first = shoveAll(repo, "first");
        repo.createTimeline("feature", null);
        write(dir, "a.txt", "2");
        Shove second = shoveAll(repo, "second");

        ShoveGraph loaded = ShoveGraph.load(repo);

        assertThat(loaded.size()).isEqualTo(2);
        assertThat(loaded.getNode(first.getId()).orElseThrow().getHeads()).containsExactly("feature");
        assertThat(loaded.getNode(second.getId()).orElseThrow().getHeads()).containsExactly("main");
        assertThat(loaded.render()).startsWith("* " + second.getId().shortId() + " (main) second\n");
    }
}
