package com.pocket.diff;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DiffEngine 测试")
class DiffEngineTest {

    private final DiffEngine engine = new DiffEngine();

    private static String lines(int count) {
        StringBuilder sb = new StringBuilder();
        for (int i = 1; i <= count; i++) {
            sb.append("line").append(i).append('\n');
        }
        return sb.toString();
    }

    @Test
    @DisplayName("按行切分，末尾换行不产生空行")
    void splitLines() {
        assertThat(DiffEngine.splitLines("a\nb")).containsExactly("a", "b");
        assertThat(DiffEngine.splitLines("a\nb\n")).containsExactly("a", "b");
        assertThat(DiffEngine.splitLines("a\n\nb\n")).containsExactly("a", "", "b");
        assertThat(DiffEngine.splitLines("")).isEmpty();
        assertThat(DiffEngine.splitLines(null)).isEmpty();
    }

    @Test
    @DisplayName("相同文本没有 hunk")
    void identical() {
        DiffResult result = engine.diff("a.txt", "x\ny\n", "a.txt", "x\ny\n", DiffOptions.defaults());
        assertThat(result.isIdentical()).isTrue();
        assertThat(engine.editScript(List.of("x", "y"), List.of("x", "y")))
                .allMatch(Edit::isKeep);
    }

    @Test
    @DisplayName("修改一行生成一个 Changed 与带上下文的 hunk")
    void singleLineChange() {
        DiffResult result = engine.diff("f.txt", "a\nb\nc\n", "f.txt", "a\nB\nc\n", DiffOptions.defaults());

        assertThat(result.getHunks()).hasSize(1);
        DiffHunk hunk = result.getHunks().get(0);
        assertThat(hunk.header()).isEqualTo("@@ -1,3 +1,3 @@");
        assertThat(hunk.getLines()).extracting(DiffLine::toString).containsExactly(" a", "-b", "+B", " c");
        assertThat(hunk.getChanges()).containsExactly(new DiffChange.Changed(2, List.of("b"), 2, List.of("B")));
    }

    @Test
    @DisplayName("新文件的所有行都是新增")
    void newFile() {
        DiffResult result = engine.diff(null, null, "n.txt", "x\ny\n", DiffOptions.defaults());

        DiffHunk hunk = result.getHunks().get(0);
        assertThat(hunk.header()).isEqualTo("@@ -0,0 +1,2 @@");
        assertThat(hunk.getChanges()).containsExactly(new DiffChange.Added(1, List.of("x", "y")));
    }

    @Test
    @DisplayName("删除行生成 Removed")
    void removedLines() {
        DiffResult result = engine.diff("f", "a\nb\nc\n", "f", "a\nc\n", DiffOptions.defaults());
        assertThat(result.getHunks().get(0).getChanges()).containsExactly(new DiffChange.Removed(2, List.of("b")));
    }

    @Test
    @DisplayName("相距较远的修改拆成多个 hunk，增大上下文后合并")
    void hunkGrouping() {
        String before = lines(20);
        String after = before.replace("line2\n", "LINE2\n").replace("line18\n", "LINE18\n");

        DiffResult split = engine.diff("f", before, "f", after, DiffOptions.defaults());
        assertThat(split.getHunks()).extracting(DiffHunk::header)
                .containsExactly("@@ -1,5 +1,5 @@", "@@ -15,6 +15,6 @@");

        DiffResult merged = engine.diff("f", before, "f", after, DiffOptions.builder().contextLines(10).build());
        assertThat(merged.getHunks()).hasSize(1);
        assertThat(merged.getHunks().get(0).getChanges()).hasSize(2);
    }

    @Test
    @DisplayName("忽略空白与大小写选项")
    void ignoreOptions() {
        DiffOptions ws = DiffOptions.builder().ignoreWhitespace(true).build();
        DiffOptions ic = DiffOptions.builder().ignoreCase(true).build();

        assertThat(engine.diff("f", "a  b\n", "f", " a b\n", ws).isIdentical()).isTrue();
        assertThat(engine.diff("f", "a  b\n", "f", " a b\n", DiffOptions.defaults()).isIdentical()).isFalse();
        assertThat(engine.diff("f", "Hello\n", "f", "hello\n", ic).isIdentical()).isTrue();
    }

    @Test
    @DisplayName("含 NUL 的内容按二进制处理")
    void binary() {
        byte[] bin = {1, 0, 2};
        DiffResult result = engine.diff("b.bin", bin, "b.bin", "text".getBytes(StandardCharsets.UTF_8), DiffOptions.defaults());

        assertThat(result.isBinary()).isTrue();
        assertThat(result.getHunks()).isEmpty();
        assertThat(DiffEngine.format(result)).contains("Binary files differ");
    }

    @Test
    @DisplayName("编辑脚本长度等于保留行加最少的增删行")
    void editScript_isMinimal() {
        List<String> a = new ArrayList<>(List.of("a", "b", "c", "a", "b", "b", "a"));
        List<String> b = new ArrayList<>(List.of("c", "b", "a", "b", "a", "c"));

        List<Edit> script = engine.editScript(a, b);

        long changes = script.stream().filter(e -> !e.isKeep()).count();
        assertThat(changes).isEqualTo(5);
    }

    @Test
    @DisplayName("删除在同一段变化中排在新增之前，行号连续")
    void editScript_deletesBeforeInserts() {
        List<Edit> script = engine.editScript(List.of("a", "x", "y", "b"), List.of("a", "p", "q", "b"));

        assertThat(script).extracting(Edit::getType).containsExactly(
                Edit.Type.KEEP, Edit.Type.DELETE, Edit.Type.DELETE,
                Edit.Type.INSERT, Edit.Type.INSERT, Edit.Type.KEEP);
        assertThat(script.get(1).getOldIndex()).isEqualTo(1);
        assertThat(script.get(3).getNewIndex()).isEqualTo(1);
    }

    @Test
    @DisplayName("整篇重写一万行的文件也能在线性内存内得到编辑脚本")
    void editScript_largeRewrite() {
        List<String> before = new ArrayList<>();
        List<String> after = new ArrayList<>();
        for (int i = 0; i < 10_000; i++) {
            before.add("old " + i);
            after.add("new " + i);
        }

        List<Edit> script = engine.editScript(before, after);

        assertThat(script).hasSize(20_000);
        assertThat(script).filteredOn(e -> e.getType() == Edit.Type.DELETE).hasSize(10_000);
        assertThat(script).filteredOn(e -> e.getType() == Edit.Type.INSERT).hasSize(10_000);
        assertThat(script).noneMatch(Edit::isKeep);
    }

    @Test
    @DisplayName("大文件中零散的修改仍得到最短脚本")
    void editScript_largeSparseChanges() {
        List<String> before = new ArrayList<>();
        for (int i = 0; i < 5_000; i++) {
            before.add("line " + i);
        }
        List<String> after = new ArrayList<>(before);
        after.set(100, "changed 100");
        after.remove(2_500);
        after.add(4_000, "inserted");

        List<Edit> script = engine.editScript(before, after);

        assertThat(script).filteredOn(e -> !e.isKeep()).hasSize(4);
        assertThat(script).filteredOn(Edit::isKeep).hasSize(4_998);
    }

    @Test
    @DisplayName("渲染 unified diff")
    void format() {
        DiffResult result = engine.diff("f.txt", "a\nb\n", "f.txt", "a\nc\n", DiffOptions.defaults());
        assertThat(DiffEngine.format(result)).isEqualTo(
                "--- a/f.txt\n+++ b/f.txt\n@@ -1,2 +1,2 @@\n a\n-b\n+c\n");
    }
}
