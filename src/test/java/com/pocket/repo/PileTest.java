package com.pocket.repo;

import com.pocket.exception.PileException;
import com.pocket.obj.ObjectId;
import com.pocket.obj.ShoveId;
import com.pocket.obj.TreeEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Pile 测试")
class PileTest {

    private static final ShoveId HEAD = ShoveId.of("head-1");

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static Snapshot headWith(ObjectStore store, String path, String content) throws Exception {
        SortedMap<String, TreeEntry> files = new TreeMap<>();
        files.put(path, TreeEntry.file(path, store.store(bytes(content))));
        return new Snapshot(HEAD, files);
    }

    @Test
    @DisplayName("HEAD 中没有的文件为 ADDED，内容不同为 MODIFIED")
    void addPath_classifiesAgainstHead(@TempDir Path dir) throws Exception {
        ObjectStore store = new ObjectStore(dir);
        Snapshot head = headWith(store, "a.txt", "v1");
        Pile pile = new Pile();

        PileEntry added = pile.addPath("b.txt", bytes("new"), store, head).orElseThrow();
        PileEntry modified = pile.addPath("a.txt", bytes("v2"), store, head).orElseThrow();

        assertThat(added.getStatus()).isEqualTo(PileStatus.ADDED);
        assertThat(modified.getStatus()).isEqualTo(PileStatus.MODIFIED);
        assertThat(store.get(modified.getObjectId())).isEqualTo(bytes("v2"));
        assertThat(pile.getBaseShove()).isEqualTo(HEAD);
        assertThat(pile.getEntries()).extracting(PileEntry::getPath).containsExactly("a.txt", "b.txt");
    }

    @Test
    @DisplayName("内容与 HEAD 相同时不暂存，并移除已有记录")
    void addPath_identicalToHead_removesEntry(@TempDir Path dir) throws Exception {
        ObjectStore store = new ObjectStore(dir);
        Snapshot head = headWith(store, "a.txt", "v1");
        Pile pile = new Pile();
        pile.addPath("a.txt", bytes("v2"), store, head);

        Optional<PileEntry> reverted = pile.addPath("a.txt", bytes("v1"), store, head);

        assertThat(reverted).isEmpty();
        assertThat(pile.isEmpty()).isTrue();
        assertThat(pile.getBaseShove()).isNull();
    }

    @Test
    @DisplayName("同一路径只保留最后一次暂存")
    void addPath_samePathTwice_keepsLatest(@TempDir Path dir) throws Exception {
        ObjectStore store = new ObjectStore(dir);
        Pile pile = new Pile();
        pile.addPath("a.txt", bytes("one"), store, Snapshot.empty());
        pile.addPath("a.txt", bytes("two"), store, Snapshot.empty());

        assertThat(pile.size()).isEqualTo(1);
        assertThat(pile.get("a.txt").getObjectId()).isEqualTo(ObjectStore.hash(bytes("two")));
    }

    @Test
    @DisplayName("删除只能针对已跟踪文件")
    void markDeleted_requiresTrackedPath(@TempDir Path dir) throws Exception {
        ObjectStore store = new ObjectStore(dir);
        Snapshot head = headWith(store, "a.txt", "v1");
        Pile pile = new Pile();

        assertThat(pile.markDeleted("a.txt", head).getStatus()).isEqualTo(PileStatus.DELETED);
        assertThatThrownBy(() -> pile.markDeleted("ghost.txt", head)).isInstanceOf(PileException.class);
    }

    @Test
    @DisplayName("移除不存在的记录抛 PileException")
    void removePath_missing_throws() {
        Pile pile = new Pile();
        assertThatThrownBy(() -> pile.removePath("nope.txt"))
                .isInstanceOf(PileException.class)
                .hasMessageContaining("nope.txt");
    }

    @Test
    @DisplayName("applyTo 写入新增与修改、移除删除与改名的旧路径")
    void applyTo_producesNewFileView(@TempDir Path dir) throws Exception {
        ObjectStore store = new ObjectStore(dir);
        ObjectId keep = store.store(bytes("keep"));
        ObjectId gone = store.store(bytes("gone"));
        ObjectId moved = store.store(bytes("moved"));
        SortedMap<String, TreeEntry> files = new TreeMap<>();
        files.put("keep.txt", TreeEntry.file("keep.txt", keep));
        files.put("gone.txt", TreeEntry.file("gone.txt", gone));
        files.put("old.txt", TreeEntry.file("old.txt", moved));
        Snapshot head = new Snapshot(HEAD, files);

        Pile pile = new Pile();
        pile.addPath("new/file.txt", bytes("fresh"), store, head);
        pile.markDeleted("gone.txt", head);
        pile.markRenamed("old.txt", "renamed.txt", moved, head);

        SortedMap<String, TreeEntry> result = pile.applyTo(head.getFiles());

        assertThat(result.keySet()).containsExactly("keep.txt", "new/file.txt", "renamed.txt");
        assertThat(result.get("renamed.txt").getId()).isEqualTo(moved);
        assertThat(result.get("new/file.txt").getName()).isEqualTo("new/file.txt");
    }

    @Test
    @DisplayName("保存后重新加载得到相同的 pile")
    void saveAndLoad_preservesEntries(@TempDir Path dir) throws Exception {
        ObjectStore store = new ObjectStore(dir);
        Snapshot head = headWith(store, "a.txt", "v1");
        Pile pile = new Pile();
        pile.addPath("a.txt", bytes("v2"), TreeEntry.MODE_EXECUTABLE, store, head);
        pile.addPath("dir/b.txt", bytes("b"), store, head);
        pile.markRenamed("a.txt", "c.txt", store.store(bytes("v1")), head);
        Path file = dir.resolve("piles").resolve("current.toml");

        pile.save(file);
        Pile loaded = Pile.load(file);

        assertThat(loaded).isEqualTo(pile);
        assertThat(loaded.getBaseShove()).isEqualTo(HEAD);
        assertThat(loaded.get("c.txt").getOriginalPath()).isEqualTo("a.txt");
    }

    @Test
    @DisplayName("文件不存在时加载为空 pile")
    void load_missingFile_isEmpty(@TempDir Path dir) throws Exception {
        Pile pile = Pile.load(dir.resolve("missing.toml"));
        assertThat(pile.isEmpty()).isTrue();
        assertThat(pile.getBaseShove()).isNull();
    }

    @Test
    @DisplayName("基准 head 与当前 head 不同时 pile 过期")
    void isStale_comparesBaseShove(@TempDir Path dir) throws Exception {
        ObjectStore store = new ObjectStore(dir);
        Pile pile = new Pile();
        assertThat(pile.isStale(ShoveId.of("other"))).isFalse();

        pile.addPath("a.txt", bytes("x"), store, new Snapshot(HEAD, new TreeMap<>()));

        assertThat(pile.isStale(HEAD)).isFalse();
        assertThat(pile.isStale(ShoveId.of("other"))).isTrue();
    }
}
