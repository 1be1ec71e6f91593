package com.pocket.merge;

import com.pocket.exception.MergeException;
import com.pocket.exception.UncommittedChangesException;
import com.pocket.exception.UnrelatedHistoriesException;
import com.pocket.exception.UnresolvedConflictsException;
import com.pocket.obj.FileChange;
import com.pocket.obj.ObjectId;
import com.pocket.obj.Shove;
import com.pocket.obj.ShoveId;
import com.pocket.obj.TreeEntry;
import com.pocket.repo.Repository;
import com.pocket.repo.Timeline;
import com.pocket.repo.TreeWalker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import static com.pocket.PocketTestUtil.read;
import static com.pocket.PocketTestUtil.shoveAll;
import static com.pocket.PocketTestUtil.write;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MergeEngine 测试")
class MergeEngineTest {

    private static final String BASE_TEXT = "line1\nline2\nline3\nline4\nline5\n";

    @TempDir
    Path root;

    private Repository repo;
    private MergeEngine engine;
    private Shove base;

    @BeforeEach
    void setUp() throws Exception {
        repo = Repository.create(root);
        engine = new MergeEngine(repo);
        write(root, "a.txt", BASE_TEXT);
        base = shoveAll(repo, "base");
        repo.createTimeline("feature", null);
    }

    /** 在 feature 上写入内容并 shove，然后切回 main。 */
    private Shove onFeature(String path, String content) throws Exception {
        repo.switchTimeline("feature", false);
        write(root, path, content);
        Shove shove = shoveAll(repo, "feature: " + path);
        repo.switchTimeline("main", false);
        return shove;
    }

    private Shove onMain(String path, String content) throws Exception {
        write(root, path, content);
        return shoveAll(repo, "main: " + path);
    }

    @Test
    @DisplayName("当前 timeline 是对方祖先时快进")
    void fastForward() throws Exception {
        Shove theirs = onFeature("a.txt", "changed\n");

        MergeResult result = engine.merge("feature", MergeStrategy.AUTO);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isFastForward()).isTrue();
        assertThat(result.getNewShove()).isNull();
        assertThat(repo.getHead()).isEqualTo(theirs.getId());
        assertThat(read(root, "a.txt")).isEqualTo("changed\n");
    }

    @Test
    @DisplayName("对方已包含在当前历史中时什么也不做")
    void alreadyUpToDate() throws Exception {
        MergeResult same = engine.merge("feature", MergeStrategy.AUTO);
        assertThat(same.isSuccess()).isTrue();
        assertThat(same.getMessage()).isEqualTo("Already up to date.");

        Shove ours = onMain("b.txt", "b\n");
        MergeResult behind = engine.merge("feature", MergeStrategy.AUTO);
        assertThat(behind.getMessage()).isEqualTo("Already up to date.");
        assertThat(repo.getHead()).isEqualTo(ours.getId());
    }

    @Test
    @DisplayName("分叉且修改不重叠时生成双父合并 shove")
    void threeWay_clean() throws Exception {
        Shove theirs = onFeature("a.txt", BASE_TEXT.replace("line5", "LINE5"));
        write(root, "b.txt", "main only\n");
        Shove ours = onMain("a.txt", BASE_TEXT.replace("line1", "LINE1"));

        MergeResult result = engine.merge("feature", MergeStrategy.AUTO);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isFastForward()).isFalse();
        assertThat(result.getBase()).isEqualTo(base.getId());
        Shove merge = repo.getRefs().loadShove(result.getNewShove());
        assertThat(merge.getParentIds()).containsExactly(ours.getId(), theirs.getId());
        assertThat(repo.getHead()).isEqualTo(merge.getId());
        assertThat(read(root, "a.txt")).isEqualTo("LINE1\nline2\nline3\nline4\nLINE5\n");
        assertThat(read(root, "b.txt")).isEqualTo("main only\n");
        assertThat(repo.status().isClean()).isTrue();

        Map<ShoveId, List<FileChange>> byParent = repo.getChangesByParent(merge);
        assertThat(byParent.get(ours.getId())).extracting(FileChange::getPath).containsExactly("a.txt");
        assertThat(byParent.get(theirs.getId())).extracting(FileChange::getPath).containsExactly("a.txt", "b.txt");
    }

    @Test
    @DisplayName("同一行冲突：写入冲突标记并阻止 shove，解决后生成合并 shove")
    void conflict_thenResolveWithTheirs() throws Exception {
        Shove theirs = onFeature("a.txt", BASE_TEXT.replace("line3", "THEIRS"));
        Shove ours = onMain("a.txt", BASE_TEXT.replace("line3", "OURS"));

        MergeResult result = engine.merge("feature", MergeStrategy.AUTO);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getConflicts()).extracting(MergeConflict::getPath).containsExactly("a.txt");
        assertThat(read(root, "a.txt")).contains("<<<<<<< ours\nOURS\n=======\nTHEIRS\n>>>>>>> theirs\n");
        assertThat(repo.status().getConflicts()).containsExactly("a.txt");
        assertThat(repo.getHead()).isEqualTo(ours.getId());
        assertThatThrownBy(() -> repo.createShove("too early")).isInstanceOf(UnresolvedConflictsException.class);
        assertThatThrownBy(() -> engine.merge("feature", MergeStrategy.AUTO)).isInstanceOf(MergeException.class);

        engine.resolve("a.txt", ConflictResolution.useTheirs());
        assertThat(read(root, "a.txt")).isEqualTo(BASE_TEXT.replace("line3", "THEIRS"));

        Shove merge = repo.createShove("merge feature");
        assertThat(merge.getParentIds()).containsExactly(ours.getId(), theirs.getId());
        assertThat(MergeState.load(repo.getPocketDir())).isEmpty();
        assertThat(repo.snapshot(merge.getId()).idOf("a.txt")).isEqualTo(repo.snapshot(theirs.getId()).idOf("a.txt"));
    }

    @Test
    @DisplayName("手工编辑冲突文件并暂存即视为已解决")
    void conflict_resolvedByPiling() throws Exception {
        onFeature("a.txt", BASE_TEXT.replace("line3", "THEIRS"));
        onMain("a.txt", BASE_TEXT.replace("line3", "OURS"));
        engine.merge("feature", MergeStrategy.AUTO);

        write(root, "a.txt", BASE_TEXT.replace("line3", "BOTH"));
        repo.pile(List.of("a.txt"));

        assertThat(repo.status().getConflicts()).isEmpty();
        Shove merge = repo.createShove("merge by hand");
        assertThat(merge.isMerge()).isTrue();
        assertThat(read(root, "a.txt")).contains("BOTH");
    }

    @Test
    @DisplayName("放弃合并恢复当前 head 的内容")
    void abort() throws Exception {
        onFeature("a.txt", BASE_TEXT.replace("line3", "THEIRS"));
        onFeature("new.txt", "from feature\n");
        Shove ours = onMain("a.txt", BASE_TEXT.replace("line3", "OURS"));
        engine.merge("feature", MergeStrategy.AUTO);
        assertThat(root.resolve("new.txt")).exists();

        engine.abortMerge();

        assertThat(read(root, "a.txt")).isEqualTo(BASE_TEXT.replace("line3", "OURS"));
        assertThat(root.resolve("new.txt")).doesNotExist();
        assertThat(MergeState.load(repo.getPocketDir())).isEmpty();
        assertThat(repo.getHead()).isEqualTo(ours.getId());
        assertThat(repo.status().isClean()).isTrue();
        assertThatThrownBy(() -> engine.abortMerge()).isInstanceOf(MergeException.class);
    }

    @Test
    @DisplayName("OURS / THEIRS 策略自动解决冲突")
    void oursAndTheirsStrategies() throws Exception {
        onFeature("a.txt", BASE_TEXT.replace("line3", "THEIRS"));
        onMain("a.txt", BASE_TEXT.replace("line3", "OURS"));

        MergeResult result = engine.merge("feature", MergeStrategy.THEIRS);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getNewShove()).isNotNull();
        assertThat(result.getConflicts()).allMatch(MergeConflict::isResolved);
        assertThat(read(root, "a.txt")).isEqualTo(BASE_TEXT.replace("line3", "THEIRS"));

        onFeature("a.txt", BASE_TEXT.replace("line3", "THEIRS-2"));
        onMain("a.txt", BASE_TEXT.replace("line3", "OURS-2"));
        assertThat(engine.merge("feature", MergeStrategy.OURS).isSuccess()).isTrue();
        assertThat(read(root, "a.txt")).isEqualTo(BASE_TEXT.replace("line3", "OURS-2"));
    }

    @Test
    @DisplayName("FAST_FORWARD_ONLY 在分叉时失败且不改动仓库")
    void fastForwardOnly() throws Exception {
        onFeature("f.txt", "f\n");
        Shove ours = onMain("m.txt", "m\n");

        MergeResult result = engine.merge("feature", MergeStrategy.FAST_FORWARD_ONLY);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage()).contains("Not possible to fast-forward");
        assertThat(repo.getHead()).isEqualTo(ours.getId());
        assertThat(root.resolve("f.txt")).doesNotExist();
    }

    @Test
    @DisplayName("ALWAYS_CREATE_SHOVE 在可以快进时也生成合并 shove")
    void alwaysCreateShove() throws Exception {
        Shove theirs = onFeature("f.txt", "f\n");

        MergeResult result = engine.merge("feature", MergeStrategy.ALWAYS_CREATE_SHOVE);

        assertThat(result.isFastForward()).isFalse();
        Shove merge = repo.getRefs().loadShove(result.getNewShove());
        assertThat(merge.getParentIds()).containsExactly(base.getId(), theirs.getId());
        assertThat(read(root, "f.txt")).isEqualTo("f\n");
    }

    @Test
    @DisplayName("没有公共祖先时拒绝合并")
    void unrelatedHistories() throws Exception {
        onMain("m.txt", "m\n");
        SortedMap<String, TreeEntry> files = new TreeMap<>();
        ObjectId blob = repo.getObjects().store("orphan\n".getBytes(StandardCharsets.UTF_8));
        files.put("orphan.txt", TreeEntry.file("orphan.txt", blob));
        Instant now = Instant.parse("2024-01-01T00:00:00Z");
        Shove orphan = Shove.create(List.of(), repo.currentAuthor(now), now, "orphan",
                TreeWalker.build(repo.getObjects(), files));
        repo.getRefs().saveShove(orphan);
        repo.getRefs().saveTimeline(new Timeline("orphan", orphan.getId()));

        assertThatThrownBy(() -> engine.merge("orphan", MergeStrategy.AUTO))
                .isInstanceOf(UnrelatedHistoriesException.class)
                .hasMessageContaining("unrelated histories");
    }

    @Test
    @DisplayName("有未提交修改时拒绝合并")
    void uncommittedChanges() throws Exception {
        onFeature("f.txt", "f\n");
        write(root, "a.txt", "dirty\n");

        assertThatThrownBy(() -> engine.merge("feature", MergeStrategy.AUTO))
                .isInstanceOf(UncommittedChangesException.class);
    }

    @Test
    @DisplayName("快进会覆盖同名未跟踪文件时拒绝合并并保留文件")
    void fastForward_untrackedWouldBeOverwritten() throws Exception {
        onFeature("notes.txt", "from feature\n");
        write(root, "notes.txt", "my local notes\n");

        assertThatThrownBy(() -> engine.merge("feature", MergeStrategy.AUTO))
                .isInstanceOf(UncommittedChangesException.class)
                .hasMessageContaining("untracked file 'notes.txt' would be overwritten");
        assertThat(read(root, "notes.txt")).isEqualTo("my local notes\n");
        assertThat(repo.getHead()).isEqualTo(base.getId());
    }

    @Test
    @DisplayName("三方合并带入的文件与未跟踪文件冲突时拒绝合并")
    void threeWay_untrackedWouldBeOverwritten() throws Exception {
        onFeature("notes.txt", "from feature\n");
        Shove ours = onMain("m.txt", "m\n");
        write(root, "notes.txt", "my local notes\n");

        assertThatThrownBy(() -> engine.merge("feature", MergeStrategy.AUTO))
                .isInstanceOf(UncommittedChangesException.class)
                .hasMessageContaining("would be overwritten");
        assertThatThrownBy(() -> engine.merge("feature", MergeStrategy.ALWAYS_CREATE_SHOVE))
                .isInstanceOf(UncommittedChangesException.class);
        assertThat(read(root, "notes.txt")).isEqualTo("my local notes\n");
        assertThat(repo.getHead()).isEqualTo(ours.getId());
        assertThat(MergeState.load(repo.getPocketDir())).isEmpty();
    }

    @Test
    @DisplayName("未跟踪文件与带入的内容完全相同时照常快进")
    void fastForward_identicalUntrackedIsKept() throws Exception {
        Shove theirs = onFeature("notes.txt", "same\n");
        write(root, "notes.txt", "same\n");

        MergeResult result = engine.merge("feature", MergeStrategy.AUTO);

        assertThat(result.isFastForward()).isTrue();
        assertThat(repo.getHead()).isEqualTo(theirs.getId());
        assertThat(read(root, "notes.txt")).isEqualTo("same\n");
    }

    @Test
    @DisplayName("祖先判断与最近公共祖先")
    void ancestry() throws Exception {
        Shove theirs = onFeature("f.txt", "f\n");
        Shove ours = onMain("m.txt", "m\n");

        assertThat(engine.isAncestor(base.getId(), ours.getId())).isTrue();
        assertThat(engine.isAncestor(ours.getId(), base.getId())).isFalse();
        assertThat(engine.isAncestor(ours.getId(), ours.getId())).isTrue();
        assertThat(engine.findCommonAncestor(ours.getId(), theirs.getId())).contains(base.getId());
        assertThat(engine.findCommonAncestor(base.getId(), theirs.getId())).contains(base.getId());
    }
}
