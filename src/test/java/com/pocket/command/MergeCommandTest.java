package com.pocket.command;

import com.pocket.PocketTestUtil.ExecuteResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.pocket.PocketTestUtil.read;
import static com.pocket.PocketTestUtil.run;
import static com.pocket.PocketTestUtil.write;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("merge / resolve 命令测试")
class MergeCommandTest {

    @TempDir
    Path root;

    @BeforeEach
    void setUp() throws IOException {
        assertThat(run(root, "new-repo", "--no-default").getExitCode()).isZero();
        write(root, "a.txt", "one\ntwo\nthree\n");
        shove("a.txt", "base");
        assertThat(pocket("timeline", "new", "feat").getExitCode()).isZero();
    }

    private ExecuteResult pocket(String... args) {
        return run(root, args);
    }

    private void shove(String path, String message) {
        assertThat(pocket("pile", path).getExitCode()).isZero();
        assertThat(pocket("shove", "-m", message).getExitCode()).isZero();
    }

    private void onTimeline(String timeline, String path, String content, String message) throws IOException {
        assertThat(pocket("timeline", "switch", timeline).getExitCode()).isZero();
        write(root, path, content);
        shove(path, message);
    }

    private void diverge() throws IOException {
        onTimeline("feat", "a.txt", "one\nfeature\nthree\n", "feature edit");
        onTimeline("main", "a.txt", "one\nmain\nthree\n", "main edit");
    }

    @Test
    @DisplayName("目标在前方时快进")
    void fastForward() throws IOException {
        onTimeline("feat", "b.txt", "b\n", "add b");
        pocket("timeline", "switch", "main");
        assertThat(Files.exists(root.resolve("b.txt"))).isFalse();

        ExecuteResult result = pocket("merge", "feat");

        assertThat(result.getExitCode()).isZero();
        assertThat(result.getOutput()).contains("Fast-forward").doesNotContain("Merge shove:");
        assertThat(read(root, "b.txt")).isEqualTo("b\n");
        assertThat(pocket("merge", "feat").getOutput()).contains("Already up to date.");
    }

    @Test
    @DisplayName("冲突时退出码为 1，resolve --theirs 后 shove 完成合并")
    void conflictThenResolve() throws IOException {
        diverge();

        ExecuteResult result = pocket("merge", "feat");

        assertThat(result.getExitCode()).isEqualTo(1);
        assertThat(result.getOutput())
                .contains("Merge failed")
                .contains("Automatic merge failed")
                .contains("Conflicts:\n  a.txt\n");
        assertThat(read(root, "a.txt")).contains("<<<<<<< ours", "main", "=======", "feature", ">>>>>>> theirs");
        assertThat(pocket("status").getOutput()).contains("Conflicts:\n  conflict: a.txt");

        ExecuteResult blocked = pocket("shove", "-m", "too early");
        assertThat(blocked.getExitCode()).isEqualTo(1);
        assertThat(blocked.getErr()).contains("unresolved conflicts in a.txt");

        assertThat(pocket("resolve", "a.txt", "--theirs").getOutput()).contains("Resolved a.txt using theirs");
        assertThat(read(root, "a.txt")).isEqualTo("one\nfeature\nthree\n");
        assertThat(pocket("shove", "-m", "merge feat").getExitCode()).isZero();

        assertThat(pocket("log", "-n", "1").getOutput()).contains("Merge: ", "    merge feat");
        assertThat(pocket("status").getOutput()).contains("nothing to shove");
    }

    @Test
    @DisplayName("merge --abort 恢复合并前的状态")
    void abort() throws IOException {
        diverge();
        pocket("merge", "feat");

        ExecuteResult result = pocket("merge", "--abort");

        assertThat(result.getExitCode()).isZero();
        assertThat(result.getOutput()).contains("Merge aborted");
        assertThat(read(root, "a.txt")).isEqualTo("one\nmain\nthree\n");
        assertThat(pocket("merge", "--abort").getErr()).contains("fatal: no merge in progress");
    }

    @Test
    @DisplayName("theirs 策略自动解决冲突并创建合并 shove")
    void theirsStrategy() throws IOException {
        diverge();

        ExecuteResult result = pocket("merge", "feat", "--strategy", "theirs");

        assertThat(result.getExitCode()).isZero();
        assertThat(result.getOutput()).contains("Merge made by the 'theirs' strategy.", "Merge shove: ");
        assertThat(read(root, "a.txt")).isEqualTo("one\nfeature\nthree\n");
    }

    @Test
    @DisplayName("fast-forward-only 在分叉时失败")
    void fastForwardOnly() throws IOException {
        diverge();

        ExecuteResult result = pocket("merge", "feat", "-s", "fast-forward-only");

        assertThat(result.getExitCode()).isEqualTo(1);
        assertThat(result.getOutput()).contains("Merge failed", "Not possible to fast-forward");
        assertThat(read(root, "a.txt")).isEqualTo("one\nmain\nthree\n");
    }

    @Test
    @DisplayName("未知策略、缺少 timeline、未找到 timeline")
    void errors() {
        assertThat(pocket("merge", "feat", "-s", "bogus").getErr()).contains("fatal: unknown merge strategy 'bogus'");
        assertThat(pocket("merge").getErr()).contains("fatal: no timeline specified to merge");
        ExecuteResult missing = pocket("merge", "nope");
        assertThat(missing.getExitCode()).isEqualTo(1);
        assertThat(missing.getErr()).contains("not found");
        assertThat(pocket("resolve", "a.txt", "--ours").getErr()).contains("fatal: no merge in progress");
    }
}
