package com.pocket.command;

import com.pocket.PocketTestUtil.ExecuteResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static com.pocket.PocketTestUtil.read;
import static com.pocket.PocketTestUtil.run;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("new-repo 命令测试")
class NewRepoCommandTest {

    @TempDir
    Path root;

    @Test
    @DisplayName("默认模板创建仓库、README 与 .pocketignore")
    void defaultTemplate() throws Exception {
        ExecuteResult result = run(root, "new-repo");

        assertThat(result.getExitCode()).isZero();
        assertThat(result.getOutput())
                .contains("Creating new Pocket repository at " + root.toAbsolutePath().normalize())
                .contains("Repository created successfully.")
                .contains("Current timeline: main");
        assertThat(root.resolve(".pocket/HEAD")).isRegularFile();
        assertThat(read(root, "README.md")).isEqualTo(NewRepoCommand.README);
        assertThat(read(root, ".pocketignore")).startsWith("# Pocket ignore file\n").contains("*.log");
    }

    @Test
    @DisplayName("minimal 模板不写 README，--no-default 不写任何文件")
    void minimalAndNoDefault() {
        Path minimal = root.resolve("minimal");
        Path bare = root.resolve("bare");

        assertThat(run(root, "new-repo", "minimal", "--template", "minimal").getExitCode()).isZero();
        assertThat(run(root, "new-repo", "bare", "--no-default").getExitCode()).isZero();

        assertThat(minimal.resolve("README.md")).doesNotExist();
        assertThat(minimal.resolve(".pocketignore")).exists();
        assertThat(bare.resolve(".pocket")).isDirectory();
        assertThat(bare.resolve("README.md")).doesNotExist();
        assertThat(bare.resolve(".pocketignore")).doesNotExist();
    }

    @Test
    @DisplayName("仓库已存在时失败，退出码为 1")
    void alreadyExists() {
        run(root, "new-repo");

        ExecuteResult again = run(root, "new-repo");

        assertThat(again.getExitCode()).isEqualTo(1);
        assertThat(again.getErr()).contains("fatal: repository already exists");
    }

    @Test
    @DisplayName("未知模板被拒绝")
    void unknownTemplate() {
        ExecuteResult result = run(root, "new-repo", "--template", "fancy");

        assertThat(result.getExitCode()).isEqualTo(1);
        assertThat(result.getErr()).contains("unknown template 'fancy'");
        assertThat(root.resolve(".pocket")).doesNotExist();
    }

    @Test
    @DisplayName("仓库外执行其它命令报告 not a pocket repository")
    void outsideRepository() {
        ExecuteResult result = run(root, "status");

        assertThat(result.getExitCode()).isEqualTo(1);
        assertThat(result.getErr()).contains("fatal: not a pocket repository");
    }

    @Test
    @DisplayName("未知子命令或选项为用法错误，退出码为 2")
    void usageError() {
        assertThat(run(root, "frobnicate").getExitCode()).isEqualTo(2);
        assertThat(run(root, "new-repo", "--bogus").getExitCode()).isEqualTo(2);
    }
}
