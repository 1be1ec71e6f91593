package com.pocket.repo;

import com.pocket.obj.TreeEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static com.pocket.PocketTestUtil.read;
import static com.pocket.PocketTestUtil.write;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Workspace 测试")
class WorkspaceTest {

    @TempDir
    Path root;

    @Test
    @DisplayName("相对路径解析到工作区内，空路径即根目录")
    void resolve_insideRoot() {
        Workspace workspace = new Workspace(root);

        assertThat(workspace.resolve("")).isEqualTo(workspace.getRoot());
        assertThat(workspace.resolve("dir/a.txt")).isEqualTo(workspace.getRoot().resolve("dir").resolve("a.txt"));
        assertThat(workspace.resolve("dir/../b.txt")).isEqualTo(workspace.getRoot().resolve("b.txt"));
    }

    @Test
    @DisplayName("逃出工作区的路径被拒绝，不会写到根目录之外")
    void resolve_rejectsEscape() {
        Workspace workspace = new Workspace(root.resolve("work"));
        byte[] content = "x".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> workspace.resolve("../outside.txt"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("outside the working tree");
        assertThatThrownBy(() -> workspace.writeFile("a/../../outside.txt", content, TreeEntry.MODE_REGULAR))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(root.resolve("outside.txt")).doesNotExist();
    }

    @Test
    @DisplayName("写入时替换占用路径的同名文件，删除后清理空目录")
    void writeAndDelete() throws Exception {
        Workspace workspace = new Workspace(root);
        write(root, "dir", "a plain file");

        workspace.writeFile("dir/inner.txt", "inner".getBytes(StandardCharsets.UTF_8), TreeEntry.MODE_REGULAR);
        assertThat(read(root, "dir/inner.txt")).isEqualTo("inner");

        workspace.deleteFile("dir/inner.txt");
        assertThat(root.resolve("dir")).doesNotExist();
        assertThat(root).exists();
    }
}
