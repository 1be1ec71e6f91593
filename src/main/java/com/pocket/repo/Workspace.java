package com.pocket.repo;

import com.pocket.obj.TreeEntry;
import com.pocket.utils.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * 工作区：递归列出、读取、写入工作目录中的文件（.pocket 与被忽略的路径不参与）。
 * 路径对外一律是相对根目录、以 / 分隔的字符串。
 */
public final class Workspace {

    private static final Logger log = LoggerFactory.getLogger(Workspace.class);

    private final Path root;

    /**
     * 以给定路径为工作区根目录。
     */
    public Workspace(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    /**
     * 递归列出所有未被忽略的普通文件，被忽略的目录整体跳过。
     */
    public List<String> listFiles(IgnoreRules ignore) throws IOException {
        List<String> files = new ArrayList<>();
        walk(root, "", ignore, files);
        files.sort(String::compareTo);
        log.debug("listFiles root={} count={}", root, files.size());
        return files;
    }

    /**
     * 列出某个目录（相对路径）下所有未被忽略的文件。
     */
    public List<String> listFiles(String relativeDir, IgnoreRules ignore) throws IOException {
        List<String> files = new ArrayList<>();
        Path dir = resolve(relativeDir);
        if (Files.isDirectory(dir)) {
            walk(dir, relativeDir.isEmpty() ? "" : relativeDir + "/", ignore, files);
        }
        files.sort(String::compareTo);
        return files;
    }

    private void walk(Path dir, String prefix, IgnoreRules ignore, List<String> out) throws IOException {
        try (Stream<Path> stream = Files.list(dir)) {
            for (Path p : (Iterable<Path>) stream::iterator) {
                String rel = prefix + p.getFileName().toString();
                boolean directory = Files.isDirectory(p);
                if (ignore.isIgnored(rel, directory)) {
                    log.debug("ignored {}", rel);
                    continue;
                }
                if (directory) {
                    walk(p, rel + "/", ignore, out);
                } else if (Files.isRegularFile(p)) {
                    out.add(rel);
                }
            }
        }
    }

    /** 相对路径对应的绝对路径。 */
    public Path resolve(String relativePath) {
        if (relativePath.isEmpty()) {
            return root;
        }
        Path resolved = root.resolve(relativePath).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("path '" + relativePath + "' is outside the working tree");
        }
        return resolved;
    }

    /**
     * 把任意路径转换为相对根目录、/ 分隔的路径；不在工作区内时返回 null。
     */
    public String relativize(Path path) {
        Path abs = path.toAbsolutePath().normalize();
        if (!abs.startsWith(root)) {
            return null;
        }
        return root.relativize(abs).toString().replace('\\', '/');
    }

    public boolean exists(String relativePath) {
        return Files.exists(resolve(relativePath));
    }

    public boolean isDirectory(String relativePath) {
        return Files.isDirectory(resolve(relativePath));
    }

    /** 读取文件全部字节。 */
    public byte[] readFile(String relativePath) throws IOException {
        return Files.readAllBytes(resolve(relativePath));
    }

    /**
     * 写入文件：先写临时文件再移动到目标位置，可执行权限按 tree 条目设置。
     */
    public void writeFile(String relativePath, byte[] content, int permissions) throws IOException {
        Path target = resolve(relativePath);
        if (Files.isDirectory(target)) {
            FileUtils.deleteRecursively(target);
        }
        // 上级路径被同名文件占用时先删除该文件
        for (Path dir = target.getParent(); dir != null && !dir.equals(root); dir = dir.getParent()) {
            if (Files.isRegularFile(dir)) {
                Files.delete(dir);
                break;
            }
        }
        FileUtils.writeAtomically(target, content);
        setExecutable(target, permissions == TreeEntry.MODE_EXECUTABLE);
        log.debug("wrote {} size={}", relativePath, content.length);
    }

    /** 删除文件并清理因此变空的上级目录。 */
    public void deleteFile(String relativePath) throws IOException {
        FileUtils.deleteAndPrune(resolve(relativePath), root);
        log.debug("deleted {}", relativePath);
    }

    /**
     * 文件的权限位：可执行为 0755，否则 0644。
     * 不支持 POSIX 权限的系统上按 Files.isExecutable 判断。
     */
    public int getPermissions(String relativePath) throws IOException {
        Path p = resolve(relativePath);
        try {
            Set<PosixFilePermission> perms = Files.getPosixFilePermissions(p);
            return perms.contains(PosixFilePermission.OWNER_EXECUTE)
                    ? TreeEntry.MODE_EXECUTABLE : TreeEntry.MODE_REGULAR;
        } catch (UnsupportedOperationException e) {
            return Files.isExecutable(p) ? TreeEntry.MODE_EXECUTABLE : TreeEntry.MODE_REGULAR;
        }
    }

    private static void setExecutable(Path p, boolean executable) throws IOException {
        try {
            Set<PosixFilePermission> perms = Files.getPosixFilePermissions(p);
            boolean changed = executable
                    ? perms.add(PosixFilePermission.OWNER_EXECUTE)
                    : perms.remove(PosixFilePermission.OWNER_EXECUTE);
            if (changed) {
                Files.setPosixFilePermissions(p, perms);
            }
        } catch (UnsupportedOperationException e) {
            log.debug("posix permissions not supported for {}", p);
        }
    }

    /**
     * 工作区根目录路径。
     */
    public Path getRoot() {
        return root;
    }
}
