package com.pocket.utils;

import lombok.experimental.UtilityClass;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.stream.Stream;

/**
 * 文件写入工具：先写同目录临时文件再 rename 到目标路径，避免崩溃时留下半个文件。
 */
@UtilityClass
public class FileUtils {

    /**
     * 若目录不存在则创建（含父目录）。
     */
    public static void createDirectories(Path path) throws IOException {
        if (path != null && !Files.exists(path)) {
            Files.createDirectories(path);
        }
    }

    /**
     * 原子地写入文件：写入 dir/.tmp_xxx 后 move 到 target（覆盖已有文件）。
     */
    public static void writeAtomically(Path target, byte[] content) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        createDirectories(dir);
        Path temp = dir.resolve(".tmp_" + target.getFileName() + "_" + System.nanoTime());
        try {
            Files.write(temp, content);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * 删除文件，并向上删除因此变空的目录，直到 stopAt（不含）为止。
     */
    public static void deleteAndPrune(Path file, Path stopAt) throws IOException {
        Files.deleteIfExists(file);
        Path dir = file.getParent();
        while (dir != null && !dir.equals(stopAt) && dir.startsWith(stopAt) && Files.isDirectory(dir)) {
            try (Stream<Path> entries = Files.list(dir)) {
                if (entries.findAny().isPresent()) break;
            }
            Files.delete(dir);
            dir = dir.getParent();
        }
    }

    /**
     * 递归删除目录及其内容；路径不存在时什么也不做。
     */
    public static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        if (Files.isDirectory(path)) {
            try (Stream<Path> entries = Files.list(path)) {
                for (Path child : (Iterable<Path>) entries::iterator) {
                    deleteRecursively(child);
                }
            }
        }
        Files.delete(path);
    }
}
