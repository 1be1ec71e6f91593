package com.pocket.merge;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.pocket.exception.CorruptObjectException;
import com.pocket.obj.ShoveId;
import com.pocket.utils.TomlUtils;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 未完成合并的记录（.pocket/MERGE.toml）：被合并的 timeline 与 head、冲突列表。
 * 冲突全部解决后 createShove 生成双父 shove 并删除该文件。
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class MergeState {

    public static final String FILE_NAME = "MERGE.toml";

    String timeline;
    String theirsName;
    ShoveId oursHead;
    ShoveId theirsHead;
    ShoveId baseShove;
    @Builder.Default
    List<MergeConflict> conflicts = new ArrayList<>();

    public static Optional<MergeState> load(Path pocketDir) throws CorruptObjectException, IOException {
        Path file = pocketDir.resolve(FILE_NAME);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(TomlUtils.read(file, MergeState.class));
        } catch (IOException e) {
            throw new CorruptObjectException("merge state cannot be parsed: " + e.getMessage(), e);
        }
    }

    public void save(Path pocketDir) throws IOException {
        TomlUtils.write(pocketDir.resolve(FILE_NAME), this);
    }

    public static void clear(Path pocketDir) throws IOException {
        Files.deleteIfExists(pocketDir.resolve(FILE_NAME));
    }

    public Optional<MergeConflict> find(String path) {
        return conflicts.stream().filter(c -> c.getPath().equals(path)).findFirst();
    }

    /** 返回记录了该路径解决方式的新状态。 */
    public MergeState resolve(String path, ConflictResolution resolution) {
        List<MergeConflict> updated = new ArrayList<>();
        for (MergeConflict c : conflicts) {
            updated.add(c.getPath().equals(path) ? c.withResolution(resolution) : c);
        }
        return toBuilder().conflicts(updated).build();
    }

    @JsonIgnore
    public List<String> getUnresolvedPaths() {
        return conflicts.stream()
                .filter(c -> !c.isResolved())
                .map(MergeConflict::getPath)
                .collect(Collectors.toList());
    }
}
