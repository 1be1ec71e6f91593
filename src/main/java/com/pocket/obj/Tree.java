package com.pocket.obj;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 目录快照：按 name 排序的条目列表。
 * 序列化为 TOML（entries = [{name, id, entry_type, permissions}]）后作为普通对象存入 ObjectStore，
 * 因此同样内容的目录得到同样的 id。
 */
@Value
@Builder
@Jacksonized
public class Tree {

    @Builder.Default
    List<TreeEntry> entries = List.of();

    /** 用给定条目构造 tree，内部按 name 排序；null 视为空 tree。 */
    public static Tree of(Collection<TreeEntry> entries) {
        List<TreeEntry> sorted = new ArrayList<>(entries != null ? entries : List.of());
        sorted.sort(Comparator.comparing(TreeEntry::getName));
        return new Tree(List.copyOf(sorted));
    }

    public static Tree empty() {
        return new Tree(List.of());
    }

    /** 按名称查找条目。 */
    public Optional<TreeEntry> find(String name) {
        return entries.stream().filter(e -> e.getName().equals(name)).findFirst();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
