package com.pocket.obj;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * 一次提交（shove）：不可变快照，引用根 tree 与父 shove。
 * parentIds 为空表示根 shove，两个及以上表示合并 shove。
 * 序列化字段：id, parent_ids, author{name,email,timestamp}, timestamp, message, root_tree_id。
 */
@Value
@Builder
@Jacksonized
public class Shove {

    ShoveId id;
    @Builder.Default
    List<ShoveId> parentIds = List.of();
    Author author;
    Instant timestamp;
    String message;
    ObjectId rootTreeId;

    /**
     * 创建新 shove，id 为规范字段文本的 SHA-256：
     * <pre>
     * tree &lt;root_tree_id&gt;
     * parent &lt;id&gt;            (每个父一行)
     * author &lt;name&gt; &lt;email&gt; &lt;author timestamp&gt;
     * timestamp &lt;timestamp&gt;
     *
     * &lt;message&gt;
     * </pre>
     */
    public static Shove create(List<ShoveId> parentIds, Author author, Instant timestamp,
                               String message, ObjectId rootTreeId) {
        List<ShoveId> parents = List.copyOf(parentIds);
        StringBuilder sb = new StringBuilder();
        sb.append("tree ").append(rootTreeId.getHex()).append('\n');
        for (ShoveId parent : parents) {
            sb.append("parent ").append(parent.getValue()).append('\n');
        }
        sb.append("author ").append(author.display()).append(' ').append(author.getTimestamp()).append('\n');
        sb.append("timestamp ").append(timestamp).append('\n');
        sb.append('\n').append(message);
        return new Shove(ShoveId.hashOf(sb.toString()), parents, author, timestamp, message, rootTreeId);
    }

    @JsonIgnore
    public boolean isRoot() {
        return parentIds.isEmpty();
    }

    @JsonIgnore
    public boolean isMerge() {
        return parentIds.size() > 1;
    }

    /** 第一个父 shove，根 shove 返回 null。 */
    @JsonIgnore
    public ShoveId getFirstParent() {
        return parentIds.isEmpty() ? null : parentIds.get(0);
    }

    /** 提交信息首行。 */
    @JsonIgnore
    public String getSummary() {
        if (message == null) {
            return "";
        }
        int nl = message.indexOf('\n');
        return nl >= 0 ? message.substring(0, nl) : message;
    }
}
