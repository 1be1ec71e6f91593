package com.pocket.obj;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.pocket.utils.HexUtils;
import lombok.EqualsAndHashCode;

/**
 * 对象 id：对象原始字节的 SHA-256（64 字符小写 hex）。
 * 相同内容必然得到相同 id，ObjectStore 以此去重。
 */
@EqualsAndHashCode
public final class ObjectId implements Comparable<ObjectId> {

    private final String hex;

    private ObjectId(String hex) {
        this.hex = hex;
    }

    /** 解析 64 字符 hex，非法时抛 IllegalArgumentException。 */
    @JsonCreator
    public static ObjectId of(String hex) {
        if (!HexUtils.isSha256Hex(hex)) {
            throw new IllegalArgumentException("invalid object id: " + hex);
        }
        return new ObjectId(hex);
    }

    /** 计算内容的 id（不写入对象库）。 */
    public static ObjectId forContent(byte[] content) {
        return new ObjectId(HexUtils.sha256Hex(content));
    }

    @JsonValue
    public String getHex() {
        return hex;
    }

    /** 前 2 个字符：对象库中的分片目录名。 */
    public String shard() {
        return hex.substring(0, 2);
    }

    /** 其余 62 个字符：分片目录下的文件名。 */
    public String rest() {
        return hex.substring(2);
    }

    /** 用于展示的短 id。 */
    public String shortHex() {
        return hex.substring(0, 8);
    }

    @Override
    public int compareTo(ObjectId o) {
        return hex.compareTo(o.hex);
    }

    @Override
    public String toString() {
        return hex;
    }
}
