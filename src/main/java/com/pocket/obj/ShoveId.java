package com.pocket.obj;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.pocket.utils.HexUtils;
import lombok.EqualsAndHashCode;

import java.nio.charset.StandardCharsets;

/**
 * shove id：shove 规范字段的 SHA-256，见 {@link Shove#create}。
 * 读取时也接受其它不含路径分隔符的 id（例如旧仓库中的 UUID）。
 */
@EqualsAndHashCode
public final class ShoveId implements Comparable<ShoveId> {

    private final String value;

    private ShoveId(String value) {
        this.value = value;
    }

    @JsonCreator
    public static ShoveId of(String value) {
        if (!isValid(value)) {
            throw new IllegalArgumentException("invalid shove id: " + value);
        }
        return new ShoveId(value.trim());
    }

    /** 非空、不含路径分隔符且不以 . 开头。 */
    public static boolean isValid(String value) {
        return value != null && !value.isBlank() && !value.contains("/") && !value.contains("\\")
                && !value.trim().startsWith(".");
    }

    /** 对规范文本取 SHA-256 得到 id。 */
    static ShoveId hashOf(String canonical) {
        return new ShoveId(HexUtils.sha256Hex(canonical.getBytes(StandardCharsets.UTF_8)));
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String shortId() {
        return value.length() > 8 ? value.substring(0, 8) : value;
    }

    @Override
    public int compareTo(ShoveId o) {
        return value.compareTo(o.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
