package com.pocket.utils;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.experimental.UtilityClass;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * .pocket 下所有 TOML 文件（config、shove、timeline、pile、tree 对象）的统一序列化入口。
 * 字段名为 snake_case，时间为 ISO-8601 字符串，null 字段不写出。
 */
@UtilityClass
public class TomlUtils {

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .addModule(new JavaTimeModule())
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    /** 序列化为 UTF-8 TOML 字节。 */
    public static byte[] toBytes(Object value) throws IOException {
        return MAPPER.writeValueAsBytes(value);
    }

    /** 从 TOML 字节反序列化。 */
    public static <T> T fromBytes(byte[] data, Class<T> type) throws IOException {
        return MAPPER.readValue(data, type);
    }

    /** 原子写入 TOML 文件。 */
    public static void write(Path path, Object value) throws IOException {
        FileUtils.writeAtomically(path, toBytes(value));
    }

    /** 读取 TOML 文件。 */
    public static <T> T read(Path path, Class<T> type) throws IOException {
        return fromBytes(Files.readAllBytes(path), type);
    }
}
