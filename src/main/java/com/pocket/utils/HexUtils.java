package com.pocket.utils;

import lombok.experimental.UtilityClass;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * 十六进制与摘要工具，用于对象 id（64 字符 SHA-256 hex）与 shove id 的计算。
 */
@UtilityClass
public class HexUtils {

    /** SHA-256 摘要的 hex 长度。 */
    public static final int SHA256_HEX_LENGTH = 64;

    /**
     * 将字节数组转为小写十六进制字符串。
     * 例：32 字节 SHA-256 digest → "2cf2..." 共 64 字符。
     *
     * @param bytes 任意长度
     * @return 小写 hex 字符串
     */
    public static String bytesToHex(byte[] bytes) {
        if (bytes == null) return "";
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b & 0xff));
        }
        return sb.toString();
    }

    /**
     * 判断字符串是否为合法的 64 字符小写 SHA-256 hex。
     */
    public static boolean isSha256Hex(String hex) {
        if (hex == null || hex.length() != SHA256_HEX_LENGTH) return false;
        for (int i = 0; i < hex.length(); i++) {
            char c = hex.charAt(i);
            if (!((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f'))) return false;
        }
        return true;
    }

    /**
     * 计算输入字节的 SHA-256 并返回 64 字符 hex。
     */
    public static String sha256Hex(byte[] input) {
        return bytesToHex(sha256(input));
    }

    /**
     * 计算输入字节的 SHA-256 摘要（32 字节）。
     */
    public static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
