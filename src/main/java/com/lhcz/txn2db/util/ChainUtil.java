package com.lhcz.txn2db.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * 地址 / 类型字符串的规范化工具
 */
public final class ChainUtil {

    private static final int ADDRESS_HEX_LENGTH = 64;

    private ChainUtil() {
    }

    /**
     * 补齐为 0x + 64 位小写十六进制
     */
    public static String standardizeAddress(String address) {
        if (address == null) {
            return null;
        }
        String hex = address.trim().toLowerCase(Locale.ROOT);
        if (hex.startsWith("0x")) {
            hex = hex.substring(2);
        }
        if (hex.length() > ADDRESS_HEX_LENGTH) {
            throw new IllegalArgumentException("地址过长: " + address);
        }
        return "0x" + "0".repeat(ADDRESS_HEX_LENGTH - hex.length()) + hex;
    }

    public static String sha3Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA3-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("JDK 不支持 SHA3-256", e);
        }
    }

    public static String truncate(String value, int maxChars) {
        if (value == null || value.length() <= maxChars) {
            return value;
        }
        return value.substring(0, maxChars);
    }
}
