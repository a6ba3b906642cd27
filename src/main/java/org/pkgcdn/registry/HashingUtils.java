package org.pkgcdn.registry;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 哈希工具类：计算 tarball 的 sha1（十六进制字符串），与注册中心元数据中的 {@code dist.shasum} 比对。
 * <p>
 * 对文件的哈希计算采用流式读取，避免一次性把大文件读入内存。
 */
public final class HashingUtils {

    private static final HexFormat HEX = HexFormat.of();

    private HashingUtils() {
    }

    public static String sha1Hex(byte[] bytes) {
        return HEX.formatHex(sha1Digest().digest(bytes));
    }

    public static String sha1Hex(Path file) throws IOException {
        MessageDigest digest = sha1Digest();
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buffer = new byte[8192];
            int read;
            while ((read = in.read(buffer)) >= 0) {
                digest.update(buffer, 0, read);
            }
        }
        return HEX.formatHex(digest.digest());
    }

    private static MessageDigest sha1Digest() {
        try {
            return MessageDigest.getInstance("SHA-1");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("当前运行环境不支持 SHA-1 摘要算法（MessageDigest）", e);
        }
    }
}
