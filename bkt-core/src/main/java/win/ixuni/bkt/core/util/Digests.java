package win.ixuni.bkt.core.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 摘要工具 (MD5 / SHA-256, lowercase hex)
 */
public final class Digests {

    private static final int BUFFER_SIZE = 64 * 1024;

    private Digests() {
    }

    public static MessageDigest md5() {
        return newDigest("MD5");
    }

    public static MessageDigest sha256() {
        return newDigest("SHA-256");
    }

    public static String hex(MessageDigest digest) {
        return HexFormat.of().formatHex(digest.digest());
    }

    public static String md5Hex(byte[] data) {
        return HexFormat.of().formatHex(md5().digest(data));
    }

    public static String md5Hex(Path file) throws IOException {
        return hexOf(file, md5());
    }

    public static String sha256Hex(Path file) throws IOException {
        return hexOf(file, sha256());
    }

    private static String hexOf(Path file, MessageDigest digest) throws IOException {
        byte[] buffer = new byte[BUFFER_SIZE];
        try (InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return hex(digest);
    }

    private static MessageDigest newDigest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " not available", e);
        }
    }
}
