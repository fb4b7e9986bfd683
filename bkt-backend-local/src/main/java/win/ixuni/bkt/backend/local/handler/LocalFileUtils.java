package win.ixuni.bkt.backend.local.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import win.ixuni.bkt.backend.local.context.LocalBackendContext;
import win.ixuni.bkt.core.model.ObjectInfo;
import win.ixuni.bkt.core.util.Digests;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLConnection;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Local 后端共享工具方法
 */
@Slf4j
public final class LocalFileUtils {

    public static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    /**
     * 共享 ObjectMapper 实例（线程安全）
     */
    public static final ObjectMapper MAPPER = new ObjectMapper();

    private LocalFileUtils() {
    }

    /**
     * 递归删除目录及其内容
     */
    public static void deleteDirectoryRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.delete(path);
                } catch (IOException e) {
                    throw new UncheckedIOException("Failed to delete: " + path, e);
                }
            });
        }
    }

    /**
     * Remove empty directories from {@code start} upwards, stopping at {@code stop} (exclusive)
     */
    public static void pruneEmptyParents(Path start, Path stop) {
        Path dir = start;
        while (dir != null && dir.startsWith(stop) && !dir.equals(stop)) {
            try (Stream<Path> children = Files.list(dir)) {
                if (children.findAny().isPresent()) {
                    return;
                }
            } catch (IOException e) {
                return;
            }
            try {
                Files.delete(dir);
            } catch (IOException e) {
                log.debug("Stopped pruning at {}: {}", dir, e.getMessage());
                return;
            }
            dir = dir.getParent();
        }
    }

    public static LocalSidecar readSidecar(Path metaPath) throws IOException {
        if (!Files.exists(metaPath)) {
            return null;
        }
        return MAPPER.readValue(Files.readString(metaPath), LocalSidecar.class);
    }

    public static void writeSidecar(Path metaPath, LocalSidecar sidecar) throws IOException {
        Files.createDirectories(metaPath.getParent());
        Files.writeString(metaPath, MAPPER.writeValueAsString(sidecar));
    }

    /**
     * Content type from the file extension, {@value #DEFAULT_CONTENT_TYPE} when unknown
     */
    public static String guessContentType(String key) {
        String guessed = URLConnection.guessContentTypeFromName(key);
        return guessed != null ? guessed : DEFAULT_CONTENT_TYPE;
    }

    /**
     * Build the object info of a stored file.
     * <p>
     * Sidecar values win; a file without sidecar (placed out of band) gets its MD5 computed
     * and its content type guessed from the extension.
     */
    public static ObjectInfo describe(LocalBackendContext ctx, String bucketName, String key, Path objectPath)
            throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(objectPath, BasicFileAttributes.class);
        LocalSidecar sidecar = readSidecar(ctx.getMetadataPath(bucketName, key));

        String etag = sidecar != null && sidecar.getEtag() != null && sidecar.getSize() == attrs.size()
                ? sidecar.getEtag()
                : Digests.md5Hex(objectPath);
        String contentType = sidecar != null && sidecar.getContentType() != null
                ? sidecar.getContentType()
                : guessContentType(key);

        return ObjectInfo.builder()
                .key(key)
                .size(attrs.size())
                .etag(etag)
                .contentType(contentType)
                .lastModified(attrs.lastModifiedTime().toInstant())
                .build();
    }
}
