package win.ixuni.bkt.core.upload;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

/**
 * Magic-number content type detection
 * <p>
 * Looks at the first {@value #SNIFF_LENGTH} bytes only. The client supplied Content-Type is
 * never consulted. Unknown binary data is {@code application/octet-stream}, unknown text is
 * {@code text/plain; charset=utf-8}.
 */
public final class ContentSniffer {

    public static final int SNIFF_LENGTH = 512;

    public static final String OCTET_STREAM = "application/octet-stream";
    public static final String TEXT_PLAIN = "text/plain; charset=utf-8";

    private static final String[] HTML_TAGS = {
            "<!DOCTYPE HTML", "<HTML", "<HEAD", "<SCRIPT", "<IFRAME", "<H1", "<DIV", "<FONT",
            "<TABLE", "<A", "<STYLE", "<TITLE", "<B", "<BODY", "<BR", "<P", "<!--"
    };

    private ContentSniffer() {
    }

    /**
     * Detect the content type of a leading chunk of data
     *
     * @param data   buffer holding the leading bytes
     * @param length number of valid bytes in {@code data}
     * @return MIME type, never null
     */
    public static String detect(byte[] data, int length) {
        int n = Math.min(length, SNIFF_LENGTH);
        if (n == 0) {
            return TEXT_PLAIN;
        }

        // executables first, they are what the content policy blocks
        if (startsWith(data, n, 'M', 'Z')) {
            return "application/x-msdownload";
        }
        if (startsWith(data, n, 0x7F, 'E', 'L', 'F')) {
            return elfType(data, n);
        }
        if (startsWith(data, n, 0xFE, 0xED, 0xFA, 0xCE) || startsWith(data, n, 0xFE, 0xED, 0xFA, 0xCF)
                || startsWith(data, n, 0xCE, 0xFA, 0xED, 0xFE) || startsWith(data, n, 0xCF, 0xFA, 0xED, 0xFE)) {
            return "application/x-mach-binary";
        }

        if (startsWith(data, n, 0xFE, 0xFF)) {
            return "text/plain; charset=utf-16be";
        }
        if (startsWith(data, n, 0xFF, 0xFE)) {
            return "text/plain; charset=utf-16le";
        }
        if (startsWith(data, n, 0xEF, 0xBB, 0xBF)) {
            return TEXT_PLAIN;
        }

        String markup = detectMarkup(data, n);
        if (markup != null) {
            return markup;
        }

        if (startsWith(data, n, '%', 'P', 'D', 'F', '-')) {
            return "application/pdf";
        }
        if (startsWithAscii(data, n, "%!PS-Adobe-")) {
            return "application/postscript";
        }
        if (startsWithAscii(data, n, "GIF87a") || startsWithAscii(data, n, "GIF89a")) {
            return "image/gif";
        }
        if (startsWith(data, n, 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A)) {
            return "image/png";
        }
        if (startsWith(data, n, 0xFF, 0xD8, 0xFF)) {
            return "image/jpeg";
        }
        if (startsWith(data, n, 'B', 'M')) {
            return "image/bmp";
        }
        if (startsWith(data, n, 0x00, 0x00, 0x01, 0x00)) {
            return "image/x-icon";
        }
        if (startsWithAscii(data, n, "RIFF") && n >= 12) {
            String form = new String(data, 8, 4, StandardCharsets.US_ASCII);
            switch (form) {
                case "WEBP":
                    return "image/webp";
                case "WAVE":
                    return "audio/wave";
                case "AVI ":
                    return "video/avi";
                default:
                    break;
            }
        }
        if (startsWithAscii(data, n, "ID3")) {
            return "audio/mpeg";
        }
        if (startsWith(data, n, 'O', 'g', 'g', 'S', 0x00)) {
            return "application/ogg";
        }
        if (n >= 12 && data[4] == 'f' && data[5] == 't' && data[6] == 'y' && data[7] == 'p') {
            return "video/mp4";
        }
        if (startsWith(data, n, 0x1A, 0x45, 0xDF, 0xA3)) {
            return "video/webm";
        }
        if (startsWith(data, n, 'P', 'K', 0x03, 0x04)) {
            return "application/zip";
        }
        if (startsWith(data, n, 0x1F, 0x8B, 0x08)) {
            return "application/x-gzip";
        }
        if (startsWith(data, n, 'R', 'a', 'r', '!', 0x1A, 0x07)) {
            return "application/x-rar-compressed";
        }
        if (startsWith(data, n, '7', 'z', 0xBC, 0xAF, 0x27, 0x1C)) {
            return "application/x-7z-compressed";
        }
        if (startsWithAscii(data, n, "BZh")) {
            return "application/x-bzip2";
        }
        if (startsWith(data, n, 0x00, 'a', 's', 'm')) {
            return "application/wasm";
        }

        return looksBinary(data, n) ? OCTET_STREAM : TEXT_PLAIN;
    }

    public static String detect(byte[] data) {
        return detect(data, data.length);
    }

    /**
     * Sniff a content stream without consuming it.
     * <p>
     * Groups the leading buffers until {@value #SNIFF_LENGTH} bytes are available (or the
     * stream ends), detects the type and hands the type plus the complete, replayed stream to
     * {@code next}. Only the head is held in memory.
     */
    public static <T> Mono<T> sniff(Flux<ByteBuffer> content,
                                    BiFunction<String, Flux<ByteBuffer>, Mono<T>> next) {
        return Flux.defer(() -> {
                    AtomicInteger seen = new AtomicInteger();
                    AtomicBoolean headDone = new AtomicBoolean();
                    return content.bufferUntil(buffer -> {
                        if (headDone.get()) {
                            return true;
                        }
                        if (seen.addAndGet(buffer.remaining()) >= SNIFF_LENGTH) {
                            headDone.set(true);
                            return true;
                        }
                        return false;
                    });
                })
                .switchOnFirst((signal, groups) -> {
                    List<ByteBuffer> head = signal.hasValue() ? signal.get() : List.of();
                    String type = detect(headBytes(head), Math.min(SNIFF_LENGTH, remaining(head)));
                    Flux<ByteBuffer> replay = groups.concatMapIterable(group -> group);
                    return next.apply(type, replay).flux();
                })
                .next();
    }

    /**
     * Media type without parameters, lower case
     */
    public static String baseType(String contentType) {
        if (contentType == null) {
            return "";
        }
        int semicolon = contentType.indexOf(';');
        String base = semicolon >= 0 ? contentType.substring(0, semicolon) : contentType;
        return base.trim().toLowerCase(Locale.ROOT);
    }

    private static byte[] headBytes(List<ByteBuffer> head) {
        byte[] bytes = new byte[Math.min(SNIFF_LENGTH, remaining(head))];
        int offset = 0;
        for (ByteBuffer buffer : head) {
            if (offset >= bytes.length) {
                break;
            }
            ByteBuffer view = buffer.duplicate();
            int count = Math.min(view.remaining(), bytes.length - offset);
            view.get(bytes, offset, count);
            offset += count;
        }
        return bytes;
    }

    private static int remaining(List<ByteBuffer> buffers) {
        int total = 0;
        for (ByteBuffer buffer : buffers) {
            total += buffer.remaining();
        }
        return total;
    }

    private static String elfType(byte[] data, int n) {
        if (n < 18) {
            return "application/x-executable";
        }
        boolean bigEndian = data[5] == 2;
        int type = bigEndian
                ? ((data[16] & 0xFF) << 8) | (data[17] & 0xFF)
                : ((data[17] & 0xFF) << 8) | (data[16] & 0xFF);
        return type == 3 ? "application/x-sharedlib" : "application/x-executable";
    }

    private static String detectMarkup(byte[] data, int n) {
        int start = 0;
        while (start < n && isWhitespace(data[start])) {
            start++;
        }
        if (start == n || data[start] != '<') {
            return null;
        }
        if (matchesIgnoreCase(data, n, start, "<?xml")) {
            return "text/xml; charset=utf-8";
        }
        for (String tag : HTML_TAGS) {
            if (matchesIgnoreCase(data, n, start, tag)) {
                int end = start + tag.length();
                if (end < n && (data[end] == ' ' || data[end] == '>')) {
                    return "text/html; charset=utf-8";
                }
            }
        }
        return null;
    }

    private static boolean matchesIgnoreCase(byte[] data, int n, int offset, String pattern) {
        if (offset + pattern.length() > n) {
            return false;
        }
        for (int i = 0; i < pattern.length(); i++) {
            char expected = pattern.charAt(i);
            char actual = (char) (data[offset + i] & 0xFF);
            if (Character.toUpperCase(actual) != expected) {
                return false;
            }
        }
        return true;
    }

    private static boolean looksBinary(byte[] data, int n) {
        for (int i = 0; i < n; i++) {
            int b = data[i] & 0xFF;
            if (b <= 0x08 || b == 0x0B || (b >= 0x0E && b <= 0x1A) || (b >= 0x1C && b <= 0x1F)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isWhitespace(byte b) {
        return b == '\t' || b == '\n' || b == 0x0C || b == '\r' || b == ' ';
    }

    private static boolean startsWithAscii(byte[] data, int n, String prefix) {
        if (prefix.length() > n) {
            return false;
        }
        for (int i = 0; i < prefix.length(); i++) {
            if (data[i] != (byte) prefix.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    private static boolean startsWith(byte[] data, int n, int... prefix) {
        if (prefix.length > n) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if ((data[i] & 0xFF) != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
