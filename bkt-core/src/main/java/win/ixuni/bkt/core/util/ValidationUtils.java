package win.ixuni.bkt.core.util;

import win.ixuni.bkt.core.exception.ValidationException;

import java.util.regex.Pattern;

/**
 * Bucket / key / region validation utility class
 * <p>
 * Every check runs before any side effect and throws {@link ValidationException}.
 */
public final class ValidationUtils {

    public static final String DEFAULT_REGION = "us-east-1";
    public static final int MAX_KEY_LENGTH = 1024;

    private static final Pattern BUCKET_NAME = Pattern.compile("^[a-z0-9][a-z0-9\\-]*[a-z0-9]$");
    private static final Pattern IP_ADDRESS = Pattern.compile("^[0-9]{1,3}\\.[0-9]{1,3}\\.[0-9]{1,3}\\.[0-9]{1,3}$");
    private static final Pattern REGION = Pattern.compile("^[a-z]{2}-[a-z]+-[0-9]{1,2}$");

    private ValidationUtils() {
    }

    /**
     * S3 bucket naming rules
     */
    public static void validateBucketName(String name) {
        if (name == null || name.length() < 3 || name.length() > 63) {
            throw ValidationException.invalidBucketName("bucket name must be between 3 and 63 characters");
        }
        if (!BUCKET_NAME.matcher(name).matches()) {
            throw ValidationException.invalidBucketName("bucket name must start and end with a lowercase letter "
                    + "or number, and can only contain lowercase letters, numbers, and hyphens");
        }
        if (IP_ADDRESS.matcher(name).matches()) {
            throw ValidationException.invalidBucketName("bucket name must not be formatted as an IP address");
        }
        if (name.contains("--")) {
            throw ValidationException.invalidBucketName("bucket name must not contain consecutive hyphens");
        }
        if (name.startsWith("xn--")) {
            throw ValidationException.invalidBucketName("bucket name must not start with 'xn--' prefix");
        }
        if (name.endsWith("-s3alias")) {
            throw ValidationException.invalidBucketName("bucket name must not end with '-s3alias' suffix");
        }
    }

    /**
     * Object key rules: no traversal, no absolute paths, no NUL or backslash
     */
    public static void validateObjectKey(String key) {
        if (key == null || key.isEmpty()) {
            throw ValidationException.invalidKey("object key cannot be empty");
        }
        if (key.length() > MAX_KEY_LENGTH) {
            throw ValidationException.invalidKey("object key cannot exceed 1024 characters");
        }
        if (key.contains("..")) {
            throw ValidationException.invalidKey("object key cannot contain '..' path traversal");
        }
        if (key.startsWith("/")) {
            throw ValidationException.invalidKey("object key cannot start with '/'");
        }
        if (key.indexOf('\0') >= 0) {
            throw ValidationException.invalidKey("object key cannot contain null bytes");
        }
        if (key.indexOf('\\') >= 0) {
            throw ValidationException.invalidKey("object key cannot contain backslashes");
        }
    }

    /**
     * @return the region to use; empty or null becomes {@value #DEFAULT_REGION}
     */
    public static String normalizeRegion(String region) {
        if (region == null || region.isEmpty()) {
            return DEFAULT_REGION;
        }
        if (region.length() > 20) {
            throw new ValidationException("region name too long (max 20 characters)");
        }
        if (!REGION.matcher(region).matches()) {
            throw new ValidationException("region must match AWS format (e.g., us-east-1, eu-west-2)");
        }
        return region;
    }

    /**
     * Escape {@code \}, {@code %} and {@code _} for a SQL LIKE pattern with the default escape
     */
    public static String escapeLikeWildcards(String input) {
        if (input == null) {
            return "";
        }
        return input.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }

    /**
     * Folder prefix normalized to end in a single {@code /}; empty stays empty
     */
    public static String normalizeFolder(String prefix) {
        if (prefix == null || prefix.isEmpty()) {
            return "";
        }
        return prefix.endsWith("/") ? prefix : prefix + "/";
    }
}
