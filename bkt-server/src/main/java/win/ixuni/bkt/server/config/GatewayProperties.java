package win.ixuni.bkt.server.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import win.ixuni.bkt.core.upload.ContentPolicy;
import win.ixuni.bkt.core.util.ValidationUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * bkt 网关主配置
 */
@Data
@ConfigurationProperties(prefix = "bkt")
public class GatewayProperties {

    private Storage storage = new Storage();

    /**
     * Environment fallback for s3 buckets without a stored configuration
     */
    private S3 s3 = new S3();

    private Cache cache = new Cache();

    private Security security = new Security();

    private Reconciliation reconciliation = new Reconciliation();

    private Uploads uploads = new Uploads();

    private Store store = new Store();

    /**
     * Storage and upload limits
     */
    @Data
    public static class Storage {

        /**
         * Root directory of the local backend
         */
        private String localRoot = "./data";

        /**
         * Backend for buckets created without an explicit choice: local or s3
         */
        private String defaultBackend = "local";

        private long maxFileSize = ContentPolicy.DEFAULT_MAX_SIZE;

        /**
         * Uploads above this size are accepted but logged at warning level
         */
        private long largeFileWarning = ContentPolicy.DEFAULT_WARN_SIZE;

        /**
         * How long a synchronous upload request waits for the backend write
         */
        private Duration syncTimeout = Duration.ofMinutes(10);

        /**
         * Staging root for asynchronous uploads; files go to {@code <dir>/bkt-uploads/<id>/}
         */
        private String uploadTempDir = System.getProperty("java.io.tmpdir");

        /**
         * Sniffed types accepted for upload, empty means every type that is not blocked
         */
        private List<String> allowedContentTypes = new ArrayList<>();

        private List<String> blockedContentTypes = new ArrayList<>(ContentPolicy.DEFAULT_BLOCKED_TYPES);

        /**
         * Max wait for the per-key lock of a move or rename
         */
        private Duration moveLockTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class S3 {

        private String endpoint;

        private String region = ValidationUtils.DEFAULT_REGION;

        private String accessKey;

        private String secretKey;

        private String bucketPrefix = "";

        private boolean useSsl = true;

        private boolean forcePathStyle = false;
    }

    @Data
    public static class Cache {

        /**
         * Lifetime of a decrypted S3 configuration in memory
         */
        private Duration ttl = Duration.ofMinutes(5);
    }

    @Data
    public static class Security {

        /**
         * Secret the credential encryption key is derived from
         */
        private String encryptionSecret;

        /**
         * Trusted header carrying the username resolved by the upstream authentication layer
         */
        private String identityHeader = "X-Authenticated-User";

        /**
         * Usernames seeded as administrators at startup when missing from the user store
         */
        private List<String> bootstrapAdmins = new ArrayList<>();
    }

    @Data
    public static class Reconciliation {

        /**
         * Max metadata rows inserted for out-of-band backend keys per listing request
         */
        private int insertCeiling = 1000;

        private int workers = 2;

        private int queueCapacity = 1000;
    }

    @Data
    public static class Uploads {

        private int workers = 4;

        private int queueCapacity = 100;

        /**
         * Min interval between two persisted progress updates of one upload
         */
        private Duration progressInterval = Duration.ofMillis(500);
    }

    /**
     * 元数据存储
     */
    @Data
    public static class Store {

        /**
         * memory or postgresql
         */
        private String type = "memory";

        private String url;

        private String username;

        private String password;

        private int poolSize = 10;

        private boolean autoCreateSchema = true;
    }
}
