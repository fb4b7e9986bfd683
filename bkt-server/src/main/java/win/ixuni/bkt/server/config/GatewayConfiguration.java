package win.ixuni.bkt.server.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import win.ixuni.bkt.core.policy.PolicyEvaluator;
import win.ixuni.bkt.core.policy.PolicyValidator;
import win.ixuni.bkt.core.upload.ContentPolicy;
import win.ixuni.bkt.core.util.KeyLockManager;
import win.ixuni.bkt.server.resolver.ConfigCache;
import win.ixuni.bkt.server.security.CredentialCipher;
import win.ixuni.bkt.server.task.BackgroundTaskQueue;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;

/**
 * 核心组件装配
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
public class GatewayConfiguration {

    public static final String UPLOAD_QUEUE = "uploadQueue";
    public static final String RECONCILIATION_QUEUE = "reconciliationQueue";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ConfigCache configCache(GatewayProperties properties, Clock clock) {
        return new ConfigCache(properties.getCache().getTtl(), clock);
    }

    @Bean
    public CredentialCipher credentialCipher(GatewayProperties properties) {
        String secret = properties.getSecurity().getEncryptionSecret();
        if (secret == null || secret.isBlank()) {
            log.warn("bkt.security.encryption-secret is not set, using a random per-process secret: "
                    + "stored S3 credentials will not be readable after a restart");
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            secret = Base64.getEncoder().encodeToString(random);
        }
        return new CredentialCipher(secret);
    }

    @Bean
    public PolicyEvaluator policyEvaluator() {
        return new PolicyEvaluator();
    }

    @Bean
    public PolicyValidator policyValidator() {
        return new PolicyValidator();
    }

    @Bean
    public KeyLockManager keyLockManager(GatewayProperties properties) {
        return new KeyLockManager(properties.getStorage().getMoveLockTimeout());
    }

    @Bean
    public ContentPolicy contentPolicy(GatewayProperties properties) {
        GatewayProperties.Storage storage = properties.getStorage();
        return new ContentPolicy(storage.getMaxFileSize(), storage.getLargeFileWarning(),
                storage.getAllowedContentTypes(), storage.getBlockedContentTypes());
    }

    @Bean(name = UPLOAD_QUEUE)
    public BackgroundTaskQueue uploadQueue(GatewayProperties properties) {
        GatewayProperties.Uploads uploads = properties.getUploads();
        return new BackgroundTaskQueue("uploads", uploads.getWorkers(), uploads.getQueueCapacity());
    }

    @Bean(name = RECONCILIATION_QUEUE)
    public BackgroundTaskQueue reconciliationQueue(GatewayProperties properties) {
        GatewayProperties.Reconciliation reconciliation = properties.getReconciliation();
        return new BackgroundTaskQueue("reconcile", reconciliation.getWorkers(), reconciliation.getQueueCapacity());
    }
}
