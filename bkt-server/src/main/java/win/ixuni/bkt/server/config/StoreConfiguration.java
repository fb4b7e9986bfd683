package win.ixuni.bkt.server.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import win.ixuni.bkt.core.store.BucketStore;
import win.ixuni.bkt.core.store.ObjectStore;
import win.ixuni.bkt.core.store.PolicyStore;
import win.ixuni.bkt.core.store.S3ConfigStore;
import win.ixuni.bkt.core.store.UploadStore;
import win.ixuni.bkt.core.store.UserStore;
import win.ixuni.bkt.core.store.memory.MemoryBucketStore;
import win.ixuni.bkt.core.store.memory.MemoryObjectStore;
import win.ixuni.bkt.core.store.memory.MemoryPolicyStore;
import win.ixuni.bkt.core.store.memory.MemoryS3ConfigStore;
import win.ixuni.bkt.core.store.memory.MemoryStoreContext;
import win.ixuni.bkt.core.store.memory.MemoryUploadStore;
import win.ixuni.bkt.core.store.memory.MemoryUserStore;
import win.ixuni.bkt.store.postgresql.PostgresBucketStore;
import win.ixuni.bkt.store.postgresql.PostgresObjectStore;
import win.ixuni.bkt.store.postgresql.PostgresPolicyStore;
import win.ixuni.bkt.store.postgresql.PostgresS3ConfigStore;
import win.ixuni.bkt.store.postgresql.PostgresStoreContext;
import win.ixuni.bkt.store.postgresql.PostgresUploadStore;
import win.ixuni.bkt.store.postgresql.PostgresUserStore;
import win.ixuni.bkt.store.postgresql.config.PostgresStoreConfig;
import win.ixuni.bkt.store.postgresql.schema.PostgresSchemaInitializer;

import java.time.Clock;

/**
 * 元数据存储装配
 * <p>
 * {@code bkt.store.type} picks one implementation for all six stores.
 */
@Configuration(proxyBeanMethods = false)
public class StoreConfiguration {

    @Slf4j
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "bkt.store", name = "type", havingValue = "memory", matchIfMissing = true)
    static class MemoryStores {

        @Bean
        MemoryStoreContext memoryStoreContext(Clock clock) {
            log.info("Using in-memory metadata store, contents are lost on restart");
            return new MemoryStoreContext(clock);
        }

        @Bean
        BucketStore bucketStore(MemoryStoreContext ctx) {
            return new MemoryBucketStore(ctx);
        }

        @Bean
        ObjectStore objectStore(MemoryStoreContext ctx) {
            return new MemoryObjectStore(ctx);
        }

        @Bean
        PolicyStore policyStore(MemoryStoreContext ctx) {
            return new MemoryPolicyStore(ctx);
        }

        @Bean
        S3ConfigStore s3ConfigStore(MemoryStoreContext ctx) {
            return new MemoryS3ConfigStore(ctx);
        }

        @Bean
        UploadStore uploadStore(MemoryStoreContext ctx) {
            return new MemoryUploadStore(ctx);
        }

        @Bean
        UserStore userStore(MemoryStoreContext ctx) {
            return new MemoryUserStore(ctx);
        }
    }

    @Slf4j
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "bkt.store", name = "type", havingValue = "postgresql")
    static class PostgresStores {

        @Bean(destroyMethod = "dispose")
        PostgresStoreContext postgresStoreContext(GatewayProperties properties, Clock clock) {
            GatewayProperties.Store store = properties.getStore();
            if (store.getUrl() == null || store.getUrl().isBlank()) {
                throw new IllegalStateException("bkt.store.url is required when bkt.store.type=postgresql");
            }
            PostgresStoreConfig config = PostgresStoreConfig.builder()
                    .url(store.getUrl())
                    .username(store.getUsername())
                    .password(store.getPassword())
                    .poolSize(store.getPoolSize())
                    .autoCreateSchema(store.isAutoCreateSchema())
                    .build();
            PostgresStoreContext ctx = PostgresStoreContext.create(config, clock);
            if (config.isAutoCreateSchema()) {
                new PostgresSchemaInitializer(ctx.getConnectionFactory()).initialize().block();
            }
            return ctx;
        }

        @Bean
        BucketStore bucketStore(PostgresStoreContext ctx) {
            return new PostgresBucketStore(ctx);
        }

        @Bean
        ObjectStore objectStore(PostgresStoreContext ctx) {
            return new PostgresObjectStore(ctx);
        }

        @Bean
        PolicyStore policyStore(PostgresStoreContext ctx) {
            return new PostgresPolicyStore(ctx);
        }

        @Bean
        S3ConfigStore s3ConfigStore(PostgresStoreContext ctx) {
            return new PostgresS3ConfigStore(ctx);
        }

        @Bean
        UploadStore uploadStore(PostgresStoreContext ctx) {
            return new PostgresUploadStore(ctx);
        }

        @Bean
        UserStore userStore(PostgresStoreContext ctx) {
            return new PostgresUserStore(ctx);
        }
    }
}
