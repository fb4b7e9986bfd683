package win.ixuni.bkt.core.store;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.model.S3Configuration;

/**
 * S3 配置存储
 * <p>
 * At most one configuration is the default: writing one with {@code isDefault} clears the flag
 * on every other configuration in the same transaction.
 */
public interface S3ConfigStore {

    Mono<S3Configuration> insert(S3Configuration configuration);

    Mono<S3Configuration> update(S3Configuration configuration);

    Mono<S3Configuration> findById(String id);

    Mono<S3Configuration> findDefault();

    Flux<S3Configuration> findAll();

    /**
     * Delete a configuration no bucket references, check and delete in one transaction
     *
     * @return {@code ResourceInUseException} while referenced
     */
    Mono<Void> delete(String id);
}
