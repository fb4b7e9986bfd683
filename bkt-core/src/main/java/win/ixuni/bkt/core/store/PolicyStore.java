package win.ixuni.bkt.core.store;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.model.BucketPolicy;
import win.ixuni.bkt.core.model.Policy;

/**
 * 策略存储 (named policies, user attachments and bucket policies)
 */
public interface PolicyStore {

    /**
     * @return the stored policy, or {@code DuplicateNameException} when the name is taken
     */
    Mono<Policy> insert(Policy policy);

    /**
     * Replace name, description and document of an existing policy
     */
    Mono<Policy> update(Policy policy);

    Mono<Policy> findById(String id);

    Mono<Policy> findByName(String name);

    Flux<Policy> findAll();

    /**
     * Delete a policy no user is attached to. The attachment check and the delete run in one
     * transaction.
     *
     * @return {@code ResourceInUseException} while attached, {@code PolicyNotFoundException}
     *         when missing
     */
    Mono<Void> delete(String id);

    /**
     * Attach in one transaction; attaching twice is a no-op
     */
    Mono<Void> attach(String userId, String policyId);

    /**
     * @return true when an attachment was removed
     */
    Mono<Boolean> detach(String userId, String policyId);

    Flux<Policy> findByUser(String userId);

    Mono<BucketPolicy> findBucketPolicy(String bucketId);

    Mono<BucketPolicy> putBucketPolicy(BucketPolicy bucketPolicy);

    Mono<Boolean> deleteBucketPolicy(String bucketId);
}
