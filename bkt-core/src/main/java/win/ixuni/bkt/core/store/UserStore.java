package win.ixuni.bkt.core.store;

import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.model.User;

/**
 * 用户存储
 * <p>
 * Users are provisioned by the authentication layer; {@link #save(User)} exists for that
 * layer and for seeding.
 */
public interface UserStore {

    Mono<User> findById(String id);

    Mono<User> findByUsername(String username);

    Mono<User> save(User user);
}
