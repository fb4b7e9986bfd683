package win.ixuni.bkt.core.store.memory;

import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.model.User;
import win.ixuni.bkt.core.store.UserStore;

import java.util.UUID;

@RequiredArgsConstructor
public class MemoryUserStore implements UserStore {

    private final MemoryStoreContext ctx;

    @Override
    public Mono<User> findById(String id) {
        return ctx.tx(() -> copy(ctx.getUsers().get(id)));
    }

    @Override
    public Mono<User> findByUsername(String username) {
        return ctx.tx(() -> ctx.getUsers().values().stream()
                .filter(user -> user.getUsername().equals(username))
                .findFirst()
                .map(MemoryUserStore::copy)
                .orElse(null));
    }

    @Override
    public Mono<User> save(User user) {
        return ctx.tx(() -> {
            User stored = copy(user);
            if (stored.getId() == null) {
                stored.setId(UUID.randomUUID().toString());
            }
            ctx.getUsers().put(stored.getId(), stored);
            return copy(stored);
        });
    }

    private static User copy(User user) {
        if (user == null) {
            return null;
        }
        return User.builder()
                .id(user.getId())
                .username(user.getUsername())
                .isAdmin(user.isAdmin())
                .build();
    }
}
