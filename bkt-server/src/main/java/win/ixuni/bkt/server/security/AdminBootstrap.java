package win.ixuni.bkt.server.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.model.User;
import win.ixuni.bkt.core.store.UserStore;
import win.ixuni.bkt.server.config.GatewayProperties;

/**
 * Seeds {@code bkt.security.bootstrap-admins} into the user store on startup
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdminBootstrap implements ApplicationRunner {

    private final GatewayProperties properties;
    private final UserStore userStore;

    @Override
    public void run(ApplicationArguments args) {
        Flux.fromIterable(properties.getSecurity().getBootstrapAdmins())
                .map(String::trim)
                .filter(username -> !username.isEmpty())
                .concatMap(username -> userStore.findByUsername(username)
                        .hasElement()
                        .flatMap(exists -> exists
                                ? Mono.<User>empty()
                                : userStore.save(User.builder().username(username).isAdmin(true).build())
                                        .doOnNext(user -> log.info("Seeded administrator {}", user.getUsername()))))
                .then()
                .block();
    }
}
