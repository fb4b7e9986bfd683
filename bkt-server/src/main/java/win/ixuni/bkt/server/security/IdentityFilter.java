package win.ixuni.bkt.server.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import win.ixuni.bkt.core.model.User;
import win.ixuni.bkt.core.policy.Identity;
import win.ixuni.bkt.core.policy.PolicyValidator;
import win.ixuni.bkt.core.store.PolicyStore;
import win.ixuni.bkt.core.store.UserStore;
import win.ixuni.bkt.server.config.GatewayProperties;

/**
 * 身份过滤器
 * <p>
 * Reads the username put in the trusted identity header by the upstream authentication layer,
 * loads the user's admin flag and attached policies and stores the {@link Identity} as an
 * exchange attribute. No header, or an unknown user, yields the anonymous identity, which every
 * gated operation denies.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@RequiredArgsConstructor
public class IdentityFilter implements WebFilter {

    public static final String IDENTITY_ATTRIBUTE = "bkt.identity";

    private final GatewayProperties properties;
    private final UserStore userStore;
    private final PolicyStore policyStore;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String username = exchange.getRequest().getHeaders()
                .getFirst(properties.getSecurity().getIdentityHeader());
        return resolve(username)
                .flatMap(identity -> {
                    exchange.getAttributes().put(IDENTITY_ATTRIBUTE, identity);
                    return chain.filter(exchange);
                });
    }

    /**
     * Identity for a username, anonymous when unknown
     */
    public Mono<Identity> resolve(String username) {
        if (username == null || username.isBlank()) {
            return Mono.just(Identity.anonymous());
        }
        return userStore.findByUsername(username.trim())
                .flatMap(this::load)
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.debug("Unknown user '{}', treating request as anonymous", username);
                    return Identity.anonymous();
                }));
    }

    private Mono<Identity> load(User user) {
        return policyStore.findByUser(user.getId())
                .map(policy -> PolicyValidator.readStored(policy.getDocument()))
                .collectList()
                .map(policies -> Identity.builder()
                        .userId(user.getId())
                        .username(user.getUsername())
                        .admin(user.isAdmin())
                        .policies(policies)
                        .build());
    }

    public static Identity identityOf(ServerWebExchange exchange) {
        Identity identity = exchange.getAttribute(IDENTITY_ATTRIBUTE);
        return identity != null ? identity : Identity.anonymous();
    }
}
