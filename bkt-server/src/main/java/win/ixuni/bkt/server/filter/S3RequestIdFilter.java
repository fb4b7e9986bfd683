package win.ixuni.bkt.server.filter;

import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * S3 请求 ID 过滤器
 * <p>
 * Every response of the {@code /s3} subtree, errors included, carries {@code x-amz-request-id}.
 * The id is also kept as an exchange attribute so error bodies can repeat it.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class S3RequestIdFilter implements WebFilter {

    public static final String S3_PATH_PREFIX = "/s3";

    public static final String REQUEST_ID_HEADER = "x-amz-request-id";

    public static final String REQUEST_ID_ATTRIBUTE = "bkt.s3.requestId";

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();
        if (!path.equals(S3_PATH_PREFIX) && !path.startsWith(S3_PATH_PREFIX + "/")) {
            return chain.filter(exchange);
        }
        String requestId = generateRequestId();
        exchange.getAttributes().put(REQUEST_ID_ATTRIBUTE, requestId);
        exchange.getResponse().getHeaders().set(REQUEST_ID_HEADER, requestId);
        return chain.filter(exchange);
    }

    public static String requestIdOf(ServerWebExchange exchange) {
        String requestId = exchange.getAttribute(REQUEST_ID_ATTRIBUTE);
        return requestId != null ? requestId : generateRequestId();
    }

    static String generateRequestId() {
        return UUID.randomUUID().toString().replace("-", "").toUpperCase().substring(0, 16);
    }
}
