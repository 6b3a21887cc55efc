package com.pagecraft.infra;

import io.micronaut.context.annotation.Value;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.MutableHttpResponse;
import io.micronaut.http.annotation.Filter;
import io.micronaut.http.filter.HttpServerFilter;
import io.micronaut.http.filter.ServerFilterChain;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Requires a caller identity on every /api/v1/** request.
 *
 * Header: X-User-Id: {opaque user id}. The value becomes the lock holder id;
 * identity is resolved upstream and not verified here.
 *
 * To disable, set {@code app.require-user-header} to false.
 */
@Filter("/api/v1/**")
public class UserHeaderFilter implements HttpServerFilter {

    public static final String HEADER = "X-User-Id";

    @Value("${app.require-user-header:true}")
    boolean required;

    @Override
    public Publisher<MutableHttpResponse<?>> doFilter(HttpRequest<?> request,
                                                      ServerFilterChain chain) {
        if (!required) {
            return chain.proceed(request);
        }

        String userId = request.getHeaders().get(HEADER);
        if (userId != null && !userId.isBlank()) {
            return chain.proceed(request);
        }

        return Mono.just(HttpResponse.unauthorized()
            .body(Map.of("message", "Missing " + HEADER + " header", "code", "UNAUTHORIZED")));
    }
}
