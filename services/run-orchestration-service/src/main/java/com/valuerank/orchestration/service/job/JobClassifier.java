package com.valuerank.orchestration.service.job;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class JobClassifier {

    private static final List<TokenGroup> GROUPS = List.of(
        new TokenGroup(true, "econnrefused", "enotfound", "etimedout", "timeout", "econnreset",
            "socket hang up", "network error", "fetch failed"),
        new TokenGroup(true, "429", "rate limit"),
        // 5xx before validation/auth so "503 invalid upstream response" still retries
        new TokenGroup(true, "500", "502", "503", "504"),
        new TokenGroup(false, "validation", "invalid"),
        new TokenGroup(false, "401", "unauthorized", "403", "forbidden"),
        new TokenGroup(false, "404", "not found"),
        new TokenGroup(false, "400", "bad request")
    );

    public boolean isRetryable(Object error) {
        String message = render(error);
        if (message == null || message.isBlank()) {
            return true;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        for (TokenGroup group : GROUPS) {
            if (group.matches(normalized)) {
                return group.retryable();
            }
        }
        return true;
    }

    static String render(Object error) {
        if (error == null) {
            return null;
        }
        if (error instanceof Throwable throwable) {
            Set<Throwable> visited = Collections.newSetFromMap(new IdentityHashMap<>());
            Throwable current = throwable;
            while (current != null && visited.add(current)) {
                if (current.getMessage() != null && !current.getMessage().isBlank()) {
                    return current.getMessage();
                }
                current = current.getCause();
            }
            return throwable.getClass().getSimpleName();
        }
        if (error instanceof Map<?, ?> map && map.get("message") != null) {
            return String.valueOf(map.get("message"));
        }
        return String.valueOf(error);
    }

    private record TokenGroup(boolean retryable, List<String> tokens) {

        TokenGroup(boolean retryable, String... tokens) {
            this(retryable, List.of(tokens));
        }

        boolean matches(String message) {
            return tokens.stream().anyMatch(message::contains);
        }
    }
}
