package com.phillippitts.voicecompanion.config.logging;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Seeds the Log4j2 ThreadContext for every HTTP request so guild and caller show up in log lines.
 *
 * <p>Keys: {@code requestId} (X-Request-ID or a fresh UUID), {@code userId} (X-User-ID when
 * present), {@code guildId} (from {@code /guilds/{guildId}/...}), {@code method} and {@code uri}.
 * Executors copy these keys to worker threads, so voice and playback work started by a request
 * logs under the same ids.
 *
 * <p>The context is cleared when the request completes.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID = "requestId";
    static final String USER_ID = "userId";
    static final String GUILD_ID = "guildId";

    private static final Pattern GUILD_PATH = Pattern.compile("^/guilds/([^/]+)");

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                populate(http);
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    private static void populate(HttpServletRequest http) {
        String requestId = http.getHeader("X-Request-ID");
        ThreadContext.put(REQUEST_ID, isBlank(requestId) ? UUID.randomUUID().toString() : requestId);

        String userId = http.getHeader("X-User-ID");
        if (!isBlank(userId)) {
            ThreadContext.put(USER_ID, userId);
        }

        String uri = http.getRequestURI();
        String guildId = guildIdFrom(uri);
        if (guildId != null) {
            ThreadContext.put(GUILD_ID, guildId);
        }
        ThreadContext.put("method", http.getMethod());
        ThreadContext.put("uri", uri);
    }

    static String guildIdFrom(String uri) {
        if (uri == null) {
            return null;
        }
        Matcher m = GUILD_PATH.matcher(uri);
        return m.find() ? m.group(1) : null;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
