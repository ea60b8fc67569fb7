package com.example.photomap.security;

import com.example.photomap.exceptions.ErrorResponse;
import com.example.photomap.exceptions.PhotoMapException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;

/**
 * Per-client fixed window limit over the unauthenticated surface: everything under
 * {@code /api/auth/} and the public invite validation endpoint.
 */
@Component
public class AuthRateLimitingFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AuthRateLimitingFilter.class);
    private static final String AUTH_PREFIX = "/api/auth/";
    private static final String INVITE_VALIDATE_PREFIX = "/api/invites/validate/";

    private final ObjectMapper objectMapper;
    private final ClientAddressResolver clientAddressResolver;
    private final RateLimiterService rateLimiterService;

    public AuthRateLimitingFilter(ObjectMapper objectMapper,
                                  ClientAddressResolver clientAddressResolver,
                                  RateLimiterService rateLimiterService) {
        this.objectMapper = objectMapper;
        this.clientAddressResolver = clientAddressResolver;
        this.rateLimiterService = rateLimiterService;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (HttpMethod.OPTIONS.matches(request.getMethod())) {
            return true;
        }
        String path = resolvePath(request);
        return !path.startsWith(AUTH_PREFIX) && !path.startsWith(INVITE_VALIDATE_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String clientIp;
        try {
            clientIp = clientAddressResolver.resolve(request);
        } catch (PhotoMapException ex) {
            log.warn("Rejected {} {}: proxy trust is enabled but no forwarding header was sent",
                    request.getMethod(), resolvePath(request));
            writeError(response, ex.getError().getStatus(), ex.getError().name(), ex.getMessage());
            return;
        }

        if (!rateLimiterService.isAllowed(clientIp)) {
            log.info("Rate limit exceeded for {} on {}", clientIp, resolvePath(request));
            writeError(response, HttpStatus.TOO_MANY_REQUESTS, PhotoMapException.Errors.RATE_LIMITED.name(),
                    "Too many requests, please try again later");
            return;
        }

        filterChain.doFilter(request, response);
    }

    private String resolvePath(HttpServletRequest request) {
        String uri = Optional.ofNullable(request.getRequestURI()).orElse("");
        String contextPath = Optional.ofNullable(request.getContextPath()).orElse("");
        if (!contextPath.isEmpty() && uri.startsWith(contextPath)) {
            return uri.substring(contextPath.length());
        }
        return uri;
    }

    private void writeError(HttpServletResponse response, HttpStatus status, String error, String message)
            throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getWriter(), new ErrorResponse(status.value(), error, message));
    }
}
