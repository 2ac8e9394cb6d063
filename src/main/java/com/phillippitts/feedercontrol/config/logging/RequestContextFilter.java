package com.phillippitts.feedercontrol.config.logging;

import com.phillippitts.feedercontrol.service.device.DeviceLink;
import com.phillippitts.feedercontrol.service.device.LinkStatus;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Log context for REST calls from the mobile app.
 *
 * <p>Every request gets a {@code requestId} (taken from {@value #REQUEST_ID_HEADER} or generated)
 * that is echoed back in the response, the app instance from {@value #CLIENT_ID_HEADER} when
 * sent, and {@code request} as {@code "<METHOD> <uri>"}. Device endpoints additionally carry
 * {@code device} as {@code <port>@<link state>}, so a 503 or 504 logged by the exception handler
 * names the port that failed.
 *
 * <p>Only the keys added here are removed afterwards; worker keys such as {@code job} on the
 * same thread are left alone.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestContextFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String CLIENT_ID_HEADER = "X-Client-ID";
    static final String DEVICE_PATH_PREFIX = "/api/device";

    private final ObjectProvider<DeviceLink> deviceLink;

    public RequestContextFilter(ObjectProvider<DeviceLink> deviceLink) {
        this.deviceLink = deviceLink;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        List<String> added = new ArrayList<>(4);
        try {
            String requestId = request.getHeader(REQUEST_ID_HEADER);
            if (requestId == null || requestId.isBlank()) {
                requestId = UUID.randomUUID().toString();
            }
            put(added, "requestId", requestId);
            response.setHeader(REQUEST_ID_HEADER, requestId);

            String clientId = request.getHeader(CLIENT_ID_HEADER);
            if (clientId != null && !clientId.isBlank()) {
                put(added, "clientId", clientId.trim());
            }
            put(added, "request", request.getMethod() + " " + request.getRequestURI());

            if (request.getRequestURI().startsWith(DEVICE_PATH_PREFIX)) {
                put(added, "device", describeLink());
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.removeAll(added);
        }
    }

    private String describeLink() {
        DeviceLink link = deviceLink.getIfAvailable();
        LinkStatus status = link == null ? null : link.status();
        if (status == null) {
            return "unavailable";
        }
        String port = status.address() == null ? "none" : status.address();
        return port + "@" + status.state();
    }

    private static void put(List<String> added, String key, String value) {
        ThreadContext.put(key, value);
        added.add(key);
    }
}
