/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.http;

import java.io.IOException;
import java.util.List;

import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpExchange;

/**
 * Answers <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/405">405 Method Not Allowed</a>
 * to any method outside a fixed set, naming the set in the {@code Allow} header.
 * The body of a rejected request is never read.
 */
public final class MethodFilter extends Filter {

    public static final Filter GET_ONLY = allowing("GET");

    private final List<String> allowed;
    private final String allowHeader;

    private MethodFilter(List<String> allowed) {
        this.allowed = allowed;
        this.allowHeader = String.join(", ", allowed);
    }

    public static Filter allowing(String... methods) {
        return new MethodFilter(List.of(methods));
    }

    @Override
    public void doFilter(HttpExchange exchange, Chain chain) throws IOException {
        if (allowed.contains(exchange.getRequestMethod())) {
            chain.doFilter(exchange);
            return;
        }
        try (exchange) {
            exchange.getResponseHeaders().add("Allow", allowHeader);
            exchange.sendResponseHeaders(405, -1);
        }
    }

    @Override
    public String description() {
        return "Allows " + allowHeader;
    }
}
