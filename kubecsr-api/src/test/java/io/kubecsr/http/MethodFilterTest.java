/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.http;

import java.io.IOException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MethodFilterTest {

    @Mock
    HttpExchange exchange;

    @Mock
    Filter.Chain chain;

    @Test
    void passesAllowedMethodDown() throws IOException {
        // Given
        when(exchange.getRequestMethod()).thenReturn("GET");

        // When
        MethodFilter.GET_ONLY.doFilter(exchange, chain);

        // Then
        verify(chain).doFilter(exchange);
        verify(exchange, never()).sendResponseHeaders(anyInt(), anyLong());
    }

    @ParameterizedTest
    @ValueSource(strings = { "TRACE", "OPTIONS", "HEAD", "POST", "PUT", "PATCH", "DELETE" })
    void rejectsOtherMethods(String method) throws IOException {
        // Given
        Headers headers = new Headers();
        when(exchange.getRequestMethod()).thenReturn(method);
        when(exchange.getResponseHeaders()).thenReturn(headers);

        // When
        MethodFilter.GET_ONLY.doFilter(exchange, chain);

        // Then
        verify(exchange).sendResponseHeaders(405, -1);
        verify(exchange).close();
        verify(chain, never()).doFilter(exchange);
        assertThat(headers.getFirst("Allow")).isEqualTo("GET");
    }

    @Test
    void namesEveryAllowedMethod() throws IOException {
        // Given
        Filter filter = MethodFilter.allowing("GET", "HEAD");
        Headers headers = new Headers();
        when(exchange.getRequestMethod()).thenReturn("POST");
        when(exchange.getResponseHeaders()).thenReturn(headers);

        // When
        filter.doFilter(exchange, chain);

        // Then
        assertThat(headers.getFirst("Allow")).isEqualTo("GET, HEAD");
        assertThat(filter.description()).isEqualTo("Allows GET, HEAD");
    }

    @Test
    void headPassesWhenAllowed() throws IOException {
        // Given
        when(exchange.getRequestMethod()).thenReturn("HEAD");

        // When
        MethodFilter.allowing("GET", "HEAD").doFilter(exchange, chain);

        // Then
        verify(chain).doFilter(exchange);
    }
}
