/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.linkhop.shortlink.redirector.remote;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import com.linkhop.shortlink.redirector.common.convention.exception.RemoteException;
import com.linkhop.shortlink.redirector.config.AnalyticsProperties;
import com.linkhop.shortlink.redirector.dto.biz.ClickEventDTO;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static com.linkhop.shortlink.redirector.common.convention.errorcode.BaseErrorCode.ANALYTICS_UNAVAILABLE;
import static org.junit.jupiter.api.Assertions.*;

class HutoolAnalyticsRemoteServiceTest {

    private HttpServer server;

    private final Map<String, String> receivedBodies = new ConcurrentHashMap<>();

    private volatile int trackStatus = 202;

    private volatile String healthBody = "{\"status\":\"OK\"}";

    private HutoolAnalyticsRemoteService remoteService;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/track", exchange -> {
            receivedBodies.put(exchange.getRequestURI().getPath(), readBody(exchange));
            respond(exchange, trackStatus, "");
        });
        server.createContext("/health", exchange -> respond(exchange, 200, healthBody));
        server.start();

        AnalyticsProperties properties = new AnalyticsProperties();
        properties.setBaseUrl("http://127.0.0.1:" + server.getAddress().getPort());
        properties.setTimeout(Duration.ofSeconds(2));
        properties.setHealthTimeout(Duration.ofSeconds(2));
        remoteService = new HutoolAnalyticsRemoteService(properties);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private static String readBody(HttpExchange exchange) throws IOException {
        return new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        }
        exchange.close();
    }

    private static ClickEventDTO event(String code) {
        return ClickEventDTO.builder()
                .code(code)
                .occurredAt(new Date())
                .userAgent("curl/8.0")
                .referer("direct")
                .clientIp("203.0.113.9")
                .countryHint("DE")
                .acceptLanguage("de-DE")
                .build();
    }

    @Test
    @DisplayName("单条事件按统计服务字段名序列化")
    void ingestPostsEventWithWireFieldNames() {
        assertEquals(202, remoteService.ingest(event("abc123")));

        JSONObject body = JSON.parseObject(receivedBodies.get("/api/track"));
        assertEquals("abc123", body.getString("shortCode"));
        assertEquals("203.0.113.9", body.getString("ipAddress"));
        assertEquals("DE", body.getString("country"));
        assertEquals("curl/8.0", body.getString("userAgent"));
        assertNotNull(body.getString("timestamp"));
    }

    @Test
    void ingestBatchWrapsEventsInClicksArray() {
        assertEquals(202, remoteService.ingestBatch(List.of(event("aaa111"), event("bbb222"))));

        JSONObject body = JSON.parseObject(receivedBodies.get("/api/track/batch"));
        assertEquals(2, body.getJSONArray("clicks").size());
        assertEquals("bbb222", body.getJSONArray("clicks").getJSONObject(1).getString("shortCode"));
    }

    @Test
    @DisplayName("非 2xx 状态码原样返回，由调用方决定是否重试")
    void returnsErrorStatusInsteadOfThrowing() {
        trackStatus = 503;
        assertEquals(503, remoteService.ingest(event("abc123")));

        trackStatus = 400;
        assertEquals(400, remoteService.ingest(event("abc123")));
    }

    @Test
    @DisplayName("连接失败抛出 RemoteException")
    void connectionFailureIsRemoteException() {
        server.stop(0);

        RemoteException ex = assertThrows(RemoteException.class, () -> remoteService.ingest(event("abc123")));

        assertEquals(ANALYTICS_UNAVAILABLE.code(), ex.getErrorCode());
        assertFalse(remoteService.health());
    }

    @Test
    void healthRequiresStatusOk() {
        assertTrue(remoteService.health());

        healthBody = "{\"status\":\"DEGRADED\"}";
        assertFalse(remoteService.health());

        healthBody = "not json";
        assertFalse(remoteService.health());
    }
}
