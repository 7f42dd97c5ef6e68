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

package com.linkhop.shortlink.redirector.controller;

import com.linkhop.shortlink.redirector.common.web.GlobalExceptionHandler;
import com.linkhop.shortlink.redirector.config.AnalyticsProperties;
import com.linkhop.shortlink.redirector.config.ShortCodeProperties;
import com.linkhop.shortlink.redirector.mq.producer.ClickEventDispatcher;
import com.linkhop.shortlink.redirector.service.RedirectCoordinator;
import com.linkhop.shortlink.redirector.service.ShortCodeAllocator;
import com.linkhop.shortlink.redirector.service.impl.ShortLinkServiceImpl;
import com.linkhop.shortlink.redirector.support.RecordingSleeper;
import com.linkhop.shortlink.redirector.support.ScriptedAnalyticsRemoteService;
import com.linkhop.shortlink.redirector.support.ScriptedShortLinkRepository;
import com.linkhop.shortlink.redirector.toolkit.CodeSpace;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.util.Random;
import java.util.concurrent.Executor;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.redirectedUrl;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ShortLinkControllerTest {

    private static final Executor DIRECT = Runnable::run;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        ScriptedShortLinkRepository repository = new ScriptedShortLinkRepository();
        Clock clock = Clock.systemUTC();
        ShortCodeProperties codeProperties = new ShortCodeProperties();
        codeProperties.setBaseUrl("https://s.example.com");
        CodeSpace codeSpace = new CodeSpace(new Random(9L), codeProperties.getDefaultLength(), codeProperties.getMaxLength());
        ClickEventDispatcher dispatcher = new ClickEventDispatcher(
                new ScriptedAnalyticsRemoteService(), new AnalyticsProperties(), DIRECT, new RecordingSleeper());
        ShortLinkServiceImpl shortLinkService = new ShortLinkServiceImpl(
                new ShortCodeAllocator(codeSpace, repository, codeProperties),
                repository,
                new RedirectCoordinator(repository, dispatcher, clock, DIRECT),
                codeSpace,
                codeProperties,
                clock);
        mockMvc = MockMvcBuilders.standaloneSetup(new ShortLinkController(shortLinkService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void createThenRedirect() throws Exception {
        mockMvc.perform(post("/api/short-link/v1/create")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"targetUrl\":\"https://example.com/docs\",\"customAlias\":\"Docs\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0"))
                .andExpect(jsonPath("$.data.code").value("docs"))
                .andExpect(jsonPath("$.data.shortUrl").value("https://s.example.com/docs"))
                .andExpect(jsonPath("$.data.custom").value(true))
                .andExpect(jsonPath("$.data.existing").value(false));

        mockMvc.perform(get("/docs"))
                .andExpect(status().isFound())
                .andExpect(redirectedUrl("https://example.com/docs"));

        mockMvc.perform(get("/api/short-link/v1/info/docs"))
                .andExpect(jsonPath("$.data.clickCount").value(1));
    }

    @Test
    void clientErrorsAreWrappedInResult() throws Exception {
        mockMvc.perform(post("/api/short-link/v1/create")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"targetUrl\":\"https://example.com\",\"customAlias\":\"admin\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("A000100"));

        mockMvc.perform(delete("/api/short-link/v1/missing"))
                .andExpect(jsonPath("$.code").value("A000200"));
    }

    @Test
    void unknownCodeRedirectIsNotFound() throws Exception {
        mockMvc.perform(get("/missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void statsEndpoint() throws Exception {
        mockMvc.perform(get("/api/short-link/v1/stats"))
                .andExpect(jsonPath("$.code").value("0"))
                .andExpect(jsonPath("$.data.alphabetSize").value(58))
                .andExpect(jsonPath("$.data.totalUrls").value(0));
    }

    @Test
    void createSameTargetReturnsExistingLink() throws Exception {
        String body = "{\"targetUrl\":\"https://example.com/pricing\"}";
        mockMvc.perform(post("/api/short-link/v1/create").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(jsonPath("$.data.existing").value(false));

        mockMvc.perform(post("/api/short-link/v1/create").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.existing").value(true));

        mockMvc.perform(get("/api/short-link/v1/health"))
                .andExpect(jsonPath("$.data.totalUrls").value(1));
    }

    @Test
    void invalidTargetUrlIsRejected() throws Exception {
        mockMvc.perform(post("/api/short-link/v1/create")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"targetUrl\":\"http://\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("A000102"));
    }

    @Test
    void pageEndpointBindsQueryParams() throws Exception {
        for (int i = 1; i <= 3; i++) {
            mockMvc.perform(post("/api/short-link/v1/create")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"targetUrl\":\"https://example.com/" + i + "\"}"));
        }

        mockMvc.perform(get("/api/short-link/v1/page").param("page", "2").param("limit", "2"))
                .andExpect(jsonPath("$.code").value("0"))
                .andExpect(jsonPath("$.data.total").value(3))
                .andExpect(jsonPath("$.data.pages").value(2))
                .andExpect(jsonPath("$.data.page").value(2))
                .andExpect(jsonPath("$.data.records.length()").value(1));
    }

    @Test
    void healthEndpoint() throws Exception {
        mockMvc.perform(get("/api/short-link/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0"))
                .andExpect(jsonPath("$.data.service").value("shortlink-redirector"))
                .andExpect(jsonPath("$.data.status").value("healthy"))
                .andExpect(jsonPath("$.data.activeUrls").value(0));
    }
}
