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

package com.linkhop.shortlink.redirector.dao.repository;

import com.linkhop.shortlink.redirector.dao.entity.ShortLinkDO;
import com.linkhop.shortlink.redirector.dto.req.ShortLinkPageReqDTO;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryShortLinkRepositoryTest {

    private final InMemoryShortLinkRepository repository = new InMemoryShortLinkRepository();

    private static ShortLinkDO link(String code, boolean custom) {
        return ShortLinkDO.builder()
                .code(code)
                .targetUrl("https://example.com/" + code)
                .active(true)
                .clickCount(0L)
                .customAlias(custom)
                .build();
    }

    @Test
    void insertAndFind() {
        repository.insert(link("abc123", false));

        assertTrue(repository.existsByCodeOrAlias("abc123"));
        assertEquals("https://example.com/abc123", repository.findByCodeOrAlias("abc123").orElseThrow().getTargetUrl());
        assertTrue(repository.findByCodeOrAlias("other1").isEmpty());
        assertFalse(repository.existsByCodeOrAlias(null));
    }

    @Test
    @DisplayName("重复入库抛出唯一约束异常并标明冲突字段")
    void duplicateInsertReportsField() {
        repository.insert(link("abc123", false));
        repository.insert(link("promo", true));

        ShortLinkDuplicateKeyException codeConflict = assertThrows(ShortLinkDuplicateKeyException.class,
                () -> repository.insert(link("abc123", false)));
        assertEquals(ShortLinkDuplicateKeyException.FIELD_CODE, codeConflict.getField());

        ShortLinkDuplicateKeyException aliasConflict = assertThrows(ShortLinkDuplicateKeyException.class,
                () -> repository.insert(link("promo", false)));
        assertEquals(ShortLinkDuplicateKeyException.FIELD_CUSTOM_ALIAS, aliasConflict.getField());
        assertInstanceOf(DuplicateKeyException.class, aliasConflict);
    }

    @Test
    @DisplayName("返回的实体是拷贝，修改不影响存储")
    void returnsDefensiveCopies() {
        ShortLinkDO original = link("abc123", false);
        repository.insert(original);
        original.setTargetUrl("https://changed.example.com");

        ShortLinkDO found = repository.findByCodeOrAlias("abc123").orElseThrow();
        found.setActive(false);

        ShortLinkDO again = repository.findByCodeOrAlias("abc123").orElseThrow();
        assertEquals("https://example.com/abc123", again.getTargetUrl());
        assertTrue(again.getActive());
    }

    @Test
    void incrementAndDeactivate() {
        repository.insert(link("abc123", false));

        repository.incrementClickCount("abc123");
        repository.incrementClickCount("abc123");
        repository.incrementClickCount("missing");

        assertEquals(2L, repository.findByCodeOrAlias("abc123").orElseThrow().getClickCount());
        assertTrue(repository.softDeactivate("abc123"));
        assertFalse(repository.softDeactivate("missing"));
        assertFalse(repository.findByCodeOrAlias("abc123").orElseThrow().getActive());
    }

    @Test
    void counts() {
        repository.insert(link("abc123", false));
        repository.insert(link("def456", false));
        repository.insert(link("promo", true));
        repository.softDeactivate("def456");

        assertEquals(3, repository.count());
        assertEquals(2, repository.countActive());
        assertEquals(1, repository.countCustomAlias());
        assertEquals(2, repository.findAllActive().size());
    }

    @Test
    @DisplayName("并发插入同一短码只有一个成功")
    void concurrentInsertOfSameCodeHasSingleWinner() throws Exception {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    try {
                        repository.insert(link("race42", false));
                        return true;
                    } catch (ShortLinkDuplicateKeyException ex) {
                        return false;
                    }
                }));
            }
            start.countDown();
            int winners = 0;
            for (Future<Boolean> each : futures) {
                if (each.get(5, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertEquals(1, winners);
            assertEquals(1, repository.count());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("按原始链接只查询启用中的短链接，取最早创建的一条")
    void findActiveByTargetUrl() {
        repository.insert(link("old001", false).toBuilder().targetUrl("https://example.com/x").createdAt(new Date(1000L)).active(false).build());
        repository.insert(link("new002", false).toBuilder().targetUrl("https://example.com/x").createdAt(new Date(3000L)).build());
        repository.insert(link("mid003", false).toBuilder().targetUrl("https://example.com/x").createdAt(new Date(2000L)).build());

        assertEquals("mid003", repository.findActiveByTargetUrl("https://example.com/x").orElseThrow().getCode());
        assertTrue(repository.findActiveByTargetUrl("https://example.com/y").isEmpty());
        assertTrue(repository.findActiveByTargetUrl(null).isEmpty());
    }

    @Test
    void pageActiveSkipsInactiveAndAppliesOffset() {
        for (int i = 1; i <= 5; i++) {
            repository.insert(link("page0" + i, false).toBuilder().createdAt(new Date(i * 1000L)).active(i != 3).build());
        }
        ShortLinkPageReqDTO requestParam = new ShortLinkPageReqDTO();
        requestParam.setPage(2);
        requestParam.setLimit(2);
        requestParam.setOrder("asc");

        List<ShortLinkDO> result = repository.pageActive(requestParam);

        assertEquals(List.of("page04", "page05"), result.stream().map(ShortLinkDO::getCode).toList());
    }
}
