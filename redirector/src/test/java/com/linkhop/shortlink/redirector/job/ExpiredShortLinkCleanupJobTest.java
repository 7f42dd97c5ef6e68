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

package com.linkhop.shortlink.redirector.job;

import com.linkhop.shortlink.redirector.dao.entity.ShortLinkDO;
import com.linkhop.shortlink.redirector.dao.repository.InMemoryShortLinkRepository;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;

import static org.junit.jupiter.api.Assertions.*;

class ExpiredShortLinkCleanupJobTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Test
    void deactivatesOnlyExpiredActiveLinks() {
        InMemoryShortLinkRepository repository = new InMemoryShortLinkRepository();
        repository.insert(link("live01", null));
        repository.insert(link("soon01", Date.from(NOW.plusSeconds(60))));
        repository.insert(link("stale1", Date.from(NOW.minusSeconds(60))));
        ExpiredShortLinkCleanupJob job = new ExpiredShortLinkCleanupJob(repository, Clock.fixed(NOW, ZoneOffset.UTC));

        assertEquals(1, job.deactivateExpired());

        assertFalse(repository.findByCodeOrAlias("stale1").orElseThrow().getActive());
        assertTrue(repository.findByCodeOrAlias("live01").orElseThrow().getActive());
        assertTrue(repository.findByCodeOrAlias("soon01").orElseThrow().getActive());
        assertEquals(0, job.deactivateExpired());
    }

    private static ShortLinkDO link(String code, Date expiresAt) {
        return ShortLinkDO.builder()
                .code(code)
                .targetUrl("https://example.com/" + code)
                .expiresAt(expiresAt)
                .active(true)
                .customAlias(false)
                .build();
    }
}
