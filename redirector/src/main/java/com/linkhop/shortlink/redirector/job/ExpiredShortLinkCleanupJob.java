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
import com.linkhop.shortlink.redirector.dao.repository.ShortLinkRepository;
import com.linkhop.shortlink.redirector.toolkit.LinkUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Date;

/**
 * 过期短链接停用任务
 * <p>
 * 跳转时每次都会重新判断有效期，这里只是把已过期的记录状态同步为停用，跳转正确性不依赖本任务
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "short-link.cleanup", name = "enabled", havingValue = "true")
public class ExpiredShortLinkCleanupJob {

    private final ShortLinkRepository shortLinkRepository;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${short-link.cleanup.fixed-delay:PT1H}", initialDelayString = "${short-link.cleanup.initial-delay:PT1M}")
    public void execute() {
        int deactivated = deactivateExpired();
        if (deactivated > 0) {
            log.info("[过期短链接停用] 本轮停用 {} 条", deactivated);
        }
    }

    /**
     * 停用所有已不可跳转的启用中短链接
     *
     * @return 本轮停用条数
     */
    public int deactivateExpired() {
        Date now = Date.from(clock.instant());
        int deactivated = 0;
        for (ShortLinkDO each : shortLinkRepository.findAllActive()) {
            if (!LinkUtil.isRedirectable(each, now) && shortLinkRepository.softDeactivate(each.getCode())) {
                deactivated++;
            }
        }
        return deactivated;
    }
}
