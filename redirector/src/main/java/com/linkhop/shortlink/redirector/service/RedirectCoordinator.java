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

package com.linkhop.shortlink.redirector.service;

import cn.hutool.core.util.StrUtil;
import com.linkhop.shortlink.redirector.common.convention.exception.ClientException;
import com.linkhop.shortlink.redirector.dao.entity.ShortLinkDO;
import com.linkhop.shortlink.redirector.dao.repository.ShortLinkRepository;
import com.linkhop.shortlink.redirector.dto.biz.RedirectContextDTO;
import com.linkhop.shortlink.redirector.mq.producer.ClickEventDispatcher;
import com.linkhop.shortlink.redirector.toolkit.LinkUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Date;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static com.linkhop.shortlink.redirector.common.convention.errorcode.BaseErrorCode.LINK_EXPIRED;
import static com.linkhop.shortlink.redirector.common.convention.errorcode.BaseErrorCode.LINK_NOT_FOUND;

/**
 * 跳转协调器
 * <p>
 * 查询 -> 判断是否可跳转 -> 异步投递点击事件和点击数累加 -> 返回原始链接。
 * 只有查询会阻塞调用方，统计相关的副作用全部交给后台线程。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedirectCoordinator {

    private final ShortLinkRepository shortLinkRepository;
    private final ClickEventDispatcher clickEventDispatcher;
    private final Clock clock;

    @Qualifier("clickCountExecutor")
    private final Executor clickCountExecutor;

    /**
     * 解析短码
     *
     * @param code    短码或自定义短码
     * @param context 请求上下文，允许为空
     * @return 原始链接
     * @throws ClientException 短码不存在或已失效
     */
    public String resolve(String code, RedirectContextDTO context) {
        if (!LinkUtil.isWellFormedCode(code)) {
            throw new ClientException(StrUtil.format("短链接 {} 不存在", code), LINK_NOT_FOUND);
        }
        ShortLinkDO shortLinkDO = shortLinkRepository.findByCodeOrAlias(code)
                .orElseThrow(() -> new ClientException(StrUtil.format("短链接 {} 不存在", code), LINK_NOT_FOUND));
        Date now = Date.from(clock.instant());
        if (!LinkUtil.isRedirectable(shortLinkDO, now)) {
            throw new ClientException(StrUtil.format("短链接 {} 已失效", code), LINK_EXPIRED);
        }
        clickEventDispatcher.dispatch(LinkUtil.buildClickEvent(shortLinkDO.getCode(), context, now));
        incrementClickCountAsync(shortLinkDO.getCode());
        return shortLinkDO.getTargetUrl();
    }

    private void incrementClickCountAsync(String code) {
        try {
            CompletableFuture.runAsync(() -> shortLinkRepository.incrementClickCount(code), clickCountExecutor)
                    .exceptionally(ex -> {
                        log.warn("[短链接跳转] 短码 {} 点击数累加失败", code, ex);
                        return null;
                    });
        } catch (RejectedExecutionException ex) {
            log.warn("[短链接跳转] 点击数累加线程池已满，跳过短码 {}", code);
        }
    }
}
