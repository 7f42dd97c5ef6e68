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

package com.linkhop.shortlink.redirector.initialize;

import com.linkhop.shortlink.redirector.config.AnalyticsProperties;
import com.linkhop.shortlink.redirector.mq.producer.ClickEventDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

/**
 * 启动时探测一次统计服务
 * <p>
 * 结果只打日志，统计服务不可用不影响启动，也不影响后续投递
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalyticsHealthInitializeTask implements InitializingBean {

    private final ClickEventDispatcher clickEventDispatcher;
    private final AnalyticsProperties analyticsProperties;

    @Override
    public void afterPropertiesSet() {
        boolean healthy;
        try {
            healthy = clickEventDispatcher.isAnalyticsHealthy();
        } catch (RuntimeException ex) {
            log.warn("[统计服务健康检查] {} 探测异常，点击事件将按重试策略投递，失败后丢弃", analyticsProperties.getBaseUrl(), ex);
            return;
        }
        if (healthy) {
            log.info("[统计服务健康检查] {} 可用", analyticsProperties.getBaseUrl());
            return;
        }
        log.warn("[统计服务健康检查] {} 不可用，点击事件将按重试策略投递，失败后丢弃", analyticsProperties.getBaseUrl());
    }
}
