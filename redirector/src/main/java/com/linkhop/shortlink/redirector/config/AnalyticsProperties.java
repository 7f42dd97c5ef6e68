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

package com.linkhop.shortlink.redirector.config;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 统计服务投递配置
 * <pre>
 * short-link:
 *   analytics:
 *     base-url: http://localhost:3002
 *     timeout: 5s
 *     health-timeout: 3s
 *     max-retries: 3
 *     base-delay: 1s
 *     max-batch-size: 1000
 *     batch:
 *       enabled: false
 *       flush-interval: 2s
 * </pre>
 */
@Getter
@Setter
@ToString
@ConfigurationProperties(prefix = "short-link.analytics")
public class AnalyticsProperties {

    /**
     * 统计服务地址
     */
    private String baseUrl = "http://localhost:3002";

    /**
     * 单次投递超时
     */
    private Duration timeout = Duration.ofSeconds(5);

    /**
     * 健康检查超时，只用于启动诊断
     */
    private Duration healthTimeout = Duration.ofSeconds(3);

    /**
     * 单个事件的最大投递次数（含首次）
     */
    private int maxRetries = 3;

    /**
     * 退避基数，第 n 次失败后等待 baseDelay * n
     */
    private Duration baseDelay = Duration.ofSeconds(1);

    /**
     * 单批事件数量上限
     */
    private int maxBatchSize = 1000;

    /**
     * 投递线程数
     */
    private int workerThreads = Runtime.getRuntime().availableProcessors();

    /**
     * 投递队列容量，队列满时直接丢弃
     */
    private int queueCapacity = 10000;

    private Batch batch = new Batch();

    @Getter
    @Setter
    @ToString
    public static class Batch {

        /**
         * 开启后单个事件先进入缓冲区，由定时任务按批投递
         */
        private boolean enabled = false;

        private Duration flushInterval = Duration.ofSeconds(2);

        private int bufferCapacity = 10000;
    }
}
