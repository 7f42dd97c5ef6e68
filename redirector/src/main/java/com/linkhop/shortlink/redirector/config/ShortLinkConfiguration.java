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

import com.linkhop.shortlink.redirector.toolkit.CodeSpace;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 短链接核心组件配置
 */
@Slf4j
@Configuration
@EnableScheduling
@EnableConfigurationProperties({ShortCodeProperties.class, AnalyticsProperties.class})
public class ShortLinkConfiguration {

    /**
     * 短码随机源，配置了种子时生成序列可复现
     */
    @Bean
    public Random shortCodeRandom(ShortCodeProperties shortCodeProperties) {
        if (shortCodeProperties.getSeed() != null) {
            log.warn("短码随机源使用固定种子：{}，仅限测试环境", shortCodeProperties.getSeed());
            return new Random(shortCodeProperties.getSeed());
        }
        return new SecureRandom();
    }

    @Bean
    public CodeSpace codeSpace(Random shortCodeRandom, ShortCodeProperties shortCodeProperties) {
        return new CodeSpace(shortCodeRandom, shortCodeProperties.getDefaultLength(), shortCodeProperties.getMaxLength());
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * 点击事件投递线程池
     * <p>
     * 有界队列，队列满时抛出 RejectedExecutionException 由投递方丢弃事件；关闭时等待已入队的任务执行完
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService clickEventDispatchExecutor(AnalyticsProperties analyticsProperties) {
        AtomicInteger index = new AtomicInteger();
        int threads = Math.max(1, analyticsProperties.getWorkerThreads());
        return new ThreadPoolExecutor(threads,
                threads,
                60,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(analyticsProperties.getQueueCapacity()),
                runnable -> {
                    Thread thread = new Thread(runnable);
                    thread.setName("click_event_dispatcher_" + index.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.AbortPolicy()
        );
    }

    /**
     * 点击数累加线程池
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService clickCountExecutor() {
        AtomicInteger index = new AtomicInteger();
        return new ThreadPoolExecutor(1,
                2,
                60,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(10000),
                runnable -> {
                    Thread thread = new Thread(runnable);
                    thread.setName("short-link_click_count_" + index.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.AbortPolicy()
        );
    }
}
