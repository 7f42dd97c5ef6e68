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

package com.linkhop.shortlink.redirector.mq.producer;

import cn.hutool.core.collection.CollUtil;
import cn.hutool.core.util.StrUtil;
import com.linkhop.shortlink.redirector.common.convention.exception.ClientException;
import com.linkhop.shortlink.redirector.common.convention.exception.RemoteException;
import com.linkhop.shortlink.redirector.config.AnalyticsProperties;
import com.linkhop.shortlink.redirector.dto.biz.ClickEventDTO;
import com.linkhop.shortlink.redirector.remote.AnalyticsRemoteService;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.IntSupplier;

import static com.linkhop.shortlink.redirector.common.convention.errorcode.BaseErrorCode.CLICK_BATCH_SIZE_INVALID;
import static com.linkhop.shortlink.redirector.common.convention.errorcode.BaseErrorCode.CLICK_EVENT_INVALID;

/**
 * 点击事件投递组件
 * <p>
 * 跳转链路只负责把事件交给这里，投递在独立线程池中完成，调用方不等待结果。
 * 统计服务不可用时按 baseDelay * 第几次尝试 退避重试，总共最多 maxRetries 次，耗尽后丢弃并计数。
 * 2xx 视为成功；4xx 视为终态失败，不重试；5xx 与连接失败、超时可重试。
 */
@Slf4j
@Component
public class ClickEventDispatcher implements InitializingBean, DisposableBean {

    private final AnalyticsRemoteService analyticsRemoteService;
    private final AnalyticsProperties analyticsProperties;
    private final Executor clickEventDispatchExecutor;
    private final BackoffSleeper backoffSleeper;

    @Getter
    private final ClickDispatchMetrics metrics = new ClickDispatchMetrics();

    /**
     * 批量模式下的待发送缓冲，未开启批量模式时为 null
     */
    private final BlockingQueue<ClickEventDTO> batchBuffer;

    private ScheduledExecutorService batchFlusher;

    @Autowired
    public ClickEventDispatcher(AnalyticsRemoteService analyticsRemoteService,
                                AnalyticsProperties analyticsProperties,
                                @Qualifier("clickEventDispatchExecutor") Executor clickEventDispatchExecutor) {
        this(analyticsRemoteService, analyticsProperties, clickEventDispatchExecutor, TimeUnit.MILLISECONDS::sleep);
    }

    public ClickEventDispatcher(AnalyticsRemoteService analyticsRemoteService,
                                AnalyticsProperties analyticsProperties,
                                Executor clickEventDispatchExecutor,
                                BackoffSleeper backoffSleeper) {
        this.analyticsRemoteService = analyticsRemoteService;
        this.analyticsProperties = analyticsProperties;
        this.clickEventDispatchExecutor = clickEventDispatchExecutor;
        this.backoffSleeper = backoffSleeper;
        AnalyticsProperties.Batch batch = analyticsProperties.getBatch();
        this.batchBuffer = batch.isEnabled() ? new ArrayBlockingQueue<>(batch.getBufferCapacity()) : null;
    }

    /**
     * 投递单个点击事件，立即返回，不抛出任何异常
     */
    public void dispatch(ClickEventDTO event) {
        if (event == null || StrUtil.isBlank(event.getCode())) {
            metrics.recordRejected(1);
            log.warn("[点击事件投递] 事件缺少短码，丢弃：{}", event);
            return;
        }
        if (batchBuffer != null) {
            if (!batchBuffer.offer(event)) {
                metrics.recordDropped(1);
                log.warn("[点击事件投递] 批量缓冲已满，丢弃短码 {} 的点击事件", event.getCode());
            }
            return;
        }
        submit(1, () -> deliver(1, () -> analyticsRemoteService.ingest(event), event.getCode()));
    }

    /**
     * 批量投递点击事件，入参校验失败抛出 {@link ClientException}，校验通过后异步发送
     */
    public void dispatchBatch(List<ClickEventDTO> events) {
        if (CollUtil.isEmpty(events) || events.size() > analyticsProperties.getMaxBatchSize()) {
            throw new ClientException(
                    StrUtil.format("批量点击事件条数需在 1-{} 之间", analyticsProperties.getMaxBatchSize()), CLICK_BATCH_SIZE_INVALID);
        }
        for (ClickEventDTO each : events) {
            if (each == null || StrUtil.isBlank(each.getCode())) {
                throw new ClientException("批量点击事件中存在缺少短码的事件", CLICK_EVENT_INVALID);
            }
        }
        List<ClickEventDTO> snapshot = List.copyOf(events);
        submit(snapshot.size(), () -> deliverBatch(snapshot));
    }

    /**
     * 从批量缓冲中取出至多 maxBatchSize 条事件，交给投递线程池发送
     *
     * @return 本次取出的事件条数
     */
    public int flushBuffer() {
        if (batchBuffer == null) {
            return 0;
        }
        List<ClickEventDTO> drained = new ArrayList<>();
        batchBuffer.drainTo(drained, analyticsProperties.getMaxBatchSize());
        if (drained.isEmpty()) {
            return 0;
        }
        submit(drained.size(), () -> deliverBatch(drained));
        return drained.size();
    }

    /**
     * 统计服务是否健康，仅用于诊断，不影响投递
     */
    public boolean isAnalyticsHealthy() {
        return analyticsRemoteService.health();
    }

    @Override
    public void afterPropertiesSet() {
        if (batchBuffer == null) {
            return;
        }
        long intervalMillis = analyticsProperties.getBatch().getFlushInterval().toMillis();
        batchFlusher = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("click_event_batch_flusher");
            thread.setDaemon(true);
            return thread;
        });
        batchFlusher.scheduleWithFixedDelay(() -> {
            try {
                flushBuffer();
            } catch (Throwable ex) {
                log.error("[点击事件投递] 批量缓冲刷新异常", ex);
            }
        }, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        log.info("[点击事件投递] 已开启批量模式，刷新间隔 {} ms，缓冲容量 {}",
                intervalMillis, analyticsProperties.getBatch().getBufferCapacity());
    }

    @Override
    public void destroy() {
        if (batchFlusher != null) {
            batchFlusher.shutdownNow();
        }
        // 关闭前把缓冲中剩余的事件交给投递线程池，线程池随后由容器排空
        while (flushBuffer() > 0) {
            log.debug("[点击事件投递] 关闭前刷新批量缓冲");
        }
    }

    private void deliverBatch(List<ClickEventDTO> events) {
        deliver(events.size(), () -> analyticsRemoteService.ingestBatch(events), StrUtil.format("批量 {} 条", events.size()));
    }

    private void submit(int eventCount, Runnable task) {
        try {
            clickEventDispatchExecutor.execute(task);
        } catch (RejectedExecutionException ex) {
            metrics.recordRejected(eventCount);
            log.warn("[点击事件投递] 投递队列已满，丢弃 {} 条点击事件", eventCount);
        }
    }

    /**
     * 带重试的投递
     *
     * @return 是否投递成功
     */
    boolean deliver(int eventCount, IntSupplier call, String description) {
        int maxAttempts = Math.max(1, analyticsProperties.getMaxRetries());
        for (int attemptNumber = 1; attemptNumber <= maxAttempts; attemptNumber++) {
            int status;
            try {
                status = call.getAsInt();
            } catch (RemoteException ex) {
                log.warn("[点击事件投递] {} 第 {} 次投递失败：{}", description, attemptNumber, ex.getErrorMessage());
                if (!backoff(attemptNumber, maxAttempts, eventCount, description)) {
                    return false;
                }
                continue;
            } catch (RuntimeException ex) {
                metrics.recordDropped(eventCount);
                log.error("[点击事件投递] {} 投递出现非预期异常，不再重试", description, ex);
                return false;
            }
            if (status >= 200 && status < 300) {
                metrics.recordDelivered(eventCount);
                return true;
            }
            if (status < 500) {
                metrics.recordDropped(eventCount);
                log.error("[点击事件投递] {} 被统计服务拒绝，状态码：{}，不再重试", description, status);
                return false;
            }
            log.warn("[点击事件投递] {} 第 {} 次投递失败，状态码：{}", description, attemptNumber, status);
            if (!backoff(attemptNumber, maxAttempts, eventCount, description)) {
                return false;
            }
        }
        return false;
    }

    /**
     * 两次尝试之间退避；已是最后一次或线程被中断时丢弃事件
     *
     * @return 是否继续下一次尝试
     */
    private boolean backoff(int attemptNumber, int maxAttempts, int eventCount, String description) {
        if (attemptNumber >= maxAttempts) {
            metrics.recordDropped(eventCount);
            log.warn("[点击事件投递] {} 已尝试 {} 次仍失败，丢弃", description, maxAttempts);
            return false;
        }
        metrics.recordRetried();
        try {
            backoffSleeper.sleep(analyticsProperties.getBaseDelay().toMillis() * attemptNumber);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            metrics.recordDropped(eventCount);
            log.warn("[点击事件投递] {} 退避等待被中断，丢弃", description);
            return false;
        }
    }

    /**
     * 退避等待
     */
    @FunctionalInterface
    public interface BackoffSleeper {

        void sleep(long millis) throws InterruptedException;
    }
}
