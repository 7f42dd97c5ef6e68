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

import lombok.ToString;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 点击事件投递计数，按事件条数累计
 */
@ToString
public class ClickDispatchMetrics {

    /**
     * 统计服务已确认接收
     */
    private final AtomicLong delivered = new AtomicLong();

    /**
     * 发生过的重试次数
     */
    private final AtomicLong retried = new AtomicLong();

    /**
     * 重试耗尽或遇到终态错误后丢弃
     */
    private final AtomicLong dropped = new AtomicLong();

    /**
     * 格式非法或队列已满，未进入投递流程
     */
    private final AtomicLong rejected = new AtomicLong();

    void recordDelivered(int events) {
        delivered.addAndGet(events);
    }

    void recordRetried() {
        retried.incrementAndGet();
    }

    void recordDropped(int events) {
        dropped.addAndGet(events);
    }

    void recordRejected(int events) {
        rejected.addAndGet(events);
    }

    public long getDelivered() {
        return delivered.get();
    }

    public long getRetried() {
        return retried.get();
    }

    public long getDropped() {
        return dropped.get();
    }

    public long getRejected() {
        return rejected.get();
    }
}
