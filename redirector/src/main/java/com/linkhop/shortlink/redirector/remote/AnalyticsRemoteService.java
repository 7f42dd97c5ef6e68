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

package com.linkhop.shortlink.redirector.remote;

import com.linkhop.shortlink.redirector.common.convention.exception.RemoteException;
import com.linkhop.shortlink.redirector.dto.biz.ClickEventDTO;

import java.util.List;

/**
 * 统计服务远程调用
 * <p>
 * 写接口返回 HTTP 状态码，由调用方区分 2xx 成功、4xx 终态失败和 5xx 可重试；
 * 连接失败、超时等传输层错误抛出 {@link RemoteException}。
 */
public interface AnalyticsRemoteService {

    /**
     * 上报单个点击事件
     *
     * @return HTTP 状态码
     * @throws RemoteException 传输层错误
     */
    int ingest(ClickEventDTO event);

    /**
     * 批量上报点击事件，1-1000 条
     *
     * @return HTTP 状态码
     * @throws RemoteException 传输层错误
     */
    int ingestBatch(List<ClickEventDTO> events);

    /**
     * 健康检查，只用于诊断，异常一律返回 false
     */
    boolean health();
}
