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

import cn.hutool.core.util.StrUtil;
import cn.hutool.http.ContentType;
import cn.hutool.http.HttpRequest;
import cn.hutool.http.HttpResponse;
import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import com.linkhop.shortlink.redirector.common.convention.exception.RemoteException;
import com.linkhop.shortlink.redirector.config.AnalyticsProperties;
import com.linkhop.shortlink.redirector.dto.biz.ClickEventDTO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.linkhop.shortlink.redirector.common.constant.ShortLinkConstant.ANALYTICS_HEALTH_PATH;
import static com.linkhop.shortlink.redirector.common.constant.ShortLinkConstant.ANALYTICS_TRACK_BATCH_PATH;
import static com.linkhop.shortlink.redirector.common.constant.ShortLinkConstant.ANALYTICS_TRACK_PATH;
import static com.linkhop.shortlink.redirector.common.convention.errorcode.BaseErrorCode.ANALYTICS_UNAVAILABLE;

/**
 * 基于 Hutool HttpRequest 的统计服务调用实现
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HutoolAnalyticsRemoteService implements AnalyticsRemoteService {

    private final AnalyticsProperties analyticsProperties;

    @Override
    public int ingest(ClickEventDTO event) {
        return post(ANALYTICS_TRACK_PATH, JSON.toJSONString(event));
    }

    @Override
    public int ingestBatch(List<ClickEventDTO> events) {
        return post(ANALYTICS_TRACK_BATCH_PATH, JSON.toJSONString(Map.of("clicks", events)));
    }

    @Override
    public boolean health() {
        String url = analyticsProperties.getBaseUrl() + ANALYTICS_HEALTH_PATH;
        try (HttpResponse response = HttpRequest.get(url)
                .timeout((int) analyticsProperties.getHealthTimeout().toMillis())
                .execute()) {
            if (response.getStatus() != 200) {
                log.warn("[统计服务健康检查] 状态码异常：{}", response.getStatus());
                return false;
            }
            String body = response.body();
            JSONObject result = StrUtil.isBlank(body) ? null : JSON.parseObject(body);
            return result != null && Objects.equals(result.getString("status"), "OK");
        } catch (RuntimeException ex) {
            log.warn("[统计服务健康检查] 请求失败：{}", ex.getMessage());
            return false;
        }
    }

    private int post(String path, String body) {
        String url = analyticsProperties.getBaseUrl() + path;
        try (HttpResponse response = HttpRequest.post(url)
                .contentType(ContentType.JSON.getValue())
                .body(body)
                .timeout((int) analyticsProperties.getTimeout().toMillis())
                .execute()) {
            return response.getStatus();
        } catch (RuntimeException ex) {
            // Hutool 把连接拒绝、读超时等包装为 IORuntimeException / HttpException
            throw new RemoteException(StrUtil.format("统计服务 {} 调用失败：{}", path, ex.getMessage()), ex, ANALYTICS_UNAVAILABLE);
        }
    }
}
