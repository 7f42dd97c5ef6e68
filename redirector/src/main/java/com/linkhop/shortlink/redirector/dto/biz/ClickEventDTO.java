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

package com.linkhop.shortlink.redirector.dto.biz;

import com.alibaba.fastjson2.annotation.JSONField;
import lombok.Builder;
import lombok.Value;

import java.util.Date;

/**
 * 短链接点击事件
 * <p>
 * 每次跳转产生一个，创建后不可修改，由投递器独占直到投递成功或被丢弃。
 * 字段名按统计服务的入参序列化。
 */
@Value
@Builder
public class ClickEventDTO {

    @JSONField(name = "shortCode")
    String code;

    @JSONField(name = "timestamp", format = "iso8601")
    Date occurredAt;

    @JSONField(name = "userAgent")
    String userAgent;

    @JSONField(name = "referer")
    String referer;

    @JSONField(name = "ipAddress")
    String clientIp;

    @JSONField(name = "country")
    String countryHint;

    @JSONField(name = "acceptLanguage")
    String acceptLanguage;
}
