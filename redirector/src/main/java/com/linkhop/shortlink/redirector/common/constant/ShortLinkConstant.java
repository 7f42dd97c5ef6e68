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

package com.linkhop.shortlink.redirector.common.constant;

import java.util.Set;

/**
 * 短链接常量类
 */
public class ShortLinkConstant {

    /**
     * 短码字符集，去掉了易混淆的 0、O、l、I
     */
    public static final String CODE_ALPHABET = "abcdefghijkmnopqrstuvwxyzABCDEFGHJKLMNPQRSTUVWXYZ123456789";

    /**
     * 自定义短码保留字，与路由前缀冲突
     */
    public static final Set<String> RESERVED_ALIASES = Set.of("api", "admin", "www", "app", "short", "url", "link", "health");

    public static final int CUSTOM_ALIAS_MIN_LENGTH = 3;

    public static final int CUSTOM_ALIAS_MAX_LENGTH = 20;

    /**
     * 有效天数上限
     */
    public static final int MAX_EXPIRES_IN_DAYS = 365;

    /**
     * 分页查询每页条数上限
     */
    public static final int PAGE_MAX_LIMIT = 100;

    /**
     * 分页查询允许的排序字段
     */
    public static final Set<String> PAGE_SORT_FIELDS = Set.of("createdAt", "clickCount", "expiresAt");

    /**
     * 健康检查中上报的服务名
     */
    public static final String SERVICE_NAME = "shortlink-redirector";

    /**
     * 默认创建人
     */
    public static final String ANONYMOUS_CREATOR = "anonymous";

    /**
     * 点击事件缺省字段值
     */
    public static final String UNKNOWN = "unknown";

    public static final String DIRECT_REFERER = "direct";

    /**
     * Cloudflare 透传的访问者国家
     */
    public static final String COUNTRY_HINT_HEADER = "CF-IPCountry";

    /**
     * 统计服务接口
     */
    public static final String ANALYTICS_TRACK_PATH = "/api/track";

    public static final String ANALYTICS_TRACK_BATCH_PATH = "/api/track/batch";

    public static final String ANALYTICS_HEALTH_PATH = "/health";
}
