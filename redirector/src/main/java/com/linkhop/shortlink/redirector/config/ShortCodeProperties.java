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

/**
 * 短码生成配置
 * <pre>
 * short-link:
 *   code:
 *     default-length: 6
 *     max-length: 8
 *     max-retries: 10
 *     seed: 20241019   # 可选，固定随机种子便于复现
 * </pre>
 */
@Getter
@Setter
@ToString
@ConfigurationProperties(prefix = "short-link.code")
public class ShortCodeProperties {

    /**
     * 起始短码长度
     */
    private int defaultLength = 6;

    /**
     * 短码长度上限，超过后不再增长
     */
    private int maxLength = 8;

    /**
     * 每个长度下的最大尝试次数
     */
    private int maxRetries = 10;

    /**
     * 随机种子，为空时使用 SecureRandom
     */
    private Long seed;

    /**
     * 短链接对外访问的域名前缀，拼接短码后得到完整短链接
     */
    private String baseUrl = "http://localhost:3001";
}
