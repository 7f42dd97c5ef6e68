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

package com.linkhop.shortlink.redirector.dto.resp;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 短码空间使用情况
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShortCodeStatsRespDTO {

    private Long totalUrls;

    private Long activeUrls;

    private Long customAliases;

    /**
     * 已过期但仍标记为启用的短链接数
     */
    private Long expiredUrls;

    private Integer alphabetSize;

    /**
     * 默认长度下的短码总数
     */
    private String possibleCombinations;

    /**
     * 默认长度下随机生成一次发生碰撞的概率，百分比，保留两位小数
     */
    private Double collisionProbability;
}
