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

package com.linkhop.shortlink.redirector.dao.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Date;

/**
 * 短链接实体
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ShortLinkDO {

    /**
     * 短码，随机生成的短码与自定义短码共用同一个唯一命名空间
     */
    private String code;

    /**
     * 跳转目标链接
     */
    private String targetUrl;

    private Date createdAt;

    /**
     * 过期时间，null 表示永久有效
     */
    private Date expiresAt;

    /**
     * 启用标识，软删除后为 false，不可恢复
     */
    private Boolean active;

    /**
     * 本地点击计数，尽力而为，可能少计
     */
    private Long clickCount;

    /**
     * 是否为自定义短码
     */
    private Boolean customAlias;

    private String createdBy;
}
