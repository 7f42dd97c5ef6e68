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

import java.util.Date;

/**
 * 短链接详情
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShortLinkInfoRespDTO {

    private String code;

    /**
     * 完整短链接
     */
    private String shortUrl;

    private String targetUrl;

    private Date createdAt;

    private Date expiresAt;

    private Boolean active;

    /**
     * 查询时刻是否已过有效期
     */
    private Boolean expired;

    private Long clickCount;

    private Boolean customAlias;
}
