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

package com.linkhop.shortlink.redirector.dto.req;

import lombok.Data;

/**
 * 短链接创建请求参数
 */
@Data
public class ShortLinkCreateReqDTO {

    /**
     * 跳转目标链接，需带 http:// 或 https://
     */
    private String targetUrl;

    /**
     * 自定义短码，可选
     */
    private String customAlias;

    /**
     * 有效天数，可选，1-365，为空表示永久有效
     */
    private Integer expiresInDays;

    /**
     * 创建人，为空时记为 anonymous
     */
    private String createdBy;
}
