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
 * 短链接分页查询请求参数
 */
@Data
public class ShortLinkPageReqDTO {

    /**
     * 页码，从 1 开始
     */
    private Integer page = 1;

    /**
     * 每页条数
     */
    private Integer limit = 10;

    /**
     * 排序字段：createdAt、clickCount、expiresAt
     */
    private String sortBy = "createdAt";

    /**
     * 排序方向：asc、desc
     */
    private String order = "desc";
}
