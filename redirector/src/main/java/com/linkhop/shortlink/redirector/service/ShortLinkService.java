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

package com.linkhop.shortlink.redirector.service;

import com.linkhop.shortlink.redirector.dto.req.ShortLinkCreateReqDTO;
import com.linkhop.shortlink.redirector.dto.req.ShortLinkPageReqDTO;
import com.linkhop.shortlink.redirector.dto.resp.ShortCodeStatsRespDTO;
import com.linkhop.shortlink.redirector.dto.resp.ShortLinkCreateRespDTO;
import com.linkhop.shortlink.redirector.dto.resp.ShortLinkHealthRespDTO;
import com.linkhop.shortlink.redirector.dto.resp.ShortLinkInfoRespDTO;
import com.linkhop.shortlink.redirector.dto.resp.ShortLinkPageRespDTO;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * 短链接接口层
 */
public interface ShortLinkService {

    /**
     * 创建短链接
     * <p>
     * 未指定自定义短码且原始链接已有可跳转的短链接时，直接返回已有短链接
     *
     * @param requestParam 创建短链接请求参数
     * @return 短链接创建信息
     */
    ShortLinkCreateRespDTO createShortLink(ShortLinkCreateReqDTO requestParam);

    /**
     * 短链接跳转原始链接
     *
     * @param code     短码或自定义短码
     * @param request  HTTP 请求
     * @param response HTTP 响应
     */
    void restoreUrl(String code, HttpServletRequest request, HttpServletResponse response);

    /**
     * 查询短链接详情
     */
    ShortLinkInfoRespDTO getShortLinkInfo(String code);

    /**
     * 分页查询启用中的短链接
     *
     * @param requestParam 分页参数
     * @return 短链接分页返回结果
     */
    ShortLinkPageRespDTO pageShortLink(ShortLinkPageReqDTO requestParam);

    /**
     * 删除短链接，只做逻辑停用
     */
    void deleteShortLink(String code);

    /**
     * 短码空间统计
     */
    ShortCodeStatsRespDTO getCodeSpaceStats();

    /**
     * 服务健康状况，包含短链接总数与启用数
     */
    ShortLinkHealthRespDTO healthCheck();
}
