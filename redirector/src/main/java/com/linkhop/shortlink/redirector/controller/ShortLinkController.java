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

package com.linkhop.shortlink.redirector.controller;

import com.linkhop.shortlink.redirector.common.convention.result.Result;
import com.linkhop.shortlink.redirector.common.convention.result.Results;
import com.linkhop.shortlink.redirector.dto.req.ShortLinkCreateReqDTO;
import com.linkhop.shortlink.redirector.dto.req.ShortLinkPageReqDTO;
import com.linkhop.shortlink.redirector.dto.resp.ShortCodeStatsRespDTO;
import com.linkhop.shortlink.redirector.dto.resp.ShortLinkCreateRespDTO;
import com.linkhop.shortlink.redirector.dto.resp.ShortLinkHealthRespDTO;
import com.linkhop.shortlink.redirector.dto.resp.ShortLinkInfoRespDTO;
import com.linkhop.shortlink.redirector.dto.resp.ShortLinkPageRespDTO;
import com.linkhop.shortlink.redirector.service.ShortLinkService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * 短链接控制层
 */
@RestController
@RequiredArgsConstructor
public class ShortLinkController {

    private final ShortLinkService shortLinkService;

    /**
     * 短链接跳转原始链接
     */
    @GetMapping("/{code}")
    public void restoreUrl(@PathVariable("code") String code, HttpServletRequest request, HttpServletResponse response) {
        shortLinkService.restoreUrl(code, request, response);
    }

    /**
     * 创建短链接
     */
    @PostMapping("/api/short-link/v1/create")
    public Result<ShortLinkCreateRespDTO> createShortLink(@RequestBody ShortLinkCreateReqDTO requestParam) {
        return Results.success(shortLinkService.createShortLink(requestParam));
    }

    /**
     * 查询短链接详情
     */
    @GetMapping("/api/short-link/v1/info/{code}")
    public Result<ShortLinkInfoRespDTO> getShortLinkInfo(@PathVariable("code") String code) {
        return Results.success(shortLinkService.getShortLinkInfo(code));
    }

    /**
     * 分页查询启用中的短链接
     */
    @GetMapping("/api/short-link/v1/page")
    public Result<ShortLinkPageRespDTO> pageShortLink(ShortLinkPageReqDTO requestParam) {
        return Results.success(shortLinkService.pageShortLink(requestParam));
    }

    /**
     * 停用短链接
     */
    @DeleteMapping("/api/short-link/v1/{code}")
    public Result<Void> deleteShortLink(@PathVariable("code") String code) {
        shortLinkService.deleteShortLink(code);
        return Results.success();
    }

    /**
     * 短码空间统计
     */
    @GetMapping("/api/short-link/v1/stats")
    public Result<ShortCodeStatsRespDTO> getCodeSpaceStats() {
        return Results.success(shortLinkService.getCodeSpaceStats());
    }

    /**
     * 服务健康检查
     */
    @GetMapping("/api/short-link/v1/health")
    public Result<ShortLinkHealthRespDTO> healthCheck() {
        return Results.success(shortLinkService.healthCheck());
    }
}
