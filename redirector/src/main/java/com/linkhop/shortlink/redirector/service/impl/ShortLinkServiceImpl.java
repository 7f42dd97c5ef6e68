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

package com.linkhop.shortlink.redirector.service.impl;

import cn.hutool.core.util.NumberUtil;
import cn.hutool.core.util.StrUtil;
import com.linkhop.shortlink.redirector.common.convention.exception.ClientException;
import com.linkhop.shortlink.redirector.common.convention.exception.ServiceException;
import com.linkhop.shortlink.redirector.config.ShortCodeProperties;
import com.linkhop.shortlink.redirector.dao.entity.ShortLinkDO;
import com.linkhop.shortlink.redirector.dao.repository.ShortLinkDuplicateKeyException;
import com.linkhop.shortlink.redirector.dao.repository.ShortLinkRepository;
import com.linkhop.shortlink.redirector.dto.biz.AllocatedCodeDTO;
import com.linkhop.shortlink.redirector.dto.req.ShortLinkCreateReqDTO;
import com.linkhop.shortlink.redirector.dto.req.ShortLinkPageReqDTO;
import com.linkhop.shortlink.redirector.dto.resp.ShortCodeStatsRespDTO;
import com.linkhop.shortlink.redirector.dto.resp.ShortLinkCreateRespDTO;
import com.linkhop.shortlink.redirector.dto.resp.ShortLinkHealthRespDTO;
import com.linkhop.shortlink.redirector.dto.resp.ShortLinkInfoRespDTO;
import com.linkhop.shortlink.redirector.dto.resp.ShortLinkPageRespDTO;
import com.linkhop.shortlink.redirector.service.RedirectCoordinator;
import com.linkhop.shortlink.redirector.service.ShortCodeAllocator;
import com.linkhop.shortlink.redirector.service.ShortLinkService;
import com.linkhop.shortlink.redirector.toolkit.CodeSpace;
import com.linkhop.shortlink.redirector.toolkit.LinkUtil;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.linkhop.shortlink.redirector.common.constant.ShortLinkConstant.ANONYMOUS_CREATOR;
import static com.linkhop.shortlink.redirector.common.constant.ShortLinkConstant.MAX_EXPIRES_IN_DAYS;
import static com.linkhop.shortlink.redirector.common.constant.ShortLinkConstant.PAGE_MAX_LIMIT;
import static com.linkhop.shortlink.redirector.common.constant.ShortLinkConstant.PAGE_SORT_FIELDS;
import static com.linkhop.shortlink.redirector.common.constant.ShortLinkConstant.SERVICE_NAME;
import static com.linkhop.shortlink.redirector.common.convention.errorcode.BaseErrorCode.ALIAS_TAKEN;
import static com.linkhop.shortlink.redirector.common.convention.errorcode.BaseErrorCode.ALLOCATION_EXHAUSTED;
import static com.linkhop.shortlink.redirector.common.convention.errorcode.BaseErrorCode.EXPIRES_IN_DAYS_INVALID;
import static com.linkhop.shortlink.redirector.common.convention.errorcode.BaseErrorCode.LINK_EXPIRED;
import static com.linkhop.shortlink.redirector.common.convention.errorcode.BaseErrorCode.LINK_NOT_FOUND;
import static com.linkhop.shortlink.redirector.common.convention.errorcode.BaseErrorCode.TARGET_URL_INVALID;

/**
 * 短链接接口实现层
 * <p>
 * 写流程：分配短码 -> 入库，入库时的唯一约束冲突按短码类型分别处理。
 * 读流程：交给 {@link RedirectCoordinator}，这里只负责 HTTP 语义。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ShortLinkServiceImpl implements ShortLinkService {

    private final ShortCodeAllocator shortCodeAllocator;
    private final ShortLinkRepository shortLinkRepository;
    private final RedirectCoordinator redirectCoordinator;
    private final CodeSpace codeSpace;
    private final ShortCodeProperties shortCodeProperties;
    private final Clock clock;

    @Override
    public ShortLinkCreateRespDTO createShortLink(ShortLinkCreateReqDTO requestParam) {
        verifyCreateParam(requestParam);
        String customAlias = StrUtil.emptyToNull(StrUtil.trim(requestParam.getCustomAlias()));
        Instant createdAt = clock.instant();
        Date now = Date.from(createdAt);
        if (customAlias == null) {
            Optional<ShortLinkDO> hasShortLinkDO = shortLinkRepository.findActiveByTargetUrl(requestParam.getTargetUrl())
                    .filter(each -> LinkUtil.isRedirectable(each, now));
            if (hasShortLinkDO.isPresent()) {
                log.info("原始链接已存在可用短链接，短码：{}", hasShortLinkDO.get().getCode());
                return buildCreateResp(hasShortLinkDO.get(), true);
            }
        }
        Date expiresAt = requestParam.getExpiresInDays() == null
                ? null
                : Date.from(createdAt.plus(requestParam.getExpiresInDays(), ChronoUnit.DAYS));
        AllocatedCodeDTO allocated = shortCodeAllocator.allocate(customAlias);
        ShortLinkDO shortLinkDO = buildShortLink(allocated, requestParam, now, expiresAt);
        try {
            shortLinkRepository.insert(shortLinkDO);
        } catch (ShortLinkDuplicateKeyException ex) {
            // 查重与入库之间被并发请求抢占
            if (allocated.isCustom()) {
                log.warn("自定义短码：{} 重复入库", allocated.getCode());
                throw new ClientException(StrUtil.format("自定义短码 {} 已被占用", allocated.getCode()), ALIAS_TAKEN);
            }
            log.warn("短码：{} 重复入库，重新分配", allocated.getCode());
            allocated = shortCodeAllocator.allocate(null);
            shortLinkDO = buildShortLink(allocated, requestParam, now, expiresAt);
            try {
                shortLinkRepository.insert(shortLinkDO);
            } catch (ShortLinkDuplicateKeyException retryEx) {
                log.warn("短码：{} 再次重复入库", allocated.getCode());
                throw new ServiceException("短链接频繁生成，请稍后再试", retryEx, ALLOCATION_EXHAUSTED);
            }
        }
        log.info("创建短链接成功，短码：{}，自定义：{}", shortLinkDO.getCode(), allocated.isCustom());
        return buildCreateResp(shortLinkDO, false);
    }

    @SneakyThrows
    @Override
    public void restoreUrl(String code, HttpServletRequest request, HttpServletResponse response) {
        String targetUrl;
        try {
            targetUrl = redirectCoordinator.resolve(code, LinkUtil.buildRedirectContext(request));
        } catch (ClientException ex) {
            if (Objects.equals(ex.getErrorCode(), LINK_EXPIRED.code())) {
                response.sendError(HttpServletResponse.SC_GONE, ex.getErrorMessage());
                return;
            }
            response.sendError(HttpServletResponse.SC_NOT_FOUND, ex.getErrorMessage());
            return;
        }
        response.sendRedirect(targetUrl);
    }

    @Override
    public ShortLinkInfoRespDTO getShortLinkInfo(String code) {
        ShortLinkDO shortLinkDO = shortLinkRepository.findByCodeOrAlias(code)
                .orElseThrow(() -> new ClientException(StrUtil.format("短链接 {} 不存在", code), LINK_NOT_FOUND));
        return buildInfoResp(shortLinkDO, Date.from(clock.instant()));
    }

    @Override
    public ShortLinkPageRespDTO pageShortLink(ShortLinkPageReqDTO requestParam) {
        ShortLinkPageReqDTO actual = normalizePageParam(requestParam);
        Date now = Date.from(clock.instant());
        List<ShortLinkInfoRespDTO> records = shortLinkRepository.pageActive(actual).stream()
                .map(each -> buildInfoResp(each, now))
                .toList();
        long total = shortLinkRepository.countActive();
        return ShortLinkPageRespDTO.builder()
                .records(records)
                .total(total)
                .page(actual.getPage())
                .pages((int) ((total + actual.getLimit() - 1) / actual.getLimit()))
                .limit(actual.getLimit())
                .build();
    }

    @Override
    public void deleteShortLink(String code) {
        if (!shortLinkRepository.softDeactivate(code)) {
            throw new ClientException(StrUtil.format("短链接 {} 不存在", code), LINK_NOT_FOUND);
        }
        log.info("短链接已停用，短码：{}", code);
    }

    @Override
    public ShortCodeStatsRespDTO getCodeSpaceStats() {
        Date now = Date.from(clock.instant());
        long total = shortLinkRepository.count();
        long expired = shortLinkRepository.findAllActive().stream()
                .filter(each -> LinkUtil.isExpired(each, now))
                .count();
        int length = codeSpace.defaultLength();
        double probability = codeSpace.collisionProbability(total, length) * 100;
        return ShortCodeStatsRespDTO.builder()
                .totalUrls(total)
                .activeUrls(shortLinkRepository.countActive())
                .customAliases(shortLinkRepository.countCustomAlias())
                .expiredUrls(expired)
                .alphabetSize(codeSpace.alphabetSize())
                .possibleCombinations(codeSpace.possibleCombinations(length).toString())
                .collisionProbability(NumberUtil.round(probability, 2).doubleValue())
                .build();
    }

    @Override
    public ShortLinkHealthRespDTO healthCheck() {
        return ShortLinkHealthRespDTO.builder()
                .service(SERVICE_NAME)
                .status("healthy")
                .timestamp(Date.from(clock.instant()))
                .totalUrls(shortLinkRepository.count())
                .activeUrls(shortLinkRepository.countActive())
                .uptime(ManagementFactory.getRuntimeMXBean().getUptime() / 1000)
                .build();
    }

    private void verifyCreateParam(ShortLinkCreateReqDTO requestParam) {
        if (!LinkUtil.isValidTargetUrl(requestParam.getTargetUrl())) {
            throw new ClientException("原始链接格式错误，需为 http:// 或 https:// 开头的完整链接", TARGET_URL_INVALID);
        }
        Integer expiresInDays = requestParam.getExpiresInDays();
        if (expiresInDays != null && (expiresInDays < 1 || expiresInDays > MAX_EXPIRES_IN_DAYS)) {
            throw new ClientException(StrUtil.format("有效天数需在 1-{} 之间", MAX_EXPIRES_IN_DAYS), EXPIRES_IN_DAYS_INVALID);
        }
    }

    private ShortLinkPageReqDTO normalizePageParam(ShortLinkPageReqDTO requestParam) {
        ShortLinkPageReqDTO actual = new ShortLinkPageReqDTO();
        if (requestParam.getPage() != null && requestParam.getPage() > 0) {
            actual.setPage(requestParam.getPage());
        }
        if (requestParam.getLimit() != null && requestParam.getLimit() > 0) {
            actual.setLimit(Math.min(requestParam.getLimit(), PAGE_MAX_LIMIT));
        }
        if (PAGE_SORT_FIELDS.contains(requestParam.getSortBy())) {
            actual.setSortBy(requestParam.getSortBy());
        }
        // 只有显式指定 asc 才升序
        if (StrUtil.equalsIgnoreCase(requestParam.getOrder(), "asc")) {
            actual.setOrder("asc");
        }
        return actual;
    }

    private ShortLinkCreateRespDTO buildCreateResp(ShortLinkDO shortLinkDO, boolean existing) {
        return ShortLinkCreateRespDTO.builder()
                .code(shortLinkDO.getCode())
                .shortUrl(LinkUtil.buildShortUrl(shortCodeProperties.getBaseUrl(), shortLinkDO.getCode()))
                .targetUrl(shortLinkDO.getTargetUrl())
                .createdAt(shortLinkDO.getCreatedAt())
                .expiresAt(shortLinkDO.getExpiresAt())
                .custom(Boolean.TRUE.equals(shortLinkDO.getCustomAlias()))
                .existing(existing)
                .build();
    }

    private ShortLinkInfoRespDTO buildInfoResp(ShortLinkDO shortLinkDO, Date now) {
        return ShortLinkInfoRespDTO.builder()
                .code(shortLinkDO.getCode())
                .shortUrl(LinkUtil.buildShortUrl(shortCodeProperties.getBaseUrl(), shortLinkDO.getCode()))
                .targetUrl(shortLinkDO.getTargetUrl())
                .createdAt(shortLinkDO.getCreatedAt())
                .expiresAt(shortLinkDO.getExpiresAt())
                .active(shortLinkDO.getActive())
                .expired(LinkUtil.isExpired(shortLinkDO, now))
                .clickCount(shortLinkDO.getClickCount())
                .customAlias(shortLinkDO.getCustomAlias())
                .build();
    }

    private ShortLinkDO buildShortLink(AllocatedCodeDTO allocated, ShortLinkCreateReqDTO requestParam, Date now, Date expiresAt) {
        return ShortLinkDO.builder()
                .code(allocated.getCode())
                .targetUrl(requestParam.getTargetUrl())
                .createdAt(now)
                .expiresAt(expiresAt)
                .active(Boolean.TRUE)
                .clickCount(0L)
                .customAlias(allocated.isCustom())
                .createdBy(StrUtil.blankToDefault(requestParam.getCreatedBy(), ANONYMOUS_CREATOR))
                .build();
    }
}
