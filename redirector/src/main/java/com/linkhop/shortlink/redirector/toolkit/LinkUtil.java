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

package com.linkhop.shortlink.redirector.toolkit;

import cn.hutool.core.util.ReUtil;
import cn.hutool.core.util.StrUtil;
import com.linkhop.shortlink.redirector.dao.entity.ShortLinkDO;
import com.linkhop.shortlink.redirector.dto.biz.ClickEventDTO;
import com.linkhop.shortlink.redirector.dto.biz.RedirectContextDTO;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;

import java.util.Date;
import java.util.regex.Pattern;

import static com.linkhop.shortlink.redirector.common.constant.ShortLinkConstant.COUNTRY_HINT_HEADER;
import static com.linkhop.shortlink.redirector.common.constant.ShortLinkConstant.CUSTOM_ALIAS_MAX_LENGTH;
import static com.linkhop.shortlink.redirector.common.constant.ShortLinkConstant.CUSTOM_ALIAS_MIN_LENGTH;
import static com.linkhop.shortlink.redirector.common.constant.ShortLinkConstant.DIRECT_REFERER;
import static com.linkhop.shortlink.redirector.common.constant.ShortLinkConstant.UNKNOWN;

/**
 * 短链接工具类
 */
public final class LinkUtil {

    private static final Pattern CODE_PATTERN = Pattern.compile("^[a-zA-Z0-9-]+$");

    /**
     * http(s) 协议，带顶级域名的主机，路径与查询串只允许 URL 安全字符
     */
    private static final Pattern TARGET_URL_PATTERN = Pattern.compile(
            "^https?://(www\\.)?[-a-zA-Z0-9@:%._+~#=]{1,256}\\.[a-zA-Z0-9()]{1,6}\\b([-a-zA-Z0-9()@:%_+.~#?&/=]*)$");

    private LinkUtil() {
    }

    /**
     * 短链接是否可跳转：启用中，且未设置有效期或有效期晚于 now
     * <p>
     * 跳转链路和过期清理任务共用这一个判断，启用标识可能滞后，有效期必须每次重新比较
     */
    public static boolean isRedirectable(ShortLinkDO shortLinkDO, Date now) {
        return Boolean.TRUE.equals(shortLinkDO.getActive()) && !isExpired(shortLinkDO, now);
    }

    /**
     * 只看有效期，不看启用标识，有效期恰好等于 now 时仍可跳转
     */
    public static boolean isExpired(ShortLinkDO shortLinkDO, Date now) {
        return shortLinkDO.getExpiresAt() != null && shortLinkDO.getExpiresAt().before(now);
    }

    /**
     * 跳转目标是否为合法的 http(s) 链接
     */
    public static boolean isValidTargetUrl(String targetUrl) {
        return StrUtil.isNotBlank(targetUrl) && ReUtil.isMatch(TARGET_URL_PATTERN, targetUrl);
    }

    /**
     * 拼接对外展示的完整短链接
     */
    public static String buildShortUrl(String baseUrl, String code) {
        return StrUtil.removeSuffix(baseUrl, "/") + "/" + code;
    }

    /**
     * 入参短码格式是否合法，非法短码不必查库
     */
    public static boolean isWellFormedCode(String code) {
        return StrUtil.isNotBlank(code)
                && code.length() >= CUSTOM_ALIAS_MIN_LENGTH
                && code.length() <= CUSTOM_ALIAS_MAX_LENGTH
                && ReUtil.isMatch(CODE_PATTERN, code);
    }

    /**
     * 获取用户真实 IP
     *
     * @param request 请求
     * @return 用户真实 IP
     */
    public static String getActualIp(HttpServletRequest request) {
        String ipAddress = request.getHeader("X-Forwarded-For");
        if (ipAddress == null || ipAddress.isEmpty() || UNKNOWN.equalsIgnoreCase(ipAddress)) {
            ipAddress = request.getHeader("Proxy-Client-IP");
        }
        if (ipAddress == null || ipAddress.isEmpty() || UNKNOWN.equalsIgnoreCase(ipAddress)) {
            ipAddress = request.getHeader("WL-Proxy-Client-IP");
        }
        if (ipAddress == null || ipAddress.isEmpty() || UNKNOWN.equalsIgnoreCase(ipAddress)) {
            ipAddress = request.getHeader("HTTP_CLIENT_IP");
        }
        if (ipAddress == null || ipAddress.isEmpty() || UNKNOWN.equalsIgnoreCase(ipAddress)) {
            ipAddress = request.getRemoteAddr();
        }
        // 多级代理时取第一个
        if (ipAddress != null && ipAddress.contains(",")) {
            ipAddress = StrUtil.trim(StrUtil.subBefore(ipAddress, ",", false));
        }
        return ipAddress;
    }

    /**
     * 从入站请求中提取跳转上下文
     */
    public static RedirectContextDTO buildRedirectContext(HttpServletRequest request) {
        String referer = request.getHeader(HttpHeaders.REFERER);
        if (StrUtil.isBlank(referer)) {
            referer = request.getHeader("Referrer");
        }
        return RedirectContextDTO.builder()
                .userAgent(request.getHeader(HttpHeaders.USER_AGENT))
                .referer(referer)
                .clientIp(getActualIp(request))
                .countryHint(request.getHeader(COUNTRY_HINT_HEADER))
                .acceptLanguage(request.getHeader(HttpHeaders.ACCEPT_LANGUAGE))
                .build();
    }

    /**
     * 构建点击事件，缺失字段按统计服务约定填充默认值
     */
    public static ClickEventDTO buildClickEvent(String code, RedirectContextDTO context, Date occurredAt) {
        RedirectContextDTO actual = context == null ? new RedirectContextDTO() : context;
        return ClickEventDTO.builder()
                .code(code)
                .occurredAt(occurredAt)
                .userAgent(StrUtil.blankToDefault(actual.getUserAgent(), UNKNOWN))
                .referer(StrUtil.blankToDefault(actual.getReferer(), DIRECT_REFERER))
                .clientIp(StrUtil.blankToDefault(actual.getClientIp(), UNKNOWN))
                .countryHint(StrUtil.emptyToNull(actual.getCountryHint()))
                .acceptLanguage(StrUtil.blankToDefault(actual.getAcceptLanguage(), UNKNOWN))
                .build();
    }
}
