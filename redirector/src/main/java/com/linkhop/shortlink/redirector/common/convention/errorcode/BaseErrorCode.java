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

package com.linkhop.shortlink.redirector.common.convention.errorcode;

/**
 * 基础错误码定义
 * <p>
 * A 开头为客户端错误，B 开头为系统执行错误，C 开头为调用第三方服务错误
 */
public enum BaseErrorCode implements IErrorCode {

    // ========== 一级宏观错误码 客户端错误 ==========
    CLIENT_ERROR("A000001", "用户端错误"),

    // ========== 二级宏观错误码 短链接创建参数错误 ==========
    ALIAS_INVALID("A000100", "自定义短码格式错误"),
    ALIAS_TAKEN("A000101", "自定义短码已被占用"),
    TARGET_URL_INVALID("A000102", "跳转链接格式错误"),
    EXPIRES_IN_DAYS_INVALID("A000103", "有效天数需在 1 到 365 之间"),

    // ========== 二级宏观错误码 短链接跳转错误 ==========
    LINK_NOT_FOUND("A000200", "短链接不存在"),
    LINK_EXPIRED("A000201", "短链接已过期或已失效"),

    // ========== 二级宏观错误码 点击事件参数错误 ==========
    CLICK_EVENT_INVALID("A000300", "点击事件缺少短码"),
    CLICK_BATCH_SIZE_INVALID("A000301", "批量点击事件数量需在 1 到上限之间"),

    // ========== 一级宏观错误码 系统执行出错 ==========
    SERVICE_ERROR("B000001", "系统执行出错"),
    ALLOCATION_EXHAUSTED("B000100", "短链接频繁生成，请稍后再试"),

    // ========== 一级宏观错误码 调用第三方服务出错 ==========
    REMOTE_ERROR("C000001", "调用第三方服务出错"),
    ANALYTICS_UNAVAILABLE("C000100", "统计服务不可用");

    private final String code;

    private final String message;

    BaseErrorCode(String code, String message) {
        this.code = code;
        this.message = message;
    }

    @Override
    public String code() {
        return code;
    }

    @Override
    public String message() {
        return message;
    }
}
