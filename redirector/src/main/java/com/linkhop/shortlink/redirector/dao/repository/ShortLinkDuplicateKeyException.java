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

package com.linkhop.shortlink.redirector.dao.repository;

import lombok.Getter;
import org.springframework.dao.DuplicateKeyException;

/**
 * 短链接唯一约束冲突，field 为冲突的字段
 */
@Getter
public class ShortLinkDuplicateKeyException extends DuplicateKeyException {

    public static final String FIELD_CODE = "code";

    public static final String FIELD_CUSTOM_ALIAS = "customAlias";

    private final String field;

    private final String value;

    public ShortLinkDuplicateKeyException(String field, String value) {
        super(String.format("短链接唯一约束冲突，字段：%s，值：%s", field, value));
        this.field = field;
        this.value = value;
    }
}
