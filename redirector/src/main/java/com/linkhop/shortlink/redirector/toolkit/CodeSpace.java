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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Random;
import java.util.regex.Pattern;

import static com.linkhop.shortlink.redirector.common.constant.ShortLinkConstant.CODE_ALPHABET;
import static com.linkhop.shortlink.redirector.common.constant.ShortLinkConstant.CUSTOM_ALIAS_MAX_LENGTH;
import static com.linkhop.shortlink.redirector.common.constant.ShortLinkConstant.CUSTOM_ALIAS_MIN_LENGTH;
import static com.linkhop.shortlink.redirector.common.constant.ShortLinkConstant.RESERVED_ALIASES;

/**
 * 短码空间
 * <p>
 * 字符集、长度增长策略、自定义短码格式校验以及碰撞概率估算。除随机源外不持有任何状态，
 * 随机源由外部注入，固定种子即可复现生成序列。
 */
public class CodeSpace {

    private static final Pattern CUSTOM_ALIAS_PATTERN = Pattern.compile("^[a-zA-Z0-9-]+$");

    private final Random random;

    private final int defaultLength;

    private final int maxLength;

    public CodeSpace(Random random, int defaultLength, int maxLength) {
        if (defaultLength <= 0 || maxLength < defaultLength) {
            throw new IllegalArgumentException(
                    StrUtil.format("短码长度配置非法，defaultLength：{}，maxLength：{}", defaultLength, maxLength));
        }
        this.random = random;
        this.defaultLength = defaultLength;
        this.maxLength = maxLength;
    }

    public int defaultLength() {
        return defaultLength;
    }

    public int maxLength() {
        return maxLength;
    }

    public int alphabetSize() {
        return CODE_ALPHABET.length();
    }

    /**
     * 生成指定长度的随机候选短码
     *
     * @param length 短码长度，必须落在 [defaultLength, maxLength] 区间
     * @return 随机短码
     */
    public String randomCandidate(int length) {
        if (length < defaultLength || length > maxLength) {
            throw new IllegalArgumentException(
                    StrUtil.format("短码长度 {} 超出范围 [{}, {}]", length, defaultLength, maxLength));
        }
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(CODE_ALPHABET.charAt(random.nextInt(CODE_ALPHABET.length())));
        }
        return sb.toString();
    }

    /**
     * 长度增长策略：每次 +1，封顶 maxLength
     */
    public int growthPolicy(int currentLength) {
        return Math.min(currentLength + 1, maxLength);
    }

    /**
     * 校验自定义短码：3-20 位，只允许字母、数字和中划线，且不能是保留字
     */
    public boolean isValidCustomFormat(String alias) {
        if (StrUtil.isBlank(alias)) {
            return false;
        }
        if (alias.length() < CUSTOM_ALIAS_MIN_LENGTH || alias.length() > CUSTOM_ALIAS_MAX_LENGTH) {
            return false;
        }
        if (!ReUtil.isMatch(CUSTOM_ALIAS_PATTERN, alias)) {
            return false;
        }
        return !RESERVED_ALIASES.contains(normalizeCustomAlias(alias));
    }

    /**
     * 自定义短码统一转小写入库
     */
    public String normalizeCustomAlias(String alias) {
        return alias.toLowerCase();
    }

    /**
     * 指定长度下的短码总数 |alphabet|^length
     */
    public BigInteger possibleCombinations(int length) {
        return BigInteger.valueOf(alphabetSize()).pow(length);
    }

    /**
     * 已占用 occupied 个短码时，随机生成一个指定长度短码发生碰撞的概率
     */
    public double collisionProbability(long occupied, int length) {
        if (occupied <= 0) {
            return 0D;
        }
        return new BigDecimal(occupied)
                .divide(new BigDecimal(possibleCombinations(length)), 20, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
