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

import cn.hutool.core.util.StrUtil;
import com.linkhop.shortlink.redirector.common.convention.exception.AbstractException;
import com.linkhop.shortlink.redirector.common.convention.exception.ClientException;
import com.linkhop.shortlink.redirector.common.convention.exception.ServiceException;
import com.linkhop.shortlink.redirector.config.ShortCodeProperties;
import com.linkhop.shortlink.redirector.dao.repository.ShortLinkRepository;
import com.linkhop.shortlink.redirector.dto.biz.AllocatedCodeDTO;
import com.linkhop.shortlink.redirector.dto.biz.AllocationAttempt;
import com.linkhop.shortlink.redirector.toolkit.CodeSpace;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

import static com.linkhop.shortlink.redirector.common.convention.errorcode.BaseErrorCode.ALIAS_INVALID;
import static com.linkhop.shortlink.redirector.common.convention.errorcode.BaseErrorCode.ALIAS_TAKEN;
import static com.linkhop.shortlink.redirector.common.convention.errorcode.BaseErrorCode.ALLOCATION_EXHAUSTED;
import static com.linkhop.shortlink.redirector.common.convention.errorcode.BaseErrorCode.SERVICE_ERROR;

/**
 * 短码分配器
 * <p>
 * 自定义短码：格式校验 -> 转小写 -> 查重，占用直接失败，不重试。
 * 随机短码：按 (长度, 尝试次数) 显式有界循环，每个长度最多 maxRetries 次，全部碰撞则增长长度，
 * 到达最大长度仍失败则抛出 {@link ServiceException}。
 * <p>
 * 这里的查重不是原子的，并发下两个请求可能拿到同一个候选短码，最终由持久层唯一约束兜底。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ShortCodeAllocator {

    private final CodeSpace codeSpace;
    private final ShortLinkRepository shortLinkRepository;
    private final ShortCodeProperties shortCodeProperties;

    private final AtomicLong collisionCount = new AtomicLong();

    /**
     * 分配短码
     *
     * @param customAlias 自定义短码，为空时随机生成
     * @return 分配结果
     */
    public AllocatedCodeDTO allocate(String customAlias) {
        if (customAlias != null) {
            return allocateCustomAlias(customAlias);
        }
        return AllocatedCodeDTO.builder()
                .code(allocateRandomCode())
                .custom(false)
                .build();
    }

    /**
     * 累计碰撞次数
     */
    public long getCollisionCount() {
        return collisionCount.get();
    }

    private AllocatedCodeDTO allocateCustomAlias(String customAlias) {
        if (!codeSpace.isValidCustomFormat(customAlias)) {
            throw new ClientException(
                    StrUtil.format("自定义短码 {} 需为 3-20 位字母、数字或中划线，且不能使用保留字", customAlias), ALIAS_INVALID);
        }
        String alias = codeSpace.normalizeCustomAlias(customAlias);
        if (exists(alias)) {
            throw new ClientException(StrUtil.format("自定义短码 {} 已被占用", alias), ALIAS_TAKEN);
        }
        return AllocatedCodeDTO.builder()
                .code(alias)
                .custom(true)
                .build();
    }

    private String allocateRandomCode() {
        int maxRetries = shortCodeProperties.getMaxRetries();
        int length = codeSpace.defaultLength();
        while (true) {
            for (int attemptNumber = 1; attemptNumber <= maxRetries; attemptNumber++) {
                AllocationAttempt attempt = new AllocationAttempt(codeSpace.randomCandidate(length), attemptNumber, length);
                if (!exists(attempt.getCandidate())) {
                    return attempt.getCandidate();
                }
                collisionCount.incrementAndGet();
                log.debug("短码碰撞，候选：{}，长度：{}，第 {} 次尝试", attempt.getCandidate(), attempt.getLength(), attempt.getAttemptNumber());
            }
            if (length >= codeSpace.maxLength()) {
                break;
            }
            int nextLength = codeSpace.growthPolicy(length);
            log.info("长度 {} 下连续 {} 次碰撞，短码长度增长到 {}", length, maxRetries, nextLength);
            length = nextLength;
        }
        log.warn("短码分配失败，长度 {} 到 {} 均已尝试 {} 次", codeSpace.defaultLength(), codeSpace.maxLength(), maxRetries);
        throw new ServiceException(ALLOCATION_EXHAUSTED);
    }

    private boolean exists(String code) {
        try {
            return shortLinkRepository.existsByCodeOrAlias(code);
        } catch (AbstractException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new ServiceException(StrUtil.format("短码 {} 查重失败", code), ex, SERVICE_ERROR);
        }
    }
}
