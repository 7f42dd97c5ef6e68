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

import com.linkhop.shortlink.redirector.dao.entity.ShortLinkDO;
import com.linkhop.shortlink.redirector.dto.req.ShortLinkPageReqDTO;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static com.linkhop.shortlink.redirector.dao.repository.ShortLinkDuplicateKeyException.FIELD_CODE;
import static com.linkhop.shortlink.redirector.dao.repository.ShortLinkDuplicateKeyException.FIELD_CUSTOM_ALIAS;

/**
 * 基于内存的短链接持久层
 * <p>
 * 以短码为键的单表，自定义短码与随机短码天然落在同一个命名空间；putIfAbsent 充当唯一索引。
 * 出入参均做拷贝，调用方拿到的实体修改后不会影响存储。
 */
@Repository
public class InMemoryShortLinkRepository implements ShortLinkRepository {

    private final Map<String, ShortLinkDO> storage = new ConcurrentHashMap<>();

    @Override
    public Optional<ShortLinkDO> findByCodeOrAlias(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(storage.get(code)).map(this::copy);
    }

    @Override
    public Optional<ShortLinkDO> findActiveByTargetUrl(String targetUrl) {
        if (targetUrl == null) {
            return Optional.empty();
        }
        return storage.values().stream()
                .filter(each -> Boolean.TRUE.equals(each.getActive()) && targetUrl.equals(each.getTargetUrl()))
                .min(Comparator.comparing(ShortLinkDO::getCreatedAt, Comparator.nullsLast(Comparator.<Date>naturalOrder())))
                .map(this::copy);
    }

    @Override
    public boolean existsByCodeOrAlias(String code) {
        return code != null && storage.containsKey(code);
    }

    @Override
    public void insert(ShortLinkDO shortLinkDO) {
        ShortLinkDO hasShortLinkDO = storage.putIfAbsent(shortLinkDO.getCode(), copy(shortLinkDO));
        if (hasShortLinkDO != null) {
            String field = Boolean.TRUE.equals(hasShortLinkDO.getCustomAlias()) ? FIELD_CUSTOM_ALIAS : FIELD_CODE;
            throw new ShortLinkDuplicateKeyException(field, shortLinkDO.getCode());
        }
    }

    @Override
    public void incrementClickCount(String code) {
        storage.computeIfPresent(code, (key, each) -> each.toBuilder()
                .clickCount(each.getClickCount() == null ? 1L : each.getClickCount() + 1)
                .build());
    }

    @Override
    public boolean softDeactivate(String code) {
        if (code == null) {
            return false;
        }
        return storage.computeIfPresent(code, (key, each) -> each.toBuilder().active(Boolean.FALSE).build()) != null;
    }

    @Override
    public List<ShortLinkDO> findAllActive() {
        return storage.values().stream()
                .filter(each -> Boolean.TRUE.equals(each.getActive()))
                .map(this::copy)
                .toList();
    }

    @Override
    public List<ShortLinkDO> pageActive(ShortLinkPageReqDTO requestParam) {
        Comparator<ShortLinkDO> comparator = sortComparator(requestParam.getSortBy());
        if ("desc".equals(requestParam.getOrder())) {
            comparator = comparator.reversed();
        }
        long offset = (long) (requestParam.getPage() - 1) * requestParam.getLimit();
        return storage.values().stream()
                .filter(each -> Boolean.TRUE.equals(each.getActive()))
                .sorted(comparator.thenComparing(ShortLinkDO::getCode))
                .skip(offset)
                .limit(requestParam.getLimit())
                .map(this::copy)
                .toList();
    }

    @Override
    public long count() {
        return storage.size();
    }

    @Override
    public long countActive() {
        return storage.values().stream()
                .filter(each -> Boolean.TRUE.equals(each.getActive()))
                .count();
    }

    @Override
    public long countCustomAlias() {
        return storage.values().stream()
                .filter(each -> Boolean.TRUE.equals(each.getCustomAlias()))
                .count();
    }

    private Comparator<ShortLinkDO> sortComparator(String sortBy) {
        if ("clickCount".equals(sortBy)) {
            return Comparator.comparing(ShortLinkDO::getClickCount, Comparator.nullsFirst(Comparator.<Long>naturalOrder()));
        }
        if ("expiresAt".equals(sortBy)) {
            return Comparator.comparing(ShortLinkDO::getExpiresAt, Comparator.nullsFirst(Comparator.<Date>naturalOrder()));
        }
        return Comparator.comparing(ShortLinkDO::getCreatedAt, Comparator.nullsFirst(Comparator.<Date>naturalOrder()));
    }

    private ShortLinkDO copy(ShortLinkDO shortLinkDO) {
        return shortLinkDO.toBuilder().build();
    }
}
