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

import java.util.List;
import java.util.Optional;

/**
 * 短链接持久层
 * <p>
 * 短码唯一性的最终裁决方：{@link #insert(ShortLinkDO)} 必须在短码与自定义短码的联合命名空间上做唯一约束，
 * 上层的存在性预检查只是减少冲突回滚的优化。
 */
public interface ShortLinkRepository {

    /**
     * 按短码或自定义短码查询，不过滤启用状态和有效期
     */
    Optional<ShortLinkDO> findByCodeOrAlias(String code);

    /**
     * 按原始链接查询一条启用中的短链接，不判断有效期
     */
    Optional<ShortLinkDO> findActiveByTargetUrl(String targetUrl);

    /**
     * 短码或自定义短码是否已被占用
     */
    boolean existsByCodeOrAlias(String code);

    /**
     * 新增短链接
     *
     * @throws ShortLinkDuplicateKeyException 短码已被占用
     */
    void insert(ShortLinkDO shortLinkDO);

    /**
     * 点击数 +1，调用方不关心结果
     */
    void incrementClickCount(String code);

    /**
     * 软删除
     *
     * @return 短链接不存在时返回 false
     */
    boolean softDeactivate(String code);

    /**
     * 所有仍处于启用状态的短链接，供过期清理任务使用
     */
    List<ShortLinkDO> findAllActive();

    /**
     * 分页查询启用中的短链接
     *
     * @param requestParam 页码从 1 开始，排序字段与方向已由调用方规整
     */
    List<ShortLinkDO> pageActive(ShortLinkPageReqDTO requestParam);

    long count();

    long countActive();

    long countCustomAlias();
}
