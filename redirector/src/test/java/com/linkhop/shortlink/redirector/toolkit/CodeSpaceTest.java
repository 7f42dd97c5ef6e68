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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class CodeSpaceTest {

    private final CodeSpace codeSpace = new CodeSpace(new Random(7L), 6, 8);

    @Test
    @DisplayName("字符集去掉易混淆字符")
    void alphabetExcludesAmbiguousCharacters() {
        assertEquals(58, codeSpace.alphabetSize());
        for (int i = 0; i < 2000; i++) {
            String candidate = codeSpace.randomCandidate(8);
            assertFalse(candidate.contains("0") || candidate.contains("O")
                    || candidate.contains("l") || candidate.contains("I"), candidate);
        }
    }

    @Test
    @DisplayName("随机短码长度受限于 [default, max]")
    void randomCandidateRespectsLengthBounds() {
        assertEquals(6, codeSpace.randomCandidate(6).length());
        assertEquals(7, codeSpace.randomCandidate(7).length());
        assertEquals(8, codeSpace.randomCandidate(8).length());
        assertThrows(IllegalArgumentException.class, () -> codeSpace.randomCandidate(5));
        assertThrows(IllegalArgumentException.class, () -> codeSpace.randomCandidate(9));
    }

    @Test
    @DisplayName("固定种子生成序列可复现")
    void sameSeedProducesSameSequence() {
        CodeSpace first = new CodeSpace(new Random(42L), 6, 8);
        CodeSpace second = new CodeSpace(new Random(42L), 6, 8);
        for (int i = 0; i < 20; i++) {
            assertEquals(first.randomCandidate(6), second.randomCandidate(6));
        }
    }

    @Test
    void growthPolicyIsCappedAtMaxLength() {
        assertEquals(7, codeSpace.growthPolicy(6));
        assertEquals(8, codeSpace.growthPolicy(7));
        assertEquals(8, codeSpace.growthPolicy(8));
    }

    @Test
    void rejectsInvalidLengthConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new CodeSpace(new Random(), 0, 8));
        assertThrows(IllegalArgumentException.class, () -> new CodeSpace(new Random(), 8, 6));
    }

    @Test
    @DisplayName("自定义短码格式校验")
    void validatesCustomAliasFormat() {
        assertTrue(codeSpace.isValidCustomFormat("promo-2024"));
        assertTrue(codeSpace.isValidCustomFormat("abc"));
        assertTrue(codeSpace.isValidCustomFormat("a".repeat(20)));

        assertFalse(codeSpace.isValidCustomFormat(null));
        assertFalse(codeSpace.isValidCustomFormat("ab"));
        assertFalse(codeSpace.isValidCustomFormat("a".repeat(21)));
        assertFalse(codeSpace.isValidCustomFormat("has space"));
        assertFalse(codeSpace.isValidCustomFormat("under_score"));
        assertFalse(codeSpace.isValidCustomFormat("admin"));
        assertFalse(codeSpace.isValidCustomFormat("ADMIN"));
        assertFalse(codeSpace.isValidCustomFormat("Health"));
    }

    @Test
    void normalizesCustomAliasToLowerCase() {
        assertEquals("mylink", codeSpace.normalizeCustomAlias("MyLink"));
    }

    @Test
    @DisplayName("碰撞概率 = 已占用 / 组合总数")
    void collisionProbabilityModel() {
        assertEquals(BigInteger.valueOf(58), codeSpace.possibleCombinations(1));
        assertEquals(BigInteger.valueOf(3364), codeSpace.possibleCombinations(2));
        assertEquals(BigInteger.valueOf(58).pow(6), codeSpace.possibleCombinations(6));
        assertEquals(0D, codeSpace.collisionProbability(0, 6));
        assertEquals(0.5D, codeSpace.collisionProbability(1682, 2), 1e-12);
    }
}
