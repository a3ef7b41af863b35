/*
 * Copyright 2014-2025 Real Logic Limited.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.ilayer.rfq.pricing;

/**
 * Fee a solver deducts from each destination amount, as a fraction (0.01 = 1%).
 */
@FunctionalInterface
public interface FeeModel
{
    /**
     * No fee. Makes quotes exact and repeatable.
     */
    FeeModel NONE = () -> 0.0;

    /**
     * Draw the fee for one destination token.
     *
     * @return fee fraction in [0, 1).
     */
    double nextFee();
}
