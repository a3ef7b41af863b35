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

import java.util.List;

/**
 * Source of spot prices.
 */
@FunctionalInterface
public interface PriceFeed
{
    /**
     * Look up prices for a batch of addresses.
     * <p>
     * <b>Contract:</b> partial results are valid. An address that cannot be priced, including one
     * whose lookup failed on the network, is absent from the result. Implementations must not throw
     * for individual address failures.
     *
     * @param addresses token addresses, duplicates allowed.
     * @return prices found, in no particular order.
     */
    List<Price> lookup(List<String> addresses);
}
