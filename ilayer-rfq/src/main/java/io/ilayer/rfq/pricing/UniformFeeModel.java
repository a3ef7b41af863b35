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

import java.util.concurrent.ThreadLocalRandom;

/**
 * Fee drawn independently per call from a uniform distribution over {@code [minFee, maxFee]}.
 * <p>
 * Not cryptographic, not repeatable.
 */
public final class UniformFeeModel implements FeeModel
{
    private final double minFee;
    private final double maxFee;

    /**
     * @param minFee lower bound, inclusive.
     * @param maxFee upper bound, inclusive.
     */
    public UniformFeeModel(final double minFee, final double maxFee)
    {
        if (minFee < 0.0 || maxFee >= 1.0 || minFee > maxFee)
        {
            throw new IllegalArgumentException("invalid fee range: [" + minFee + ", " + maxFee + "]");
        }

        this.minFee = minFee;
        this.maxFee = maxFee;
    }

    @Override
    public double nextFee()
    {
        if (minFee == maxFee)
        {
            return minFee;
        }

        return ThreadLocalRandom.current().nextDouble(minFee, Math.nextUp(maxFee));
    }

    public double minFee()
    {
        return minFee;
    }

    public double maxFee()
    {
        return maxFee;
    }

    @Override
    public String toString()
    {
        return "UniformFeeModel{minFee=" + minFee + ", maxFee=" + maxFee + '}';
    }
}
