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
package io.ilayer.rfq.codec;

import java.util.Objects;

/**
 * Priced answer to a {@link QuoteRequest}.
 * <p>
 * {@link #from()} echoes the request's source weights as amounts. {@link #to()} carries the priced,
 * fee adjusted destination amounts.
 */
public final class QuoteResponse
{
    private final String solver;
    private final SwapSide<TokenAmount> from;
    private final SwapSide<TokenAmount> to;

    /**
     * Create a response.
     *
     * @param solver public key of the responding solver.
     * @param from   echoed source side.
     * @param to     priced destination side.
     */
    public QuoteResponse(final String solver, final SwapSide<TokenAmount> from, final SwapSide<TokenAmount> to)
    {
        this.solver = Objects.requireNonNull(solver, "solver");
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
    }

    public String solver()
    {
        return solver;
    }

    public SwapSide<TokenAmount> from()
    {
        return from;
    }

    public SwapSide<TokenAmount> to()
    {
        return to;
    }

    @Override
    public boolean equals(final Object o)
    {
        if (this == o)
        {
            return true;
        }

        if (!(o instanceof QuoteResponse))
        {
            return false;
        }

        final QuoteResponse that = (QuoteResponse)o;
        return solver.equals(that.solver) && from.equals(that.from) && to.equals(that.to);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(solver, from, to);
    }

    @Override
    public String toString()
    {
        return "QuoteResponse{solver=" + solver + ", from=" + from + ", to=" + to + '}';
    }
}
