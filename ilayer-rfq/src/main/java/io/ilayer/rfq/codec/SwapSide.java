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

import java.util.List;
import java.util.Objects;

/**
 * One side of a swap: a network and the tokens involved on it.
 *
 * @param <T> {@link TokenWeight} in requests, {@link TokenAmount} in responses.
 */
public final class SwapSide<T>
{
    private final String network;
    private final List<T> tokens;

    /**
     * Create a side. The token list is copied.
     *
     * @param network network identifier, e.g. {@code mainnet}.
     * @param tokens  tokens on this side, possibly empty.
     */
    public SwapSide(final String network, final List<T> tokens)
    {
        this.network = Objects.requireNonNull(network, "network");
        this.tokens = List.copyOf(tokens);
    }

    public String network()
    {
        return network;
    }

    /**
     * Tokens on this side.
     *
     * @return unmodifiable list.
     */
    public List<T> tokens()
    {
        return tokens;
    }

    @Override
    public boolean equals(final Object o)
    {
        if (this == o)
        {
            return true;
        }

        if (!(o instanceof SwapSide))
        {
            return false;
        }

        final SwapSide<?> that = (SwapSide<?>)o;
        return network.equals(that.network) && tokens.equals(that.tokens);
    }

    @Override
    public int hashCode()
    {
        return 31 * network.hashCode() + tokens.hashCode();
    }

    @Override
    public String toString()
    {
        return "{network=" + network + ", tokens=" + tokens + '}';
    }
}
