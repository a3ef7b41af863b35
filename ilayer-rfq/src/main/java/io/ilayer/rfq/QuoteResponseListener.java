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
package io.ilayer.rfq;

import io.ilayer.rfq.codec.QuoteResponse;

/**
 * Receives every response that arrives on a requester's response topic, including ones that
 * arrive after the outstanding request was already answered.
 */
@FunctionalInterface
public interface QuoteResponseListener
{
    /**
     * Listener that prints each response to standard out.
     */
    QuoteResponseListener PRINTING = (response) -> System.out.println("[Requester] Quote received: " + response);

    /**
     * Called on the substrate's poller thread.
     *
     * @param response the decoded response.
     */
    void onResponse(QuoteResponse response);
}
