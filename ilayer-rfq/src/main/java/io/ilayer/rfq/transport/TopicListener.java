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
package io.ilayer.rfq.transport;

import org.agrona.DirectBuffer;

/**
 * Callback for messages received on a content topic.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>Called on the substrate's poller thread</li>
 *   <li>Buffer contents are only valid during this call</li>
 *   <li>An exception thrown here is reported and does not stop delivery to other listeners</li>
 * </ul>
 */
@FunctionalInterface
public interface TopicListener
{
    /**
     * Called once per message published on the topic.
     *
     * @param topic  content topic the message was published on.
     * @param buffer buffer holding the payload.
     * @param offset offset of the payload in the buffer.
     * @param length payload length in bytes.
     */
    void onMessage(String topic, DirectBuffer buffer, int offset, int length);
}
