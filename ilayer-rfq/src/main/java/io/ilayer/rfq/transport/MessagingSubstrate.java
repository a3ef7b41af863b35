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
 * Topic based publish/subscribe used by requesters and solvers.
 * <p>
 * Delivery is best effort: a message published while nobody listens on its topic is lost, and a
 * successful {@link #publish(String, DirectBuffer, int, int)} says nothing about whether anyone
 * received it.
 */
public interface MessagingSubstrate extends AutoCloseable
{
    /**
     * Publish one message on a content topic.
     *
     * @param topic  content topic.
     * @param buffer buffer holding the payload.
     * @param offset offset of the payload.
     * @param length payload length in bytes.
     * @throws TransportException if the message could not be handed over.
     */
    void publish(String topic, DirectBuffer buffer, int offset, int length);

    /**
     * Register a listener for a content topic.
     *
     * @param topic    content topic.
     * @param listener callback for each message.
     * @return handle to stop delivery.
     * @throws SubscribeException if the registration failed, e.g. the substrate is closed.
     */
    TopicSubscription subscribe(String topic, TopicListener listener);

    /**
     * Block until at least one subscriber is reachable on the substrate.
     *
     * @param timeoutMs how long to wait.
     * @throws TransportException if no peer became reachable in time.
     */
    void waitForPeers(long timeoutMs);

    @Override
    void close();
}
