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

/**
 * Handle for a live listener registration. Closing it stops delivery; closing twice has no effect.
 */
public interface TopicSubscription extends AutoCloseable
{
    /**
     * Content topic this subscription listens on.
     *
     * @return the topic.
     */
    String topic();

    /**
     * Is the registration still delivering messages.
     *
     * @return true until closed.
     */
    boolean isActive();

    @Override
    void close();
}
