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
package io.ilayer.rfq.identity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Topics Unit Tests")
class TopicsTest
{
    @Test
    @DisplayName("should name the well-known request topic")
    void shouldNameRequestTopic()
    {
        assertEquals("/iLayer/1/rfq/proto", Topics.REQUEST_TOPIC);
    }

    @Test
    @DisplayName("should build the response topic from the bucket")
    void shouldBuildResponseTopic()
    {
        assertEquals("/iLayer/1/6a4b371c/proto", Topics.topicFor("6a4b371c"));
        assertEquals(Topics.topicFor("6a4b371c"), Topics.topicFor("6a4b371c"));
    }

    @Test
    @DisplayName("should give distinct buckets distinct topics")
    void shouldKeepBucketsApart()
    {
        assertNotEquals(Topics.topicFor("6a4b371c"), Topics.topicFor("1adcf2d2"));
        assertNotEquals(Topics.REQUEST_TOPIC, Topics.topicFor("6a4b371c"));
    }

    @Test
    @DisplayName("should refuse a value that is not a bucket")
    void shouldRejectInvalidBucket()
    {
        assertThrows(IllegalArgumentException.class, () -> Topics.topicFor("rfq"));
        assertThrows(IllegalArgumentException.class, () -> Topics.topicFor("6A4B371C"));
        assertThrows(IllegalArgumentException.class, () -> Topics.topicFor(null));
    }
}
