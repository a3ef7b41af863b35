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

import io.ilayer.rfq.identity.SessionIdentity;
import io.ilayer.rfq.identity.Topics;
import io.ilayer.rfq.transport.MessagingSubstrate;

import java.util.Objects;

/**
 * Everything a requester or solver needs to know about the process it runs in: who it is, where
 * requests go and where its responses arrive. Built once at startup and never changed.
 */
public final class RfqSession
{
    private final SessionIdentity identity;
    private final String bucket;
    private final String requestTopic;
    private final String responseTopic;
    private final MessagingSubstrate substrate;

    private RfqSession(final SessionIdentity identity, final MessagingSubstrate substrate)
    {
        this.identity = identity;
        this.bucket = identity.bucket();
        this.requestTopic = Topics.REQUEST_TOPIC;
        this.responseTopic = Topics.topicFor(bucket);
        this.substrate = substrate;
    }

    /**
     * Create a session for an identity.
     *
     * @param identity  the process identity.
     * @param substrate substrate used for all traffic.
     * @return the session.
     */
    public static RfqSession create(final SessionIdentity identity, final MessagingSubstrate substrate)
    {
        return new RfqSession(Objects.requireNonNull(identity, "identity"), Objects.requireNonNull(substrate, "substrate"));
    }

    public SessionIdentity identity()
    {
        return identity;
    }

    public String publicKey()
    {
        return identity.publicKey();
    }

    public String bucket()
    {
        return bucket;
    }

    public String requestTopic()
    {
        return requestTopic;
    }

    /**
     * Topic this session's responses are published on.
     *
     * @return {@link Topics#topicFor(String)} of the bucket.
     */
    public String responseTopic()
    {
        return responseTopic;
    }

    public MessagingSubstrate substrate()
    {
        return substrate;
    }

    @Override
    public String toString()
    {
        return "RfqSession{bucket=" + bucket + ", requestTopic=" + requestTopic + ", responseTopic=" + responseTopic + '}';
    }
}
