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

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.util.encoders.Hex;

import java.nio.charset.StandardCharsets;

/**
 * Derivation of the bucket, the short correlation key a requester publishes with its request and
 * later listens on for the response.
 * <p>
 * A bucket is the first {@link #BUCKET_LENGTH} hex characters of the SHA-256 digest of the UTF-8
 * bytes of the public key string. Truncating to 32 bits keeps topic names short; a collision between
 * two concurrent requesters routes both responses to both of them.
 */
public final class Buckets
{
    /**
     * Number of hex characters in a bucket.
     */
    public static final int BUCKET_LENGTH = 8;

    private Buckets()
    {
    }

    /**
     * Compute the bucket for a public key.
     *
     * @param publicKey public key string, e.g. {@code 0x02...} compressed hex.
     * @return 8 lower case hex characters.
     */
    public static String bucketOf(final String publicKey)
    {
        if (null == publicKey || publicKey.isEmpty())
        {
            throw new IllegalArgumentException("publicKey must not be empty");
        }

        final byte[] input = publicKey.getBytes(StandardCharsets.UTF_8);
        final SHA256Digest digest = new SHA256Digest();
        final byte[] hash = new byte[digest.getDigestSize()];
        digest.update(input, 0, input.length);
        digest.doFinal(hash, 0);

        return Hex.toHexString(hash, 0, BUCKET_LENGTH / 2);
    }

    /**
     * Check that a value has the shape of a bucket. Values from the wire must pass this before they
     * are used to build a topic name.
     *
     * @param bucket candidate value.
     * @return true if exactly {@link #BUCKET_LENGTH} lower case hex characters.
     */
    public static boolean isValid(final String bucket)
    {
        if (null == bucket || bucket.length() != BUCKET_LENGTH)
        {
            return false;
        }

        for (int i = 0; i < BUCKET_LENGTH; i++)
        {
            final char c = bucket.charAt(i);
            if (!((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f')))
            {
                return false;
            }
        }

        return true;
    }
}
