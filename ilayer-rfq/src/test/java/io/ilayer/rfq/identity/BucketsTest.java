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
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Buckets Unit Tests")
class BucketsTest
{
    /** Compressed secp256k1 generator point */
    static final String G = "0x0279be667ef9dcbbac55a06295ce870b07029bfcdb2dce28d959f2815b16f81798";

    /** Compressed 2G */
    static final String TWO_G = "0x02c6047f9441ed7d6d3045406e95c07cd85c778e4b8cef3ca7abac09b95c709ee5";

    @Nested
    @DisplayName("Derivation")
    class DerivationTests
    {
        @Test
        @DisplayName("should take the first 8 hex characters of the SHA-256 of the key string")
        void shouldMatchKnownDigestPrefix()
        {
            assertEquals("6a4b371c", Buckets.bucketOf(G));
            assertEquals("1adcf2d2", Buckets.bucketOf(TWO_G));
        }

        @Test
        @DisplayName("should be deterministic")
        void shouldBeDeterministic()
        {
            assertEquals(Buckets.bucketOf(G), Buckets.bucketOf(G));
        }

        @Test
        @DisplayName("should hash the string, so case changes the bucket")
        void shouldHashTheStringAsGiven()
        {
            assertNotEquals(Buckets.bucketOf(G), Buckets.bucketOf(G.toUpperCase()));
        }

        @Test
        @DisplayName("should always produce a valid bucket")
        void shouldProduceValidBucket()
        {
            for (int i = 0; i < 100; i++)
            {
                final String bucket = Buckets.bucketOf("key-" + i);

                assertEquals(Buckets.BUCKET_LENGTH, bucket.length());
                assertTrue(Buckets.isValid(bucket), bucket);
            }
        }

        @Test
        @DisplayName("should reject an empty key")
        void shouldRejectEmptyKey()
        {
            assertThrows(IllegalArgumentException.class, () -> Buckets.bucketOf(""));
            assertThrows(IllegalArgumentException.class, () -> Buckets.bucketOf(null));
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests
    {
        @Test
        @DisplayName("should accept 8 lower case hex characters")
        void shouldAcceptLowerHex()
        {
            assertTrue(Buckets.isValid("0123abcd"));
            assertTrue(Buckets.isValid("ffffffff"));
        }

        @Test
        @DisplayName("should reject wrong length, upper case and non hex")
        void shouldRejectMalformed()
        {
            assertFalse(Buckets.isValid(null));
            assertFalse(Buckets.isValid(""));
            assertFalse(Buckets.isValid("0123abc"));
            assertFalse(Buckets.isValid("0123abcde"));
            assertFalse(Buckets.isValid("0123ABCD"));
            assertFalse(Buckets.isValid("0123abcg"));
            assertFalse(Buckets.isValid("../rfq/x"));
        }
    }
}
