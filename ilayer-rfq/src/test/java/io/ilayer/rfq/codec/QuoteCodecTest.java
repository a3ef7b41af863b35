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

import org.agrona.ExpandableArrayBuffer;
import org.agrona.concurrent.UnsafeBuffer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link QuoteCodec}.
 * <p>
 * <b>Test Strategy:</b>
 * <ul>
 *   <li>Round trip: every field survives, including empty lists and fractional values</li>
 *   <li>Layout: header fields sit where the wire format says</li>
 *   <li>Malformed input: truncated, wrong header, absurd lengths all raise {@link CodecException}</li>
 * </ul>
 */
@DisplayName("QuoteCodec Unit Tests")
class QuoteCodecTest
{
    private static final String WETH = "0xc02aaa39b223fe8d0a0e5c4f27ead9083c756cc2";
    private static final String USDC = "0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48";
    private static final String USDT = "0xdac17f958d2ee523a2206206994597c13d831ec7";

    private ExpandableArrayBuffer buffer;

    @BeforeEach
    void setUp()
    {
        buffer = new ExpandableArrayBuffer(64);
    }

    static QuoteRequest sampleRequest()
    {
        return new QuoteRequest(
            "6a4b371c",
            new SwapSide<>("mainnet", List.of(new TokenWeight(WETH, 1))),
            new SwapSide<>("base", List.of(new TokenWeight(USDC, 30), new TokenWeight(USDT, 70))));
    }

    static QuoteResponse sampleResponse()
    {
        return new QuoteResponse(
            "0x0279be667ef9dcbbac55a06295ce870b07029bfcdb2dce28d959f2815b16f81798",
            new SwapSide<>("mainnet", List.of(new TokenAmount(WETH, 1))),
            new SwapSide<>("base", List.of(new TokenAmount(USDC, 945.123456789), new TokenAmount(USDT, 2205.5))));
    }

    @Nested
    @DisplayName("Round Trip Tests")
    class RoundTripTests
    {
        @Test
        @DisplayName("should preserve every request field")
        void shouldRoundTripRequest()
        {
            final QuoteRequest request = sampleRequest();

            final int length = QuoteCodec.encodeRequest(buffer, 0, request);

            assertEquals(request, QuoteCodec.decodeRequest(buffer, 0, length));
        }

        @Test
        @DisplayName("should preserve fractional amounts exactly")
        void shouldRoundTripFractionalResponse()
        {
            final QuoteResponse response = sampleResponse();

            final int length = QuoteCodec.encodeResponse(buffer, 0, response);
            final QuoteResponse decoded = QuoteCodec.decodeResponse(buffer, 0, length);

            assertEquals(response, decoded);
            assertEquals(945.123456789, decoded.to().tokens().get(0).amount());
        }

        @Test
        @DisplayName("should preserve empty token lists and zero amounts")
        void shouldRoundTripEmptyAndZero()
        {
            final QuoteResponse response = new QuoteResponse(
                "solver",
                new SwapSide<>("mainnet", List.of()),
                new SwapSide<>("base", List.of(new TokenAmount(USDC, 0))));

            final int length = QuoteCodec.encodeResponse(buffer, 0, response);
            final QuoteResponse decoded = QuoteCodec.decodeResponse(buffer, 0, length);

            assertTrue(decoded.from().tokens().isEmpty());
            assertEquals(0.0, decoded.to().tokens().get(0).amount());
            assertEquals(response, decoded);
        }

        @Test
        @DisplayName("should encode and decode at a non-zero offset")
        void shouldRoundTripAtOffset()
        {
            final QuoteRequest request = sampleRequest();

            final int length = QuoteCodec.encodeRequest(buffer, 32, request);

            assertEquals(request, QuoteCodec.decodeRequest(buffer, 32, length));
        }

        @Test
        @DisplayName("should carry multi-byte UTF-8 strings")
        void shouldRoundTripUtf8()
        {
            final QuoteRequest request = new QuoteRequest(
                "6a4b371c",
                new SwapSide<>("réseau-主网", List.of(new TokenWeight(WETH, 0.5))),
                new SwapSide<>("base", List.of()));

            final int length = QuoteCodec.encodeRequest(buffer, 0, request);

            assertEquals(request, QuoteCodec.decodeRequest(buffer, 0, length));
        }

        @Test
        @DisplayName("should ignore bytes after the message")
        void shouldIgnoreTrailingBytes()
        {
            final QuoteRequest request = sampleRequest();
            final int length = QuoteCodec.encodeRequest(buffer, 0, request);
            buffer.putLong(length, -1L);

            assertEquals(request, QuoteCodec.decodeRequest(buffer, 0, length + 8));
        }
    }

    @Nested
    @DisplayName("Layout Tests")
    class LayoutTests
    {
        @Test
        @DisplayName("should write magic, version and type little-endian")
        void shouldWriteHeader()
        {
            QuoteCodec.encodeResponse(buffer, 0, sampleResponse());

            assertEquals(0x51, buffer.getByte(0) & 0xFF);
            assertEquals(QuoteCodec.MAGIC, buffer.getInt(QuoteCodec.MAGIC_OFFSET, QuoteCodec.BYTE_ORDER));
            assertEquals(QuoteCodec.VERSION, buffer.getByte(QuoteCodec.VERSION_OFFSET));
            assertEquals(QuoteCodec.TYPE_RESPONSE, buffer.getByte(QuoteCodec.TYPE_OFFSET));
        }

        @Test
        @DisplayName("should write the bucket as the first body string")
        void shouldWriteBucketFirst()
        {
            QuoteCodec.encodeRequest(buffer, 0, sampleRequest());

            assertEquals(8, buffer.getInt(QuoteCodec.BODY_OFFSET, QuoteCodec.BYTE_ORDER));
            assertEquals("6a4b371c", buffer.getStringWithoutLengthUtf8(QuoteCodec.BODY_OFFSET + 4, 8));
        }
    }

    @Nested
    @DisplayName("Malformed Input Tests")
    class MalformedInputTests
    {
        @Test
        @DisplayName("should reject every truncation of a valid message")
        void shouldRejectTruncation()
        {
            final int length = QuoteCodec.encodeRequest(buffer, 0, sampleRequest());

            for (int truncated = 0; truncated < length; truncated++)
            {
                final int size = truncated;
                assertThrows(CodecException.class, () -> QuoteCodec.decodeRequest(buffer, 0, size), "length " + size);
            }
        }

        @Test
        @DisplayName("should reject a request read as a response")
        void shouldRejectWrongType()
        {
            final int length = QuoteCodec.encodeRequest(buffer, 0, sampleRequest());

            assertThrows(CodecException.class, () -> QuoteCodec.decodeResponse(buffer, 0, length));
        }

        @Test
        @DisplayName("should reject bad magic")
        void shouldRejectBadMagic()
        {
            final int length = QuoteCodec.encodeRequest(buffer, 0, sampleRequest());
            buffer.putInt(QuoteCodec.MAGIC_OFFSET, 0xCAFEBABE);

            assertThrows(CodecException.class, () -> QuoteCodec.decodeRequest(buffer, 0, length));
        }

        @Test
        @DisplayName("should reject an unknown version")
        void shouldRejectUnknownVersion()
        {
            final int length = QuoteCodec.encodeRequest(buffer, 0, sampleRequest());
            buffer.putByte(QuoteCodec.VERSION_OFFSET, (byte)9);

            assertThrows(CodecException.class, () -> QuoteCodec.decodeRequest(buffer, 0, length));
        }

        @Test
        @DisplayName("should reject negative and oversized string lengths")
        void shouldRejectBadStringLength()
        {
            final int length = QuoteCodec.encodeRequest(buffer, 0, sampleRequest());

            buffer.putInt(QuoteCodec.BODY_OFFSET, -1, QuoteCodec.BYTE_ORDER);
            assertThrows(CodecException.class, () -> QuoteCodec.decodeRequest(buffer, 0, length));

            buffer.putInt(QuoteCodec.BODY_OFFSET, QuoteCodec.MAX_STRING_LENGTH + 1, QuoteCodec.BYTE_ORDER);
            assertThrows(CodecException.class, () -> QuoteCodec.decodeRequest(buffer, 0, length));
        }

        @Test
        @DisplayName("should reject a string that is not valid UTF-8")
        void shouldRejectInvalidUtf8()
        {
            final int length = QuoteCodec.encodeRequest(buffer, 0, sampleRequest());
            final int fromNetworkOffset = QuoteCodec.BODY_OFFSET + 4 + 8 + 4;

            buffer.putByte(fromNetworkOffset, (byte)0xFF);

            final CodecException ex = assertThrows(
                CodecException.class, () -> QuoteCodec.decodeRequest(buffer, 0, length));
            assertTrue(ex.getMessage().contains("UTF-8"));
        }

        @Test
        @DisplayName("should reject a token count beyond the limit")
        void shouldRejectBadTokenCount()
        {
            final int length = QuoteCodec.encodeRequest(buffer, 0, sampleRequest());
            final int fromCountOffset = QuoteCodec.BODY_OFFSET + 4 + 8 + 4 + "mainnet".length();

            buffer.putInt(fromCountOffset, QuoteCodec.MAX_TOKENS + 1, QuoteCodec.BYTE_ORDER);
            assertThrows(CodecException.class, () -> QuoteCodec.decodeRequest(buffer, 0, length));

            buffer.putInt(fromCountOffset, -3, QuoteCodec.BYTE_ORDER);
            assertThrows(CodecException.class, () -> QuoteCodec.decodeRequest(buffer, 0, length));
        }

        @Test
        @DisplayName("should reject random bytes")
        void shouldRejectGarbage()
        {
            final UnsafeBuffer garbage = new UnsafeBuffer(new byte[]{ 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12 });

            assertThrows(CodecException.class, () -> QuoteCodec.decodeRequest(garbage, 0, 12));
        }

        @Test
        @DisplayName("should reject a length beyond the buffer")
        void shouldRejectOutOfBounds()
        {
            final UnsafeBuffer small = new UnsafeBuffer(new byte[16]);

            assertThrows(CodecException.class, () -> QuoteCodec.decodeRequest(small, 8, 16));
        }
    }

    @Nested
    @DisplayName("Encoding Limit Tests")
    class EncodingLimitTests
    {
        @Test
        @DisplayName("should refuse to encode more tokens than a decoder accepts")
        void shouldRefuseTooManyTokens()
        {
            final List<TokenWeight> tokens = new ArrayList<>();
            for (int i = 0; i <= QuoteCodec.MAX_TOKENS; i++)
            {
                tokens.add(new TokenWeight("0x" + i, 1));
            }

            final QuoteRequest request = new QuoteRequest(
                "6a4b371c", new SwapSide<>("mainnet", tokens), new SwapSide<>("base", List.of()));

            assertThrows(IllegalArgumentException.class, () -> QuoteCodec.encodeRequest(buffer, 0, request));
        }
    }
}
