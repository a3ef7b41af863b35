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

import org.agrona.DirectBuffer;
import org.agrona.MutableDirectBuffer;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Binary codec for {@link QuoteRequest} and {@link QuoteResponse}.
 * <p>
 * Stateless, so safe to call from any thread. Encoding writes into a caller supplied buffer, an
 * {@link org.agrona.ExpandableArrayBuffer} when the size is not known up front.
 * <p>
 * <b>Wire format:</b>
 * <pre>
 * Offset  Size  Field
 * ------  ----  -----
 * 0       4     magic (0x49524651 = "IRFQ")
 * 4       1     version (1)
 * 5       1     message type (1 = request, 2 = response)
 * 6       2     reserved
 * 8       N     body
 *
 * request body:  string bucket, side from, side to
 * response body: string solver, side from, side to
 * side:          string network, int32 count, count x (string address, float64 value)
 * string:        int32 length, UTF-8 bytes
 * </pre>
 * All multi-byte fields are little-endian. Token values travel as float64 so fractional amounts
 * survive the trip.
 */
public final class QuoteCodec
{
    /** Magic bytes identifying a quote message: "IRFQ" */
    public static final int MAGIC = 0x4952_4651;

    /** Current wire version */
    public static final byte VERSION = 1;

    /** Message type of a {@link QuoteRequest} */
    public static final byte TYPE_REQUEST = 1;

    /** Message type of a {@link QuoteResponse} */
    public static final byte TYPE_RESPONSE = 2;

    public static final int MAGIC_OFFSET = 0;
    public static final int VERSION_OFFSET = 4;
    public static final int TYPE_OFFSET = 5;
    public static final int BODY_OFFSET = 8;

    /** Upper bound on any encoded string, in bytes */
    public static final int MAX_STRING_LENGTH = 1024;

    /** Upper bound on the tokens of one side */
    public static final int MAX_TOKENS = 256;

    static final ByteOrder BYTE_ORDER = ByteOrder.LITTLE_ENDIAN;

    private QuoteCodec()
    {
    }

    /**
     * Encode a request.
     *
     * @param buffer  buffer to write into, must have room or be expandable.
     * @param offset  offset within the buffer.
     * @param request request to encode.
     * @return encoded length in bytes.
     */
    public static int encodeRequest(final MutableDirectBuffer buffer, final int offset, final QuoteRequest request)
    {
        int position = encodeHeader(buffer, offset, TYPE_REQUEST);
        position += putString(buffer, position, request.bucket());
        position = encodeWeights(buffer, position, request.from());
        position = encodeWeights(buffer, position, request.to());

        return position - offset;
    }

    /**
     * Decode a request.
     *
     * @param buffer buffer holding the message.
     * @param offset offset of the message start.
     * @param length length of the message.
     * @return the decoded request.
     * @throws CodecException if the bytes are not a valid request.
     */
    public static QuoteRequest decodeRequest(final DirectBuffer buffer, final int offset, final int length)
    {
        final Reader reader = new Reader(buffer, offset, length);
        reader.header(TYPE_REQUEST);

        final String bucket = reader.string();
        final SwapSide<TokenWeight> from = reader.weights();
        final SwapSide<TokenWeight> to = reader.weights();

        return new QuoteRequest(bucket, from, to);
    }

    /**
     * Encode a response.
     *
     * @param buffer   buffer to write into, must have room or be expandable.
     * @param offset   offset within the buffer.
     * @param response response to encode.
     * @return encoded length in bytes.
     */
    public static int encodeResponse(final MutableDirectBuffer buffer, final int offset, final QuoteResponse response)
    {
        int position = encodeHeader(buffer, offset, TYPE_RESPONSE);
        position += putString(buffer, position, response.solver());
        position = encodeAmounts(buffer, position, response.from());
        position = encodeAmounts(buffer, position, response.to());

        return position - offset;
    }

    /**
     * Decode a response.
     *
     * @param buffer buffer holding the message.
     * @param offset offset of the message start.
     * @param length length of the message.
     * @return the decoded response.
     * @throws CodecException if the bytes are not a valid response.
     */
    public static QuoteResponse decodeResponse(final DirectBuffer buffer, final int offset, final int length)
    {
        final Reader reader = new Reader(buffer, offset, length);
        reader.header(TYPE_RESPONSE);

        final String solver = reader.string();
        final SwapSide<TokenAmount> from = reader.amounts();
        final SwapSide<TokenAmount> to = reader.amounts();

        return new QuoteResponse(solver, from, to);
    }

    private static int encodeHeader(final MutableDirectBuffer buffer, final int offset, final byte type)
    {
        buffer.putInt(offset + MAGIC_OFFSET, MAGIC, BYTE_ORDER);
        buffer.putByte(offset + VERSION_OFFSET, VERSION);
        buffer.putByte(offset + TYPE_OFFSET, type);
        buffer.putShort(offset + TYPE_OFFSET + 1, (short)0, BYTE_ORDER);

        return offset + BODY_OFFSET;
    }

    private static int encodeWeights(final MutableDirectBuffer buffer, final int offset, final SwapSide<TokenWeight> side)
    {
        int position = offset + putString(buffer, offset, side.network());
        position = putCount(buffer, position, side.tokens().size());

        for (final TokenWeight token : side.tokens())
        {
            position += putString(buffer, position, token.address());
            buffer.putDouble(position, token.weight(), BYTE_ORDER);
            position += Double.BYTES;
        }

        return position;
    }

    private static int encodeAmounts(final MutableDirectBuffer buffer, final int offset, final SwapSide<TokenAmount> side)
    {
        int position = offset + putString(buffer, offset, side.network());
        position = putCount(buffer, position, side.tokens().size());

        for (final TokenAmount token : side.tokens())
        {
            position += putString(buffer, position, token.address());
            buffer.putDouble(position, token.amount(), BYTE_ORDER);
            position += Double.BYTES;
        }

        return position;
    }

    private static int putCount(final MutableDirectBuffer buffer, final int offset, final int count)
    {
        if (count > MAX_TOKENS)
        {
            throw new IllegalArgumentException("too many tokens: " + count + " > " + MAX_TOKENS);
        }

        buffer.putInt(offset, count, BYTE_ORDER);
        return offset + Integer.BYTES;
    }

    private static int putString(final MutableDirectBuffer buffer, final int offset, final String value)
    {
        return buffer.putStringUtf8(offset, value, BYTE_ORDER, MAX_STRING_LENGTH);
    }

    /**
     * Bounds checked cursor over a received message. Every read validates against the message length
     * before touching the buffer so malformed input surfaces as a {@link CodecException}.
     */
    private static final class Reader
    {
        private final DirectBuffer buffer;
        private final int limit;
        private int position;

        Reader(final DirectBuffer buffer, final int offset, final int length)
        {
            if (offset < 0 || length < 0 || offset + length > buffer.capacity())
            {
                throw new CodecException("message out of buffer bounds: offset=" + offset + " length=" + length);
            }

            this.buffer = buffer;
            this.position = offset;
            this.limit = offset + length;
        }

        void header(final byte expectedType)
        {
            require(BODY_OFFSET);

            final int magic = buffer.getInt(position + MAGIC_OFFSET, BYTE_ORDER);
            if (MAGIC != magic)
            {
                throw new CodecException("bad magic: 0x" + Integer.toHexString(magic));
            }

            final byte version = buffer.getByte(position + VERSION_OFFSET);
            if (VERSION != version)
            {
                throw new CodecException("unsupported version: " + version);
            }

            final byte type = buffer.getByte(position + TYPE_OFFSET);
            if (expectedType != type)
            {
                throw new CodecException("unexpected message type: " + type + ", expected " + expectedType);
            }

            position += BODY_OFFSET;
        }

        SwapSide<TokenWeight> weights()
        {
            final String network = string();
            final int count = count();
            final List<TokenWeight> tokens = new ArrayList<>(count);

            for (int i = 0; i < count; i++)
            {
                final String address = string();
                tokens.add(new TokenWeight(address, float64()));
            }

            return new SwapSide<>(network, tokens);
        }

        SwapSide<TokenAmount> amounts()
        {
            final String network = string();
            final int count = count();
            final List<TokenAmount> tokens = new ArrayList<>(count);

            for (int i = 0; i < count; i++)
            {
                final String address = string();
                tokens.add(new TokenAmount(address, float64()));
            }

            return new SwapSide<>(network, tokens);
        }

        String string()
        {
            final int length = int32();
            if (length < 0 || length > MAX_STRING_LENGTH)
            {
                throw new CodecException("invalid string length: " + length);
            }

            require(length);
            final byte[] bytes = new byte[length];
            buffer.getBytes(position, bytes);
            position += length;

            // decoded strings must re-encode to the same bytes
            try
            {
                return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
            }
            catch (final CharacterCodingException ex)
            {
                throw new CodecException("string is not valid UTF-8", ex);
            }
        }

        private int count()
        {
            final int count = int32();
            if (count < 0 || count > MAX_TOKENS)
            {
                throw new CodecException("invalid token count: " + count);
            }

            return count;
        }

        private int int32()
        {
            require(Integer.BYTES);
            final int value = buffer.getInt(position, BYTE_ORDER);
            position += Integer.BYTES;

            return value;
        }

        private double float64()
        {
            require(Double.BYTES);
            final double value = buffer.getDouble(position, BYTE_ORDER);
            position += Double.BYTES;

            return value;
        }

        private void require(final int bytes)
        {
            if (limit - position < bytes)
            {
                throw new CodecException(
                    "message truncated: need " + bytes + " bytes at " + position + ", have " + (limit - position));
            }
        }
    }
}
