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
import org.agrona.MutableDirectBuffer;

import java.nio.ByteOrder;

/**
 * Framing that carries a content topic and its payload on the shared channel.
 * <p>
 * Every topic travels on the same Aeron stream, so receivers read the topic from this envelope and
 * hand the payload to the listeners registered for it.
 * <pre>
 * Offset  Size  Field
 * ------  ----  -----
 * 0       4     magic (0x494C5450 = "ILTP")
 * 4       1     version (1)
 * 5       3     reserved
 * 8       4     topic length T
 * 12      T     topic, UTF-8
 * 12+T    4     payload length P
 * 16+T    P     payload
 * </pre>
 * Little-endian. Encoding is static; decoding uses an instance as a reusable flyweight, one per
 * polling thread.
 */
public final class TopicEnvelope
{
    /** Magic bytes identifying an envelope: "ILTP" */
    public static final int MAGIC = 0x494C_5450;

    /** Current envelope version */
    public static final byte VERSION = 1;

    public static final int MAGIC_OFFSET = 0;
    public static final int VERSION_OFFSET = 4;
    public static final int TOPIC_LENGTH_OFFSET = 8;
    public static final int TOPIC_OFFSET = 12;

    /** Bytes of an envelope with an empty topic and empty payload */
    public static final int MIN_LENGTH = TOPIC_OFFSET + Integer.BYTES;

    /** Upper bound on the encoded topic, in bytes */
    public static final int MAX_TOPIC_LENGTH = 256;

    private static final ByteOrder BYTE_ORDER = ByteOrder.LITTLE_ENDIAN;

    private DirectBuffer buffer;
    private String topic;
    private int payloadOffset;
    private int payloadLength;

    /**
     * Write an envelope.
     *
     * @param buffer        destination, must have room or be expandable.
     * @param offset        offset within the destination.
     * @param topic         content topic.
     * @param payload       buffer holding the payload.
     * @param payloadOffset offset of the payload.
     * @param payloadLength length of the payload.
     * @return total envelope length in bytes.
     * @throws IllegalArgumentException if the topic exceeds {@link #MAX_TOPIC_LENGTH} bytes.
     */
    public static int encode(
        final MutableDirectBuffer buffer,
        final int offset,
        final String topic,
        final DirectBuffer payload,
        final int payloadOffset,
        final int payloadLength)
    {
        buffer.putInt(offset + MAGIC_OFFSET, MAGIC, BYTE_ORDER);
        buffer.putByte(offset + VERSION_OFFSET, VERSION);
        buffer.putByte(offset + VERSION_OFFSET + 1, (byte)0);
        buffer.putShort(offset + VERSION_OFFSET + 2, (short)0, BYTE_ORDER);

        int position = offset + TOPIC_LENGTH_OFFSET;
        position += buffer.putStringUtf8(position, topic, BYTE_ORDER, MAX_TOPIC_LENGTH);

        buffer.putInt(position, payloadLength, BYTE_ORDER);
        position += Integer.BYTES;
        buffer.putBytes(position, payload, payloadOffset, payloadLength);

        return position + payloadLength - offset;
    }

    /**
     * Decode an envelope in place. On success the accessors describe it until the next call.
     *
     * @param buffer buffer holding the envelope.
     * @param offset offset of the envelope.
     * @param length bytes available.
     * @return true if the bytes are a complete, well formed envelope.
     */
    public boolean wrap(final DirectBuffer buffer, final int offset, final int length)
    {
        this.buffer = null;
        this.topic = null;

        if (length < MIN_LENGTH ||
            MAGIC != buffer.getInt(offset + MAGIC_OFFSET, BYTE_ORDER) ||
            VERSION != buffer.getByte(offset + VERSION_OFFSET))
        {
            return false;
        }

        final int topicLength = buffer.getInt(offset + TOPIC_LENGTH_OFFSET, BYTE_ORDER);
        if (topicLength < 0 || topicLength > MAX_TOPIC_LENGTH || length < MIN_LENGTH + topicLength)
        {
            return false;
        }

        final int payloadLengthOffset = offset + TOPIC_OFFSET + topicLength;
        final int payloadLength = buffer.getInt(payloadLengthOffset, BYTE_ORDER);
        if (payloadLength < 0 || payloadLength > length - MIN_LENGTH - topicLength)
        {
            return false;
        }

        this.buffer = buffer;
        this.topic = buffer.getStringWithoutLengthUtf8(offset + TOPIC_OFFSET, topicLength);
        this.payloadOffset = payloadLengthOffset + Integer.BYTES;
        this.payloadLength = payloadLength;

        return true;
    }

    public String topic()
    {
        return topic;
    }

    public DirectBuffer buffer()
    {
        return buffer;
    }

    public int payloadOffset()
    {
        return payloadOffset;
    }

    public int payloadLength()
    {
        return payloadLength;
    }
}
