package com.questrail.isocam.protocol.codec;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * WireFraming
 * -----------------------------------------------------------------------------
 * Implements the length-prefixed framing used in both directions.
 *
 * <p>Every message is preceded by an 8-byte header made of two big-endian
 * unsigned 32-bit integers:</p>
 * <pre>
 *   +-----------+-------------+--------------------+----------------------+
 *   | text_len  | binary_len  | text (text_len B)  | binary (binary_len B)|
 *   +-----------+-------------+--------------------+----------------------+
 * </pre>
 *
 * <p>This class knows nothing about tags or values. Whether a binary part is
 * allowed for a given tag is checked by {@link MessageCodec}.</p>
 */
public final class WireFraming
{
    /** Size of the {@code (text_len, binary_len)} header. */
    public static final int HEADER_LENGTH = 8;

    /** Default upper bound on {@code text_len + binary_len}. */
    public static final int DEFAULT_MAX_FRAME_SIZE = 256 * 1024 * 1024;

    /**
     * Decoded frame header.
     *
     * @param textLength   length of the text part
     * @param binaryLength length of the binary part
     */
    public record Header(int textLength, int binaryLength) {
        public int bodyLength() {
            return textLength + binaryLength;
        }
    }

    private WireFraming() {}

    /**
     * Reads and validates a header from its two raw unsigned words.
     *
     * @throws ProtocolException if either length, or their sum, exceeds {@code maxFrameSize}
     */
    public static Header header(long rawTextLength, long rawBinaryLength, int maxFrameSize) {
        long textLength = rawTextLength & 0xFFFFFFFFL;
        long binaryLength = rawBinaryLength & 0xFFFFFFFFL;
        if (textLength + binaryLength > maxFrameSize) {
            throw new ProtocolException("Frame of " + textLength + "+" + binaryLength
                    + " bytes exceeds maximum of " + maxFrameSize);
        }
        return new Header((int) textLength, (int) binaryLength);
    }

    /**
     * Serializes a frame: header, text, binary.
     */
    public static byte[] toBytes(WireFrame frame) {
        ByteBuffer buf = ByteBuffer.allocate(HEADER_LENGTH + frame.textLength() + frame.binaryLength());
        buf.putInt(frame.textLength());
        buf.putInt(frame.binaryLength());
        buf.put(frame.text());
        buf.put(frame.binary());
        return buf.array();
    }

    /**
     * Parses exactly one complete frame.
     *
     * @throws ProtocolException if the buffer is truncated, carries trailing
     *                           bytes, or announces an oversize frame
     */
    public static WireFrame fromBytes(byte[] bytes, int maxFrameSize) {
        if (bytes.length < HEADER_LENGTH) {
            throw new ProtocolException("Truncated frame header: " + bytes.length + " bytes");
        }

        ByteBuffer buf = ByteBuffer.wrap(bytes);
        Header header = header(buf.getInt(), buf.getInt(), maxFrameSize);

        int expected = HEADER_LENGTH + header.bodyLength();
        if (bytes.length != expected) {
            throw new ProtocolException("Frame length mismatch: header announces "
                    + expected + " bytes, got " + bytes.length);
        }

        int textEnd = HEADER_LENGTH + header.textLength();
        return new WireFrame(
                Arrays.copyOfRange(bytes, HEADER_LENGTH, textEnd),
                Arrays.copyOfRange(bytes, textEnd, expected));
    }
}
