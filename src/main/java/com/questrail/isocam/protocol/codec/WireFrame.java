package com.questrail.isocam.protocol.codec;

import java.util.Arrays;
import java.util.Objects;

/**
 * One framed message as it travels on the socket: the encoded text part and
 * the (usually empty) binary part.
 *
 * <p>A frame takes ownership of the arrays it is built from and hands the
 * same arrays back, so a frame's bytes are written once by the codec or the
 * socket decoder and never modified afterwards. Pixel data is copied only at
 * the {@link com.questrail.isocam.api.FrameEnvelope} boundary.</p>
 */
public final class WireFrame
{
    private static final byte[] EMPTY = new byte[0];

    private final byte[] text;
    private final byte[] binary;

    public WireFrame(byte[] text, byte[] binary) {
        this.text = Objects.requireNonNull(text, "text");
        this.binary = binary == null || binary.length == 0 ? EMPTY : binary;
    }

    public static WireFrame textOnly(byte[] text) {
        return new WireFrame(text, null);
    }

    public byte[] text() {
        return text;
    }

    public byte[] binary() {
        return binary;
    }

    public int textLength() {
        return text.length;
    }

    public int binaryLength() {
        return binary.length;
    }

    public boolean hasBinary() {
        return binary.length > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof WireFrame other
                && Arrays.equals(text, other.text)
                && Arrays.equals(binary, other.binary);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(text) + Arrays.hashCode(binary);
    }

    @Override
    public String toString() {
        return "WireFrame[text=" + text.length + "B, binary=" + binary.length + "B]";
    }
}
