package com.questrail.isocam.api;

import java.util.Arrays;
import java.util.Objects;

/**
 * FrameEnvelope
 * -----------------------------------------------------------------------------
 * One captured image plus the metadata the driver reported with it.
 *
 * <p>Immutable: pixel bytes are copied on construction and by
 * {@link #pixels()}. These are the only copies a frame's pixels go through
 * between the driver and the supervisor's listener; the wire layer shares
 * buffers. Use {@link #pixelLength()} where only the size is needed.</p>
 */
public final class FrameEnvelope
{
    private final byte[] pixels;
    private final PixelFormat format;
    private final int width;
    private final int height;
    private final long frameIndex;
    private final int queuedCount;
    private final double captureTime;

    /**
     * @param pixels      raw pixel bytes in {@code format} layout
     * @param format      pixel layout
     * @param width       image width in pixels
     * @param height      image height in pixels
     * @param frameIndex  frame number reported by the camera
     * @param queuedCount frames still waiting on the camera's hardware queue
     * @param captureTime monotonic capture time in seconds
     */
    public FrameEnvelope(byte[] pixels,
                         PixelFormat format,
                         int width,
                         int height,
                         long frameIndex,
                         int queuedCount,
                         double captureTime) {
        this.pixels = Objects.requireNonNull(pixels, "pixels").clone();
        this.format = Objects.requireNonNull(format, "format");
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("negative frame size " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.frameIndex = frameIndex;
        this.queuedCount = queuedCount;
        this.captureTime = captureTime;
    }

    /**
     * Returns a copy of the pixel bytes.
     */
    public byte[] pixels() {
        return pixels.clone();
    }

    public int pixelLength() {
        return pixels.length;
    }

    public PixelFormat format() {
        return format;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public long frameIndex() {
        return frameIndex;
    }

    public int queuedCount() {
        return queuedCount;
    }

    public double captureTime() {
        return captureTime;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FrameEnvelope other)) {
            return false;
        }
        return width == other.width
                && height == other.height
                && frameIndex == other.frameIndex
                && queuedCount == other.queuedCount
                && Double.compare(captureTime, other.captureTime) == 0
                && format == other.format
                && Arrays.equals(pixels, other.pixels);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(format, width, height, frameIndex, queuedCount, captureTime);
        return 31 * result + Arrays.hashCode(pixels);
    }

    @Override
    public String toString() {
        return "FrameEnvelope[" +
                "frameIndex=" + frameIndex +
                ", format=" + format.wireName() +
                ", size=" + width + "x" + height +
                ", bytes=" + pixels.length +
                ", queued=" + queuedCount +
                ", t=" + captureTime +
                ']';
    }
}
