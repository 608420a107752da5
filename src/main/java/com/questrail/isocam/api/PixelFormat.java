package com.questrail.isocam.api;

import java.util.Optional;

/**
 * Pixel layouts a camera driver may deliver.
 *
 * <p>The wire name is the pixel-format string carried in {@code image}
 * messages.</p>
 */
public enum PixelFormat
{
    /** Single channel, 16 bits per pixel, little endian. */
    MONO16("gray16le", 1),

    /** Blue/green/red, 16 bits per channel, little endian. */
    BGR48("bgr48le", 3);

    private final String wireName;
    private final int channels;

    PixelFormat(String wireName, int channels) {
        this.wireName = wireName;
        this.channels = channels;
    }

    public String wireName() {
        return wireName;
    }

    public int channels() {
        return channels;
    }

    /** Bytes occupied by one pixel. */
    public int bytesPerPixel() {
        return channels * 2;
    }

    public static Optional<PixelFormat> fromWireName(String name) {
        for (PixelFormat format : values()) {
            if (format.wireName.equals(name)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
