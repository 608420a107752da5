package com.questrail.isocam.protocol.internal.decode;

import com.questrail.isocam.api.FrameEnvelope;
import com.questrail.isocam.api.PixelFormat;
import com.questrail.isocam.protocol.codec.ProtocolException;
import com.questrail.isocam.protocol.codec.WireMessage;
import com.questrail.isocam.protocol.model.CameraEvent;
import com.questrail.isocam.protocol.model.CameraRequest;
import com.questrail.isocam.protocol.model.MessageTag;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * CameraMessageDecoder
 * -----------------------------------------------------------------------------
 * Inverse of {@link com.questrail.isocam.protocol.internal.encode.CameraMessageEncoder}.
 *
 * <p>The worker decodes with {@link #decodeRequest(WireMessage)} and the
 * supervisor with {@link #decodeEvent(WireMessage)}; a tag that is not valid
 * in the decoding direction, or a value of the wrong shape, is a
 * {@link ProtocolException}.</p>
 */
public final class CameraMessageDecoder
{
    public CameraRequest decodeRequest(WireMessage message) {
        Objects.requireNonNull(message, "message");
        MessageTag tag = message.tag();
        Object value = message.value();

        return switch (tag) {
            case OPEN_CAM -> new CameraRequest.OpenCamera(string(tag, value));
            case CLOSE_CAM -> new CameraRequest.CloseCamera();
            case PLAY -> new CameraRequest.Play();
            case STOP -> new CameraRequest.Stop();
            case SERIALS -> new CameraRequest.ListSerials();
            case EOF -> new CameraRequest.EndOfStream();
            case SETTING -> {
                List<?> pair = sequence(tag, value, 2);
                yield new CameraRequest.WriteSetting(string(tag, pair.get(0)), pair.get(1));
            }
            default -> throw new ProtocolException("Tag " + tag.wireName() + " is not a request");
        };
    }

    public CameraEvent decodeEvent(WireMessage message) {
        Objects.requireNonNull(message, "message");
        MessageTag tag = message.tag();
        Object value = message.value();

        return switch (tag) {
            case CAM_OPEN -> new CameraEvent.CameraOpened();
            case CAM_CLOSED -> new CameraEvent.CameraClosed();
            case PLAYING -> {
                if (!(value instanceof Boolean playing)) {
                    throw malformed(tag, value);
                }
                yield new CameraEvent.PlayingChanged(playing);
            }
            case SETTINGS -> new CameraEvent.SettingsSnapshot(map(tag, value));
            case SETTING -> new CameraEvent.SettingChanged(map(tag, value));
            case SERIALS -> {
                List<?> items = value == null ? List.of() : sequence(tag, value, -1);
                List<String> serials = new ArrayList<>(items.size());
                for (Object item : items) {
                    serials.add(string(tag, item));
                }
                yield new CameraEvent.SerialsListed(serials);
            }
            case IMAGE -> new CameraEvent.ImageCaptured(frame(value));
            case EXCEPTION -> {
                List<?> pair = sequence(tag, value, 2);
                Object trace = pair.get(1);
                yield new CameraEvent.CameraFault(string(tag, pair.get(0)),
                        trace == null ? "" : string(tag, trace));
            }
            default -> throw new ProtocolException("Tag " + tag.wireName() + " is not an event");
        };
    }

    private static FrameEnvelope frame(Object value) {
        MessageTag tag = MessageTag.IMAGE;
        List<?> fields = sequence(tag, value, 6);

        if (!(fields.get(0) instanceof byte[] pixels)) {
            throw malformed(tag, fields.get(0));
        }
        String formatName = string(tag, fields.get(1));
        PixelFormat format = PixelFormat.fromWireName(formatName)
                .orElseThrow(() -> new ProtocolException("Unknown pixel format: " + formatName));
        List<?> size = sequence(tag, fields.get(2), 2);

        return new FrameEnvelope(
                pixels,
                format,
                (int) integer("width", size.get(0), 0, Integer.MAX_VALUE),
                (int) integer("height", size.get(1), 0, Integer.MAX_VALUE),
                integer("frame index", fields.get(3), Long.MIN_VALUE, Long.MAX_VALUE),
                (int) integer("queued count", fields.get(4), 0, Integer.MAX_VALUE),
                number(tag, fields.get(5)).doubleValue());
    }

    /**
     * Reads an image metadata field that must be a whole number within
     * {@code [min, max]}.
     */
    private static long integer(String field, Object value, long min, long max) {
        long n;
        if (value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte) {
            n = ((Number) value).longValue();
        }
        else if (value instanceof BigInteger big && big.bitLength() < Long.SIZE) {
            n = big.longValue();
        }
        else {
            throw new ProtocolException("Malformed image " + field + ": " + value);
        }
        if (n < min || n > max) {
            throw new ProtocolException("Malformed image " + field + ": " + value);
        }
        return n;
    }

    private static Map<String, Object> map(MessageTag tag, Object value) {
        if (!(value instanceof Map<?, ?> raw)) {
            throw malformed(tag, value);
        }
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            out.put(string(tag, entry.getKey()), entry.getValue());
        }
        return out;
    }

    private static List<?> sequence(MessageTag tag, Object value, int size) {
        if (value instanceof List<?> list && (size < 0 || list.size() == size)) {
            return list;
        }
        throw malformed(tag, value);
    }

    private static String string(MessageTag tag, Object value) {
        if (value instanceof String s) {
            return s;
        }
        throw malformed(tag, value);
    }

    private static Number number(MessageTag tag, Object value) {
        if (value instanceof Number n) {
            return n;
        }
        throw malformed(tag, value);
    }

    private static ProtocolException malformed(MessageTag tag, Object value) {
        return new ProtocolException("Malformed " + tag.wireName() + " value: " + value);
    }
}
