package com.questrail.isocam.protocol.internal.encode;

import com.questrail.isocam.api.FrameEnvelope;
import com.questrail.isocam.protocol.codec.WireMessage;
import com.questrail.isocam.protocol.model.CameraEvent;
import com.questrail.isocam.protocol.model.CameraRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * CameraMessageEncoder
 * -----------------------------------------------------------------------------
 * Maps typed {@link CameraRequest}s and {@link CameraEvent}s onto the
 * {@link WireMessage} values of the message catalogue.
 *
 * <pre>
 *   open_cam   serial
 *   setting    [name, value]            (request)
 *   setting    {name: value, ...}       (event)
 *   settings   {name: value, ...}
 *   serials    [serial, ...]            (event; null as a request)
 *   playing    true | false
 *   image      [bytes, fmt, [w, h], frame_index, queued_count, capture_time]
 *   exception  [message, trace]
 * </pre>
 *
 * All other tags carry {@code null}.
 */
public final class CameraMessageEncoder
{
    public WireMessage encode(CameraRequest request) {
        Objects.requireNonNull(request, "request");

        if (request instanceof CameraRequest.OpenCamera r) {
            return new WireMessage(r.tag(), r.serial());
        }
        if (request instanceof CameraRequest.WriteSetting r) {
            return new WireMessage(r.tag(), pair(r.name(), r.value()));
        }

        // close_cam, play, stop, serials, eof
        return new WireMessage(request.tag(), null);
    }

    public WireMessage encode(CameraEvent event) {
        Objects.requireNonNull(event, "event");

        if (event instanceof CameraEvent.PlayingChanged e) {
            return new WireMessage(e.tag(), e.playing());
        }
        if (event instanceof CameraEvent.SettingsSnapshot e) {
            return new WireMessage(e.tag(), e.settings());
        }
        if (event instanceof CameraEvent.SettingChanged e) {
            return new WireMessage(e.tag(), e.changes());
        }
        if (event instanceof CameraEvent.SerialsListed e) {
            return new WireMessage(e.tag(), e.serials());
        }
        if (event instanceof CameraEvent.ImageCaptured e) {
            return new WireMessage(e.tag(), image(e.frame()));
        }
        if (event instanceof CameraEvent.CameraFault e) {
            return new WireMessage(e.tag(), pair(e.message(), e.trace()));
        }

        // cam_open, cam_closed
        return new WireMessage(event.tag(), null);
    }

    private static List<Object> image(FrameEnvelope frame) {
        List<Object> value = new ArrayList<>(6);
        value.add(frame.pixels());
        value.add(frame.format().wireName());
        value.add(List.of(frame.width(), frame.height()));
        value.add(frame.frameIndex());
        value.add(frame.queuedCount());
        value.add(frame.captureTime());
        return value;
    }

    private static List<Object> pair(Object first, Object second) {
        List<Object> value = new ArrayList<>(2);
        value.add(first);
        value.add(second);
        return value;
    }
}
