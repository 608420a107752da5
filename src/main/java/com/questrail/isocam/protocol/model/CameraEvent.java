package com.questrail.isocam.protocol.model;

import com.questrail.isocam.api.FrameEnvelope;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * CameraEvent
 * =============================================================================
 * Messages emitted by the camera controller and delivered to the supervisor's
 * listener, in emission order.
 *
 * <p>Settings maps are in wire form (see
 * {@link com.questrail.isocam.api.CameraSettings#toWire()}) and preserve key
 * order.</p>
 */
public sealed interface CameraEvent
        permits CameraEvent.CameraOpened,
                CameraEvent.CameraClosed,
                CameraEvent.PlayingChanged,
                CameraEvent.SettingsSnapshot,
                CameraEvent.SettingChanged,
                CameraEvent.SerialsListed,
                CameraEvent.ImageCaptured,
                CameraEvent.CameraFault
{
    MessageTag tag();

    record CameraOpened() implements CameraEvent {
        @Override
        public MessageTag tag() {
            return MessageTag.CAM_OPEN;
        }
    }

    /** Always the last event of a camera session. */
    record CameraClosed() implements CameraEvent {
        @Override
        public MessageTag tag() {
            return MessageTag.CAM_CLOSED;
        }
    }

    record PlayingChanged(boolean playing) implements CameraEvent {
        @Override
        public MessageTag tag() {
            return MessageTag.PLAYING;
        }
    }

    /** Full settings, published once a camera has been opened. */
    record SettingsSnapshot(Map<String, Object> settings) implements CameraEvent {
        public SettingsSnapshot {
            settings = Collections.unmodifiableMap(new LinkedHashMap<>(settings));
        }

        @Override
        public MessageTag tag() {
            return MessageTag.SETTINGS;
        }
    }

    /**
     * Echo of a setting write: the requested setting and any dependent
     * settings, with the values the driver actually applied.
     */
    record SettingChanged(Map<String, Object> changes) implements CameraEvent {
        public SettingChanged {
            changes = Collections.unmodifiableMap(new LinkedHashMap<>(changes));
        }

        @Override
        public MessageTag tag() {
            return MessageTag.SETTING;
        }
    }

    record SerialsListed(List<String> serials) implements CameraEvent {
        public SerialsListed {
            serials = List.copyOf(serials);
        }

        @Override
        public MessageTag tag() {
            return MessageTag.SERIALS;
        }
    }

    record ImageCaptured(FrameEnvelope frame) implements CameraEvent {
        public ImageCaptured {
            Objects.requireNonNull(frame, "frame");
        }

        @Override
        public MessageTag tag() {
            return MessageTag.IMAGE;
        }
    }

    /**
     * A rejected request or a fault. {@code trace} is empty for rejections
     * and carries a stack trace or captured stderr for faults.
     */
    record CameraFault(String message, String trace) implements CameraEvent {
        public CameraFault {
            Objects.requireNonNull(message, "message");
            trace = trace == null ? "" : trace;
        }

        public static CameraFault rejected(String message) {
            return new CameraFault(message, "");
        }

        /**
         * Fault describing {@code cause}, with its stack trace as the trace.
         */
        public static CameraFault from(Throwable cause) {
            Objects.requireNonNull(cause, "cause");
            String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();

            StringWriter trace = new StringWriter();
            try (PrintWriter out = new PrintWriter(trace)) {
                cause.printStackTrace(out);
            }
            return new CameraFault(message, trace.toString());
        }

        @Override
        public MessageTag tag() {
            return MessageTag.EXCEPTION;
        }
    }
}
