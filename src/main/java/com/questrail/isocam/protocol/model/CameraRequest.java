package com.questrail.isocam.protocol.model;

import java.util.Objects;

/**
 * CameraRequest
 * =============================================================================
 * Messages sent by the supervisor to the worker process.
 *
 * <p>{@link CloseCamera} and {@link EndOfStream} double as the sentinels that
 * drive cooperative shutdown: the first ends a camera session, the second ends
 * the connection.</p>
 */
public sealed interface CameraRequest
        permits CameraRequest.OpenCamera,
                CameraRequest.CloseCamera,
                CameraRequest.Play,
                CameraRequest.Stop,
                CameraRequest.WriteSetting,
                CameraRequest.ListSerials,
                CameraRequest.EndOfStream
{
    MessageTag tag();

    /**
     * Whether the request only makes sense against an open camera session.
     */
    default boolean sessionScoped() {
        return false;
    }

    record OpenCamera(String serial) implements CameraRequest {
        public OpenCamera {
            Objects.requireNonNull(serial, "serial");
        }

        @Override
        public MessageTag tag() {
            return MessageTag.OPEN_CAM;
        }
    }

    record CloseCamera() implements CameraRequest {
        @Override
        public MessageTag tag() {
            return MessageTag.CLOSE_CAM;
        }

        @Override
        public boolean sessionScoped() {
            return true;
        }
    }

    record Play() implements CameraRequest {
        @Override
        public MessageTag tag() {
            return MessageTag.PLAY;
        }

        @Override
        public boolean sessionScoped() {
            return true;
        }
    }

    record Stop() implements CameraRequest {
        @Override
        public MessageTag tag() {
            return MessageTag.STOP;
        }

        @Override
        public boolean sessionScoped() {
            return true;
        }
    }

    /**
     * Request to change one setting.
     *
     * <p>The name is kept as received so that unknown names reach the
     * controller and are rejected there. The value is in wire form.</p>
     */
    record WriteSetting(String name, Object value) implements CameraRequest {
        public WriteSetting {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public MessageTag tag() {
            return MessageTag.SETTING;
        }

        @Override
        public boolean sessionScoped() {
            return true;
        }
    }

    record ListSerials() implements CameraRequest {
        @Override
        public MessageTag tag() {
            return MessageTag.SERIALS;
        }
    }

    record EndOfStream() implements CameraRequest {
        @Override
        public MessageTag tag() {
            return MessageTag.EOF;
        }
    }
}
