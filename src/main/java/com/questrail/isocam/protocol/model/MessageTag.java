package com.questrail.isocam.protocol.model;

import java.util.Optional;

/**
 * Wire tags of the camera protocol.
 *
 * <p>{@code setting} and {@code serials} travel in both directions with
 * different value shapes; the direction is implied by which side decodes the
 * message. Only {@link #IMAGE} carries a binary part.</p>
 */
public enum MessageTag
{
    OPEN_CAM("open_cam", Direction.REQUEST),
    CLOSE_CAM("close_cam", Direction.REQUEST),
    PLAY("play", Direction.REQUEST),
    STOP("stop", Direction.REQUEST),
    EOF("eof", Direction.REQUEST),
    SETTING("setting", Direction.BOTH),
    SERIALS("serials", Direction.BOTH),
    CAM_OPEN("cam_open", Direction.EVENT),
    CAM_CLOSED("cam_closed", Direction.EVENT),
    PLAYING("playing", Direction.EVENT),
    SETTINGS("settings", Direction.EVENT),
    IMAGE("image", Direction.EVENT),
    EXCEPTION("exception", Direction.EVENT);

    public enum Direction {
        /** Supervisor to worker. */
        REQUEST,
        /** Worker to supervisor. */
        EVENT,
        BOTH
    }

    private final String wireName;
    private final Direction direction;

    MessageTag(String wireName, Direction direction) {
        this.wireName = wireName;
        this.direction = direction;
    }

    public String wireName() {
        return wireName;
    }

    public Direction direction() {
        return direction;
    }

    public boolean isRequest() {
        return direction != Direction.EVENT;
    }

    public boolean isEvent() {
        return direction != Direction.REQUEST;
    }

    public boolean carriesBinary() {
        return this == IMAGE;
    }

    public static Optional<MessageTag> fromWireName(String name) {
        for (MessageTag tag : values()) {
            if (tag.wireName.equals(name)) {
                return Optional.of(tag);
            }
        }
        return Optional.empty();
    }
}
