package com.questrail.isocam.protocol.codec;

import com.questrail.isocam.protocol.model.MessageTag;

import java.util.Objects;

/**
 * A decoded {@code (tag, value)} pair, before it is mapped onto a typed
 * request or event.
 *
 * <p>For {@link MessageTag#IMAGE} the value is a list whose first element is
 * the raw pixel {@code byte[]} followed by the metadata.</p>
 */
public record WireMessage(MessageTag tag, Object value)
{
    public WireMessage {
        Objects.requireNonNull(tag, "tag");
    }
}
