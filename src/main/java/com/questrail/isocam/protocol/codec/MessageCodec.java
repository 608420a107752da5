package com.questrail.isocam.protocol.codec;

import com.questrail.isocam.protocol.model.MessageTag;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * MessageCodec
 * =============================================================================
 * Turns {@code (tag, value)} pairs into {@link WireFrame}s and back.
 *
 * <h2>Text part</h2>
 * The text part is the UTF-8 encoding of the two-element sequence
 * {@code [tag, value]} produced by the configured {@link TextCodec}.
 *
 * <h2>Binary part</h2>
 * Only {@link MessageTag#IMAGE} may carry a binary part. Its text part encodes
 * the metadata only; on decode the binary part is prepended to the metadata
 * sequence so the caller sees {@code [bytes, fmt, [w, h], ...]}.
 */
public final class MessageCodec
{
    private final TextCodec textCodec;

    public MessageCodec(TextCodec textCodec) {
        this.textCodec = Objects.requireNonNull(textCodec, "textCodec");
    }

    /**
     * Encodes a message whose binary part, if any, is given separately.
     *
     * @param tag    message tag
     * @param value  message value (metadata only for {@code image})
     * @param binary binary part, or {@code null}
     * @throws ProtocolException if a non-image tag is given a binary part
     */
    public WireFrame encode(MessageTag tag, Object value, byte[] binary) {
        Objects.requireNonNull(tag, "tag");
        if (binary != null && binary.length > 0 && !tag.carriesBinary()) {
            throw new ProtocolException("Tag " + tag.wireName() + " cannot carry a binary part");
        }

        List<Object> pair = new ArrayList<>(2);
        pair.add(tag.wireName());
        pair.add(value);

        byte[] text = textCodec.encode(pair).getBytes(StandardCharsets.UTF_8);
        return new WireFrame(text, binary);
    }

    /**
     * Encodes a message in the same shape {@link #decode(WireFrame)} returns.
     * For {@code image} the first element of the value must be the pixel bytes.
     */
    public WireFrame encode(WireMessage message) {
        Objects.requireNonNull(message, "message");
        if (!message.tag().carriesBinary()) {
            return encode(message.tag(), message.value(), null);
        }

        if (!(message.value() instanceof List<?> value) || value.isEmpty()
                || !(value.get(0) instanceof byte[] bytes)) {
            throw new ProtocolException("image value must start with the pixel bytes");
        }
        return encode(message.tag(), new ArrayList<>(value.subList(1, value.size())), bytes);
    }

    /**
     * Decodes one frame.
     *
     * @throws ProtocolException if the text is not a {@code [tag, value]} pair,
     *                           the tag is unknown, or a non-image frame
     *                           carries a binary part
     */
    public WireMessage decode(WireFrame frame) {
        Objects.requireNonNull(frame, "frame");

        Object decoded = textCodec.decode(utf8(frame.text()));
        if (!(decoded instanceof List<?> pair) || pair.size() != 2) {
            throw new ProtocolException("Message text is not a [tag, value] pair: " + decoded);
        }
        if (!(pair.get(0) instanceof String tagName)) {
            throw new ProtocolException("Message tag is not a string: " + pair.get(0));
        }

        MessageTag tag = MessageTag.fromWireName(tagName)
                .orElseThrow(() -> new ProtocolException("Unknown message tag: " + tagName));
        Object value = pair.get(1);

        if (!tag.carriesBinary()) {
            if (frame.hasBinary()) {
                throw new ProtocolException("Tag " + tagName + " received with "
                        + frame.binaryLength() + " binary bytes");
            }
            return new WireMessage(tag, value);
        }

        if (!(value instanceof List<?> metadata)) {
            throw new ProtocolException("image metadata is not a sequence: " + value);
        }
        List<Object> withBytes = new ArrayList<>(metadata.size() + 1);
        withBytes.add(frame.binary());
        withBytes.addAll(metadata);
        return new WireMessage(tag, withBytes);
    }

    private static String utf8(byte[] text) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(text))
                    .toString();
        }
        catch (CharacterCodingException e) {
            throw new ProtocolException("Message text is not valid UTF-8", e);
        }
    }
}
