package com.questrail.isocam.protocol.codec;

/**
 * Structured text codec used for the text part of every frame.
 *
 * <p>Implementations must round-trip maps, lists, strings, booleans, integers,
 * floating point numbers and {@code null}, nested arbitrarily. Tuples are
 * represented as lists. Decoding must never construct arbitrary types.</p>
 */
public interface TextCodec
{
    String encode(Object value);

    /**
     * @throws ProtocolException if {@code text} cannot be decoded
     */
    Object decode(String text);
}
