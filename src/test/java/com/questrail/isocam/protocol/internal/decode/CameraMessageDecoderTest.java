package com.questrail.isocam.protocol.internal.decode;

import com.questrail.isocam.api.FrameEnvelope;
import com.questrail.isocam.api.PixelFormat;
import com.questrail.isocam.protocol.codec.MessageCodec;
import com.questrail.isocam.protocol.codec.ProtocolException;
import com.questrail.isocam.protocol.codec.WireMessage;
import com.questrail.isocam.protocol.codec.YamlTextCodec;
import com.questrail.isocam.protocol.internal.encode.CameraMessageEncoder;
import com.questrail.isocam.protocol.model.CameraEvent;
import com.questrail.isocam.protocol.model.CameraRequest;
import com.questrail.isocam.protocol.model.MessageTag;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CameraMessageDecoderTest {

    private final CameraMessageDecoder decoder = new CameraMessageDecoder();
    private final CameraMessageEncoder encoder = new CameraMessageEncoder();
    private final MessageCodec codec = new MessageCodec(new YamlTextCodec());

    // ---------------------------------------------------------------------
    // Requests
    // ---------------------------------------------------------------------

    @Test
    void decodesSettingRequestAsNameValuePair() {
        CameraRequest request = decoder.decodeRequest(
                new WireMessage(MessageTag.SETTING, List.of("exposure_ms", 12.5)));

        assertEquals(new CameraRequest.WriteSetting("exposure_ms", 12.5), request);
    }

    @Test
    void serialsIsBothARequestAndAnEvent() {
        assertEquals(new CameraRequest.ListSerials(),
                decoder.decodeRequest(new WireMessage(MessageTag.SERIALS, null)));
        assertEquals(new CameraEvent.SerialsListed(List.of("a", "b")),
                decoder.decodeEvent(new WireMessage(MessageTag.SERIALS, List.of("a", "b"))));
    }

    @Test
    void rejectsEventTagsOnTheRequestSide() {
        assertThrows(ProtocolException.class,
                () -> decoder.decodeRequest(new WireMessage(MessageTag.CAM_OPEN, null)));
        assertThrows(ProtocolException.class,
                () -> decoder.decodeRequest(new WireMessage(MessageTag.IMAGE, List.of())));
    }

    @Test
    void rejectsRequestTagsOnTheEventSide() {
        assertThrows(ProtocolException.class,
                () -> decoder.decodeEvent(new WireMessage(MessageTag.EOF, null)));
        assertThrows(ProtocolException.class,
                () -> decoder.decodeEvent(new WireMessage(MessageTag.OPEN_CAM, "1")));
    }

    @Test
    void rejectsMalformedValues() {
        assertThrows(ProtocolException.class,
                () -> decoder.decodeRequest(new WireMessage(MessageTag.OPEN_CAM, 42)));
        assertThrows(ProtocolException.class,
                () -> decoder.decodeRequest(new WireMessage(MessageTag.SETTING, List.of("gain"))));
        assertThrows(ProtocolException.class,
                () -> decoder.decodeEvent(new WireMessage(MessageTag.PLAYING, "yes")));
        assertThrows(ProtocolException.class,
                () -> decoder.decodeEvent(new WireMessage(MessageTag.SETTINGS, List.of())));
        assertThrows(ProtocolException.class,
                () -> decoder.decodeEvent(image(List.of(-1, 1), 0, 0)));
        assertThrows(ProtocolException.class,
                () -> decoder.decodeEvent(image(List.of(1, 1L << 32), 0, 0)));
        assertThrows(ProtocolException.class,
                () -> decoder.decodeEvent(image(List.of(1, 1), 0, -3)));
        assertThrows(ProtocolException.class,
                () -> decoder.decodeEvent(image(List.of(1.5, 1), 0, 0)));
        assertThrows(ProtocolException.class,
                () -> decoder.decodeEvent(image(List.of(1, 1), BigInteger.ONE.shiftLeft(64), 0)));
    }

    private static WireMessage image(List<?> size, Object frameIndex, Object queuedCount) {
        return new WireMessage(MessageTag.IMAGE,
                Arrays.asList(new byte[2], "gray16le", size, frameIndex, queuedCount, 0.0));
    }

    // ---------------------------------------------------------------------
    // Events
    // ---------------------------------------------------------------------

    @Test
    void exceptionWithNullTraceBecomesEmptyTrace() {
        CameraEvent event = decoder.decodeEvent(
                new WireMessage(MessageTag.EXCEPTION, Arrays.asList("Camera is not playing", null)));

        assertEquals(CameraEvent.CameraFault.rejected("Camera is not playing"), event);
    }

    @Test
    void imageSurvivesTheWire() {
        FrameEnvelope frame = new FrameEnvelope(
                new byte[] { 1, 0, 2, 0, 3, 0 }, PixelFormat.MONO16, 3, 1, 41, 2, 12.25);

        WireMessage onWire = codec.decode(codec.encode(encoder.encode(new CameraEvent.ImageCaptured(frame))));
        CameraEvent event = decoder.decodeEvent(onWire);

        assertEquals(new CameraEvent.ImageCaptured(frame), event);
    }

    @Test
    void rejectsUnknownPixelFormat() {
        List<Object> value = Arrays.asList(new byte[2], "rgb24", List.of(1, 1), 0, 0, 0.0);

        assertThrows(ProtocolException.class,
                () -> decoder.decodeEvent(new WireMessage(MessageTag.IMAGE, value)));
    }

    @Test
    void settingEchoKeepsOrder() {
        Map<String, Object> echo = new LinkedHashMap<>();
        echo.put("roi_x", 4);
        echo.put("roi_width", 60);

        CameraEvent event = decoder.decodeEvent(
                codec.decode(codec.encode(encoder.encode(new CameraEvent.SettingChanged(echo)))));

        assertEquals(List.of("roi_x", "roi_width"),
                List.copyOf(((CameraEvent.SettingChanged) event).changes().keySet()));
    }
}
