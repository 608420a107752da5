package com.questrail.isocam.protocol.codec;

import com.questrail.isocam.protocol.model.MessageTag;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MessageCodecTest
 * -----------------------------------------------------------------------------
 * Tag/value framing over the YAML text codec.
 */
class MessageCodecTest {

    private final MessageCodec codec = new MessageCodec(new YamlTextCodec());

    private static WireFrame text(String yaml) {
        return WireFrame.textOnly(yaml.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void decodesTagValuePair() {
        WireMessage message = codec.decode(text("[open_cam, '12345']"));

        assertEquals(MessageTag.OPEN_CAM, message.tag());
        assertEquals("12345", message.value());
    }

    @Test
    void settingsMapKeepsKeyOrderThroughTheWire() {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("roi_width", 10);
        settings.put("exposure_ms", 2.5);
        settings.put("trigger_type", "SW Trigger");
        settings.put("taps", "1");

        WireMessage decoded = codec.decode(codec.encode(MessageTag.SETTINGS, settings, null));

        assertEquals(MessageTag.SETTINGS, decoded.tag());
        Map<?, ?> value = (Map<?, ?>) decoded.value();
        assertEquals(List.of("roi_width", "exposure_ms", "trigger_type", "taps"), List.copyOf(value.keySet()));
        assertEquals(2.5, value.get("exposure_ms"));
        // numeric-looking strings stay strings
        assertEquals("1", value.get("taps"));
    }

    /**
     * The image pixels travel in the binary part; the decoded value has them
     * back in front of the metadata.
     */
    @Test
    void imageBytesTravelAsBinaryPart() {
        byte[] pixels = { 1, 2, 3, 4 };
        List<Object> value = Arrays.asList(pixels, "gray16le", List.of(2, 1), 7, 0, 1.5);

        WireFrame frame = codec.encode(new WireMessage(MessageTag.IMAGE, value));

        assertArrayEquals(pixels, frame.binary());
        String text = new String(frame.text(), StandardCharsets.UTF_8);
        assertTrue(text.startsWith("[image, [gray16le"), text);

        List<?> decoded = (List<?>) codec.decode(frame).value();
        assertArrayEquals(pixels, (byte[]) decoded.get(0));
        assertEquals("gray16le", decoded.get(1));
        assertEquals(List.of(2, 1), decoded.get(2));
    }

    @Test
    void refusesBinaryPartOnNonImageTag() {
        assertThrows(ProtocolException.class,
                () -> codec.encode(MessageTag.SETTING, Map.of("gain", 1), new byte[] { 1 }));

        WireFrame frame = new WireFrame("[play, null]".getBytes(StandardCharsets.UTF_8), new byte[] { 1 });
        assertThrows(ProtocolException.class, () -> codec.decode(frame));
    }

    @Test
    void rejectsUnknownTag() {
        ProtocolException e = assertThrows(ProtocolException.class, () -> codec.decode(text("[rewind, null]")));
        assertTrue(e.getMessage().contains("rewind"));
    }

    @Test
    void rejectsTextThatIsNotAPair() {
        assertThrows(ProtocolException.class, () -> codec.decode(text("play")));
        assertThrows(ProtocolException.class, () -> codec.decode(text("[play]")));
        assertThrows(ProtocolException.class, () -> codec.decode(text("[1, null]")));
    }

    @Test
    void rejectsMalformedYaml() {
        assertThrows(ProtocolException.class, () -> codec.decode(text("[play, {")));
    }

    @Test
    void rejectsInvalidUtf8() {
        WireFrame frame = WireFrame.textOnly(new byte[] { '[', (byte) 0xC3, (byte) 0x28, ']' });
        assertThrows(ProtocolException.class, () -> codec.decode(frame));
    }

    @Test
    void safeLoaderRefusesJavaTypeTags() {
        assertThrows(ProtocolException.class,
                () -> codec.decode(text("[settings, !!java.io.File {path: /tmp}]")));
    }
}
