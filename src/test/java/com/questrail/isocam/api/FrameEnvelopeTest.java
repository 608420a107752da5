package com.questrail.isocam.api;

import com.questrail.isocam.protocol.codec.MessageCodec;
import com.questrail.isocam.protocol.codec.WireFrame;
import com.questrail.isocam.protocol.codec.YamlTextCodec;
import com.questrail.isocam.protocol.internal.encode.CameraMessageEncoder;
import com.questrail.isocam.protocol.model.CameraEvent;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FrameEnvelopeTest {

    @Test
    void driverBufferReuseDoesNotReachTheEnvelope() {
        byte[] driverBuffer = { 1, 0, 2, 0 };
        FrameEnvelope frame = new FrameEnvelope(driverBuffer, PixelFormat.MONO16, 2, 1, 0, 0, 0.5);

        driverBuffer[0] = 9;
        frame.pixels()[1] = 9;

        assertArrayEquals(new byte[] { 1, 0, 2, 0 }, frame.pixels());
        assertEquals(4, frame.pixelLength());
    }

    @Test
    void encodedFrameCarriesPixelsInItsBinaryPart() {
        FrameEnvelope frame = new FrameEnvelope(new byte[] { 5, 6 }, PixelFormat.MONO16, 1, 1, 3, 0, 1.0);
        MessageCodec codec = new MessageCodec(new YamlTextCodec());

        WireFrame wire = codec.encode(new CameraMessageEncoder().encode(new CameraEvent.ImageCaptured(frame)));

        assertEquals(frame.pixelLength(), wire.binaryLength());
        assertArrayEquals(frame.pixels(), wire.binary());
    }

    @Test
    void rejectsNegativeSize() {
        assertThrows(IllegalArgumentException.class,
                () -> new FrameEnvelope(new byte[0], PixelFormat.MONO16, -1, 1, 0, 0, 0.0));
    }
}
