package com.wangbin.hoststats.core.socket;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class FrameCodecTest {

    @Test
    void outboundMessageGetsLittleEndianLengthHeader() {
        EmbeddedChannel channel = newChannel();

        assertTrue(channel.writeOutbound("getstate".getBytes(StandardCharsets.UTF_8)));

        ByteBuf written = Unpooled.buffer();
        ByteBuf part;
        while ((part = channel.readOutbound()) != null) {
            written.writeBytes(part);
            part.release();
        }
        assertEquals(8, written.readIntLE());
        assertEquals("getstate", written.toString(StandardCharsets.UTF_8));
        written.release();
        channel.finishAndReleaseAll();
    }

    @Test
    void inboundFramesAreSplitOnHeader() {
        EmbeddedChannel channel = newChannel();
        byte[] first = "{\"data\":{}}".getBytes(StandardCharsets.UTF_8);
        byte[] second = "err bad".getBytes(StandardCharsets.UTF_8);

        ByteBuf wire = Unpooled.buffer();
        wire.writeIntLE(first.length).writeBytes(first);
        wire.writeIntLE(second.length).writeBytes(second, 0, 3);
        channel.writeInbound(wire);

        byte[] decoded = channel.readInbound();
        assertArrayEquals(first, decoded);
        Object pending = channel.readInbound();
        assertNull(pending, "partial frame must wait for the rest");

        channel.writeInbound(Unpooled.wrappedBuffer(second, 3, second.length - 3));
        byte[] rest = channel.readInbound();
        assertArrayEquals(second, rest);
        channel.finishAndReleaseAll();
    }

    private EmbeddedChannel newChannel() {
        EmbeddedChannel channel = new EmbeddedChannel();
        FrameCodec.install(channel.pipeline(), 1024);
        return channel;
    }
}
