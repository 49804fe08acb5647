package com.wangbin.hoststats.core.socket;

import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import io.netty.handler.codec.bytes.ByteArrayDecoder;
import io.netty.handler.codec.bytes.ByteArrayEncoder;

import java.nio.ByteOrder;

/**
 * 控制套接字帧格式：4字节小端长度头 + 消息体
 */
public final class FrameCodec {

    public static final int HEADER_LENGTH = 4;

    private FrameCodec() {
    }

    /**
     * 在管道中安装帧编解码器，之后的处理器收发 byte[]
     */
    public static void install(ChannelPipeline pipeline, int maxFrameLength) {
        pipeline.addLast("frameDecoder", new LengthFieldBasedFrameDecoder(
                ByteOrder.LITTLE_ENDIAN,
                maxFrameLength,
                0,
                HEADER_LENGTH,
                0,
                HEADER_LENGTH,
                true
        ));
        pipeline.addLast("framePrepender", new LengthFieldPrepender(ByteOrder.LITTLE_ENDIAN, HEADER_LENGTH, 0, false));
        pipeline.addLast("bytesDecoder", new ByteArrayDecoder());
        pipeline.addLast("bytesEncoder", new ByteArrayEncoder());
    }
}
