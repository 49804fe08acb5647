package com.wangbin.hoststats.core.socket;

import java.io.Closeable;
import java.io.IOException;

/**
 * 控制套接字连接，每次请求对应一个完整的响应帧
 */
public interface SocketConnection extends Closeable {

    /**
     * 发送一帧数据
     */
    void send(byte[] data) throws IOException;

    /**
     * 阻塞等待一帧响应
     *
     * @throws IOException 未收到数据或连接已断开
     */
    byte[] receive() throws IOException;

    /**
     * 关闭连接，可重复调用
     */
    @Override
    void close();
}
