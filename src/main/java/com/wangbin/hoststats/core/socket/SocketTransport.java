package com.wangbin.hoststats.core.socket;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 本地控制套接字传输
 */
public interface SocketTransport {

    /**
     * 打开到指定套接字的连接
     *
     * @throws IOException 无法连接
     */
    SocketConnection open(Path socketPath) throws IOException;
}
