package com.apigw.support;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 模拟故障后端：接受连接后立即关闭，或保持连接但从不响应
 */
public class RawSocketBackend implements AutoCloseable {

    public enum Mode { CLOSE, HOLD }

    private final ServerSocket serverSocket;
    private final Mode mode;
    private final List<Long> acceptTimes = new CopyOnWriteArrayList<>();
    private final List<Socket> held = new CopyOnWriteArrayList<>();
    private final Thread acceptor;

    public RawSocketBackend(Mode mode) throws IOException {
        this.mode = mode;
        this.serverSocket = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
        this.acceptor = new Thread(this::acceptLoop, "raw-backend-" + mode);
        this.acceptor.setDaemon(true);
        this.acceptor.start();
    }

    private void acceptLoop() {
        while (!serverSocket.isClosed()) {
            try {
                Socket socket = serverSocket.accept();
                acceptTimes.add(System.nanoTime());
                if (mode == Mode.CLOSE) {
                    socket.close();
                } else {
                    held.add(socket);
                }
            } catch (IOException e) {
                return;
            }
        }
    }

    public String url() {
        return "http://127.0.0.1:" + serverSocket.getLocalPort();
    }

    /**
     * 每次接受连接的时间（System.nanoTime）
     */
    public List<Long> acceptTimes() {
        return acceptTimes;
    }

    @Override
    public void close() throws IOException {
        serverSocket.close();
        for (Socket socket : held) {
            socket.close();
        }
    }
}
