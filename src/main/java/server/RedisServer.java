package server;

import command.CommandExecutor;
import command.CommandHandler;
import command.CommandParser;
import config.ServerConfig;
import lombok.extern.slf4j.Slf4j;
import protocol.RespDecoder;
import service.StorageService;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Redis 서버의 메인 클래스
 * 서버 시작, 클라이언트 연결 수락을 담당하며 연결마다 별도의 스레드에서 {@link ClientHandler} 를 실행합니다.
 */
@Slf4j
public class RedisServer implements Closeable {

    private final ServerConfig config;
    private final StorageService storageService;
    private final CommandHandler commandHandler;
    private final RespDecoder decoder;
    private final Set<ClientHandler> activeClients = ConcurrentHashMap.newKeySet();
    private final AtomicInteger clientCounter = new AtomicInteger();

    private volatile ServerSocket serverSocket;
    private volatile boolean running;
    private Thread acceptorThread;

    public RedisServer(ServerConfig config) {
        this.config = config;
        this.storageService = new StorageService();
        this.commandHandler = new CommandHandler(new CommandParser(), new CommandExecutor(storageService));
        this.decoder = new RespDecoder(config.getMaxBulkLength(),
            RespDecoder.DEFAULT_MAX_ARRAY_LENGTH, RespDecoder.DEFAULT_MAX_LINE_LENGTH);
    }

    /**
     * 서버 소켓을 바인드하고 연결 수락 스레드를 시작합니다. 바인드가 끝나면 바로 반환합니다.
     */
    public synchronized void start() throws IOException {
        if (serverSocket != null) {
            throw new IllegalStateException("Server already started");
        }
        serverSocket = createServerSocket();
        running = true;
        log.info("Redis server started on {}:{}. Waiting for connections...", config.getBindAddress(), getPort());

        acceptorThread = new Thread(this::acceptLoop, "redis-acceptor");
        acceptorThread.start();
    }

    /**
     * 실제로 바인드된 포트. 설정 포트가 0 이면 임의로 할당된 포트입니다.
     */
    public int getPort() {
        ServerSocket socket = serverSocket;
        return socket == null ? config.getPort() : socket.getLocalPort();
    }

    /**
     * 연결 수락 스레드가 끝날 때까지 기다립니다.
     */
    public void awaitTermination() throws InterruptedException {
        Thread thread = acceptorThread;
        if (thread != null) {
            thread.join();
        }
    }

    /**
     * 새 연결 수락을 멈추고 열려 있는 모든 클라이언트 연결을 닫습니다.
     */
    @Override
    public synchronized void close() {
        if (!running) {
            return;
        }
        running = false;
        try {
            serverSocket.close();
        } catch (IOException e) {
            log.warn("Error closing server socket: {}", e.getMessage());
        }
        for (ClientHandler client : activeClients) {
            client.close();
        }
        log.info("Redis server stopped ({} keys discarded)", storageService.size());
    }

    private void acceptLoop() {
        while (running) {
            try {
                Socket clientSocket = serverSocket.accept();
                clientSocket.setTcpNoDelay(true);
                log.info("Client connected: {}", clientSocket.getRemoteSocketAddress());

                // 클라이언트 연결을 별도의 스레드로 처리
                ClientHandler clientHandler = new ClientHandler(clientSocket, commandHandler, decoder,
                    config.getReadBufferSize(), activeClients);
                activeClients.add(clientHandler);
                if (!running) {
                    clientHandler.close();
                }
                new Thread(clientHandler, "client-" + clientCounter.incrementAndGet()).start();
            } catch (IOException e) {
                if (!running) {
                    break;
                }
                log.error("Error accepting client connection: {}", e.getMessage());
            }
        }
        log.info("Stopped accepting connections");
    }

    /**
     * 서버 소켓을 생성하고 설정합니다.
     */
    private ServerSocket createServerSocket() throws IOException {
        ServerSocket socket = new ServerSocket();
        // 서버 재시작 시 'Address already in use' 에러 방지
        socket.setReuseAddress(true);
        try {
            socket.bind(new InetSocketAddress(config.getBindAddress(), config.getPort()));
        } catch (IOException e) {
            socket.close();
            throw e;
        }
        return socket;
    }
}
