package server;

import command.CommandHandler;
import lombok.extern.slf4j.Slf4j;
import protocol.Frame;
import protocol.ProtocolException;
import protocol.Reply;
import protocol.RespBuffer;
import protocol.RespDecoder;
import protocol.RespProtocol;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketException;
import java.util.Optional;
import java.util.Set;

/**
 * 클라이언트 연결 하나를 처음부터 끝까지 처리합니다.
 * <p>
 * 읽은 바이트를 연결 전용 버퍼에 쌓고, 완성된 프레임을 도착 순서대로 처리해 응답을 씁니다.
 * 명령어 오류는 에러 응답 후 계속 진행하지만, 프로토콜 오류가 나면 에러 응답을 보낸 뒤 연결을 닫습니다.
 */
@Slf4j
public class ClientHandler implements Runnable {

    private final Socket clientSocket;
    private final CommandHandler commandHandler;
    private final RespDecoder decoder;
    private final int readBufferSize;
    private final Set<ClientHandler> activeClients;
    private final RespBuffer buffer = new RespBuffer();

    public ClientHandler(Socket clientSocket, CommandHandler commandHandler, RespDecoder decoder,
                         int readBufferSize, Set<ClientHandler> activeClients) {
        this.clientSocket = clientSocket;
        this.commandHandler = commandHandler;
        this.decoder = decoder;
        this.readBufferSize = readBufferSize;
        this.activeClients = activeClients;
    }

    @Override
    public void run() {
        String clientAddress = String.valueOf(clientSocket.getRemoteSocketAddress());

        try (InputStream inputStream = clientSocket.getInputStream();
             OutputStream outputStream = new BufferedOutputStream(clientSocket.getOutputStream())) {

            handleClientLoop(inputStream, outputStream, clientAddress);

        } catch (SocketException e) {
            log.debug("Client disconnected: {} ({})", clientAddress, e.getMessage());
        } catch (IOException e) {
            log.warn("Error handling client {}: {}", clientAddress, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error handling client {}", clientAddress, e);
        } finally {
            activeClients.remove(this);
            close();
        }

        log.info("Client connection closed: {}", clientAddress);
    }

    /**
     * 소켓을 닫습니다. 다른 스레드에서 호출하면 블로킹 중인 읽기가 깨어나 루프가 끝납니다.
     */
    public void close() {
        if (clientSocket.isClosed()) {
            return;
        }
        try {
            clientSocket.close();
        } catch (IOException e) {
            log.warn("Error closing client socket {}: {}", clientSocket.getRemoteSocketAddress(), e.getMessage());
        }
    }

    private void handleClientLoop(InputStream inputStream, OutputStream outputStream, String clientAddress)
            throws IOException {
        byte[] chunk = new byte[readBufferSize];
        int read;
        while ((read = inputStream.read(chunk)) != -1) {
            buffer.append(chunk, 0, read);
            try {
                processFrames(outputStream, clientAddress);
            } catch (ProtocolException e) {
                log.warn("Protocol error from client {}: {}", clientAddress, e.getMessage());
                sendResponse(outputStream, Reply.error("ERR Protocol error: " + e.getMessage()));
                return;
            }
        }
        log.debug("Client closed the connection: {}", clientAddress);
    }

    /**
     * 버퍼에 있는 완성된 프레임을 모두 처리하고, 더 이상 없을 때 한 번에 flush 합니다.
     */
    private void processFrames(OutputStream outputStream, String clientAddress) throws IOException {
        Optional<Frame> frame;
        while ((frame = decoder.decode(buffer)).isPresent()) {
            Reply reply = dispatch(frame.get(), clientAddress);
            outputStream.write(RespProtocol.encode(reply));
        }
        outputStream.flush();
    }

    private Reply dispatch(Frame frame, String clientAddress) {
        log.debug("Received from {}: {}", clientAddress, frame);
        try {
            return commandHandler.handle(frame);
        } catch (RuntimeException e) {
            log.error("Error processing command from client {}", clientAddress, e);
            return Reply.error("ERR internal server error");
        }
    }

    /**
     * 클라이언트에게 응답을 전송합니다.
     */
    private void sendResponse(OutputStream outputStream, Reply reply) throws IOException {
        outputStream.write(RespProtocol.encode(reply));
        outputStream.flush();
    }
}
