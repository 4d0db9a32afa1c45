package config;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import protocol.RespDecoder;

/**
 * Redis 서버 설정을 관리하는 클래스
 */
@Slf4j
@Getter
@Setter
public class ServerConfig {
    private int port = 6379;
    private String bindAddress = "127.0.0.1";
    private long maxBulkLength = RespDecoder.DEFAULT_MAX_BULK_LENGTH;
    private int readBufferSize = 4096;

    /**
     * 명령행 인수를 파싱하여 설정을 업데이트합니다.
     * 잘못된 값은 경고만 남기고 기본값을 유지합니다.
     */
    public void parseCommandLineArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--port":
                    if (i + 1 < args.length) {
                        String value = args[++i];
                        Integer parsed = parseInRange(value, 0, 65535);
                        if (parsed != null) {
                            this.port = parsed;
                            log.info("Port set from command line: {}", this.port);
                        } else {
                            log.warn("Invalid port number: {}", value);
                        }
                    }
                    break;
                case "--bind":
                    if (i + 1 < args.length) {
                        this.bindAddress = args[++i];
                        log.info("Bind address set from command line: {}", this.bindAddress);
                    }
                    break;
                case "--max-bulk-length":
                    if (i + 1 < args.length) {
                        String value = args[++i];
                        Integer parsed = parseInRange(value, 1, (int) RespDecoder.MAX_BULK_LENGTH_LIMIT);
                        if (parsed != null) {
                            this.maxBulkLength = parsed;
                            log.info("Max bulk length set from command line: {}", this.maxBulkLength);
                        } else {
                            log.warn("Invalid max bulk length: {}", value);
                        }
                    }
                    break;
                case "--read-buffer-size":
                    if (i + 1 < args.length) {
                        String value = args[++i];
                        Integer parsed = parseInRange(value, 1, 16 * 1024 * 1024);
                        if (parsed != null) {
                            this.readBufferSize = parsed;
                            log.info("Read buffer size set from command line: {}", this.readBufferSize);
                        } else {
                            log.warn("Invalid read buffer size: {}", value);
                        }
                    }
                    break;
                default:
                    log.warn("Ignoring unknown argument: {}", args[i]);
                    break;
            }
        }
    }

    private static Integer parseInRange(String value, int min, int max) {
        try {
            int parsed = Integer.parseInt(value);
            return parsed >= min && parsed <= max ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
