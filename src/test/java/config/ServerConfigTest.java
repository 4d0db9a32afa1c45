package config;

import org.junit.jupiter.api.Test;
import protocol.RespDecoder;

import static org.assertj.core.api.Assertions.assertThat;

class ServerConfigTest {

    @Test
    void shouldUseRedisDefaults() {
        ServerConfig config = new ServerConfig();

        assertThat(config.getPort()).isEqualTo(6379);
        assertThat(config.getBindAddress()).isEqualTo("127.0.0.1");
        assertThat(config.getMaxBulkLength()).isEqualTo(RespDecoder.DEFAULT_MAX_BULK_LENGTH);
        assertThat(config.getReadBufferSize()).isEqualTo(4096);
    }

    @Test
    void shouldOverrideDefaultsFromCommandLine() {
        ServerConfig config = new ServerConfig();

        config.parseCommandLineArgs(new String[]{
            "--port", "7000", "--bind", "0.0.0.0", "--max-bulk-length", "1024", "--read-buffer-size", "64"});

        assertThat(config.getPort()).isEqualTo(7000);
        assertThat(config.getBindAddress()).isEqualTo("0.0.0.0");
        assertThat(config.getMaxBulkLength()).isEqualTo(1024);
        assertThat(config.getReadBufferSize()).isEqualTo(64);
    }

    @Test
    void shouldKeepDefaultsForInvalidValues() {
        ServerConfig config = new ServerConfig();

        config.parseCommandLineArgs(new String[]{"--port", "http", "--read-buffer-size", "0", "--port", "70000"});

        assertThat(config.getPort()).isEqualTo(6379);
        assertThat(config.getReadBufferSize()).isEqualTo(4096);
    }

    @Test
    void shouldIgnoreUnknownArguments() {
        ServerConfig config = new ServerConfig();

        config.parseCommandLineArgs(new String[]{"--dir", "/tmp", "--port", "6380"});

        assertThat(config.getPort()).isEqualTo(6380);
    }

    @Test
    void shouldKeepDefaultBulkLimitWhenValueExceedsMaximum() {
        ServerConfig config = new ServerConfig();

        config.parseCommandLineArgs(new String[]{"--max-bulk-length", "2147483645"});

        assertThat(config.getMaxBulkLength()).isEqualTo(RespDecoder.DEFAULT_MAX_BULK_LENGTH);
    }

    @Test
    void shouldAcceptBulkLimitAtMaximum() {
        ServerConfig config = new ServerConfig();

        config.parseCommandLineArgs(new String[]{"--max-bulk-length", String.valueOf(RespDecoder.MAX_BULK_LENGTH_LIMIT)});

        assertThat(config.getMaxBulkLength()).isEqualTo(RespDecoder.MAX_BULK_LENGTH_LIMIT);
    }
}
