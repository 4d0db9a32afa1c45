package protocol;

import model.Bytes;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RespProtocolTest {

    private static String encoded(Reply reply) {
        return new String(RespProtocol.encode(reply), StandardCharsets.UTF_8);
    }

    @Test
    void shouldEncodeSimpleStrings() {
        assertThat(encoded(Reply.OK)).isEqualTo("+OK\r\n");
        assertThat(encoded(Reply.PONG)).isEqualTo("+PONG\r\n");
    }

    @Test
    void shouldEncodeNilAsNullBulkString() {
        assertThat(encoded(Reply.nil())).isEqualTo("$-1\r\n");
    }

    @Test
    void shouldEncodeBulkStringWithByteLength() {
        assertThat(encoded(Reply.bulkString(Bytes.of("bar")))).isEqualTo("$3\r\nbar\r\n");
        assertThat(encoded(Reply.bulkString(Bytes.EMPTY))).isEqualTo("$0\r\n\r\n");
        // 'é' 는 UTF-8 로 2 바이트
        assertThat(encoded(Reply.bulkString(Bytes.of("héllo")))).isEqualTo("$6\r\nhéllo\r\n");
    }

    @Test
    void shouldEncodeErrors() {
        assertThat(encoded(Reply.error("ERR unknown command 'FOO'"))).isEqualTo("-ERR unknown command 'FOO'\r\n");
    }

    @Test
    void shouldStripLineBreaksFromErrorText() {
        assertThat(encoded(Reply.error("ERR bad\r\nname"))).isEqualTo("-ERR bad  name\r\n");
    }

    @Test
    void shouldRefuseSimpleStringWithLineBreak() {
        assertThatThrownBy(() -> Reply.simpleString("O\r\nK"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldEncodeRequestFrameAsArrayOfBulkStrings() {
        byte[] bytes = RespProtocol.encode(Frames.command("SET", "foo", "bar"));

        assertThat(new String(bytes, StandardCharsets.UTF_8))
            .isEqualTo("*3\r\n$3\r\nSET\r\n$3\r\nfoo\r\n$3\r\nbar\r\n");
    }

    @Test
    void shouldProduceBytesTheDecoderAccepts() throws ProtocolException {
        byte[] value = {0, '\r', '\n', (byte) 0x80};
        RespBuffer buffer = new RespBuffer();
        buffer.append(RespProtocol.encode(Reply.bulkString(Bytes.of(value))));

        Frame frame = new RespDecoder().decode(buffer).orElseThrow();

        assertThat(frame.getData().toByteArray()).isEqualTo(value);
    }
}
