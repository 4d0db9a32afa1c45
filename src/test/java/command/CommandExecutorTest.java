package command;

import model.Bytes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import protocol.Reply;
import service.StorageService;

import static org.assertj.core.api.Assertions.assertThat;

class CommandExecutorTest {

    private StorageService storageService;
    private CommandExecutor executor;

    @BeforeEach
    void setUp() {
        storageService = new StorageService();
        executor = new CommandExecutor(storageService);
    }

    @Test
    void shouldReturnNilForMissingKey() {
        assertThat(executor.execute(new GetCommand(Bytes.of("missing")))).isEqualTo(Reply.nil());
    }

    @Test
    void shouldStoreValueAndReplyOkOnSet() {
        Reply reply = executor.execute(new SetCommand(Bytes.of("foo"), Bytes.of("bar")));

        assertThat(reply).isEqualTo(Reply.OK);
        assertThat(storageService.get(Bytes.of("foo"))).contains(Bytes.of("bar"));
        assertThat(executor.execute(new GetCommand(Bytes.of("foo")))).isEqualTo(Reply.bulkString(Bytes.of("bar")));
    }

    @Test
    void shouldReplyPongToPingWithoutMessage() {
        assertThat(executor.execute(new PingCommand())).isEqualTo(Reply.PONG);
    }

    @Test
    void shouldReturnPingAndEchoArgumentUnchanged() {
        Bytes message = Bytes.of(new byte[]{'h', 0, '\r', '\n'});

        assertThat(executor.execute(new PingCommand(message))).isEqualTo(Reply.bulkString(message));
        assertThat(executor.execute(new EchoCommand(message))).isEqualTo(Reply.bulkString(message));
        assertThat(executor.execute(new EchoCommand(Bytes.EMPTY))).isEqualTo(Reply.bulkString(Bytes.EMPTY));
    }

    @Test
    void shouldLeaveStoreUntouchedOnPingAndEcho() {
        executor.execute(new PingCommand(Bytes.of("foo")));
        executor.execute(new EchoCommand(Bytes.of("foo")));

        assertThat(storageService.size()).isZero();
    }
}
