package command;

import model.Bytes;
import org.junit.jupiter.api.Test;
import protocol.Frame;
import protocol.Frames;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandParserTest {

    private final CommandParser parser = new CommandParser();

    @Test
    void shouldParseEachSupportedCommand() throws CommandException {
        assertThat(parser.parse(Frames.command("GET", "foo"))).isEqualTo(new GetCommand(Bytes.of("foo")));
        assertThat(parser.parse(Frames.command("SET", "foo", "bar")))
            .isEqualTo(new SetCommand(Bytes.of("foo"), Bytes.of("bar")));
        assertThat(parser.parse(Frames.command("PING"))).isEqualTo(new PingCommand());
        assertThat(parser.parse(Frames.command("PING", "hi"))).isEqualTo(new PingCommand(Bytes.of("hi")));
        assertThat(parser.parse(Frames.command("ECHO", ""))).isEqualTo(new EchoCommand(Bytes.EMPTY));
    }

    @Test
    void shouldMatchCommandNamesCaseInsensitively() throws CommandException {
        assertThat(parser.parse(Frames.command("get", "foo"))).isInstanceOf(GetCommand.class);
        assertThat(parser.parse(Frames.command("gEt", "foo"))).isInstanceOf(GetCommand.class);
        assertThat(parser.parse(Frames.command("Ping"))).isInstanceOf(PingCommand.class);
    }

    @Test
    void shouldRejectUnknownCommand() {
        assertThatThrownBy(() -> parser.parse(Frames.command("FOO")))
            .isInstanceOfSatisfying(UnknownCommandException.class,
                e -> assertThat(e.getCommandName()).isEqualTo("FOO"))
            .isNotInstanceOf(WrongArityException.class)
            .hasMessage("unknown command 'FOO'");
    }

    @Test
    void shouldReportExpectedAndActualArgumentCount() {
        assertThatThrownBy(() -> parser.parse(Frames.command("GET")))
            .isInstanceOfSatisfying(WrongArityException.class, e -> {
                assertThat(e.getCommandName()).isEqualTo("get");
                assertThat(e.getMinArgs()).isEqualTo(1);
                assertThat(e.getMaxArgs()).isEqualTo(1);
                assertThat(e.getActualArgs()).isZero();
            })
            .hasMessage("wrong number of arguments for 'get' command (expected 1, got 0)");
    }

    @Test
    void shouldEnforceArityOfEveryCommand() {
        assertThatThrownBy(() -> parser.parse(Frames.command("GET", "a", "b")))
            .isInstanceOf(WrongArityException.class);
        assertThatThrownBy(() -> parser.parse(Frames.command("SET", "foo")))
            .hasMessage("wrong number of arguments for 'set' command (expected 2, got 1)");
        assertThatThrownBy(() -> parser.parse(Frames.command("SET", "foo", "bar", "px", "100")))
            .isInstanceOf(WrongArityException.class);
        assertThatThrownBy(() -> parser.parse(Frames.command("PING", "a", "b")))
            .hasMessage("wrong number of arguments for 'ping' command (expected 0 or 1, got 2)");
        assertThatThrownBy(() -> parser.parse(Frames.command("ECHO")))
            .isInstanceOf(WrongArityException.class);
    }

    @Test
    void shouldRejectFramesThatAreNotArraysOfBulkStrings() {
        assertThatThrownBy(() -> parser.parse(Frame.simpleString("PING")))
            .isExactlyInstanceOf(CommandException.class)
            .hasMessageContaining("expected array of bulk strings");
        assertThatThrownBy(() -> parser.parse(Frame.array(List.of(Frame.bulkString(Bytes.of("GET")),
            Frame.nullBulkString()))))
            .isExactlyInstanceOf(CommandException.class);
        assertThatThrownBy(() -> parser.parse(Frame.array(List.of())))
            .isExactlyInstanceOf(CommandException.class)
            .hasMessage("empty command");
    }
}
