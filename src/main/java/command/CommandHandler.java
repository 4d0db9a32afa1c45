package command;

import protocol.Frame;
import protocol.Reply;

/**
 * 요청 프레임을 파싱하고 실행하여 응답을 돌려주는 핸들러 클래스.
 * 파싱 단계의 {@link CommandException} 은 실행기로 가지 않고 곧바로 에러 응답이 됩니다.
 */
public class CommandHandler {

    private final CommandParser commandParser;
    private final CommandExecutor commandExecutor;

    public CommandHandler(CommandParser commandParser, CommandExecutor commandExecutor) {
        this.commandParser = commandParser;
        this.commandExecutor = commandExecutor;
    }

    public Reply handle(Frame frame) {
        Command command;
        try {
            command = commandParser.parse(frame);
        } catch (CommandException e) {
            return e.toReply();
        }
        return commandExecutor.execute(command);
    }
}
