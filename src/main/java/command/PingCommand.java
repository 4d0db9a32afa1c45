package command;

import model.Bytes;
import protocol.Reply;
import service.StorageService;

/**
 * 인자가 없으면 PONG, 있으면 ECHO 와 같이 인자를 그대로 돌려줍니다.
 */
public record PingCommand(Bytes message) implements Command {

    public PingCommand() {
        this(null);
    }

    @Override
    public String name() {
        return "ping";
    }

    @Override
    public Reply execute(StorageService storageService) {
        if (message == null) {
            return Reply.PONG;
        }
        return Reply.bulkString(message);
    }
}
