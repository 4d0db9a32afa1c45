package command;

import model.Bytes;
import protocol.Reply;
import service.StorageService;

public record EchoCommand(Bytes message) implements Command {

    @Override
    public String name() {
        return "echo";
    }

    @Override
    public Reply execute(StorageService storageService) {
        return Reply.bulkString(message);
    }
}
