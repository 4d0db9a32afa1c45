package command;

import model.Bytes;
import protocol.Reply;
import service.StorageService;

public record SetCommand(Bytes key, Bytes value) implements Command {

    @Override
    public String name() {
        return "set";
    }

    @Override
    public Reply execute(StorageService storageService) {
        storageService.set(key, value);
        return Reply.OK;
    }
}
