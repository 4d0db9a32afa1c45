package command;

import model.Bytes;
import protocol.Reply;
import service.StorageService;

public record GetCommand(Bytes key) implements Command {

    @Override
    public String name() {
        return "get";
    }

    @Override
    public Reply execute(StorageService storageService) {
        return storageService.get(key)
            .map(Reply::bulkString)
            .orElse(Reply.nil());
    }
}
