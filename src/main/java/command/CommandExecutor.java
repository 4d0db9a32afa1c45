package command;

import lombok.extern.slf4j.Slf4j;
import protocol.Reply;
import service.StorageService;

/**
 * 파싱된 명령어를 공유 저장소에 대해 실행하고 응답을 만듭니다.
 */
@Slf4j
public class CommandExecutor {

    private final StorageService storageService;

    public CommandExecutor(StorageService storageService) {
        this.storageService = storageService;
    }

    public Reply execute(Command command) {
        Reply reply = command.execute(storageService);
        log.debug("Executed {} -> {}", command.name(), reply);
        return reply;
    }
}
