package command;

import protocol.Reply;

/**
 * 프레임은 올바르지만 명령어로 해석할 수 없을 때 발생합니다.
 * 요청 단위로 에러 응답이 되며 연결은 계속 유지됩니다.
 */
public class CommandException extends Exception {

    public CommandException(String message) {
        super(message);
    }

    public Reply toReply() {
        return Reply.error("ERR " + getMessage());
    }
}
