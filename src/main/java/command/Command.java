package command;

import protocol.Reply;
import service.StorageService;

/**
 * 파싱이 끝난 Redis 명령어가 구현하는 공통 인터페이스
 */
public interface Command {

    /**
     * 명령어 이름 (소문자)
     */
    String name();

    /**
     * 명령어 실행 로직. 저장소 연산은 최대 한 번만 수행하며 I/O 를 하지 않습니다.
     * @param storageService 공유 저장소
     * @return 클라이언트에게 보낼 응답
     */
    Reply execute(StorageService storageService);
}
