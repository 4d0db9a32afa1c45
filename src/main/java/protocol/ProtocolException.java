package protocol;

import java.io.IOException;

/**
 * 바이트 스트림이 RESP 형식을 따르지 않을 때 발생합니다.
 * 이후의 프레임 경계를 신뢰할 수 없으므로 연결은 닫혀야 합니다.
 */
public class ProtocolException extends IOException {

    public ProtocolException(String message) {
        super(message);
    }
}
