package protocol;

import lombok.EqualsAndHashCode;
import model.Bytes;

/**
 * 명령어 실행 결과. SimpleString, BulkString, Nil, Error 중 하나이며
 * {@link RespProtocol#encode(Reply)} 로 와이어 형식으로 변환됩니다.
 */
@EqualsAndHashCode
public final class Reply {

    public static final Reply OK = simpleString("OK");
    public static final Reply PONG = simpleString("PONG");
    public static final Reply NIL = new Reply(Frame.nullBulkString());

    private final Frame frame;

    private Reply(Frame frame) {
        this.frame = frame;
    }

    /**
     * 단순 문자열 응답. CR/LF 를 포함할 수 없습니다.
     */
    public static Reply simpleString(String text) {
        if (text.indexOf('\r') >= 0 || text.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("simple string must not contain CR or LF");
        }
        return new Reply(Frame.simpleString(text));
    }

    public static Reply bulkString(Bytes value) {
        return new Reply(Frame.bulkString(value));
    }

    public static Reply nil() {
        return NIL;
    }

    /**
     * 에러 응답. 메시지 안의 CR/LF 는 공백으로 치환됩니다.
     */
    public static Reply error(String message) {
        return new Reply(Frame.error(message.replace('\r', ' ').replace('\n', ' ')));
    }

    public FrameType getType() {
        return frame.getType();
    }

    public boolean isError() {
        return frame.getType() == FrameType.ERROR;
    }

    Frame toFrame() {
        return frame;
    }

    @Override
    public String toString() {
        switch (frame.getType()) {
            case SIMPLE_STRING:
                return "+" + frame.getData();
            case ERROR:
                return "-" + frame.getData();
            case NULL_BULK_STRING:
                return "(nil)";
            default:
                return "\"" + frame.getData() + "\"";
        }
    }
}
