package protocol;

/**
 * RESP 프레임 타입과 와이어 상의 접두 바이트
 */
public enum FrameType {
    SIMPLE_STRING('+'),     // +OK\r\n
    ERROR('-'),             // -ERR msg\r\n
    BULK_STRING('$'),       // $3\r\nfoo\r\n
    NULL_BULK_STRING('$'),  // $-1\r\n
    ARRAY('*');             // *2\r\n$3\r\nGET\r\n$3\r\nfoo\r\n

    private final byte prefix;

    FrameType(char prefix) {
        this.prefix = (byte) prefix;
    }

    public byte getPrefix() {
        return prefix;
    }
}
