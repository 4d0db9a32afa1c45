package protocol;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link RespBuffer} 에서 RESP 프레임을 하나씩 디코딩합니다.
 * <p>
 * 먼저 할당 없이 프레임이 완성됐는지만 검사하고, 완성된 경우에만 {@link Frame} 을 만듭니다.
 * 검사 진행 상황은 버퍼에 남으므로 조각난 요청도 도착한 바이트만큼만 새로 검사합니다.
 * 완성된 프레임이 아직 없으면 아무것도 소비하지 않고 {@link Optional#empty()} 를 반환합니다.
 */
public class RespDecoder {

    public static final long DEFAULT_MAX_BULK_LENGTH = 512L * 1024 * 1024;
    public static final int DEFAULT_MAX_ARRAY_LENGTH = 1024 * 1024;
    public static final int DEFAULT_MAX_LINE_LENGTH = 64 * 1024;
    /** 설정으로 올릴 수 있는 bulk 길이의 상한 */
    public static final long MAX_BULK_LENGTH_LIMIT = DEFAULT_MAX_BULK_LENGTH;
    /** 프레임 하나가 차지할 수 있는 최대 바이트 수. {@link RespBuffer} 가 담을 수 있는 크기 안쪽 */
    public static final long MAX_FRAME_LENGTH = 1L << 30;
    static final int MAX_NESTING_DEPTH = 32;

    private final long maxBulkLength;
    private final int maxArrayLength;
    private final int maxLineLength;

    public RespDecoder() {
        this(DEFAULT_MAX_BULK_LENGTH, DEFAULT_MAX_ARRAY_LENGTH, DEFAULT_MAX_LINE_LENGTH);
    }

    public RespDecoder(long maxBulkLength, int maxArrayLength, int maxLineLength) {
        this.maxBulkLength = Math.min(maxBulkLength, MAX_BULK_LENGTH_LIMIT);
        this.maxArrayLength = maxArrayLength;
        this.maxLineLength = maxLineLength;
    }

    /**
     * 프레임 하나를 디코딩합니다.
     *
     * @return 완성된 프레임, 또는 데이터가 더 필요하면 빈 Optional
     * @throws ProtocolException 바이트 스트림이 RESP 형식이 아닐 때
     */
    public Optional<Frame> decode(RespBuffer buffer) throws ProtocolException {
        ScanState state = buffer.scanState();
        while (!state.complete) {
            if (!scanNext(buffer, state)) {
                return Optional.empty();
            }
        }
        int frameLength = state.position;
        Frame frame = build(buffer, new Cursor());
        buffer.skip(frameLength);
        return Optional.of(frame);
    }

    /**
     * 다음 항목 하나를 검사합니다. 항목이 아직 다 도착하지 않았으면 상태를 그대로 두고 false 를 반환합니다.
     */
    private boolean scanNext(RespBuffer buffer, ScanState state) throws ProtocolException {
        int position = state.position;
        if (position >= buffer.readableBytes()) {
            return false;
        }
        byte prefix = buffer.getByte(position);
        switch (prefix) {
            case '+':
            case '-': {
                int crlf = findLineEnd(buffer, position);
                if (crlf < 0) {
                    return false;
                }
                state.position = crlf + 2;
                state.completeItem();
                return true;
            }
            case '$':
                return scanBulkString(buffer, state, position);
            case '*': {
                if (state.depth >= MAX_NESTING_DEPTH) {
                    throw new ProtocolException("arrays nested too deeply");
                }
                int crlf = findLineEnd(buffer, position);
                if (crlf < 0) {
                    return false;
                }
                long count = parseLength(buffer, position + 1, crlf, "multibulk");
                if (count < 0 || count > maxArrayLength) {
                    throw new ProtocolException("invalid multibulk length " + count);
                }
                state.position = crlf + 2;
                if (count == 0) {
                    state.completeItem();
                } else {
                    state.open(count);
                }
                return true;
            }
            default:
                throw new ProtocolException("unexpected type byte '" + printable(prefix) + "'");
        }
    }

    private boolean scanBulkString(RespBuffer buffer, ScanState state, int position) throws ProtocolException {
        int crlf = findLineEnd(buffer, position);
        if (crlf < 0) {
            return false;
        }
        long length = parseLength(buffer, position + 1, crlf, "bulk");
        int dataStart = crlf + 2;
        if (length == -1) {
            state.position = dataStart;
            state.completeItem();
            return true;
        }
        if (length < 0 || length > maxBulkLength) {
            throw new ProtocolException("invalid bulk length " + length);
        }
        long frameEnd = dataStart + length + 2;
        if (frameEnd > MAX_FRAME_LENGTH) {
            throw new ProtocolException("frame larger than " + MAX_FRAME_LENGTH + " bytes");
        }

        int end = (int) (dataStart + length);
        int available = buffer.readableBytes();
        // 선언된 길이만큼 받은 뒤에는 바로 CRLF 가 와야 함
        if (available > end && buffer.getByte(end) != '\r') {
            throw new ProtocolException("bulk string does not match declared length " + length);
        }
        if (available > end + 1 && buffer.getByte(end + 1) != '\n') {
            throw new ProtocolException("bulk string does not match declared length " + length);
        }
        if (available < end + 2) {
            return false;
        }
        state.position = end + 2;
        state.completeItem();
        return true;
    }

    /**
     * 검사를 통과한 프레임을 버퍼 앞에서부터 만듭니다.
     */
    private Frame build(RespBuffer buffer, Cursor cursor) throws ProtocolException {
        int headerStart = cursor.position + 1;
        byte prefix = buffer.getByte(cursor.position);
        int crlf = buffer.indexOfCrlf(headerStart, buffer.readableBytes());
        cursor.position = crlf + 2;
        switch (prefix) {
            case '+':
                return Frame.simpleString(buffer.slice(headerStart, crlf - headerStart).asString());
            case '-':
                return Frame.error(buffer.slice(headerStart, crlf - headerStart).asString());
            case '$': {
                int length = (int) parseLength(buffer, headerStart, crlf, "bulk");
                if (length == -1) {
                    return Frame.nullBulkString();
                }
                Frame frame = Frame.bulkString(buffer.slice(cursor.position, length));
                cursor.position += length + 2;
                return frame;
            }
            default: {
                int count = (int) parseLength(buffer, headerStart, crlf, "multibulk");
                List<Frame> elements = new ArrayList<>(count);
                for (int i = 0; i < count; i++) {
                    elements.add(build(buffer, cursor));
                }
                return Frame.array(elements);
            }
        }
    }

    /**
     * 접두 바이트 다음부터 CRLF 의 위치를 찾습니다. 아직 없으면 -1.
     */
    private int findLineEnd(RespBuffer buffer, int position) throws ProtocolException {
        int from = position + 1;
        int crlf = buffer.indexOfCrlf(from, from + maxLineLength + 2);
        if (crlf < 0 && buffer.readableBytes() - from >= maxLineLength + 2) {
            throw new ProtocolException("line too long");
        }
        return crlf;
    }

    private static long parseLength(RespBuffer buffer, int from, int to, String kind) throws ProtocolException {
        boolean negative = to > from && buffer.getByte(from) == '-';
        int i = negative ? from + 1 : from;
        // 18 자리까지만 허용하므로 long 범위를 넘지 않음
        if (to == i || to - i > 18) {
            throw invalidLength(buffer, from, to, kind);
        }
        long value = 0;
        for (; i < to; i++) {
            byte b = buffer.getByte(i);
            if (b < '0' || b > '9') {
                throw invalidLength(buffer, from, to, kind);
            }
            value = value * 10 + (b - '0');
        }
        return negative ? -value : value;
    }

    private static ProtocolException invalidLength(RespBuffer buffer, int from, int to, String kind) {
        return new ProtocolException("invalid " + kind + " length '" + buffer.slice(from, to - from) + "'");
    }

    private static String printable(byte b) {
        return b >= 0x20 && b < 0x7f ? String.valueOf((char) b) : String.format("\\x%02x", b);
    }

    private static final class Cursor {
        int position;
    }
}
