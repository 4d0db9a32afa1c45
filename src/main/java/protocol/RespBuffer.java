package protocol;

import model.Bytes;

/**
 * 연결 하나가 소유하는 가변 크기 바이트 누적 버퍼.
 * 소켓에서 읽은 바이트를 {@link #append} 로 쌓고, 디코더가 완성된 프레임만큼 {@link #skip} 으로 소비합니다.
 * 인덱스 인자는 모두 아직 소비되지 않은 첫 바이트를 기준으로 한 상대 위치입니다.
 */
public class RespBuffer {

    private static final int DEFAULT_CAPACITY = 4096;
    static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

    // 디코더가 미완성 프레임을 어디까지 훑었는지. 소비(skip) 시 초기화
    private final ScanState scanState = new ScanState();
    private byte[] buffer;
    private int readIndex;
    private int writeIndex;

    public RespBuffer() {
        this(DEFAULT_CAPACITY);
    }

    public RespBuffer(int initialCapacity) {
        this.buffer = new byte[Math.max(16, initialCapacity)];
    }

    public void append(byte[] src) {
        append(src, 0, src.length);
    }

    public void append(byte[] src, int offset, int length) {
        ensureWritable(length);
        System.arraycopy(src, offset, buffer, writeIndex, length);
        writeIndex += length;
    }

    public int readableBytes() {
        return writeIndex - readIndex;
    }

    public boolean isEmpty() {
        return readIndex == writeIndex;
    }

    public byte getByte(int index) {
        checkIndex(index, 1);
        return buffer[readIndex + index];
    }

    /**
     * [from, limit) 구간에서 CRLF 의 시작 위치를 찾습니다. 없으면 -1.
     */
    public int indexOfCrlf(int from, int limit) {
        int end = Math.min(limit, readableBytes()) - 1;
        for (int i = from; i < end; i++) {
            if (buffer[readIndex + i] == '\r' && buffer[readIndex + i + 1] == '\n') {
                return i;
            }
        }
        return -1;
    }

    public Bytes slice(int index, int length) {
        checkIndex(index, length);
        return Bytes.of(buffer, readIndex + index, length);
    }

    /**
     * 앞에서부터 n 바이트를 소비합니다.
     */
    public void skip(int n) {
        checkIndex(0, n);
        readIndex += n;
        scanState.reset();
        if (readIndex == writeIndex) {
            readIndex = 0;
            writeIndex = 0;
        }
    }

    ScanState scanState() {
        return scanState;
    }

    private void ensureWritable(int length) {
        if (buffer.length - writeIndex >= length) {
            return;
        }
        int readable = readableBytes();
        if (buffer.length - readable >= length && readIndex > 0) {
            // 이미 소비된 앞부분을 비워서 공간 확보
            System.arraycopy(buffer, readIndex, buffer, 0, readable);
        } else {
            long required = (long) readable + length;
            if (required > MAX_CAPACITY) {
                throw new IllegalStateException("buffer cannot grow beyond " + MAX_CAPACITY + " bytes");
            }
            int newCapacity = buffer.length;
            while (newCapacity < required) {
                newCapacity = (int) Math.min((long) newCapacity * 2, MAX_CAPACITY);
            }
            byte[] grown = new byte[newCapacity];
            System.arraycopy(buffer, readIndex, grown, 0, readable);
            buffer = grown;
        }
        readIndex = 0;
        writeIndex = readable;
    }

    private void checkIndex(int index, int length) {
        if (index < 0 || length < 0 || index + length > readableBytes()) {
            throw new IndexOutOfBoundsException(
                "index " + index + ", length " + length + ", readable " + readableBytes());
        }
    }
}
