package protocol;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import model.Bytes;

import java.util.Collections;
import java.util.List;

/**
 * 디코딩된 RESP 프로토콜 단위 하나 (요청 또는 응답).
 * 문자열 계열 프레임은 {@code data} 를, 배열 프레임은 {@code elements} 를 가집니다.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Frame {

    private static final Frame NULL_BULK = new Frame(FrameType.NULL_BULK_STRING, null, null);

    private final FrameType type;
    private final Bytes data;
    private final List<Frame> elements;

    private Frame(FrameType type, Bytes data, List<Frame> elements) {
        this.type = type;
        this.data = data;
        this.elements = elements;
    }

    public static Frame simpleString(String text) {
        return new Frame(FrameType.SIMPLE_STRING, Bytes.of(text), null);
    }

    public static Frame error(String text) {
        return new Frame(FrameType.ERROR, Bytes.of(text), null);
    }

    public static Frame bulkString(Bytes data) {
        return new Frame(FrameType.BULK_STRING, data, null);
    }

    public static Frame nullBulkString() {
        return NULL_BULK;
    }

    public static Frame array(List<Frame> elements) {
        return new Frame(FrameType.ARRAY, null, Collections.unmodifiableList(elements));
    }

    public boolean isNull() {
        return type == FrameType.NULL_BULK_STRING;
    }
}
