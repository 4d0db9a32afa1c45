package model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 불변 바이트 시퀀스. 키와 값 모두에 사용되며 내용 기반으로 equals/hashCode 를 계산합니다.
 */
public final class Bytes {

    public static final Bytes EMPTY = new Bytes(new byte[0]);

    private final byte[] data;
    private int hash;

    private Bytes(byte[] data) {
        this.data = data;
    }

    /**
     * 주어진 배열을 복사하여 생성합니다.
     */
    public static Bytes of(byte[] data) {
        return data.length == 0 ? EMPTY : new Bytes(data.clone());
    }

    public static Bytes of(byte[] data, int offset, int length) {
        return length == 0 ? EMPTY : new Bytes(Arrays.copyOfRange(data, offset, offset + length));
    }

    public static Bytes of(String value) {
        return value.isEmpty() ? EMPTY : new Bytes(value.getBytes(StandardCharsets.UTF_8));
    }

    public int length() {
        return data.length;
    }

    public byte byteAt(int index) {
        return data[index];
    }

    /**
     * 내부 배열의 복사본을 반환합니다.
     */
    public byte[] toByteArray() {
        return data.clone();
    }

    public String asString() {
        return new String(data, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Bytes)) return false;
        return Arrays.equals(data, ((Bytes) o).data);
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0 && data.length > 0) {
            h = Arrays.hashCode(data);
            hash = h;
        }
        return h;
    }

    @Override
    public String toString() {
        return asString();
    }
}
