package protocol;

import model.Bytes;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Redis RESP 프로토콜 응답/요청의 바이트 인코딩을 담당하는 클래스
 */
public final class RespProtocol {

    private static final byte[] CRLF = {'\r', '\n'};
    private static final byte[] NULL_BULK_STRING = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);

    private RespProtocol() {
    }

    /**
     * 응답을 와이어 형식 바이트로 변환합니다.
     */
    public static byte[] encode(Reply reply) {
        return encode(reply.toFrame());
    }

    /**
     * 임의의 프레임을 와이어 형식 바이트로 변환합니다.
     */
    public static byte[] encode(Frame frame) {
        if (frame.isNull()) {
            return NULL_BULK_STRING.clone();
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(estimateSize(frame));
        write(frame, out);
        return out.toByteArray();
    }

    private static void write(Frame frame, ByteArrayOutputStream out) {
        switch (frame.getType()) {
            case SIMPLE_STRING:
            case ERROR:
                out.write(frame.getType().getPrefix());
                writeBytes(frame.getData(), out);
                out.writeBytes(CRLF);
                break;
            case BULK_STRING:
                writeHeader(FrameType.BULK_STRING, frame.getData().length(), out);
                writeBytes(frame.getData(), out);
                out.writeBytes(CRLF);
                break;
            case NULL_BULK_STRING:
                out.writeBytes(NULL_BULK_STRING);
                break;
            case ARRAY:
                writeHeader(FrameType.ARRAY, frame.getElements().size(), out);
                for (Frame element : frame.getElements()) {
                    write(element, out);
                }
                break;
            default:
                throw new IllegalStateException("Unknown frame type: " + frame.getType());
        }
    }

    private static void writeHeader(FrameType type, int length, ByteArrayOutputStream out) {
        out.write(type.getPrefix());
        out.writeBytes(Integer.toString(length).getBytes(StandardCharsets.US_ASCII));
        out.writeBytes(CRLF);
    }

    private static void writeBytes(Bytes bytes, ByteArrayOutputStream out) {
        out.writeBytes(bytes.toByteArray());
    }

    private static int estimateSize(Frame frame) {
        if (frame.getType() == FrameType.ARRAY) {
            int size = 16;
            for (Frame element : frame.getElements()) {
                size += estimateSize(element);
            }
            return size;
        }
        return frame.getData() == null ? 8 : frame.getData().length() + 16;
    }
}
