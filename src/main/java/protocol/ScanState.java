package protocol;

/**
 * 버퍼 앞쪽의 미완성 프레임을 어디까지 검사했는지 기록합니다.
 * 다음 {@link RespDecoder#decode} 호출은 처음부터가 아니라 {@link #position} 에서 이어서 검사합니다.
 */
final class ScanState {

    /** 다음에 검사할 항목의 시작 위치 (버퍼의 읽기 위치 기준) */
    int position;
    /** 열려 있는 배열마다 남은 원소 수 */
    final long[] remaining = new long[RespDecoder.MAX_NESTING_DEPTH];
    int depth;
    boolean complete;

    void open(long count) {
        remaining[depth++] = count;
    }

    /**
     * 항목 하나가 끝났음을 기록합니다. 다 채워진 배열은 닫고, 최상위까지 닫히면 프레임이 완성됩니다.
     */
    void completeItem() {
        while (depth > 0) {
            if (--remaining[depth - 1] > 0) {
                return;
            }
            depth--;
        }
        complete = true;
    }

    void reset() {
        position = 0;
        depth = 0;
        complete = false;
    }
}
