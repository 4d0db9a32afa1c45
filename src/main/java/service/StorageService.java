package service;

import lombok.extern.slf4j.Slf4j;
import model.Bytes;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 모든 클라이언트 연결이 공유하는 인메모리 키-값 저장소.
 * <p>
 * 단일 키 연산은 원자적이며, 서로 다른 키에 대한 get/set 은 서로를 막지 않습니다.
 * 호출자는 별도의 락 없이 여러 스레드에서 호출할 수 있습니다.
 */
@Slf4j
public class StorageService {

    // 키-값 저장소 (스레드 안전)
    private final Map<Bytes, Bytes> keyValueStore = new ConcurrentHashMap<>();

    /**
     * 키-값을 저장합니다. 기존 값은 통째로 교체됩니다.
     */
    public void set(Bytes key, Bytes value) {
        keyValueStore.put(key, value);
        log.debug("Stored: {} ({} bytes)", key, value.length());
    }

    /**
     * 키에 해당하는 값을 가져옵니다. 키가 없으면 빈 Optional 을 반환합니다.
     */
    public Optional<Bytes> get(Bytes key) {
        Bytes value = keyValueStore.get(key);
        log.debug("Retrieved: {} -> {}", key, value == null ? "(nil)" : value.length() + " bytes");
        return Optional.ofNullable(value);
    }

    /**
     * 저장된 키의 개수를 반환합니다.
     */
    public int size() {
        return keyValueStore.size();
    }
}
