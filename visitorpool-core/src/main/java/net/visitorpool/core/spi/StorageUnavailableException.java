package net.visitorpool.core.spi;

/** 저장소에 닿을 수 없음. 풀 불변식을 평가할 수 없으므로 호출 경로 전체를 실패시킨다. */
public class StorageUnavailableException extends RuntimeException {
    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
