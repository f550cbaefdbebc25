package com.xingest.core.cache;

/** 캐시 저장소 오작동. 오케스트레이터는 잡지 않고 그대로 올려보낸다. */
public class CacheException extends RuntimeException {
    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
