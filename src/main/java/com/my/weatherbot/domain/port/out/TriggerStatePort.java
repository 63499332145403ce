package com.my.weatherbot.domain.port.out;

import java.util.Optional;

/**
 * 왜: 스케줄러가 재시작 후에도 기억해야 하는 작은 상태(마지막으로 발화한 특보 ID 등)를 보관하기 위함.
 */
public interface TriggerStatePort {

    Optional<String> get(String key);

    void put(String key, String value);
}
