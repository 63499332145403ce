package com.my.weatherbot.domain.port.out;

import com.my.weatherbot.domain.model.CallResult;
import com.my.weatherbot.domain.model.Payload;

import java.util.UUID;

/**
 * 왜: 푸시 API 호출을 분리하고 결과를 일시/영구 실패로 구분해 돌려받기 위함.
 * 같은 retryKey로 반복 호출해도 플랫폼이 한 번만 전달하도록 요청한다.
 */
public interface DeliveryGatewayPort {

    /**
     * @return 성공 시 플랫폼 요청 ID(없으면 빈 문자열)
     */
    CallResult<String> send(String subscriberId, Payload payload, UUID retryKey);
}
