package com.my.weatherbot.domain.port.in;

import com.my.weatherbot.domain.model.JobType;
import com.my.weatherbot.domain.model.Subscriber;

/**
 * 왜: 메뉴/핸들러 계층이 구독 설정을 바꾸는 유일한 진입점. 반환값은 변경 직후의 설정이다.
 */
public interface UpdateSubscriptionUseCase {

    Subscriber setEnabled(String subscriberId, JobType jobType, boolean enabled);

    Subscriber setCity(String subscriberId, String city);

    Subscriber settingsOf(String subscriberId);
}
