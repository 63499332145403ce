package com.my.weatherbot.domain.port.in;

import com.my.weatherbot.domain.model.DispatchReport;
import com.my.weatherbot.domain.model.FiringEvent;

/**
 * 왜: 발화 하나를 구독자별 발송으로 펼치는 진입점을 하나로 모으기 위함.
 */
public interface DispatchNotificationUseCase {
    DispatchReport dispatch(FiringEvent event);
}
