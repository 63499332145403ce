package com.my.weatherbot.domain.port.in;

import com.my.weatherbot.domain.model.FiringEvent;

import java.time.OffsetDateTime;
import java.util.List;

public interface DetectFiringsUseCase {
    List<FiringEvent> tick(OffsetDateTime now);

    /**
     * 발송 배치가 발화를 받아들인 뒤에 호출한다. 조건부 발화의 상태는 이때 기록된다.
     */
    void acknowledge(FiringEvent event);
}
