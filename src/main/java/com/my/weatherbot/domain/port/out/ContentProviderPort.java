package com.my.weatherbot.domain.port.out;

import com.my.weatherbot.domain.model.CallResult;
import com.my.weatherbot.domain.model.JobType;
import com.my.weatherbot.domain.model.Payload;

/**
 * 왜: 날씨/태풍/절기 콘텐츠 생성을 외부 협력자로 두고 발송 가능한 결과만 받기 위함.
 */
public interface ContentProviderPort {
    CallResult<Payload> fetch(JobType jobType, String city);
}
