package com.my.weatherbot.domain.model;

import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

/**
 * 왜: (구독자, 작업, 발화 시각) 단위로 기록된 발송이 최대 한 번이 되도록 하는 키.
 * 발화 시각은 같은 순간이면 오프셋 표기와 무관하게 같은 키가 되도록 epoch 초로 비교한다.
 */
public record DedupKey(String subscriberId, JobType jobType, OffsetDateTime triggerTimestamp) {

    public DedupKey {
        Objects.requireNonNull(subscriberId, "subscriberId");
        Objects.requireNonNull(jobType, "jobType");
        Objects.requireNonNull(triggerTimestamp, "triggerTimestamp");
    }

    public long triggerEpochSecond() {
        return triggerTimestamp.toEpochSecond();
    }

    public String asString() {
        return subscriberId + "|" + jobType.name() + "|" + triggerEpochSecond();
    }

    /**
     * 같은 키로 재시도할 때 게이트웨이가 중복 수신을 걸러낼 수 있도록 결정적인 UUID를 만든다.
     */
    public UUID retryKey() {
        return UUID.nameUUIDFromBytes(asString().getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DedupKey other)) {
            return false;
        }
        return subscriberId.equals(other.subscriberId)
                && jobType == other.jobType
                && triggerEpochSecond() == other.triggerEpochSecond();
    }

    @Override
    public int hashCode() {
        return Objects.hash(subscriberId, jobType, triggerEpochSecond());
    }
}
