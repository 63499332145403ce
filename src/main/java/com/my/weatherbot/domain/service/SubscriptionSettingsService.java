package com.my.weatherbot.domain.service;

import com.my.weatherbot.domain.exception.InvalidRequestException;
import com.my.weatherbot.domain.model.JobType;
import com.my.weatherbot.domain.model.Subscriber;
import com.my.weatherbot.domain.port.in.UpdateSubscriptionUseCase;
import com.my.weatherbot.domain.port.out.SubscriptionStorePort;
import org.jboss.logging.Logger;

/**
 * 왜: 설정 변경을 발송 계층이 읽는 저장소에 동기적으로 반영해 다음 발송부터 바로 적용되도록 하기 위함.
 */
public class SubscriptionSettingsService implements UpdateSubscriptionUseCase {

    private static final Logger log = Logger.getLogger(SubscriptionSettingsService.class);

    private final SubscriptionStorePort subscriptionStore;

    public SubscriptionSettingsService(SubscriptionStorePort subscriptionStore) {
        this.subscriptionStore = subscriptionStore;
    }

    @Override
    public Subscriber setEnabled(String subscriberId, JobType jobType, boolean enabled) {
        requireSubscriberId(subscriberId);
        if (jobType == null) {
            throw new InvalidRequestException("jobType이 비어 있습니다.");
        }
        subscriptionStore.setJobEnabled(subscriberId, jobType, enabled);
        log.infof("구독자 %s의 「%s」 푸시를 %s", Subscriber.shortId(subscriberId), jobType.displayName(), enabled ? "켰습니다." : "껐습니다.");
        return subscriptionStore.getSettings(subscriberId);
    }

    @Override
    public Subscriber setCity(String subscriberId, String city) {
        requireSubscriberId(subscriberId);
        String normalized = normalizeCity(city);
        if (normalized.isEmpty()) {
            throw new InvalidRequestException("도시 이름이 비어 있습니다.");
        }
        subscriptionStore.setPreferredCity(subscriberId, normalized);
        log.infof("구독자 %s의 기본 도시를 %s(으)로 변경했습니다.", Subscriber.shortId(subscriberId), normalized);
        return subscriptionStore.getSettings(subscriberId);
    }

    @Override
    public Subscriber settingsOf(String subscriberId) {
        requireSubscriberId(subscriberId);
        return subscriptionStore.getSettings(subscriberId);
    }

    /**
     * 기상 데이터가 쓰는 정식 표기(臺)로 맞춘다.
     */
    static String normalizeCity(String city) {
        if (city == null) {
            return "";
        }
        return city.trim().replace('台', '臺');
    }

    private static void requireSubscriberId(String subscriberId) {
        if (subscriberId == null || subscriberId.isBlank()) {
            throw new InvalidRequestException("subscriberId가 비어 있습니다.");
        }
    }
}
