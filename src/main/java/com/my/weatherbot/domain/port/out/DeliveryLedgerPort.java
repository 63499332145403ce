package com.my.weatherbot.domain.port.out;

import com.my.weatherbot.domain.model.DedupKey;

/**
 * 왜: 재시작 이후에도 남는 발송 완료 기록으로 발화당 최대 한 번의 기록을 보장하기 위함.
 * 저장소 접근 실패 시 StoreUnavailableException을 던진다.
 */
public interface DeliveryLedgerPort {

    boolean isDelivered(DedupKey key);

    /**
     * 키가 없을 때만 원자적으로 기록한다.
     *
     * @return 이번 호출이 처음 기록했으면 true
     */
    boolean markIfAbsent(DedupKey key);
}
