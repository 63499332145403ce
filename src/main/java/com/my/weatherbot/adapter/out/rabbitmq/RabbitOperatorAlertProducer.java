package com.my.weatherbot.adapter.out.rabbitmq;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.weatherbot.domain.model.OperatorAlert;
import com.my.weatherbot.domain.port.out.OperatorAlertPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Channel;
import org.eclipse.microprofile.reactive.messaging.Emitter;
import org.jboss.logging.Logger;

/**
 * 왜: 배치 중단 같은 운영 이벤트를 RabbitMQ로 내보내는 기술적 구현을 포트 뒤에 두기 위함.
 */
@ApplicationScoped
public class RabbitOperatorAlertProducer implements OperatorAlertPort {

    private static final Logger log = Logger.getLogger(RabbitOperatorAlertProducer.class);

    private final Emitter<String> alertEmitter;
    private final ObjectMapper objectMapper;

    @Inject
    public RabbitOperatorAlertProducer(@Channel("operator-alerts") Emitter<String> alertEmitter, ObjectMapper objectMapper) {
        this.alertEmitter = alertEmitter;
        this.objectMapper = objectMapper;
    }

    @Override
    public void raise(OperatorAlert alert) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(AlertBody.from(alert));
        } catch (JsonProcessingException e) {
            log.warnf("운영 알림 직렬화 실패 kind=%s: %s", alert.kind(), e.getMessage());
            return;
        }
        alertEmitter.send(payload);
        log.infof("운영 알림 발행: kind=%s job=%s trigger=%s", alert.kind(), alert.jobType(), alert.triggerTimestamp());
    }

    record AlertBody(@JsonProperty("kind") String kind,
                     @JsonProperty("jobType") String jobType,
                     @JsonProperty("featureId") String featureId,
                     @JsonProperty("triggerTimestamp") String triggerTimestamp,
                     @JsonProperty("message") String message,
                     @JsonProperty("raisedAt") String raisedAt) {

        static AlertBody from(OperatorAlert alert) {
            return new AlertBody(alert.kind(),
                    alert.jobType().name(),
                    alert.jobType().featureId(),
                    alert.triggerTimestamp().toString(),
                    alert.message(),
                    alert.raisedAt().toString());
        }
    }
}
