package com.my.weatherbot.adapter.in.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.weatherbot.domain.exception.InvalidRequestException;
import com.my.weatherbot.domain.exception.StoreUnavailableException;
import com.my.weatherbot.domain.model.Subscriber;
import com.my.weatherbot.domain.port.in.UpdateSubscriptionUseCase;
import io.smallrye.mutiny.Uni;
import io.smallrye.reactive.messaging.annotations.Blocking;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Incoming;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.io.IOException;

/**
 * 왜: 대화 계층에서 온 구독 설정 변경 명령을 설정 유스케이스로 들여보내는 단일 경로를 제공하기 위함.
 * 저장소 장애는 예외로 올려 메시지가 nack 되도록 하고, 형식 오류는 기록 후 버린다.
 */
@ApplicationScoped
public class SettingsCommandConsumer {

    private static final Logger log = Logger.getLogger(SettingsCommandConsumer.class);

    private final UpdateSubscriptionUseCase updateSubscriptionUseCase;
    private final ObjectMapper objectMapper;

    @Inject
    public SettingsCommandConsumer(UpdateSubscriptionUseCase updateSubscriptionUseCase, ObjectMapper objectMapper) {
        this.updateSubscriptionUseCase = updateSubscriptionUseCase;
        this.objectMapper = objectMapper;
    }

    @Incoming("subscription-settings")
    @Blocking
    public Uni<Void> consume(Message<String> message) {
        return Uni.createFrom().item(() -> {
            handle(message.getPayload());
            return null;
        }).replaceWithVoid();
    }

    void handle(String payload) {
        SettingsCommand command;
        try {
            command = objectMapper.readValue(payload, SettingsCommand.class);
        } catch (IOException | InvalidRequestException e) {
            log.warnf("설정 명령 파싱 실패로 처리 중단: %s", e.getMessage());
            return;
        }
        MDC.put("commandId", command.commandId());
        MDC.put("subscriberId", Subscriber.shortId(command.subscriberId()));
        try {
            Subscriber updated = command.applyTo(updateSubscriptionUseCase);
            log.infof("설정 명령 %s 처리 완료: city=%s, jobs=%s", command.parsedAction(), updated.preferredCity(), updated.enabledJobs());
        } catch (InvalidRequestException e) {
            log.warnf("설정 명령 검증 실패로 처리 중단: %s", e.getMessage());
        } catch (StoreUnavailableException e) {
            log.errorf(e, "설정 명령 %s 저장 실패", command.commandId());
            throw e;
        } finally {
            MDC.remove("commandId");
            MDC.remove("subscriberId");
        }
    }
}
