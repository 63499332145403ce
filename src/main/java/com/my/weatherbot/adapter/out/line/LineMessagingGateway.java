package com.my.weatherbot.adapter.out.line;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.weatherbot.config.AppConfig;
import com.my.weatherbot.domain.model.CallResult;
import com.my.weatherbot.domain.model.Payload;
import com.my.weatherbot.domain.port.out.DeliveryGatewayPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * 왜: LINE 푸시 API 호출을 캡슐화하고 응답 코드를 재시도 가능/불가능 실패로 분류해 돌려주기 위함.
 */
@ApplicationScoped
public class LineMessagingGateway implements DeliveryGatewayPort {

    private static final Logger log = Logger.getLogger(LineMessagingGateway.class);

    static final String PUSH_PATH = "/v2/bot/message/push";
    static final String RETRY_KEY_HEADER = "X-Line-Retry-Key";
    static final String REQUEST_ID_HEADER = "x-line-request-id";
    private static final int MAX_MESSAGES_PER_PUSH = 5;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String pushUrl;
    private final Optional<String> channelAccessToken;
    private final Duration requestTimeout;

    @Inject
    public LineMessagingGateway(AppConfig appConfig, ObjectMapper objectMapper) {
        this(HttpClient.newBuilder()
                        .connectTimeout(Duration.ofSeconds(appConfig.line().connectTimeoutSeconds()))
                        .build(),
                objectMapper,
                appConfig.line().apiBase(),
                appConfig.line().channelAccessToken(),
                Duration.ofSeconds(appConfig.line().requestTimeoutSeconds()));
    }

    LineMessagingGateway(HttpClient httpClient,
                         ObjectMapper objectMapper,
                         String apiBase,
                         Optional<String> channelAccessToken,
                         Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.pushUrl = stripTrailingSlash(apiBase) + PUSH_PATH;
        this.channelAccessToken = channelAccessToken.filter(token -> !token.isBlank());
        this.requestTimeout = requestTimeout;
    }

    @Override
    public CallResult<String> send(String subscriberId, Payload payload, UUID retryKey) {
        if (channelAccessToken.isEmpty()) {
            log.warn("LINE 채널 액세스 토큰이 설정되지 않아 전송할 수 없습니다.");
            return CallResult.permanentFailure("채널 액세스 토큰 없음");
        }
        String body;
        try {
            body = objectMapper.writeValueAsString(new PushRequest(subscriberId, parseMessages(payload)));
        } catch (IllegalArgumentException | JsonProcessingException e) {
            return CallResult.permanentFailure("메시지 본문 오류: " + e.getMessage());
        }
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(pushUrl))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + channelAccessToken.get())
                .header(RETRY_KEY_HEADER, retryKey.toString())
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return classify(response);
        } catch (IOException e) {
            return CallResult.transientFailure("I/O 오류: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CallResult.transientFailure("전송 중 인터럽트");
        }
    }

    private CallResult<String> classify(HttpResponse<String> response) {
        int status = response.statusCode();
        String requestId = response.headers().firstValue(REQUEST_ID_HEADER).orElse("");
        if (status >= 200 && status < 300) {
            return CallResult.success(requestId);
        }
        if (status == 409) {
            // 같은 재시도 키로 이미 수락된 요청
            log.debugf("LINE이 재시도 키 중복(409)을 돌려줬습니다. 이미 수락된 요청으로 봅니다. requestId=%s", requestId);
            return CallResult.success(response.headers().firstValue("x-line-accepted-request-id").orElse(requestId));
        }
        String reason = "status=" + status + " body=" + abbreviate(response.body());
        if (status == 429 || status >= 500) {
            return CallResult.transientFailure(reason);
        }
        return CallResult.permanentFailure(reason);
    }

    private JsonNode parseMessages(Payload payload) throws JsonProcessingException {
        JsonNode messages = objectMapper.readTree(payload.messagesJson());
        if (messages == null || !messages.isArray() || messages.isEmpty()) {
            throw new IllegalArgumentException("messages는 비어 있지 않은 배열이어야 합니다.");
        }
        if (messages.size() > MAX_MESSAGES_PER_PUSH) {
            throw new IllegalArgumentException("한 번에 보낼 수 있는 메시지는 " + MAX_MESSAGES_PER_PUSH + "개까지입니다.");
        }
        return messages;
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= 200 ? body : body.substring(0, 200) + "...";
    }

    private record PushRequest(@JsonProperty("to") String to,
                               @JsonProperty("messages") JsonNode messages) {
    }
}
