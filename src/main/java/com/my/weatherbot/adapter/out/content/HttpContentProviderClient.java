package com.my.weatherbot.adapter.out.content;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.weatherbot.config.AppConfig;
import com.my.weatherbot.domain.exception.ConditionCheckException;
import com.my.weatherbot.domain.model.CallResult;
import com.my.weatherbot.domain.model.JobType;
import com.my.weatherbot.domain.model.Payload;
import com.my.weatherbot.domain.port.out.ContentProviderPort;
import com.my.weatherbot.domain.port.out.TriggerConditionPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Optional;

/**
 * 왜: 날씨 콘텐츠 생성과 발화 조건 판정을 맡은 콘텐츠 서비스 HTTP API를 두 포트로 노출하기 위함.
 */
@ApplicationScoped
public class HttpContentProviderClient implements ContentProviderPort, TriggerConditionPort {

    private static final Logger log = Logger.getLogger(HttpContentProviderClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final Duration requestTimeout;

    @Inject
    public HttpContentProviderClient(AppConfig appConfig, ObjectMapper objectMapper) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build(),
                objectMapper,
                appConfig.content().baseUrl(),
                Duration.ofSeconds(appConfig.content().requestTimeoutSeconds()));
    }

    HttpContentProviderClient(HttpClient httpClient, ObjectMapper objectMapper, String baseUrl, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public CallResult<Payload> fetch(JobType jobType, String city) {
        String url = baseUrl + "/notifications/" + jobType.featureId() + "?city=" + URLEncoder.encode(city, StandardCharsets.UTF_8);
        HttpResponse<String> response;
        try {
            response = get(url);
        } catch (IOException e) {
            return CallResult.transientFailure("콘텐츠 조회 I/O 오류: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CallResult.transientFailure("콘텐츠 조회 중 인터럽트");
        }
        int status = response.statusCode();
        if (status == 429 || status >= 500) {
            return CallResult.transientFailure("콘텐츠 서비스 status=" + status);
        }
        if (status >= 400) {
            return CallResult.permanentFailure("콘텐츠 서비스 status=" + status);
        }
        try {
            NotificationResponse body = objectMapper.readValue(response.body(), NotificationResponse.class);
            if (body.messages() == null || !body.messages().isArray() || body.messages().isEmpty()) {
                return CallResult.permanentFailure(jobType.featureId() + "(" + city + ") 콘텐츠가 비어 있습니다.");
            }
            String summary = body.summary() != null ? body.summary() : "";
            return CallResult.success(new Payload(summary, objectMapper.writeValueAsString(body.messages())));
        } catch (IOException e) {
            log.warnf("콘텐츠 응답 파싱 실패 job=%s city=%s: %s", jobType, city, e.getMessage());
            return CallResult.permanentFailure("콘텐츠 응답 형식 오류: " + e.getMessage());
        }
    }

    @Override
    public Optional<String> activeTyphoonAdvisory() {
        TyphoonResponse body = readCondition(baseUrl + "/conditions/typhoon", TyphoonResponse.class);
        if (!body.active() || body.advisoryId() == null || body.advisoryId().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(body.advisoryId());
    }

    @Override
    public boolean isSolarTermDay(LocalDate date) {
        SolarTermResponse body = readCondition(baseUrl + "/conditions/solar-term?date=" + date, SolarTermResponse.class);
        return body.solarTermDay();
    }

    private <T> T readCondition(String url, Class<T> type) {
        try {
            HttpResponse<String> response = get(url);
            if (response.statusCode() >= 400) {
                throw new ConditionCheckException("조건 조회 실패 status=" + response.statusCode() + " url=" + url);
            }
            T body = objectMapper.readValue(response.body(), type);
            if (body == null) {
                throw new ConditionCheckException("조건 응답 본문이 비어 있습니다 url=" + url);
            }
            return body;
        } catch (IOException e) {
            throw new ConditionCheckException("조건 조회 실패 url=" + url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConditionCheckException("조건 조회 중 인터럽트 url=" + url, e);
        }
    }

    private HttpResponse<String> get(String url) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("Accept", "application/json")
                .timeout(requestTimeout)
                .GET()
                .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record NotificationResponse(@JsonProperty("summary") String summary,
                                        @JsonProperty("messages") JsonNode messages) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record TyphoonResponse(@JsonProperty("active") boolean active,
                                   @JsonProperty("advisoryId") String advisoryId) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record SolarTermResponse(@JsonProperty("solarTermDay") boolean solarTermDay,
                                     @JsonProperty("name") String name) {
    }
}
