package io.github.samzhu.relay.service;

import java.net.URI;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cloud.function.cloudevent.CloudEventMessageBuilder;
import org.springframework.cloud.stream.function.StreamBridge;
import org.springframework.messaging.Message;
import org.springframework.stereotype.Service;

import io.github.samzhu.relay.model.UsageEventData;

/**
 * 用量事件發送服務
 *
 * <p>每次防截斷請求結束後，以 CloudEvents v1.0 Binary Mode 透過 Spring Cloud Stream 發送用量事件。
 *
 * <p>CloudEvents 屬性：
 * <ul>
 *   <li>{@code type}: io.github.samzhu.relay.usage.v1</li>
 *   <li>{@code source}: /relay/gemini-anti</li>
 *   <li>{@code subject}: 客戶端識別（X-Forwarded-For / X-Real-IP）</li>
 *   <li>{@code id}: OpenTelemetry Trace ID，沒有時為隨機 UUID</li>
 * </ul>
 *
 * <p>發送失敗只記錄日誌，不影響回應。
 *
 * @see UsageEventData
 * @see <a href="https://cloudevents.io/">CloudEvents Specification</a>
 */
@Service
public class UsageEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(UsageEventPublisher.class);

    static final String BINDING_NAME = "usageEvent-out-0";
    static final String EVENT_TYPE = "io.github.samzhu.relay.usage.v1";
    static final URI EVENT_SOURCE = URI.create("/relay/gemini-anti");

    private final StreamBridge streamBridge;

    public UsageEventPublisher(StreamBridge streamBridge) {
        this.streamBridge = streamBridge;
    }

    public void publish(UsageEventData eventData) {
        try {
            String eventId = eventData.traceId() != null ? eventData.traceId() : UUID.randomUUID().toString();
            OffsetDateTime eventTime = eventData.eventTime() != null
                ? OffsetDateTime.ofInstant(eventData.eventTime(), ZoneOffset.UTC)
                : OffsetDateTime.now(ZoneOffset.UTC);

            Message<UsageEventData> message = CloudEventMessageBuilder
                .withData(eventData)
                .setId(eventId)
                .setType(EVENT_TYPE)
                .setSource(EVENT_SOURCE)
                .setTime(eventTime)
                .setSubject(eventData.clientId())
                .setDataContentType("application/json")
                .build();

            if (streamBridge.send(BINDING_NAME, message)) {
                log.debug("Usage event published: id={}, model={}, totalTokens={}, continued={}",
                    eventId, eventData.model(), eventData.totalTokens(), eventData.continued());
            } else {
                log.warn("Failed to publish usage event: id={}", eventId);
            }
        } catch (Exception e) {
            String rootCause = e.getCause() != null ? e.getCause().getClass().getSimpleName() : "N/A";
            log.error("Error publishing usage event: type={}, message={}, rootCause={}, binding={}",
                e.getClass().getSimpleName(), e.getMessage(), rootCause, BINDING_NAME, e);
        }
    }
}
