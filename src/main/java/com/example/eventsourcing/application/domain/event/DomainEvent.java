package com.example.eventsourcing.application.domain.event;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import lombok.Getter;

/**
 * <h1>領域事件 (Domain Event)</h1>
 * <p>
 * 代表領域中已發生、不可變更的事實。子類別只需宣告自身的 payload 欄位與事件類型標籤。
 * </p>
 * <ul>
 * <li>eventId：全域唯一，預設為隨機 UUID</li>
 * <li>aggregateId：可為 null，空白字串一律視為 null</li>
 * <li>occurredOn：建立時間，截斷至微秒以與資料庫精度一致</li>
 * <li>eventType：穩定的類型標籤，作為序列化、查詢與投影訂閱的依據</li>
 * </ul>
 */
@Getter
public abstract class DomainEvent {

	private final String eventId;

	private final String aggregateId;

	private final Instant occurredOn;

	private final Map<String, Object> metadata;

	protected DomainEvent(String aggregateId) {
		this(aggregateId, Map.of());
	}

	protected DomainEvent(String aggregateId, Map<String, Object> metadata) {
		this(new EventHeader(UUID.randomUUID().toString(), aggregateId,
				Instant.now().truncatedTo(ChronoUnit.MICROS), metadata));
	}

	protected DomainEvent(EventHeader header) {
		if (header == null || header.eventId() == null || header.eventId().isBlank()) {
			throw new IllegalArgumentException("事件標頭缺少 eventId");
		}
		if (header.occurredOn() == null) {
			throw new IllegalArgumentException("事件標頭缺少 occurredOn");
		}
		this.eventId = header.eventId();
		this.aggregateId = (header.aggregateId() == null || header.aggregateId().isBlank()) ? null
				: header.aggregateId();
		this.occurredOn = header.occurredOn();
		this.metadata = (header.metadata() == null) ? Map.of()
				: Collections.unmodifiableMap(new LinkedHashMap<>(header.metadata()));
	}

	/**
	 * 事件類型標籤，同一個事件類別必須永遠回傳相同的值
	 */
	public abstract String getEventType();

	public EventHeader header() {
		return new EventHeader(eventId, aggregateId, occurredOn, metadata);
	}

	@Override
	public String toString() {
		return getEventType() + "[eventId=" + eventId + ", aggregateId=" + aggregateId + ", occurredOn=" + occurredOn
				+ "]";
	}
}
