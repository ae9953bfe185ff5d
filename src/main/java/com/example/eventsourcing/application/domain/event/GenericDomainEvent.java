package com.example.eventsourcing.application.domain.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;

/**
 * 未註冊類型的事件
 * <p>
 * 僅在容忍模式 (tolerate-unknown-types) 下由解碼器產生，原封不動保留事件類型與 payload，
 * 重新寫入時也會以原始 payload 編碼。
 * </p>
 */
public final class GenericDomainEvent extends DomainEvent {

	private final String eventType;

	@Getter
	private final Map<String, Object> payload;

	public GenericDomainEvent(String aggregateId, String eventType, Map<String, Object> payload) {
		super(aggregateId);
		this.eventType = requireType(eventType);
		this.payload = copy(payload);
	}

	public GenericDomainEvent(EventHeader header, String eventType, Map<String, Object> payload) {
		super(header);
		this.eventType = requireType(eventType);
		this.payload = copy(payload);
	}

	@Override
	public String getEventType() {
		return eventType;
	}

	private static String requireType(String eventType) {
		if (eventType == null || eventType.isBlank()) {
			throw new IllegalArgumentException("事件類型不可為空");
		}
		return eventType;
	}

	private static Map<String, Object> copy(Map<String, Object> payload) {
		return (payload == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
	}
}
