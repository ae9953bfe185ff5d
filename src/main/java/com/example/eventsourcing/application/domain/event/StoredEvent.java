package com.example.eventsourcing.application.domain.event;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 已持久化的事件
 * <p>
 * 在領域事件之外，附帶儲存層指派的全域序號 (sequenceNumber)、聚合內版本 (version) 與寫入時間 (storedAt)。
 * 全域序號嚴格遞增，是投影重播的排序依據。
 * </p>
 */
@Getter
@ToString
@AllArgsConstructor
public class StoredEvent {

	private final long sequenceNumber;

	private final long version;

	private final DomainEvent event;

	private final Instant storedAt;

	public String getEventType() {
		return event.getEventType();
	}

	public String getEventId() {
		return event.getEventId();
	}

	public String getAggregateId() {
		return event.getAggregateId();
	}
}
