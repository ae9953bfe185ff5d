package com.example.eventsourcing.infra.event.codec;

import java.util.Map;

import com.example.eventsourcing.application.domain.event.DomainEvent;
import com.example.eventsourcing.application.domain.event.EventHeader;

/**
 * 單一事件類型的 payload 編解碼器
 *
 * <p>
 * 只負責事件本身的欄位，eventId、aggregateId、occurredOn、metadata 由儲存層以 {@link EventHeader} 處理。
 * payload 只能包含 JSON 可表示的值 (字串、數字、布林、List、Map)。
 * </p>
 *
 * @param <E> 事件類別
 */
public interface EventCodec<E extends DomainEvent> {

	/**
	 * 事件類型標籤，必須與 {@link DomainEvent#getEventType()} 一致
	 */
	String eventType();

	Class<E> eventClass();

	Map<String, Object> encode(E event);

	E decode(EventHeader header, Map<String, Object> payload);
}
