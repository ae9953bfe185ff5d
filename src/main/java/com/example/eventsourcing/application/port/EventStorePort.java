package com.example.eventsourcing.application.port;

import java.time.Instant;
import java.util.List;

import com.example.eventsourcing.application.domain.event.DomainEvent;
import com.example.eventsourcing.application.domain.event.StoredEvent;

/**
 * <h1>事件儲存 Port</h1>
 * <p>
 * 只允許追加的事件日誌。每筆事件寫入時取得嚴格遞增的全域序號，以及在所屬聚合根內從 1 起算、連續不重複的版本號。
 * </p>
 * <ul>
 * <li>同一批次的事件要嘛全部寫入，要嘛全部不寫入</li>
 * <li>沒有聚合根識別碼的事件版本一律為 1</li>
 * <li>重複的 eventId 拒絕寫入</li>
 * </ul>
 */
public interface EventStorePort {

	StoredEvent append(DomainEvent event);

	/**
	 * 以單一原子批次寫入事件，事件可屬於不同聚合根
	 */
	List<StoredEvent> appendAll(List<? extends DomainEvent> events);

	/**
	 * 寫入單一聚合根的事件，並檢查聚合根目前版本是否等於 expectedVersion
	 *
	 * @throws com.example.eventsourcing.application.domain.exception.ConcurrencyConflictException 版本不符
	 */
	List<StoredEvent> appendAll(String aggregateId, List<? extends DomainEvent> events, long expectedVersion);

	/**
	 * 聚合根的全部事件，依版本遞增排序
	 */
	List<DomainEvent> getEventsForAggregate(String aggregateId);

	/**
	 * 版本大於 fromVersion 的事件，依版本遞增排序
	 */
	List<DomainEvent> getEventsForAggregateFromVersion(String aggregateId, long fromVersion);

	/**
	 * 指定類型的事件，依全域序號排序
	 */
	List<DomainEvent> getEventsByType(String eventType);

	/**
	 * occurredOn 晚於 after 的事件 (不含)，依全域序號排序
	 */
	List<DomainEvent> getEventsAfter(Instant after);

	/**
	 * occurredOn 介於 from 與 to 之間的事件 (含兩端)，依全域序號排序
	 */
	List<DomainEvent> getEventsBetween(Instant from, Instant to);

	/**
	 * 聚合根目前最大版本，沒有事件時為 0
	 */
	long getAggregateVersion(String aggregateId);

	/**
	 * 全域序號大於 afterSequence 的事件，最多 limit 筆，依全域序號排序
	 */
	List<StoredEvent> readAll(long afterSequence, int limit);

	long getLastSequenceNumber();

	long count();

	long countForAggregate(String aggregateId);
}
