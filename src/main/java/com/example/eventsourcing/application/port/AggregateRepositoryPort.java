package com.example.eventsourcing.application.port;

import java.util.List;
import java.util.Optional;

import com.example.eventsourcing.application.domain.aggregate.EventSourcedAggregateRoot;
import com.example.eventsourcing.application.domain.event.StoredEvent;

/**
 * 事件溯源聚合根的倉儲 Port
 *
 * @param <A> 聚合根類型
 */
public interface AggregateRepositoryPort<A extends EventSourcedAggregateRoot<A>> {

	/**
	 * 載入聚合根：有快照時從快照補齊後續事件，否則重播完整事件流
	 *
	 * @return 沒有任何事件時為空
	 */
	Optional<A> findById(String aggregateId);

	/**
	 * @throws com.example.eventsourcing.application.domain.exception.AggregateNotFoundException 聚合根不存在
	 */
	A getById(String aggregateId);

	/**
	 * 載入聚合根在指定版本時的狀態
	 */
	Optional<A> findByIdAtVersion(String aggregateId, long version);

	/**
	 * 持久化待寫入事件，必要時建立快照，並通知投影
	 *
	 * @return 本次寫入的事件，沒有待寫入事件時為空
	 */
	List<StoredEvent> save(A aggregate);
}
