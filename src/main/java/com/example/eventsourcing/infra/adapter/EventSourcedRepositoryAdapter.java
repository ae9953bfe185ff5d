package com.example.eventsourcing.infra.adapter;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

import com.example.eventsourcing.application.domain.aggregate.EventSourcedAggregateRoot;
import com.example.eventsourcing.application.domain.event.DomainEvent;
import com.example.eventsourcing.application.domain.event.StoredEvent;
import com.example.eventsourcing.application.domain.exception.AggregateNotFoundException;
import com.example.eventsourcing.application.domain.snapshot.Snapshot;
import com.example.eventsourcing.application.domain.snapshot.SnapshotPolicy;
import com.example.eventsourcing.application.port.AggregateRepositoryPort;
import com.example.eventsourcing.application.port.EventStorePort;
import com.example.eventsourcing.application.port.ProjectionBusPort;
import com.example.eventsourcing.application.port.SnapshotStorePort;

import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * <h1>事件溯源倉儲轉接器 (Infrastructure Adapter)</h1>
 * <p>
 * 實作 {@link AggregateRepositoryPort}，編排事件儲存、快照與投影通知的協作策略。
 * </p>
 * <ul>
 * <li><b>載入：</b>快照優先，補齊快照之後的事件；快照讀取或還原失敗時退回完整重播</li>
 * <li><b>儲存：</b>以預期版本寫入待寫入事件，成功後依快照策略建立快照，再通知投影</li>
 * </ul>
 *
 * @param <A> 聚合根類型
 */
@Slf4j
public class EventSourcedRepositoryAdapter<A extends EventSourcedAggregateRoot<A>>
		implements AggregateRepositoryPort<A> {

	@Getter
	private final String aggregateType;

	private final Function<String, A> factory;

	private final EventStorePort eventStore;

	/**
	 * 可為 null，代表停用快照
	 */
	private final SnapshotStorePort snapshotStore;

	private final SnapshotPolicy snapshotPolicy;

	/**
	 * 每個聚合根保留的快照份數，0 代表不清理
	 */
	private final int snapshotRetainCount;

	/**
	 * 可為 null，代表不通知投影
	 */
	private final ProjectionBusPort projectionBus;

	private final Clock clock;

	@Builder
	public EventSourcedRepositoryAdapter(String aggregateType, Function<String, A> factory, EventStorePort eventStore,
			SnapshotStorePort snapshotStore, SnapshotPolicy snapshotPolicy, int snapshotRetainCount,
			ProjectionBusPort projectionBus, Clock clock) {
		this.aggregateType = Objects.requireNonNull(aggregateType, "aggregateType");
		this.factory = Objects.requireNonNull(factory, "factory");
		this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
		this.snapshotStore = snapshotStore;
		this.snapshotPolicy = (snapshotPolicy == null) ? SnapshotPolicy.everyNthVersion(SnapshotPolicy.DEFAULT_THRESHOLD)
				: snapshotPolicy;
		this.snapshotRetainCount = Math.max(snapshotRetainCount, 0);
		this.projectionBus = projectionBus;
		this.clock = (clock == null) ? Clock.systemUTC() : clock;
	}

	@Override
	public Optional<A> findById(String aggregateId) {
		// 1. 策略 A：快照優化
		Optional<Snapshot> snapshot = loadSnapshot(aggregateId);
		if (snapshot.isPresent()) {
			Optional<A> restored = restore(aggregateId, snapshot.get());
			if (restored.isPresent()) {
				return restored;
			}
		}

		// 2. 策略 B：完整重播
		List<DomainEvent> events = eventStore.getEventsForAggregate(aggregateId);
		if (events.isEmpty()) {
			log.debug(">>> [Recovery] 聚合根 {} (ID: {}) 沒有任何事件", aggregateType, aggregateId);
			return Optional.empty();
		}
		A aggregate = EventSourcedAggregateRoot.reconstitute(factory, events);
		log.debug(">>> [Recovery] 未使用快照，完整重播 {} 筆事件 (Aggregate: {}, Version: {})", events.size(), aggregateId,
				aggregate.getVersion());
		return Optional.of(aggregate);
	}

	@Override
	public A getById(String aggregateId) {
		return findById(aggregateId).orElseThrow(() -> new AggregateNotFoundException(aggregateType, aggregateId));
	}

	@Override
	public Optional<A> findByIdAtVersion(String aggregateId, long version) {
		if (version <= 0) {
			throw new IllegalArgumentException("版本必須大於 0 (目前: " + version + ")");
		}

		if (snapshotStore != null) {
			Optional<Snapshot> exact = readSnapshot(() -> snapshotStore.getSnapshotAtVersion(aggregateId, version),
					aggregateId);
			if (exact.isPresent()) {
				Optional<A> restored = restoreOnly(aggregateId, exact.get());
				if (restored.isPresent()) {
					return restored;
				}
			}
		}

		List<DomainEvent> events = eventStore.getEventsForAggregate(aggregateId);
		if (events.size() < version) {
			return Optional.empty();
		}
		return Optional.of(EventSourcedAggregateRoot.reconstitute(factory, events.subList(0, (int) version)));
	}

	@Override
	public List<StoredEvent> save(A aggregate) {
		List<DomainEvent> pending = aggregate.getPendingEvents();
		if (pending.isEmpty()) {
			log.debug(">>> [Repository] 聚合根 {} 沒有待寫入事件，略過", aggregate.getId());
			return List.of();
		}

		long expectedVersion = aggregate.getVersion() - pending.size();
		List<StoredEvent> stored = eventStore.appendAll(aggregate.getId(), pending, expectedVersion);
		aggregate.markEventsCommitted();

		takeSnapshotIfNeeded(aggregate);
		publish(stored);
		return stored;
	}

	private Optional<Snapshot> loadSnapshot(String aggregateId) {
		if (snapshotStore == null) {
			return Optional.empty();
		}
		return readSnapshot(() -> snapshotStore.getSnapshot(aggregateId), aggregateId);
	}

	private Optional<Snapshot> readSnapshot(Supplier<Optional<Snapshot>> reader,
			String aggregateId) {
		Optional<Snapshot> snapshot;
		try {
			snapshot = reader.get();
		} catch (RuntimeException e) {
			log.warn(">>> [Recovery] 快照讀取失敗，改為完整重播 (Aggregate: {}): {}", aggregateId, e.getMessage());
			return Optional.empty();
		}
		if (snapshot.isPresent() && !aggregateType.equals(snapshot.get().getAggregateType())) {
			log.warn(">>> [Recovery] 快照類型 {} 與倉儲類型 {} 不符，忽略快照 (Aggregate: {})",
					snapshot.get().getAggregateType(), aggregateType, aggregateId);
			return Optional.empty();
		}
		return snapshot;
	}

	/**
	 * 從快照還原後補齊後續事件，事件讀取失敗直接拋出
	 */
	private Optional<A> restore(String aggregateId, Snapshot snapshot) {
		Optional<A> restored = restoreOnly(aggregateId, snapshot);
		if (restored.isEmpty()) {
			return restored;
		}
		A aggregate = restored.get();
		List<DomainEvent> tail = eventStore.getEventsForAggregateFromVersion(aggregateId, snapshot.getVersion());
		tail.forEach(aggregate::replay);
		log.info(">>> [Recovery] 發現快照！從版本 {} 恢復，補齊 {} 筆後續事件 (Aggregate: {})", snapshot.getVersion(),
				tail.size(), aggregateId);
		return restored;
	}

	private Optional<A> restoreOnly(String aggregateId, Snapshot snapshot) {
		try {
			A aggregate = factory.apply(aggregateId);
			aggregate.restoreFromSnapshot(snapshot);
			return Optional.of(aggregate);
		} catch (RuntimeException e) {
			log.warn(">>> [Recovery] 快照還原失敗，改為完整重播 (Aggregate: {}, Version: {}): {}", aggregateId,
					snapshot.getVersion(), e.getMessage());
			return Optional.empty();
		}
	}

	private void takeSnapshotIfNeeded(A aggregate) {
		if (snapshotStore == null || !snapshotPolicy.shouldSnapshot(aggregate)) {
			return;
		}
		try {
			snapshotStore.saveSnapshot(Snapshot.of(aggregate, aggregateType, clock.instant()));
			if (snapshotRetainCount > 0) {
				snapshotStore.retainLatest(aggregate.getId(), snapshotRetainCount);
			}
			log.info(">>> [Snapshot] 建立快照 (Aggregate: {}, Version: {})", aggregate.getId(), aggregate.getVersion());
		} catch (RuntimeException e) {
			// 事件已持久化，快照失敗只影響下次載入速度
			log.error(">>> [Snapshot] 快照寫入失敗 (Aggregate: {}, Version: {})", aggregate.getId(),
					aggregate.getVersion(), e);
		}
	}

	private void publish(List<StoredEvent> stored) {
		if (projectionBus == null) {
			return;
		}
		try {
			projectionBus.publish(stored);
		} catch (RuntimeException e) {
			log.error(">>> [Projection] 投影通知失敗，事件已持久化，可透過重建修復 (Seq: {} ~ {})",
					stored.get(0).getSequenceNumber(), stored.get(stored.size() - 1).getSequenceNumber(), e);
		}
	}
}
