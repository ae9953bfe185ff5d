package com.example.eventsourcing.infra.adapter;

import java.time.Clock;
import java.util.function.Function;

import com.example.eventsourcing.application.domain.aggregate.EventSourcedAggregateRoot;
import com.example.eventsourcing.application.domain.snapshot.SnapshotPolicy;
import com.example.eventsourcing.application.port.AggregateRepositoryPort;
import com.example.eventsourcing.application.port.EventStorePort;
import com.example.eventsourcing.application.port.ProjectionBusPort;
import com.example.eventsourcing.application.port.SnapshotStorePort;

import lombok.RequiredArgsConstructor;

/**
 * 依共用的事件儲存、快照與投影設定建立各聚合根類型的倉儲
 */
@RequiredArgsConstructor
public class EventSourcedRepositoryFactory {

	private final EventStorePort eventStore;

	private final SnapshotStorePort snapshotStore;

	private final SnapshotPolicy snapshotPolicy;

	private final int snapshotRetainCount;

	private final ProjectionBusPort projectionBus;

	private final Clock clock;

	public <A extends EventSourcedAggregateRoot<A>> AggregateRepositoryPort<A> create(String aggregateType,
			Function<String, A> factory) {
		return EventSourcedRepositoryAdapter.<A>builder().aggregateType(aggregateType).factory(factory)
				.eventStore(eventStore).snapshotStore(snapshotStore).snapshotPolicy(snapshotPolicy)
				.snapshotRetainCount(snapshotRetainCount).projectionBus(projectionBus).clock(clock).build();
	}
}
