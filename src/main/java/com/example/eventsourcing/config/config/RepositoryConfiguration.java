package com.example.eventsourcing.config.config;

import java.time.Clock;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.eventsourcing.application.domain.snapshot.SnapshotPolicy;
import com.example.eventsourcing.application.port.EventStorePort;
import com.example.eventsourcing.application.port.ProjectionBusPort;
import com.example.eventsourcing.application.port.SnapshotStorePort;
import com.example.eventsourcing.infra.adapter.EventSourcedRepositoryFactory;

/**
 * 倉儲配置類
 * <p>
 * 提供 {@link EventSourcedRepositoryFactory}，各聚合根類型以它建立自己的倉儲 Bean：
 * </p>
 *
 * <pre>
 * &#64;Bean
 * public AggregateRepositoryPort&lt;Product&gt; productRepository(EventSourcedRepositoryFactory factory) {
 * 	return factory.create("Product", Product::new);
 * }
 * </pre>
 */
@Configuration
public class RepositoryConfiguration {

	@Bean
	public SnapshotPolicy snapshotPolicy(EventSourcingProperties properties) {
		EventSourcingProperties.Snapshot snapshot = properties.getSnapshot();
		return snapshot.isEnabled() ? SnapshotPolicy.everyNthVersion(snapshot.getThreshold()) : SnapshotPolicy.never();
	}

	@Bean
	public EventSourcedRepositoryFactory eventSourcedRepositoryFactory(EventStorePort eventStore,
			ObjectProvider<SnapshotStorePort> snapshotStore, SnapshotPolicy snapshotPolicy,
			ObjectProvider<ProjectionBusPort> projectionBus, EventSourcingProperties properties, Clock clock) {
		SnapshotStorePort snapshots = properties.getSnapshot().isEnabled() ? snapshotStore.getIfAvailable() : null;
		return new EventSourcedRepositoryFactory(eventStore, snapshots, snapshotPolicy,
				properties.getSnapshot().getRetainCount(), projectionBus.getIfAvailable(), clock);
	}
}
