package com.example.eventsourcing.config.config;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.eventsourcing.application.domain.projection.Projector;
import com.example.eventsourcing.application.port.EventStorePort;
import com.example.eventsourcing.application.port.ProjectionBusPort;
import com.example.eventsourcing.application.service.ProjectionManager;
import com.example.eventsourcing.infra.adapter.SynchronousProjectionBusAdapter;

/**
 * 投影配置類
 * <p>
 * 容器中所有 {@link Projector} Bean 會依宣告順序註冊到 {@link ProjectionManager}。
 * </p>
 */
@Configuration
public class ProjectionConfiguration {

	@Bean
	public ProjectionManager projectionManager(EventStorePort eventStore, ObjectProvider<Projector> projectors,
			EventSourcingProperties properties) {
		ProjectionManager manager = new ProjectionManager(eventStore, properties.getProjection().getBatchSize());
		manager.registerAll(projectors.orderedStream().toList());
		return manager;
	}

	/**
	 * 同步投影：在寫入端執行緒上直接投遞
	 */
	@Bean
	@ConditionalOnProperty(prefix = "eventsourcing.projection", name = "async", havingValue = "false")
	public ProjectionBusPort synchronousProjectionBus(ProjectionManager projectionManager) {
		return new SynchronousProjectionBusAdapter(projectionManager);
	}
}
