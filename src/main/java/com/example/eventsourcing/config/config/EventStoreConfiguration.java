package com.example.eventsourcing.config.config;

import java.time.Clock;

import javax.sql.DataSource;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import com.example.eventsourcing.application.port.EventStorePort;
import com.example.eventsourcing.application.port.SnapshotStorePort;
import com.example.eventsourcing.application.service.EventStoreStatisticsService;
import com.example.eventsourcing.infra.event.codec.JsonMapCodec;
import com.example.eventsourcing.infra.event.mapper.StoredEventMapper;
import com.example.eventsourcing.infra.persistence.InMemoryEventStore;
import com.example.eventsourcing.infra.persistence.InMemorySnapshotStore;
import com.example.eventsourcing.infra.persistence.JdbcEventStore;
import com.example.eventsourcing.infra.persistence.JdbcSnapshotStore;

import lombok.extern.slf4j.Slf4j;

/**
 * <h1>事件儲存配置類</h1>
 * <p>
 * <b>職責：</b>依 eventsourcing.store.driver 建立事件儲存與快照儲存。
 * </p>
 * <ul>
 * <li><b>jdbc (預設)：</b>使用容器中的 DataSource，資料表由 schema.sql 建立</li>
 * <li><b>memory：</b>記憶體儲存，重啟後資料消失</li>
 * </ul>
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(EventSourcingProperties.class)
public class EventStoreConfiguration {

	@Bean
	@ConditionalOnMissingBean(Clock.class)
	public Clock eventStoreClock() {
		return Clock.systemUTC();
	}

	@Bean
	@ConditionalOnProperty(prefix = "eventsourcing.store", name = "driver", havingValue = "jdbc", matchIfMissing = true)
	public EventStorePort jdbcEventStore(DataSource dataSource, StoredEventMapper storedEventMapper, Clock clock,
			EventSourcingProperties properties) {
		log.info(">>> [Config] 使用 JDBC 事件儲存");
		return new JdbcEventStore(dataSource, storedEventMapper, clock, properties.getStore().getMaxAppendAttempts());
	}

	@Bean
	@ConditionalOnProperty(prefix = "eventsourcing.store", name = "driver", havingValue = "jdbc", matchIfMissing = true)
	public SnapshotStorePort jdbcSnapshotStore(JdbcTemplate jdbcTemplate, JsonMapCodec jsonMapCodec) {
		return new JdbcSnapshotStore(jdbcTemplate, jsonMapCodec);
	}

	@Bean
	@ConditionalOnProperty(prefix = "eventsourcing.store", name = "driver", havingValue = "memory")
	public EventStorePort inMemoryEventStore(Clock clock) {
		log.info(">>> [Config] 使用記憶體事件儲存");
		return new InMemoryEventStore(clock);
	}

	@Bean
	@ConditionalOnProperty(prefix = "eventsourcing.store", name = "driver", havingValue = "memory")
	public SnapshotStorePort inMemorySnapshotStore() {
		return new InMemorySnapshotStore();
	}

	@Bean
	public EventStoreStatisticsService eventStoreStatisticsService(EventStorePort eventStore,
			EventSourcingProperties properties) {
		return new EventStoreStatisticsService(eventStore, properties.getProjection().getBatchSize());
	}
}
