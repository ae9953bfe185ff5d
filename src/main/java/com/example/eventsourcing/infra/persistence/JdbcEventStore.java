package com.example.eventsourcing.infra.persistence;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

import javax.sql.DataSource;

import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import com.example.eventsourcing.application.domain.event.DomainEvent;
import com.example.eventsourcing.application.domain.event.StoredEvent;
import com.example.eventsourcing.application.domain.exception.ConcurrencyConflictException;
import com.example.eventsourcing.application.domain.exception.DuplicateEventException;
import com.example.eventsourcing.application.domain.exception.StorageUnavailableException;
import com.example.eventsourcing.application.port.EventStorePort;
import com.example.eventsourcing.infra.event.mapper.StoredEventMapper;
import com.example.eventsourcing.infra.event.mapper.StoredEventMapper.EncodedEvent;

import lombok.extern.slf4j.Slf4j;

/**
 * <h1>JDBC 事件儲存</h1>
 * <p>
 * 事件寫入 domain_events 資料表，每個批次在單一交易內完成：
 * </p>
 * <ol>
 * <li>鎖定 event_store_sequence 並一次保留整批的全域序號</li>
 * <li>檢查預期版本 (若有指定)</li>
 * <li>以聚合根目前最大版本 + 1 指派版本號</li>
 * <li>批次寫入</li>
 * </ol>
 * <p>
 * 序號列的列鎖讓並發寫入序列化，(aggregate_id, version) 唯一索引則作為最後防線：
 * 版本衝突時在重試上限內重新指派，超過上限拋出 {@link ConcurrencyConflictException}。
 * </p>
 */
@Slf4j
public class JdbcEventStore implements EventStorePort {

	private static final String SELECT_EVENTS = """
			SELECT sequence_number, event_id, event_type, aggregate_id, version, payload, metadata, occurred_on, stored_at
			FROM domain_events
			""";

	private static final String INSERT_EVENT = """
			INSERT INTO domain_events
			    (sequence_number, event_id, event_type, aggregate_id, version, payload, metadata, occurred_on, stored_at)
			VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
			""";

	private static final String RESERVE_SEQUENCE = "UPDATE event_store_sequence SET last_sequence = last_sequence + ? WHERE id = 1";

	private static final String CURRENT_SEQUENCE = "SELECT last_sequence FROM event_store_sequence WHERE id = 1";

	private static final String CURRENT_VERSION = "SELECT COALESCE(MAX(version), 0) FROM domain_events WHERE aggregate_id = ?";

	public static final int DEFAULT_MAX_APPEND_ATTEMPTS = 3;

	private final JdbcTemplate jdbcTemplate;

	private final TransactionTemplate transactionTemplate;

	private final StoredEventMapper mapper;

	private final Clock clock;

	private final int maxAppendAttempts;

	public JdbcEventStore(DataSource dataSource, StoredEventMapper mapper) {
		this(dataSource, mapper, Clock.systemUTC(), DEFAULT_MAX_APPEND_ATTEMPTS);
	}

	public JdbcEventStore(DataSource dataSource, StoredEventMapper mapper, Clock clock, int maxAppendAttempts) {
		if (maxAppendAttempts <= 0) {
			throw new IllegalArgumentException("maxAppendAttempts 必須大於 0");
		}
		this.jdbcTemplate = new JdbcTemplate(dataSource);
		this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
		this.mapper = mapper;
		this.clock = clock;
		this.maxAppendAttempts = maxAppendAttempts;
	}

	@Override
	public StoredEvent append(DomainEvent event) {
		return appendAll(List.of(event)).get(0);
	}

	@Override
	public List<StoredEvent> appendAll(List<? extends DomainEvent> events) {
		return write(events, null, -1);
	}

	@Override
	public List<StoredEvent> appendAll(String aggregateId, List<? extends DomainEvent> events, long expectedVersion) {
		Objects.requireNonNull(aggregateId, "aggregateId");
		for (DomainEvent event : events) {
			if (!aggregateId.equals(event.getAggregateId())) {
				throw new IllegalArgumentException("事件 " + event.getEventId() + " 不屬於聚合根 " + aggregateId);
			}
		}
		return write(events, aggregateId, expectedVersion);
	}

	private List<StoredEvent> write(List<? extends DomainEvent> events, String expectedAggregateId,
			long expectedVersion) {
		Objects.requireNonNull(events, "events");
		if (events.isEmpty()) {
			return List.of();
		}

		Set<String> batchIds = new HashSet<>();
		List<EncodedEvent> encoded = new ArrayList<>(events.size());
		for (DomainEvent event : events) {
			Objects.requireNonNull(event, "event");
			if (!batchIds.add(event.getEventId())) {
				throw new DuplicateEventException(event.getEventId());
			}
			encoded.add(mapper.encode(event));
		}

		for (int attempt = 1;; attempt++) {
			try {
				return transactionTemplate.execute(status -> insert(encoded, expectedAggregateId, expectedVersion));
			} catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
				String duplicated = findExistingEventId(batchIds);
				if (duplicated != null) {
					throw new DuplicateEventException(duplicated);
				}
				if (attempt >= maxAppendAttempts) {
					throw new ConcurrencyConflictException("版本號指派在 " + attempt + " 次嘗試後仍然衝突", e);
				}
				log.warn(">>> [EventStore] 寫入衝突，重新指派版本號 (第 {} 次重試): {}", attempt, e.getMessage());
			} catch (DataAccessException e) {
				throw new StorageUnavailableException("事件寫入失敗", e);
			}
		}
	}

	private List<StoredEvent> insert(List<EncodedEvent> batch, String expectedAggregateId, long expectedVersion) {
		jdbcTemplate.update(RESERVE_SEQUENCE, batch.size());
		Long lastSequence = jdbcTemplate.queryForObject(CURRENT_SEQUENCE, Long.class);
		if (lastSequence == null) {
			throw new IllegalStateException("event_store_sequence 尚未初始化");
		}

		if (expectedAggregateId != null) {
			long actual = currentVersion(expectedAggregateId);
			if (actual != expectedVersion) {
				throw new ConcurrencyConflictException(expectedAggregateId, expectedVersion, actual);
			}
		}

		Instant storedAt = clock.instant();
		long sequence = lastSequence - batch.size();
		Map<String, Long> nextVersions = new HashMap<>();
		List<StoredEvent> stored = new ArrayList<>(batch.size());
		for (EncodedEvent encoded : batch) {
			String aggregateId = encoded.event().getAggregateId();
			long version = 1;
			if (aggregateId != null) {
				version = nextVersions.merge(aggregateId, currentVersion(aggregateId) + 1,
						(previous, ignored) -> previous + 1);
			}
			stored.add(new StoredEvent(++sequence, version, encoded.event(), storedAt));
		}

		jdbcTemplate.batchUpdate(INSERT_EVENT, new BatchPreparedStatementSetter() {
			@Override
			public void setValues(PreparedStatement ps, int i) throws SQLException {
				StoredEvent row = stored.get(i);
				EncodedEvent encoded = batch.get(i);
				DomainEvent event = row.getEvent();
				ps.setLong(1, row.getSequenceNumber());
				ps.setString(2, event.getEventId());
				ps.setString(3, event.getEventType());
				if (event.getAggregateId() == null) {
					ps.setNull(4, Types.VARCHAR);
				} else {
					ps.setString(4, event.getAggregateId());
				}
				ps.setLong(5, row.getVersion());
				ps.setString(6, encoded.payload());
				ps.setString(7, encoded.metadata());
				ps.setTimestamp(8, Timestamp.from(event.getOccurredOn()));
				ps.setTimestamp(9, Timestamp.from(row.getStoredAt()));
			}

			@Override
			public int getBatchSize() {
				return batch.size();
			}
		});

		log.debug(">>> [EventStore] 寫入 {} 筆事件 (Seq: {} ~ {})", stored.size(), stored.get(0).getSequenceNumber(),
				lastSequence);
		return List.copyOf(stored);
	}

	private long currentVersion(String aggregateId) {
		Long version = jdbcTemplate.queryForObject(CURRENT_VERSION, Long.class, aggregateId);
		return version == null ? 0 : version;
	}

	private String findExistingEventId(Set<String> eventIds) {
		try {
			for (String eventId : eventIds) {
				Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM domain_events WHERE event_id = ?",
						Long.class, eventId);
				if (count != null && count > 0) {
					return eventId;
				}
			}
			return null;
		} catch (DataAccessException e) {
			throw new StorageUnavailableException("檢查重複事件失敗", e);
		}
	}

	@Override
	public List<DomainEvent> getEventsForAggregate(String aggregateId) {
		return query(() -> jdbcTemplate.query(SELECT_EVENTS + "WHERE aggregate_id = ? ORDER BY version",
				(rs, rowNum) -> mapper.toDomainEvent(rs), aggregateId));
	}

	@Override
	public List<DomainEvent> getEventsForAggregateFromVersion(String aggregateId, long fromVersion) {
		return query(() -> jdbcTemplate.query(SELECT_EVENTS + "WHERE aggregate_id = ? AND version > ? ORDER BY version",
				(rs, rowNum) -> mapper.toDomainEvent(rs), aggregateId, fromVersion));
	}

	@Override
	public List<DomainEvent> getEventsByType(String eventType) {
		return query(() -> jdbcTemplate.query(SELECT_EVENTS + "WHERE event_type = ? ORDER BY sequence_number",
				(rs, rowNum) -> mapper.toDomainEvent(rs), eventType));
	}

	@Override
	public List<DomainEvent> getEventsAfter(Instant after) {
		return query(() -> jdbcTemplate.query(SELECT_EVENTS + "WHERE occurred_on > ? ORDER BY sequence_number",
				(rs, rowNum) -> mapper.toDomainEvent(rs), Timestamp.from(after)));
	}

	@Override
	public List<DomainEvent> getEventsBetween(Instant from, Instant to) {
		return query(() -> jdbcTemplate.query(
				SELECT_EVENTS + "WHERE occurred_on >= ? AND occurred_on <= ? ORDER BY sequence_number",
				(rs, rowNum) -> mapper.toDomainEvent(rs), Timestamp.from(from), Timestamp.from(to)));
	}

	@Override
	public long getAggregateVersion(String aggregateId) {
		return query(() -> currentVersion(aggregateId));
	}

	@Override
	public List<StoredEvent> readAll(long afterSequence, int limit) {
		if (limit <= 0) {
			throw new IllegalArgumentException("limit 必須大於 0");
		}
		return query(() -> jdbcTemplate.query(
				SELECT_EVENTS + "WHERE sequence_number > ? ORDER BY sequence_number LIMIT ?",
				(rs, rowNum) -> mapper.toStoredEvent(rs), afterSequence, limit));
	}

	@Override
	public long getLastSequenceNumber() {
		return query(() -> jdbcTemplate.queryForObject("SELECT COALESCE(MAX(sequence_number), 0) FROM domain_events",
				Long.class));
	}

	@Override
	public long count() {
		return query(() -> jdbcTemplate.queryForObject("SELECT COUNT(*) FROM domain_events", Long.class));
	}

	@Override
	public long countForAggregate(String aggregateId) {
		return query(() -> jdbcTemplate.queryForObject("SELECT COUNT(*) FROM domain_events WHERE aggregate_id = ?",
				Long.class, aggregateId));
	}

	private <T> T query(Supplier<T> query) {
		try {
			return query.get();
		} catch (DataAccessException e) {
			throw new StorageUnavailableException("事件查詢失敗", e);
		}
	}
}
