package com.example.eventsourcing.infra.persistence;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import com.example.eventsourcing.application.domain.event.DomainEvent;
import com.example.eventsourcing.application.domain.event.StoredEvent;
import com.example.eventsourcing.application.domain.exception.ConcurrencyConflictException;
import com.example.eventsourcing.application.domain.exception.DuplicateEventException;
import com.example.eventsourcing.application.port.EventStorePort;

import lombok.extern.slf4j.Slf4j;

/**
 * <h1>記憶體事件儲存</h1>
 * <p>
 * 以讀寫鎖保護的記憶體日誌，適用於測試與單機情境。全域序號等於事件在日誌中的位置 (從 1 起算)。
 * </p>
 * <ul>
 * <li>寫入批次先完整驗證 (重複 eventId、預期版本) 後才寫入，失敗時日誌不變</li>
 * <li>以聚合根與事件類型建立索引</li>
 * </ul>
 */
@Slf4j
public class InMemoryEventStore implements EventStorePort {

	private final List<StoredEvent> journal = new ArrayList<>();

	private final Map<String, List<StoredEvent>> eventsByAggregate = new HashMap<>();

	private final Map<String, List<StoredEvent>> eventsByType = new HashMap<>();

	private final Set<String> eventIds = new HashSet<>();

	private final ReadWriteLock lock = new ReentrantReadWriteLock();

	private final Clock clock;

	public InMemoryEventStore() {
		this(Clock.systemUTC());
	}

	public InMemoryEventStore(Clock clock) {
		this.clock = clock;
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
		events.forEach(event -> Objects.requireNonNull(event, "event"));
		if (events.isEmpty()) {
			return List.of();
		}

		lock.writeLock().lock();
		try {
			if (expectedAggregateId != null) {
				long actual = currentVersion(expectedAggregateId);
				if (actual != expectedVersion) {
					throw new ConcurrencyConflictException(expectedAggregateId, expectedVersion, actual);
				}
			}

			Set<String> batchIds = new HashSet<>();
			for (DomainEvent event : events) {
				if (eventIds.contains(event.getEventId()) || !batchIds.add(event.getEventId())) {
					throw new DuplicateEventException(event.getEventId());
				}
			}

			Instant storedAt = clock.instant();
			Map<String, Long> nextVersions = new HashMap<>();
			List<StoredEvent> stored = new ArrayList<>(events.size());
			long sequence = journal.size();
			for (DomainEvent event : events) {
				long version = 1;
				if (event.getAggregateId() != null) {
					version = nextVersions.merge(event.getAggregateId(), currentVersion(event.getAggregateId()) + 1,
							(previous, ignored) -> previous + 1);
				}
				stored.add(new StoredEvent(++sequence, version, event, storedAt));
			}

			stored.forEach(this::index);
			log.debug(">>> [EventStore] 寫入 {} 筆事件 (Seq: {} ~ {})", stored.size(), stored.get(0).getSequenceNumber(),
					sequence);
			return List.copyOf(stored);
		} finally {
			lock.writeLock().unlock();
		}
	}

	private void index(StoredEvent stored) {
		journal.add(stored);
		eventIds.add(stored.getEventId());
		eventsByType.computeIfAbsent(stored.getEventType(), key -> new ArrayList<>()).add(stored);
		if (stored.getAggregateId() != null) {
			eventsByAggregate.computeIfAbsent(stored.getAggregateId(), key -> new ArrayList<>()).add(stored);
		}
	}

	private long currentVersion(String aggregateId) {
		List<StoredEvent> stream = eventsByAggregate.get(aggregateId);
		return (stream == null || stream.isEmpty()) ? 0 : stream.get(stream.size() - 1).getVersion();
	}

	@Override
	public List<DomainEvent> getEventsForAggregate(String aggregateId) {
		return getEventsForAggregateFromVersion(aggregateId, 0);
	}

	@Override
	public List<DomainEvent> getEventsForAggregateFromVersion(String aggregateId, long fromVersion) {
		return read(() -> toEvents(eventsByAggregate.getOrDefault(aggregateId, List.of()),
				stored -> stored.getVersion() > fromVersion));
	}

	@Override
	public List<DomainEvent> getEventsByType(String eventType) {
		return read(() -> toEvents(eventsByType.getOrDefault(eventType, List.of()), stored -> true));
	}

	@Override
	public List<DomainEvent> getEventsAfter(Instant after) {
		return read(() -> toEvents(journal, stored -> stored.getEvent().getOccurredOn().isAfter(after)));
	}

	@Override
	public List<DomainEvent> getEventsBetween(Instant from, Instant to) {
		return read(() -> toEvents(journal, stored -> {
			Instant occurredOn = stored.getEvent().getOccurredOn();
			return !occurredOn.isBefore(from) && !occurredOn.isAfter(to);
		}));
	}

	@Override
	public long getAggregateVersion(String aggregateId) {
		return read(() -> currentVersion(aggregateId));
	}

	@Override
	public List<StoredEvent> readAll(long afterSequence, int limit) {
		if (limit <= 0) {
			throw new IllegalArgumentException("limit 必須大於 0");
		}
		return read(() -> {
			int from = (int) Math.min(Math.max(afterSequence, 0), journal.size());
			int to = (int) Math.min((long) from + limit, journal.size());
			return List.copyOf(journal.subList(from, to));
		});
	}

	@Override
	public long getLastSequenceNumber() {
		return read(() -> (long) journal.size());
	}

	@Override
	public long count() {
		return read(() -> (long) journal.size());
	}

	@Override
	public long countForAggregate(String aggregateId) {
		return read(() -> (long) eventsByAggregate.getOrDefault(aggregateId, List.of()).size());
	}

	private <T> T read(Supplier<T> query) {
		lock.readLock().lock();
		try {
			return query.get();
		} finally {
			lock.readLock().unlock();
		}
	}

	private static List<DomainEvent> toEvents(List<StoredEvent> source, Predicate<StoredEvent> filter) {
		return source.stream().filter(filter).map(StoredEvent::getEvent).collect(Collectors.toList());
	}
}
