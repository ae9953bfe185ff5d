package com.example.eventsourcing.infra.persistence;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.eventsourcing.application.domain.event.StoredEvent;
import com.example.eventsourcing.application.port.EventStorePort;
import com.example.eventsourcing.fixture.ProductCreated;

class InMemoryEventStoreTest extends AbstractEventStoreTest {

	private static final Instant NOW = Instant.parse("2025-06-01T08:00:00Z");

	@Override
	protected EventStorePort createStore() {
		return new InMemoryEventStore(Clock.fixed(NOW, ZoneOffset.UTC));
	}

	@Override
	protected int concurrentWriters() {
		return 64;
	}

	@Test
	@DisplayName("寫入時間取自注入的 Clock")
	void storedAtComesFromClock() {
		List<StoredEvent> stored = store.appendAll(List.of(new ProductCreated("A", "Alpha", 1)));

		assertThat(stored.get(0).getStoredAt()).isEqualTo(NOW);
	}

	@Test
	@DisplayName("空批次不寫入任何事件")
	void emptyBatchIsNoop() {
		assertThat(store.appendAll(List.of())).isEmpty();
		assertThat(store.count()).isZero();
		assertThat(store.getLastSequenceNumber()).isZero();
	}
}
