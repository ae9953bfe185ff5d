package com.example.eventsourcing.infra.adapter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.eventsourcing.application.domain.event.DomainEvent;
import com.example.eventsourcing.application.domain.event.StoredEvent;
import com.example.eventsourcing.application.domain.exception.AggregateNotFoundException;
import com.example.eventsourcing.application.domain.exception.ConcurrencyConflictException;
import com.example.eventsourcing.application.domain.exception.StorageUnavailableException;
import com.example.eventsourcing.application.domain.snapshot.Snapshot;
import com.example.eventsourcing.application.domain.snapshot.SnapshotPolicy;
import com.example.eventsourcing.application.port.EventStorePort;
import com.example.eventsourcing.application.port.ProjectionBusPort;
import com.example.eventsourcing.application.port.SnapshotStorePort;
import com.example.eventsourcing.fixture.Product;
import com.example.eventsourcing.fixture.ProductCreated;
import com.example.eventsourcing.fixture.ProductRenamed;
import com.example.eventsourcing.infra.persistence.InMemoryEventStore;
import com.example.eventsourcing.infra.persistence.InMemorySnapshotStore;

/**
 * <h1>事件溯源倉儲轉接器測試</h1>
 *
 * <pre>
 * <b>Scenario:</b> 載入時快照優先，儲存時寫入事件、建立快照並通知投影。
 * <b>Given</b> 記憶體事件儲存與快照儲存。
 * <b>When</b>  儲存與載入聚合根，或底層儲存失敗。
 * <b>Then</b>  載入結果與完整重播一致，快照失敗退回完整重播，事件儲存失敗直接拋出。
 * </pre>
 */
class EventSourcedRepositoryAdapterTest {

	private EventStorePort eventStore;

	private SnapshotStorePort snapshotStore;

	private ProjectionBusPort projectionBus;

	@BeforeEach
	void setUp() {
		eventStore = spy(new InMemoryEventStore());
		snapshotStore = spy(new InMemorySnapshotStore());
		projectionBus = mock(ProjectionBusPort.class);
	}

	private EventSourcedRepositoryAdapter<Product> repository(SnapshotPolicy policy) {
		return EventSourcedRepositoryAdapter.<Product>builder().aggregateType(Product.TYPE).factory(Product::new)
				.eventStore(eventStore).snapshotStore(snapshotStore).snapshotPolicy(policy).snapshotRetainCount(2)
				.projectionBus(projectionBus).build();
	}

	@Test
	@DisplayName("Created(42) 與 Renamed(42, X) 載入後版本為 2、名稱為 X")
	void loadsByFullReplay() {
		eventStore.appendAll(List.of(new ProductCreated("42", "Original", 100), new ProductRenamed("42", "X")));

		Product product = repository(SnapshotPolicy.never()).getById("42");

		assertThat(product.getVersion()).isEqualTo(2);
		assertThat(product.getName()).isEqualTo("X");
	}

	@Test
	@DisplayName("版本 5 的快照加上版本 6~8 的事件：只重播 3 筆事件")
	void loadsFromSnapshotAndReplaysTail() {
		Product product = Product.create("P-1", "Start", 10);
		for (int i = 1; i <= 4; i++) {
			product.changePrice(10 + i);
		}
		DirectWriter.save(eventStore, product);
		snapshotStore.saveSnapshot(Snapshot.of(product, Product.TYPE, Instant.now()));
		product.rename("After");
		product.changePrice(99);
		product.changePrice(100);
		DirectWriter.save(eventStore, product);

		Product loaded = repository(SnapshotPolicy.never()).getById("P-1");

		verify(eventStore).getEventsForAggregateFromVersion("P-1", 5);
		verify(eventStore, never()).getEventsForAggregate(anyString());
		assertThat(eventStore.getEventsForAggregateFromVersion("P-1", 5)).hasSize(3);
		assertThat(loaded.getVersion()).isEqualTo(8);
		assertThat(loaded.getName()).isEqualTo("After");
		assertThat(loaded.getPrice()).isEqualTo(100);
	}

	@Test
	@DisplayName("沒有任何事件時 findById 為空，getById 拋出 AggregateNotFoundException")
	void missingAggregate() {
		EventSourcedRepositoryAdapter<Product> repository = repository(SnapshotPolicy.never());

		assertThat(repository.findById("nope")).isEmpty();
		assertThatThrownBy(() -> repository.getById("nope")).isInstanceOf(AggregateNotFoundException.class)
				.hasMessageContaining("nope");
	}

	@Test
	@DisplayName("儲存時寫入待寫入事件、清空緩衝並通知投影")
	void savePersistsPendingEvents() {
		EventSourcedRepositoryAdapter<Product> repository = repository(SnapshotPolicy.never());
		Product product = Product.create("P-1", "Keyboard", 1200);
		product.rename("Mechanical Keyboard");

		List<StoredEvent> stored = repository.save(product);

		assertThat(stored).extracting(StoredEvent::getVersion).containsExactly(1L, 2L);
		assertThat(product.hasPendingEvents()).isFalse();
		assertThat(eventStore.getAggregateVersion("P-1")).isEqualTo(2);
		verify(projectionBus).publish(stored);

		Product loaded = repository.getById("P-1");
		loaded.changePrice(1500);
		repository.save(loaded);
		assertThat(repository.getById("P-1").getPrice()).isEqualTo(1500);
	}

	@Test
	@DisplayName("沒有待寫入事件時儲存不做任何事")
	void saveWithoutPendingEventsIsNoop() {
		EventSourcedRepositoryAdapter<Product> repository = repository(SnapshotPolicy.everyNthVersion(1));
		eventStore.appendAll(List.of(new ProductCreated("P-1", "Keyboard", 1)));
		Product loaded = repository.getById("P-1");

		assertThat(repository.save(loaded)).isEmpty();

		assertThat(eventStore.count()).isEqualTo(1);
		verify(eventStore, never()).appendAll(anyString(), any(), eq(1L));
		verify(snapshotStore, never()).saveSnapshot(any());
		verifyNoInteractions(projectionBus);
	}

	@Test
	@DisplayName("預設策略在版本 10 建立快照，並依保留數清理舊快照")
	void snapshotsEveryTenthVersion() {
		EventSourcedRepositoryAdapter<Product> repository = repository(SnapshotPolicy.everyNthVersion(10));
		Product product = Product.create("P-1", "Start", 0);
		for (int i = 1; i <= 8; i++) {
			product.changePrice(i);
		}
		repository.save(product);
		assertThat(snapshotStore.getSnapshot("P-1")).isEmpty();

		product.changePrice(9);
		repository.save(product);
		assertThat(snapshotStore.getSnapshot("P-1")).get().extracting(Snapshot::getVersion).isEqualTo(10L);

		for (int round = 2; round <= 3; round++) {
			for (int i = 0; i < 10; i++) {
				product.changePrice(round * 100 + i);
				repository.save(product);
			}
		}
		assertThat(snapshotStore.getSnapshot("P-1")).get().extracting(Snapshot::getVersion).isEqualTo(30L);
		assertThat(snapshotStore.getSnapshotAtVersion("P-1", 20)).isPresent();
		assertThat(snapshotStore.getSnapshotAtVersion("P-1", 10)).isEmpty();
	}

	@Test
	@DisplayName("快照寫入失敗不影響儲存結果")
	void snapshotWriteFailureDoesNotFailSave() {
		doThrow(new StorageUnavailableException("snapshot table down", new RuntimeException())).when(snapshotStore)
				.saveSnapshot(any());
		EventSourcedRepositoryAdapter<Product> repository = repository(SnapshotPolicy.everyNthVersion(1));

		List<StoredEvent> stored = repository.save(Product.create("P-1", "Keyboard", 1));

		assertThat(stored).hasSize(1);
		assertThat(eventStore.count()).isEqualTo(1);
		verify(projectionBus).publish(stored);
	}

	@Test
	@DisplayName("快照讀取失敗時退回完整重播")
	void snapshotReadFailureFallsBackToFullReplay() {
		eventStore.appendAll(List.of(new ProductCreated("42", "Original", 100), new ProductRenamed("42", "X")));
		doThrow(new StorageUnavailableException("snapshot table down", new RuntimeException())).when(snapshotStore)
				.getSnapshot("42");

		Product product = repository(SnapshotPolicy.never()).getById("42");

		assertThat(product.getVersion()).isEqualTo(2);
		assertThat(product.getName()).isEqualTo("X");
	}

	@Test
	@DisplayName("快照內容無法還原或類型不符時退回完整重播")
	void unusableSnapshotFallsBackToFullReplay() {
		eventStore.appendAll(List.of(new ProductCreated("42", "Original", 100), new ProductRenamed("42", "X")));
		snapshotStore.saveSnapshot(Snapshot.builder().aggregateId("42").aggregateType(Product.TYPE).version(2)
				.state(Map.of("unexpected", true)).createdAt(Instant.now()).build());

		Product fromBrokenState = repository(SnapshotPolicy.never()).getById("42");
		assertThat(fromBrokenState.getName()).isEqualTo("X");

		snapshotStore.saveSnapshot(Snapshot.builder().aggregateId("42").aggregateType("Order").version(2)
				.state(Map.of("name", "wrong", "price", 1, "renameCount", 0)).createdAt(Instant.now()).build());
		Product fromForeignType = repository(SnapshotPolicy.never()).getById("42");
		assertThat(fromForeignType.getName()).isEqualTo("X");
	}

	@Test
	@DisplayName("事件儲存讀取失敗時拋出例外，而不是回報聚合根不存在")
	void eventStoreFailurePropagates() {
		EventStorePort failing = mock(EventStorePort.class);
		when(failing.getEventsForAggregate("42"))
				.thenThrow(new StorageUnavailableException("db down", new RuntimeException()));
		EventSourcedRepositoryAdapter<Product> repository = EventSourcedRepositoryAdapter.<Product>builder()
				.aggregateType(Product.TYPE).factory(Product::new).eventStore(failing).build();

		assertThatThrownBy(() -> repository.findById("42")).isInstanceOf(StorageUnavailableException.class);
	}

	@Test
	@DisplayName("並發修改同一聚合根時，後儲存者收到 ConcurrencyConflictException，且不建立快照")
	void concurrentModificationIsRejected() {
		EventSourcedRepositoryAdapter<Product> repository = repository(SnapshotPolicy.everyNthVersion(2));
		repository.save(Product.create("P-1", "Keyboard", 1));
		Product first = repository.getById("P-1");
		Product second = repository.getById("P-1");

		first.rename("First");
		repository.save(first);
		second.rename("Second");

		assertThatThrownBy(() -> repository.save(second)).isInstanceOf(ConcurrencyConflictException.class);
		assertThat(second.hasPendingEvents()).isTrue();
		assertThat(repository.getById("P-1").getName()).isEqualTo("First");
		verify(snapshotStore).saveSnapshot(any());
	}

	@Test
	@DisplayName("投影通知失敗不影響儲存結果")
	void projectionFailureDoesNotFailSave() {
		doThrow(new IllegalStateException("projector down")).when(projectionBus).publish(any());

		List<StoredEvent> stored = repository(SnapshotPolicy.never()).save(Product.create("P-1", "Keyboard", 1));

		assertThat(stored).hasSize(1);
	}

	@Test
	@DisplayName("載入指定版本：使用該版本的快照，或重播前 N 筆事件")
	void loadsHistoricalVersion() {
		EventSourcedRepositoryAdapter<Product> repository = repository(SnapshotPolicy.never());
		Product product = Product.create("P-1", "v1", 1);
		product.rename("v2");
		product.rename("v3");
		repository.save(product);

		assertThat(repository.findByIdAtVersion("P-1", 2)).get().extracting(Product::getName).isEqualTo("v2");
		assertThat(repository.findByIdAtVersion("P-1", 4)).isEmpty();

		snapshotStore.saveSnapshot(Snapshot.builder().aggregateId("P-1").aggregateType(Product.TYPE).version(1)
				.state(Map.of("name", "from-snapshot", "price", 1, "renameCount", 0)).createdAt(Instant.now()).build());
		Optional<Product> atOne = repository.findByIdAtVersion("P-1", 1);
		assertThat(atOne).get().extracting(Product::getName).isEqualTo("from-snapshot");
		assertThat(atOne.get().getVersion()).isEqualTo(1);
	}

	/**
	 * 直接寫入待寫入事件，不經過倉儲
	 */
	private static final class DirectWriter {

		static void save(EventStorePort store, Product product) {
			List<DomainEvent> pending = product.pullPendingEvents();
			store.appendAll(product.getId(), pending, product.getVersion() - pending.size());
		}
	}
}
