package com.example.eventsourcing.application.domain.aggregate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.eventsourcing.application.domain.event.DomainEvent;
import com.example.eventsourcing.application.domain.event.GenericDomainEvent;
import com.example.eventsourcing.application.domain.exception.ReconstitutionException;
import com.example.eventsourcing.application.domain.snapshot.Snapshot;
import com.example.eventsourcing.fixture.Product;
import com.example.eventsourcing.fixture.ProductCreated;
import com.example.eventsourcing.fixture.ProductPriceChanged;
import com.example.eventsourcing.fixture.ProductRenamed;

/**
 * <h1>事件溯源聚合根測試</h1>
 *
 * <pre>
 * <b>Scenario:</b> 聚合根狀態完全由事件決定。
 * <b>Given</b> 一串屬於同一聚合根的事件。
 * <b>When</b>  記錄、重播或從快照還原。
 * <b>Then</b>  版本等於已套用事件數，狀態與重播路徑無關。
 * </pre>
 */
class EventSourcedAggregateRootTest {

	@Test
	@DisplayName("記錄事件時套用狀態、推進版本並加入待寫入緩衝")
	void recordEventAppliesAndBuffers() {
		Product product = Product.create("P-1", "Keyboard", 1200);
		product.rename("Mechanical Keyboard");

		assertThat(product.getVersion()).isEqualTo(2);
		assertThat(product.getPersistedVersion()).isZero();
		assertThat(product.getName()).isEqualTo("Mechanical Keyboard");
		assertThat(product.getPendingEvents()).extracting(DomainEvent::getEventType)
				.containsExactly(ProductCreated.TYPE, ProductRenamed.TYPE);
	}

	@Test
	@DisplayName("業務規則失敗時不產生事件，版本不變")
	void failedCommandRecordsNothing() {
		Product product = Product.create("P-1", "Keyboard", 1200);

		assertThatThrownBy(() -> product.rename(" ")).isInstanceOf(IllegalArgumentException.class);

		assertThat(product.getVersion()).isEqualTo(1);
		assertThat(product.getPendingEvents()).hasSize(1);
	}

	@Test
	@DisplayName("從事件流重建：Created(42) + Renamed(42, X) 得到版本 2、名稱 X")
	void reconstituteFromHistory() {
		List<DomainEvent> history = List.of(new ProductCreated("42", "Original", 100), new ProductRenamed("42", "X"));

		Product product = EventSourcedAggregateRoot.reconstitute(Product::new, history);

		assertThat(product.getId()).isEqualTo("42");
		assertThat(product.getVersion()).isEqualTo(2);
		assertThat(product.getName()).isEqualTo("X");
		assertThat(product.hasPendingEvents()).isFalse();
	}

	@Test
	@DisplayName("空事件流或首筆事件缺少聚合根識別碼時拒絕重建")
	void reconstituteRejectsInvalidStreams() {
		assertThatThrownBy(() -> EventSourcedAggregateRoot.reconstitute(Product::new, List.of()))
				.isInstanceOf(ReconstitutionException.class);

		List<DomainEvent> anonymous = List.of(ProductCreated.withoutAggregate("Nameless", 1));
		assertThatThrownBy(() -> EventSourcedAggregateRoot.reconstitute(Product::new, anonymous))
				.isInstanceOf(ReconstitutionException.class);
	}

	@Test
	@DisplayName("事件流中混入其他聚合根的事件時拒絕重建")
	void reconstituteRejectsForeignEvents() {
		List<DomainEvent> mixed = List.of(new ProductCreated("A", "Alpha", 1), new ProductRenamed("B", "Beta"));

		assertThatThrownBy(() -> EventSourcedAggregateRoot.reconstitute(Product::new, mixed))
				.isInstanceOf(ReconstitutionException.class);
	}

	@Test
	@DisplayName("沒有處理器的事件不改變狀態，但仍計入版本")
	void unhandledEventStillCountsVersion() {
		Product product = Product.create("P-1", "Keyboard", 1200);
		product.record(new GenericDomainEvent("P-1", "product.audited", Map.of("by", "ops")));

		assertThat(product.getVersion()).isEqualTo(2);
		assertThat(product.getName()).isEqualTo("Keyboard");
	}

	@Test
	@DisplayName("記錄不屬於此聚合根的事件時拋出例外")
	void recordRejectsForeignEvent() {
		Product product = Product.create("P-1", "Keyboard", 1200);

		assertThatThrownBy(() -> product.record(new ProductRenamed("P-2", "Other")))
				.isInstanceOf(IllegalArgumentException.class);
		assertThat(product.getVersion()).isEqualTo(1);
	}

	@Test
	@DisplayName("確定性：任一版本 k 的快照加上後續事件，與完整重播結果相同")
	void snapshotPlusTailEqualsFullReplay() {
		List<DomainEvent> history = new ArrayList<>();
		history.add(new ProductCreated("P-9", "Start", 10));
		for (int i = 1; i <= 12; i++) {
			history.add(i % 3 == 0 ? new ProductRenamed("P-9", "Name-" + i) : new ProductPriceChanged("P-9", 10 + i));
		}
		Product full = EventSourcedAggregateRoot.reconstitute(Product::new, history);

		for (int k = 1; k <= history.size(); k++) {
			Product prefix = EventSourcedAggregateRoot.reconstitute(Product::new, history.subList(0, k));
			Snapshot snapshot = Snapshot.of(prefix, Product.TYPE, Instant.now());

			Product restored = new Product("P-9");
			restored.restoreFromSnapshot(snapshot);
			history.subList(k, history.size()).forEach(restored::replay);

			assertThat(restored.getVersion()).isEqualTo(full.getVersion());
			assertThat(restored.captureState()).isEqualTo(full.captureState());
		}
	}

	@Test
	@DisplayName("快照只能還原至全新的聚合根")
	void restoreFromSnapshotRequiresFreshInstance() {
		Product product = Product.create("P-1", "Keyboard", 1200);
		Snapshot snapshot = Snapshot.of(product, Product.TYPE, Instant.now());

		assertThatThrownBy(() -> product.restoreFromSnapshot(snapshot)).isInstanceOf(IllegalStateException.class);
	}

	@Test
	@DisplayName("取出待寫入事件後緩衝清空，版本不變")
	void pullPendingEventsClearsBuffer() {
		Product product = Product.create("P-1", "Keyboard", 1200);
		product.changePrice(1500);

		List<DomainEvent> pulled = product.pullPendingEvents();

		assertThat(pulled).hasSize(2);
		assertThat(product.getPendingEvents()).isEmpty();
		assertThat(product.getVersion()).isEqualTo(2);
		assertThat(product.getPersistedVersion()).isEqualTo(2);
	}

	@Test
	@DisplayName("同一事件類別重複註冊處理器時拋出例外")
	void duplicateHandlerRegistrationFails() {
		EventHandlers.Builder<Product> builder = EventHandlers.<Product>builder().on(ProductRenamed.class,
				(product, event) -> {
				});

		assertThatThrownBy(() -> builder.on(ProductRenamed.class, (product, event) -> {
		})).isInstanceOf(IllegalStateException.class);
	}
}
