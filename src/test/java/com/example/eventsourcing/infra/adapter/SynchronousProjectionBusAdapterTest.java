package com.example.eventsourcing.infra.adapter;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.example.eventsourcing.application.domain.event.StoredEvent;
import com.example.eventsourcing.application.service.ProjectionManager;
import com.example.eventsourcing.fixture.PriceHistoryProjector;
import com.example.eventsourcing.fixture.ProductCatalogProjector;
import com.example.eventsourcing.fixture.ProductCreated;
import com.example.eventsourcing.fixture.ProductPriceChanged;
import com.example.eventsourcing.infra.persistence.InMemoryEventStore;

/**
 * <h1>同步投影通知測試</h1>
 *
 * <pre>
 * <b>Scenario:</b> 兩個寫入端各自提交事件後，以和提交相反的順序通知投影。
 * <b>Given</b> 事件 A (Seq 1) 與 B (Seq 2) 已寫入事件儲存。
 * <b>When</b>  先 publish(B)，再 publish(A)。
 * <b>Then</b>  讀取模型包含 A 與 B，且依儲存順序收到。
 * </pre>
 */
class SynchronousProjectionBusAdapterTest {

	private InMemoryEventStore eventStore;

	private ProductCatalogProjector catalog;

	private PriceHistoryProjector prices;

	private ProjectionManager manager;

	private SynchronousProjectionBusAdapter bus;

	@BeforeEach
	void setUp() {
		eventStore = new InMemoryEventStore();
		catalog = new ProductCatalogProjector();
		prices = new PriceHistoryProjector();
		manager = new ProjectionManager(eventStore);
		manager.registerAll(List.of(catalog, prices));
		bus = new SynchronousProjectionBusAdapter(manager);
	}

	@Test
	@DisplayName("通知順序與提交順序相反時，兩筆事件都依儲存順序投影")
	void projectsInStoreOrderWhenWritersPublishOutOfOrder() {
		StoredEvent alpha = eventStore.append(new ProductCreated("A", "Alpha", 1));
		StoredEvent beta = eventStore.append(new ProductCreated("B", "Beta", 2));

		bus.publish(List.of(beta));
		bus.publish(List.of(alpha));

		assertThat(catalog.getNames()).containsOnlyKeys("A", "B");
		assertThat(catalog.getSeenEventIds()).containsExactly(alpha.getEventId(), beta.getEventId());
		assertThat(manager.getCheckpoint("product-catalog")).isEqualTo(2);
		assertThat(manager.getLiveCursor()).isEqualTo(2);
	}

	@Test
	@DisplayName("每筆事件只投影一次，空批次不觸發讀取")
	void projectsEachEventOnce() {
		StoredEvent first = eventStore.append(new ProductPriceChanged("A", 10));
		bus.publish(List.of(first));
		StoredEvent second = eventStore.append(new ProductPriceChanged("A", 11));
		bus.publish(List.of(second));
		bus.publish(List.of(first, second));
		bus.publish(List.of());

		assertThat(prices.getPrices()).containsExactly(10L, 11L);
	}
}
