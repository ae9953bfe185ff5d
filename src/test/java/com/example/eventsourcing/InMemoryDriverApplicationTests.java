package com.example.eventsourcing;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Import;

import com.example.eventsourcing.application.port.AggregateRepositoryPort;
import com.example.eventsourcing.application.port.EventStorePort;
import com.example.eventsourcing.application.port.ProjectionBusPort;
import com.example.eventsourcing.config.init.EventStoreStatsRunner;
import com.example.eventsourcing.config.init.ListEventsRunner;
import com.example.eventsourcing.config.init.ProjectionRebuildRunner;
import com.example.eventsourcing.fixture.PriceHistoryProjector;
import com.example.eventsourcing.fixture.Product;
import com.example.eventsourcing.fixture.ProductTestConfiguration;
import com.example.eventsourcing.infra.adapter.SynchronousProjectionBusAdapter;
import com.example.eventsourcing.infra.persistence.InMemoryEventStore;

/**
 * 記憶體儲存 + 同步投影的設定組合，並在啟動時執行投影重建指令
 */
@SpringBootTest(properties = { "eventsourcing.store.driver=memory", "eventsourcing.projection.async=false",
		"eventsourcing.tools.command=projection-rebuild" }, args = "--all")
@Import(ProductTestConfiguration.class)
class InMemoryDriverApplicationTests {

	@Autowired
	private AggregateRepositoryPort<Product> productRepository;

	@Autowired
	private EventStorePort eventStore;

	@Autowired
	private ProjectionBusPort projectionBus;

	@Autowired
	private PriceHistoryProjector prices;

	@Autowired
	private ApplicationContext context;

	@Test
	@DisplayName("eventsourcing.tools.command 只啟用對應的維運指令")
	void enablesOnlyTheSelectedCommand() {
		assertThat(context.getBeanNamesForType(ProjectionRebuildRunner.class)).hasSize(1);
		assertThat(context.getBeanNamesForType(ListEventsRunner.class)).isEmpty();
		assertThat(context.getBeanNamesForType(EventStoreStatsRunner.class)).isEmpty();
	}

	@Test
	@DisplayName("driver=memory 且 async=false 時使用記憶體儲存並同步投影")
	void usesMemoryStoreWithSynchronousProjection() {
		assertThat(eventStore).isInstanceOf(InMemoryEventStore.class);
		assertThat(projectionBus).isInstanceOf(SynchronousProjectionBusAdapter.class);

		Product product = Product.create("P-1", "Lamp", 30);
		product.changePrice(35);
		productRepository.save(product);

		assertThat(prices.getPrices()).containsExactly(35L);
		assertThat(productRepository.getById("P-1").getPrice()).isEqualTo(35);
	}
}
