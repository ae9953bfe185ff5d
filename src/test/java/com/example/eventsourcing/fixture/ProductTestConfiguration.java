package com.example.eventsourcing.fixture;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

import com.example.eventsourcing.application.port.AggregateRepositoryPort;
import com.example.eventsourcing.infra.adapter.EventSourcedRepositoryFactory;
import com.example.eventsourcing.infra.event.codec.EventCodec;

/**
 * 整合測試用的商品領域 Bean
 */
@TestConfiguration
public class ProductTestConfiguration {

	@Bean
	public EventCodec<ProductCreated> productCreatedCodec() {
		return new ProductEventCodecs.CreatedCodec();
	}

	@Bean
	public EventCodec<ProductRenamed> productRenamedCodec() {
		return new ProductEventCodecs.RenamedCodec();
	}

	@Bean
	public EventCodec<ProductPriceChanged> productPriceChangedCodec() {
		return new ProductEventCodecs.PriceChangedCodec();
	}

	@Bean
	public ProductCatalogProjector productCatalogProjector() {
		return new ProductCatalogProjector();
	}

	@Bean
	public PriceHistoryProjector priceHistoryProjector() {
		return new PriceHistoryProjector();
	}

	@Bean
	public AggregateRepositoryPort<Product> productRepository(EventSourcedRepositoryFactory factory) {
		return factory.create(Product.TYPE, Product::new);
	}
}
