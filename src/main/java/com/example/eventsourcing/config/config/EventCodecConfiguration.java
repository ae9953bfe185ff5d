package com.example.eventsourcing.config.config;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.eventsourcing.infra.event.codec.EventCodec;
import com.example.eventsourcing.infra.event.codec.EventCodecRegistry;
import com.example.eventsourcing.infra.event.codec.JsonMapCodec;
import com.example.eventsourcing.infra.event.mapper.StoredEventMapper;

import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

/**
 * EventCodec 的配置類
 * <p>
 * 收集容器中所有 {@link EventCodec} Bean 建立註冊表。新增事件類型時只需宣告對應的編解碼器 Bean。
 * </p>
 */
@Configuration
public class EventCodecConfiguration {

	@Bean
	@ConditionalOnMissingBean(ObjectMapper.class)
	public ObjectMapper eventObjectMapper() {
		return JsonMapper.builder().build();
	}

	@Bean
	public JsonMapCodec jsonMapCodec(ObjectMapper objectMapper) {
		return new JsonMapCodec(objectMapper);
	}

	@Bean
	public EventCodecRegistry eventCodecRegistry(ObjectProvider<EventCodec<?>> codecs,
			EventSourcingProperties properties) {
		EventCodecRegistry registry = new EventCodecRegistry(properties.getCodec().isTolerateUnknownTypes());
		codecs.orderedStream().forEach(registry::register);
		return registry;
	}

	@Bean
	public StoredEventMapper storedEventMapper(EventCodecRegistry eventCodecRegistry, JsonMapCodec jsonMapCodec) {
		return new StoredEventMapper(eventCodecRegistry, jsonMapCodec);
	}
}
