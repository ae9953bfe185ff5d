package com.example.eventsourcing.config.init;

import java.util.List;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.example.eventsourcing.application.domain.event.DomainEvent;
import com.example.eventsourcing.application.domain.event.StoredEvent;
import com.example.eventsourcing.application.port.EventStorePort;
import com.example.eventsourcing.infra.event.codec.EventCodecRegistry;
import com.example.eventsourcing.infra.event.codec.JsonMapCodec;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * <h1>列出事件指令</h1>
 * <p>
 * 依聚合根或事件類型篩選，未指定時依全域序號列出最前面的事件。
 * </p>
 *
 * <pre>
 * java -jar app.jar --eventsourcing.tools.command=list-events [--aggregate=ID] [--type=TYPE] [--limit=20]
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "eventsourcing.tools", name = "command", havingValue = "list-events")
public class ListEventsRunner implements ApplicationRunner {

	public static final int DEFAULT_LIMIT = 20;

	private final EventStorePort eventStore;

	private final EventCodecRegistry codecRegistry;

	private final JsonMapCodec jsonCodec;

	@Override
	public void run(ApplicationArguments args) {
		List<DomainEvent> events = listEvents(RunnerOptions.value(args, "aggregate"),
				RunnerOptions.value(args, "type"), limit(args));

		if (events.isEmpty()) {
			log.info(">>> [Events] 找不到任何事件");
			return;
		}

		log.info(">>> [Events] 共 {} 筆事件", events.size());
		for (int i = 0; i < events.size(); i++) {
			DomainEvent event = events.get(i);
			log.info(">>> [Events] [{}] {} (Event ID: {}, Aggregate ID: {}, Occurred: {}) Payload: {}", i + 1,
					event.getEventType(), event.getEventId(),
					event.getAggregateId() == null ? "N/A" : event.getAggregateId(), event.getOccurredOn(),
					jsonCodec.serialize(codecRegistry.encode(event)));
		}
	}

	/**
	 * 聚合根優先於事件類型，結果最多 limit 筆
	 */
	public List<DomainEvent> listEvents(String aggregateId, String eventType, int limit) {
		if (limit <= 0) {
			throw new IllegalArgumentException("limit 必須大於 0 (目前: " + limit + ")");
		}

		List<DomainEvent> events;
		if (aggregateId != null) {
			events = eventStore.getEventsForAggregate(aggregateId);
		} else if (eventType != null) {
			events = eventStore.getEventsByType(eventType);
		} else {
			events = eventStore.readAll(0, limit).stream().map(StoredEvent::getEvent).toList();
		}
		return events.size() > limit ? events.subList(0, limit) : events;
	}

	private static int limit(ApplicationArguments args) {
		String limit = RunnerOptions.value(args, "limit");
		if (limit == null) {
			return DEFAULT_LIMIT;
		}
		try {
			return Integer.parseInt(limit);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("limit 必須是整數 (目前: " + limit + ")", e);
		}
	}
}
