package com.example.eventsourcing.application.service;

import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.example.eventsourcing.application.domain.event.StoredEvent;
import com.example.eventsourcing.application.port.EventStorePort;
import com.example.eventsourcing.application.shared.dto.EventStoreStatistics;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 事件儲存統計服務，依全域序號分頁掃描整個事件儲存
 */
@Slf4j
@RequiredArgsConstructor
public class EventStoreStatisticsService {

	private final EventStorePort eventStore;

	private final int batchSize;

	public EventStoreStatistics collect() {
		Map<String, Long> counts = new HashMap<>();
		Set<String> aggregates = new HashSet<>();
		long total = 0;
		long cursor = 0;

		while (true) {
			List<StoredEvent> page = eventStore.readAll(cursor, batchSize);
			for (StoredEvent event : page) {
				counts.merge(event.getEventType(), 1L, Long::sum);
				if (event.getAggregateId() != null) {
					aggregates.add(event.getAggregateId());
				}
				cursor = event.getSequenceNumber();
			}
			total += page.size();
			if (page.size() < batchSize) {
				break;
			}
		}

		Map<String, Long> sorted = new LinkedHashMap<>();
		Comparator<Map.Entry<String, Long>> byCountDesc = Map.Entry.<String, Long>comparingByValue().reversed();
		counts.entrySet().stream().sorted(byCountDesc.thenComparing(Map.Entry.<String, Long>comparingByKey()))
				.forEach(entry -> sorted.put(entry.getKey(), entry.getValue()));

		log.info(">>> [Stats] 事件總數 {}，事件類型 {} 種，聚合根 {} 個", total, sorted.size(), aggregates.size());
		return new EventStoreStatistics(total, Collections.unmodifiableMap(sorted), aggregates.size(), cursor);
	}
}
