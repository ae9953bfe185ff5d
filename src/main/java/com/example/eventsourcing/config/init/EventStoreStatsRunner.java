package com.example.eventsourcing.config.init;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.example.eventsourcing.application.service.EventStoreStatisticsService;
import com.example.eventsourcing.application.shared.dto.EventStoreStatistics;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 事件儲存統計指令
 *
 * <pre>
 * java -jar app.jar --eventsourcing.tools.command=stats
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "eventsourcing.tools", name = "command", havingValue = "stats")
public class EventStoreStatsRunner implements ApplicationRunner {

	private final EventStoreStatisticsService statisticsService;

	@Override
	public void run(ApplicationArguments args) {
		EventStoreStatistics statistics = statisticsService.collect();

		log.info("=== 事件儲存統計 ===");
		log.info(">>> [Stats] 事件總數: {}", statistics.totalEvents());
		log.info(">>> [Stats] 聚合根數: {}", statistics.uniqueAggregates());
		log.info(">>> [Stats] 最新序號: {}", statistics.lastSequenceNumber());
		statistics.eventsByType().forEach((type, count) -> log.info(">>> [Stats]   {}: {}", type, count));
	}
}
