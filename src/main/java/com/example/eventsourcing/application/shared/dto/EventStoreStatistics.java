package com.example.eventsourcing.application.shared.dto;

import java.util.Map;

/**
 * 事件儲存統計
 *
 * @param totalEvents       事件總數
 * @param eventsByType      各事件類型的數量，依數量遞減排序
 * @param uniqueAggregates  不重複的聚合根數量
 * @param lastSequenceNumber 最後一個全域序號
 */
public record EventStoreStatistics(long totalEvents, Map<String, Long> eventsByType, long uniqueAggregates,
		long lastSequenceNumber) {
}
