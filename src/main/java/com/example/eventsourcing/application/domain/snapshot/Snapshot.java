package com.example.eventsourcing.application.domain.snapshot;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.example.eventsourcing.application.domain.aggregate.EventSourcedAggregateRoot;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 聚合根快照
 * <p>
 * 記錄聚合根在某個版本的完整狀態。重建時從快照版本之後的事件開始補齊，省去重播整條事件流。
 * </p>
 */
@Getter
@ToString(exclude = "state")
public class Snapshot {

	/**
	 * 聚合根識別碼
	 */
	private final String aggregateId;

	/**
	 * 聚合根類型，載入時用來排除其他類型寫入的快照
	 */
	private final String aggregateType;

	/**
	 * 該版本的聚合根狀態
	 */
	private final Map<String, Object> state;

	/**
	 * 快照涵蓋的最後一個事件版本，重建時從 version + 1 開始重播
	 */
	private final long version;

	private final Instant createdAt;

	@Builder
	public Snapshot(String aggregateId, String aggregateType, Map<String, Object> state, long version,
			Instant createdAt) {
		if (aggregateId == null || aggregateId.isBlank()) {
			throw new IllegalArgumentException("快照缺少聚合根識別碼");
		}
		if (version <= 0) {
			throw new IllegalArgumentException("快照版本必須大於 0 (目前: " + version + ")");
		}
		this.aggregateId = aggregateId;
		this.aggregateType = aggregateType;
		this.state = (state == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(state));
		this.version = version;
		this.createdAt = createdAt;
	}

	public static Snapshot of(EventSourcedAggregateRoot<?> aggregate, String aggregateType, Instant createdAt) {
		return Snapshot.builder().aggregateId(aggregate.getId()).aggregateType(aggregateType)
				.state(aggregate.captureState()).version(aggregate.getVersion()).createdAt(createdAt).build();
	}
}
