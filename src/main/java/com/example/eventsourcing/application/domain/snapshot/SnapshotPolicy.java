package com.example.eventsourcing.application.domain.snapshot;

import com.example.eventsourcing.application.domain.aggregate.EventSourcedAggregateRoot;

/**
 * 快照策略：決定聚合根儲存後是否需要建立快照
 */
@FunctionalInterface
public interface SnapshotPolicy {

	int DEFAULT_THRESHOLD = 10;

	boolean shouldSnapshot(EventSourcedAggregateRoot<?> aggregate);

	/**
	 * 版本為 threshold 的整數倍時建立快照
	 */
	static SnapshotPolicy everyNthVersion(int threshold) {
		if (threshold <= 0) {
			throw new IllegalArgumentException("快照門檻必須大於 0 (目前: " + threshold + ")");
		}
		return aggregate -> aggregate.getVersion() > 0 && aggregate.getVersion() % threshold == 0;
	}

	static SnapshotPolicy never() {
		return aggregate -> false;
	}
}
