package com.example.eventsourcing.infra.persistence;

import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

import com.example.eventsourcing.application.domain.snapshot.Snapshot;
import com.example.eventsourcing.application.port.SnapshotStorePort;

/**
 * 記憶體快照儲存，每個聚合根以版本排序保存
 */
public class InMemorySnapshotStore implements SnapshotStorePort {

	private final Map<String, ConcurrentSkipListMap<Long, Snapshot>> snapshots = new ConcurrentHashMap<>();

	@Override
	public void saveSnapshot(Snapshot snapshot) {
		snapshots.computeIfAbsent(snapshot.getAggregateId(), key -> new ConcurrentSkipListMap<>())
				.put(snapshot.getVersion(), snapshot);
	}

	@Override
	public Optional<Snapshot> getSnapshot(String aggregateId) {
		NavigableMap<Long, Snapshot> versions = snapshots.get(aggregateId);
		if (versions == null) {
			return Optional.empty();
		}
		Map.Entry<Long, Snapshot> latest = versions.lastEntry();
		return latest == null ? Optional.empty() : Optional.of(latest.getValue());
	}

	@Override
	public Optional<Snapshot> getSnapshotAtVersion(String aggregateId, long version) {
		NavigableMap<Long, Snapshot> versions = snapshots.get(aggregateId);
		return versions == null ? Optional.empty() : Optional.ofNullable(versions.get(version));
	}

	@Override
	public int deleteSnapshotsOlderThan(String aggregateId, long beforeVersion) {
		NavigableMap<Long, Snapshot> versions = snapshots.get(aggregateId);
		if (versions == null) {
			return 0;
		}
		NavigableMap<Long, Snapshot> older = versions.headMap(beforeVersion, false);
		int removed = older.size();
		older.clear();
		return removed;
	}

	@Override
	public int retainLatest(String aggregateId, int count) {
		if (count <= 0) {
			throw new IllegalArgumentException("保留數量必須大於 0");
		}
		NavigableMap<Long, Snapshot> versions = snapshots.get(aggregateId);
		if (versions == null) {
			return 0;
		}
		int removed = 0;
		while (versions.size() > count && versions.pollFirstEntry() != null) {
			removed++;
		}
		return removed;
	}

	@Override
	public int deleteSnapshots(String aggregateId) {
		NavigableMap<Long, Snapshot> removed = snapshots.remove(aggregateId);
		return removed == null ? 0 : removed.size();
	}
}
