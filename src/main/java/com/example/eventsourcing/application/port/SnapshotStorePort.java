package com.example.eventsourcing.application.port;

import java.util.Optional;

import com.example.eventsourcing.application.domain.snapshot.Snapshot;

/**
 * 快照儲存 Port
 * <p>
 * 以 (aggregateId, version) 為唯一鍵，同一鍵重複寫入時以最後一次為準。
 * </p>
 */
public interface SnapshotStorePort {

	void saveSnapshot(Snapshot snapshot);

	/**
	 * 版本最大的快照
	 */
	Optional<Snapshot> getSnapshot(String aggregateId);

	Optional<Snapshot> getSnapshotAtVersion(String aggregateId, long version);

	/**
	 * 刪除版本小於 beforeVersion 的快照
	 *
	 * @return 刪除筆數
	 */
	int deleteSnapshotsOlderThan(String aggregateId, long beforeVersion);

	/**
	 * 只保留最新的 count 份快照
	 *
	 * @return 刪除筆數
	 */
	int retainLatest(String aggregateId, int count);

	int deleteSnapshots(String aggregateId);
}
