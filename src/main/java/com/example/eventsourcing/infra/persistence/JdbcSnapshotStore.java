package com.example.eventsourcing.infra.persistence;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import com.example.eventsourcing.application.domain.exception.StorageUnavailableException;
import com.example.eventsourcing.application.domain.snapshot.Snapshot;
import com.example.eventsourcing.application.port.SnapshotStorePort;
import com.example.eventsourcing.infra.event.codec.JsonMapCodec;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * <h1>JDBC 快照儲存</h1>
 * <p>
 * 快照寫入 aggregate_snapshots 資料表，(aggregate_id, version) 為主鍵。同一鍵重複寫入時覆蓋原本的狀態，
 * 以 UPDATE 後 INSERT 的方式實作，不依賴特定資料庫的 UPSERT 語法。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcSnapshotStore implements SnapshotStorePort {

	private static final String SELECT_SNAPSHOT = """
			SELECT aggregate_id, aggregate_type, version, state, created_at
			FROM aggregate_snapshots
			""";

	private final JdbcTemplate jdbcTemplate;

	private final JsonMapCodec jsonCodec;

	private final RowMapper<Snapshot> rowMapper = this::mapRow;

	@Override
	public void saveSnapshot(Snapshot snapshot) {
		String state = jsonCodec.serialize(snapshot.getState());
		Timestamp createdAt = Timestamp.from(snapshot.getCreatedAt() == null ? Instant.now() : snapshot.getCreatedAt());

		execute(() -> {
			if (update(snapshot, state, createdAt) > 0) {
				return null;
			}
			try {
				jdbcTemplate.update("""
						INSERT INTO aggregate_snapshots (aggregate_id, aggregate_type, version, state, created_at)
						VALUES (?, ?, ?, ?, ?)
						""", snapshot.getAggregateId(), snapshot.getAggregateType(), snapshot.getVersion(), state,
						createdAt);
			} catch (DataIntegrityViolationException e) {
				// 並發寫入同一版本，改為覆蓋
				update(snapshot, state, createdAt);
			}
			return null;
		});
		log.debug(">>> [Snapshot] 寫入快照 (Aggregate: {}, Version: {})", snapshot.getAggregateId(),
				snapshot.getVersion());
	}

	private int update(Snapshot snapshot, String state, Timestamp createdAt) {
		return jdbcTemplate.update("""
				UPDATE aggregate_snapshots SET aggregate_type = ?, state = ?, created_at = ?
				WHERE aggregate_id = ? AND version = ?
				""", snapshot.getAggregateType(), state, createdAt, snapshot.getAggregateId(), snapshot.getVersion());
	}

	@Override
	public Optional<Snapshot> getSnapshot(String aggregateId) {
		return execute(() -> first(jdbcTemplate
				.query(SELECT_SNAPSHOT + "WHERE aggregate_id = ? ORDER BY version DESC LIMIT 1", rowMapper, aggregateId)));
	}

	@Override
	public Optional<Snapshot> getSnapshotAtVersion(String aggregateId, long version) {
		return execute(() -> first(jdbcTemplate.query(SELECT_SNAPSHOT + "WHERE aggregate_id = ? AND version = ?",
				rowMapper, aggregateId, version)));
	}

	@Override
	public int deleteSnapshotsOlderThan(String aggregateId, long beforeVersion) {
		return execute(() -> jdbcTemplate.update("DELETE FROM aggregate_snapshots WHERE aggregate_id = ? AND version < ?",
				aggregateId, beforeVersion));
	}

	@Override
	public int retainLatest(String aggregateId, int count) {
		if (count <= 0) {
			throw new IllegalArgumentException("保留數量必須大於 0");
		}
		return execute(() -> {
			List<Long> kept = jdbcTemplate.queryForList(
					"SELECT version FROM aggregate_snapshots WHERE aggregate_id = ? ORDER BY version DESC LIMIT ?",
					Long.class, aggregateId, count);
			if (kept.size() < count) {
				return 0;
			}
			long oldestKept = kept.get(kept.size() - 1);
			int removed = jdbcTemplate.update("DELETE FROM aggregate_snapshots WHERE aggregate_id = ? AND version < ?",
					aggregateId, oldestKept);
			if (removed > 0) {
				log.info(">>> [Snapshot] 清理舊快照 {} 份，僅保留最新 {} 份 (Aggregate: {})", removed, count, aggregateId);
			}
			return removed;
		});
	}

	@Override
	public int deleteSnapshots(String aggregateId) {
		return execute(() -> jdbcTemplate.update("DELETE FROM aggregate_snapshots WHERE aggregate_id = ?", aggregateId));
	}

	private Snapshot mapRow(ResultSet rs, int rowNum) throws SQLException {
		String aggregateId = rs.getString("aggregate_id");
		long version = rs.getLong("version");
		try {
			return Snapshot.builder().aggregateId(aggregateId).aggregateType(rs.getString("aggregate_type"))
					.version(version).state(jsonCodec.deserialize(rs.getString("state")))
					.createdAt(rs.getTimestamp("created_at").toInstant()).build();
		} catch (IllegalArgumentException e) {
			throw new IllegalStateException("快照內容無法還原 (Aggregate: " + aggregateId + ", Version: " + version + ")",
					e);
		}
	}

	private static Optional<Snapshot> first(List<Snapshot> snapshots) {
		return snapshots.isEmpty() ? Optional.empty() : Optional.of(snapshots.get(0));
	}

	private <T> T execute(Supplier<T> action) {
		try {
			return action.get();
		} catch (DataAccessException e) {
			throw new StorageUnavailableException("快照儲存存取失敗", e);
		}
	}
}
