package com.example.eventsourcing.infra.event.mapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Map;

import com.example.eventsourcing.application.domain.event.DomainEvent;
import com.example.eventsourcing.application.domain.event.EventHeader;
import com.example.eventsourcing.application.domain.event.StoredEvent;
import com.example.eventsourcing.application.domain.exception.CorruptEventException;
import com.example.eventsourcing.infra.event.codec.EventCodecRegistry;
import com.example.eventsourcing.infra.event.codec.JsonMapCodec;

import lombok.RequiredArgsConstructor;

/**
 * 事件資料表列與領域事件之間的映射器
 *
 * <p>
 * 封裝 domain_events 資料表的欄位格式，讓 JDBC 事件儲存只處理 SQL 與交易。
 * </p>
 * <ul>
 * <li>寫入：事件經 {@link EventCodecRegistry} 編碼為 payload，再以 {@link JsonMapCodec} 轉為 JSON</li>
 * <li>讀取：JSON 或 payload 無法還原時拋出 {@link CorruptEventException}</li>
 * </ul>
 */
@RequiredArgsConstructor
public class StoredEventMapper {

	private final EventCodecRegistry codecRegistry;

	private final JsonMapCodec jsonCodec;

	/**
	 * 寫入前的編碼結果
	 */
	public record EncodedEvent(DomainEvent event, String payload, String metadata) {
	}

	public EncodedEvent encode(DomainEvent event) {
		Map<String, Object> payload = codecRegistry.encode(event);
		return new EncodedEvent(event, jsonCodec.serialize(payload), jsonCodec.serialize(event.getMetadata()));
	}

	/**
	 * 將查詢結果的目前列還原為 {@link StoredEvent}
	 */
	public StoredEvent toStoredEvent(ResultSet rs) throws SQLException {
		String eventType = rs.getString("event_type");
		String eventId = rs.getString("event_id");

		Map<String, Object> payload = readJson(rs.getString("payload"), eventType, eventId, "payload");
		Map<String, Object> metadata = readJson(rs.getString("metadata"), eventType, eventId, "metadata");

		Timestamp occurredOn = rs.getTimestamp("occurred_on");
		if (occurredOn == null) {
			throw new CorruptEventException(eventType, eventId, "事件缺少 occurred_on");
		}
		EventHeader header = new EventHeader(eventId, rs.getString("aggregate_id"), occurredOn.toInstant(), metadata);
		DomainEvent event = codecRegistry.decode(eventType, header, payload);

		return new StoredEvent(rs.getLong("sequence_number"), rs.getLong("version"), event,
				rs.getTimestamp("stored_at").toInstant());
	}

	public DomainEvent toDomainEvent(ResultSet rs) throws SQLException {
		return toStoredEvent(rs).getEvent();
	}

	private Map<String, Object> readJson(String json, String eventType, String eventId, String column) {
		try {
			return jsonCodec.deserialize(json);
		} catch (IllegalArgumentException e) {
			throw new CorruptEventException(eventType, eventId, "事件 " + column + " 不是有效的 JSON 物件", e);
		}
	}
}
