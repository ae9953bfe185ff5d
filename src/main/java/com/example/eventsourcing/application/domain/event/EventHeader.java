package com.example.eventsourcing.application.domain.event;

import java.time.Instant;
import java.util.Map;

/**
 * 事件標頭：所有領域事件共用的識別與時間資訊
 * <p>
 * 由儲存層解碼事件時使用，使重建出的事件保留原本的 eventId 與 occurredOn。
 * </p>
 */
public record EventHeader(String eventId, String aggregateId, Instant occurredOn, Map<String, Object> metadata) {
}
