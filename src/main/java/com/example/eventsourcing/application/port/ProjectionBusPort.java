package com.example.eventsourcing.application.port;

import java.util.List;

import com.example.eventsourcing.application.domain.event.StoredEvent;

/**
 * 投影通知 Port：事件寫入成功後，將事件交給投影處理
 */
public interface ProjectionBusPort {

	void publish(List<StoredEvent> events);
}
