package com.example.eventsourcing.application.domain.projection;

import java.util.Set;

import com.example.eventsourcing.application.domain.event.DomainEvent;

/**
 * 投影器：將事件流轉換為讀取模型
 * <p>
 * 投影器的狀態必須可以由 {@link #reset()} 清空後，再依全域序號重播全部事件完整重建。
 * </p>
 */
public interface Projector {

	/**
	 * 投影器名稱，在同一個 ProjectionManager 中必須唯一
	 */
	String getName();

	/**
	 * 訂閱的事件類型標籤
	 */
	Set<String> getHandledEventTypes();

	void project(DomainEvent event);

	/**
	 * 清空讀取模型
	 */
	void reset();
}
