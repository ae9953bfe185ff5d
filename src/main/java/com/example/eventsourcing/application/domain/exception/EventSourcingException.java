package com.example.eventsourcing.application.domain.exception;

/**
 * 事件溯源核心的例外基底類別
 * <p>
 * 所有由事件儲存、快照、聚合重建與投影所拋出的領域例外皆繼承此類別，呼叫端可依子類別區分處理策略。
 * </p>
 */
public class EventSourcingException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public EventSourcingException(String message) {
		super(message);
	}

	public EventSourcingException(String message, Throwable cause) {
		super(message, cause);
	}
}
