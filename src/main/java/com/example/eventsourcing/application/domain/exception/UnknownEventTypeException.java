package com.example.eventsourcing.application.domain.exception;

/**
 * 事件類型標籤沒有已註冊的編解碼器
 */
public class UnknownEventTypeException extends CorruptEventException {

	private static final long serialVersionUID = 1L;

	public UnknownEventTypeException(String eventType, String eventId) {
		super(eventType, eventId, "未註冊的事件類型");
	}
}
