package com.example.eventsourcing.application.domain.exception;

import lombok.Getter;

/**
 * 已儲存的事件無法解碼為領域事件
 */
@Getter
public class CorruptEventException extends EventSourcingException {

	private static final long serialVersionUID = 1L;

	private final String eventType;
	private final String eventId;

	public CorruptEventException(String eventType, String eventId, String message) {
		super(describe(eventType, eventId, message));
		this.eventType = eventType;
		this.eventId = eventId;
	}

	public CorruptEventException(String eventType, String eventId, String message, Throwable cause) {
		super(describe(eventType, eventId, message), cause);
		this.eventType = eventType;
		this.eventId = eventId;
	}

	private static String describe(String eventType, String eventId, String message) {
		return message + " (Type: " + eventType + ", Event: " + eventId + ")";
	}
}
