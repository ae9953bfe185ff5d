package com.example.eventsourcing.application.domain.exception;

import lombok.Getter;

/**
 * 相同 eventId 的事件已存在於事件儲存中
 */
@Getter
public class DuplicateEventException extends EventSourcingException {

	private static final long serialVersionUID = 1L;

	private final String eventId;

	public DuplicateEventException(String eventId) {
		super("事件 " + eventId + " 已存在，拒絕重複寫入");
		this.eventId = eventId;
	}
}
