package com.example.eventsourcing.application.domain.exception;

import lombok.Getter;

/**
 * 指定的聚合根沒有任何事件，也沒有快照
 */
@Getter
public class AggregateNotFoundException extends EventSourcingException {

	private static final long serialVersionUID = 1L;

	private final String aggregateType;
	private final String aggregateId;

	public AggregateNotFoundException(String aggregateType, String aggregateId) {
		super("找不到聚合根 " + aggregateType + " (ID: " + aggregateId + ")");
		this.aggregateType = aggregateType;
		this.aggregateId = aggregateId;
	}
}
