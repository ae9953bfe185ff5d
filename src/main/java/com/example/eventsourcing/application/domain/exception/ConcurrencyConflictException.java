package com.example.eventsourcing.application.domain.exception;

import lombok.Getter;

/**
 * 樂觀並發衝突
 * <p>
 * 寫入時聚合根的實際版本與呼叫端預期不符，或版本號指派在重試上限內仍然衝突。呼叫端應重新載入聚合根後再試。
 * </p>
 */
@Getter
public class ConcurrencyConflictException extends EventSourcingException {

	private static final long serialVersionUID = 1L;

	private final String aggregateId;
	private final long expectedVersion;
	private final long actualVersion;

	public ConcurrencyConflictException(String aggregateId, long expectedVersion, long actualVersion) {
		super("聚合根 " + aggregateId + " 版本衝突：預期 " + expectedVersion + "，實際 " + actualVersion);
		this.aggregateId = aggregateId;
		this.expectedVersion = expectedVersion;
		this.actualVersion = actualVersion;
	}

	public ConcurrencyConflictException(String message, Throwable cause) {
		super(message, cause);
		this.aggregateId = null;
		this.expectedVersion = -1;
		this.actualVersion = -1;
	}
}
