package com.example.eventsourcing.application.domain.exception;

/**
 * 事件流無法重建為聚合根 (空事件流、缺少聚合根識別碼、識別碼不一致)
 */
public class ReconstitutionException extends EventSourcingException {

	private static final long serialVersionUID = 1L;

	public ReconstitutionException(String message) {
		super(message);
	}
}
