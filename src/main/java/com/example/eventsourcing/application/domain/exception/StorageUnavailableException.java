package com.example.eventsourcing.application.domain.exception;

/**
 * 底層儲存無法存取 (連線失敗、SQL 錯誤等)
 */
public class StorageUnavailableException extends EventSourcingException {

	private static final long serialVersionUID = 1L;

	public StorageUnavailableException(String message, Throwable cause) {
		super(message, cause);
	}
}
