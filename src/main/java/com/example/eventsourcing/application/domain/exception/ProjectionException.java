package com.example.eventsourcing.application.domain.exception;

import lombok.Getter;

/**
 * 投影器處理事件失敗
 * <p>
 * 攜帶投影器名稱與失敗事件的全域序號，方便定位後修正再重建。
 * </p>
 */
@Getter
public class ProjectionException extends EventSourcingException {

	private static final long serialVersionUID = 1L;

	private final String projectorName;
	private final long sequenceNumber;

	public ProjectionException(String projectorName, long sequenceNumber, Throwable cause) {
		super("投影器 " + projectorName + " 處理事件失敗 (Seq: " + sequenceNumber + "): " + cause.getMessage(), cause);
		this.projectorName = projectorName;
		this.sequenceNumber = sequenceNumber;
	}

	/**
	 * 與特定事件無關的投影器狀態錯誤，sequenceNumber 為 0
	 */
	public ProjectionException(String projectorName, String message) {
		super(message);
		this.projectorName = projectorName;
		this.sequenceNumber = 0;
	}
}
