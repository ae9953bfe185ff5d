package com.example.eventsourcing.application.domain.exception;

public class ProjectorNotFoundException extends EventSourcingException {

	private static final long serialVersionUID = 1L;

	public ProjectorNotFoundException(String projectorName) {
		super("找不到名稱為 " + projectorName + " 的投影器");
	}
}
