package com.example.eventsourcing.application.domain.exception;

public class ProjectorAlreadyRegisteredException extends EventSourcingException {

	private static final long serialVersionUID = 1L;

	public ProjectorAlreadyRegisteredException(String projectorName) {
		super("投影器 " + projectorName + " 已註冊，名稱不可重複");
	}
}
