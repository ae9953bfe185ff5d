package com.example.eventsourcing.config.init;

import java.util.List;

import org.springframework.boot.ApplicationArguments;

/**
 * 讀取指令的命令列選項
 */
final class RunnerOptions {

	private RunnerOptions() {
	}

	/**
	 * 選項的第一個值，未提供或空白時回傳 null
	 */
	static String value(ApplicationArguments args, String name) {
		List<String> values = args.getOptionValues(name);
		if (values == null || values.isEmpty() || values.get(0).isBlank()) {
			return null;
		}
		return values.get(0).trim();
	}
}
