package com.example.eventsourcing.config.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * 事件溯源核心的設定
 *
 * <pre>
 * eventsourcing:
 *   store:
 *     driver: jdbc            # jdbc | memory
 *     max-append-attempts: 3
 *   snapshot:
 *     enabled: true
 *     threshold: 10
 *     retain-count: 3
 *   projection:
 *     batch-size: 100
 *     async: true
 *     ring-buffer-size: 1024
 *   codec:
 *     tolerate-unknown-types: false
 *   tools:
 *     command: stats          # stats | list-events | projection-rebuild，未設定時不執行
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "eventsourcing")
public class EventSourcingProperties {

	private Store store = new Store();

	private Snapshot snapshot = new Snapshot();

	private Projection projection = new Projection();

	private Codec codec = new Codec();

	private Tools tools = new Tools();

	public enum Driver {
		JDBC, MEMORY
	}

	@Data
	public static class Store {

		private Driver driver = Driver.JDBC;

		/**
		 * 版本號指派衝突時的最大嘗試次數
		 */
		private int maxAppendAttempts = 3;
	}

	@Data
	public static class Snapshot {

		private boolean enabled = true;

		/**
		 * 版本為 threshold 的整數倍時建立快照
		 */
		private int threshold = 10;

		/**
		 * 每個聚合根保留的快照份數，0 代表不清理
		 */
		private int retainCount = 3;
	}

	@Data
	public static class Projection {

		/**
		 * 重建與追趕時每頁讀取的事件數
		 */
		private int batchSize = 100;

		/**
		 * true 時以 Disruptor 非同步投影，false 時在寫入端執行緒同步投影
		 */
		private boolean async = true;

		/**
		 * RingBuffer 容量，必須為 2 的次方
		 */
		private int ringBufferSize = 1024;
	}

	@Data
	public static class Codec {

		/**
		 * 未註冊的事件類型是否以 GenericDomainEvent 保留
		 */
		private boolean tolerateUnknownTypes = false;
	}

	@Data
	public static class Tools {

		/**
		 * 啟動時執行的維運指令，參數由命令列選項提供
		 */
		private String command;
	}
}
