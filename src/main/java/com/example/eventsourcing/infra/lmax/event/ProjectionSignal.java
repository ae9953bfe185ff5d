package com.example.eventsourcing.infra.lmax.event;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * RingBuffer 內的投影喚醒訊號
 * <p>
 * 只攜帶本次寫入的最大全域序號，事件內容由處理器從事件儲存依序讀取。
 * </p>
 */
@Data
@NoArgsConstructor
public class ProjectionSignal {

	/**
	 * 本次寫入的最大全域序號
	 */
	private long upToSequence;

	private int eventCount;

	public void clear() {
		this.upToSequence = 0;
		this.eventCount = 0;
	}
}
