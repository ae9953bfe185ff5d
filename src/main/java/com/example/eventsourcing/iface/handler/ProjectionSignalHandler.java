package com.example.eventsourcing.iface.handler;

import com.example.eventsourcing.application.service.ProjectionManager;
import com.example.eventsourcing.infra.lmax.event.ProjectionSignal;
import com.lmax.disruptor.EventHandler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 投影訊號處理器
 * <p>
 * 在 Disruptor 的單一消費者執行緒上累積訊號，批次結尾時呼叫 {@link ProjectionManager#catchUp()}
 * 依全域序號補齊事件。投影失敗時即時游標停在失敗事件之前，下一個訊號會重試。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class ProjectionSignalHandler implements EventHandler<ProjectionSignal> {

	private final ProjectionManager projectionManager;

	private long highestSignalled;

	@Override
	public void onEvent(ProjectionSignal signal, long sequence, boolean endOfBatch) {
		highestSignalled = Math.max(highestSignalled, signal.getUpToSequence());
		signal.clear();
		if (!endOfBatch || highestSignalled <= projectionManager.getLiveCursor()) {
			return;
		}
		try {
			long scanned = projectionManager.catchUp();
			log.debug(">>> [Projection] 即時投影完成 {} 筆 (Cursor: {})", scanned, projectionManager.getLiveCursor());
		} catch (Exception e) {
			log.error(">>> [Projection] 即時投影失敗，游標停留於 {}，等待下一個訊號重試", projectionManager.getLiveCursor(), e);
		}
	}
}
