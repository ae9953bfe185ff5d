package com.example.eventsourcing.infra.adapter;

import java.util.List;

import com.example.eventsourcing.application.domain.event.StoredEvent;
import com.example.eventsourcing.application.port.ProjectionBusPort;
import com.example.eventsourcing.application.service.ProjectionManager;

import lombok.RequiredArgsConstructor;

/**
 * 在寫入端的執行緒上直接投影
 * <p>
 * 傳入的事件只作為觸發，實際由 {@link ProjectionManager#catchUp()} 依全域序號從事件儲存投遞；
 * 寫入端呼叫 publish 的先後不影響投影順序。
 * </p>
 */
@RequiredArgsConstructor
public class SynchronousProjectionBusAdapter implements ProjectionBusPort {

	private final ProjectionManager projectionManager;

	@Override
	public void publish(List<StoredEvent> events) {
		if (events.isEmpty()) {
			return;
		}
		projectionManager.catchUp();
	}
}
