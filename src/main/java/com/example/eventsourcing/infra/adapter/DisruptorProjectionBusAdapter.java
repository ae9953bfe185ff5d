package com.example.eventsourcing.infra.adapter;

import java.util.List;

import com.example.eventsourcing.application.domain.event.StoredEvent;
import com.example.eventsourcing.application.port.ProjectionBusPort;
import com.example.eventsourcing.infra.lmax.event.ProjectionSignal;
import com.lmax.disruptor.RingBuffer;

import lombok.RequiredArgsConstructor;

/**
 * 以 Disruptor 非同步通知投影
 * <p>
 * 寫入端只發布喚醒訊號，不等待投影完成。消費端會合併同一批次的訊號，RingBuffer 只有在投影長時間停滯時才會填滿，
 * 此時寫入端等待空位。
 * </p>
 */
@RequiredArgsConstructor
public class DisruptorProjectionBusAdapter implements ProjectionBusPort {

	private final RingBuffer<ProjectionSignal> ringBuffer;

	@Override
	public void publish(List<StoredEvent> events) {
		if (events.isEmpty()) {
			return;
		}
		long upToSequence = events.stream().mapToLong(StoredEvent::getSequenceNumber).max().getAsLong();

		long sequence = ringBuffer.next();
		try {
			ProjectionSignal signal = ringBuffer.get(sequence);
			signal.setUpToSequence(upToSequence);
			signal.setEventCount(events.size());
		} finally {
			ringBuffer.publish(sequence);
		}
	}
}
