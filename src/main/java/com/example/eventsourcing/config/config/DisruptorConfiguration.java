package com.example.eventsourcing.config.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.eventsourcing.application.port.ProjectionBusPort;
import com.example.eventsourcing.application.service.ProjectionManager;
import com.example.eventsourcing.iface.handler.ProjectionSignalHandler;
import com.example.eventsourcing.infra.adapter.DisruptorProjectionBusAdapter;
import com.example.eventsourcing.infra.lmax.event.ProjectionSignal;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.util.DaemonThreadFactory;

/**
 * LMAX Disruptor 設定類 (非同步投影)
 *
 * <p>
 * 寫入端在事件持久化後發布 {@link ProjectionSignal}，由單一消費者執行緒上的 {@link ProjectionSignalHandler}
 * 依全域序號補齊投影。單一消費者確保投影器不會被並發呼叫，投影順序與事件儲存一致。
 * </p>
 */
@Configuration
@ConditionalOnProperty(prefix = "eventsourcing.projection", name = "async", havingValue = "true", matchIfMissing = true)
public class DisruptorConfiguration {

	@Bean
	public ProjectionSignalHandler projectionSignalHandler(ProjectionManager projectionManager) {
		return new ProjectionSignalHandler(projectionManager);
	}

	/**
	 * 建立投影專用的 Disruptor，RingBuffer 容量需為 2 的次方
	 */
	@Bean(destroyMethod = "shutdown")
	public Disruptor<ProjectionSignal> projectionDisruptor(ProjectionSignalHandler projectionSignalHandler,
			EventSourcingProperties properties) {
		Disruptor<ProjectionSignal> disruptor = new Disruptor<>(ProjectionSignal::new,
				properties.getProjection().getRingBufferSize(), DaemonThreadFactory.INSTANCE);
		disruptor.handleEventsWith(projectionSignalHandler);
		disruptor.start();
		return disruptor;
	}

	@Bean
	public RingBuffer<ProjectionSignal> projectionRingBuffer(Disruptor<ProjectionSignal> projectionDisruptor) {
		return projectionDisruptor.getRingBuffer();
	}

	@Bean
	public ProjectionBusPort disruptorProjectionBus(RingBuffer<ProjectionSignal> projectionRingBuffer) {
		return new DisruptorProjectionBusAdapter(projectionRingBuffer);
	}
}
