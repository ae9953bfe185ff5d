package com.example.eventsourcing.application.domain.projection;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

import com.example.eventsourcing.application.domain.event.DomainEvent;

import lombok.extern.slf4j.Slf4j;

/**
 * 以事件類型標籤分派處理器的投影器基底類別
 * <p>
 * 子類別在建構子中以 {@link #when(String, Class, Consumer)} 註冊處理器，訂閱清單即由註冊內容決定。
 * </p>
 */
@Slf4j
public abstract class AbstractProjector implements Projector {

	private final Map<String, Consumer<DomainEvent>> handlers = new LinkedHashMap<>();

	protected <E extends DomainEvent> void when(String eventType, Class<E> eventClass, Consumer<? super E> handler) {
		Consumer<DomainEvent> typed = event -> {
			if (!eventClass.isInstance(event)) {
				// 容忍模式下未知類型會以 GenericDomainEvent 送達
				log.warn(">>> [Projection] {} 收到非預期的事件實作 {} (Type: {}, Event: {})，略過", getName(),
						event.getClass().getSimpleName(), eventType, event.getEventId());
				return;
			}
			handler.accept(eventClass.cast(event));
		};
		if (handlers.putIfAbsent(eventType, typed) != null) {
			throw new IllegalStateException("投影器 " + getName() + " 已註冊事件類型 " + eventType);
		}
	}

	@Override
	public String getName() {
		return getClass().getSimpleName();
	}

	@Override
	public Set<String> getHandledEventTypes() {
		return Set.copyOf(handlers.keySet());
	}

	@Override
	public void project(DomainEvent event) {
		Consumer<DomainEvent> handler = handlers.get(event.getEventType());
		if (handler != null) {
			handler.accept(event);
		}
	}
}
