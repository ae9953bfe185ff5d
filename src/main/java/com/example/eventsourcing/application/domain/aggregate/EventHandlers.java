package com.example.eventsourcing.application.domain.aggregate;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;

import com.example.eventsourcing.application.domain.event.DomainEvent;

/**
 * 聚合根的事件處理表
 * <p>
 * 以事件的具體類別作為鍵，每個聚合根類別建立一次 (通常為 static final 欄位)。
 * 沒有對應處理器的事件在套用時不改變狀態。
 * </p>
 *
 * <pre>
 * private static final EventHandlers&lt;Product&gt; HANDLERS = EventHandlers.&lt;Product&gt;builder()
 * 		.on(ProductCreated.class, Product::onCreated)
 * 		.on(ProductRenamed.class, Product::onRenamed)
 * 		.build();
 * </pre>
 *
 * @param <A> 聚合根類型
 */
public final class EventHandlers<A> {

	private final Map<Class<? extends DomainEvent>, BiConsumer<A, DomainEvent>> handlers;

	private EventHandlers(Map<Class<? extends DomainEvent>, BiConsumer<A, DomainEvent>> handlers) {
		this.handlers = Map.copyOf(handlers);
	}

	public static <A> Builder<A> builder() {
		return new Builder<>();
	}

	public static <A> EventHandlers<A> none() {
		return new EventHandlers<>(Map.of());
	}

	/**
	 * 將事件套用到聚合根
	 *
	 * @return 是否有對應的處理器
	 */
	public boolean apply(A aggregate, DomainEvent event) {
		BiConsumer<A, DomainEvent> handler = handlers.get(event.getClass());
		if (handler == null) {
			return false;
		}
		handler.accept(aggregate, event);
		return true;
	}

	public boolean handles(Class<? extends DomainEvent> eventClass) {
		return handlers.containsKey(eventClass);
	}

	public static final class Builder<A> {

		private final Map<Class<? extends DomainEvent>, BiConsumer<A, DomainEvent>> handlers = new LinkedHashMap<>();

		private Builder() {
		}

		public <E extends DomainEvent> Builder<A> on(Class<E> eventClass, BiConsumer<A, ? super E> handler) {
			BiConsumer<A, DomainEvent> typed = (aggregate, event) -> handler.accept(aggregate, eventClass.cast(event));
			if (handlers.putIfAbsent(eventClass, typed) != null) {
				throw new IllegalStateException("事件 " + eventClass.getSimpleName() + " 已註冊處理器");
			}
			return this;
		}

		public EventHandlers<A> build() {
			return new EventHandlers<>(handlers);
		}
	}
}
