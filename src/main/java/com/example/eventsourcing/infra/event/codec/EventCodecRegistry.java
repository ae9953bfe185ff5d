package com.example.eventsourcing.infra.event.codec;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.example.eventsourcing.application.domain.event.DomainEvent;
import com.example.eventsourcing.application.domain.event.EventHeader;
import com.example.eventsourcing.application.domain.event.GenericDomainEvent;
import com.example.eventsourcing.application.domain.exception.CorruptEventException;
import com.example.eventsourcing.application.domain.exception.UnknownEventTypeException;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * <h1>事件編解碼器註冊表</h1>
 * <p>
 * 以事件類型標籤對應到 {@link EventCodec}，取代依類別名稱反射建立事件的作法。
 * </p>
 * <ul>
 * <li><b>嚴格模式 (預設)：</b>未註冊的類型拋出 {@link UnknownEventTypeException}</li>
 * <li><b>容忍模式：</b>未註冊的類型解碼為 {@link GenericDomainEvent}，並記錄警告</li>
 * </ul>
 */
@Slf4j
public class EventCodecRegistry {

	private final Map<String, EventCodec<?>> codecsByType = new ConcurrentHashMap<>();

	private final Map<Class<?>, EventCodec<?>> codecsByClass = new ConcurrentHashMap<>();

	@Getter
	private final boolean tolerateUnknownTypes;

	public EventCodecRegistry(boolean tolerateUnknownTypes) {
		this.tolerateUnknownTypes = tolerateUnknownTypes;
	}

	public synchronized EventCodecRegistry register(EventCodec<?> codec) {
		if (codecsByType.containsKey(codec.eventType())) {
			throw new IllegalStateException("事件類型 " + codec.eventType() + " 已註冊編解碼器");
		}
		if (codecsByClass.containsKey(codec.eventClass())) {
			throw new IllegalStateException("事件類別 " + codec.eventClass().getName() + " 已註冊編解碼器");
		}
		codecsByType.put(codec.eventType(), codec);
		codecsByClass.put(codec.eventClass(), codec);
		log.debug(">>> [Codec] 註冊事件編解碼器 {} -> {}", codec.eventType(), codec.eventClass().getSimpleName());
		return this;
	}

	public EventCodecRegistry registerAll(Collection<? extends EventCodec<?>> codecs) {
		codecs.forEach(this::register);
		return this;
	}

	public boolean isRegistered(String eventType) {
		return codecsByType.containsKey(eventType);
	}

	public Set<String> registeredTypes() {
		return Set.copyOf(codecsByType.keySet());
	}

	/**
	 * 將事件編碼為 payload
	 *
	 * @throws UnknownEventTypeException 事件類別沒有編解碼器
	 */
	public Map<String, Object> encode(DomainEvent event) {
		if (event instanceof GenericDomainEvent generic) {
			return generic.getPayload();
		}
		EventCodec<?> codec = codecsByClass.get(event.getClass());
		if (codec == null) {
			throw new UnknownEventTypeException(event.getEventType(), event.getEventId());
		}
		return encodeWith(codec, event);
	}

	private <E extends DomainEvent> Map<String, Object> encodeWith(EventCodec<E> codec, DomainEvent event) {
		return codec.encode(codec.eventClass().cast(event));
	}

	/**
	 * 將 payload 解碼為事件
	 *
	 * @throws UnknownEventTypeException 嚴格模式下類型未註冊
	 * @throws CorruptEventException     payload 無法解碼
	 */
	public DomainEvent decode(String eventType, EventHeader header, Map<String, Object> payload) {
		EventCodec<?> codec = codecsByType.get(eventType);
		if (codec == null) {
			if (!tolerateUnknownTypes) {
				throw new UnknownEventTypeException(eventType, header.eventId());
			}
			log.warn(">>> [Codec] 未註冊的事件類型 {} (Event: {})，以 GenericDomainEvent 保留原始內容", eventType,
					header.eventId());
			return new GenericDomainEvent(header, eventType, payload);
		}

		DomainEvent event;
		try {
			event = codec.decode(header, payload);
		} catch (CorruptEventException e) {
			throw e;
		} catch (RuntimeException e) {
			throw new CorruptEventException(eventType, header.eventId(), "事件 payload 無法解碼", e);
		}
		if (event == null || !eventType.equals(event.getEventType())) {
			throw new CorruptEventException(eventType, header.eventId(), "編解碼器回傳的事件類型不符");
		}
		return event;
	}
}
