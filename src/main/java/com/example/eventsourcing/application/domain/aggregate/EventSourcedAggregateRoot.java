package com.example.eventsourcing.application.domain.aggregate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

import com.example.eventsourcing.application.domain.event.DomainEvent;
import com.example.eventsourcing.application.domain.exception.ReconstitutionException;
import com.example.eventsourcing.application.domain.snapshot.Snapshot;

import lombok.extern.slf4j.Slf4j;

/**
 * <h1>事件溯源聚合根基底類別</h1>
 * <p>
 * 聚合根的狀態完全由事件決定：所有狀態變更都必須先產生事件，再經由 {@link #recordEvent(DomainEvent)} 套用。
 * 同一串事件重播到全新的實例上，必定得到相同的狀態與版本。
 * </p>
 * <ul>
 * <li><b>version：</b>已套用的事件數量 (含快照涵蓋的部分)</li>
 * <li><b>pendingEvents：</b>尚未持久化的事件，由倉儲在儲存成功後清空</li>
 * </ul>
 *
 * @param <A> 聚合根自身類型
 */
@Slf4j
public abstract class EventSourcedAggregateRoot<A extends EventSourcedAggregateRoot<A>> {

	private final String id;

	private long version;

	private final List<DomainEvent> pendingEvents = new ArrayList<>();

	protected EventSourcedAggregateRoot(String id) {
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("聚合根識別碼不可為空");
		}
		this.id = id;
	}

	/**
	 * 從完整事件流重建聚合根
	 *
	 * @param factory 以聚合根識別碼建立空白實例
	 * @param events  依版本排序的事件流
	 */
	public static <A extends EventSourcedAggregateRoot<A>> A reconstitute(Function<String, A> factory,
			List<? extends DomainEvent> events) {
		if (events == null || events.isEmpty()) {
			throw new ReconstitutionException("無法從空的事件流重建聚合根");
		}
		DomainEvent first = events.get(0);
		if (first.getAggregateId() == null) {
			throw new ReconstitutionException("首筆事件 " + first.getEventId() + " 未攜帶聚合根識別碼，無法重建");
		}
		A aggregate = factory.apply(first.getAggregateId());
		for (DomainEvent event : events) {
			aggregate.replay(event);
		}
		return aggregate;
	}

	/**
	 * 重播已持久化的事件 (不加入待寫入緩衝)
	 */
	public final void replay(DomainEvent event) {
		Objects.requireNonNull(event, "event");
		if (!id.equals(event.getAggregateId())) {
			throw new ReconstitutionException("事件 " + event.getEventId() + " 屬於聚合根 " + event.getAggregateId()
					+ "，無法重播至 " + id);
		}
		applyEvent(event);
	}

	/**
	 * 記錄新發生的事件：套用狀態變更並加入待寫入緩衝
	 */
	protected final void recordEvent(DomainEvent event) {
		Objects.requireNonNull(event, "event");
		if (!id.equals(event.getAggregateId())) {
			throw new IllegalArgumentException("事件聚合根識別碼 " + event.getAggregateId() + " 與聚合根 " + id + " 不符");
		}
		applyEvent(event);
		pendingEvents.add(event);
	}

	private void applyEvent(DomainEvent event) {
		if (!eventHandlers().apply(self(), event)) {
			log.debug(">>> [Aggregate] {} 無 {} 的處理器，僅推進版本", getClass().getSimpleName(), event.getEventType());
		}
		version++;
	}

	/**
	 * 從快照還原狀態與版本，只能用在尚未套用任何事件的實例上
	 */
	public final void restoreFromSnapshot(Snapshot snapshot) {
		Objects.requireNonNull(snapshot, "snapshot");
		if (version != 0 || !pendingEvents.isEmpty()) {
			throw new IllegalStateException("快照只能還原至全新的聚合根 (目前版本: " + version + ")");
		}
		if (!id.equals(snapshot.getAggregateId())) {
			throw new IllegalArgumentException("快照屬於聚合根 " + snapshot.getAggregateId() + "，無法還原至 " + id);
		}
		restoreState(snapshot.getState());
		this.version = snapshot.getVersion();
	}

	public String getId() {
		return id;
	}

	public long getVersion() {
		return version;
	}

	/**
	 * 已持久化的版本，即 version 扣除待寫入事件數
	 */
	public long getPersistedVersion() {
		return version - pendingEvents.size();
	}

	public List<DomainEvent> getPendingEvents() {
		return List.copyOf(pendingEvents);
	}

	public boolean hasPendingEvents() {
		return !pendingEvents.isEmpty();
	}

	/**
	 * 取出並清空待寫入事件
	 */
	public List<DomainEvent> pullPendingEvents() {
		List<DomainEvent> pulled = List.copyOf(pendingEvents);
		pendingEvents.clear();
		return pulled;
	}

	public void markEventsCommitted() {
		pendingEvents.clear();
	}

	/**
	 * 擷取可序列化的狀態，用於建立快照
	 */
	public abstract Map<String, Object> captureState();

	/**
	 * 以 {@link #captureState()} 的結果還原狀態
	 */
	protected abstract void restoreState(Map<String, Object> state);

	protected abstract EventHandlers<A> eventHandlers();

	@SuppressWarnings("unchecked")
	private A self() {
		return (A) this;
	}
}
