package com.example.eventsourcing.application.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

import com.example.eventsourcing.application.domain.event.StoredEvent;
import com.example.eventsourcing.application.domain.exception.ProjectionException;
import com.example.eventsourcing.application.domain.exception.ProjectorAlreadyRegisteredException;
import com.example.eventsourcing.application.domain.exception.ProjectorNotFoundException;
import com.example.eventsourcing.application.domain.projection.Projector;
import com.example.eventsourcing.application.port.EventStorePort;

import lombok.extern.slf4j.Slf4j;

/**
 * <h1>投影管理器</h1>
 * <p>
 * <b>職責：</b>
 * </p>
 * <ul>
 * <li>依事件類型將事件分派給訂閱的投影器</li>
 * <li>依全域序號分頁讀取事件儲存，重建單一或全部投影器</li>
 * <li>以即時游標 (live cursor) 追上事件儲存的最新事件，供非同步投影使用</li>
 * </ul>
 * <p>
 * 每個投影器記錄已處理的最後一個全域序號 (checkpoint)，序號不大於 checkpoint 的事件不會重複投遞，
 * 序號跳號時先從事件儲存補齊，投影器看到的順序永遠是儲存順序。
 * 重建期間該投影器只接收重建流程的事件，即時投遞會略過它；重建結尾在鎖內補齊最後一段事件並更新
 * checkpoint，之後再恢復即時投遞。
 * </p>
 */
@Slf4j
public class ProjectionManager {

	public static final int DEFAULT_BATCH_SIZE = 100;

	private final EventStorePort eventStore;

	private final int batchSize;

	private final Map<String, Registration> registrationsByName = new ConcurrentHashMap<>();

	private final List<Registration> registrations = new CopyOnWriteArrayList<>();

	private final Map<String, List<Registration>> registrationsByType = new ConcurrentHashMap<>();

	private final ReentrantLock catchUpLock = new ReentrantLock();

	private final AtomicLong liveCursor = new AtomicLong();

	public ProjectionManager(EventStorePort eventStore) {
		this(eventStore, DEFAULT_BATCH_SIZE);
	}

	public ProjectionManager(EventStorePort eventStore, int batchSize) {
		if (batchSize <= 0) {
			throw new IllegalArgumentException("batchSize 必須大於 0");
		}
		this.eventStore = eventStore;
		this.batchSize = batchSize;
	}

	/**
	 * 註冊投影器
	 *
	 * @throws ProjectorAlreadyRegisteredException 名稱重複
	 */
	public synchronized void register(Projector projector) {
		String name = projector.getName();
		if (registrationsByName.containsKey(name)) {
			throw new ProjectorAlreadyRegisteredException(name);
		}
		Registration registration = new Registration(projector);
		registrationsByName.put(name, registration);
		registrations.add(registration);
		for (String eventType : registration.handledTypes) {
			registrationsByType.computeIfAbsent(eventType, key -> new CopyOnWriteArrayList<>()).add(registration);
		}
		log.info(">>> [Projection] 註冊投影器 {}，訂閱事件: {}", name, registration.handledTypes);
	}

	public void registerAll(Collection<? extends Projector> projectors) {
		projectors.forEach(this::register);
	}

	public Optional<Projector> getProjector(String name) {
		return Optional.ofNullable(registrationsByName.get(name)).map(registration -> registration.projector);
	}

	public List<Projector> getProjectors() {
		return registrations.stream().map(registration -> registration.projector).toList();
	}

	public long getCheckpoint(String name) {
		Registration registration = find(name);
		registration.lock.lock();
		try {
			return registration.checkpoint;
		} finally {
			registration.lock.unlock();
		}
	}

	public long getLiveCursor() {
		return liveCursor.get();
	}

	/**
	 * 將單一已持久化的事件投遞給所有訂閱其類型的投影器
	 * <p>
	 * 事件序號超過投影器 checkpoint + 1 時，先從事件儲存依序補齊中間的事件再投遞；序號不大於 checkpoint
	 * 的事件已投遞過，略過。因此呼叫端的投遞順序不影響投影器看到的順序。重建中的投影器由重建流程涵蓋。
	 * </p>
	 *
	 * @throws ProjectionException 投影器處理失敗
	 */
	public void projectEvent(StoredEvent event) {
		for (Registration registration : subscribers(event)) {
			deliverInOrder(registration, event);
		}
	}

	/**
	 * 依傳入順序投遞事件
	 */
	public void projectEvents(List<StoredEvent> events) {
		events.forEach(this::projectEvent);
	}

	private void deliverInOrder(Registration registration, StoredEvent event) {
		registration.lock.lock();
		try {
			if (registration.rebuilding || event.getSequenceNumber() <= registration.checkpoint) {
				return;
			}
			if (event.getSequenceNumber() > registration.checkpoint + 1) {
				fillGap(registration, event.getSequenceNumber());
			}
			apply(registration, event);
			registration.checkpoint = event.getSequenceNumber();
		} finally {
			registration.lock.unlock();
		}
	}

	/**
	 * 在投影器鎖內，從事件儲存補齊 checkpoint 與 beforeSequence 之間的事件
	 */
	private void fillGap(Registration registration, long beforeSequence) {
		log.debug(">>> [Projection] 投影器 {} 補齊 Seq: {} ~ {}", registration.name, registration.checkpoint + 1,
				beforeSequence - 1);
		while (true) {
			List<StoredEvent> page = eventStore.readAll(registration.checkpoint, batchSize);
			for (StoredEvent stored : page) {
				if (stored.getSequenceNumber() >= beforeSequence) {
					return;
				}
				if (registration.handledTypes.contains(stored.getEventType())) {
					apply(registration, stored);
				}
				registration.checkpoint = stored.getSequenceNumber();
			}
			if (page.size() < batchSize) {
				return;
			}
		}
	}

	/**
	 * catchUp 已依序號讀取，只需略過已投遞的事件
	 */
	private void deliver(Registration registration, StoredEvent event) {
		registration.lock.lock();
		try {
			if (registration.rebuilding || event.getSequenceNumber() <= registration.checkpoint) {
				return;
			}
			apply(registration, event);
			registration.checkpoint = event.getSequenceNumber();
		} finally {
			registration.lock.unlock();
		}
	}

	/**
	 * 從即時游標讀取事件儲存，投遞尚未處理的事件
	 *
	 * @return 本次掃描的事件數
	 */
	public long catchUp() {
		catchUpLock.lock();
		try {
			long scanned = 0;
			while (true) {
				List<StoredEvent> page = eventStore.readAll(liveCursor.get(), batchSize);
				for (StoredEvent event : page) {
					for (Registration registration : subscribers(event)) {
						deliver(registration, event);
					}
					liveCursor.set(event.getSequenceNumber());
					scanned++;
				}
				if (page.size() < batchSize) {
					return scanned;
				}
			}
		} finally {
			catchUpLock.unlock();
		}
	}

	public long rebuild(String name) {
		return rebuild(name, () -> false);
	}

	/**
	 * 重建單一投影器：清空後依全域序號重播所有它訂閱的事件
	 *
	 * @param cancelled 每讀取一頁前檢查，回傳 true 時中止重建
	 * @return 掃描的事件數
	 * @throws ProjectorNotFoundException 名稱未註冊
	 * @throws CancellationException      重建被取消或執行緒被中斷
	 * @throws ProjectionException        投影器處理失敗，重建在失敗事件處停止
	 */
	public long rebuild(String name, BooleanSupplier cancelled) {
		return rebuild(List.of(find(name)), cancelled);
	}

	public long rebuildAll() {
		return rebuildAll(() -> false);
	}

	/**
	 * 以單次掃描重建所有投影器，每筆事件依註冊順序分派
	 */
	public long rebuildAll(BooleanSupplier cancelled) {
		return rebuild(List.copyOf(registrations), cancelled);
	}

	private long rebuild(List<Registration> targets, BooleanSupplier cancelled) {
		if (targets.isEmpty()) {
			return 0;
		}
		String names = targets.stream().map(registration -> registration.name).toList().toString();
		long startedAt = System.currentTimeMillis();

		begin(targets);
		Map<String, List<Registration>> byType = indexByType(targets);
		long cursor = 0;
		long scanned = 0;
		boolean completed = false;
		try {
			log.info(">>> [Rebuild] 開始重建投影器 {}", names);
			while (true) {
				checkCancelled(cancelled, names);
				List<StoredEvent> page = eventStore.readAll(cursor, batchSize);
				for (StoredEvent event : page) {
					dispatch(byType, event);
					cursor = event.getSequenceNumber();
				}
				scanned += page.size();
				if (page.size() < batchSize) {
					break;
				}
			}

			lockAll(targets);
			try {
				// 補齊掃描期間寫入的事件，之後交回即時投遞
				List<StoredEvent> tail = eventStore.readAll(cursor, batchSize);
				while (!tail.isEmpty()) {
					for (StoredEvent event : tail) {
						dispatch(byType, event);
						cursor = event.getSequenceNumber();
					}
					scanned += tail.size();
					tail = eventStore.readAll(cursor, batchSize);
				}
				finish(targets, cursor);
				completed = true;
			} finally {
				unlockAll(targets);
			}
		} finally {
			if (!completed) {
				abort(targets, cursor);
			}
		}

		log.info(">>> [Rebuild] 投影器 {} 重建完成，掃描 {} 筆事件 (Seq: {})，耗時 {} ms", names, scanned, cursor,
				System.currentTimeMillis() - startedAt);
		return scanned;
	}

	private void begin(List<Registration> targets) {
		lockAll(targets);
		try {
			for (Registration registration : targets) {
				if (registration.rebuilding) {
					throw new ProjectionException(registration.name, "投影器 " + registration.name + " 正在重建中");
				}
			}
			for (Registration registration : targets) {
				registration.rebuilding = true;
				registration.checkpoint = 0;
			}
			try {
				targets.forEach(registration -> registration.projector.reset());
			} catch (RuntimeException e) {
				// 部分投影器已清空，checkpoint 歸零後由下次投遞或重建從頭補齊
				targets.forEach(registration -> registration.rebuilding = false);
				throw e;
			}
		} finally {
			unlockAll(targets);
		}
	}

	private void finish(List<Registration> targets, long cursor) {
		for (Registration registration : targets) {
			registration.checkpoint = cursor;
			registration.rebuilding = false;
		}
	}

	private void abort(List<Registration> targets, long cursor) {
		for (Registration registration : targets) {
			registration.lock.lock();
			try {
				registration.checkpoint = cursor;
				registration.rebuilding = false;
			} finally {
				registration.lock.unlock();
			}
		}
		log.warn(">>> [Rebuild] 重建未完成，投影器狀態僅涵蓋至 Seq: {}，需重新執行重建", cursor);
	}

	private void dispatch(Map<String, List<Registration>> byType, StoredEvent event) {
		for (Registration registration : byType.getOrDefault(event.getEventType(), List.of())) {
			apply(registration, event);
		}
	}

	private static void apply(Registration registration, StoredEvent event) {
		try {
			registration.projector.project(event.getEvent());
		} catch (RuntimeException e) {
			throw new ProjectionException(registration.name, event.getSequenceNumber(), e);
		}
	}

	private static void checkCancelled(BooleanSupplier cancelled, String names) {
		if (Thread.currentThread().isInterrupted() || cancelled.getAsBoolean()) {
			throw new CancellationException("投影器 " + names + " 重建已取消");
		}
	}

	private static Map<String, List<Registration>> indexByType(List<Registration> targets) {
		Map<String, List<Registration>> byType = new HashMap<>();
		for (Registration registration : targets) {
			for (String eventType : registration.handledTypes) {
				byType.computeIfAbsent(eventType, key -> new ArrayList<>()).add(registration);
			}
		}
		return byType;
	}

	private static void lockAll(List<Registration> targets) {
		targets.forEach(registration -> registration.lock.lock());
	}

	private static void unlockAll(List<Registration> targets) {
		for (int i = targets.size() - 1; i >= 0; i--) {
			targets.get(i).lock.unlock();
		}
	}

	private List<Registration> subscribers(StoredEvent event) {
		return registrationsByType.getOrDefault(event.getEventType(), List.of());
	}

	private Registration find(String name) {
		Registration registration = registrationsByName.get(name);
		if (registration == null) {
			throw new ProjectorNotFoundException(name);
		}
		return registration;
	}

	/**
	 * 投影器與其投遞狀態，checkpoint 與 rebuilding 由 lock 保護
	 */
	private static final class Registration {

		private final Projector projector;

		private final String name;

		private final Set<String> handledTypes;

		private final ReentrantLock lock = new ReentrantLock();

		private long checkpoint;

		private boolean rebuilding;

		private Registration(Projector projector) {
			this.projector = projector;
			this.name = projector.getName();
			this.handledTypes = Set.copyOf(projector.getHandledEventTypes());
		}
	}
}
