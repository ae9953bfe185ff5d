package com.example.eventsourcing.infra.persistence;

import com.example.eventsourcing.application.port.SnapshotStorePort;

class InMemorySnapshotStoreTest extends AbstractSnapshotStoreTest {

	@Override
	protected SnapshotStorePort createStore() {
		return new InMemorySnapshotStore();
	}
}
