package com.example.eventsourcing.config.init;

import java.util.List;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.example.eventsourcing.application.domain.exception.ProjectorNotFoundException;
import com.example.eventsourcing.application.domain.projection.Projector;
import com.example.eventsourcing.application.service.ProjectionManager;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * <h1>投影重建指令</h1>
 * <p>
 * 指定 --all 重建全部投影器，指定 --projector 重建單一投影器，都未指定時列出已註冊的投影器。
 * </p>
 *
 * <pre>
 * java -jar app.jar --eventsourcing.tools.command=projection-rebuild (--projector=NAME | --all)
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "eventsourcing.tools", name = "command", havingValue = "projection-rebuild")
public class ProjectionRebuildRunner implements ApplicationRunner {

	private final ProjectionManager projectionManager;

	@Override
	public void run(ApplicationArguments args) {
		if (args.containsOption("all")) {
			log.info(">>> [Rebuild] 開始重建所有投影器");
			long scanned = projectionManager.rebuildAll();
			log.info(">>> [Rebuild] 所有投影器重建完成，掃描 {} 筆事件", scanned);
			return;
		}

		String name = RunnerOptions.value(args, "projector");
		if (name != null) {
			log.info(">>> [Rebuild] 開始重建投影器 {}", name);
			try {
				long scanned = projectionManager.rebuild(name);
				log.info(">>> [Rebuild] 投影器 {} 重建完成，掃描 {} 筆事件", name, scanned);
			} catch (ProjectorNotFoundException e) {
				log.error(">>> [Rebuild] {}", e.getMessage());
				throw e;
			}
			return;
		}

		List<Projector> projectors = projectionManager.getProjectors();
		if (projectors.isEmpty()) {
			log.warn(">>> [Rebuild] 沒有已註冊的投影器");
			return;
		}
		log.info(">>> [Rebuild] 已註冊的投影器:");
		projectors.forEach(projector -> log.info(">>> [Rebuild]   - {}", projector.getName()));
		log.info(">>> [Rebuild] 使用 --projector=NAME 或 --all 執行重建");
	}
}
