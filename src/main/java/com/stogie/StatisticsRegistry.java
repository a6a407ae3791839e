/*
 * Copyright 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.stogie;

import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Process-wide directory of running servers' statistics.
 * <p>
 * Each server registers a live supplier under its name when it starts and unregisters it when it stops,
 * so monitoring code can enumerate every server without holding references to them.
 * <p>
 * A shared instance is available via {@link #defaultInstance()}; servers may also be given their own registry.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class StatisticsRegistry {
	@NonNull
	private static final StatisticsRegistry DEFAULT_INSTANCE;

	static {
		DEFAULT_INSTANCE = new StatisticsRegistry();
	}

	@NonNull
	private final Map<String, Supplier<ServerStatistics>> suppliersByName;

	public StatisticsRegistry() {
		this.suppliersByName = new ConcurrentHashMap<>();
	}

	@NonNull
	public static StatisticsRegistry defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	public void register(@NonNull String name,
											 @NonNull Supplier<ServerStatistics> statisticsSupplier) {
		requireNonNull(name);
		requireNonNull(statisticsSupplier);

		this.suppliersByName.put(name, statisticsSupplier);
	}

	public void unregister(@NonNull String name) {
		requireNonNull(name);
		this.suppliersByName.remove(name);
	}

	@NonNull
	public Optional<ServerStatistics> getStatistics(@NonNull String name) {
		requireNonNull(name);

		Supplier<ServerStatistics> statisticsSupplier = this.suppliersByName.get(name);
		return statisticsSupplier == null ? Optional.empty() : Optional.of(statisticsSupplier.get());
	}

	/**
	 * Takes a snapshot of every registered server.
	 *
	 * @return statistics keyed by server name
	 */
	@NonNull
	public Map<String, ServerStatistics> getAllStatistics() {
		Map<String, ServerStatistics> statisticsByName = new LinkedHashMap<>();

		for (Map.Entry<String, Supplier<ServerStatistics>> entry : this.suppliersByName.entrySet())
			statisticsByName.put(entry.getKey(), entry.getValue().get());

		return Collections.unmodifiableMap(statisticsByName);
	}
}
