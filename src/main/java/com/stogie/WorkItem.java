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

import static java.util.Objects.requireNonNull;

/**
 * What a worker thread can find on the work queue: a connection to serve, or an instruction to exit.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
sealed interface WorkItem permits WorkItem.Work, WorkItem.Shutdown {
	@NonNull
	WorkItem SHUTDOWN = new Shutdown();

	record Work(@NonNull HttpConnection connection) implements WorkItem {
		public Work {
			requireNonNull(connection);
		}
	}

	record Shutdown() implements WorkItem {}
}
