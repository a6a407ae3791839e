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
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Where a {@link Server} listens: a TCP host and port, a UNIX domain socket path, or a socket inherited from the launching process.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class BindAddress {
	@NonNull
	private final Type type;
	@Nullable
	private final String host;
	@Nullable
	private final Integer port;
	@Nullable
	private final Path path;
	@Nullable
	private final String abstractName;

	/**
	 * A TCP address.  {@code host} may be a literal IPv4 or IPv6 address, {@code 0.0.0.0} or {@code ::} for all interfaces, or a resolvable hostname.
	 * A port of {@code 0} requests an ephemeral port; {@link Server#getBindAddress()} reports the actual one once prepared.
	 *
	 * @param host the host to bind to
	 * @param port the port to bind to
	 * @return the bind address
	 */
	@NonNull
	public static BindAddress withHostAndPort(@NonNull String host,
																						@NonNull Integer port) {
		requireNonNull(host);
		requireNonNull(port);

		if (port < 0 || port > 65_535)
			throw new IllegalArgumentException(format("Illegal port %d", port));

		return new BindAddress(Type.TCP, host, port, null, null);
	}

	/**
	 * A UNIX domain socket.
	 * <p>
	 * A name starting with a NUL character binds in the Linux abstract namespace, see {@link #withAbstractName(String)}.
	 * Anything else is a filesystem path.
	 *
	 * @param path the socket file path, or a NUL followed by an abstract name
	 * @return the bind address
	 */
	@NonNull
	public static BindAddress withPath(@NonNull String path) {
		requireNonNull(path);

		if (path.startsWith("\0"))
			return withAbstractName(path.substring(1));

		if (path.isEmpty())
			throw new IllegalArgumentException("UNIX domain socket path must not be empty");

		return withPath(Path.of(path));
	}

	@NonNull
	public static BindAddress withPath(@NonNull Path path) {
		requireNonNull(path);
		return new BindAddress(Type.UNIX, null, null, path, null);
	}

	/**
	 * A Linux abstract-namespace UNIX domain socket.  No file is created, so no permissions are applied after binding.
	 *
	 * @param abstractName the socket name, without the leading NUL
	 * @return the bind address
	 */
	@NonNull
	public static BindAddress withAbstractName(@NonNull String abstractName) {
		requireNonNull(abstractName);

		if (abstractName.isEmpty())
			throw new IllegalArgumentException("Abstract UNIX domain socket name must not be empty");

		return new BindAddress(Type.UNIX, null, null, null, abstractName);
	}

	/**
	 * The listening socket handed to this process by its launcher (e.g. systemd socket activation with {@code StandardInput=socket}).
	 *
	 * @return the bind address
	 */
	@NonNull
	public static BindAddress inherited() {
		return new BindAddress(Type.INHERITED, null, null, null, null);
	}

	private BindAddress(@NonNull Type type,
											@Nullable String host,
											@Nullable Integer port,
											@Nullable Path path,
											@Nullable String abstractName) {
		this.type = requireNonNull(type);
		this.host = host;
		this.port = port;
		this.path = path;
		this.abstractName = abstractName;
	}

	@NonNull
	public Type getType() {
		return this.type;
	}

	@NonNull
	public Optional<String> getHost() {
		return Optional.ofNullable(this.host);
	}

	@NonNull
	public Optional<Integer> getPort() {
		return Optional.ofNullable(this.port);
	}

	@NonNull
	public Optional<Path> getPath() {
		return Optional.ofNullable(this.path);
	}

	/**
	 * The abstract-namespace name, without its leading NUL.
	 *
	 * @return the name, or empty for anything but an abstract UNIX domain socket
	 */
	@NonNull
	public Optional<String> getAbstractName() {
		return Optional.ofNullable(this.abstractName);
	}

	@NonNull
	public Boolean isAbstractNamespace() {
		return this.abstractName != null;
	}

	/**
	 * Does binding this address ask the OS to pick a port?
	 *
	 * @return {@code true} for TCP port {@code 0}
	 */
	@NonNull
	public Boolean isEphemeral() {
		return getType() == Type.TCP && Objects.equals(this.port, 0);
	}

	@Override
	@NonNull
	public String toString() {
		if (getType() == Type.UNIX)
			return this.abstractName != null ? "@" + this.abstractName : String.valueOf(this.path);

		if (getType() == Type.INHERITED)
			return "inherited";

		// Bracket IPv6 literals so the port stays unambiguous
		if (this.host != null && this.host.indexOf(':') >= 0)
			return format("[%s]:%d", this.host, this.port);

		return format("%s:%d", this.host, this.port);
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof BindAddress bindAddress))
			return false;

		return Objects.equals(getType(), bindAddress.getType())
				&& Objects.equals(getHost(), bindAddress.getHost())
				&& Objects.equals(getPort(), bindAddress.getPort())
				&& Objects.equals(getPath(), bindAddress.getPath())
				&& Objects.equals(getAbstractName(), bindAddress.getAbstractName());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getType(), getHost(), getPort(), getPath(), getAbstractName());
	}

	/**
	 * Kinds of bind address.
	 */
	public enum Type {
		TCP,
		UNIX,
		INHERITED
	}
}
