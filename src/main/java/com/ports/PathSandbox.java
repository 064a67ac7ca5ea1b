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

package com.ports;

import com.ports.exception.PathViolationException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Resolves decoded request paths against a canonical root directory, rejecting anything that would land outside it.
 * <p>
 * The root is canonicalized once, at construction. Each request path is joined to it and then canonicalized as well,
 * following symbolic links for the portion of the path that exists, so neither {@code ..} segments (encoded or not)
 * nor links pointing elsewhere can escape.
 */
@ThreadSafe
public final class PathSandbox {
	@NonNull
	private final Path rootDirectory;

	/**
	 * Creates a sandbox rooted at the canonical form of the given directory.
	 *
	 * @param rootDirectory an existing directory
	 * @return the sandbox
	 * @throws IllegalArgumentException if the directory does not exist or cannot be canonicalized
	 */
	@NonNull
	public static PathSandbox forRootDirectory(@NonNull Path rootDirectory) {
		requireNonNull(rootDirectory);

		if (!Files.isDirectory(rootDirectory))
			throw new IllegalArgumentException(format("Root directory %s does not exist or is not a directory", rootDirectory));

		try {
			return new PathSandbox(rootDirectory.toRealPath());
		} catch (IOException e) {
			throw new IllegalArgumentException(format("Unable to canonicalize root directory %s", rootDirectory), e);
		}
	}

	private PathSandbox(@NonNull Path rootDirectory) {
		this.rootDirectory = requireNonNull(rootDirectory);
	}

	/**
	 * Resolves a percent-decoded request path.
	 *
	 * @param requestPath the decoded path, e.g. {@code /docs/readme.md}
	 * @return the canonical absolute path, guaranteed to be the root or beneath it; it may not exist
	 * @throws PathViolationException if the path escapes the root or is not a legal filesystem path
	 */
	@NonNull
	public Path resolve(@NonNull String requestPath) {
		requireNonNull(requestPath);

		String relativePath = requestPath;

		while (relativePath.startsWith("/"))
			relativePath = relativePath.substring(1);

		Path canonicalPath;

		try {
			canonicalPath = canonicalize(getRootDirectory().resolve(relativePath));
		} catch (InvalidPathException e) {
			throw new PathViolationException(format("Illegal request path '%s'", requestPath), e, requestPath);
		} catch (IOException e) {
			throw new PathViolationException(format("Unable to canonicalize request path '%s'", requestPath), e, requestPath);
		}

		if (!isWithinRoot(canonicalPath))
			throw new PathViolationException(format("Request path '%s' resolves outside of the root directory", requestPath), requestPath);

		return canonicalPath;
	}

	/**
	 * Whether the given path is the canonical root or lies beneath it, compared component by component.
	 */
	@NonNull
	public Boolean isWithinRoot(@NonNull Path canonicalPath) {
		requireNonNull(canonicalPath);
		return canonicalPath.equals(getRootDirectory()) || canonicalPath.startsWith(getRootDirectory());
	}

	@NonNull
	private Path canonicalize(@NonNull Path path) throws IOException {
		requireNonNull(path);

		if (Files.exists(path))
			return path.toRealPath();

		// Canonicalize the deepest ancestor that exists, then append the rest after lexical normalization
		Path existingAncestor = path.getParent();

		while (existingAncestor != null && !Files.exists(existingAncestor))
			existingAncestor = existingAncestor.getParent();

		if (existingAncestor == null)
			return path.toAbsolutePath().normalize();

		Path remainder = existingAncestor.relativize(path);
		return existingAncestor.toRealPath().resolve(remainder).normalize();
	}

	@NonNull
	public Path getRootDirectory() {
		return this.rootDirectory;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{rootDirectory=%s}", getClass().getSimpleName(), getRootDirectory());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof PathSandbox pathSandbox))
			return false;

		return getRootDirectory().equals(pathSandbox.getRootDirectory());
	}

	@Override
	public int hashCode() {
		return getRootDirectory().hashCode();
	}
}
