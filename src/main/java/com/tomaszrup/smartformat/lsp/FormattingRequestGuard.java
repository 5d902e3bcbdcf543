////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.smartformat.lsp;

import java.net.URI;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs formatting requests fail-soft: a failure is logged and answered
 * with {@code noResult}.
 *
 * <p>Cancellation is passed through so that lsp4j can answer the request as
 * cancelled. {@link VirtualMachineError}s are never caught.</p>
 */
class FormattingRequestGuard {
	private static final Logger logger = LoggerFactory.getLogger(FormattingRequestGuard.class);

	<T> CompletableFuture<T> run(String requestName, URI uri, Supplier<CompletableFuture<T>> request,
			T noResult) {
		CompletableFuture<T> result;
		try {
			result = request.get();
		} catch (CancellationException e) {
			throw e;
		} catch (RuntimeException | LinkageError e) {
			logFailure(requestName, uri, rootCause(e));
			return CompletableFuture.completedFuture(noResult);
		}
		if (result == null) {
			return CompletableFuture.completedFuture(noResult);
		}
		return result.handle((value, failure) -> {
			if (failure == null) {
				return value;
			}
			Throwable cause = rootCause(failure);
			if (cause instanceof CancellationException) {
				throw (CancellationException) cause;
			}
			if (cause instanceof VirtualMachineError) {
				throw (VirtualMachineError) cause;
			}
			logFailure(requestName, uri, cause);
			return noResult;
		});
	}

	private static void logFailure(String requestName, URI uri, Throwable cause) {
		logger.warn("{} failed for {}, answering with no edits: {}", requestName, uri, cause.toString());
		logger.debug("{} failure", requestName, cause);
	}

	/** Strips the wrappers {@link CompletableFuture} puts around a failure. */
	static Throwable rootCause(Throwable throwable) {
		Throwable current = throwable;
		while ((current instanceof CompletionException || current instanceof ExecutionException)
				&& current.getCause() != null) {
			current = current.getCause();
		}
		return current;
	}
}
