/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.streamjoin.spi;

import com.facebook.presto.common.Page;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;

import java.io.Closeable;

/**
 * A pollable sequence of pages produced by one partition of a plan node.
 * <p>
 * A stream never blocks the calling thread. {@link #getNextPage()} either returns
 * a page, or returns {@code null} when no page is ready. In the latter case the
 * stream is either finished ({@link #isFinished()}), or the caller should wait
 * for {@link #isBlocked()} before polling again. Failures are reported by
 * throwing from {@link #getNextPage()}; a stream that failed produces no
 * further pages.
 */
public interface PageStream
        extends Closeable
{
    ListenableFuture<?> NOT_BLOCKED = Futures.immediateFuture(null);

    /**
     * Returns the next page, or {@code null} if no page is currently available.
     */
    Page getNextPage();

    /**
     * Will this stream produce more pages?
     */
    boolean isFinished();

    /**
     * Returns a future that completes when the stream may be able to produce a
     * page. If the stream is not blocked, this method returns {@code NOT_BLOCKED}.
     */
    default ListenableFuture<?> isBlocked()
    {
        return NOT_BLOCKED;
    }

    /**
     * Releases all state held by the stream. Closing is idempotent and may
     * happen at any point, including before the stream is finished.
     */
    @Override
    void close();
}
