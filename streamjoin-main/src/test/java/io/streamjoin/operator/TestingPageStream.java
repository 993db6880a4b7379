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
package io.streamjoin.operator;

import com.facebook.presto.common.Page;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import io.streamjoin.spi.PageStream;

import java.util.ArrayDeque;
import java.util.Queue;

import static com.google.common.base.Preconditions.checkState;

/**
 * A page stream fed by the test. It is blocked while it has no page queued and has
 * not been finished.
 */
public class TestingPageStream
        implements PageStream
{
    private final Queue<Page> pages = new ArrayDeque<>();
    private SettableFuture<?> blocked = SettableFuture.create();
    private boolean noMorePages;
    private RuntimeException failure;
    private boolean closed;
    private int polls;

    public synchronized TestingPageStream addPage(Page page)
    {
        checkState(!noMorePages, "no more pages expected");
        pages.add(page);
        blocked.set(null);
        return this;
    }

    public synchronized TestingPageStream noMorePages()
    {
        noMorePages = true;
        blocked.set(null);
        return this;
    }

    public synchronized void fail(RuntimeException failure)
    {
        this.failure = failure;
        blocked.set(null);
    }

    @Override
    public synchronized Page getNextPage()
    {
        polls++;
        if (failure != null) {
            throw failure;
        }
        return pages.poll();
    }

    @Override
    public synchronized boolean isFinished()
    {
        return closed || (noMorePages && pages.isEmpty());
    }

    @Override
    public synchronized ListenableFuture<?> isBlocked()
    {
        if (!pages.isEmpty() || noMorePages || failure != null || closed) {
            return NOT_BLOCKED;
        }
        if (blocked.isDone()) {
            blocked = SettableFuture.create();
        }
        return blocked;
    }

    @Override
    public synchronized void close()
    {
        closed = true;
        blocked.set(null);
    }

    public synchronized boolean isClosed()
    {
        return closed;
    }

    public synchronized int getPolls()
    {
        return polls;
    }
}
