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

import com.facebook.airlift.concurrent.SetThreadName;
import com.facebook.airlift.log.Logger;
import com.facebook.presto.common.Page;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import io.airlift.units.Duration;
import io.streamjoin.spi.PageStream;

import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

import java.io.Closeable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import static com.google.common.base.Preconditions.checkState;
import static com.google.common.util.concurrent.MoreExecutors.directExecutor;
import static io.streamjoin.spi.PageStream.NOT_BLOCKED;
import static java.util.Objects.requireNonNull;

/**
 * Moves the pages of one stream into a consumer, for a bounded amount of time per call.
 * A driver never waits on its stream: when the stream is blocked, {@link #processFor}
 * returns a future that completes once the stream may make progress again.
 */
@ThreadSafe
public class Driver
        implements Closeable
{
    private static final Logger log = Logger.get(Driver.class);

    private final String name;
    private final PageStream source;
    private final Consumer<Page> output;
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicReference<SettableFuture<?>> driverBlockedFuture = new AtomicReference<>();

    @GuardedBy("lock")
    private boolean finished;
    @GuardedBy("lock")
    private boolean closed;

    public Driver(String name, PageStream source, Consumer<Page> output)
    {
        this.name = requireNonNull(name, "name is null");
        this.source = requireNonNull(source, "source is null");
        this.output = requireNonNull(output, "output is null");

        // initially the driver is not blocked
        SettableFuture<?> future = SettableFuture.create();
        future.set(null);
        driverBlockedFuture.set(future);
    }

    public boolean isFinished()
    {
        lock.lock();
        try {
            return finished || closed;
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Processes the stream until it is finished, blocked, or {@code duration} has passed.
     * A failure of the stream closes the driver and is rethrown.
     */
    public ListenableFuture<?> processFor(Duration duration)
    {
        requireNonNull(duration, "duration is null");
        checkState(!lock.isHeldByCurrentThread(), "Can not process for a duration while holding the driver lock");

        // if the driver is blocked we don't need to continue
        SettableFuture<?> blockedFuture = driverBlockedFuture.get();
        if (!blockedFuture.isDone()) {
            return blockedFuture;
        }

        long maxRuntime = duration.roundTo(TimeUnit.NANOSECONDS);
        if (!lock.tryLock()) {
            return NOT_BLOCKED;
        }
        try (SetThreadName ignored = new SetThreadName("Driver-%s", name)) {
            if (finished || closed) {
                return NOT_BLOCKED;
            }
            long start = System.nanoTime();
            do {
                Page page = source.getNextPage();
                if (page != null) {
                    output.accept(page);
                    continue;
                }
                if (source.isFinished()) {
                    finished = true;
                    break;
                }
                ListenableFuture<?> blocked = source.isBlocked();
                if (!blocked.isDone()) {
                    return updateDriverBlockedFuture(blocked);
                }
            }
            while (System.nanoTime() - start < maxRuntime);

            if (finished) {
                closeSource();
            }
            return NOT_BLOCKED;
        }
        catch (RuntimeException e) {
            finished = true;
            try {
                closeSource();
            }
            catch (RuntimeException closeException) {
                if (closeException != e) {
                    e.addSuppressed(closeException);
                }
                log.error(closeException, "Error closing stream after failure");
            }
            throw e;
        }
        finally {
            lock.unlock();
        }
    }

    public String getName()
    {
        return name;
    }

    private ListenableFuture<?> updateDriverBlockedFuture(ListenableFuture<?> sourceBlockedFuture)
    {
        // driverBlockedFuture will be completed as soon as the sourceBlockedFuture is completed
        SettableFuture<?> newDriverBlockedFuture = SettableFuture.create();
        driverBlockedFuture.set(newDriverBlockedFuture);
        sourceBlockedFuture.addListener(() -> newDriverBlockedFuture.set(null), directExecutor());
        return newDriverBlockedFuture;
    }

    @GuardedBy("lock")
    private void closeSource()
    {
        if (closed) {
            return;
        }
        closed = true;
        source.close();
    }

    @Override
    public void close()
    {
        lock.lock();
        try {
            closeSource();
        }
        finally {
            lock.unlock();
        }
        // wake up anyone waiting on the blocked future
        driverBlockedFuture.get().set(null);
    }
}
