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
package io.streamjoin.execution;

import com.facebook.airlift.log.Logger;
import com.facebook.presto.common.Page;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import io.airlift.units.Duration;
import io.streamjoin.operator.Driver;
import io.streamjoin.spi.plan.PlanNode;

import javax.annotation.concurrent.ThreadSafe;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static com.google.common.util.concurrent.MoreExecutors.directExecutor;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Runs every partition of a plan on an executor, one {@link Driver} per partition, and
 * collects the pages produced. A driver that is blocked is rescheduled when its input
 * can make progress again.
 */
@ThreadSafe
public class LocalExecutionRunner
{
    private static final Logger log = Logger.get(LocalExecutionRunner.class);
    private static final Duration DEFAULT_QUANTA = new Duration(100, MILLISECONDS);

    private final Executor executor;
    private final Duration quanta;

    public LocalExecutionRunner(Executor executor)
    {
        this(executor, DEFAULT_QUANTA);
    }

    public LocalExecutionRunner(Executor executor, Duration quanta)
    {
        this.executor = requireNonNull(executor, "executor is null");
        this.quanta = requireNonNull(quanta, "quanta is null");
    }

    /**
     * Returns the pages of all partitions, partition 0 first. The future fails with the
     * first failure of any partition, after which the remaining drivers are closed.
     */
    public ListenableFuture<List<Page>> execute(PlanNode plan)
    {
        requireNonNull(plan, "plan is null");
        int partitionCount = plan.getPartitionCount();
        SettableFuture<List<Page>> result = SettableFuture.create();

        List<List<Page>> partitionPages = new ArrayList<>(partitionCount);
        List<Driver> drivers = new ArrayList<>(partitionCount);
        try {
            for (int partition = 0; partition < partitionCount; partition++) {
                List<Page> pages = Collections.synchronizedList(new ArrayList<>());
                partitionPages.add(pages);
                drivers.add(new Driver(plan.getId() + "." + partition, plan.execute(partition), pages::add));
            }
        }
        catch (RuntimeException e) {
            drivers.forEach(Driver::close);
            result.setException(e);
            return result;
        }

        AtomicInteger remaining = new AtomicInteger(partitionCount);
        Execution execution = new Execution(drivers, partitionPages, remaining, result);
        for (Driver driver : drivers) {
            execution.schedule(driver);
        }
        return result;
    }

    private class Execution
    {
        private final List<Driver> drivers;
        private final List<List<Page>> partitionPages;
        private final AtomicInteger remaining;
        private final SettableFuture<List<Page>> result;

        private Execution(List<Driver> drivers, List<List<Page>> partitionPages, AtomicInteger remaining, SettableFuture<List<Page>> result)
        {
            this.drivers = drivers;
            this.partitionPages = partitionPages;
            this.remaining = remaining;
            this.result = result;
        }

        void schedule(Driver driver)
        {
            try {
                executor.execute(() -> process(driver));
            }
            catch (RejectedExecutionException e) {
                fail(e);
            }
        }

        private void process(Driver driver)
        {
            if (result.isDone()) {
                driver.close();
                return;
            }
            ListenableFuture<?> blocked;
            try {
                blocked = driver.processFor(quanta);
            }
            catch (RuntimeException e) {
                fail(e);
                return;
            }

            if (driver.isFinished()) {
                if (remaining.decrementAndGet() == 0) {
                    ImmutableList.Builder<Page> pages = ImmutableList.builder();
                    for (List<Page> partition : partitionPages) {
                        synchronized (partition) {
                            pages.addAll(partition);
                        }
                    }
                    result.set(pages.build());
                }
                return;
            }
            if (blocked.isDone()) {
                schedule(driver);
            }
            else {
                blocked.addListener(() -> schedule(driver), directExecutor());
            }
        }

        private void fail(Throwable failure)
        {
            if (!result.setException(failure)) {
                log.debug(failure, "Partition failed after the execution completed");
            }
            for (Driver driver : drivers) {
                try {
                    driver.close();
                }
                catch (RuntimeException e) {
                    log.error(e, "Error closing driver");
                }
            }
        }
    }
}
