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
import com.google.common.collect.ImmutableList;
import io.streamjoin.spi.PageStream;

import java.util.Iterator;
import java.util.List;

import static java.util.Objects.requireNonNull;

public class FixedPageStream
        implements PageStream
{
    private final Iterator<Page> pages;
    private boolean closed;

    public FixedPageStream(List<Page> pages)
    {
        this.pages = ImmutableList.copyOf(requireNonNull(pages, "pages is null")).iterator();
    }

    @Override
    public Page getNextPage()
    {
        if (closed || !pages.hasNext()) {
            return null;
        }
        return pages.next();
    }

    @Override
    public boolean isFinished()
    {
        return closed || !pages.hasNext();
    }

    @Override
    public void close()
    {
        closed = true;
    }
}
