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
package io.streamjoin;

import com.facebook.presto.common.Page;
import com.facebook.presto.common.PageBuilder;
import com.facebook.presto.common.block.Block;
import com.facebook.presto.common.block.BlockBuilder;
import com.facebook.presto.common.type.Type;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.facebook.presto.common.type.BooleanType.BOOLEAN;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Builds pages row by row, for tests. {@link #pageBreak()} starts a new page.
 */
public class RowPagesBuilder
{
    private final List<Type> types;
    private final List<Page> pages = new ArrayList<>();
    private PageBuilder pageBuilder;

    public static RowPagesBuilder rowPagesBuilder(Type... types)
    {
        return rowPagesBuilder(ImmutableList.copyOf(types));
    }

    public static RowPagesBuilder rowPagesBuilder(List<Type> types)
    {
        return new RowPagesBuilder(types);
    }

    private RowPagesBuilder(List<Type> types)
    {
        this.types = ImmutableList.copyOf(requireNonNull(types, "types is null"));
        this.pageBuilder = new PageBuilder(this.types);
    }

    public List<Type> getTypes()
    {
        return types;
    }

    public RowPagesBuilder row(Object... values)
    {
        checkArgument(values.length == types.size(), "expected %s values, got %s", types.size(), values.length);
        for (int channel = 0; channel < values.length; channel++) {
            writeValue(types.get(channel), pageBuilder.getBlockBuilder(channel), values[channel]);
        }
        pageBuilder.declarePosition();
        return this;
    }

    public RowPagesBuilder rows(List<List<Object>> rows)
    {
        for (List<Object> row : rows) {
            row(row.toArray());
        }
        return this;
    }

    public RowPagesBuilder pageBreak()
    {
        if (!pageBuilder.isEmpty()) {
            pages.add(pageBuilder.build());
            pageBuilder = new PageBuilder(types);
        }
        return this;
    }

    public List<Page> build()
    {
        pageBreak();
        return ImmutableList.copyOf(pages);
    }

    /**
     * Splits {@code rows} into pages of {@code rowsPerPage} rows.
     */
    public static List<Page> toPages(List<Type> types, List<List<Object>> rows, int rowsPerPage)
    {
        RowPagesBuilder builder = rowPagesBuilder(types);
        for (int i = 0; i < rows.size(); i++) {
            if (i > 0 && i % rowsPerPage == 0) {
                builder.pageBreak();
            }
            builder.row(rows.get(i).toArray());
        }
        return builder.build();
    }

    private static void writeValue(Type type, BlockBuilder blockBuilder, Object value)
    {
        if (value == null) {
            blockBuilder.appendNull();
        }
        else if (BOOLEAN.equals(type)) {
            type.writeBoolean(blockBuilder, (Boolean) value);
        }
        else {
            type.writeLong(blockBuilder, ((Number) value).longValue());
        }
    }

    /**
     * Reads every row of {@code pages}, with nulls for SQL nulls.
     */
    public static List<List<Object>> toRows(List<Type> types, List<Page> pages)
    {
        List<List<Object>> rows = new ArrayList<>();
        for (Page page : pages) {
            checkArgument(page.getChannelCount() == types.size(), "page has %s channels, expected %s", page.getChannelCount(), types.size());
            for (int position = 0; position < page.getPositionCount(); position++) {
                Object[] row = new Object[types.size()];
                for (int channel = 0; channel < types.size(); channel++) {
                    row[channel] = readValue(types.get(channel), page.getBlock(channel), position);
                }
                rows.add(Arrays.asList(row));
            }
        }
        return rows;
    }

    private static Object readValue(Type type, Block block, int position)
    {
        if (block.isNull(position)) {
            return null;
        }
        if (BOOLEAN.equals(type)) {
            return type.getBoolean(block, position);
        }
        return type.getLong(block, position);
    }
}
