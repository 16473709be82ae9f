// Copyright 2021-present StarRocks, Inc. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     https://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.equidepth.statistic;

import com.equidepth.common.Config;
import com.equidepth.common.ErrorCode;
import com.equidepth.common.StatsException;
import com.equidepth.statistic.histogram.HistogramBuilder;
import com.google.common.primitives.Ints;
import com.google.common.primitives.UnsignedBytes;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Comparator;
import java.util.Iterator;

/**
 * Collects the histogram of one column from its encoded values, which must be sorted in ascending order
 * (for example read through an index or produced by {@code ORDER BY column}).
 * <p>
 * A {@code null} element stands for a SQL NULL. NULLs are counted but never added to the histogram.
 */
public class HistogramCollector {
    private static final Logger LOG = LogManager.getLogger(HistogramCollector.class);

    private static final Comparator<byte[]> ENCODED_VALUE_COMPARATOR = UnsignedBytes.lexicographicalComparator();

    private final int bucketsNum;
    private final boolean checkInputOrder;

    public HistogramCollector() {
        this(Ints.saturatedCast(Config.histogram_buckets_size), Config.histogram_check_input_order);
    }

    public HistogramCollector(int bucketsNum, boolean checkInputOrder) {
        this.bucketsNum = bucketsNum;
        this.checkInputOrder = checkInputOrder;
    }

    public ColumnHistogram collect(long columnId, Iterable<byte[]> sortedValues) throws StatsException {
        return collect(columnId, sortedValues.iterator());
    }

    public ColumnHistogram collect(long columnId, Iterator<byte[]> sortedValues) throws StatsException {
        if (bucketsNum < 1) {
            throw new StatsException(ErrorCode.ERR_HISTOGRAM_INVALID_BUCKET_NUM, bucketsNum);
        }

        HistogramBuilder builder = new HistogramBuilder(columnId, bucketsNum);
        long logInterval = Config.histogram_collect_log_interval;
        long rowCount = 0;
        long nullCount = 0;
        byte[] previous = null;
        while (sortedValues.hasNext()) {
            byte[] value = sortedValues.next();
            long position = rowCount++;
            if (value == null) {
                nullCount++;
                continue;
            }

            if (checkInputOrder && previous != null && ENCODED_VALUE_COMPARATOR.compare(previous, value) > 0) {
                LOG.warn("histogram input of column {} is out of order at position {}", columnId, position);
                throw new StatsException(ErrorCode.ERR_HISTOGRAM_UNSORTED_INPUT, columnId, position);
            }
            previous = value;

            builder.ingest(value);
            long notNullCount = rowCount - nullCount;
            if (logInterval > 0 && notNullCount % logInterval == 0) {
                LOG.debug("collecting histogram of column {}: {} values, ndv {}, {} buckets",
                        columnId, notNullCount, builder.getNdv(), builder.getBuckets().size());
            }
        }

        ColumnHistogram result = new ColumnHistogram(builder.build(), nullCount, rowCount);
        LOG.info("finish collecting histogram of column {}, row count {}, null count {}, ndv {}, bucket count {}",
                columnId, rowCount, nullCount, builder.getNdv(), result.getHistogram().getBucketCount());
        return result;
    }

    public int getBucketsNum() {
        return bucketsNum;
    }

    public boolean isCheckInputOrder() {
        return checkInputOrder;
    }
}
