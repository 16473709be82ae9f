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

package com.equidepth.statistic.histogram;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Builds an equi-depth histogram over the encoded values of one column or index in a single pass.
 * <p>
 * Values must be fed through {@link #ingest(byte[])} in ascending order of their encoded bytes. The order is
 * not checked: unsorted input silently produces an inaccurate histogram.
 * <p>
 * The builder starts with one item per bucket. Once {@code bucketsNum} buckets exist and the last one is full,
 * every two neighbor buckets are merged and the per bucket limit is doubled, so the number of buckets stays
 * bounded by {@code bucketsNum} while the memory use stays constant.
 * <p>
 * A value equal to the upper bound of the last bucket always goes into that bucket, even if it is full,
 * so that a single value is never split across buckets.
 * <p>
 * Not thread safe. Use one builder per column.
 */
public class HistogramBuilder {
    private static final Logger LOG = LogManager.getLogger(HistogramBuilder.class);

    // column or index id, not interpreted
    private final long id;
    // max number of buckets
    private final int bucketsNum;
    private final List<Bucket> buckets;
    // number of distinct values
    private long ndv = 0;
    // max number of values in one bucket. When a bucket reaches it, only a value equal to
    // its upper bound can still be inserted into it.
    private long perBucketLimit = 1;
    private int mergeCount = 0;

    public HistogramBuilder(long id, int bucketsNum) {
        Preconditions.checkArgument(bucketsNum >= 1, "bucketsNum must be at least 1, got %s", bucketsNum);
        this.id = id;
        this.bucketsNum = bucketsNum;
        this.buckets = Lists.newArrayListWithCapacity(bucketsNum + 1);
    }

    /**
     * Adds one encoded value. The builder keeps a reference to {@code value}, the caller must not modify it
     * afterwards.
     */
    public void ingest(byte[] value) {
        Preconditions.checkNotNull(value, "histogram value is null");
        Bucket last = getLastBucket();
        if (last != null && Arrays.equals(last.getUpperBound(), value)) {
            last.insertRepeatedItem();
            return;
        }

        ndv++;
        if (buckets.size() >= bucketsNum && isLastBucketFull()) {
            mergeBuckets();
        }

        if (!isLastBucketFull()) {
            getLastBucket().insertItem(value);
            return;
        }

        // the last bucket is full or absent, open a new one
        last = getLastBucket();
        long count = 1 + (last == null ? 0 : last.getCount());
        buckets.add(new Bucket(count, value, value, 1));
    }

    /**
     * An empty bucket list counts as full, which makes the first value open the first bucket.
     */
    boolean isLastBucketFull() {
        if (buckets.isEmpty()) {
            return true;
        }
        return getBucketItemCount(buckets.size() - 1) >= perBucketLimit;
    }

    // Merges every two neighbor buckets, an odd bucket at the tail is kept as is.
    private void mergeBuckets() {
        int size = buckets.size();
        int merged = 0;
        for (int i = 0; i < size; i += 2) {
            Bucket first = buckets.get(i);
            if (i + 1 < size) {
                Bucket second = buckets.get(i + 1);
                buckets.set(merged++,
                        new Bucket(second.getCount(), first.getLowerBound(), second.getUpperBound(),
                                second.getRepeats()));
            } else {
                buckets.set(merged++, first);
            }
        }
        buckets.subList(merged, size).clear();
        perBucketLimit *= 2;
        mergeCount++;
        LOG.debug("merge histogram buckets of {} from {} to {}, per bucket limit is {} now",
                id, size, merged, perBucketLimit);
    }

    private Bucket getLastBucket() {
        return buckets.isEmpty() ? null : buckets.get(buckets.size() - 1);
    }

    private long getBucketItemCount(int index) {
        long count = buckets.get(index).getCount();
        return index == 0 ? count : count - buckets.get(index - 1).getCount();
    }

    /**
     * Takes a read-only snapshot of the current state. The builder can keep ingesting afterwards.
     */
    public Histogram build() {
        return new Histogram(id, ndv, perBucketLimit, buckets);
    }

    public long getId() {
        return id;
    }

    public int getBucketsNum() {
        return bucketsNum;
    }

    public long getNdv() {
        return ndv;
    }

    public long getPerBucketLimit() {
        return perBucketLimit;
    }

    public int getMergeCount() {
        return mergeCount;
    }

    public long getTotalCount() {
        Bucket last = getLastBucket();
        return last == null ? 0 : last.getCount();
    }

    public List<Bucket> getBuckets() {
        return Collections.unmodifiableList(buckets);
    }
}
