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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * The finished histogram of one column or index. Buckets are ordered by their bounds and carry
 * cumulative counts, see {@link Bucket}.
 * <p>
 * The buckets and their bound arrays are copies taken when the histogram is built, changing them does not
 * affect the builder.
 */
public class Histogram {
    private final long id;
    private final long ndv;
    private final long perBucketLimit;
    private final ImmutableList<Bucket> buckets;

    Histogram(long id, long ndv, long perBucketLimit, List<Bucket> buckets) {
        this.id = id;
        this.ndv = ndv;
        this.perBucketLimit = perBucketLimit;
        ImmutableList.Builder<Bucket> builder = ImmutableList.builderWithExpectedSize(buckets.size());
        for (Bucket bucket : buckets) {
            builder.add(new Bucket(bucket));
        }
        this.buckets = builder.build();
    }

    public long getId() {
        return id;
    }

    public long getNdv() {
        return ndv;
    }

    public long getPerBucketLimit() {
        return perBucketLimit;
    }

    public List<Bucket> getBuckets() {
        return buckets;
    }

    public int getBucketCount() {
        return buckets.size();
    }

    public long getTotalCount() {
        return buckets.isEmpty() ? 0 : buckets.get(buckets.size() - 1).getCount();
    }

    /**
     * Number of items in the bucket at {@code index} alone, derived from the cumulative counts.
     */
    public long getBucketItemCount(int index) {
        Preconditions.checkElementIndex(index, buckets.size());
        long count = buckets.get(index).getCount();
        return index == 0 ? count : count - buckets.get(index - 1).getCount();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", id)
                .add("ndv", ndv)
                .add("perBucketLimit", perBucketLimit)
                .add("buckets", buckets)
                .toString();
    }
}
