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
import com.google.common.io.BaseEncoding;

/**
 * Bucket is an element of a histogram.
 * <p>
 * The count of a bucket is the number of items stored in all previous buckets and the current bucket,
 * so counts are always in increasing order along the bucket list.
 * The upper bound is the greatest item value stored in the bucket, the lower bound is the first one.
 * Repeats is the number of repeats of the upper bound value, it can be used to find popular values.
 */
public class Bucket {
    private long count;
    private final byte[] lowerBound;
    private byte[] upperBound;
    private long repeats;

    Bucket(long count, byte[] lowerBound, byte[] upperBound, long repeats) {
        this.count = count;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.repeats = repeats;
    }

    // the bounds are copied, so the copy shares nothing with the original
    Bucket(Bucket other) {
        this(other.count, other.lowerBound.clone(), other.upperBound.clone(), other.repeats);
    }

    void insertRepeatedItem() {
        count++;
        repeats++;
    }

    void insertItem(byte[] value) {
        upperBound = value;
        count++;
        repeats = 1;
    }

    public long getCount() {
        return count;
    }

    public byte[] getLowerBound() {
        return lowerBound;
    }

    public byte[] getUpperBound() {
        return upperBound;
    }

    public long getRepeats() {
        return repeats;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("count", count)
                .add("lower", BaseEncoding.base16().encode(lowerBound))
                .add("upper", BaseEncoding.base16().encode(upperBound))
                .add("repeats", repeats)
                .toString();
    }
}
