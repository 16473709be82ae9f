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

import com.equidepth.statistic.histogram.Histogram;
import com.google.common.base.MoreObjects;

/**
 * Histogram of one column together with the row counts seen while collecting it.
 * NULL values are not part of the histogram, they are only counted.
 */
public class ColumnHistogram {
    private final Histogram histogram;
    private final long nullCount;
    private final long rowCount;

    public ColumnHistogram(Histogram histogram, long nullCount, long rowCount) {
        this.histogram = histogram;
        this.nullCount = nullCount;
        this.rowCount = rowCount;
    }

    public long getColumnId() {
        return histogram.getId();
    }

    public Histogram getHistogram() {
        return histogram;
    }

    public long getNullCount() {
        return nullCount;
    }

    public long getRowCount() {
        return rowCount;
    }

    public long getNotNullCount() {
        return rowCount - nullCount;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("rowCount", rowCount)
                .add("nullCount", nullCount)
                .add("histogram", histogram)
                .toString();
    }
}
