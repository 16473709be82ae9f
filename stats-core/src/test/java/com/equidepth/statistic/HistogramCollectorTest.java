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
import com.equidepth.statistic.histogram.Histogram;
import com.google.common.collect.Lists;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.equidepth.utframe.EncodedValues.encodeLong;
import static com.equidepth.utframe.EncodedValues.encodeLongs;

public class HistogramCollectorTest {

    @AfterEach
    public void tearDown() {
        Config.histogram_buckets_size = StatsConstants.DEFAULT_HISTOGRAM_BUCKET_NUM;
        Config.histogram_check_input_order = false;
        Config.histogram_collect_log_interval = 1000000;
    }

    @Test
    public void testCollectWithNulls() throws StatsException {
        List<byte[]> values = Lists.newArrayList((byte[]) null, null);
        values.addAll(encodeLongs(0, 1, 2, 3, 3, 3, 3));
        values.add(null);
        values.addAll(encodeLongs(4, 4, 4, 4, 5));

        ColumnHistogram result = new HistogramCollector(3, false).collect(11, values);
        Assertions.assertEquals(11, result.getColumnId());
        Assertions.assertEquals(15, result.getRowCount());
        Assertions.assertEquals(3, result.getNullCount());
        Assertions.assertEquals(12, result.getNotNullCount());

        Histogram histogram = result.getHistogram();
        Assertions.assertEquals(6, histogram.getNdv());
        Assertions.assertEquals(3, histogram.getBucketCount());
        Assertions.assertEquals(4, histogram.getPerBucketLimit());
        Assertions.assertEquals(12, histogram.getTotalCount());
    }

    @Test
    public void testCollectOnlyNulls() throws StatsException {
        ColumnHistogram result = new HistogramCollector(4, true).collect(1, Arrays.<byte[]>asList(null, null));
        Assertions.assertEquals(2, result.getRowCount());
        Assertions.assertEquals(2, result.getNullCount());
        Assertions.assertEquals(0, result.getHistogram().getBucketCount());
        Assertions.assertEquals(0, result.getHistogram().getNdv());
    }

    @Test
    public void testUnsortedInputRejected() {
        List<byte[]> values = encodeLongs(1, 2, 2, 5, 3, 6);
        StatsException e = Assertions.assertThrows(StatsException.class,
                () -> new HistogramCollector(4, true).collect(9, values));
        Assertions.assertEquals(ErrorCode.ERR_HISTOGRAM_UNSORTED_INPUT, e.getErrorCode());
        Assertions.assertTrue(e.getMessage().contains("column 9"), e.getMessage());
        Assertions.assertTrue(e.getMessage().contains("position 4"), e.getMessage());
    }

    @Test
    public void testUnsortedInputNotChecked() throws StatsException {
        List<byte[]> values = encodeLongs(1, 2, 5, 3, 6);
        ColumnHistogram result = new HistogramCollector(4, false).collect(9, values);
        Assertions.assertEquals(5, result.getHistogram().getNdv());
        Assertions.assertEquals(5, result.getHistogram().getTotalCount());
    }

    @Test
    public void testSignedOrderIsUnsignedBytes() throws StatsException {
        // the encoding maps negative numbers below positive ones in unsigned byte order
        List<byte[]> values = encodeLongs(-300, -2, -1, 0, 1, 128, 300);
        ColumnHistogram result = new HistogramCollector(2, true).collect(1, values);
        Assertions.assertEquals(7, result.getHistogram().getNdv());
    }

    @Test
    public void testInvalidBucketNum() {
        StatsException e = Assertions.assertThrows(StatsException.class,
                () -> new HistogramCollector(0, false).collect(1, encodeLongs(1)));
        Assertions.assertEquals(ErrorCode.ERR_HISTOGRAM_INVALID_BUCKET_NUM, e.getErrorCode());
    }

    @Test
    public void testDefaultsFromConfig() throws Exception {
        Config.setMutableConfig(StatsConstants.HISTOGRAM_BUCKET_NUM, "2");
        Config.setMutableConfig(StatsConstants.HISTOGRAM_CHECK_INPUT_ORDER, "true");
        Config.setMutableConfig(StatsConstants.HISTOGRAM_COLLECT_LOG_INTERVAL, "2");

        HistogramCollector collector = new HistogramCollector();
        Assertions.assertEquals(2, collector.getBucketsNum());
        Assertions.assertTrue(collector.isCheckInputOrder());

        List<byte[]> values = Lists.newArrayList();
        for (long i = 0; i < 100; i++) {
            values.add(encodeLong(i));
        }
        ColumnHistogram result = collector.collect(5, values.iterator());
        Assertions.assertTrue(result.getHistogram().getBucketCount() <= 2);
        Assertions.assertEquals(100, result.getHistogram().getNdv());

        Assertions.assertThrows(StatsException.class,
                () -> collector.collect(5, encodeLongs(3, 2)));
    }
}
