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

// This file is based on code available under the Apache license here:
//   https://github.com/apache/incubator-doris/blob/master/fe/fe-core/src/main/java/org/apache/doris/common/Config.java

// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.

package com.equidepth.common;

import com.equidepth.statistic.StatsConstants;

public class Config extends ConfigBase {

    /**
     * default bucket size of histogram statistics
     */
    @ConfField(mutable = true, aliases = {"histogram_bucket_num"},
            comment = "Target number of buckets of a histogram when the caller does not pass one")
    public static long histogram_buckets_size = StatsConstants.DEFAULT_HISTOGRAM_BUCKET_NUM;

    /**
     * If set to true, histogram collection verifies that the encoded values arrive in ascending order
     * and fails the collection on the first value lower than its predecessor.
     * The histogram builder itself never checks the order.
     */
    @ConfField(mutable = true, comment = "Fail histogram collection on unsorted input")
    public static boolean histogram_check_input_order = false;

    /**
     * Number of non-null values between two progress logs of histogram collection.
     */
    @ConfField(mutable = true)
    public static long histogram_collect_log_interval = 1000000;
}
