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

public class StatsConstants {
    public static final int DEFAULT_HISTOGRAM_BUCKET_NUM = 64;

    // config keys
    public static final String HISTOGRAM_BUCKET_NUM = "histogram_buckets_size";
    public static final String HISTOGRAM_CHECK_INPUT_ORDER = "histogram_check_input_order";
    public static final String HISTOGRAM_COLLECT_LOG_INTERVAL = "histogram_collect_log_interval";

    private StatsConstants() {
    }
}
