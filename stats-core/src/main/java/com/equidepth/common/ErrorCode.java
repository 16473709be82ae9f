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
//   https://github.com/apache/incubator-doris/blob/master/fe/fe-core/src/main/java/org/apache/doris/common/ErrorCode.java

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

import java.util.MissingFormatArgumentException;

/**
 * Error codes reported by the statistics layer. Every code carries a SQLSTATE so that callers running inside a
 * query engine can map the failure onto the statement that triggered collection.
 */
public enum ErrorCode {
    ERR_UNKNOWN_ERROR(1105, new byte[] {'H', 'Y', '0', '0', '0'}, "Unknown error"),

    /**
     * 5100 - 5199: Configuration
     */
    ERROR_CONFIG_INVALID_VALUE(5101, new byte[] {'F', '0', '0', '0', '0'}, "Invalid value '%s' for config '%s'"),
    ERROR_CONFIG_NOT_EXIST(5102, new byte[] {'F', '0', '0', '0', '0'}, "Config '%s' does not exist or is not mutable"),
    ERROR_CONFIG_UNKNOWN_ENV(5103, new byte[] {'F', '0', '0', '0', '0'}, "No such env variable: %s"),

    /**
     * 5400 - 5499: Statistics
     */
    ERR_HISTOGRAM_UNSORTED_INPUT(5401, new byte[] {'2', '2', '0', '0', '0'},
            "Histogram input of column %d is not sorted: value at position %d is lower than its predecessor"),
    ERR_HISTOGRAM_INVALID_BUCKET_NUM(5402, new byte[] {'2', '2', '0', '2', '3'},
            "Invalid histogram bucket number %d, it must be at least 1"),
    ;

    ErrorCode(int code, byte[] sqlState, String errorMsg) {
        this.code = code;
        this.sqlState = sqlState;
        this.errorMsg = errorMsg;
    }

    // This is error code
    private final int code;
    // This sql state is compatible with ANSI SQL
    private final byte[] sqlState;
    // Error message format
    private final String errorMsg;

    public int getCode() {
        return code;
    }

    public byte[] getSqlState() {
        return sqlState;
    }

    public String formatErrorMsg(Object... args) {
        try {
            return String.format(errorMsg, args);
        } catch (MissingFormatArgumentException e) {
            return errorMsg;
        }
    }
}
