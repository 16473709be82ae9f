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

package com.equidepth.common;

import com.google.common.base.Strings;

/**
 * StatsException is the base class of checked exceptions raised around statistics collection.
 * <p>
 * When it is built from an {@link ErrorCode}, the code is kept so that the caller can report both the
 * numeric code and the SQLSTATE of the failure.
 */
public class StatsException extends Exception {
    private ErrorCode errorCode;

    public StatsException(ErrorCode errorCode, Object... objs) {
        super(errorCode.formatErrorMsg(objs));
        this.errorCode = errorCode;
    }

    public StatsException(String msg, Throwable cause) {
        super(Strings.nullToEmpty(msg), cause);
        this.errorCode = ErrorCode.ERR_UNKNOWN_ERROR;
    }

    public StatsException(String msg) {
        super(Strings.nullToEmpty(msg));
        this.errorCode = ErrorCode.ERR_UNKNOWN_ERROR;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
