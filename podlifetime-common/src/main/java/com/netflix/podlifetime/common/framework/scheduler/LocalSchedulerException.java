/*
 * Copyright 2025 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.netflix.podlifetime.common.framework.scheduler;

public class LocalSchedulerException extends RuntimeException {

    public enum ErrorCode {
        NotFound,
        Timeout
    }

    private final ErrorCode errorCode;

    private LocalSchedulerException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public static LocalSchedulerException scheduleNotFound(String scheduleId) {
        return new LocalSchedulerException(ErrorCode.NotFound, "Schedule not found: " + scheduleId);
    }

    public static LocalSchedulerException timeout(String scheduleName) {
        return new LocalSchedulerException(ErrorCode.Timeout, "Action execution timeout: " + scheduleName);
    }
}
