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

package com.netflix.podlifetime.server.kubernetes.controller;

/**
 * Result of a single pod reconciliation. All values denote a successful invocation. Failures are reported
 * as exceptions.
 */
public enum ReconcileOutcome {

    /**
     * The pod does not exist.
     */
    NOT_FOUND,

    /**
     * The pod has no lifetime label.
     */
    EXEMPT,

    /**
     * The lifetime label value is not a non-negative integer number of seconds. The pod is left untouched.
     */
    INVALID_LIFETIME,

    /**
     * None of the pod containers is running.
     */
    NOT_RUNNING,

    /**
     * The lifetime has not elapsed yet.
     */
    NOT_EXPIRED,

    /**
     * The lifetime elapsed, and the delete request was accepted.
     */
    DELETED,

    /**
     * The lifetime elapsed, but the pod was removed before the delete request reached the API server.
     */
    ALREADY_DELETED
}
