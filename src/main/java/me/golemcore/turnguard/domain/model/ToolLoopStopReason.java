package me.golemcore.turnguard.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Why the external tool loop stopped. {@code detail} carries the error or hook
 * message for {@link Kind#ERROR} and {@link Kind#HOOK_BLOCKED}.
 */
public record ToolLoopStopReason(Kind kind, String detail) {

    public enum Kind {
        COMPLETED, MAX_ITERATIONS, RATE_LIMITED, APPROVAL_DENIED, ERROR, HOOK_BLOCKED
    }

    public static ToolLoopStopReason completed() {
        return new ToolLoopStopReason(Kind.COMPLETED, null);
    }

    public static ToolLoopStopReason maxIterations() {
        return new ToolLoopStopReason(Kind.MAX_ITERATIONS, null);
    }

    public static ToolLoopStopReason rateLimited() {
        return new ToolLoopStopReason(Kind.RATE_LIMITED, null);
    }

    public static ToolLoopStopReason approvalDenied() {
        return new ToolLoopStopReason(Kind.APPROVAL_DENIED, null);
    }

    public static ToolLoopStopReason error(String message) {
        return new ToolLoopStopReason(Kind.ERROR, message);
    }

    public static ToolLoopStopReason hookBlocked(String message) {
        return new ToolLoopStopReason(Kind.HOOK_BLOCKED, message);
    }
}
