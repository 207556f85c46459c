package com.lad.core.tools;

/**
 * States of the tool-calling exchange driven by {@link ToolCallBridge}.
 */
public enum BridgeState {
    /** Only the activation call may run; other calls get a corrective reply. */
    AWAITING_PREFLIGHT,
    /** Tool calls run under the per-call timeout and the result ceilings. */
    ACTIVE,
    /** Call ceiling reached; further requests are refused and a final answer is demanded. */
    EXHAUSTED,
    COMPLETED,
    TIMED_OUT,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == TIMED_OUT || this == FAILED;
    }
}
