package com.lhcz.txn2db.core;

public enum PipelineState {
    INITIALIZING,
    STREAMING,
    BACKFILLING,
    FLUSHING,
    DRAINING,
    STOPPED
}
